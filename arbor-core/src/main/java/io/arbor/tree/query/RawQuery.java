package io.arbor.tree.query;

import java.util.List;

/**
 * A structural query compiled by a {@link QueryEngine}.
 *
 * <p>Holds the patterns' capture and string tables and the uninterpreted predicate steps of every
 * pattern. Implementations are immutable.
 */
public interface RawQuery {
  /** @return the number of patterns */
  int patternCount();

  /** @return the number of distinct capture names */
  int captureCount();

  /**
   * @param captureId a capture id in {@code [0, captureCount())}
   * @return the capture name, without the leading {@code @}
   */
  String captureNameForId(int captureId);

  /** @return the number of string literals used by predicates */
  int stringCount();

  /**
   * @param stringId a string id in {@code [0, stringCount())}
   * @return the literal value
   */
  String stringValueForId(int stringId);

  /**
   * Returns the predicate steps of one pattern in declaration order.
   *
   * @param patternIndex the pattern index
   * @return the steps, possibly empty
   */
  List<PredicateStep> predicateSteps(int patternIndex);

  /**
   * @param patternIndex the pattern index
   * @return the byte offset of the pattern in the query source
   */
  int startByteForPattern(int patternIndex);
}
