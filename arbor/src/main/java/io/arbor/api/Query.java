package io.arbor.api;

import io.arbor.impl.QueryPredicateCompiler;
import io.arbor.tree.Language;
import io.arbor.tree.query.QueryEngine;
import io.arbor.tree.query.RawQuery;
import java.util.List;

/**
 * A structural query together with its compiled predicates.
 *
 * <p>Every pattern has a list of {@link QueryPredicate}s that a match must satisfy, and a list of
 * {@link QueryProperty} pairs declared with {@code set!}. Queries are immutable and may be shared
 * across threads.
 */
public interface Query {

  /**
   * Compiles the predicates of a query the engine already compiled.
   *
   * @param rawQuery the structural query
   * @return the compiled query
   * @throws QueryException if a predicate clause is malformed
   */
  static Query compile(RawQuery rawQuery) throws QueryException {
    return QueryPredicateCompiler.compile(rawQuery);
  }

  /**
   * Compiles a pattern source with {@code engine}, then its predicates.
   *
   * @param engine the structural query engine
   * @param language the language of the trees the query will run on
   * @param source the pattern source
   * @return the compiled query
   * @throws QueryException if the engine rejects the source or a predicate clause is malformed
   */
  static Query compile(QueryEngine engine, Language language, String source)
      throws QueryException {
    return QueryPredicateCompiler.compile(engine, language, source);
  }

  /** @return the structural query to hand to the engine */
  RawQuery rawQuery();

  /** @return the number of patterns */
  int patternCount();

  /** @return the capture names, indexed by capture id */
  List<String> captureNames();

  /**
   * @param patternIndex the pattern index
   * @return the filtering predicates of the pattern, in declaration order
   */
  List<QueryPredicate> predicates(int patternIndex);

  /**
   * @param patternIndex the pattern index
   * @return the {@code set!} properties of the pattern, in declaration order
   */
  List<QueryProperty> patternProperties(int patternIndex);

  /**
   * @param patternIndex the pattern index
   * @return the byte offset of the pattern in the query source
   */
  int startByteForPattern(int patternIndex);
}
