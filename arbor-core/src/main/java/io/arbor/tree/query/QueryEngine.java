package io.arbor.tree.query;

import io.arbor.tree.Language;
import io.arbor.tree.Node;

/** The structural pattern matcher. Finds candidate matches; predicates are not evaluated here. */
public interface QueryEngine {
  /**
   * Compiles a pattern source.
   *
   * @param language the language whose node kinds and fields the patterns refer to
   * @param source the pattern source
   * @return the compiled query
   * @throws QueryEngineException if the source is malformed or names unknown kinds, fields or
   *     captures
   */
  RawQuery compile(Language language, String source) throws QueryEngineException;

  /**
   * Starts matching a query under a node.
   *
   * @param query a query compiled by this engine
   * @param node the node to search under
   * @param range restricts the matches to this range
   * @return a fresh match source
   */
  MatchSource execute(RawQuery query, Node node, QueryRange range);
}
