package io.arbor.api;

import io.arbor.impl.QueryCursorImpl;
import io.arbor.tree.Node;
import io.arbor.tree.Point;
import io.arbor.tree.query.QueryEngine;

/**
 * Runs queries through a {@link QueryEngine} and filters the raw results with the queries'
 * predicates.
 *
 * <p>Each call to {@link #matches} or {@link #captures} starts a fresh engine execution. The
 * returned iterators evaluate predicates lazily as they are advanced; predicate evaluation never
 * throws, a match that fails a predicate is skipped.
 *
 * <pre>{@code
 * QueryCursor cursor = QueryCursor.create(engine);
 * cursor.matches(query, tree.rootNode(), NodeTextProvider.of(source))
 *     .forEachRemaining(m -> System.out.println(m.patternIndex()));
 * }</pre>
 */
public interface QueryCursor {

  /**
   * @param engine the structural query engine
   * @return a new cursor without range restrictions
   */
  static QueryCursor create(QueryEngine engine) {
    return new QueryCursorImpl(engine);
  }

  /**
   * Restricts subsequent executions to nodes intersecting a byte range.
   *
   * @param start the first byte
   * @param end the byte past the last one
   * @return this cursor
   */
  QueryCursor setByteRange(int start, int end);

  /**
   * Restricts subsequent executions to nodes intersecting a point range.
   *
   * @param start the first position
   * @param end the position past the last one
   * @return this cursor
   */
  QueryCursor setPointRange(Point start, Point end);

  /**
   * Executes {@code query} under {@code node} and yields the matches whose predicates hold.
   *
   * @param query the query
   * @param node the node to search under
   * @param text supplies node text for predicates
   * @return the filtered matches
   */
  QueryMatches matches(Query query, Node node, NodeTextProvider text);

  /**
   * Executes {@code query} under {@code node} and yields the individual captures of matches whose
   * predicates hold. Predicates are evaluated again for every capture.
   *
   * @param query the query
   * @param node the node to search under
   * @param text supplies node text for predicates
   * @return the filtered captures
   */
  QueryCaptures captures(Query query, Node node, NodeTextProvider text);
}
