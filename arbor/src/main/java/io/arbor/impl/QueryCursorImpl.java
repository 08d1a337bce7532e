package io.arbor.impl;

import io.arbor.api.NodeTextProvider;
import io.arbor.api.Query;
import io.arbor.api.QueryCaptures;
import io.arbor.api.QueryCursor;
import io.arbor.api.QueryMatches;
import io.arbor.tree.Node;
import io.arbor.tree.Point;
import io.arbor.tree.query.MatchSource;
import io.arbor.tree.query.QueryEngine;
import io.arbor.tree.query.QueryRange;
import java.util.Objects;

/** Query cursor that starts one engine execution per call and filters it lazily. */
public final class QueryCursorImpl implements QueryCursor {
  private final QueryEngine engine;
  private QueryRange range = QueryRange.ALL;

  public QueryCursorImpl(QueryEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  @Override
  public QueryCursor setByteRange(int start, int end) {
    range = range.withByteRange(start, end);
    return this;
  }

  @Override
  public QueryCursor setPointRange(Point start, Point end) {
    range = range.withPointRange(start, end);
    return this;
  }

  @Override
  public QueryMatches matches(Query query, Node node, NodeTextProvider text) {
    return new QueryMatchesImpl(execute(query, node), new MatchConditions(query, text));
  }

  @Override
  public QueryCaptures captures(Query query, Node node, NodeTextProvider text) {
    return new QueryCapturesImpl(execute(query, node), new MatchConditions(query, text));
  }

  private MatchSource execute(Query query, Node node) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(node, "node");
    return engine.execute(query.rawQuery(), node, range);
  }
}
