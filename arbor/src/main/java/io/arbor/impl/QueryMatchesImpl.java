package io.arbor.impl;

import io.arbor.api.QueryCapture;
import io.arbor.api.QueryMatch;
import io.arbor.api.QueryMatches;
import io.arbor.tree.query.MatchSource;
import io.arbor.tree.query.RawCapture;
import io.arbor.tree.query.RawMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/** Pulls raw matches until one satisfies its pattern's predicates. */
final class QueryMatchesImpl implements QueryMatches {
  private final MatchSource source;
  private final MatchConditions conditions;
  private QueryMatch next;
  private boolean exhausted;

  QueryMatchesImpl(MatchSource source, MatchConditions conditions) {
    this.source = source;
    this.conditions = conditions;
  }

  @Override
  public boolean hasNext() {
    while (next == null && !exhausted) {
      RawMatch match = source.nextMatch();
      if (match == null) {
        exhausted = true;
      } else if (conditions.satisfies(match)) {
        next = toQueryMatch(match);
      }
    }
    return next != null;
  }

  @Override
  public QueryMatch next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    QueryMatch match = next;
    next = null;
    return match;
  }

  private static QueryMatch toQueryMatch(RawMatch match) {
    List<QueryCapture> captures = new ArrayList<>(match.captures().size());
    for (RawCapture capture : match.captures()) {
      captures.add(new QueryCapture(match.patternIndex(), capture.index(), capture.node()));
    }
    return new QueryMatch(match.patternIndex(), captures);
  }
}
