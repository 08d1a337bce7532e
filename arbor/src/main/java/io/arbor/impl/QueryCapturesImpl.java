package io.arbor.impl;

import io.arbor.api.QueryCapture;
import io.arbor.api.QueryCaptures;
import io.arbor.tree.query.CaptureEvent;
import io.arbor.tree.query.MatchSource;
import io.arbor.tree.query.RawCapture;
import java.util.NoSuchElementException;

/** Pulls raw captures, re-checking the owning match's predicates for each one. */
final class QueryCapturesImpl implements QueryCaptures {
  private final MatchSource source;
  private final MatchConditions conditions;
  private QueryCapture next;
  private boolean exhausted;

  QueryCapturesImpl(MatchSource source, MatchConditions conditions) {
    this.source = source;
    this.conditions = conditions;
  }

  @Override
  public boolean hasNext() {
    while (next == null && !exhausted) {
      CaptureEvent event = source.nextCapture();
      if (event == null) {
        exhausted = true;
      } else if (conditions.satisfies(event.match())) {
        RawCapture capture = event.capture();
        next = new QueryCapture(event.match().patternIndex(), capture.index(), capture.node());
      }
    }
    return next != null;
  }

  @Override
  public QueryCapture next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    QueryCapture capture = next;
    next = null;
    return capture;
  }
}
