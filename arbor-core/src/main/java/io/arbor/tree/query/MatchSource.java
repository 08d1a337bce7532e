package io.arbor.tree.query;

/**
 * Pull-based stream of raw structural matches from one query execution.
 *
 * <p>A source is consumed either match by match or capture by capture, not both. Once a method
 * returns {@code null} the source is exhausted.
 */
public interface MatchSource {
  /** @return the next match or {@code null} when there are no more */
  RawMatch nextMatch();

  /** @return the next capture, in node order, or {@code null} when there are no more */
  CaptureEvent nextCapture();
}
