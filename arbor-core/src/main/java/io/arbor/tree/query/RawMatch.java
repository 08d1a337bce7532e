package io.arbor.tree.query;

import java.util.List;

/** An unfiltered match of one pattern: the pattern index and the nodes it captured. */
public final class RawMatch {
  private final int patternIndex;
  private final List<RawCapture> captures;

  public RawMatch(int patternIndex, List<RawCapture> captures) {
    this.patternIndex = patternIndex;
    this.captures = List.copyOf(captures);
  }

  public int patternIndex() {
    return patternIndex;
  }

  /** @return the captures in the order the engine reported them */
  public List<RawCapture> captures() {
    return captures;
  }

  @Override
  public String toString() {
    return "RawMatch{pattern=" + patternIndex + ", captures=" + captures + "}";
  }
}
