package io.arbor.api;

import io.arbor.tree.Node;

/** A node captured by a filtered match. */
public final class QueryCapture {
  private final int patternIndex;
  private final int index;
  private final Node node;

  public QueryCapture(int patternIndex, int index, Node node) {
    this.patternIndex = patternIndex;
    this.index = index;
    this.node = node;
  }

  /** @return the pattern of the match that produced this capture */
  public int patternIndex() {
    return patternIndex;
  }

  /** @return the capture id, an index into {@link Query#captureNames()} */
  public int index() {
    return index;
  }

  public Node node() {
    return node;
  }

  @Override
  public String toString() {
    return "QueryCapture{pattern=" + patternIndex + ", index=" + index + ", node=" + node + "}";
  }
}
