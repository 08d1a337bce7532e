package io.arbor.api;

import io.arbor.tree.Node;
import java.util.ArrayList;
import java.util.List;

/** A match whose pattern predicates all hold. */
public final class QueryMatch {
  private final int patternIndex;
  private final List<QueryCapture> captures;

  public QueryMatch(int patternIndex, List<QueryCapture> captures) {
    this.patternIndex = patternIndex;
    this.captures = List.copyOf(captures);
  }

  public int patternIndex() {
    return patternIndex;
  }

  public List<QueryCapture> captures() {
    return captures;
  }

  /**
   * @param captureIndex a capture id
   * @return the nodes captured under that id, in capture order
   */
  public List<Node> nodesForCaptureIndex(int captureIndex) {
    List<Node> nodes = new ArrayList<>();
    for (QueryCapture capture : captures) {
      if (capture.index() == captureIndex) {
        nodes.add(capture.node());
      }
    }
    return nodes;
  }

  @Override
  public String toString() {
    return "QueryMatch{pattern=" + patternIndex + ", captures=" + captures + "}";
  }
}
