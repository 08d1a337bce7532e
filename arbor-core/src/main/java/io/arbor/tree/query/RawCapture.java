package io.arbor.tree.query;

import io.arbor.tree.Node;
import java.util.Objects;

/** A node captured by a structural match, tagged with its capture id. */
public final class RawCapture {
  private final int index;
  private final Node node;

  public RawCapture(int index, Node node) {
    this.index = index;
    this.node = Objects.requireNonNull(node, "node");
  }

  /** @return the capture id, see {@link RawQuery#captureNameForId(int)} */
  public int index() {
    return index;
  }

  public Node node() {
    return node;
  }

  @Override
  public String toString() {
    return "RawCapture{" + index + ", " + node + "}";
  }
}
