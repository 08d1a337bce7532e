package io.arbor.tree;

/**
 * A stateful depth-first walker over a tree.
 *
 * <p>A cursor never moves above the node it was created for. Each {@code goto} method returns
 * {@code false} and leaves the cursor where it was when the move is impossible.
 */
public interface TreeCursor {
  /** @return the node the cursor is positioned on */
  Node node();

  /**
   * Returns the field through which the current node is attached to its parent.
   *
   * @return the field id or {@link Language#NO_FIELD}
   */
  int fieldId();

  /** @return {@code true} if the cursor moved to the first child of the current node */
  boolean gotoFirstChild();

  /** @return {@code true} if the cursor moved to the next sibling of the current node */
  boolean gotoNextSibling();

  /** @return {@code true} if the cursor moved to the parent of the current node */
  boolean gotoParent();
}
