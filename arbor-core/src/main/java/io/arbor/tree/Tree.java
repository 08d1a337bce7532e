package io.arbor.tree;

/** A parsed syntax tree. */
public interface Tree {
  /** @return the root node */
  Node rootNode();

  /** @return the language the tree was parsed with */
  Language language();

  /**
   * Creates a cursor positioned on the root node.
   *
   * @return a new cursor
   */
  default TreeCursor walk() {
    return rootNode().walk();
  }
}
