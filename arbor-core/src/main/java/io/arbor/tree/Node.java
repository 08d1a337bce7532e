package io.arbor.tree;

/**
 * A node of a parsed syntax tree.
 *
 * <p>Nodes are lightweight handles owned by their tree; implementations must not copy source text.
 */
public interface Node {
  /**
   * Returns the numeric kind of this node.
   *
   * @return the kind id, see {@link Language#nodeKindForId(int)}
   */
  int kindId();

  /**
   * Returns the name of this node's kind.
   *
   * @return the kind name
   */
  String kind();

  /**
   * Tells whether this node is named.
   *
   * @return {@code true} for named nodes, {@code false} for anonymous tokens
   */
  boolean isNamed();

  /** @return the offset of the first byte of this node in the source */
  int startByte();

  /** @return the offset just past the last byte of this node in the source */
  int endByte();

  /** @return the position of the first byte of this node */
  Point startPosition();

  /** @return the position just past the last byte of this node */
  Point endPosition();

  /**
   * Creates a traversal cursor rooted at this node.
   *
   * @return a new cursor positioned on this node
   */
  TreeCursor walk();
}
