package io.arbor.api;

import io.arbor.tree.Node;
import io.arbor.tree.Tree;

/**
 * Walks a tree while tracking the {@link PropertySheet} state of every node on the current path.
 *
 * <p>The cursor keeps one state per level and recomputes the state of a node each time it moves
 * onto it. Cursors are cheap, single-threaded and meant to be discarded after one traversal.
 *
 * @param <P> the property set type
 */
public interface PropertyCursor<P> {

  /**
   * Creates a cursor positioned on the root of {@code tree}.
   *
   * @param tree the tree to walk
   * @param sheet the sheet to evaluate
   * @param source the source text of {@code tree}
   * @param <P> the property set type
   * @return a new cursor
   */
  static <P> PropertyCursor<P> create(Tree tree, PropertySheet<P> sheet, byte[] source) {
    return sheet.walk(tree, source);
  }

  /** @return the current node */
  Node node();

  /**
   * Returns the property set of the current node. The instance is shared with the sheet and must
   * not be modified.
   *
   * @return the property set
   */
  P nodeProperties();

  /** @return {@code true} if the cursor moved to the first child of the current node */
  boolean gotoFirstChild();

  /** @return {@code true} if the cursor moved to the next sibling of the current node */
  boolean gotoNextSibling();

  /** @return {@code true} if the cursor moved to the parent of the current node */
  boolean gotoParent();

  /** @return the field id of the current node, or {@link io.arbor.tree.Language#NO_FIELD} */
  int fieldId();

  /** @return the field name of the current node, or {@code null} */
  String fieldName();

  /** @return the state id assigned to the current node */
  int stateId();

  /** @return the depth of the current node, {@code 0} for the root */
  int depth();

  /** @return the source text this cursor reads from */
  byte[] source();
}
