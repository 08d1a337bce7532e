package io.arbor.impl;

import io.arbor.api.PropertyCursor;
import io.arbor.internal_api.Utf8Decoder;
import io.arbor.tree.Language;
import io.arbor.tree.Node;
import io.arbor.tree.Tree;
import io.arbor.tree.TreeCursor;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Property cursor over a {@link TreeCursor}.
 *
 * <p>{@code stateStack} holds the seed state {@code 0} followed by one resolved state per level of
 * the current path; {@code childIndexStack} holds the index of each node on the path among its
 * siblings. Both are pushed and popped together with the underlying cursor's moves.
 */
final class PropertyCursorImpl<P> implements PropertyCursor<P> {
  private static final Logger log = LoggerFactory.getLogger(PropertyCursorImpl.class);

  private static final int DEFAULT_STATE = 0;

  private final TreeCursor cursor;
  private final Language language;
  private final PropertySheetImpl<P> sheet;
  private final byte[] source;
  private final IntArrayList stateStack = new IntArrayList();
  private final IntArrayList childIndexStack = new IntArrayList();
  private final Utf8Decoder decoder = new Utf8Decoder();
  private CharSequence nodeText;
  private boolean nodeTextDecoded;

  PropertyCursorImpl(Tree tree, PropertySheetImpl<P> sheet, byte[] source) {
    this.cursor = tree.walk();
    this.language = tree.language();
    this.sheet = sheet;
    this.source = source;
    childIndexStack.push(0);
    stateStack.push(DEFAULT_STATE);
    stateStack.push(nextState(0));
  }

  @Override
  public Node node() {
    return cursor.node();
  }

  @Override
  public P nodeProperties() {
    return sheet.propertySet(currentState().propertySetId);
  }

  @Override
  public boolean gotoFirstChild() {
    if (!cursor.gotoFirstChild()) {
      return false;
    }
    int nextStateId = nextState(0);
    stateStack.push(nextStateId);
    childIndexStack.push(0);
    trace("first child");
    return true;
  }

  @Override
  public boolean gotoNextSibling() {
    if (!cursor.gotoNextSibling()) {
      return false;
    }
    int childIndex = childIndexStack.popInt() + 1;
    stateStack.popInt();
    int nextStateId = nextState(childIndex);
    stateStack.push(nextStateId);
    childIndexStack.push(childIndex);
    trace("next sibling");
    return true;
  }

  @Override
  public boolean gotoParent() {
    if (!cursor.gotoParent()) {
      return false;
    }
    stateStack.popInt();
    childIndexStack.popInt();
    trace("parent");
    return true;
  }

  @Override
  public int fieldId() {
    return cursor.fieldId();
  }

  @Override
  public String fieldName() {
    int fieldId = cursor.fieldId();
    return fieldId != Language.NO_FIELD ? language.fieldNameForId(fieldId) : null;
  }

  @Override
  public int stateId() {
    return stateStack.topInt();
  }

  @Override
  public int depth() {
    return childIndexStack.size() - 1;
  }

  @Override
  public byte[] source() {
    return source;
  }

  /**
   * Resolves the state of the node under the cursor from the state on top of the stack, falling
   * back to the transitions of state 0, then to the top state's default.
   */
  private int nextState(int nodeChildIndex) {
    PropertyState currentState = currentState();
    Node node = cursor.node();
    int fieldId = cursor.fieldId();
    nodeText = null;
    nodeTextDecoded = false;

    int stateId = firstMatch(currentState, node, fieldId, nodeChildIndex);
    if (stateId == PropertyTransition.NONE) {
      stateId = firstMatch(sheet.state(DEFAULT_STATE), node, fieldId, nodeChildIndex);
    }
    return stateId != PropertyTransition.NONE ? stateId : currentState.defaultNextStateId;
  }

  private int firstMatch(PropertyState state, Node node, int fieldId, int nodeChildIndex) {
    int kindId = node.kindId();
    for (PropertyTransition transition : state.candidates(fieldId, kindId)) {
      if (transition.kindId != PropertyTransition.NONE && transition.kindId != kindId) {
        continue;
      }
      if (transition.regexIndex != PropertyTransition.NONE) {
        CharSequence text = nodeText(node);
        if (text == null || !sheet.regex(transition.regexIndex).matcher(text).find()) {
          continue;
        }
      }
      if (transition.childIndex != PropertyTransition.NONE
          && transition.childIndex != nodeChildIndex) {
        continue;
      }
      return transition.stateId;
    }
    return PropertyTransition.NONE;
  }

  /** Decodes the node's text at most once per resolution; {@code null} if it is not UTF-8. */
  private CharSequence nodeText(Node node) {
    if (!nodeTextDecoded) {
      nodeText = decoder.decode(source, node.startByte(), node.endByte());
      nodeTextDecoded = true;
    }
    return nodeText;
  }

  /**
   * The state whose transitions are consulted next: the one on top of the stack. While resolving
   * a node this is its parent's state, afterwards it is the node's own state.
   */
  private PropertyState currentState() {
    return sheet.state(stateStack.topInt());
  }

  private void trace(String move) {
    if (log.isTraceEnabled()) {
      log.trace(
          "{} -> {} (depth {}, child {}, state {})",
          move,
          cursor.node().kind(),
          depth(),
          childIndexStack.topInt(),
          stateStack.topInt());
    }
  }
}
