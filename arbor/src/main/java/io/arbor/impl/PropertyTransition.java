package io.arbor.impl;

/**
 * A candidate move of the property state machine. Each constraint equal to {@link #NONE} is
 * absent and always satisfied.
 */
final class PropertyTransition {
  static final int NONE = -1;

  final int stateId;
  final int childIndex;
  final int regexIndex;
  final int kindId;

  PropertyTransition(int stateId, int childIndex, int regexIndex, int kindId) {
    this.stateId = stateId;
    this.childIndex = childIndex;
    this.regexIndex = regexIndex;
    this.kindId = kindId;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("-> ").append(stateId);
    if (kindId != NONE) sb.append(" kind=").append(kindId);
    if (childIndex != NONE) sb.append(" index=").append(childIndex);
    if (regexIndex != NONE) sb.append(" regex=").append(regexIndex);
    return sb.toString();
  }
}
