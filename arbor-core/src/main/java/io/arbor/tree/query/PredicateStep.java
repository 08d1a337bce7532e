package io.arbor.tree.query;

/**
 * One step of a pattern's predicate stream.
 *
 * <p>A pattern's predicates are flattened into a sequence of steps. Each clause is a run of
 * {@link Type#STRING} and {@link Type#CAPTURE} steps terminated by a {@link Type#DONE} step.
 */
public final class PredicateStep {
  public enum Type {
    /** End of a clause. */
    DONE,
    /** Reference to a capture, {@link #valueId()} is a capture id. */
    CAPTURE,
    /** A literal, {@link #valueId()} is an index into the query's string table. */
    STRING
  }

  private static final PredicateStep DONE_STEP = new PredicateStep(Type.DONE, 0);

  private final Type type;
  private final int valueId;

  private PredicateStep(Type type, int valueId) {
    this.type = type;
    this.valueId = valueId;
  }

  public static PredicateStep done() {
    return DONE_STEP;
  }

  public static PredicateStep capture(int captureId) {
    return new PredicateStep(Type.CAPTURE, captureId);
  }

  public static PredicateStep string(int stringId) {
    return new PredicateStep(Type.STRING, stringId);
  }

  public Type type() {
    return type;
  }

  public int valueId() {
    return valueId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PredicateStep)) return false;
    PredicateStep other = (PredicateStep) o;
    return type == other.type && valueId == other.valueId;
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + valueId;
  }

  @Override
  public String toString() {
    return type == Type.DONE ? "DONE" : type + "(" + valueId + ")";
  }
}
