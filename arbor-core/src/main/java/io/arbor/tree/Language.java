package io.arbor.tree;

/**
 * Grammar metadata for the trees produced by one language.
 *
 * <p>Node kinds are numbered from {@code 0} to {@link #nodeKindCount()} - 1. A grammar may use the
 * same name for a named and an anonymous kind, so a kind is identified by its name together with
 * its {@linkplain #nodeKindIsNamed(int) named} flag. Field ids are numbered from {@code 1};
 * {@link #NO_FIELD} means "no field".
 */
public interface Language {
  /** Field id reported for nodes that are not attached to their parent through a field. */
  int NO_FIELD = 0;

  /**
   * Returns the number of distinct node kinds.
   *
   * @return the node kind count
   */
  int nodeKindCount();

  /**
   * Returns the name of a node kind.
   *
   * @param kindId the kind id
   * @return the kind name
   */
  String nodeKindForId(int kindId);

  /**
   * Tells whether a node kind is named, as opposed to an anonymous token.
   *
   * @param kindId the kind id
   * @return {@code true} for named kinds
   */
  boolean nodeKindIsNamed(int kindId);

  /**
   * Returns the number of fields. Valid field ids are {@code 1..fieldCount()}.
   *
   * @return the field count
   */
  int fieldCount();

  /**
   * Returns the name of a field.
   *
   * @param fieldId the field id
   * @return the field name or {@code null} for an unknown id
   */
  String fieldNameForId(int fieldId);

  /**
   * Looks up a field by name.
   *
   * @param fieldName the field name
   * @return the field id or {@link #NO_FIELD} when the language has no such field
   */
  int fieldIdForName(String fieldName);
}
