package io.arbor.api;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import io.arbor.impl.PropertySheetCompiler;
import io.arbor.tree.Language;
import io.arbor.tree.Tree;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.Map;

/**
 * A compiled property sheet: a state machine that assigns a property set to every node visited by
 * a {@link PropertyCursor}.
 *
 * <p>A sheet is compiled once from a JSON description against a {@link Language}. It is immutable
 * afterwards and may be shared by any number of cursors running on different threads.
 *
 * <pre>{@code
 * PropertySheet<Map<String, String>> sheet = PropertySheet.compile(language, json);
 * PropertyCursor<Map<String, String>> cursor = sheet.walk(tree, source);
 * if (cursor.gotoFirstChild()) {
 *   String highlight = cursor.nodeProperties().get("highlight");
 * }
 * }</pre>
 *
 * @param <P> the property set type
 */
public interface PropertySheet<P> {

  /**
   * Compiles a sheet whose property sets are read-only string maps.
   *
   * @param language the grammar the sheet refers to
   * @param json the sheet description
   * @return the compiled sheet
   * @throws PropertySheetException if the description is malformed or contains an invalid regex
   */
  static PropertySheet<Map<String, String>> compile(Language language, String json)
      throws PropertySheetException {
    PropertySheet<Map<String, String>> sheet =
        compile(
            language,
            json,
            TypeToken.getParameterized(Map.class, String.class, String.class).getType());
    return sheet.<Map<String, String>, RuntimeException>map(
        set -> set != null ? Collections.unmodifiableMap(set) : null);
  }

  /**
   * Compiles a sheet whose property sets are deserialized into {@code propertySetType}.
   *
   * @param language the grammar the sheet refers to
   * @param json the sheet description
   * @param propertySetType the property set class
   * @param <P> the property set type
   * @return the compiled sheet
   * @throws PropertySheetException if the description is malformed or contains an invalid regex
   */
  static <P> PropertySheet<P> compile(Language language, String json, Class<P> propertySetType)
      throws PropertySheetException {
    return compile(language, json, (Type) propertySetType);
  }

  /**
   * Compiles a sheet whose property sets are deserialized into a generic type.
   *
   * @param language the grammar the sheet refers to
   * @param json the sheet description
   * @param propertySetType the property set type, e.g. from a {@link TypeToken}
   * @param <P> the property set type
   * @return the compiled sheet
   * @throws PropertySheetException if the description is malformed or contains an invalid regex
   */
  static <P> PropertySheet<P> compile(Language language, String json, Type propertySetType)
      throws PropertySheetException {
    return PropertySheetCompiler.compile(language, json, propertySetType, new Gson());
  }

  /**
   * Compiles a sheet using a caller-configured {@link Gson}, e.g. one with type adapters for the
   * property set type.
   *
   * @param language the grammar the sheet refers to
   * @param json the sheet description
   * @param propertySetType the property set type
   * @param gson the deserializer
   * @param <P> the property set type
   * @return the compiled sheet
   * @throws PropertySheetException if the description is malformed or contains an invalid regex
   */
  static <P> PropertySheet<P> compile(
      Language language, String json, Type propertySetType, Gson gson)
      throws PropertySheetException {
    return PropertySheetCompiler.compile(language, json, propertySetType, gson);
  }

  /**
   * Starts a traversal of {@code tree} at its root.
   *
   * @param tree the tree to walk
   * @param source the source text the tree was parsed from
   * @return a new cursor positioned on the root
   */
  PropertyCursor<P> walk(Tree tree, byte[] source);

  /** @return the number of states, at least 1 */
  int stateCount();

  /** @return the number of property sets */
  int propertySetCount();

  /**
   * @param propertySetId index of a property set
   * @return the shared property set
   */
  P propertySet(int propertySetId);

  /** @return the number of distinct text patterns compiled for this sheet */
  int regexCount();

  /**
   * @param regexIndex index of a compiled pattern
   * @return the pattern source
   */
  String regexPattern(int regexIndex);

  /**
   * Converts every property set, keeping the compiled state machine.
   *
   * @param mapper the conversion
   * @param <T> the new property set type
   * @param <E> the exception the conversion may throw
   * @return a new sheet sharing this sheet's states and patterns
   * @throws E the first failure of {@code mapper}
   */
  <T, E extends Exception> PropertySheet<T> map(PropertySetMapper<? super P, ? extends T, E> mapper)
      throws E;

  /**
   * Conversion applied by {@link #map(PropertySetMapper)}.
   *
   * @param <P> the source type
   * @param <T> the target type
   * @param <E> the failure type
   */
  @FunctionalInterface
  interface PropertySetMapper<P, T, E extends Exception> {
    T apply(P propertySet) throws E;
  }
}
