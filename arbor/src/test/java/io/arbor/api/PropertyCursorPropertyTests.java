package io.arbor.api;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.arbor.test.TestLanguage;
import io.arbor.test.TestNode;
import io.arbor.test.TestTree;
import io.arbor.tree.Node;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/** Invariants of compiled sheets and their cursors over randomly generated sheets. */
@PropertyDefaults(tries = 200)
class PropertyCursorPropertyTests {
  private static final TestLanguage LANGUAGE = TestLanguage.calls();
  private static final String SOURCE = "f(g(Xy))";
  private static final List<String> PATTERNS = List.of("^[A-Z]", "g", "\\(", "y$", "[a-z]+");

  @Property
  void reportedStatesAreAlwaysDefined(
      @ForAll("sheets") String json, @ForAll List<@IntRange(min = 0, max = 2) Integer> moves)
      throws Exception {
    PropertySheet<Map<String, String>> sheet = PropertySheet.compile(LANGUAGE, json);
    PropertyCursor<Map<String, String>> cursor = sheet.walk(tree(), bytes());

    assertDefined(sheet, cursor);
    for (int move : moves) {
      move(cursor, move);
      assertDefined(sheet, cursor);
      assertNotNull(cursor.nodeProperties());
    }
  }

  @Property
  void descendThenAscendRestoresTheCursor(
      @ForAll("sheets") String json, @ForAll List<@IntRange(min = 0, max = 2) Integer> moves)
      throws Exception {
    PropertyCursor<Map<String, String>> cursor =
        PropertySheet.compile(LANGUAGE, json).walk(tree(), bytes());

    for (int move : moves) {
      move(cursor, move);
      Node node = cursor.node();
      int state = cursor.stateId();
      int depth = cursor.depth();
      if (cursor.gotoFirstChild()) {
        assertEquals(depth + 1, cursor.depth());
        assertTrue(cursor.gotoParent());
      }
      assertSame(node, cursor.node());
      assertEquals(state, cursor.stateId());
      assertEquals(depth, cursor.depth());
    }
  }

  @Property
  void walkingTwiceYieldsTheSameStates(
      @ForAll("sheets") String json, @ForAll List<@IntRange(min = 0, max = 2) Integer> moves)
      throws Exception {
    PropertySheet<Map<String, String>> sheet = PropertySheet.compile(LANGUAGE, json);
    TestTree tree = tree();

    assertEquals(trace(sheet, tree, moves), trace(sheet, tree, moves));
  }

  @Property
  void eachDistinctRegexIsCompiledOnce(
      @ForAll @Size(max = 12) List<@From("patterns") String> texts) throws Exception {
    JsonArray transitions = new JsonArray();
    for (String text : texts) {
      JsonObject transition = new JsonObject();
      transition.addProperty("text", text);
      transition.addProperty("state_id", 0);
      transitions.add(transition);
    }

    PropertySheet<Map<String, String>> sheet =
        PropertySheet.compile(LANGUAGE, sheetJson(List.of(state(0, 0, transitions))));

    assertEquals(new HashSet<>(texts).size(), sheet.regexCount());
    for (int i = 0; i < sheet.regexCount(); i++) {
      assertTrue(texts.contains(sheet.regexPattern(i)));
    }
  }

  @Provide
  Arbitrary<String> patterns() {
    return Arbitraries.of(PATTERNS);
  }

  @Provide
  Arbitrary<String> sheets() {
    return Arbitraries.integers()
        .between(1, 5)
        .flatMap(
            stateCount ->
                stateArbitrary(stateCount)
                    .list()
                    .ofSize(stateCount)
                    .map(PropertyCursorPropertyTests::sheetJson));
  }

  private static Arbitrary<JsonObject> stateArbitrary(int stateCount) {
    Arbitrary<Integer> stateIds = Arbitraries.integers().between(0, stateCount - 1);
    return Combinators.combine(
            stateIds, stateIds, transitionArbitrary(stateIds).list().ofMaxSize(4))
        .as(
            (propertySetId, defaultNextStateId, transitions) -> {
              JsonArray array = new JsonArray();
              transitions.forEach(array::add);
              return state(propertySetId, defaultNextStateId, array);
            });
  }

  private static Arbitrary<JsonObject> transitionArbitrary(Arbitrary<Integer> stateIds) {
    Arbitrary<String> kinds = Arbitraries.of("", "program", "identifier", "call", "arguments", "(");
    Arbitrary<String> fields = Arbitraries.of("", "function", "arguments", "name");
    Arbitrary<Integer> indexes = Arbitraries.integers().between(-1, 3);
    Arbitrary<String> texts = Arbitraries.of(PATTERNS).injectNull(0.6);
    return Combinators.combine(kinds, Arbitraries.of(true, false), fields, indexes, texts, stateIds)
        .as(
            (kind, named, field, index, text, stateId) -> {
              JsonObject transition = new JsonObject();
              if (!kind.isEmpty()) {
                transition.addProperty("type", kind);
                transition.addProperty("named", named);
              }
              if (!field.isEmpty()) {
                transition.addProperty("field", field);
              }
              if (index >= 0) {
                transition.addProperty("index", index);
              }
              if (text != null) {
                transition.addProperty("text", text);
              }
              transition.addProperty("state_id", stateId);
              return transition;
            });
  }

  private static JsonObject state(
      int propertySetId, int defaultNextStateId, JsonArray transitions) {
    JsonObject state = new JsonObject();
    state.addProperty("property_set_id", propertySetId);
    state.addProperty("default_next_state_id", defaultNextStateId);
    state.add("transitions", transitions);
    return state;
  }

  private static String sheetJson(List<JsonObject> states) {
    JsonArray stateArray = new JsonArray();
    JsonArray propertySets = new JsonArray();
    for (int i = 0; i < states.size(); i++) {
      stateArray.add(states.get(i));
      JsonObject set = new JsonObject();
      set.addProperty("state", Integer.toString(i));
      propertySets.add(set);
    }
    JsonObject sheet = new JsonObject();
    sheet.add("states", stateArray);
    sheet.add("property_sets", propertySets);
    return sheet.toString();
  }

  /** {@code f(g(Xy))} */
  private static TestTree tree() {
    int function = LANGUAGE.fieldIdForName("function");
    int arguments = LANGUAGE.fieldIdForName("arguments");
    TestNode inner =
        LANGUAGE
            .node("call", 2, 7)
            .child(function, LANGUAGE.node("identifier", 2, 3))
            .child(
                arguments,
                LANGUAGE
                    .node("arguments", 3, 7)
                    .child(LANGUAGE.node("(", false, 3, 4))
                    .child(LANGUAGE.node("identifier", 4, 6))
                    .child(LANGUAGE.node(")", false, 6, 7)));
    TestNode outer =
        LANGUAGE
            .node("call", 0, 8)
            .child(function, LANGUAGE.node("identifier", 0, 1))
            .child(
                arguments,
                LANGUAGE
                    .node("arguments", 1, 8)
                    .child(LANGUAGE.node("(", false, 1, 2))
                    .child(inner)
                    .child(LANGUAGE.node(")", false, 7, 8)));
    return new TestTree(LANGUAGE, LANGUAGE.node("program", 0, 8).child(outer));
  }

  private static byte[] bytes() {
    return SOURCE.getBytes(StandardCharsets.UTF_8);
  }

  private static IntArrayList trace(
      PropertySheet<Map<String, String>> sheet, TestTree tree, List<Integer> moves) {
    PropertyCursor<Map<String, String>> cursor = sheet.walk(tree, bytes());
    IntArrayList states = new IntArrayList();
    states.add(cursor.stateId());
    for (int move : moves) {
      move(cursor, move);
      states.add(cursor.stateId());
    }
    return states;
  }

  private static void move(PropertyCursor<?> cursor, int move) {
    switch (move) {
      case 0 -> cursor.gotoFirstChild();
      case 1 -> cursor.gotoNextSibling();
      default -> cursor.gotoParent();
    }
  }

  private static void assertDefined(PropertySheet<?> sheet, PropertyCursor<?> cursor) {
    int state = cursor.stateId();
    assertTrue(state >= 0 && state < sheet.stateCount(), "state " + state);
  }
}
