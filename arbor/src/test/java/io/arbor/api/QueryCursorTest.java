package io.arbor.api;

import static io.arbor.test.ReplayQueryEngine.match;
import static org.junit.jupiter.api.Assertions.*;

import io.arbor.test.ReplayQueryEngine;
import io.arbor.test.TestLanguage;
import io.arbor.test.TestNode;
import io.arbor.test.TestRawQuery;
import io.arbor.tree.Node;
import io.arbor.tree.Point;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryCursorTest {
  private static final byte[] SOURCE = "foo(bar) foo(foo)".getBytes(StandardCharsets.UTF_8);

  private TestLanguage language;
  private TestNode root;
  private TestNode foo;
  private TestNode bar;
  private TestNode secondFoo;
  private TestNode thirdFoo;

  @BeforeEach
  void setUp() {
    language = TestLanguage.calls();
    root = language.node("program", 0, SOURCE.length);
    foo = language.node("identifier", 0, 3);
    bar = language.node("identifier", 4, 7);
    secondFoo = language.node("identifier", 9, 12);
    thirdFoo = language.node("identifier", 13, 16);
  }

  private static List<String> texts(List<Node> nodes) {
    return nodes.stream()
        .map(
            n ->
                new String(
                    SOURCE, n.startByte(), n.endByte() - n.startByte(), StandardCharsets.UTF_8))
        .collect(Collectors.toList());
  }

  @Test
  void capturesThatDifferAreFilteredFromMatchesAndCaptures() throws Exception {
    TestRawQuery raw = TestRawQuery.builder().pattern().predicate("eq?", "@a", "@b").build();
    ReplayQueryEngine engine =
        new ReplayQueryEngine(raw, match(0, 0, foo, 1, bar), match(0, 0, secondFoo, 1, thirdFoo));
    Query query = Query.compile(engine, language, "((identifier) @a (identifier) @b)");
    QueryCursor cursor = QueryCursor.create(engine);

    List<QueryMatch> matches =
        cursor
            .matches(query, root, NodeTextProvider.of(SOURCE))
            .stream()
            .collect(Collectors.toList());
    assertEquals(1, matches.size());
    assertSame(secondFoo, matches.get(0).nodesForCaptureIndex(0).get(0));
    assertSame(thirdFoo, matches.get(0).nodesForCaptureIndex(1).get(0));

    List<QueryCapture> captures =
        cursor
            .captures(query, root, NodeTextProvider.of(SOURCE))
            .stream()
            .collect(Collectors.toList());
    assertEquals(2, captures.size());
    assertEquals(0, captures.get(0).index());
    assertSame(secondFoo, captures.get(0).node());
    assertEquals(1, captures.get(1).index());
    assertSame(thirdFoo, captures.get(1).node());
  }

  @Test
  void literalEqualityComparesBytes() throws Exception {
    TestRawQuery raw = TestRawQuery.builder().pattern().predicate("eq?", "@a", "foo").build();
    ReplayQueryEngine engine =
        new ReplayQueryEngine(raw, match(0, 0, foo), match(0, 0, bar), match(0, 0, thirdFoo));
    Query query = Query.compile(raw);

    List<Node> nodes =
        QueryCursor.create(engine)
            .matches(query, root, NodeTextProvider.of(SOURCE))
            .stream()
            .map(m -> m.captures().get(0).node())
            .collect(Collectors.toList());

    assertEquals(List.of("foo", "foo"), texts(nodes));
  }

  @Test
  void literalBytesOfACompiledQueryAreReadOnly() throws Exception {
    TestRawQuery raw = TestRawQuery.builder().pattern().predicate("eq?", "@a", "foo").build();
    ReplayQueryEngine engine = new ReplayQueryEngine(raw, match(0, 0, foo));
    Query query = Query.compile(raw);

    ByteBuffer literal = ((QueryPredicate.CaptureEqString) query.predicates(0).get(0)).bytes();
    assertThrows(ReadOnlyBufferException.class, () -> literal.put(0, (byte) 'g'));
    literal.position(2);

    assertTrue(
        QueryCursor.create(engine).matches(query, root, NodeTextProvider.of(SOURCE)).hasNext());
  }

  @Test
  void nodeOutsideTheSourceNeverMatches() throws Exception {
    TestNode outside = language.node("identifier", 0, 10);
    TestRawQuery raw =
        TestRawQuery.builder()
            .pattern()
            .predicate("eq?", "@a", "foo")
            .pattern()
            .predicate("match?", "@a", ".")
            .pattern()
            .predicate("eq?", "@a", "@a")
            .build();
    ReplayQueryEngine engine =
        new ReplayQueryEngine(
            raw, match(0, 0, outside), match(1, 0, outside), match(2, 0, outside));
    byte[] shortSource = "foo".getBytes(StandardCharsets.UTF_8);

    assertNull(NodeTextProvider.of(shortSource).text(outside));
    assertFalse(
        QueryCursor.create(engine)
            .captures(Query.compile(raw), root, NodeTextProvider.of(shortSource))
            .hasNext());
  }

  @Test
  void regexSearchesAnywhereInTheText() throws Exception {
    TestRawQuery raw = TestRawQuery.builder().pattern().predicate("match?", "@a", "ar").build();
    ReplayQueryEngine engine = new ReplayQueryEngine(raw, match(0, 0, foo), match(0, 0, bar));

    List<QueryMatch> matches =
        QueryCursor.create(engine)
            .matches(Query.compile(raw), root, NodeTextProvider.of(SOURCE))
            .stream()
            .collect(Collectors.toList());

    assertEquals(1, matches.size());
    assertSame(bar, matches.get(0).captures().get(0).node());
  }

  @Test
  void predicateOnAbsentCaptureFails() throws Exception {
    TestRawQuery.Builder builder = TestRawQuery.builder().capture("a").capture("b");
    TestRawQuery raw = builder.pattern().predicate("eq?", "@b", "foo").build();
    ReplayQueryEngine engine = new ReplayQueryEngine(raw, match(0, 0, foo));

    assertFalse(
        QueryCursor.create(engine)
            .matches(Query.compile(raw), root, NodeTextProvider.of(SOURCE))
            .hasNext());
  }

  @Test
  void invalidUtf8IsFilteredSilently() throws Exception {
    byte[] source = {'o', 'k', ' ', (byte) 0xC3, (byte) 0x28};
    TestNode valid = language.node("identifier", 0, 2);
    TestNode invalid = language.node("identifier", 3, 5);
    TestRawQuery raw = TestRawQuery.builder().pattern().predicate("match?", "@a", ".").build();
    ReplayQueryEngine engine =
        new ReplayQueryEngine(raw, match(0, 0, invalid), match(0, 0, valid));

    QueryCaptures captures =
        QueryCursor.create(engine).captures(Query.compile(raw), root, NodeTextProvider.of(source));

    assertTrue(captures.hasNext());
    assertSame(valid, captures.next().node());
    assertFalse(captures.hasNext());
    assertThrows(NoSuchElementException.class, captures::next);
  }

  @Test
  void unfilteredPatternsPassThroughInOrder() throws Exception {
    TestRawQuery raw =
        TestRawQuery.builder()
            .capture("name")
            .pattern()
            .pattern()
            .predicate("eq?", "@name", "bar")
            .build();
    ReplayQueryEngine engine =
        new ReplayQueryEngine(
            raw, match(0, 0, foo), match(1, 0, foo), match(1, 0, bar), match(0, 0, thirdFoo));

    List<Integer> patterns =
        QueryCursor.create(engine)
            .matches(Query.compile(raw), root, NodeTextProvider.of(SOURCE))
            .stream()
            .map(QueryMatch::patternIndex)
            .collect(Collectors.toList());

    assertEquals(List.of(0, 1, 0), patterns);
  }

  @Test
  void rangesAreForwardedToTheEngine() throws Exception {
    TestRawQuery raw = TestRawQuery.builder().pattern().build();
    ReplayQueryEngine engine = new ReplayQueryEngine(raw);
    QueryCursor cursor = QueryCursor.create(engine);

    cursor.matches(Query.compile(raw), root, NodeTextProvider.of(SOURCE));
    assertEquals(0, engine.lastRange().startByte());
    assertEquals(Integer.MAX_VALUE, engine.lastRange().endByte());

    cursor.setByteRange(4, 12).setPointRange(new Point(0, 4), new Point(0, 12));
    cursor.captures(Query.compile(raw), root, NodeTextProvider.of(SOURCE));
    assertEquals(4, engine.lastRange().startByte());
    assertEquals(12, engine.lastRange().endByte());
    assertEquals(new Point(0, 4), engine.lastRange().startPoint());
    assertEquals(new Point(0, 12), engine.lastRange().endPoint());
    assertEquals(2, engine.executions());

    assertThrows(IllegalArgumentException.class, () -> cursor.setByteRange(5, 1));
    assertThrows(
        IllegalArgumentException.class,
        () -> cursor.setPointRange(new Point(1, 0), new Point(0, 9)));
  }

  @Test
  void freshCursorsYieldIdenticalSequences() throws Exception {
    TestRawQuery raw = TestRawQuery.builder().pattern().predicate("match?", "@a", "^f").build();
    ReplayQueryEngine engine =
        new ReplayQueryEngine(
            raw, match(0, 0, foo), match(0, 0, bar), match(0, 0, secondFoo), match(0, 0, thirdFoo));
    Query query = Query.compile(raw);

    List<Node> first =
        QueryCursor.create(engine)
            .captures(query, root, NodeTextProvider.of(SOURCE))
            .stream()
            .map(QueryCapture::node)
            .collect(Collectors.toList());
    List<Node> second =
        QueryCursor.create(engine)
            .captures(query, root, NodeTextProvider.of(SOURCE))
            .stream()
            .map(QueryCapture::node)
            .collect(Collectors.toList());

    assertEquals(List.of(foo, secondFoo, thirdFoo), first);
    assertEquals(first, second);
  }
}
