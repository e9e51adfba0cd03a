package com.github.alexishuf.curie;

import com.github.alexishuf.curie.exceptions.CurieFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class CurieTest {
    private static final List<String> CURIES = List.of(
            "", "a:", "b", "a:b", "a:b/c", "a:b/c/d", "b/c", "a:b/c/d/e/f/g",
            "1:2:3:4:5:6", "a+b+c+d:", "b+c+d", "a:b+c+d/e");

    private static String[] split(String dataString) {
        String[] data = dataString.replace("''", "").split(" *\\| *", -1);
        for (int i = 0; i < data.length; i++)
            data[i] = data[i].trim();
        return data;
    }

    /* --- --- --- construction --- --- --- */

    @ParameterizedTest @ValueSource(strings = {
            "       | ''      | ''",
            "a      | ''      | a:",
            "a:     | ''      | a:",
            "a      | b       | a:b",
            "a:     | b       | a:b",
            "''     | b       | b",
            "a      | b/c     | a:b/c",
            "a      | b:c     | a:b:c",
            "wiki   | CURIE   | wiki:CURIE",
            "''     | :b      | b",
            "''     | ::b     | b",
            "''     | :b/c    | b/c",
            "''     | :b:c    | b:c",
            ":      | :b      | b",
    })
    void testOf(String dataString) {
        String[] data = split(dataString);
        Curie curie = Curie.of(data[0], data[1]);
        assertEquals(data[2], curie.toString());
        assertEquals(curie, Curie.parse(data[2]));
    }

    @Test
    void testOfEmpty() {
        assertSame(Curie.EMPTY, Curie.of("", ""));
        assertSame(Curie.EMPTY, Curie.of(":", ""));
        assertSame(Curie.EMPTY, Curie.of("", ":"));
        assertSame(Curie.EMPTY, Curie.of("", "::"));
        assertSame(Curie.EMPTY, Curie.parse(""));
        assertTrue(Curie.EMPTY.isEmpty());
    }

    @Test
    void testParseNullable() {
        assertNull(Curie.parseNullable(null));
        assertEquals(Curie.of("a", "b"), Curie.parseNullable("a:b"));
    }

    @ParameterizedTest @ValueSource(strings = {
            "''            | ''",
            "[]            | ''",
            "a:b           | a:b",
            "[a:b]         | a:b",
            "[a:]          | a:",
            "[b]           | b",
            ":b            | b",
            "::b           | b",
            "[:b]          | b",
            ":             | ''",
            "[:]           | ''",
            "a::b          | a::b",
            "a:b/c/d       | a:b/c/d",
            "[a:b/c/d]     | a:b/c/d",
            "a+b+c+d:      | a+b+c+d:",
            "1:2:3:4:5:6   | 1:2:3:4:5:6",
            "[a]b]         | a]b",
            "[[a:b]]       | [a:b]",
            "][            | ][",
    })
    void testParse(String dataString) {
        String[] data = split(dataString);
        Curie curie = Curie.parse(data[0]);
        assertEquals(data[1], curie.toString());
        assertEquals(data[1].isEmpty(), curie.isEmpty());
    }

    @ParameterizedTest @ValueSource(strings = {"[", "]", "[a:b", "a:b]", "[a:b/c", "a:]"})
    void testParseUnbalanced(String text) {
        var e = assertThrows(CurieFormatException.class, () -> Curie.parse(text));
        assertEquals(text, e.input().toString());
        assertTrue(e.getMessage().contains(text), "message should contain input");
    }

    @Test
    void testParseUnbalancedNullable() {
        assertThrows(CurieFormatException.class, () -> Curie.parseNullable("[a:b"));
    }

    @ParameterizedTest @MethodSource("curies")
    void testSafeRoundTrip(String text) {
        Curie curie = Curie.parse(text);
        assertEquals(text, curie.toString());
        assertEquals(text.isEmpty() ? "" : "["+text+"]", curie.safe());
        assertEquals(curie, Curie.parse(curie.safe()));
    }

    static Stream<Arguments> curies() { return CURIES.stream().map(Arguments::arguments); }

    /* --- --- --- decomposition --- --- --- */

    @ParameterizedTest @ValueSource(strings = {
            "''               | ''       | ''",
            "a:               | a        | ''",
            "b                | ''       | b",
            "a:b              | a        | b",
            "a:b/c            | a        | b/c",
            "b/c              | ''       | b/c",
            "1:2:3:4:5:6      | 1        | 2:3:4:5:6",
            "a+b+c+d:         | a+b+c+d  | ''",
            "a:b+c+d/e        | a        | b+c+d/e",
    })
    void testSplit(String dataString) {
        String[] data = split(dataString);
        Curie curie = Curie.parse(data[0]);
        assertEquals(new Curie.Parts(data[1], data[2]), curie.split());
        assertEquals(data[1], curie.scheme());
        assertEquals(data[2], curie.reference());
        assertEquals(!data[1].isEmpty(), curie.hasScheme());
        assertEquals(curie, curie.split().toCurie());
        assertEquals(curie, Curie.of(curie.scheme(), curie.reference()));
    }

    @ParameterizedTest @ValueSource(strings = {
            //text          | base | path     | head | tail
            "''             | ''   | ''       | ''   | ''",
            "a:             | ''   | a:       | ''   | a:",
            "b              | b    | ''       | b    | ''",
            "a:b            | b    | a:       | b    | a:",
            "a:b/c          | c    | a:b      | b    | a:c",
            "a:b/c/d        | d    | a:b/c    | b    | a:c/d",
            "b/c/d          | d    | b/c      | b    | c/d",
            "a:b//d         | d    | a:b/     | b    | a:/d",
            "a:b/           | ''   | a:b      | b    | a:",
    })
    void testBasePathHeadTail(String dataString) {
        String[] data = split(dataString);
        Curie curie = Curie.parse(data[0]);
        assertEquals(data[1], curie.base());
        assertEquals(data[2], curie.path().toString());
        assertEquals(data[3], curie.head());
        assertEquals(data[4], curie.tail().toString());
    }

    @Test
    void testPathTailOfNamespaceReturnsSame() {
        Curie ns = Curie.parse("a:");
        assertSame(ns, ns.path());
        assertSame(ns, ns.tail());
        assertSame(Curie.EMPTY, Curie.EMPTY.path());
        assertSame(Curie.EMPTY, Curie.EMPTY.tail());
    }

    static Stream<Arguments> testSegments() {
        return Stream.of(
                arguments("", List.of()),
                arguments("a:", List.of("a")),
                arguments("b", asList("", "b")),
                arguments("a:b", asList("a", "b")),
                arguments("a:b/c", asList("a", "b", "c")),
                arguments("a:b/c/d", asList("a", "b", "c", "d")),
                arguments("b/c", asList("", "b", "c")),
                arguments("a:b/c/d/e/f/g", asList("a", "b", "c", "d", "e", "f", "g")),
                arguments("1:2:3:4:5:6", asList("1", "2:3:4:5:6")),
                arguments("https://example.com/a/b/c?de=fg&foo=bar",
                          asList("https", "", "", "example.com", "a", "b", "c?de=fg&foo=bar"))
        );
    }

    @ParameterizedTest @MethodSource
    void testSegments(String text, List<String> expected) {
        Curie curie = Curie.parse(text);
        assertEquals(expected, curie.segments());
        assertEquals(expected.size(), curie.rank());
        assertThrows(UnsupportedOperationException.class, () -> curie.segments().add("x"));
    }

    @ParameterizedTest @ValueSource(strings = {
            "''      | 0",
            "a:      | 1",
            "b       | 2",
            "a:b     | 2",
            "a:b/c   | 3",
            "a:b/c/d | 4",
    })
    void testRank(String dataString) {
        String[] data = split(dataString);
        assertEquals(Integer.parseInt(data[1]), Curie.parse(data[0]).rank());
    }

    /* --- --- --- composition --- --- --- */

    @ParameterizedTest @ValueSource(strings = {"a:", "b", "a:b", "a:b/c", "a:b/c/d", "b/c"})
    void testJoin(String text) {
        Curie curie = Curie.parse(text);
        String base = text.endsWith(":") ? text : text + "/";
        Curie j1 = curie.join("x"), j2 = curie.join("x", "y"), j3 = curie.join("x", "y", "z");
        assertEquals(base+"x", j1.toString());
        assertEquals(base+"x/y", j2.toString());
        assertEquals(base+"x/y/z", j3.toString());
        assertEquals(curie, j1.path());
        assertEquals(curie, j2.cut(2));
        assertEquals(curie, j3.cut(3));
        assertEquals(j1, j3.cut(2));
        assertEquals(curie.scheme(), j3.scheme());
        assertEquals(curie.rank()+3, j3.rank());
    }

    @Test
    void testJoinWithEmpty() {
        assertEquals("x", Curie.EMPTY.join("x").toString());
        assertEquals("x/y", Curie.EMPTY.join("x", "y").toString());
        assertEquals("x/y/z", Curie.EMPTY.join("x", "y", "z").toString());
        assertEquals("a:x", Curie.parse("a:").join("x").toString());
        assertEquals("a:x/y", Curie.parse("a:").join("x", "y").toString());
        assertEquals("b/x", Curie.parse("b").join("x").toString());
    }

    @ParameterizedTest @MethodSource("curies")
    void testJoinNothing(String text) {
        Curie curie = Curie.parse(text);
        assertSame(curie, curie.join());
        assertSame(curie, curie.join(""));
        assertSame(curie, curie.join("", ""));
        assertSame(curie, curie.join(Curie.EMPTY));
        assertEquals(curie.join("x", "y"), curie.join("", "x", "", "y", ""));
    }

    @Test
    void testJoinImmutable() {
        Curie curie = Curie.parse("a:b/c/d/e/f/g");
        Curie parent = curie.cut(3);
        Curie child = parent.join("t");
        assertEquals("a:b/c/d/e/f/g", curie.toString());
        assertEquals("a:b/c/d", parent.toString());
        assertEquals("a:b/c/d/t", child.toString());
    }

    @ParameterizedTest @ValueSource(strings = {
            "a:b    | x:       | a:b/x",
            "a:b    | x:y      | a:b/x/y",
            "a:b    | x:y/z    | a:b/x/y/z",
            "a:b    | y/z      | a:b/y/z",
            "a:     | x:y      | a:x/y",
            "b      | x:y      | b/x/y",
            "''     | x:       | x",
            "''     | x:y      | x/y",
            "''     | x:y/z    | x/y/z",
            "a:b/c  | ''       | a:b/c",
    })
    void testJoinCurie(String dataString) {
        String[] data = split(dataString);
        Curie parent = Curie.parse(data[0]), child = Curie.parse(data[1]);
        Curie heir = parent.join(child);
        assertEquals(data[2], heir.toString());
        assertEquals(parent.scheme(), heir.scheme());
    }

    @ParameterizedTest @ValueSource(strings = {
            "a:b/c/d/e | 0 | a:b/c/d/e",
            "a:b/c/d/e | 1 | a:b/c/d",
            "a:b/c/d/e | 2 | a:b/c",
            "a:b/c/d/e | 3 | a:b",
            "a:b/c/d/e | 4 | a:",
            "a:b/c/d/e | 5 | a:",
            "a:b/c/d/e | 9 | a:",
            "a:        | 1 | a:",
            "b/c       | 1 | b",
            "b         | 1 | ''",
            "''        | 1 | ''",
    })
    void testCut(String dataString) {
        String[] data = split(dataString);
        Curie curie = Curie.parse(data[0]);
        Curie cut = curie.cut(Integer.parseInt(data[1]));
        assertEquals(data[2], cut.toString());
        assertEquals(curie.scheme(), cut.scheme());
    }

    @ParameterizedTest @ValueSource(strings = {
            "a:b/c/d/e | 0 | ''",
            "a:b/c/d/e | 1 | e",
            "a:b/c/d/e | 2 | d/e",
            "a:b/c/d/e | 4 | b/c/d/e",
            "a:b/c/d/e | 9 | b/c/d/e",
            "a:        | 1 | ''",
            "b/c       | 1 | c",
            "''        | 2 | ''",
    })
    void testSuffix(String dataString) {
        String[] data = split(dataString);
        Curie curie = Curie.parse(data[0]);
        int n = Integer.parseInt(data[1]);
        assertEquals(data[2], curie.suffix(n));
        assertEquals(curie.reference(), curie.cut(n).join(curie.suffix(n)).reference());
    }

    @Test
    void testSuffixNegative() {
        assertThrows(IllegalArgumentException.class, () -> Curie.parse("a:b/c").suffix(-1));
    }

    @Test
    void testCutZeroReturnsSame() {
        Curie curie = Curie.parse("a:b/c");
        assertSame(curie, curie.cut(0));
    }

    @Test
    void testCutNegative() {
        assertThrows(IllegalArgumentException.class, () -> Curie.parse("a:b/c").cut(-1));
    }

    /* --- --- --- ordering and equality --- --- --- */

    @ParameterizedTest @ValueSource(strings = {
            "''        | b:",
            "a:        | b:",
            "b         | c",
            "a:b       | a:c",
            "a:b/c     | a:b/d",
            "a:b/c/d   | a:b/c/e",
            "a:x/x/a   | a:x/x/x/a",
            "a:z       | a:b/c",
            "b         | a:c",
            "''        | a:",
            "a:b/c/d/e | a:b/c/d/e/a",
    })
    void testLt(String dataString) {
        String[] data = split(dataString);
        Curie a = Curie.parse(data[0]), b = Curie.parse(data[1]);
        assertTrue(a.lt(b));
        assertFalse(b.lt(a));
        assertFalse(a.lt(a));
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(a) > 0);
        assertNotEquals(a, b);
    }

    @ParameterizedTest @MethodSource("curies")
    void testEquals(String text) {
        Curie a = Curie.parse(text), b = Curie.parse("["+text+"]");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
        assertNotEquals(a, Curie.parse("a:b+c+d/e/f"));
        assertEquals(text.equals("1:2:3:4:5:6"), a.equals(Curie.parse("1:2:3:4:5:6")));
    }

    @Test
    void testOfLeadingColonEqualsParse() {
        Curie built = Curie.of("", ":b"), parsed = Curie.parse(":b");
        assertEquals(parsed, built);
        assertEquals(parsed.hashCode(), built.hashCode());
        assertEquals(0, built.compareTo(parsed));
        assertEquals("b", built.toString());
        assertEquals("[b]", built.safe());
        assertEquals(List.of("", "b"), built.segments());
    }

    @Test
    void testSort() {
        List<Curie> expected = new ArrayList<>();
        for (String s : Arrays.asList("", "a:", "b:", "b", "c", "a:b", "a:c", "a:z", "a:b/c",
                                      "a:b/d", "a:b/c/d", "a:x/x/a", "a:x/x/x/a"))
            expected.add(Curie.parse(s));
        List<Curie> actual = new ArrayList<>(expected);
        Collections.reverse(actual);
        Collections.sort(actual);
        assertEquals(expected, actual);
        Collections.shuffle(actual);
        actual.sort(null);
        assertEquals(expected, actual);
    }

    /* --- --- --- algebraic properties --- --- --- */

    @ParameterizedTest @MethodSource("curies")
    void testJoinThenCut(String text) {
        Curie curie = Curie.parse(text);
        assertEquals(curie, curie.join("x").cut(1));
        assertEquals(curie, curie.join("x", "y").cut(2));
        assertEquals(curie, curie.join("x", "y", "z").cut(3));
        assertEquals(curie.scheme(), curie.join("x").scheme());
    }

    @ParameterizedTest @MethodSource("curies")
    void testRebuild(String text) {
        Curie curie = Curie.parse(text);
        assertEquals(curie, Curie.of(curie.scheme(), curie.reference()));
        assertEquals(curie, curie.split().toCurie());
    }

    @ParameterizedTest @ValueSource(strings = {"b", ":b", "::b/c", ":", "a:b", "a::b", ":a:b"})
    void testRebuildFromOf(String reference) {
        Curie curie = Curie.of("", reference);
        Curie rebuilt = Curie.of(curie.scheme(), curie.reference());
        assertEquals(curie.toString(), rebuilt.toString());
        assertEquals(curie, rebuilt);
        assertFalse(curie.toString().startsWith(":"));
    }

    @Test
    void testScenario() {
        Curie wiki = Curie.of("wiki", "");
        Curie page = wiki.join("CURIE");
        assertEquals("wiki:", wiki.toString());
        assertEquals("wiki:CURIE", page.toString());
        assertEquals("[wiki:CURIE]", page.safe());
        assertEquals("wiki", page.scheme());
        assertEquals("CURIE", page.reference());
        assertEquals("CURIE", page.base());
        assertEquals(wiki, page.path());
        assertEquals(wiki, page.cut(1));
        assertTrue(wiki.lt(page));
        assertEquals(page, Curie.parse(page.safe()));
    }

    record Person(Curie id, String name) implements HasIdentity {
        @Override public Curie identity() { return id; }
    }

    @Test
    void testHasIdentity() {
        Person alice = new Person(Curie.parse("person:alice"), "Alice");
        Person bob = new Person(Curie.parse("person:bob"), "Bob");
        Person anon = new Person(Curie.EMPTY, "Anonymous");
        List<Person> people = new ArrayList<>(List.of(bob, alice, anon));
        people.sort(HasIdentity::compare);
        assertEquals(List.of(anon, alice, bob), people);
        assertTrue(HasIdentity.compare(alice, bob) < 0);
        assertEquals(0, HasIdentity.compare(alice, alice));
    }
}
