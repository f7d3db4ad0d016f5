package work.lcod.langstring.shared;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.langstring.support.LangStringTestSupport.assertFailure;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.langstring.ErrorKind;

class TextOpsTest {
    @Test
    void caseTransforms() {
        assertEquals("strasse", TextOps.casefold("STRASSE"));
        assertEquals("Hello world", TextOps.capitalize("hELLO WORLD"));
        assertEquals("hELLO", TextOps.swapcase("Hello"));
        assertEquals("Hello World'S", TextOps.title("hello world's"));
        assertEquals("Two-Part Name", TextOps.title("two-part name"));
    }

    @Test
    void paddingMatchesPythonPlacement() {
        assertEquals("*abc**", TextOps.center("abc", 6, '*'));
        assertEquals("*ab*", TextOps.center("ab", 4, '*'));
        assertEquals("abc", TextOps.center("abc", 2, '*'));
        assertEquals("ab..", TextOps.ljust("ab", 4, '.'));
        assertEquals("..ab", TextOps.rjust("ab", 4, '.'));
        assertEquals("-0042", TextOps.zfill("-42", 5));
        assertEquals("0042", TextOps.zfill("42", 4));
        assertEquals("a   b", TextOps.expandtabs("a\tb", 4));
        assertEquals("ab", TextOps.expandtabs("a\tb", 0));
    }

    @Test
    void trimmingAndAffixes() {
        assertEquals("hi", TextOps.strip("  hi \n", null));
        assertEquals("hi", TextOps.strip("xxhixx", "x"));
        assertEquals("hi  ", TextOps.lstrip("  hi  ", null));
        assertEquals("  hi", TextOps.rstrip("  hi  ", null));
        assertEquals("World", TextOps.removePrefix("HelloWorld", "Hello"));
        assertEquals("Hello", TextOps.removeSuffix("HelloWorld", "World"));
        assertEquals("HelloWorld", TextOps.removeSuffix("HelloWorld", "Hello"));
    }

    @Test
    void indexingAcceptsNegativeOffsets() {
        assertEquals("o", TextOps.charAt("Hello", -1));
        assertEquals("H", TextOps.charAt("Hello", 0));
        assertThrows(IndexOutOfBoundsException.class, () -> TextOps.charAt("Hello", 5));
        assertThrows(IndexOutOfBoundsException.class, () -> TextOps.charAt("Hello", -6));
    }

    @Test
    void slicingClampsAndSteps() {
        assertEquals("ell", TextOps.slice("Hello", 1, 4, null));
        assertEquals("lo", TextOps.slice("Hello", -2, null, null));
        assertEquals("Hello", TextOps.slice("Hello", -100, 100, null));
        assertEquals("olleH", TextOps.slice("Hello", null, null, -1));
        assertEquals("Hlo", TextOps.slice("Hello", null, null, 2));
        assertEquals("", TextOps.slice("Hello", 4, 1, null));
        assertFailure(ErrorKind.VALUE, () -> TextOps.slice("Hello", null, null, 0));
    }

    @Test
    void searching() {
        assertEquals(2, TextOps.find("Hello", "l", null, null));
        assertEquals(3, TextOps.rfind("Hello", "l", null, null));
        assertEquals(-1, TextOps.find("Hello", "l", 4, null));
        assertEquals(-1, TextOps.rfind("Hello", "l", null, 2));
        assertEquals(1, TextOps.index("Hello", "e", null, null));
        assertEquals(2, TextOps.count("Hello", "l", null, null));
        assertEquals(6, TextOps.count("Hello", "", null, null));
        assertFailure(ErrorKind.VALUE, () -> TextOps.index("Hello", "z", null, null));
        assertFailure(ErrorKind.VALUE, () -> TextOps.rindex("Hello", "z", null, null));
    }

    @Test
    void replaceAndTranslate() {
        assertEquals("heLLo", TextOps.replace("hello", "l", "L", -1));
        assertEquals("heLlo", TextOps.replace("hello", "l", "L", 1));
        assertEquals("-a-b-", TextOps.replace("ab", "", "-", -1));
        assertEquals("-ab", TextOps.replace("ab", "", "-", 1));

        Map<Integer, String> table = new HashMap<>();
        table.put((int) 'a', "4");
        table.put((int) 'e', null);
        assertEquals("b4n4n4", TextOps.translate("banana", table));
        assertEquals("hllo", TextOps.translate("hello", table));
    }

    @Test
    void splittingFollowsSeparatorRules() {
        assertEquals(List.of("a", "", "b"), TextOps.split("a,,b", ",", -1));
        assertEquals(List.of("a", "b,c"), TextOps.split("a,b,c", ",", 1));
        assertEquals(List.of("a,b", "c"), TextOps.rsplit("a,b,c", ",", 1));
        assertEquals(List.of("a", "", "b"), TextOps.rsplit("a,,b", ",", -1));
        assertEquals(List.of("a", "b", "c"), TextOps.split("  a b\tc  ", null, -1));
        assertEquals(List.of("a", "b c  "), TextOps.split("  a b c  ", null, 1));
        assertEquals(List.of("  a b", "c"), TextOps.rsplit("  a b c  ", null, 1));
        assertEquals(List.of(), TextOps.split("   ", null, -1));
        assertFailure(ErrorKind.VALUE, () -> TextOps.split("abc", "", -1));
    }

    @Test
    void splitlinesRecognisesAllBreaks() {
        assertEquals(List.of("a", "b", "c"), TextOps.splitlines("a\nb\r\nc", false));
        assertEquals(List.of("a\n", "b\r\n", "c"), TextOps.splitlines("a\nb\r\nc", true));
        assertEquals(List.of("x", "y"), TextOps.splitlines("x\u2028y", false));
        assertEquals(List.of(), TextOps.splitlines("", false));
    }

    @Test
    void partitionKeepsThreeParts() {
        assertArrayEquals(new String[] {"key", "=", "value=x"}, TextOps.partition("key=value=x", "="));
        assertArrayEquals(new String[] {"key=value", "=", "x"}, TextOps.rpartition("key=value=x", "="));
        assertArrayEquals(new String[] {"abc", "", ""}, TextOps.partition("abc", "="));
        assertArrayEquals(new String[] {"", "", "abc"}, TextOps.rpartition("abc", "="));
    }

    @Test
    void formatFillsPositionalAndNamedFields() {
        assertEquals("Hello World!", TextOps.format("{} {}!", "Hello", "World"));
        assertEquals("b a", TextOps.format("{1} {0}", "a", "b"));
        assertEquals("{literal}", TextOps.format("{{literal}}"));
        assertEquals("Hi Ana", TextOps.formatMap("Hi {name}", Map.of("name", "Ana")));
        assertFailure(ErrorKind.NOT_FOUND, () -> TextOps.formatMap("Hi {name}", Map.of()));
        assertFailure(ErrorKind.VALUE, () -> TextOps.format("oops {", "x"));
        assertFailure(ErrorKind.VALUE, () -> TextOps.format("oops }"));
        assertThrows(IndexOutOfBoundsException.class, () -> TextOps.format("{} {}", "only"));
    }

    @Test
    void predicates() {
        assertTrue(TextOps.isAlpha("abc"));
        assertFalse(TextOps.isAlpha(""));
        assertTrue(TextOps.isAlnum("abc123"));
        assertTrue(TextOps.isDigit("123"));
        assertTrue(TextOps.isDecimal("123"));
        assertTrue(TextOps.isNumeric("½"));
        assertFalse(TextOps.isDecimal("½"));
        assertTrue(TextOps.isSpace(" \t"));
        assertFalse(TextOps.isSpace(""));
        assertTrue(TextOps.isLower("abc 1"));
        assertFalse(TextOps.isLower("123"));
        assertTrue(TextOps.isUpper("ABC"));
        assertTrue(TextOps.isTitle("Hello World"));
        assertFalse(TextOps.isTitle("Hello world"));
        assertTrue(TextOps.isAscii(""));
        assertFalse(TextOps.isAscii("café"));
        assertTrue(TextOps.isPrintable("Hello World"));
        assertFalse(TextOps.isPrintable("tab\there"));
        assertTrue(TextOps.isIdentifier("_name1"));
        assertFalse(TextOps.isIdentifier("1name"));
    }
}
