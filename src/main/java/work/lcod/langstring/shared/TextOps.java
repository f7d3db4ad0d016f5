package work.lcod.langstring.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import work.lcod.langstring.LangStringException;

/**
 * String helpers shared by the tagged text types. Indices, slices, splitting and padding follow the
 * conventions of Python's {@code str}: negative indices count from the end, slices clamp, and
 * {@code maxSplit < 0} means unlimited.
 */
public final class TextOps {
    private TextOps() {}

    public static String casefold(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }

    // -- case transforms

    public static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        int first = value.codePointAt(0);
        int width = Character.charCount(first);
        return new StringBuilder()
            .appendCodePoint(Character.toTitleCase(first))
            .append(value.substring(width).toLowerCase(Locale.ROOT))
            .toString();
    }

    public static String swapcase(String value) {
        return StringUtils.swapCase(value);
    }

    public static String title(String value) {
        var builder = new StringBuilder(value.length());
        boolean previousCased = false;
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            if (isCased(cp)) {
                builder.appendCodePoint(previousCased ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
                previousCased = true;
            } else {
                builder.appendCodePoint(cp);
                previousCased = false;
            }
            i += Character.charCount(cp);
        }
        return builder.toString();
    }

    // -- padding

    public static String center(String value, int width, char fill) {
        int margin = width - value.length();
        if (margin <= 0) {
            return value;
        }
        int left = margin / 2 + (margin & width & 1);
        return StringUtils.repeat(fill, left) + value + StringUtils.repeat(fill, margin - left);
    }

    public static String ljust(String value, int width, char fill) {
        return StringUtils.rightPad(value, width, fill);
    }

    public static String rjust(String value, int width, char fill) {
        return StringUtils.leftPad(value, width, fill);
    }

    public static String zfill(String value, int width) {
        int fill = width - value.length();
        if (fill <= 0) {
            return value;
        }
        String zeros = StringUtils.repeat('0', fill);
        if (!value.isEmpty() && (value.charAt(0) == '+' || value.charAt(0) == '-')) {
            return value.charAt(0) + zeros + value.substring(1);
        }
        return zeros + value;
    }

    public static String expandtabs(String value, int tabSize) {
        var builder = new StringBuilder(value.length());
        int column = 0;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\t') {
                if (tabSize > 0) {
                    int spaces = tabSize - (column % tabSize);
                    builder.append(StringUtils.repeat(' ', spaces));
                    column += spaces;
                }
            } else if (ch == '\n' || ch == '\r') {
                builder.append(ch);
                column = 0;
            } else {
                builder.append(ch);
                column++;
            }
        }
        return builder.toString();
    }

    // -- trimming

    /**
     * Strips the given characters from both ends; {@code null} strips whitespace.
     */
    public static String strip(String value, String chars) {
        return StringUtils.strip(value, chars);
    }

    public static String lstrip(String value, String chars) {
        return StringUtils.stripStart(value, chars);
    }

    public static String rstrip(String value, String chars) {
        return StringUtils.stripEnd(value, chars);
    }

    public static String removePrefix(String value, String prefix) {
        return StringUtils.removeStart(value, prefix);
    }

    public static String removeSuffix(String value, String suffix) {
        return StringUtils.removeEnd(value, suffix);
    }

    // -- indexing

    public static int normalizeIndex(int index, int length) {
        int resolved = index < 0 ? index + length : index;
        if (resolved < 0 || resolved >= length) {
            throw new IndexOutOfBoundsException("string index out of range: " + index);
        }
        return resolved;
    }

    public static String charAt(String value, int index) {
        return String.valueOf(value.charAt(normalizeIndex(index, value.length())));
    }

    /**
     * Slice with optional bounds; {@code null} means "from the start" or "to the end" in the direction of
     * {@code step}.
     */
    public static String slice(String value, Integer start, Integer end, Integer step) {
        int length = value.length();
        int stride = step == null ? 1 : step;
        if (stride == 0) {
            throw LangStringException.valueError("slice step cannot be zero");
        }
        int from;
        int to;
        if (stride > 0) {
            from = start == null ? 0 : clamp(start, length, 0, length);
            to = end == null ? length : clamp(end, length, 0, length);
        } else {
            from = start == null ? length - 1 : clamp(start, length, -1, length - 1);
            to = end == null ? -1 : clamp(end, length, -1, length - 1);
        }
        var builder = new StringBuilder();
        if (stride > 0) {
            for (int i = from; i < to; i += stride) {
                builder.append(value.charAt(i));
            }
        } else {
            for (int i = from; i > to; i += stride) {
                builder.append(value.charAt(i));
            }
        }
        return builder.toString();
    }

    private static int clamp(int index, int length, int lower, int upper) {
        int resolved = index < 0 ? index + length : index;
        if (resolved < lower) {
            return lower;
        }
        return Math.min(resolved, upper);
    }

    // -- search

    public static int find(String value, String sub, Integer start, Integer end) {
        int[] range = range(value.length(), start, end);
        if (range[0] > range[1]) {
            return -1;
        }
        return value.substring(0, range[1]).indexOf(sub, range[0]);
    }

    public static int rfind(String value, String sub, Integer start, Integer end) {
        int[] range = range(value.length(), start, end);
        if (range[0] > range[1]) {
            return -1;
        }
        int found = value.substring(0, range[1]).lastIndexOf(sub);
        return found >= range[0] ? found : -1;
    }

    public static int index(String value, String sub, Integer start, Integer end) {
        int found = find(value, sub, start, end);
        if (found < 0) {
            throw LangStringException.valueError("substring not found: '" + sub + "'");
        }
        return found;
    }

    public static int rindex(String value, String sub, Integer start, Integer end) {
        int found = rfind(value, sub, start, end);
        if (found < 0) {
            throw LangStringException.valueError("substring not found: '" + sub + "'");
        }
        return found;
    }

    public static int count(String value, String sub, Integer start, Integer end) {
        int[] range = range(value.length(), start, end);
        if (range[0] > range[1]) {
            return 0;
        }
        String window = value.substring(range[0], range[1]);
        if (sub.isEmpty()) {
            return window.length() + 1;
        }
        return StringUtils.countMatches(window, sub);
    }

    private static int[] range(int length, Integer start, Integer end) {
        int from = start == null ? 0 : clamp(start, length, 0, length);
        int to = end == null ? length : clamp(end, length, 0, length);
        return new int[] {from, to};
    }

    // -- replace / translate

    /**
     * Replaces up to {@code count} occurrences; a negative count replaces all.
     */
    public static String replace(String value, String old, String replacement, int count) {
        if (old.isEmpty()) {
            var builder = new StringBuilder();
            int inserted = 0;
            for (int i = 0; i <= value.length(); i++) {
                if (count < 0 || inserted < count) {
                    builder.append(replacement);
                    inserted++;
                }
                if (i < value.length()) {
                    builder.append(value.charAt(i));
                }
            }
            return builder.toString();
        }
        return StringUtils.replace(value, old, replacement, count < 0 ? -1 : count);
    }

    /**
     * Maps code points through {@code table}; a {@code null} mapping deletes the code point.
     */
    public static String translate(String value, Map<Integer, String> table) {
        var builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            if (table.containsKey(cp)) {
                String mapped = table.get(cp);
                if (mapped != null) {
                    builder.append(mapped);
                }
            } else {
                builder.appendCodePoint(cp);
            }
            i += Character.charCount(cp);
        }
        return builder.toString();
    }

    // -- split / partition

    public static List<String> split(String value, String separator, int maxSplit) {
        if (separator == null) {
            return splitWhitespace(value, maxSplit);
        }
        requireSeparator(separator);
        List<String> parts = new ArrayList<>();
        int from = 0;
        int found;
        while ((maxSplit < 0 || parts.size() < maxSplit) && (found = value.indexOf(separator, from)) >= 0) {
            parts.add(value.substring(from, found));
            from = found + separator.length();
        }
        parts.add(value.substring(from));
        return parts;
    }

    public static List<String> rsplit(String value, String separator, int maxSplit) {
        if (separator == null) {
            return rsplitWhitespace(value, maxSplit);
        }
        requireSeparator(separator);
        List<String> parts = new ArrayList<>();
        int to = value.length();
        int found;
        while ((maxSplit < 0 || parts.size() < maxSplit) && to >= 0
            && (found = value.lastIndexOf(separator, to - separator.length())) >= 0) {
            parts.add(value.substring(found + separator.length(), to));
            to = found;
        }
        parts.add(value.substring(0, to));
        Collections.reverse(parts);
        return parts;
    }

    private static List<String> splitWhitespace(String value, int maxSplit) {
        List<String> parts = new ArrayList<>();
        int length = value.length();
        int i = 0;
        while (true) {
            while (i < length && Character.isWhitespace(value.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            if (maxSplit >= 0 && parts.size() == maxSplit) {
                parts.add(value.substring(i));
                break;
            }
            int start = i;
            while (i < length && !Character.isWhitespace(value.charAt(i))) {
                i++;
            }
            parts.add(value.substring(start, i));
        }
        return parts;
    }

    private static List<String> rsplitWhitespace(String value, int maxSplit) {
        List<String> parts = new ArrayList<>();
        int i = value.length() - 1;
        while (true) {
            while (i >= 0 && Character.isWhitespace(value.charAt(i))) {
                i--;
            }
            if (i < 0) {
                break;
            }
            if (maxSplit >= 0 && parts.size() == maxSplit) {
                parts.add(value.substring(0, i + 1));
                break;
            }
            int end = i + 1;
            while (i >= 0 && !Character.isWhitespace(value.charAt(i))) {
                i--;
            }
            parts.add(value.substring(i + 1, end));
        }
        Collections.reverse(parts);
        return parts;
    }

    public static List<String> splitlines(String value, boolean keepEnds) {
        List<String> lines = new ArrayList<>();
        int length = value.length();
        int start = 0;
        int i = 0;
        while (i < length) {
            char ch = value.charAt(i);
            if (isLineBreak(ch)) {
                int breakEnd = i + 1;
                if (ch == '\r' && breakEnd < length && value.charAt(breakEnd) == '\n') {
                    breakEnd++;
                }
                lines.add(value.substring(start, keepEnds ? breakEnd : i));
                start = breakEnd;
                i = breakEnd;
            } else {
                i++;
            }
        }
        if (start < length) {
            lines.add(value.substring(start));
        }
        return lines;
    }

    private static boolean isLineBreak(char ch) {
        return switch (ch) {
            case '\n', '\r', '\u000b', '\u000c', '\u001c', '\u001d', '\u001e', '\u0085', '\u2028', '\u2029' -> true;
            default -> false;
        };
    }

    public static String[] partition(String value, String separator) {
        requireSeparator(separator);
        int found = value.indexOf(separator);
        if (found < 0) {
            return new String[] {value, "", ""};
        }
        return new String[] {value.substring(0, found), separator, value.substring(found + separator.length())};
    }

    public static String[] rpartition(String value, String separator) {
        requireSeparator(separator);
        int found = value.lastIndexOf(separator);
        if (found < 0) {
            return new String[] {"", "", value};
        }
        return new String[] {value.substring(0, found), separator, value.substring(found + separator.length())};
    }

    private static void requireSeparator(String separator) {
        if (separator.isEmpty()) {
            throw LangStringException.valueError("empty separator");
        }
    }

    // -- formatting

    /**
     * Replaces {@code {}} (auto-numbered) and {@code {0}} (indexed) fields. {@code {{} and {@code }}}
     * escape braces.
     */
    public static String format(String template, Object... args) {
        int[] next = {0};
        return substitute(template, token -> {
            int position;
            if (token.isEmpty()) {
                position = next[0]++;
            } else {
                try {
                    position = Integer.parseInt(token);
                } catch (NumberFormatException ex) {
                    throw LangStringException.notFound("No positional field named '" + token + "'");
                }
            }
            if (position < 0 || position >= args.length) {
                throw new IndexOutOfBoundsException("Replacement index " + position + " out of range for positional args");
            }
            return String.valueOf(args[position]);
        });
    }

    /**
     * Replaces {@code {name}} fields from the mapping; an unknown name is a not-found failure.
     */
    public static String formatMap(String template, Map<String, ?> values) {
        return substitute(template, token -> {
            if (!values.containsKey(token)) {
                throw LangStringException.notFound("No value for field '" + token + "'");
            }
            return String.valueOf(values.get(token));
        });
    }

    private static String substitute(String template, Function<String, String> resolver) {
        var builder = new StringBuilder();
        for (int i = 0; i < template.length(); i++) {
            char ch = template.charAt(i);
            if (ch == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    builder.append('{');
                    i += 1;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close == -1) {
                    throw LangStringException.valueError("Single '{' encountered in format string");
                }
                builder.append(resolver.apply(template.substring(i + 1, close).trim()));
                i = close;
                continue;
            }
            if (ch == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    builder.append('}');
                    i += 1;
                    continue;
                }
                throw LangStringException.valueError("Single '}' encountered in format string");
            }
            builder.append(ch);
        }
        return builder.toString();
    }

    // -- predicates

    public static boolean isAlpha(String value) {
        return StringUtils.isAlpha(value);
    }

    public static boolean isAlnum(String value) {
        return !value.isEmpty() && value.codePoints().allMatch(cp -> Character.isLetter(cp) || isNumericCodePoint(cp));
    }

    public static boolean isDigit(String value) {
        return !value.isEmpty() && value.codePoints().allMatch(cp -> Character.isDigit(cp)
            || (Character.getType(cp) == Character.OTHER_NUMBER && Character.getNumericValue(cp) >= 0
            && Character.getNumericValue(cp) <= 9));
    }

    public static boolean isDecimal(String value) {
        return !value.isEmpty() && value.codePoints().allMatch(cp -> Character.getType(cp) == Character.DECIMAL_DIGIT_NUMBER);
    }

    public static boolean isNumeric(String value) {
        return !value.isEmpty() && value.codePoints().allMatch(TextOps::isNumericCodePoint);
    }

    public static boolean isSpace(String value) {
        return !value.isEmpty() && value.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
    }

    public static boolean isLower(String value) {
        boolean cased = false;
        for (int cp : value.codePoints().toArray()) {
            if (Character.isUpperCase(cp) || Character.isTitleCase(cp)) {
                return false;
            }
            cased |= Character.isLowerCase(cp);
        }
        return cased;
    }

    public static boolean isUpper(String value) {
        boolean cased = false;
        for (int cp : value.codePoints().toArray()) {
            if (Character.isLowerCase(cp) || Character.isTitleCase(cp)) {
                return false;
            }
            cased |= Character.isUpperCase(cp);
        }
        return cased;
    }

    public static boolean isTitle(String value) {
        boolean cased = false;
        boolean previousCased = false;
        for (int cp : value.codePoints().toArray()) {
            if (Character.isUpperCase(cp) || Character.isTitleCase(cp)) {
                if (previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else if (Character.isLowerCase(cp)) {
                if (!previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else {
                previousCased = false;
            }
        }
        return cased;
    }

    public static boolean isAscii(String value) {
        return value.chars().allMatch(ch -> ch < 128);
    }

    public static boolean isPrintable(String value) {
        return value.codePoints().allMatch(cp -> cp == ' ' || !(Character.isISOControl(cp)
            || Character.isWhitespace(cp)
            || Character.isSpaceChar(cp)
            || Character.getType(cp) == Character.UNASSIGNED
            || Character.getType(cp) == Character.FORMAT
            || Character.getType(cp) == Character.SURROGATE
            || Character.getType(cp) == Character.PRIVATE_USE));
    }

    public static boolean isIdentifier(String value) {
        if (value.isEmpty()) {
            return false;
        }
        int first = value.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first)) {
            return false;
        }
        return value.codePoints().skip(1).allMatch(cp -> cp == '_' || Character.isUnicodeIdentifierPart(cp)
            && !Character.isIdentifierIgnorable(cp));
    }

    private static boolean isCased(int cp) {
        return Character.isUpperCase(cp) || Character.isLowerCase(cp) || Character.isTitleCase(cp);
    }

    private static boolean isNumericCodePoint(int cp) {
        int type = Character.getType(cp);
        return type == Character.DECIMAL_DIGIT_NUMBER || type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }
}
