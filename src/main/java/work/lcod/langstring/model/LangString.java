package work.lcod.langstring.model;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.langstring.LangStringException;
import work.lcod.langstring.control.FlagNamespace;
import work.lcod.langstring.control.FlagSettings;
import work.lcod.langstring.control.GlobalFlag;
import work.lcod.langstring.shared.TextOps;
import work.lcod.langstring.validation.FlagValidator;

/**
 * A text bound to a language tag.
 *
 * <p>Both fields are validated against the {@code LangStringFlag} namespace on construction and on every
 * assignment. Text operations return new instances carrying the same language tag. Equality and hashing
 * ignore the letter case of the tag.
 */
public final class LangString implements TextAlgebra<LangString>, Comparable<LangString> {
    private static final FlagNamespace NAMESPACE = FlagNamespace.LANG_STRING;

    private final FlagSettings settings;
    private String text;
    private String lang;

    public LangString(String text) {
        this(text, "", null);
    }

    public LangString(String text, String lang) {
        this(text, lang, null);
    }

    /**
     * @param settings flags to validate and render with; {@code null} follows the live
     *                 {@link work.lcod.langstring.control.Controller} state
     */
    public LangString(String text, String lang, FlagSettings settings) {
        this.settings = settings;
        FlagValidator validator = validator();
        String validText = validator.validateText(text);
        this.lang = validator.validateLanguage(lang);
        this.text = validText;
    }

    /**
     * Builds an instance from dynamically typed values; anything but a {@code String} or {@code null} is a
     * type failure.
     */
    public static LangString of(Object text, Object lang) {
        return new LangString(requireText(text, "text"), requireText(lang, "lang"), null);
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = validator().validateText(text);
    }

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = validator().validateLanguage(lang);
    }

    public Optional<FlagSettings> settings() {
        return Optional.ofNullable(settings);
    }

    FlagValidator validator() {
        return FlagValidator.of(NAMESPACE, settings);
    }

    private LangString derive(String value) {
        return new LangString(value, lang, settings);
    }

    private List<LangString> deriveAll(List<String> values) {
        List<LangString> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(derive(value));
        }
        return result;
    }

    // -- text algebra

    @Override
    public LangString concat(LangString other) {
        requireSameLang(other, "concat");
        return derive(text + other.text);
    }

    @Override
    public LangString concat(String other) {
        return derive(text + requireRaw(other));
    }

    @Override
    public LangString repeat(int times) {
        return derive(times <= 0 ? "" : text.repeat(times));
    }

    @Override
    public LangString charAt(int index) {
        return derive(TextOps.charAt(text, index));
    }

    public LangString slice(Integer start, Integer end) {
        return slice(start, end, null);
    }

    @Override
    public LangString slice(Integer start, Integer end, Integer step) {
        return derive(TextOps.slice(text, start, end, step));
    }

    @Override
    public LangString capitalize() {
        return derive(TextOps.capitalize(text));
    }

    @Override
    public LangString casefold() {
        return derive(TextOps.casefold(text));
    }

    @Override
    public LangString lower() {
        return derive(text.toLowerCase(Locale.ROOT));
    }

    @Override
    public LangString upper() {
        return derive(text.toUpperCase(Locale.ROOT));
    }

    @Override
    public LangString swapcase() {
        return derive(TextOps.swapcase(text));
    }

    @Override
    public LangString title() {
        return derive(TextOps.title(text));
    }

    public LangString center(int width) {
        return center(width, ' ');
    }

    @Override
    public LangString center(int width, char fill) {
        return derive(TextOps.center(text, width, fill));
    }

    public LangString ljust(int width) {
        return ljust(width, ' ');
    }

    @Override
    public LangString ljust(int width, char fill) {
        return derive(TextOps.ljust(text, width, fill));
    }

    public LangString rjust(int width) {
        return rjust(width, ' ');
    }

    @Override
    public LangString rjust(int width, char fill) {
        return derive(TextOps.rjust(text, width, fill));
    }

    @Override
    public LangString zfill(int width) {
        return derive(TextOps.zfill(text, width));
    }

    public LangString expandtabs() {
        return expandtabs(8);
    }

    @Override
    public LangString expandtabs(int tabSize) {
        return derive(TextOps.expandtabs(text, tabSize));
    }

    public LangString strip() {
        return strip(null);
    }

    @Override
    public LangString strip(String chars) {
        return derive(TextOps.strip(text, chars));
    }

    public LangString lstrip() {
        return lstrip(null);
    }

    @Override
    public LangString lstrip(String chars) {
        return derive(TextOps.lstrip(text, chars));
    }

    public LangString rstrip() {
        return rstrip(null);
    }

    @Override
    public LangString rstrip(String chars) {
        return derive(TextOps.rstrip(text, chars));
    }

    @Override
    public LangString removePrefix(String prefix) {
        return derive(TextOps.removePrefix(text, Objects.requireNonNull(prefix, "prefix")));
    }

    @Override
    public LangString removeSuffix(String suffix) {
        return derive(TextOps.removeSuffix(text, Objects.requireNonNull(suffix, "suffix")));
    }

    public LangString replace(String old, String replacement) {
        return replace(old, replacement, -1);
    }

    @Override
    public LangString replace(String old, String replacement, int count) {
        return derive(TextOps.replace(text, Objects.requireNonNull(old, "old"), Objects.requireNonNull(replacement, "replacement"), count));
    }

    @Override
    public LangString translate(Map<Integer, String> table) {
        return derive(TextOps.translate(text, Objects.requireNonNull(table, "table")));
    }

    /**
     * Joins the parts with this text as separator. Parts may be strings or same-language {@code LangString}s.
     */
    @Override
    public LangString join(Iterable<?> parts) {
        var builder = new StringBuilder();
        boolean first = true;
        for (Object part : Objects.requireNonNull(parts, "parts")) {
            String piece;
            if (part instanceof LangString other) {
                requireSameLang(other, "join");
                piece = other.text;
            } else if (part instanceof String raw) {
                piece = requireRaw(raw);
            } else {
                throw LangStringException.unexpectedType(part, "'String' or 'LangString'");
            }
            if (!first) {
                builder.append(text);
            }
            builder.append(piece);
            first = false;
        }
        return derive(builder.toString());
    }

    @Override
    public LangString format(Object... args) {
        return derive(TextOps.format(text, args));
    }

    @Override
    public LangString formatMap(Map<String, ?> values) {
        return derive(TextOps.formatMap(text, Objects.requireNonNull(values, "values")));
    }

    public List<LangString> split() {
        return split(null, -1);
    }

    public List<LangString> split(String separator) {
        return split(separator, -1);
    }

    @Override
    public List<LangString> split(String separator, int maxSplit) {
        return deriveAll(TextOps.split(text, separator, maxSplit));
    }

    public List<LangString> rsplit(String separator) {
        return rsplit(separator, -1);
    }

    @Override
    public List<LangString> rsplit(String separator, int maxSplit) {
        return deriveAll(TextOps.rsplit(text, separator, maxSplit));
    }

    public List<LangString> splitlines() {
        return splitlines(false);
    }

    @Override
    public List<LangString> splitlines(boolean keepEnds) {
        return deriveAll(TextOps.splitlines(text, keepEnds));
    }

    @Override
    public List<LangString> partition(String separator) {
        return deriveAll(List.of(TextOps.partition(text, Objects.requireNonNull(separator, "separator"))));
    }

    @Override
    public List<LangString> rpartition(String separator) {
        return deriveAll(List.of(TextOps.rpartition(text, Objects.requireNonNull(separator, "separator"))));
    }

    // -- queries

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean contains(String sub) {
        return text.contains(requireRaw(sub));
    }

    public boolean contains(LangString other) {
        requireSameLang(other, "contains");
        return text.contains(other.text);
    }

    public int count(String sub) {
        return count(sub, null, null);
    }

    public int count(String sub, Integer start, Integer end) {
        return TextOps.count(text, Objects.requireNonNull(sub, "sub"), start, end);
    }

    public int find(String sub) {
        return find(sub, null, null);
    }

    public int find(String sub, Integer start, Integer end) {
        return TextOps.find(text, Objects.requireNonNull(sub, "sub"), start, end);
    }

    public int rfind(String sub) {
        return rfind(sub, null, null);
    }

    public int rfind(String sub, Integer start, Integer end) {
        return TextOps.rfind(text, Objects.requireNonNull(sub, "sub"), start, end);
    }

    public int index(String sub) {
        return index(sub, null, null);
    }

    public int index(String sub, Integer start, Integer end) {
        return TextOps.index(text, Objects.requireNonNull(sub, "sub"), start, end);
    }

    public int rindex(String sub) {
        return rindex(sub, null, null);
    }

    public int rindex(String sub, Integer start, Integer end) {
        return TextOps.rindex(text, Objects.requireNonNull(sub, "sub"), start, end);
    }

    public boolean startsWith(String prefix) {
        return text.startsWith(Objects.requireNonNull(prefix, "prefix"));
    }

    public boolean endsWith(String suffix) {
        return text.endsWith(Objects.requireNonNull(suffix, "suffix"));
    }

    public boolean isAlpha() {
        return TextOps.isAlpha(text);
    }

    public boolean isAlnum() {
        return TextOps.isAlnum(text);
    }

    public boolean isDigit() {
        return TextOps.isDigit(text);
    }

    public boolean isDecimal() {
        return TextOps.isDecimal(text);
    }

    public boolean isNumeric() {
        return TextOps.isNumeric(text);
    }

    public boolean isSpace() {
        return TextOps.isSpace(text);
    }

    public boolean isLower() {
        return TextOps.isLower(text);
    }

    public boolean isUpper() {
        return TextOps.isUpper(text);
    }

    public boolean isTitle() {
        return TextOps.isTitle(text);
    }

    public boolean isAscii() {
        return TextOps.isAscii(text);
    }

    public boolean isPrintable() {
        return TextOps.isPrintable(text);
    }

    public boolean isIdentifier() {
        return TextOps.isIdentifier(text);
    }

    public byte[] encode(Charset charset) {
        return text.getBytes(Objects.requireNonNull(charset, "charset"));
    }

    // -- comparison

    /**
     * Compares texts; the tags must match ignoring case.
     */
    @Override
    public int compareTo(LangString other) {
        requireSameLang(other, "compare");
        return text.compareTo(other.text);
    }

    public boolean isLessThan(LangString other) {
        return compareTo(other) < 0;
    }

    public boolean isLessThan(String other) {
        return text.compareTo(requireRaw(other)) < 0;
    }

    public boolean isLessOrEqual(LangString other) {
        return compareTo(other) <= 0;
    }

    public boolean isLessOrEqual(String other) {
        return text.compareTo(requireRaw(other)) <= 0;
    }

    public boolean isGreaterThan(LangString other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThan(String other) {
        return text.compareTo(requireRaw(other)) > 0;
    }

    public boolean isGreaterOrEqual(LangString other) {
        return compareTo(other) >= 0;
    }

    public boolean isGreaterOrEqual(String other) {
        return text.compareTo(requireRaw(other)) >= 0;
    }

    /**
     * Compares only the text, ignoring the language.
     */
    public boolean equalsStr(String other) {
        return text.equals(Objects.requireNonNull(other, "other"));
    }

    /**
     * Strict comparison: text and tag must be identical, including the letter case of the tag.
     */
    public boolean equalsLangString(LangString other) {
        Objects.requireNonNull(other, "other");
        return text.equals(other.text) && lang.equals(other.lang);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof LangString that
            && text.equals(that.text)
            && LanguageTags.matches(lang, that.lang);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, TextOps.casefold(lang));
    }

    // -- rendering

    @Override
    public String toString() {
        return toString(RenderOptions.defaults());
    }

    public String toString(RenderOptions options) {
        FlagValidator validator = validator();
        return Objects.requireNonNull(options, "options").render(
            text,
            lang,
            validator.enabled(GlobalFlag.PRINT_WITH_QUOTES),
            validator.enabled(GlobalFlag.PRINT_WITH_LANG)
        );
    }

    public String toString(boolean printQuotes, String separator, boolean printLang) {
        return toString(new RenderOptions(printQuotes, separator, printLang));
    }

    /**
     * Removes duplicates (same text, same tag ignoring case) keeping first-seen order. Tags of one language
     * seen with several casings are replaced by the case-folded form.
     */
    public static List<LangString> mergeLangStrings(List<LangString> langStrings) {
        Objects.requireNonNull(langStrings, "langStrings");
        List<String> tags = new ArrayList<>();
        for (LangString langString : langStrings) {
            if (langString == null) {
                throw LangStringException.unexpectedType(null, "'LangString'");
            }
            tags.add(langString.lang);
        }
        Map<String, String> chosen = LanguageTags.reconcile(tags);
        Map<List<String>, LangString> merged = new LinkedHashMap<>();
        for (LangString langString : langStrings) {
            String key = TextOps.casefold(langString.lang);
            merged.computeIfAbsent(
                List.of(langString.text, key),
                ignored -> new LangString(langString.text, chosen.get(key), langString.settings)
            );
        }
        return new ArrayList<>(merged.values());
    }

    private void requireSameLang(LangString other, String operation) {
        Objects.requireNonNull(other, "other");
        if (!LanguageTags.matches(lang, other.lang)) {
            throw LangStringException.valueError(
                "Operation '" + operation + "' cannot be performed. Incompatible languages between LangString objects ('"
                    + lang + "' and '" + other.lang + "')."
            );
        }
    }

    private String requireRaw(String value) {
        if (value == null) {
            throw LangStringException.unexpectedType(null, "'String' or 'LangString'");
        }
        if (validator().enabled(GlobalFlag.METHODS_MATCH_TYPES)) {
            throw LangStringException.typeError(
                "Invalid argument '" + value + "'. '" + NAMESPACE.typeName()
                    + ".METHODS_MATCH_TYPES' is enabled. Expected 'LangString', but got 'String'."
            );
        }
        return value;
    }

    private static String requireText(Object value, String field) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw LangStringException.unexpectedType(value, "'String' for '" + field + "'");
    }
}
