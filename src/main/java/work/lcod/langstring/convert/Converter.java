package work.lcod.langstring.convert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.langstring.LangStringException;
import work.lcod.langstring.model.LangString;
import work.lcod.langstring.model.MultiLangString;
import work.lcod.langstring.model.RenderOptions;
import work.lcod.langstring.model.SetLangString;

/**
 * Conversions between raw strings, {@link LangString}, {@link SetLangString} and {@link MultiLangString}.
 *
 * <p>Plural inputs are merged before conversion: tags of one language seen with several casings collapse
 * to the case-folded tag, a single consistent casing is kept as is.
 */
public final class Converter {
    private Converter() {}

    // -- from strings

    public static LangString fromStringToLangString(String method, String input, String lang, String separator) {
        return fromStringToLangString(ConversionMethod.from(method), input, lang, separator);
    }

    public static LangString fromStringToLangString(ConversionMethod method, String input, String lang, String separator) {
        Objects.requireNonNull(method, "method");
        return switch (method) {
            case MANUAL -> fromStringToLangStringManual(input, lang);
            case PARSE -> fromStringToLangStringParse(input, separator);
        };
    }

    public static LangString fromStringToLangStringManual(String input, String lang) {
        return new LangString(input == null ? "" : input, lang == null ? "" : lang);
    }

    public static LangString fromStringToLangStringParse(String input) {
        return fromStringToLangStringParse(input, RenderOptions.DEFAULT_SEPARATOR);
    }

    /**
     * Splits on the last occurrence of {@code separator}. Without a separator (or with an empty one) the
     * whole input is the text and the language is empty.
     */
    public static LangString fromStringToLangStringParse(String input, String separator) {
        Objects.requireNonNull(input, "input");
        String sep = separator == null ? RenderOptions.DEFAULT_SEPARATOR : separator;
        int at = sep.isEmpty() ? -1 : input.lastIndexOf(sep);
        if (at < 0) {
            return new LangString(input, "");
        }
        return new LangString(input.substring(0, at), input.substring(at + sep.length()));
    }

    public static List<LangString> fromStringsToLangStrings(String method, List<String> strings, String lang, String separator) {
        return fromStringsToLangStrings(ConversionMethod.from(method), strings, lang, separator);
    }

    public static List<LangString> fromStringsToLangStrings(ConversionMethod method, List<String> strings, String lang, String separator) {
        requireElements(strings, String.class, "strings");
        List<LangString> result = new ArrayList<>(strings.size());
        for (String string : strings) {
            result.add(fromStringToLangString(method, string, lang, separator));
        }
        return result;
    }

    public static SetLangString fromStringsToSetLangString(List<String> strings, String lang) {
        requireElements(strings, String.class, "strings");
        return new SetLangString(strings, lang == null ? "" : lang);
    }

    public static MultiLangString fromStringsToMultiLangString(String method, List<String> strings, String lang, String separator) {
        return fromStringsToMultiLangString(ConversionMethod.from(method), strings, lang, separator);
    }

    public static MultiLangString fromStringsToMultiLangString(ConversionMethod method, List<String> strings, String lang, String separator) {
        return fromLangStringsToMultiLangString(fromStringsToLangStrings(method, strings, lang, separator));
    }

    // -- from LangString

    public static String fromLangStringToString(LangString arg) {
        return fromLangStringToString(arg, RenderOptions.defaults());
    }

    public static String fromLangStringToString(LangString arg, RenderOptions options) {
        return Objects.requireNonNull(arg, "arg").toString(options);
    }

    public static List<String> fromLangStringsToStrings(List<LangString> arg) {
        return fromLangStringsToStrings(arg, RenderOptions.defaults());
    }

    public static List<String> fromLangStringsToStrings(List<LangString> arg, RenderOptions options) {
        requireElements(arg, LangString.class, "arg");
        List<String> result = new ArrayList<>(arg.size());
        for (LangString langString : arg) {
            result.add(langString.toString(options));
        }
        return result;
    }

    public static SetLangString fromLangStringToSetLangString(LangString arg) {
        Objects.requireNonNull(arg, "arg");
        return new SetLangString(List.of(arg.getText()), arg.getLang(), arg.settings().orElse(null));
    }

    /**
     * Fails with a value error when the inputs span more than one language.
     */
    public static SetLangString fromLangStringsToSetLangString(List<LangString> arg) {
        requireElements(arg, LangString.class, "arg");
        List<LangString> merged = LangString.mergeLangStrings(arg);
        Set<String> texts = new LinkedHashSet<>();
        Set<String> langs = new LinkedHashSet<>();
        for (LangString langString : merged) {
            texts.add(langString.getText());
            langs.add(langString.getLang());
        }
        if (langs.size() > 1) {
            throw LangStringException.valueError(
                "The conversion can only be performed from LangStrings with the same language, got " + langs + "."
            );
        }
        String lang = langs.isEmpty() ? "" : langs.iterator().next();
        return new SetLangString(texts, lang, merged.isEmpty() ? null : merged.get(0).settings().orElse(null));
    }

    /**
     * One collection per language, in first-seen order.
     */
    public static List<SetLangString> fromLangStringsToSetLangStrings(List<LangString> arg) {
        requireElements(arg, LangString.class, "arg");
        List<SetLangString> singles = new ArrayList<>();
        for (LangString langString : LangString.mergeLangStrings(arg)) {
            singles.add(fromLangStringToSetLangString(langString));
        }
        return SetLangString.mergeSetLangStrings(singles);
    }

    /**
     * The preferred language of the result is the entity's language.
     */
    public static MultiLangString fromLangStringToMultiLangString(LangString arg) {
        Objects.requireNonNull(arg, "arg");
        Map<String, Set<String>> entries = new LinkedHashMap<>();
        entries.put(arg.getLang(), Set.of(arg.getText()));
        return new MultiLangString(entries, arg.getLang(), arg.settings().orElse(null));
    }

    /**
     * Settings of the result come from the first input.
     */
    public static MultiLangString fromLangStringsToMultiLangString(List<LangString> arg) {
        requireElements(arg, LangString.class, "arg");
        var result = new MultiLangString(null, null, arg.isEmpty() ? null : arg.get(0).settings().orElse(null));
        for (LangString langString : LangString.mergeLangStrings(arg)) {
            result.addLangString(langString);
        }
        return result;
    }

    // -- from SetLangString

    public static String fromSetLangStringToString(SetLangString arg) {
        return Objects.requireNonNull(arg, "arg").toString();
    }

    public static List<String> fromSetLangStringToStrings(SetLangString arg) {
        return fromSetLangStringToStrings(arg, RenderOptions.defaults());
    }

    public static List<String> fromSetLangStringToStrings(SetLangString arg, RenderOptions options) {
        return Objects.requireNonNull(arg, "arg").toStrings(options);
    }

    public static List<String> fromSetLangStringsToStrings(List<SetLangString> arg) {
        return fromSetLangStringsToStrings(arg, RenderOptions.defaults());
    }

    public static List<String> fromSetLangStringsToStrings(List<SetLangString> arg, RenderOptions options) {
        requireElements(arg, SetLangString.class, "arg");
        List<String> result = new ArrayList<>();
        for (SetLangString setLangString : SetLangString.mergeSetLangStrings(arg)) {
            result.addAll(setLangString.toStrings(options));
        }
        return result;
    }

    public static List<LangString> fromSetLangStringToLangStrings(SetLangString arg) {
        return Objects.requireNonNull(arg, "arg").toLangStrings();
    }

    public static List<LangString> fromSetLangStringsToLangStrings(List<SetLangString> arg) {
        requireElements(arg, SetLangString.class, "arg");
        List<LangString> result = new ArrayList<>();
        for (SetLangString setLangString : SetLangString.mergeSetLangStrings(arg)) {
            result.addAll(setLangString.toLangStrings());
        }
        return result;
    }

    public static MultiLangString fromSetLangStringToMultiLangString(SetLangString arg) {
        Objects.requireNonNull(arg, "arg");
        var result = new MultiLangString(null, null, arg.settings().orElse(null));
        result.addSetLangString(arg);
        return result;
    }

    /**
     * Settings of the result come from the first input.
     */
    public static MultiLangString fromSetLangStringsToMultiLangString(List<SetLangString> arg) {
        requireElements(arg, SetLangString.class, "arg");
        var result = new MultiLangString(null, null, arg.isEmpty() ? null : arg.get(0).settings().orElse(null));
        for (SetLangString setLangString : SetLangString.mergeSetLangStrings(arg)) {
            result.addSetLangString(setLangString);
        }
        return result;
    }

    // -- from MultiLangString

    public static String fromMultiLangStringToString(MultiLangString arg) {
        return Objects.requireNonNull(arg, "arg").toString();
    }

    public static List<String> fromMultiLangStringToStrings(MultiLangString arg) {
        return fromMultiLangStringToStrings(arg, null, RenderOptions.defaults());
    }

    /**
     * @param langs languages to include, {@code null} for all
     */
    public static List<String> fromMultiLangStringToStrings(MultiLangString arg, List<String> langs, RenderOptions options) {
        return Objects.requireNonNull(arg, "arg").toStrings(langs, options);
    }

    public static List<String> fromMultiLangStringsToStrings(List<MultiLangString> arg, List<String> langs, RenderOptions options) {
        requireElements(arg, MultiLangString.class, "arg");
        return MultiLangString.mergeMultiLangStrings(arg).toStrings(langs, options);
    }

    public static List<LangString> fromMultiLangStringToLangStrings(MultiLangString arg, List<String> langs) {
        return Objects.requireNonNull(arg, "arg").toLangStrings(langs);
    }

    public static List<LangString> fromMultiLangStringsToLangStrings(List<MultiLangString> arg, List<String> langs) {
        requireElements(arg, MultiLangString.class, "arg");
        return MultiLangString.mergeMultiLangStrings(arg).toLangStrings(langs);
    }

    public static List<SetLangString> fromMultiLangStringToSetLangStrings(MultiLangString arg, List<String> langs) {
        return Objects.requireNonNull(arg, "arg").toSetLangStrings(langs);
    }

    public static List<SetLangString> fromMultiLangStringsToSetLangStrings(List<MultiLangString> arg, List<String> langs) {
        requireElements(arg, MultiLangString.class, "arg");
        return MultiLangString.mergeMultiLangStrings(arg).toSetLangStrings(langs);
    }

    // -- generic dispatch

    /**
     * Flattens any entity, or a list of entities of one kind, into {@code LangString}s.
     */
    public static List<LangString> toLangStrings(Object arg) {
        if (arg instanceof LangString langString) {
            return new ArrayList<>(List.of(langString));
        }
        if (arg instanceof SetLangString setLangString) {
            return fromSetLangStringToLangStrings(setLangString);
        }
        if (arg instanceof MultiLangString multiLangString) {
            return fromMultiLangStringToLangStrings(multiLangString, null);
        }
        if (arg instanceof List<?> list) {
            return switch (elementKind(list)) {
                case LANG_STRING -> LangString.mergeLangStrings(cast(list, LangString.class));
                case SET_LANG_STRING -> fromSetLangStringsToLangStrings(cast(list, SetLangString.class));
                case MULTI_LANG_STRING -> fromMultiLangStringsToLangStrings(cast(list, MultiLangString.class), null);
                case EMPTY -> new ArrayList<>();
            };
        }
        throw unsupported(arg);
    }

    public static List<SetLangString> toSetLangStrings(Object arg) {
        if (arg instanceof LangString langString) {
            return new ArrayList<>(List.of(fromLangStringToSetLangString(langString)));
        }
        if (arg instanceof SetLangString setLangString) {
            return new ArrayList<>(List.of(setLangString.copy()));
        }
        if (arg instanceof MultiLangString multiLangString) {
            return fromMultiLangStringToSetLangStrings(multiLangString, null);
        }
        if (arg instanceof List<?> list) {
            return switch (elementKind(list)) {
                case LANG_STRING -> fromLangStringsToSetLangStrings(cast(list, LangString.class));
                case SET_LANG_STRING -> SetLangString.mergeSetLangStrings(cast(list, SetLangString.class));
                case MULTI_LANG_STRING -> fromMultiLangStringsToSetLangStrings(cast(list, MultiLangString.class), null);
                case EMPTY -> new ArrayList<>();
            };
        }
        throw unsupported(arg);
    }

    public static MultiLangString toMultiLangString(Object arg) {
        if (arg instanceof LangString langString) {
            return fromLangStringToMultiLangString(langString);
        }
        if (arg instanceof SetLangString setLangString) {
            return fromSetLangStringToMultiLangString(setLangString);
        }
        if (arg instanceof MultiLangString multiLangString) {
            return MultiLangString.mergeMultiLangStrings(List.of(multiLangString));
        }
        if (arg instanceof List<?> list) {
            return switch (elementKind(list)) {
                case LANG_STRING -> fromLangStringsToMultiLangString(cast(list, LangString.class));
                case SET_LANG_STRING -> fromSetLangStringsToMultiLangString(cast(list, SetLangString.class));
                case MULTI_LANG_STRING -> MultiLangString.mergeMultiLangStrings(cast(list, MultiLangString.class));
                case EMPTY -> new MultiLangString();
            };
        }
        throw unsupported(arg);
    }

    private enum ElementKind {
        EMPTY,
        LANG_STRING,
        SET_LANG_STRING,
        MULTI_LANG_STRING
    }

    private static ElementKind elementKind(List<?> list) {
        if (list.isEmpty()) {
            return ElementKind.EMPTY;
        }
        Object first = list.get(0);
        ElementKind kind;
        if (first instanceof LangString) {
            kind = ElementKind.LANG_STRING;
        } else if (first instanceof SetLangString) {
            kind = ElementKind.SET_LANG_STRING;
        } else if (first instanceof MultiLangString) {
            kind = ElementKind.MULTI_LANG_STRING;
        } else {
            throw unsupported(first);
        }
        for (Object element : list) {
            if (element == null || element.getClass() != first.getClass()) {
                throw LangStringException.unexpectedType(element, "'" + first.getClass().getSimpleName() + "' like the other list elements");
            }
        }
        return kind;
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> cast(List<?> list, Class<T> type) {
        return (List<T>) list;
    }

    private static LangStringException unsupported(Object arg) {
        return LangStringException.unexpectedType(arg, "'LangString', 'SetLangString', 'MultiLangString' or a list of them");
    }

    private static void requireElements(List<?> values, Class<?> type, String name) {
        if (values == null) {
            throw LangStringException.unexpectedType(null, "a list for '" + name + "'");
        }
        for (Object value : values) {
            if (!type.isInstance(value)) {
                throw LangStringException.unexpectedType(value, "'" + type.getSimpleName() + "' in '" + name + "'");
            }
        }
    }
}
