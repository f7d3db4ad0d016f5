package work.lcod.langstring.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.langstring.LangStringException;
import work.lcod.langstring.control.FlagNamespace;
import work.lcod.langstring.control.FlagSettings;
import work.lcod.langstring.control.GlobalFlag;
import work.lcod.langstring.shared.TextOps;
import work.lcod.langstring.validation.FlagValidator;

/**
 * Unique texts sharing one language tag, validated against the {@code SetLangStringFlag} namespace.
 */
public final class SetLangString implements SetAlgebra<SetLangString>, Iterable<String> {
    private static final FlagNamespace NAMESPACE = FlagNamespace.SET_LANG_STRING;

    private final FlagSettings settings;
    private Set<String> texts;
    private String lang;

    public SetLangString() {
        this(null, "", null);
    }

    public SetLangString(Collection<String> texts, String lang) {
        this(texts, lang, null);
    }

    public SetLangString(Collection<String> texts, String lang, FlagSettings settings) {
        this.settings = settings;
        FlagValidator validator = validator();
        Set<String> validTexts = validateTexts(validator, texts);
        this.lang = validator.validateLanguage(lang);
        this.texts = validTexts;
    }

    public Set<String> getTexts() {
        return Collections.unmodifiableSet(texts);
    }

    public void setTexts(Collection<String> texts) {
        this.texts = validateTexts(validator(), texts);
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

    private static Set<String> validateTexts(FlagValidator validator, Collection<?> candidates) {
        Set<String> valid = new LinkedHashSet<>();
        if (candidates != null) {
            for (Object candidate : candidates) {
                if (!(candidate instanceof String)) {
                    throw LangStringException.unexpectedType(candidate, "'String' in texts");
                }
                valid.add(validator.validateText(candidate));
            }
        }
        return valid;
    }

    private SetLangString derive(Collection<String> values) {
        return new SetLangString(values, lang, settings);
    }

    // -- element operations

    public void add(Object element) {
        if (element instanceof String text) {
            addText(text);
        } else if (element instanceof LangString langString) {
            addLangString(langString);
        } else if (element instanceof SetLangString other) {
            addSetLangString(other);
        } else {
            throw LangStringException.unexpectedType(element, "'String', 'LangString' or 'SetLangString'");
        }
    }

    public void addText(String text) {
        texts.add(validator().validateText(Objects.requireNonNull(text, "text")));
    }

    public void addLangString(LangString langString) {
        requireSameLang(langString.getLang(), "LangString");
        texts.add(validator().validateText(langString.getText()));
    }

    public void addSetLangString(SetLangString other) {
        requireSameLang(other.lang, "SetLangString");
        FlagValidator validator = validator();
        List<String> added = new ArrayList<>(other.texts.size());
        for (String text : other.texts) {
            added.add(validator.validateText(text));
        }
        texts.addAll(added);
    }

    public void discard(Object element) {
        if (element instanceof String text) {
            discardText(text);
        } else if (element instanceof LangString langString) {
            discardLangString(langString);
        } else if (element instanceof SetLangString other) {
            discardSetLangString(other);
        } else {
            throw LangStringException.unexpectedType(element, "'String', 'LangString' or 'SetLangString'");
        }
    }

    public void discardText(String text) {
        texts.remove(text);
    }

    public void discardLangString(LangString langString) {
        requireSameLang(langString.getLang(), "LangString");
        texts.remove(langString.getText());
    }

    public void discardSetLangString(SetLangString other) {
        requireSameLang(other.lang, "SetLangString");
        texts.removeAll(other.texts);
    }

    public void remove(Object element) {
        if (element instanceof String text) {
            removeText(text);
        } else if (element instanceof LangString langString) {
            removeLangString(langString);
        } else if (element instanceof SetLangString other) {
            removeSetLangString(other);
        } else {
            throw LangStringException.unexpectedType(element, "'String', 'LangString' or 'SetLangString'");
        }
    }

    public void removeText(String text) {
        if (!texts.remove(text)) {
            throw notFound(text);
        }
    }

    public void removeLangString(LangString langString) {
        requireSameLang(langString.getLang(), "LangString");
        removeText(langString.getText());
    }

    public void removeSetLangString(SetLangString other) {
        requireSameLang(other.lang, "SetLangString");
        for (String text : other.texts) {
            if (!texts.contains(text)) {
                throw notFound(text);
            }
        }
        texts.removeAll(other.texts);
    }

    private LangStringException notFound(String text) {
        return LangStringException.notFound("Entry '" + text + "@" + lang + "' not found in SetLangString.");
    }

    public void clear() {
        texts.clear();
    }

    public SetLangString copy() {
        return derive(texts);
    }

    /**
     * Removes and returns an arbitrary text.
     */
    public String pop() {
        Iterator<String> iterator = texts.iterator();
        if (!iterator.hasNext()) {
            throw LangStringException.notFound("pop from an empty SetLangString");
        }
        String text = iterator.next();
        iterator.remove();
        return text;
    }

    public int size() {
        return texts.size();
    }

    public boolean isEmpty() {
        return texts.isEmpty();
    }

    public boolean contains(String text) {
        requireRawAllowed(text);
        return texts.contains(text);
    }

    public boolean contains(LangString langString) {
        requireSameLang(langString.getLang(), "LangString");
        return texts.contains(langString.getText());
    }

    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableSet(texts).iterator();
    }

    // -- set algebra

    @Override
    public SetLangString union(SetLangString other) {
        var result = new LinkedHashSet<>(texts);
        result.addAll(textsOf(other));
        return derive(result);
    }

    @Override
    public SetLangString union(Collection<String> other) {
        var result = new LinkedHashSet<>(texts);
        result.addAll(textsOf(other));
        return derive(result);
    }

    @Override
    public SetLangString intersection(SetLangString other) {
        var result = new LinkedHashSet<>(texts);
        result.retainAll(textsOf(other));
        return derive(result);
    }

    @Override
    public SetLangString intersection(Collection<String> other) {
        var result = new LinkedHashSet<>(texts);
        result.retainAll(textsOf(other));
        return derive(result);
    }

    @Override
    public SetLangString difference(SetLangString other) {
        var result = new LinkedHashSet<>(texts);
        result.removeAll(textsOf(other));
        return derive(result);
    }

    @Override
    public SetLangString difference(Collection<String> other) {
        var result = new LinkedHashSet<>(texts);
        result.removeAll(textsOf(other));
        return derive(result);
    }

    @Override
    public SetLangString symmetricDifference(SetLangString other) {
        return derive(symmetric(textsOf(other)));
    }

    @Override
    public SetLangString symmetricDifference(Collection<String> other) {
        return derive(symmetric(textsOf(other)));
    }

    private Set<String> symmetric(Collection<String> other) {
        var result = new LinkedHashSet<>(texts);
        for (String text : other) {
            if (!result.remove(text)) {
                result.add(text);
            }
        }
        return result;
    }

    @Override
    public void unionUpdate(SetLangString other) {
        texts = union(other).texts;
    }

    @Override
    public void intersectionUpdate(SetLangString other) {
        texts.retainAll(textsOf(other));
    }

    @Override
    public void differenceUpdate(SetLangString other) {
        texts.removeAll(textsOf(other));
    }

    @Override
    public void symmetricDifferenceUpdate(SetLangString other) {
        texts = symmetricDifference(other).texts;
    }

    @Override
    public boolean isSubset(SetLangString other) {
        return textsOf(other).containsAll(texts);
    }

    public boolean isSubset(Collection<String> other) {
        return textsOf(other).containsAll(texts);
    }

    @Override
    public boolean isSuperset(SetLangString other) {
        return texts.containsAll(textsOf(other));
    }

    public boolean isSuperset(Collection<String> other) {
        return texts.containsAll(textsOf(other));
    }

    @Override
    public boolean isProperSubset(SetLangString other) {
        return isSubset(other) && other.texts.size() > texts.size();
    }

    @Override
    public boolean isProperSuperset(SetLangString other) {
        return isSuperset(other) && texts.size() > other.texts.size();
    }

    @Override
    public boolean isDisjoint(SetLangString other) {
        return Collections.disjoint(texts, textsOf(other));
    }

    public boolean isDisjoint(Collection<String> other) {
        return Collections.disjoint(texts, textsOf(other));
    }

    private Set<String> textsOf(SetLangString other) {
        Objects.requireNonNull(other, "other");
        requireSameLang(other.lang, "SetLangString");
        return other.texts;
    }

    private Set<String> textsOf(Collection<String> other) {
        Objects.requireNonNull(other, "other");
        requireRawAllowed(other);
        Set<String> values = new LinkedHashSet<>();
        for (Object value : other) {
            if (!(value instanceof String text)) {
                throw LangStringException.unexpectedType(value, "'String'");
            }
            values.add(text);
        }
        return values;
    }

    private void requireSameLang(String otherLang, String otherType) {
        if (!LanguageTags.matches(lang, otherLang)) {
            throw LangStringException.valueError(
                "Operation cannot be performed. Incompatible languages between SetLangString and " + otherType
                    + " object ('" + lang + "' and '" + otherLang + "')."
            );
        }
    }

    private void requireRawAllowed(Object operand) {
        if (operand == null) {
            throw LangStringException.unexpectedType(null, "'String' or 'LangString'");
        }
        if (validator().enabled(GlobalFlag.METHODS_MATCH_TYPES)) {
            throw LangStringException.typeError(
                "'" + NAMESPACE.typeName() + ".METHODS_MATCH_TYPES' is enabled. Operand must be of type SetLangString or LangString."
            );
        }
    }

    // -- conversion and rendering

    public List<LangString> toLangStrings() {
        List<LangString> result = new ArrayList<>(texts.size());
        for (String text : sortedTexts()) {
            result.add(new LangString(text, lang, settings));
        }
        return result;
    }

    public List<String> toStrings() {
        return toStrings(RenderOptions.defaults());
    }

    public List<String> toStrings(RenderOptions options) {
        Objects.requireNonNull(options, "options");
        FlagValidator validator = validator();
        boolean quotes = validator.enabled(GlobalFlag.PRINT_WITH_QUOTES);
        boolean printLang = validator.enabled(GlobalFlag.PRINT_WITH_LANG);
        return texts.stream()
            .map(text -> options.render(text, lang, quotes, printLang))
            .sorted()
            .collect(Collectors.toList());
    }

    List<String> sortedTexts() {
        return texts.stream().sorted().collect(Collectors.toList());
    }

    /**
     * Sorted texts in braces followed by the tag, e.g. {@code {'Hello', 'Hi'}@en}.
     */
    @Override
    public String toString() {
        FlagValidator validator = validator();
        return render(sortedTexts(), lang, validator.enabled(GlobalFlag.PRINT_WITH_QUOTES), validator.enabled(GlobalFlag.PRINT_WITH_LANG));
    }

    static String render(List<String> sortedTexts, String lang, boolean quotes, boolean printLang) {
        String body = sortedTexts.stream()
            .map(text -> quotes ? "'" + text + "'" : text)
            .collect(Collectors.joining(", ", "{", "}"));
        return printLang && !lang.isEmpty() ? body + "@" + lang : body;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SetLangString that
            && texts.equals(that.texts)
            && LanguageTags.matches(lang, that.lang);
    }

    @Override
    public int hashCode() {
        return Objects.hash(texts, TextOps.casefold(lang));
    }

    /**
     * Unions collections whose tags differ only by case into one collection per language, in first-seen
     * order. A language seen with several casings gets the case-folded tag. The inputs are not modified.
     */
    public static List<SetLangString> mergeSetLangStrings(List<SetLangString> setLangStrings) {
        Objects.requireNonNull(setLangStrings, "setLangStrings");
        List<String> tags = new ArrayList<>();
        for (SetLangString setLangString : setLangStrings) {
            if (setLangString == null) {
                throw LangStringException.unexpectedType(null, "'SetLangString'");
            }
            tags.add(setLangString.lang);
        }
        Map<String, String> chosen = LanguageTags.reconcile(tags);
        Map<String, Set<String>> texts = new LinkedHashMap<>();
        Map<String, FlagSettings> settings = new LinkedHashMap<>();
        for (SetLangString setLangString : setLangStrings) {
            String key = TextOps.casefold(setLangString.lang);
            texts.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).addAll(setLangString.texts);
            if (!settings.containsKey(key)) {
                settings.put(key, setLangString.settings);
            }
        }
        List<SetLangString> merged = new ArrayList<>(texts.size());
        texts.forEach((key, values) -> merged.add(new SetLangString(values, chosen.get(key), settings.get(key))));
        return merged;
    }
}
