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
 * Texts grouped by language tag, plus a preferred language used as the default lookup key.
 *
 * <p>Tags are matched case-insensitively against the registered keys, so {@code "EN"} finds entries stored
 * under {@code "en"}. Equality and hashing only consider the entries, with case-folded keys.
 *
 * <p>Entry arguments given as {@link Map.Entry} are read as {@code text -> lang}, e.g.
 * {@code Map.entry("Hello", "en")}.
 */
public final class MultiLangString implements Iterable<String> {
    public static final String DEFAULT_PREF_LANG = "en";

    private static final FlagNamespace NAMESPACE = FlagNamespace.MULTI_LANG_STRING;
    private static final String ACCEPTED = "'Map.Entry<String, String>', 'LangString', 'SetLangString' or 'MultiLangString'";

    private final FlagSettings settings;
    private Map<String, Set<String>> entries;
    private String prefLang;

    public MultiLangString() {
        this(null, DEFAULT_PREF_LANG, null);
    }

    public MultiLangString(Map<String, ? extends Collection<String>> entries) {
        this(entries, DEFAULT_PREF_LANG, null);
    }

    public MultiLangString(Map<String, ? extends Collection<String>> entries, String prefLang) {
        this(entries, prefLang, null);
    }

    /**
     * @param entries  initial texts per tag; tags differing only by case are merged
     * @param prefLang preferred language, {@value #DEFAULT_PREF_LANG} when {@code null}
     * @param settings flags to validate and render with; {@code null} follows the live
     *                 {@link work.lcod.langstring.control.Controller} state
     */
    public MultiLangString(Map<String, ? extends Collection<String>> entries, String prefLang, FlagSettings settings) {
        this.settings = settings;
        FlagValidator validator = validator();
        Map<String, Set<String>> validEntries = validateEntries(validator, entries);
        this.prefLang = validator.validateLanguage(prefLang == null ? DEFAULT_PREF_LANG : prefLang);
        this.entries = validEntries;
    }

    /**
     * Unmodifiable deep copy of the entries.
     */
    public Map<String, Set<String>> entries() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        entries.forEach((lang, texts) -> copy.put(lang, Collections.unmodifiableSet(new LinkedHashSet<>(texts))));
        return Collections.unmodifiableMap(copy);
    }

    public void setEntries(Map<String, ? extends Collection<String>> entries) {
        this.entries = validateEntries(validator(), entries);
    }

    public String getPrefLang() {
        return prefLang;
    }

    public void setPrefLang(String prefLang) {
        this.prefLang = validator().validateLanguage(prefLang == null ? DEFAULT_PREF_LANG : prefLang);
    }

    public Optional<FlagSettings> settings() {
        return Optional.ofNullable(settings);
    }

    FlagValidator validator() {
        return FlagValidator.of(NAMESPACE, settings);
    }

    private static Map<String, Set<String>> validateEntries(FlagValidator validator, Map<String, ? extends Collection<String>> raw) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        if (raw == null) {
            return result;
        }
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : raw.entrySet()) {
            Object key = entry.getKey();
            if (!(key instanceof String)) {
                throw LangStringException.unexpectedType(key, "'String' as language key");
            }
            if (entry.getValue() == null) {
                throw LangStringException.unexpectedType(null, "a collection of texts for '" + key + "'");
            }
            keys.add((String) key);
        }
        Map<String, String> chosen = LanguageTags.reconcile(keys);
        for (Map.Entry<String, ? extends Collection<String>> entry : raw.entrySet()) {
            String lang = validator.validateLanguage(chosen.get(TextOps.casefold(entry.getKey())));
            String registered = registeredIn(result, lang).orElse(lang);
            Set<String> texts = result.computeIfAbsent(registered, ignored -> new LinkedHashSet<>());
            for (Object text : entry.getValue()) {
                if (!(text instanceof String)) {
                    throw LangStringException.unexpectedType(text, "'String' in texts of '" + entry.getKey() + "'");
                }
                texts.add(validator.validateText(text));
            }
        }
        return result;
    }

    private static Optional<String> registeredIn(Map<String, Set<String>> entries, String lang) {
        String folded = TextOps.casefold(lang);
        for (String key : entries.keySet()) {
            if (TextOps.casefold(key).equals(folded)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    private Optional<String> registered(String lang) {
        return registeredIn(entries, lang == null ? "" : lang);
    }

    // -- add

    public void add(Object arg) {
        if (arg instanceof LangString langString) {
            addLangString(langString);
        } else if (arg instanceof SetLangString setLangString) {
            addSetLangString(setLangString);
        } else if (arg instanceof MultiLangString multiLangString) {
            addMultiLangString(multiLangString);
        } else if (arg instanceof Map.Entry<?, ?> entry) {
            addEntry(entryText(entry), entryLang(entry));
        } else {
            throw LangStringException.unexpectedType(arg, ACCEPTED);
        }
    }

    public void addEntry(String text, String lang) {
        FlagValidator validator = validator();
        String validText = validator.validateText(text);
        String validLang = validator.validateLanguage(lang);
        slot(validLang).add(validText);
    }

    public void addTextInPrefLang(String text) {
        addEntry(text, prefLang);
    }

    public void addLangString(LangString langString) {
        Objects.requireNonNull(langString, "langString");
        addEntry(langString.getText(), langString.getLang());
    }

    /**
     * Adds every text of the collection; the language is registered even if the collection is empty.
     */
    public void addSetLangString(SetLangString setLangString) {
        Objects.requireNonNull(setLangString, "setLangString");
        FlagValidator validator = validator();
        String validLang = validator.validateLanguage(setLangString.getLang());
        List<String> validTexts = validateAll(validator, setLangString.getTexts());
        slot(validLang).addAll(validTexts);
    }

    public void addMultiLangString(MultiLangString other) {
        Objects.requireNonNull(other, "other");
        FlagValidator validator = validator();
        Map<String, List<String>> staged = new LinkedHashMap<>();
        other.entries.forEach((lang, texts) -> staged
            .computeIfAbsent(validator.validateLanguage(lang), ignored -> new ArrayList<>())
            .addAll(validateAll(validator, texts)));
        staged.forEach((lang, texts) -> slot(lang).addAll(texts));
    }

    public void addEmptyLang(String lang) {
        slot(validator().validateLanguage(lang));
    }

    private Set<String> slot(String validLang) {
        String key = registered(validLang).orElse(validLang);
        return entries.computeIfAbsent(key, ignored -> new LinkedHashSet<>());
    }

    private static List<String> validateAll(FlagValidator validator, Collection<String> texts) {
        List<String> valid = new ArrayList<>(texts.size());
        for (String text : texts) {
            valid.add(validator.validateText(text));
        }
        return valid;
    }

    // -- discard

    public void discard(Object arg) {
        discard(arg, false);
    }

    public void discard(Object arg, boolean cleanEmpty) {
        if (arg instanceof LangString langString) {
            discardLangString(langString, cleanEmpty);
        } else if (arg instanceof SetLangString setLangString) {
            discardSetLangString(setLangString, cleanEmpty);
        } else if (arg instanceof MultiLangString multiLangString) {
            discardMultiLangString(multiLangString, cleanEmpty);
        } else if (arg instanceof Map.Entry<?, ?> entry) {
            discardEntry(entryText(entry), entryLang(entry), cleanEmpty);
        } else {
            throw LangStringException.unexpectedType(arg, ACCEPTED);
        }
    }

    public void discardEntry(String text, String lang) {
        discardEntry(text, lang, false);
    }

    /**
     * Removes the text if present. With {@code cleanEmpty} the language is dropped once it has no texts left.
     */
    public void discardEntry(String text, String lang, boolean cleanEmpty) {
        Objects.requireNonNull(text, "text");
        registered(lang).ifPresent(key -> {
            Set<String> texts = entries.get(key);
            if (texts.remove(text) && texts.isEmpty() && cleanEmpty) {
                entries.remove(key);
            }
        });
    }

    public void discardTextInPrefLang(String text) {
        discardTextInPrefLang(text, false);
    }

    public void discardTextInPrefLang(String text, boolean cleanEmpty) {
        discardEntry(text, prefLang, cleanEmpty);
    }

    public void discardLangString(LangString langString) {
        discardLangString(langString, false);
    }

    public void discardLangString(LangString langString, boolean cleanEmpty) {
        Objects.requireNonNull(langString, "langString");
        discardEntry(langString.getText(), langString.getLang(), cleanEmpty);
    }

    public void discardSetLangString(SetLangString setLangString) {
        discardSetLangString(setLangString, false);
    }

    public void discardSetLangString(SetLangString setLangString, boolean cleanEmpty) {
        Objects.requireNonNull(setLangString, "setLangString");
        for (String text : setLangString.getTexts()) {
            discardEntry(text, setLangString.getLang(), cleanEmpty);
        }
    }

    public void discardMultiLangString(MultiLangString other) {
        discardMultiLangString(other, false);
    }

    public void discardMultiLangString(MultiLangString other, boolean cleanEmpty) {
        Objects.requireNonNull(other, "other");
        for (Map.Entry<String, Set<String>> entry : other.entries().entrySet()) {
            for (String text : entry.getValue()) {
                discardEntry(text, entry.getKey(), cleanEmpty);
            }
        }
    }

    /**
     * Drops the language and its texts; does nothing when it is absent.
     */
    public void discardLang(String lang) {
        registered(lang).ifPresent(entries::remove);
    }

    // -- remove

    public void remove(Object arg) {
        remove(arg, true);
    }

    public void remove(Object arg, boolean cleanEmpty) {
        if (arg instanceof LangString langString) {
            removeLangString(langString, cleanEmpty);
        } else if (arg instanceof SetLangString setLangString) {
            removeSetLangString(setLangString, cleanEmpty);
        } else if (arg instanceof MultiLangString multiLangString) {
            removeMultiLangString(multiLangString, cleanEmpty);
        } else if (arg instanceof Map.Entry<?, ?> entry) {
            removeEntry(entryText(entry), entryLang(entry), cleanEmpty);
        } else {
            throw LangStringException.unexpectedType(arg, ACCEPTED);
        }
    }

    /**
     * Removes the text and, since {@code cleanEmpty} defaults to {@code true} here, the language once empty.
     */
    public void removeEntry(String text, String lang) {
        removeEntry(text, lang, true);
    }

    public void removeEntry(String text, String lang, boolean cleanEmpty) {
        requireEntry(text, lang);
        discardEntry(text, lang, cleanEmpty);
    }

    public void removeTextInPrefLang(String text) {
        removeTextInPrefLang(text, true);
    }

    public void removeTextInPrefLang(String text, boolean cleanEmpty) {
        removeEntry(text, prefLang, cleanEmpty);
    }

    public void removeLangString(LangString langString) {
        removeLangString(langString, true);
    }

    public void removeLangString(LangString langString, boolean cleanEmpty) {
        Objects.requireNonNull(langString, "langString");
        removeEntry(langString.getText(), langString.getLang(), cleanEmpty);
    }

    public void removeSetLangString(SetLangString setLangString) {
        removeSetLangString(setLangString, true);
    }

    public void removeSetLangString(SetLangString setLangString, boolean cleanEmpty) {
        Objects.requireNonNull(setLangString, "setLangString");
        for (String text : setLangString.getTexts()) {
            requireEntry(text, setLangString.getLang());
        }
        discardSetLangString(setLangString, cleanEmpty);
    }

    public void removeMultiLangString(MultiLangString other) {
        removeMultiLangString(other, true);
    }

    public void removeMultiLangString(MultiLangString other, boolean cleanEmpty) {
        Objects.requireNonNull(other, "other");
        other.entries.forEach((lang, texts) -> texts.forEach(text -> requireEntry(text, lang)));
        discardMultiLangString(other, cleanEmpty);
    }

    public void removeLang(String lang) {
        String key = registered(lang).orElseThrow(
            () -> LangStringException.notFound("Lang '" + lang + "' not found in the MultiLangString.")
        );
        entries.remove(key);
    }

    public void removeEmptyLangs() {
        entries.values().removeIf(Set::isEmpty);
    }

    private void requireEntry(String text, String lang) {
        if (!containsEntry(text, lang)) {
            throw LangStringException.notFound("Entry '" + text + "@" + lang + "' not found in the MultiLangString.");
        }
    }

    // -- counts

    public int countEntriesByLang(String lang) {
        return registered(lang).map(key -> entries.get(key).size()).orElse(0);
    }

    public Map<String, Integer> countEntriesPerLang() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        entries.forEach((lang, texts) -> counts.put(lang, texts.size()));
        return counts;
    }

    public int countEntriesTotal() {
        return entries.values().stream().mapToInt(Set::size).sum();
    }

    public int countLangsTotal() {
        return entries.size();
    }

    // -- contains

    public boolean contains(Object arg) {
        if (arg instanceof LangString langString) {
            return containsLangString(langString);
        }
        if (arg instanceof SetLangString setLangString) {
            return containsSetLangString(setLangString);
        }
        if (arg instanceof MultiLangString multiLangString) {
            return containsMultiLangString(multiLangString);
        }
        if (arg instanceof Map.Entry<?, ?> entry) {
            return containsEntry(entryText(entry), entryLang(entry));
        }
        throw LangStringException.unexpectedType(arg, ACCEPTED);
    }

    public boolean containsEntry(String text, String lang) {
        Objects.requireNonNull(text, "text");
        return registered(lang).map(key -> entries.get(key).contains(text)).orElse(false);
    }

    public boolean containsLang(String lang) {
        return registered(lang).isPresent();
    }

    public boolean containsTextInPrefLang(String text) {
        return containsEntry(text, prefLang);
    }

    public boolean containsTextInAnyLang(String text) {
        Objects.requireNonNull(text, "text");
        return entries.values().stream().anyMatch(texts -> texts.contains(text));
    }

    public boolean containsLangString(LangString langString) {
        Objects.requireNonNull(langString, "langString");
        return containsEntry(langString.getText(), langString.getLang());
    }

    /**
     * True when every text of the collection is present under its language. An empty collection only needs
     * its language to be registered.
     */
    public boolean containsSetLangString(SetLangString setLangString) {
        Objects.requireNonNull(setLangString, "setLangString");
        if (!containsLang(setLangString.getLang())) {
            return false;
        }
        return setLangString.getTexts().stream().allMatch(text -> containsEntry(text, setLangString.getLang()));
    }

    public boolean containsMultiLangString(MultiLangString other) {
        Objects.requireNonNull(other, "other");
        for (Map.Entry<String, Set<String>> entry : other.entries.entrySet()) {
            if (!containsLang(entry.getKey())) {
                return false;
            }
            for (String text : entry.getValue()) {
                if (!containsEntry(text, entry.getKey())) {
                    return false;
                }
            }
        }
        return true;
    }

    // -- get

    public List<String> getLangs() {
        return getLangs(false);
    }

    public List<String> getLangs(boolean casefold) {
        return entries.keySet().stream()
            .map(lang -> casefold ? TextOps.casefold(lang) : lang)
            .collect(Collectors.toList());
    }

    /**
     * Every text of every language, sorted.
     */
    public List<String> getTexts() {
        return entries.values().stream().flatMap(Set::stream).sorted().collect(Collectors.toList());
    }

    public Optional<LangString> getLangString(String text, String lang) {
        if (!containsEntry(text, lang)) {
            return Optional.empty();
        }
        return Optional.of(new LangString(text, registered(lang).orElse(lang), settings));
    }

    /**
     * Texts of the language as a collection; empty when the language is absent.
     */
    public SetLangString getSetLangString(String lang) {
        Optional<String> key = registered(lang);
        if (key.isEmpty()) {
            return new SetLangString(null, lang, settings);
        }
        return new SetLangString(entries.get(key.get()), key.get(), settings);
    }

    public SetLangString getSetLangStringPrefLang() {
        return getSetLangString(prefLang);
    }

    /**
     * New collection restricted to the given languages; absent ones are skipped.
     */
    public MultiLangString getMultiLangString(List<String> langs) {
        Objects.requireNonNull(langs, "langs");
        var result = new MultiLangString(null, prefLang, settings);
        for (String lang : langs) {
            registered(lang).ifPresent(key -> result.addSetLangString(getSetLangString(key)));
        }
        return result;
    }

    /**
     * Sorted raw texts of one language.
     */
    public List<String> getStringsLang(String lang) {
        return registered(lang).map(key -> entries.get(key).stream().sorted().collect(Collectors.toList()))
            .orElseGet(ArrayList::new);
    }

    public List<String> getStringsPrefLang() {
        return getStringsLang(prefLang);
    }

    /**
     * Canonical strings of every entry, e.g. {@code "Hello"@en}, sorted.
     */
    public List<String> getStringsAll() {
        return toStrings(null, RenderOptions.defaults());
    }

    public List<LangString> getLangStringsLang(String lang) {
        return toLangStrings(List.of(lang));
    }

    public List<LangString> getLangStringsPrefLang() {
        return getLangStringsLang(prefLang);
    }

    public List<LangString> getLangStringsAll() {
        return toLangStrings(null);
    }

    public boolean hasPrefLangEntries() {
        return registered(prefLang).map(key -> !entries.get(key).isEmpty()).orElse(false);
    }

    // -- pop

    /**
     * Removes the entry and returns it; empty when absent. The language stays registered.
     */
    public Optional<LangString> popLangString(String text, String lang) {
        Optional<LangString> found = getLangString(text, lang);
        found.ifPresent(ignored -> discardEntry(text, lang, false));
        return found;
    }

    public Optional<SetLangString> popSetLangString(String lang) {
        if (!containsLang(lang)) {
            return Optional.empty();
        }
        SetLangString found = getSetLangString(lang);
        discardLang(lang);
        return Optional.of(found);
    }

    public MultiLangString popMultiLangString(List<String> langs) {
        MultiLangString found = getMultiLangString(langs);
        langs.forEach(this::discardLang);
        return found;
    }

    // -- indexed access

    /**
     * Texts registered for the language; fails with a not-found error when the language is absent.
     */
    public Set<String> textsOf(String lang) {
        String key = registered(lang).orElseThrow(
            () -> LangStringException.notFound("Lang '" + lang + "' not found in the MultiLangString.")
        );
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.get(key)));
    }

    /**
     * Replaces every text of the language, registering it if needed.
     */
    public void putTexts(String lang, Collection<String> texts) {
        Objects.requireNonNull(texts, "texts");
        FlagValidator validator = validator();
        String validLang = validator.validateLanguage(lang);
        List<String> validTexts = validateAll(validator, texts);
        Set<String> slot = slot(validLang);
        slot.clear();
        slot.addAll(validTexts);
    }

    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableSet(entries.keySet()).iterator();
    }

    /**
     * Registered languages, last-registered first.
     */
    public List<String> reversedLangs() {
        List<String> langs = new ArrayList<>(entries.keySet());
        Collections.reverse(langs);
        return langs;
    }

    // -- conversion and rendering

    /**
     * Canonical strings for the given languages ({@code null} for all), sorted.
     */
    public List<String> toStrings(List<String> langs, RenderOptions options) {
        Objects.requireNonNull(options, "options");
        FlagValidator validator = validator();
        boolean quotes = validator.enabled(GlobalFlag.PRINT_WITH_QUOTES);
        boolean printLang = validator.enabled(GlobalFlag.PRINT_WITH_LANG);
        List<String> strings = new ArrayList<>();
        for (String key : selectedKeys(langs)) {
            for (String text : entries.get(key)) {
                strings.add(options.render(text, key, quotes, printLang));
            }
        }
        Collections.sort(strings);
        return strings;
    }

    public List<String> toStrings() {
        return toStrings(null, RenderOptions.defaults());
    }

    public List<LangString> toLangStrings(List<String> langs) {
        List<LangString> result = new ArrayList<>();
        for (String key : selectedKeys(langs)) {
            for (String text : entries.get(key).stream().sorted().collect(Collectors.toList())) {
                result.add(new LangString(text, key, settings));
            }
        }
        return result;
    }

    public List<SetLangString> toSetLangStrings(List<String> langs) {
        List<SetLangString> result = new ArrayList<>();
        for (String key : selectedKeys(langs)) {
            result.add(new SetLangString(entries.get(key), key, settings));
        }
        return result;
    }

    private List<String> selectedKeys(List<String> langs) {
        if (langs == null) {
            return new ArrayList<>(entries.keySet());
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String lang : langs) {
            registered(lang).ifPresent(keys::add);
        }
        return new ArrayList<>(keys);
    }

    /**
     * One {@code {'text', ...}@lang} group per language, ordered by language then text, e.g. {@code {'Hello'}@en, {'Olá'}@pt}.
     */
    @Override
    public String toString() {
        if (entries.isEmpty()) {
            return "{}";
        }
        FlagValidator validator = validator();
        boolean quotes = validator.enabled(GlobalFlag.PRINT_WITH_QUOTES);
        boolean printLang = validator.enabled(GlobalFlag.PRINT_WITH_LANG);
        return entries.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(entry -> SetLangString.render(
                entry.getValue().stream().sorted().collect(Collectors.toList()), entry.getKey(), quotes, printLang))
            .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof MultiLangString that && folded().equals(that.folded());
    }

    @Override
    public int hashCode() {
        return folded().hashCode();
    }

    private Map<String, Set<String>> folded() {
        Map<String, Set<String>> folded = new LinkedHashMap<>();
        entries.forEach((lang, texts) -> folded.put(TextOps.casefold(lang), texts));
        return folded;
    }

    /**
     * Combines the collections into a new one; the inputs are left untouched. A language seen with several
     * casings across the inputs gets the case-folded tag. Preferred language and settings come from the
     * first input.
     */
    public static MultiLangString mergeMultiLangStrings(List<MultiLangString> multiLangStrings) {
        Objects.requireNonNull(multiLangStrings, "multiLangStrings");
        List<String> tags = new ArrayList<>();
        for (MultiLangString multiLangString : multiLangStrings) {
            if (multiLangString == null) {
                throw LangStringException.unexpectedType(null, "'MultiLangString'");
            }
            tags.addAll(multiLangString.entries.keySet());
        }
        Map<String, String> chosen = LanguageTags.reconcile(tags);
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        for (MultiLangString multiLangString : multiLangStrings) {
            multiLangString.entries.forEach((lang, texts) ->
                merged.computeIfAbsent(chosen.get(TextOps.casefold(lang)), ignored -> new LinkedHashSet<>()).addAll(texts));
        }
        if (multiLangStrings.isEmpty()) {
            return new MultiLangString();
        }
        MultiLangString first = multiLangStrings.get(0);
        return new MultiLangString(merged, first.prefLang, first.settings);
    }

    private static String entryText(Map.Entry<?, ?> entry) {
        if (!(entry.getKey() instanceof String text)) {
            throw LangStringException.unexpectedType(entry.getKey(), "'String' as entry text");
        }
        return text;
    }

    private static String entryLang(Map.Entry<?, ?> entry) {
        if (entry.getValue() != null && !(entry.getValue() instanceof String)) {
            throw LangStringException.unexpectedType(entry.getValue(), "'String' as entry language");
        }
        return (String) entry.getValue();
    }
}
