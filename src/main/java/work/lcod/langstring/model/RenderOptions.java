package work.lcod.langstring.model;

import java.util.Objects;

/**
 * Options for the canonical textual form {@code "text"@lang}. {@code null} quote/language switches fall
 * back to the {@code PRINT_WITH_QUOTES} / {@code PRINT_WITH_LANG} flags.
 */
public record RenderOptions(Boolean printQuotes, String separator, Boolean printLang) {
    public static final String DEFAULT_SEPARATOR = "@";

    private static final RenderOptions DEFAULTS = new RenderOptions(null, DEFAULT_SEPARATOR, null);

    public RenderOptions {
        separator = Objects.requireNonNullElse(separator, DEFAULT_SEPARATOR);
    }

    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public RenderOptions withQuotes(boolean quotes) {
        return new RenderOptions(quotes, separator, printLang);
    }

    public RenderOptions withSeparator(String value) {
        return new RenderOptions(printQuotes, value, printLang);
    }

    public RenderOptions withLang(boolean lang) {
        return new RenderOptions(printQuotes, separator, lang);
    }

    boolean quotes(boolean policy) {
        return printQuotes == null ? policy : printQuotes;
    }

    boolean lang(boolean policy) {
        return printLang == null ? policy : printLang;
    }

    String render(String text, String lang, boolean quotesPolicy, boolean langPolicy) {
        String body = quotes(quotesPolicy) ? "\"" + text + "\"" : text;
        if (lang(langPolicy) && !lang.isEmpty()) {
            return body + separator + lang;
        }
        return body;
    }
}
