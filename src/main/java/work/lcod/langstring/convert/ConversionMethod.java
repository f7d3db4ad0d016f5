package work.lcod.langstring.convert;

import java.util.Locale;
import work.lcod.langstring.ErrorKind;
import work.lcod.langstring.LangStringException;

/**
 * How a raw string becomes a {@code LangString}: with a caller-supplied language, or by splitting on a
 * separator.
 */
public enum ConversionMethod {
    MANUAL,
    PARSE;

    public static ConversionMethod from(String value) {
        if (value == null || value.isBlank()) {
            throw LangStringException.kindError("Unknown method: " + value + ". Valid methods are 'manual' and 'parse'.");
        }
        try {
            return ConversionMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new LangStringException(
                ErrorKind.KIND,
                "Unknown method: " + value + ". Valid methods are 'manual' and 'parse'.",
                ex
            );
        }
    }
}
