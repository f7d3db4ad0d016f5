package work.lcod.langstring.validation;

import java.util.IllformedLocaleException;
import java.util.Locale;

/**
 * Accepts tags that {@link Locale.Builder} parses as well-formed BCP 47.
 */
public final class Bcp47LanguageTagOracle implements LanguageTagOracle {
    @Override
    public boolean isValid(String tag) {
        if (tag == null || tag.isEmpty()) {
            return false;
        }
        try {
            new Locale.Builder().setLanguageTag(tag);
            return true;
        } catch (IllformedLocaleException ex) {
            return false;
        }
    }
}
