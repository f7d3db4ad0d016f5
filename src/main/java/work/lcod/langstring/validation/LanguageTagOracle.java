package work.lcod.langstring.validation;

/**
 * Judges whether a language tag is well formed. Implementations are discovered with
 * {@link java.util.ServiceLoader}.
 */
public interface LanguageTagOracle {
    boolean isValid(String tag);
}
