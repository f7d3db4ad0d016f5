package work.lcod.langstring.validation;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.langstring.LangStringException;
import work.lcod.langstring.control.Controller;
import work.lcod.langstring.control.FlagNamespace;
import work.lcod.langstring.control.FlagSettings;
import work.lcod.langstring.control.GlobalFlag;
import work.lcod.langstring.shared.TextOps;

/**
 * Applies the flags of one namespace to candidate text and language values.
 *
 * <p>Text: type check, optional strip, emptiness check. Language: type check, optional strip, optional
 * case-fold, emptiness check, optional tag validity check against the {@link LanguageTagOracle}.
 */
public final class FlagValidator {
    private static final Logger log = LoggerFactory.getLogger(FlagValidator.class);

    private final FlagNamespace namespace;
    private final FlagSettings settings;
    private final Optional<LanguageTagOracle> oracle;

    public FlagValidator(FlagNamespace namespace, FlagSettings settings, Optional<LanguageTagOracle> oracle) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    /**
     * Validator for the given namespace. {@code settings} may be {@code null}, in which case the current
     * {@link Controller} snapshot is used.
     */
    public static FlagValidator of(FlagNamespace namespace, FlagSettings settings) {
        return new FlagValidator(namespace, settings == null ? Controller.snapshot() : settings, LanguageTagOracles.current());
    }

    public FlagNamespace namespace() {
        return namespace;
    }

    public FlagSettings settings() {
        return settings;
    }

    public boolean enabled(GlobalFlag flag) {
        return settings.isEnabled(namespace, flag);
    }

    public String validateText(Object raw) {
        String text = requireString(raw, "text");
        if (enabled(GlobalFlag.STRIP_TEXT)) {
            text = text.strip();
        }
        if (enabled(GlobalFlag.DEFINED_TEXT) && text.isEmpty()) {
            throw LangStringException.valueError(
                "Invalid 'text' value received ('" + raw + "'). '" + flagName(GlobalFlag.DEFINED_TEXT)
                    + "' is enabled. Expected non-empty text."
            );
        }
        return text;
    }

    public String validateLanguage(Object raw) {
        String lang = requireString(raw, "lang");
        if (enabled(GlobalFlag.STRIP_LANG)) {
            lang = lang.strip();
        }
        if (enabled(GlobalFlag.DEFINED_LANG) && lang.isEmpty()) {
            throw LangStringException.valueError(
                "Invalid 'lang' value received ('" + raw + "'). '" + flagName(GlobalFlag.DEFINED_LANG)
                    + "' is enabled. Expected non-empty language tag."
            );
        }
        if (enabled(GlobalFlag.LOWERCASE_LANG)) {
            lang = TextOps.casefold(lang);
        }
        if (enabled(GlobalFlag.VALID_LANG)) {
            checkValidity(raw, lang);
        }
        return lang;
    }

    private void checkValidity(Object raw, String lang) {
        if (oracle.isEmpty()) {
            if (enabled(GlobalFlag.ENFORCE_EXTRA_DEPEND)) {
                throw LangStringException.valueError(
                    "Cannot validate 'lang' value ('" + raw + "'): no language tag oracle is available and '"
                        + flagName(GlobalFlag.ENFORCE_EXTRA_DEPEND) + "' is enabled."
                );
            }
            log.warn("Language validation skipped for '{}': no language tag oracle is available.", lang);
            return;
        }
        if (!oracle.get().isValid(lang)) {
            throw LangStringException.valueError(
                "Invalid 'lang' value received ('" + raw + "'). '" + flagName(GlobalFlag.VALID_LANG)
                    + "' is enabled. Expected valid language code."
            );
        }
    }

    private String flagName(GlobalFlag flag) {
        return namespace.typeName() + "." + flag.name();
    }

    private static String requireString(Object raw, String field) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof String value) {
            return value;
        }
        throw LangStringException.unexpectedType(raw, "'String' for '" + field + "'");
    }
}
