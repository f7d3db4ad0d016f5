package work.lcod.langstring.validation;

import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide access to the language-tag oracle. The first provider found on the class path is used
 * unless an override is installed.
 */
public final class LanguageTagOracles {
    private static final Logger log = LoggerFactory.getLogger(LanguageTagOracles.class);
    private static final AtomicReference<Optional<LanguageTagOracle>> OVERRIDE = new AtomicReference<>();
    private static volatile Optional<LanguageTagOracle> discovered;

    private LanguageTagOracles() {}

    public static Optional<LanguageTagOracle> current() {
        Optional<LanguageTagOracle> override = OVERRIDE.get();
        return override != null ? override : discover();
    }

    public static void use(LanguageTagOracle oracle) {
        OVERRIDE.set(Optional.of(Objects.requireNonNull(oracle, "oracle")));
    }

    /**
     * Behaves as if no oracle were installed.
     */
    public static void useNone() {
        OVERRIDE.set(Optional.empty());
    }

    public static void reset() {
        OVERRIDE.set(null);
    }

    private static Optional<LanguageTagOracle> discover() {
        Optional<LanguageTagOracle> result = discovered;
        if (result == null) {
            result = ServiceLoader.load(LanguageTagOracle.class, LanguageTagOracles.class.getClassLoader()).findFirst();
            result.ifPresentOrElse(
                oracle -> log.debug("Using language tag oracle {}", oracle.getClass().getName()),
                () -> log.debug("No language tag oracle found")
            );
            discovered = result;
        }
        return result;
    }
}
