package work.lcod.langstring.control;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.langstring.LangStringException;

/**
 * Process-wide flag registry. Holds the current {@link FlagSettings} in an atomic reference, so readers
 * always observe a consistent snapshot and a global cascade is applied as one update.
 *
 * <p>Initialized to defaults on first use, or from the file named by the {@value #CONFIG_PROPERTY}
 * system property when it is set.
 */
public final class Controller {
    public static final String CONFIG_PROPERTY = "langstring.config";

    private static final Logger log = LoggerFactory.getLogger(Controller.class);
    private static final AtomicReference<FlagSettings> CURRENT = new AtomicReference<>();

    private Controller() {}

    /**
     * Current state as an immutable value, suitable for passing to entity constructors.
     */
    public static FlagSettings snapshot() {
        FlagSettings settings = CURRENT.get();
        if (settings == null) {
            CURRENT.compareAndSet(null, initialSettings());
            settings = CURRENT.get();
        }
        return settings;
    }

    public static void set(Flag flag, boolean state) {
        FlagSettings.requireKnown(flag);
        update(settings -> settings.with(flag, state));
        log.debug("Flag {} set to {}", flag.qualifiedName(), state);
    }

    public static boolean get(Flag flag) {
        return snapshot().get(flag);
    }

    public static Map<Flag, Boolean> getAll() {
        return snapshot().asMap();
    }

    public static Map<Flag, Boolean> getAll(FlagNamespace namespace) {
        return snapshot().asMap(namespace);
    }

    public static void reset(Flag flag) {
        FlagSettings.requireKnown(flag);
        update(settings -> settings.withReset(flag));
        log.debug("Flag {} reset", flag.qualifiedName());
    }

    /**
     * Resets the given namespace; {@link FlagNamespace#GLOBAL} resets everything.
     */
    public static void resetAll(FlagNamespace namespace) {
        if (namespace == null) {
            throw LangStringException.kindError("Invalid flag namespace: null");
        }
        update(settings -> settings.withNamespaceReset(namespace));
        log.debug("Flags of {} reset", namespace.typeName());
    }

    public static void resetAll() {
        resetAll(FlagNamespace.GLOBAL);
    }

    /**
     * Replaces the whole state, e.g. with settings read by {@link FlagSettingsLoader}.
     */
    public static void apply(FlagSettings settings) {
        if (settings == null) {
            throw LangStringException.typeError("Flag settings cannot be null.");
        }
        snapshot();
        CURRENT.set(settings);
        log.debug("Flag settings replaced: {}", settings);
    }

    public static void load(Path file) {
        apply(FlagSettingsLoader.load(file));
    }

    /**
     * Single-line description, e.g. {@code GlobalFlag.STRIP_TEXT = true}.
     */
    public static String describe(Flag flag) {
        boolean state = get(flag);
        return flag.qualifiedName() + " = " + state;
    }

    public static void print(Flag flag) {
        print(flag, System.out);
    }

    public static void print(Flag flag, PrintStream out) {
        out.println(describe(flag));
    }

    public static void print(FlagNamespace namespace) {
        print(namespace, System.out);
    }

    public static void print(FlagNamespace namespace, PrintStream out) {
        getAll(namespace).forEach((flag, state) -> out.println(flag.qualifiedName() + " = " + state));
    }

    public static void printAll() {
        printAll(System.out);
    }

    public static void printAll(PrintStream out) {
        getAll().forEach((flag, state) -> out.println(flag.qualifiedName() + " = " + state));
    }

    private static void update(UnaryOperator<FlagSettings> change) {
        snapshot();
        CURRENT.updateAndGet(change);
    }

    private static FlagSettings initialSettings() {
        String configured = System.getProperty(CONFIG_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return FlagSettings.defaults();
        }
        log.debug("Loading flag settings from {}", configured);
        return FlagSettingsLoader.load(Path.of(configured.trim()));
    }
}
