package work.lcod.langstring.control;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.lcod.langstring.LangStringException;

/**
 * The four flag namespaces: one global, three scoped to an entity kind.
 */
public enum FlagNamespace {
    GLOBAL("GlobalFlag", "global"),
    LANG_STRING("LangStringFlag", "lang_string"),
    SET_LANG_STRING("SetLangStringFlag", "set_lang_string"),
    MULTI_LANG_STRING("MultiLangStringFlag", "multi_lang_string");

    private final String typeName;
    private final String configKey;

    FlagNamespace(String typeName, String configKey) {
        this.typeName = typeName;
        this.configKey = configKey;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Table/object name used by settings files.
     */
    public String configKey() {
        return configKey;
    }

    public List<Flag> flags() {
        Flag[] members = switch (this) {
            case GLOBAL -> GlobalFlag.values();
            case LANG_STRING -> LangStringFlag.values();
            case SET_LANG_STRING -> SetLangStringFlag.values();
            case MULTI_LANG_STRING -> MultiLangStringFlag.values();
        };
        return List.of(members);
    }

    public Optional<Flag> flag(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Flag candidate : flags()) {
            if (candidate.name().equals(name)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the flag of this namespace mirroring the given global flag, if this namespace has one.
     */
    public Optional<Flag> mirror(GlobalFlag flag) {
        return flag(flag.name());
    }

    public Flag requireFlag(String name) {
        return flag(name).orElseThrow(() -> LangStringException.kindError(
            "Unknown flag '" + name + "' for " + typeName + ". Expected one of " + names() + "."
        ));
    }

    public static FlagNamespace fromConfigKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (FlagNamespace namespace : values()) {
                if (namespace.configKey.equals(normalized) || namespace.typeName.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return namespace;
                }
            }
        }
        throw LangStringException.kindError("Unknown flag namespace: " + key);
    }

    /**
     * Every flag of every namespace, ordered by qualified name.
     */
    static List<Flag> allFlags() {
        List<Flag> all = new ArrayList<>();
        for (FlagNamespace namespace : values()) {
            all.addAll(namespace.flags());
        }
        all.sort(Comparator.comparing(Flag::qualifiedName));
        return all;
    }

    private List<String> names() {
        return flags().stream().map(Flag::name).toList();
    }
}
