package work.lcod.langstring.control;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.langstring.LangStringException;

/**
 * Immutable snapshot of every flag's state. Instances can be passed explicitly to entities or held by
 * the process-wide {@link Controller}.
 */
public final class FlagSettings {
    private static final FlagSettings DEFAULTS = new FlagSettings(defaultValues());

    private final Map<Flag, Boolean> values;

    private FlagSettings(Map<Flag, Boolean> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FlagSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder(DEFAULTS.values);
    }

    public Builder toBuilder() {
        return new Builder(values);
    }

    public boolean get(Flag flag) {
        return values.get(requireKnown(flag));
    }

    /**
     * State of the flag mirroring {@code which} in the given namespace; {@code false} when the namespace
     * has no such flag.
     */
    public boolean isEnabled(FlagNamespace namespace, GlobalFlag which) {
        return namespace.mirror(which).map(values::get).orElse(false);
    }

    public FlagSettings with(Flag flag, boolean state) {
        return toBuilder().set(flag, state).build();
    }

    public FlagSettings withReset(Flag flag) {
        return toBuilder().reset(flag).build();
    }

    public FlagSettings withNamespaceReset(FlagNamespace namespace) {
        return toBuilder().resetNamespace(namespace).build();
    }

    /**
     * All flags ordered by qualified name.
     */
    public Map<Flag, Boolean> asMap() {
        return values;
    }

    public Map<Flag, Boolean> asMap(FlagNamespace namespace) {
        if (namespace == null) {
            throw LangStringException.kindError("Invalid flag namespace: null");
        }
        var scoped = new LinkedHashMap<Flag, Boolean>();
        values.forEach((flag, state) -> {
            if (flag.namespace() == namespace) {
                scoped.put(flag, state);
            }
        });
        return Collections.unmodifiableMap(scoped);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof FlagSettings settings && values.equals(settings.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        var enabled = new StringBuilder();
        values.forEach((flag, state) -> {
            if (state) {
                if (enabled.length() > 0) {
                    enabled.append(", ");
                }
                enabled.append(flag.qualifiedName());
            }
        });
        return "FlagSettings[enabled=" + enabled + "]";
    }

    static Flag requireKnown(Flag flag) {
        if (flag instanceof GlobalFlag
            || flag instanceof LangStringFlag
            || flag instanceof SetLangStringFlag
            || flag instanceof MultiLangStringFlag) {
            return flag;
        }
        String actual = flag == null ? "null" : flag.getClass().getName();
        throw LangStringException.kindError(
            "Invalid flag type. Expected GlobalFlag, LangStringFlag, SetLangStringFlag, or MultiLangStringFlag, got '"
                + actual + "'."
        );
    }

    private static Map<Flag, Boolean> defaultValues() {
        var defaults = new LinkedHashMap<Flag, Boolean>();
        for (Flag flag : FlagNamespace.allFlags()) {
            defaults.put(flag, flag.defaultValue());
        }
        return defaults;
    }

    public static final class Builder {
        private final Map<Flag, Boolean> values;

        private Builder(Map<Flag, Boolean> source) {
            this.values = new LinkedHashMap<>(source);
        }

        /**
         * Sets a flag. A global flag also sets the same-named flag of every entity namespace.
         */
        public Builder set(Flag flag, boolean state) {
            requireKnown(flag);
            if (flag instanceof GlobalFlag global) {
                for (FlagNamespace namespace : FlagNamespace.values()) {
                    namespace.mirror(global).ifPresent(mirrored -> values.put(mirrored, state));
                }
            } else {
                values.put(flag, state);
            }
            return this;
        }

        public Builder reset(Flag flag) {
            requireKnown(flag);
            if (flag instanceof GlobalFlag global) {
                for (FlagNamespace namespace : FlagNamespace.values()) {
                    namespace.mirror(global).ifPresent(mirrored -> values.put(mirrored, mirrored.defaultValue()));
                }
            } else {
                values.put(flag, flag.defaultValue());
            }
            return this;
        }

        /**
         * Resets one namespace; {@link FlagNamespace#GLOBAL} resets every namespace.
         */
        public Builder resetNamespace(FlagNamespace namespace) {
            if (namespace == null) {
                throw LangStringException.kindError("Invalid flag namespace: null");
            }
            for (Flag flag : values.keySet()) {
                if (namespace == FlagNamespace.GLOBAL || flag.namespace() == namespace) {
                    values.put(flag, flag.defaultValue());
                }
            }
            return this;
        }

        public FlagSettings build() {
            return new FlagSettings(new LinkedHashMap<>(values));
        }
    }
}
