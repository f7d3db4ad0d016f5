package work.lcod.langstring.control;

/**
 * Flags affecting every entity kind at once. Setting or resetting one of these cascades to the
 * same-named flag of each entity namespace.
 */
public enum GlobalFlag implements Flag {
    DEFINED_LANG(false),
    DEFINED_TEXT(true),
    ENFORCE_EXTRA_DEPEND(false),
    LOWERCASE_LANG(false),
    METHODS_MATCH_TYPES(false),
    PRINT_WITH_LANG(true),
    PRINT_WITH_QUOTES(true),
    STRIP_LANG(false),
    STRIP_TEXT(false),
    VALID_LANG(false);

    private final boolean defaultValue;

    GlobalFlag(boolean defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public FlagNamespace namespace() {
        return FlagNamespace.GLOBAL;
    }

    @Override
    public boolean defaultValue() {
        return defaultValue;
    }
}
