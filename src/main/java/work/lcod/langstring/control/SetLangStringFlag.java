package work.lcod.langstring.control;

/**
 * Flags scoped to same-language text sets ({@link work.lcod.langstring.model.SetLangString}).
 */
public enum SetLangStringFlag implements Flag {
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

    SetLangStringFlag(boolean defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public FlagNamespace namespace() {
        return FlagNamespace.SET_LANG_STRING;
    }

    @Override
    public boolean defaultValue() {
        return defaultValue;
    }
}
