package work.lcod.langstring.control;

/**
 * Flags scoped to {@link work.lcod.langstring.model.MultiLangString}. Language flags apply to both the
 * entry keys and the preferred language. There is no strict operand mode for this kind.
 */
public enum MultiLangStringFlag implements Flag {
    DEFINED_LANG(false),
    DEFINED_TEXT(true),
    ENFORCE_EXTRA_DEPEND(false),
    LOWERCASE_LANG(false),
    PRINT_WITH_LANG(true),
    PRINT_WITH_QUOTES(true),
    STRIP_LANG(false),
    STRIP_TEXT(false),
    VALID_LANG(false);

    private final boolean defaultValue;

    MultiLangStringFlag(boolean defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public FlagNamespace namespace() {
        return FlagNamespace.MULTI_LANG_STRING;
    }

    @Override
    public boolean defaultValue() {
        return defaultValue;
    }
}
