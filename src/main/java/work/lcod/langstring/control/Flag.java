package work.lcod.langstring.control;

/**
 * A named boolean policy switch. Implemented only by the four namespace enums of this package.
 */
public interface Flag {
    String name();

    FlagNamespace namespace();

    boolean defaultValue();

    /**
     * Display name, e.g. {@code LangStringFlag.STRIP_TEXT}.
     */
    default String qualifiedName() {
        return namespace().typeName() + "." + name();
    }
}
