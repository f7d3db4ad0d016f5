package work.lcod.langstring;

/**
 * Failure categories raised by the library.
 */
public enum ErrorKind {
    /** A value of the wrong kind was supplied (not a string where a string was required). */
    TYPE,
    /** Right kind, wrong content: empty when required, invalid tag, mismatched languages. */
    VALUE,
    /** Keyed or indexed lookup, or explicit removal, targeting an absent element. */
    NOT_FOUND,
    /** Unrecognized flag, namespace or conversion-method identifier. */
    KIND
}
