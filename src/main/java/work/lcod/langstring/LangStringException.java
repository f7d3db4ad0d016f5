package work.lcod.langstring;

import java.util.Objects;

/**
 * Unchecked failure carrying an {@link ErrorKind}. Raised before any state is changed.
 */
public final class LangStringException extends RuntimeException {
    private final ErrorKind kind;

    public LangStringException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public LangStringException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static LangStringException typeError(String message) {
        return new LangStringException(ErrorKind.TYPE, message);
    }

    public static LangStringException valueError(String message) {
        return new LangStringException(ErrorKind.VALUE, message);
    }

    public static LangStringException notFound(String message) {
        return new LangStringException(ErrorKind.NOT_FOUND, message);
    }

    public static LangStringException kindError(String message) {
        return new LangStringException(ErrorKind.KIND, message);
    }

    /**
     * Builds the standard "expected X, got Y" type failure for a dynamically typed argument.
     */
    public static LangStringException unexpectedType(Object value, String expected) {
        String actual = value == null ? "null" : value.getClass().getSimpleName();
        return typeError("Invalid argument with value '" + value + "'. Expected " + expected + ", but got '" + actual + "'.");
    }
}
