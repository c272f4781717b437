package warden.core.exception;

import java.util.Objects;

/**
 * Base class of every failure raised by the token engine.
 */
public abstract class WardenException extends RuntimeException {

    private final ErrorKind kind;

    protected WardenException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    protected WardenException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ErrorKind kind() {
        return kind;
    }
}
