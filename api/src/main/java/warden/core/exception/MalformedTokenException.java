package warden.core.exception;

/**
 * Thrown when a token or its payload is structurally damaged.
 */
public class MalformedTokenException extends WardenException {

    public MalformedTokenException(String message) {
        super(ErrorKind.MALFORMED_TOKEN, message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_TOKEN, message, cause);
    }
}
