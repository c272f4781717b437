package warden.core.exception;

/**
 * Thrown when the key named by a token is unknown or no longer usable.
 */
public class KeyNotFoundException extends WardenException {

    public KeyNotFoundException(String message) {
        super(ErrorKind.KEY_NOT_FOUND, message);
    }

    public KeyNotFoundException(String message, Throwable cause) {
        super(ErrorKind.KEY_NOT_FOUND, message, cause);
    }
}
