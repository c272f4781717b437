package warden.core.exception;

/**
 * Thrown when a requested scope is contradictory or cannot carry roles.
 */
public class InvalidScopeException extends WardenException {

    public InvalidScopeException(String message) {
        super(ErrorKind.INVALID_SCOPE, message);
    }

    public InvalidScopeException(String message, Throwable cause) {
        super(ErrorKind.INVALID_SCOPE, message, cause);
    }
}
