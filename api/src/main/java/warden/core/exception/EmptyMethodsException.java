package warden.core.exception;

/**
 * Thrown when a token would be issued without any authentication method.
 */
public class EmptyMethodsException extends WardenException {

    public EmptyMethodsException(String message) {
        super(ErrorKind.EMPTY_METHODS, message);
    }

    public EmptyMethodsException(String message, Throwable cause) {
        super(ErrorKind.EMPTY_METHODS, message, cause);
    }
}
