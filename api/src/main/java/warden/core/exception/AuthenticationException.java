package warden.core.exception;

/**
 * Thrown when credentials cannot be verified or name different principals.
 */
public class AuthenticationException extends WardenException {

    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
