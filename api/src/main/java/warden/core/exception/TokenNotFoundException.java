package warden.core.exception;

/**
 * Thrown when an opaque token is not in the token store.
 */
public class TokenNotFoundException extends WardenException {

    public TokenNotFoundException(String message) {
        super(ErrorKind.TOKEN_NOT_FOUND, message);
    }

    public TokenNotFoundException(String message, Throwable cause) {
        super(ErrorKind.TOKEN_NOT_FOUND, message, cause);
    }
}
