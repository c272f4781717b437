package warden.core.exception;

/**
 * Thrown when a token is used at or after its expiry.
 */
public class TokenExpiredException extends WardenException {

    public TokenExpiredException(String message) {
        super(ErrorKind.TOKEN_EXPIRED, message);
    }

    public TokenExpiredException(String message, Throwable cause) {
        super(ErrorKind.TOKEN_EXPIRED, message, cause);
    }
}
