package warden.core.exception;

/**
 * Thrown when a revocation event covers the token.
 */
public class TokenRevokedException extends WardenException {

    public TokenRevokedException(String message) {
        super(ErrorKind.TOKEN_REVOKED, message);
    }

    public TokenRevokedException(String message, Throwable cause) {
        super(ErrorKind.TOKEN_REVOKED, message, cause);
    }
}
