package warden.core.exception;

/**
 * Thrown when a signed token fails verification.
 */
public class SignatureInvalidException extends WardenException {

    public SignatureInvalidException(String message) {
        super(ErrorKind.SIGNATURE_INVALID, message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(ErrorKind.SIGNATURE_INVALID, message, cause);
    }
}
