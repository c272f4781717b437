package warden.core.exception;

/**
 * Thrown when an encrypted token fails authenticated decryption.
 */
public class DecryptionException extends WardenException {

    public DecryptionException(String message) {
        super(ErrorKind.DECRYPTION, message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(ErrorKind.DECRYPTION, message, cause);
    }
}
