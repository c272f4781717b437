package warden.core.exception;

/**
 * Thrown when a compressed payload cannot be inflated.
 */
public class DecompressionException extends WardenException {

    public DecompressionException(String message) {
        super(ErrorKind.DECOMPRESSION, message);
    }

    public DecompressionException(String message, Throwable cause) {
        super(ErrorKind.DECOMPRESSION, message, cause);
    }
}
