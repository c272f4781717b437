package warden.core.exception;

/**
 * Thrown when a bound token is presented without its binding.
 */
public class BindMismatchException extends WardenException {

    public BindMismatchException(String message) {
        super(ErrorKind.BIND_MISMATCH, message);
    }

    public BindMismatchException(String message, Throwable cause) {
        super(ErrorKind.BIND_MISMATCH, message, cause);
    }
}
