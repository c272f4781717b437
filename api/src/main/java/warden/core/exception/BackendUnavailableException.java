package warden.core.exception;

/**
 * Thrown when a storage backend times out or fails. Retryable.
 */
public class BackendUnavailableException extends WardenException {

    public BackendUnavailableException(String message) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
