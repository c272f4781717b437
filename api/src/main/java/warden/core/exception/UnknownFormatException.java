package warden.core.exception;

/**
 * Thrown when a token carries no recognised format tag.
 */
public class UnknownFormatException extends WardenException {

    public UnknownFormatException(String message) {
        super(ErrorKind.UNKNOWN_FORMAT, message);
    }

    public UnknownFormatException(String message, Throwable cause) {
        super(ErrorKind.UNKNOWN_FORMAT, message, cause);
    }
}
