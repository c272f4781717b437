package warden.core.exception;

import java.util.Locale;

/**
 * Internal classification of engine failures.
 *
 * <p>Kinds are precise for logs and metrics. Callers facing clients should only
 * use {@link #exposure()}, which collapses every token-invalid kind into one
 * answer so the response never reveals which check failed.
 */
public enum ErrorKind {
    AUTHENTICATION(Exposure.UNAUTHORIZED),
    INVALID_SCOPE(Exposure.BAD_REQUEST),
    EMPTY_METHODS(Exposure.BAD_REQUEST),
    UNKNOWN_FORMAT(Exposure.UNAUTHORIZED),
    MALFORMED_TOKEN(Exposure.UNAUTHORIZED),
    SIGNATURE_INVALID(Exposure.UNAUTHORIZED),
    DECRYPTION(Exposure.UNAUTHORIZED),
    DECOMPRESSION(Exposure.UNAUTHORIZED),
    KEY_NOT_FOUND(Exposure.UNAUTHORIZED),
    TOKEN_EXPIRED(Exposure.UNAUTHORIZED),
    TOKEN_REVOKED(Exposure.UNAUTHORIZED),
    TOKEN_NOT_FOUND(Exposure.UNAUTHORIZED),
    BIND_MISMATCH(Exposure.UNAUTHORIZED),
    BACKEND_UNAVAILABLE(Exposure.SERVICE_UNAVAILABLE);

    /**
     * What a client is allowed to learn about a failure.
     */
    public enum Exposure {
        UNAUTHORIZED,
        BAD_REQUEST,
        SERVICE_UNAVAILABLE;

        public boolean isRetryable() {
            return this == SERVICE_UNAVAILABLE;
        }
    }

    private final Exposure exposure;

    ErrorKind(Exposure exposure) {
        this.exposure = exposure;
    }

    public Exposure exposure() {
        return exposure;
    }

    /**
     * Metric tag value, e.g. {@code token_revoked}.
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
