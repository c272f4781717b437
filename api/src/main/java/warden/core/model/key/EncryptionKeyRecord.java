package warden.core.model.key;

import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256 key used by the encrypted token format, with lifecycle metadata.
 *
 * <p>The key id is embedded in every encrypted token. After rotation the previous key
 * is DEPRECATED and still decrypts tokens for a grace window; once the window closes
 * tokens naming it no longer validate.
 *
 * @param keyId        short key identifier embedded in tokens
 * @param secretKey    the AES key
 * @param status       lifecycle status
 * @param createdAt    creation time
 * @param activatedAt  when the key became ACTIVE, or null
 * @param deprecatedAt when the key became DEPRECATED, or null
 * @param retiredAt    when the key became RETIRED, or null
 */
public record EncryptionKeyRecord(
        String keyId,
        SecretKey secretKey,
        KeyStatus status,
        Instant createdAt,
        Instant activatedAt,
        Instant deprecatedAt,
        Instant retiredAt) {

    public static final int KEY_LENGTH_BYTES = 32;
    public static final int MAX_KEY_ID_LENGTH = 32;

    public EncryptionKeyRecord {
        Objects.requireNonNull(keyId, "keyId is required");
        Objects.requireNonNull(secretKey, "secretKey is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (keyId.isEmpty() || keyId.length() > MAX_KEY_ID_LENGTH || keyId.contains(".")) {
            throw new IllegalArgumentException("keyId must be 1-" + MAX_KEY_ID_LENGTH + " characters without '.'");
        }
        if (secretKey.getEncoded().length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException("Encryption key must be 256 bits (32 bytes). Got: "
                    + secretKey.getEncoded().length + " bytes");
        }
    }

    public static EncryptionKeyRecord active(String keyId, SecretKey secretKey, Instant now) {
        return new EncryptionKeyRecord(keyId, secretKey, KeyStatus.ACTIVE, now, now, null, null);
    }

    public static EncryptionKeyRecord pending(String keyId, SecretKey secretKey, Instant now) {
        return new EncryptionKeyRecord(keyId, secretKey, KeyStatus.PENDING, now, null, null, null);
    }

    /**
     * Copy of this key moved to a new status at the given time.
     */
    public EncryptionKeyRecord withStatus(KeyStatus newStatus, Instant at) {
        return switch (newStatus) {
            case PENDING -> new EncryptionKeyRecord(keyId, secretKey, newStatus, createdAt, null, null, null);
            case ACTIVE -> new EncryptionKeyRecord(keyId, secretKey, newStatus, createdAt, at, null, null);
            case DEPRECATED -> new EncryptionKeyRecord(keyId, secretKey, newStatus, createdAt, activatedAt, at, null);
            case RETIRED -> new EncryptionKeyRecord(
                    keyId, secretKey, newStatus, createdAt, activatedAt, deprecatedAt != null ? deprecatedAt : at, at);
        };
    }

    /**
     * Check whether tokens under this key may still be decrypted.
     *
     * @param now         the current time
     * @param gracePeriod how long a deprecated key keeps decrypting
     * @return true for ACTIVE keys and DEPRECATED keys inside the grace window
     */
    public boolean canDecryptAt(Instant now, Duration gracePeriod) {
        if (status == KeyStatus.ACTIVE) {
            return true;
        }
        if (status == KeyStatus.DEPRECATED) {
            return deprecatedAt == null || now.isBefore(deprecatedAt.plus(gracePeriod));
        }
        return false;
    }

    /**
     * Parse a base64-encoded 256-bit AES key.
     *
     * @param encoded base64 key material
     * @return the key
     * @throws IllegalArgumentException if the data is not 32 bytes of base64
     */
    public static SecretKey parseSecretKey(String encoded) {
        final byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key is not valid base64", e);
        }
        if (keyBytes.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException(
                    "Encryption key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }
        return new SecretKeySpec(keyBytes, "AES");
    }
}
