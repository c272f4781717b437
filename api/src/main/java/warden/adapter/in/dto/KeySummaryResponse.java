package warden.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.key.EncryptionKeyRecord;
import warden.core.model.key.SigningKeyRecord;

/**
 * Key metadata. Key material is never included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeySummaryResponse(
        @JsonProperty("key_id") String keyId,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("activated_at") Instant activatedAt,
        @JsonProperty("deprecated_at") Instant deprecatedAt) {

    public static KeySummaryResponse from(SigningKeyRecord key) {
        return new KeySummaryResponse(
                key.keyId(), key.status().name(), key.createdAt(), key.activatedAt(), key.deprecatedAt());
    }

    public static KeySummaryResponse from(EncryptionKeyRecord key) {
        return new KeySummaryResponse(
                key.keyId(), key.status().name(), key.createdAt(), key.activatedAt(), key.deprecatedAt());
    }
}
