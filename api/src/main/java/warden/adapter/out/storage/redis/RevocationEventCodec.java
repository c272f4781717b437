package warden.adapter.out.storage.redis;

import java.io.IOException;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import warden.core.model.revocation.RevocationEvent;

/**
 * JSON form of a revocation event, shared by the sorted set members and pub/sub messages.
 *
 * <p>Equal events encode to equal strings, so the sorted set stores each event once.
 */
final class RevocationEventCodec {

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private RevocationEventCodec() {}

    static String encode(RevocationEvent event) {
        try {
            return OBJECT_MAPPER.writeValueAsString(WireEvent.from(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize revocation event", e);
        }
    }

    /**
     * Decode an event.
     *
     * @throws IllegalArgumentException if the message is not a revocation event
     */
    static RevocationEvent decode(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, WireEvent.class).toEvent();
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Invalid revocation event: " + json, e);
        }
    }

    record WireEvent(
            @JsonProperty("sub") String subjectId,
            @JsonProperty("dom") String domainId,
            @JsonProperty("pid") String projectId,
            @JsonProperty("rol") String roleId,
            @JsonProperty("tru") String trustId,
            @JsonProperty("aud") String auditId,
            @JsonProperty("ib") Long issuedBefore,
            @JsonProperty("at") Long revokedAt) {

        static WireEvent from(RevocationEvent event) {
            return new WireEvent(
                    event.subjectId(),
                    event.domainId(),
                    event.projectId(),
                    event.roleId(),
                    event.trustId(),
                    event.auditId(),
                    event.issuedBefore().toEpochMilli(),
                    event.revokedAt().toEpochMilli());
        }

        RevocationEvent toEvent() {
            if (issuedBefore == null || revokedAt == null) {
                throw new IllegalArgumentException("Revocation event times missing");
            }
            return new RevocationEvent(
                    subjectId,
                    domainId,
                    projectId,
                    roleId,
                    trustId,
                    auditId,
                    Instant.ofEpochMilli(issuedBefore),
                    Instant.ofEpochMilli(revokedAt));
        }
    }
}
