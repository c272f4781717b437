package warden.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.revocation.RevocationEvent;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevocationEventDto(
        @JsonProperty("user_id") String userId,
        @JsonProperty("domain_id") String domainId,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("role_id") String roleId,
        @JsonProperty("trust_id") String trustId,
        @JsonProperty("audit_id") String auditId,
        @JsonProperty("issued_before") Instant issuedBefore,
        @JsonProperty("revoked_at") Instant revokedAt) {

    public static RevocationEventDto from(RevocationEvent event) {
        return new RevocationEventDto(
                event.subjectId(),
                event.domainId(),
                event.projectId(),
                event.roleId(),
                event.trustId(),
                event.auditId(),
                event.issuedBefore(),
                event.revokedAt());
    }
}
