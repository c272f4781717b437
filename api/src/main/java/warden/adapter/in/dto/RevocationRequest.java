package warden.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.revocation.RevocationCriteria;

/**
 * DTO for recording a revocation event. Every field is optional; omitted fields match
 * every token.
 */
public record RevocationRequest(
        @JsonProperty("user_id") String userId,
        @JsonProperty("domain_id") String domainId,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("role_id") String roleId,
        @JsonProperty("trust_id") String trustId,
        @JsonProperty("audit_id") String auditId,
        @JsonProperty("issued_before") Instant issuedBefore) {

    public RevocationCriteria toCriteria() {
        return RevocationCriteria.builder()
                .subjectId(userId)
                .domainId(domainId)
                .projectId(projectId)
                .roleId(roleId)
                .trustId(trustId)
                .auditId(auditId)
                .issuedBefore(issuedBefore)
                .build();
    }
}
