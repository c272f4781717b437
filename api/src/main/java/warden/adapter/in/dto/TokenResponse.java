package warden.adapter.in.dto;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.token.EndpointRecord;
import warden.core.model.token.TokenPayload;

/**
 * Token body returned by issuance and validation. The token string itself travels
 * in the {@code X-Subject-Token} header.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("user_domain_id") String userDomainId,
        @JsonProperty("scope") String scopeType,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("domain_id") String domainId,
        @JsonProperty("methods") Set<String> methods,
        @JsonProperty("roles") Set<String> roles,
        @JsonProperty("catalog") List<Endpoint> catalog,
        @JsonProperty("issued_at") Instant issuedAt,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("audit_ids") List<String> auditIds,
        @JsonProperty("bind") String bind,
        @JsonProperty("trust_id") String trustId) {

    public record Endpoint(
            @JsonProperty("service_id") String serviceId,
            @JsonProperty("type") String type,
            @JsonProperty("interface") String interfaceName,
            @JsonProperty("region") String region,
            @JsonProperty("url") String url) {

        static Endpoint from(EndpointRecord record) {
            return new Endpoint(
                    record.serviceId(), record.serviceType(), record.interfaceName(), record.region(), record.url());
        }
    }

    public static TokenResponse from(TokenPayload payload) {
        return new TokenResponse(
                payload.subjectId(),
                payload.domainId(),
                payload.scope().type(),
                payload.scope().projectId(),
                payload.scope().domainId(),
                payload.methods(),
                payload.roles(),
                payload.catalog().isEmpty()
                        ? null
                        : payload.catalog().stream().map(Endpoint::from).toList(),
                payload.issuedAt(),
                payload.expiresAt(),
                payload.auditIds(),
                payload.bind(),
                payload.trustId());
    }
}
