package warden.adapter.out.format;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import warden.core.exception.MalformedTokenException;
import warden.core.model.token.EndpointRecord;
import warden.core.model.token.FederationInfo;
import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenScope;

/**
 * JSON serialization of token payloads.
 *
 * <p>Payloads are written as a compact wire record with short property names and
 * epoch-millisecond times. Reading is strict: unknown properties, missing required
 * fields or values the payload rejects all fail with {@link MalformedTokenException}.
 */
@ApplicationScoped
public class PayloadCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
            .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false);

    public byte[] toBytes(TokenPayload payload) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(WirePayload.from(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token payload", e);
        }
    }

    public String toJson(TokenPayload payload) {
        try {
            return OBJECT_MAPPER.writeValueAsString(WirePayload.from(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token payload", e);
        }
    }

    /**
     * Read a payload.
     *
     * @param bytes UTF-8 JSON
     * @return the payload
     * @throws MalformedTokenException if the bytes are not a valid payload
     */
    public TokenPayload fromBytes(byte[] bytes) {
        try {
            return OBJECT_MAPPER.readValue(bytes, WirePayload.class).toPayload();
        } catch (IOException | RuntimeException e) {
            throw new MalformedTokenException("Token payload is malformed", e);
        }
    }

    public TokenPayload fromJson(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, WirePayload.class).toPayload();
        } catch (IOException | RuntimeException e) {
            throw new MalformedTokenException("Token payload is malformed", e);
        }
    }

    record WirePayload(
            @JsonProperty("sub") String subjectId,
            @JsonProperty("dom") String domainId,
            @JsonProperty("pid") String projectScope,
            @JsonProperty("did") String domainScope,
            @JsonProperty("mth") Set<String> methods,
            @JsonProperty("rol") Set<String> roles,
            @JsonProperty("cat") List<WireEndpoint> catalog,
            @JsonProperty("iat") long issuedAt,
            @JsonProperty("exp") long expiresAt,
            @JsonProperty("aud") List<String> auditIds,
            @JsonProperty("bnd") String bind,
            @JsonProperty("tru") String trustId,
            @JsonProperty("fed") WireFederation federation) {

        static WirePayload from(TokenPayload payload) {
            return new WirePayload(
                    payload.subjectId(),
                    payload.domainId(),
                    payload.scope().projectId(),
                    payload.scope().domainId(),
                    payload.methods(),
                    payload.roles().isEmpty() ? null : payload.roles(),
                    payload.catalog().isEmpty()
                            ? null
                            : payload.catalog().stream().map(WireEndpoint::from).toList(),
                    payload.issuedAt().toEpochMilli(),
                    payload.expiresAt().toEpochMilli(),
                    payload.auditIds(),
                    payload.bind(),
                    payload.trustId(),
                    payload.federation() == null ? null : WireFederation.from(payload.federation()));
        }

        TokenPayload toPayload() {
            if (subjectId == null || domainId == null || methods == null || methods.isEmpty()) {
                throw new IllegalArgumentException("Required payload fields missing");
            }
            if (projectScope != null && domainScope != null) {
                throw new IllegalArgumentException("Payload carries two scopes");
            }
            final TokenScope scope;
            if (projectScope != null) {
                scope = TokenScope.project(projectScope);
            } else if (domainScope != null) {
                scope = TokenScope.domain(domainScope);
            } else {
                scope = TokenScope.unscoped();
            }
            return new TokenPayload(
                    subjectId,
                    domainId,
                    scope,
                    methods,
                    roles,
                    catalog == null
                            ? null
                            : catalog.stream().map(WireEndpoint::toRecord).toList(),
                    Instant.ofEpochMilli(issuedAt),
                    Instant.ofEpochMilli(expiresAt),
                    auditIds,
                    bind,
                    trustId,
                    federation == null ? null : federation.toInfo());
        }
    }

    record WireEndpoint(
            @JsonProperty("sid") String serviceId,
            @JsonProperty("typ") String serviceType,
            @JsonProperty("ifc") String interfaceName,
            @JsonProperty("reg") String region,
            @JsonProperty("url") String url) {

        static WireEndpoint from(EndpointRecord endpoint) {
            return new WireEndpoint(
                    endpoint.serviceId(),
                    endpoint.serviceType(),
                    endpoint.interfaceName(),
                    endpoint.region(),
                    endpoint.url());
        }

        EndpointRecord toRecord() {
            return new EndpointRecord(serviceId, serviceType, interfaceName, region, url);
        }
    }

    record WireFederation(
            @JsonProperty("idp") String identityProviderId,
            @JsonProperty("pro") String protocolId,
            @JsonProperty("grp") List<String> groupIds) {

        static WireFederation from(FederationInfo federation) {
            return new WireFederation(
                    federation.identityProviderId(), federation.protocolId(), federation.groupIds());
        }

        FederationInfo toInfo() {
            return new FederationInfo(identityProviderId, protocolId, groupIds);
        }
    }
}
