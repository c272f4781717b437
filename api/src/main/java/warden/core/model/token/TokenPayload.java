package warden.core.model.token;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic content of a token: who authenticated, how, for which scope and until when.
 *
 * <p>Payloads are immutable. Rescoping produces a new payload whose audit chain starts
 * with its own identifier followed by the ancestor's chain.
 *
 * @param subjectId  the principal identifier
 * @param domainId   the principal's home domain
 * @param scope      the tenancy context
 * @param methods    authentication methods used (never empty)
 * @param roles      role identifiers granted in the scope
 * @param catalog    service catalog snapshot taken at issuance
 * @param issuedAt   issuance time
 * @param expiresAt  expiry time, strictly after {@code issuedAt}
 * @param auditIds   audit chain; element 0 identifies this token
 * @param bind       client binding assertion, or null
 * @param trustId    trust the token was delegated through, or null
 * @param federation federation attributes, or null
 */
public record TokenPayload(
        String subjectId,
        String domainId,
        TokenScope scope,
        Set<String> methods,
        Set<String> roles,
        List<EndpointRecord> catalog,
        Instant issuedAt,
        Instant expiresAt,
        List<String> auditIds,
        String bind,
        String trustId,
        FederationInfo federation) {

    public TokenPayload {
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(domainId, "domainId is required");
        Objects.requireNonNull(scope, "scope is required");
        Objects.requireNonNull(issuedAt, "issuedAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
        if (auditIds == null || auditIds.isEmpty()) {
            throw new IllegalArgumentException("auditIds cannot be empty");
        }
        methods = methods == null ? Set.of() : Set.copyOf(methods);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        catalog = catalog == null ? List.of() : List.copyOf(catalog);
        auditIds = List.copyOf(auditIds);
    }

    /**
     * The token's own identifier (head of the audit chain).
     */
    public String auditId() {
        return auditIds.get(0);
    }

    public String projectId() {
        return scope.projectId();
    }

    /**
     * Check whether the token is expired at the given instant.
     *
     * @param now the instant to evaluate
     * @return true if {@code now >= expiresAt}
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isBound() {
        return bind != null;
    }

    public boolean isDelegated() {
        return trustId != null;
    }

    public boolean isFederated() {
        return federation != null;
    }
}
