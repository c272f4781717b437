package warden.core.service.token;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.TokenConfig;
import warden.core.exception.EmptyMethodsException;
import warden.core.exception.InvalidScopeException;
import warden.core.exception.TokenExpiredException;
import warden.core.model.token.IssueRequest;
import warden.core.model.token.ScopeRequest;
import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenScope;

/**
 * Assembles token payloads from issuance inputs.
 *
 * <p>Performs no I/O. Times come from the injected clock with millisecond precision.
 * When a request rescopes an existing token, the new payload's audit chain is its own
 * fresh id followed by the ancestor's chain, and its expiry never extends past the
 * ancestor's.
 */
@ApplicationScoped
public class PayloadBuilder {

    private static final int AUDIT_ID_BYTES = 16;

    private final Clock clock;
    private final TokenConfig config;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public PayloadBuilder(Clock clock, TokenConfig config) {
        this.clock = clock;
        this.config = config;
    }

    /**
     * Build a payload.
     *
     * @param request the issuance inputs
     * @return the payload
     * @throws EmptyMethodsException if no authentication method is given
     * @throws InvalidScopeException if the scope is contradictory, a delegated token is
     *                               not project scoped, or a scoped token has no roles
     */
    public TokenPayload build(IssueRequest request) {
        if (request.methods().isEmpty()) {
            throw new EmptyMethodsException("At least one authentication method is required");
        }

        final var scope = resolveScope(request.scope());
        if (request.trustId() != null && !(scope instanceof TokenScope.ProjectScope)) {
            throw new InvalidScopeException("Delegated tokens must be project scoped");
        }
        if (scope.isScoped() && request.roles().isEmpty()) {
            throw new InvalidScopeException("No roles granted in the requested scope");
        }

        final var issuedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        var expiresAt = issuedAt.plus(config.lifetime());

        final var auditIds = new ArrayList<String>();
        auditIds.add(newAuditId());

        final var ancestor = request.ancestor();
        if (ancestor != null) {
            if (ancestor.isExpiredAt(issuedAt)) {
                throw new TokenExpiredException("Token being rescoped has expired");
            }
            auditIds.addAll(ancestor.auditIds());
            if (ancestor.expiresAt().isBefore(expiresAt)) {
                expiresAt = ancestor.expiresAt();
            }
        }

        return new TokenPayload(
                request.principal().subjectId(),
                request.principal().domainId(),
                scope,
                request.methods(),
                scope.isScoped() ? request.roles() : Set.of(),
                request.catalog(),
                issuedAt,
                expiresAt,
                auditIds,
                request.bind(),
                request.trustId(),
                request.federation());
    }

    /**
     * Validate a requested scope and turn it into a token scope.
     *
     * @throws InvalidScopeException if both identifiers are set or one is blank
     */
    static TokenScope resolveScope(ScopeRequest request) {
        final var projectId = request.projectId();
        final var domainId = request.domainId();
        if (projectId != null && domainId != null) {
            throw new InvalidScopeException("A token cannot be scoped to both a project and a domain");
        }
        if (projectId != null) {
            if (projectId.isBlank()) {
                throw new InvalidScopeException("Project id cannot be blank");
            }
            return TokenScope.project(projectId);
        }
        if (domainId != null) {
            if (domainId.isBlank()) {
                throw new InvalidScopeException("Domain id cannot be blank");
            }
            return TokenScope.domain(domainId);
        }
        return TokenScope.unscoped();
    }

    private String newAuditId() {
        final var bytes = new byte[AUDIT_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
