package warden.core.model.revocation;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import warden.core.model.token.TokenPayload;

/**
 * A recorded invalidation predicate.
 *
 * <p>An event revokes a token when the token was issued at or before
 * {@code issuedBefore} and every narrowing field present on the event matches the
 * token. Absent (null) fields are wildcards, so an event without narrowing fields
 * revokes everything issued up to its boundary.
 *
 * @param subjectId    revoke tokens of this principal
 * @param domainId     revoke tokens whose principal lives in, or whose scope is, this domain
 * @param projectId    revoke tokens scoped to this project
 * @param roleId       revoke tokens carrying this role
 * @param trustId      revoke tokens delegated through this trust
 * @param auditId      revoke tokens whose audit chain contains this id
 * @param issuedBefore inclusive issuance boundary
 * @param revokedAt    when the event was recorded
 */
public record RevocationEvent(
        String subjectId,
        String domainId,
        String projectId,
        String roleId,
        String trustId,
        String auditId,
        Instant issuedBefore,
        Instant revokedAt) {

    public RevocationEvent {
        Objects.requireNonNull(issuedBefore, "issuedBefore is required");
        Objects.requireNonNull(revokedAt, "revokedAt is required");
    }

    /**
     * Check whether this event revokes the given payload.
     *
     * @param payload the token payload
     * @return true if the payload is covered by this event
     */
    public boolean matches(TokenPayload payload) {
        if (payload.issuedAt().isAfter(issuedBefore)) {
            return false;
        }
        if (subjectId != null && !subjectId.equals(payload.subjectId())) {
            return false;
        }
        if (domainId != null
                && !domainId.equals(payload.domainId())
                && !domainId.equals(payload.scope().domainId())) {
            return false;
        }
        if (projectId != null && !projectId.equals(payload.projectId())) {
            return false;
        }
        if (roleId != null && !payload.roles().contains(roleId)) {
            return false;
        }
        if (trustId != null && !trustId.equals(payload.trustId())) {
            return false;
        }
        return auditId == null || payload.auditIds().contains(auditId);
    }

    /**
     * Whether any narrowing field is present.
     */
    public boolean hasNarrowingField() {
        return subjectId != null
                || domainId != null
                || projectId != null
                || roleId != null
                || trustId != null
                || auditId != null;
    }

    /**
     * Check whether the event can no longer match any unexpired token.
     *
     * <p>A token covered by this event was issued at or before {@code issuedBefore}, so it
     * expires no later than {@code issuedBefore + maxTokenLifetime}.
     *
     * @param now              the current time
     * @param maxTokenLifetime the longest lifetime a token can have
     * @return true if the event may be pruned
     */
    public boolean isPrunableAt(Instant now, Duration maxTokenLifetime) {
        return issuedBefore.plus(maxTokenLifetime).isBefore(now);
    }
}
