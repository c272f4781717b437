package warden.core.model.revocation;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Caller-supplied description of which tokens to revoke.
 *
 * <p>Every field is optional. Present fields narrow the match and must not be
 * blank; a null {@code issuedBefore} means "tokens issued up to now".
 */
public record RevocationCriteria(
        String subjectId,
        String domainId,
        String projectId,
        String roleId,
        String trustId,
        String auditId,
        Instant issuedBefore) {

    /**
     * Criteria matching every token issued so far.
     */
    public static RevocationCriteria all() {
        return new RevocationCriteria(null, null, null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convert to a ledger event recorded at {@code now}.
     *
     * <p>Times are truncated to milliseconds, the precision of token issuance times.
     *
     * @param now the recording time; also the boundary when {@code issuedBefore} is absent
     * @return the event
     * @throws IllegalArgumentException if a present identifier is blank
     */
    public RevocationEvent toEvent(Instant now) {
        return new RevocationEvent(
                requireNonBlank(subjectId, "user_id"),
                requireNonBlank(domainId, "domain_id"),
                requireNonBlank(projectId, "project_id"),
                requireNonBlank(roleId, "role_id"),
                requireNonBlank(trustId, "trust_id"),
                requireNonBlank(auditId, "audit_id"),
                (issuedBefore != null ? issuedBefore : now).truncatedTo(ChronoUnit.MILLIS),
                now.truncatedTo(ChronoUnit.MILLIS));
    }

    private static String requireNonBlank(String value, String field) {
        if (value != null && value.isBlank()) {
            throw new IllegalArgumentException("Revocation field " + field + " must not be blank");
        }
        return value;
    }

    public static final class Builder {
        private String subjectId;
        private String domainId;
        private String projectId;
        private String roleId;
        private String trustId;
        private String auditId;
        private Instant issuedBefore;

        private Builder() {}

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder domainId(String domainId) {
            this.domainId = domainId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder roleId(String roleId) {
            this.roleId = roleId;
            return this;
        }

        public Builder trustId(String trustId) {
            this.trustId = trustId;
            return this;
        }

        public Builder auditId(String auditId) {
            this.auditId = auditId;
            return this;
        }

        public Builder issuedBefore(Instant issuedBefore) {
            this.issuedBefore = issuedBefore;
            return this;
        }

        public RevocationCriteria build() {
            return new RevocationCriteria(subjectId, domainId, projectId, roleId, trustId, auditId, issuedBefore);
        }
    }
}
