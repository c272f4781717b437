package warden.core.model.token;

import java.util.Objects;

/**
 * An authenticated principal and the domain that owns it.
 *
 * @param subjectId the principal identifier
 * @param domainId  the principal's home domain
 */
public record Principal(String subjectId, String domainId) {

    public Principal {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId cannot be null or blank");
        }
        Objects.requireNonNull(domainId, "domainId is required");
    }
}
