package warden.core.model.token;

/**
 * Requested scope as supplied by a caller, before validation.
 *
 * <p>At most one of the two identifiers may be set; both null requests an unscoped token.
 *
 * @param projectId requested project, or null
 * @param domainId  requested domain, or null
 */
public record ScopeRequest(String projectId, String domainId) {

    public static final ScopeRequest UNSCOPED = new ScopeRequest(null, null);

    public static ScopeRequest project(String projectId) {
        return new ScopeRequest(projectId, null);
    }

    public static ScopeRequest domain(String domainId) {
        return new ScopeRequest(null, domainId);
    }

    public static ScopeRequest of(TokenScope scope) {
        return new ScopeRequest(scope.projectId(), scope.domainId());
    }
}
