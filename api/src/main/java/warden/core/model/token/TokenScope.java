package warden.core.model.token;

/**
 * Tenancy context a token is valid within.
 *
 * <p>A token carries exactly one scope:
 * <ul>
 *   <li>{@link Unscoped} - identity only, no roles</li>
 *   <li>{@link ProjectScope} - roles granted on a project</li>
 *   <li>{@link DomainScope} - roles granted on a domain</li>
 * </ul>
 */
public sealed interface TokenScope {

    Unscoped UNSCOPED = new Unscoped();

    /**
     * Wire name of the scope type.
     */
    String type();

    /**
     * Project the token is scoped to, or null.
     */
    default String projectId() {
        return null;
    }

    /**
     * Domain the token is scoped to, or null.
     */
    default String domainId() {
        return null;
    }

    default boolean isScoped() {
        return !(this instanceof Unscoped);
    }

    static TokenScope unscoped() {
        return UNSCOPED;
    }

    static TokenScope project(String projectId) {
        return new ProjectScope(projectId);
    }

    static TokenScope domain(String domainId) {
        return new DomainScope(domainId);
    }

    record Unscoped() implements TokenScope {
        @Override
        public String type() {
            return "unscoped";
        }
    }

    record ProjectScope(String projectId) implements TokenScope {
        public ProjectScope {
            if (projectId == null || projectId.isBlank()) {
                throw new IllegalArgumentException("projectId cannot be null or blank");
            }
        }

        @Override
        public String type() {
            return "project";
        }
    }

    record DomainScope(String domainId) implements TokenScope {
        public DomainScope {
            if (domainId == null || domainId.isBlank()) {
                throw new IllegalArgumentException("domainId cannot be null or blank");
            }
        }

        @Override
        public String type() {
            return "domain";
        }
    }
}
