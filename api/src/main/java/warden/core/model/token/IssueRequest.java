package warden.core.model.token;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs for minting a token, gathered from the identity, assignment and catalog backends.
 *
 * @param principal  the authenticated principal
 * @param scope      the requested scope
 * @param methods    authentication methods used
 * @param roles      roles granted in the requested scope
 * @param catalog    catalog snapshot to embed
 * @param bind       client binding assertion, or null
 * @param trustId    trust for delegated tokens, or null
 * @param federation federation attributes, or null
 * @param ancestor   payload being rescoped, or null
 */
public record IssueRequest(
        Principal principal,
        ScopeRequest scope,
        Set<String> methods,
        Set<String> roles,
        List<EndpointRecord> catalog,
        String bind,
        String trustId,
        FederationInfo federation,
        TokenPayload ancestor) {

    public IssueRequest {
        Objects.requireNonNull(principal, "principal is required");
        scope = scope == null ? ScopeRequest.UNSCOPED : scope;
        methods = methods == null ? Set.of() : Set.copyOf(methods);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        catalog = catalog == null ? List.of() : List.copyOf(catalog);
    }

    public static Builder builder(Principal principal) {
        return new Builder(principal);
    }

    public static final class Builder {
        private final Principal principal;
        private ScopeRequest scope = ScopeRequest.UNSCOPED;
        private Set<String> methods = Set.of();
        private Set<String> roles = Set.of();
        private List<EndpointRecord> catalog = List.of();
        private String bind;
        private String trustId;
        private FederationInfo federation;
        private TokenPayload ancestor;

        private Builder(Principal principal) {
            this.principal = principal;
        }

        public Builder scope(ScopeRequest scope) {
            this.scope = scope;
            return this;
        }

        public Builder methods(Set<String> methods) {
            this.methods = methods;
            return this;
        }

        public Builder roles(Set<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder catalog(List<EndpointRecord> catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder bind(String bind) {
            this.bind = bind;
            return this;
        }

        public Builder trustId(String trustId) {
            this.trustId = trustId;
            return this;
        }

        public Builder federation(FederationInfo federation) {
            this.federation = federation;
            return this;
        }

        public Builder ancestor(TokenPayload ancestor) {
            this.ancestor = ancestor;
            return this;
        }

        public IssueRequest build() {
            return new IssueRequest(principal, scope, methods, roles, catalog, bind, trustId, federation, ancestor);
        }
    }
}
