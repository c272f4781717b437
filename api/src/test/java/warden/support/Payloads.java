package warden.support;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import warden.core.model.token.TokenPayload;
import warden.core.model.token.TokenScope;

/**
 * Builder for hand-made payloads.
 */
public final class Payloads {

    private String subjectId = "alice";
    private String domainId = "default";
    private TokenScope scope = TokenScope.project("p1");
    private Set<String> methods = Set.of("password");
    private Set<String> roles = Set.of("member");
    private Instant issuedAt = TestEngine.START;
    private Duration lifetime = Duration.ofHours(1);
    private List<String> auditIds = List.of("audit-1");
    private String bind;
    private String trustId;

    private Payloads() {}

    public static Payloads payload() {
        return new Payloads();
    }

    public Payloads subject(String subjectId) {
        this.subjectId = subjectId;
        return this;
    }

    public Payloads domain(String domainId) {
        this.domainId = domainId;
        return this;
    }

    public Payloads scope(TokenScope scope) {
        this.scope = scope;
        this.roles = scope.isScoped() ? roles : Set.of();
        return this;
    }

    public Payloads roles(String... roles) {
        this.roles = Set.of(roles);
        return this;
    }

    public Payloads issuedAt(Instant issuedAt) {
        this.issuedAt = issuedAt;
        return this;
    }

    public Payloads lifetime(Duration lifetime) {
        this.lifetime = lifetime;
        return this;
    }

    public Payloads auditIds(String... auditIds) {
        this.auditIds = List.of(auditIds);
        return this;
    }

    public Payloads bind(String bind) {
        this.bind = bind;
        return this;
    }

    public Payloads trust(String trustId) {
        this.trustId = trustId;
        return this;
    }

    public TokenPayload build() {
        return new TokenPayload(
                subjectId,
                domainId,
                scope,
                methods,
                roles,
                List.of(),
                issuedAt,
                issuedAt.plus(lifetime),
                auditIds,
                bind,
                trustId,
                null);
    }
}
