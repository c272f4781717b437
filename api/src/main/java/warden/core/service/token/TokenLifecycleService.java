package warden.core.service.token;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.model.revocation.RevocationCriteria;
import warden.core.model.revocation.RevocationEvent;
import warden.core.model.token.AuthenticationRequest;
import warden.core.model.token.IssueRequest;
import warden.core.model.token.IssuedToken;
import warden.core.model.token.TokenFormat;
import warden.core.model.token.TokenPayload;
import warden.core.port.in.TokenLifecycle;
import warden.core.port.out.TokenMetrics;
import warden.core.port.out.TokenStore;
import warden.core.service.common.BackendTimeoutHelper;
import warden.core.service.revocation.RevocationPublisher;

/**
 * Entry point to the token lifecycle for inbound adapters.
 */
@ApplicationScoped
public class TokenLifecycleService implements TokenLifecycle {

    private static final Logger LOG = Logger.getLogger(TokenLifecycleService.class);

    private final TokenIssuanceService issuanceService;
    private final TokenValidationService validationService;
    private final RevocationPublisher revocationPublisher;
    private final TokenStore tokenStore;
    private final BackendTimeoutHelper timeoutHelper;

    @Inject
    public TokenLifecycleService(
            TokenIssuanceService issuanceService,
            TokenValidationService validationService,
            RevocationPublisher revocationPublisher,
            TokenStore tokenStore,
            StorageConfig storageConfig,
            TokenMetrics metrics) {
        this.issuanceService = issuanceService;
        this.validationService = validationService;
        this.revocationPublisher = revocationPublisher;
        this.tokenStore = tokenStore;
        this.timeoutHelper = new BackendTimeoutHelper(storageConfig.timeout(), metrics, "token-store");
    }

    @Override
    public Uni<IssuedToken> issue(IssueRequest request) {
        return issuanceService.issue(request);
    }

    @Override
    public Uni<IssuedToken> authenticate(AuthenticationRequest request) {
        return issuanceService.authenticate(request);
    }

    @Override
    public Uni<TokenPayload> validate(String token, String presentedBind) {
        return validationService.validate(token, presentedBind);
    }

    @Override
    public Uni<TokenPayload> validate(String token, String presentedBind, Duration timeout) {
        return validationService.validate(token, presentedBind, timeout);
    }

    @Override
    public Uni<RevocationEvent> revoke(RevocationCriteria criteria) {
        return revocationPublisher.record(criteria);
    }

    @Override
    public Uni<Void> logout(String token) {
        return logout(token, null);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The token is validated first, so logging out with an invalid token fails with
     * the validation error.
     */
    @Override
    public Uni<Void> logout(String token, String presentedBind) {
        return validationService.validate(token, presentedBind).flatMap(payload -> {
            if (TokenFormat.detect(token).orElseThrow() == TokenFormat.OPAQUE) {
                LOG.debugf("Logging out opaque token %s", payload.auditId());
                return timeoutHelper.withTimeout(tokenStore.delete(TokenFormat.OPAQUE.body(token)), "delete");
            }
            LOG.debugf("Logging out token %s by audit id", payload.auditId());
            return revocationPublisher
                    .record(RevocationCriteria.builder()
                            .auditId(payload.auditId())
                            .build())
                    .replaceWithVoid();
        });
    }

    @Override
    public Uni<List<RevocationEvent>> listRevocations(Instant since) {
        return Uni.createFrom().item(() -> revocationPublisher.listEvents(since));
    }
}
