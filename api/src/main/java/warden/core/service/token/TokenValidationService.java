package warden.core.service.token;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.exception.BindMismatchException;
import warden.core.exception.TokenExpiredException;
import warden.core.exception.TokenRevokedException;
import warden.core.exception.WardenException;
import warden.core.model.token.TokenFormat;
import warden.core.model.token.TokenPayload;
import warden.core.port.out.TokenMetrics;
import warden.core.service.common.BackendTimeoutHelper;
import warden.core.service.revocation.RevocationLedger;

/**
 * Validates presented tokens.
 *
 * <p>Checks run cheapest first and stop at the first failure:
 * <ol>
 *   <li>format detection by tag</li>
 *   <li>provider decode, which verifies integrity before reading the payload</li>
 *   <li>expiry</li>
 *   <li>client binding</li>
 *   <li>revocation ledger</li>
 * </ol>
 *
 * <p>Validation never writes. Failures carry their precise {@code ErrorKind}; callers
 * facing clients should expose only the kind's exposure.
 */
@ApplicationScoped
public class TokenValidationService {

    private static final Logger LOG = Logger.getLogger(TokenValidationService.class);

    private final TokenFormatRegistry formats;
    private final RevocationLedger ledger;
    private final Clock clock;
    private final TokenMetrics metrics;
    private final BackendTimeoutHelper timeoutHelper;

    @Inject
    public TokenValidationService(
            TokenFormatRegistry formats,
            RevocationLedger ledger,
            StorageConfig storageConfig,
            Clock clock,
            TokenMetrics metrics) {
        this.formats = formats;
        this.ledger = ledger;
        this.clock = clock;
        this.metrics = metrics;
        this.timeoutHelper = new BackendTimeoutHelper(storageConfig.timeout(), metrics, "token-store");
    }

    public Uni<TokenPayload> validate(String token, String presentedBind) {
        return validate(token, presentedBind, null);
    }

    /**
     * Validate a token.
     *
     * @param token         the raw token
     * @param presentedBind binding presented alongside the token, or null
     * @param timeout       storage timeout for opaque lookups, or null for the default
     * @return the payload; fails with the exception of the first failed check
     */
    public Uni<TokenPayload> validate(String token, String presentedBind, Duration timeout) {
        return Uni.createFrom()
                .item(() -> formats.providerFor(token))
                .flatMap(provider -> timeoutHelper.withTimeout(provider.decode(token), "decode", timeout))
                .map(payload -> check(payload, presentedBind))
                .invoke(payload -> {
                    TokenFormat.detect(token).ifPresent(metrics::recordValidated);
                    LOG.debugf("Token %s valid for subject %s", payload.auditId(), payload.subjectId());
                })
                .onFailure(WardenException.class)
                .invoke(e -> {
                    final var kind = ((WardenException) e).kind();
                    metrics.recordRejected(kind);
                    LOG.debugf("Token rejected: %s", kind);
                });
    }

    private TokenPayload check(TokenPayload payload, String presentedBind) {
        if (payload.isExpiredAt(clock.instant())) {
            throw new TokenExpiredException("Token expired at " + payload.expiresAt());
        }
        if (payload.isBound() && !payload.bind().equals(presentedBind)) {
            throw new BindMismatchException("Token binding does not match");
        }
        if (ledger.isRevoked(payload)) {
            throw new TokenRevokedException("Token has been revoked");
        }
        return payload;
    }
}
