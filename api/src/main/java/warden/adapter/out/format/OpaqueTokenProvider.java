package warden.adapter.out.format;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.config.StorageConfig;
import warden.core.exception.MalformedTokenException;
import warden.core.exception.TokenExpiredException;
import warden.core.exception.TokenNotFoundException;
import warden.core.model.token.TokenFormat;
import warden.core.model.token.TokenPayload;
import warden.core.port.out.TokenMetrics;
import warden.core.port.out.TokenStore;
import warden.core.service.common.BackendTimeoutHelper;
import warden.spi.TokenFormatProvider;

/**
 * Opaque reference tokens ({@code op_}).
 *
 * <p>The token is 32 random bytes, base64url encoded. The payload lives in the
 * {@link TokenStore} under that id until the token expires or is logged out.
 */
@ApplicationScoped
public class OpaqueTokenProvider implements TokenFormatProvider {

    static final int ID_BYTES = 32;
    static final int ID_LENGTH = 43;

    private final TokenStore tokenStore;
    private final Clock clock;
    private final BackendTimeoutHelper timeoutHelper;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public OpaqueTokenProvider(TokenStore tokenStore, Clock clock, StorageConfig storageConfig, TokenMetrics metrics) {
        this.tokenStore = tokenStore;
        this.clock = clock;
        this.timeoutHelper = new BackendTimeoutHelper(storageConfig.timeout(), metrics, "token-store");
    }

    @Override
    public TokenFormat format() {
        return TokenFormat.OPAQUE;
    }

    @Override
    public Uni<String> encode(TokenPayload payload) {
        final var ttl = Duration.between(clock.instant(), payload.expiresAt());
        if (ttl.toMillis() < 1) {
            return Uni.createFrom().failure(new TokenExpiredException("Payload already expired"));
        }
        final var id = newId();
        return timeoutHelper
                .withTimeout(tokenStore.put(id, payload, ttl), "put")
                .replaceWith(format().tag() + id);
    }

    @Override
    public Uni<TokenPayload> decode(String token) {
        final var id = format().body(token);
        if (id.length() != ID_LENGTH) {
            return Uni.createFrom().failure(new MalformedTokenException("Opaque token id has the wrong length"));
        }
        return tokenStore
                .get(id)
                .map(found -> found.orElseThrow(() -> new TokenNotFoundException("Token not found")));
    }

    private String newId() {
        final var bytes = new byte[ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
