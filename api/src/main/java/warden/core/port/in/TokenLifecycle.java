package warden.core.port.in;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.revocation.RevocationCriteria;
import warden.core.model.revocation.RevocationEvent;
import warden.core.model.token.AuthenticationRequest;
import warden.core.model.token.IssueRequest;
import warden.core.model.token.IssuedToken;
import warden.core.model.token.TokenPayload;

/**
 * Port interface for the token lifecycle exposed to inbound adapters.
 */
public interface TokenLifecycle {

    /**
     * Mint a token for an already authenticated principal.
     *
     * @param request the issuance inputs
     * @return the issued token
     */
    Uni<IssuedToken> issue(IssueRequest request);

    /**
     * Authenticate with one or more methods and mint a token.
     *
     * @param request the authentication request
     * @return the issued token
     */
    Uni<IssuedToken> authenticate(AuthenticationRequest request);

    /**
     * Validate a token.
     *
     * @param token         the raw token
     * @param presentedBind the binding presented by the client, or null
     * @return the payload of a valid token; fails with the first failed check
     */
    Uni<TokenPayload> validate(String token, String presentedBind);

    /**
     * Validate a token with a caller-supplied storage timeout.
     */
    Uni<TokenPayload> validate(String token, String presentedBind, Duration timeout);

    /**
     * Record a revocation event.
     *
     * @param criteria which tokens to revoke
     * @return the recorded event
     */
    Uni<RevocationEvent> revoke(RevocationCriteria criteria);

    /**
     * Invalidate a single token.
     *
     * <p>Opaque tokens are removed from the token store; self-describing tokens are
     * revoked by their audit id.
     *
     * @param token the raw token
     * @return Uni completing when the token no longer validates
     */
    Uni<Void> logout(String token);

    /**
     * Invalidate a single bound token.
     *
     * @param token         the raw token
     * @param presentedBind the binding presented by the client, or null
     */
    Uni<Void> logout(String token, String presentedBind);

    /**
     * Revocation events recorded at or after {@code since}.
     */
    Uni<List<RevocationEvent>> listRevocations(Instant since);
}
