package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.token.TokenPayload;

/**
 * Port interface for the key/value store backing opaque tokens.
 *
 * <p>Entries must expire on their own once their TTL elapses. Implementations
 * report backend failures as failed Unis; timeouts are applied by the caller.
 */
public interface TokenStore {

    /**
     * Store a payload under a token id.
     *
     * @param id      token id
     * @param payload the payload
     * @param ttl     time to live, positive
     * @return Uni completing when stored
     */
    Uni<Void> put(String id, TokenPayload payload, Duration ttl);

    /**
     * Look up a payload.
     *
     * @param id token id
     * @return the payload, or empty if absent or expired
     */
    Uni<Optional<TokenPayload>> get(String id);

    /**
     * Remove a payload. Removing an absent id is not an error.
     *
     * @param id token id
     * @return Uni completing when removed
     */
    Uni<Void> delete(String id);
}
