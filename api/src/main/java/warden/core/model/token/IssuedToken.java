package warden.core.model.token;

import java.util.Objects;

/**
 * A freshly minted token string together with the payload it carries.
 *
 * @param token   the token string handed to the client
 * @param format  the representation the token was encoded in
 * @param payload the payload
 */
public record IssuedToken(String token, TokenFormat format, TokenPayload payload) {

    public IssuedToken {
        Objects.requireNonNull(token, "token is required");
        Objects.requireNonNull(format, "format is required");
        Objects.requireNonNull(payload, "payload is required");
    }
}
