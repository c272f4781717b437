package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.token.TokenFormat;
import warden.core.model.token.TokenPayload;

/**
 * SPI for token representations.
 *
 * <p>Each provider owns one {@link TokenFormat}. Encoded tokens must start with the
 * format's tag. Decoding must verify integrity (signature, authentication tag or
 * store lookup) before any payload field is read.
 *
 * <h2>Registration</h2>
 * Providers are CDI beans discovered by {@code TokenFormatRegistry}:
 * <pre>{@code
 * @ApplicationScoped
 * public class MyFormatProvider implements TokenFormatProvider {
 *     // ...
 * }
 * }</pre>
 */
public interface TokenFormatProvider {

    /**
     * The format this provider handles.
     */
    TokenFormat format();

    /**
     * Encode a payload into a token string.
     *
     * @param payload the payload
     * @return the tagged token
     */
    Uni<String> encode(TokenPayload payload);

    /**
     * Decode and verify a token string.
     *
     * @param token the tagged token
     * @return the payload; fails with a {@code WardenException} subtype
     */
    Uni<TokenPayload> decode(String token);
}
