package warden.adapter.out.format;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.model.token.TokenFormat;
import warden.core.service.key.SigningKeyRegistry;

/**
 * RS256 signed tokens ({@code js_}).
 */
@ApplicationScoped
public class SignedTokenProvider extends AbstractSignedTokenProvider {

    @Inject
    public SignedTokenProvider(SigningKeyRegistry keyRegistry, PayloadCodec codec) {
        super(keyRegistry, codec);
    }

    @Override
    public TokenFormat format() {
        return TokenFormat.SIGNED;
    }

    @Override
    protected byte[] wrap(byte[] payloadBytes) {
        return payloadBytes;
    }

    @Override
    protected byte[] unwrap(byte[] signedBytes) {
        return signedBytes;
    }
}
