package warden.adapter.out.format;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.lang.JoseException;

import warden.core.exception.MalformedTokenException;
import warden.core.exception.SignatureInvalidException;
import warden.core.model.token.TokenPayload;
import warden.core.service.key.SigningKeyRegistry;
import warden.spi.TokenFormatProvider;

/**
 * Base class of the RS256 signed token formats.
 *
 * <p>The token body is a JWS compact serialization whose {@code kid} header names the
 * signing key. Subclasses may transform the serialized payload before signing and
 * after verification. Nothing in the payload is read before the signature verifies.
 */
abstract class AbstractSignedTokenProvider implements TokenFormatProvider {

    private static final Logger LOG = Logger.getLogger(AbstractSignedTokenProvider.class);

    private static final AlgorithmConstraints RS256_ONLY =
            new AlgorithmConstraints(ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256);

    private final SigningKeyRegistry keyRegistry;
    private final PayloadCodec codec;

    protected AbstractSignedTokenProvider(SigningKeyRegistry keyRegistry, PayloadCodec codec) {
        this.keyRegistry = keyRegistry;
        this.codec = codec;
    }

    /**
     * Transform serialized payload bytes before they are signed.
     */
    protected abstract byte[] wrap(byte[] payloadBytes);

    /**
     * Reverse {@link #wrap} on verified bytes.
     */
    protected abstract byte[] unwrap(byte[] signedBytes);

    @Override
    public Uni<String> encode(TokenPayload payload) {
        return Uni.createFrom().item(() -> {
            final var signingKey = keyRegistry.getCurrentSigningKey();
            final var jws = new JsonWebSignature();
            jws.setPayloadBytes(wrap(codec.toBytes(payload)));
            jws.setKey(signingKey.privateKey());
            jws.setKeyIdHeaderValue(signingKey.keyId());
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
            try {
                return format().tag() + jws.getCompactSerialization();
            } catch (JoseException e) {
                throw new IllegalStateException("Failed to sign token: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Uni<TokenPayload> decode(String token) {
        return Uni.createFrom().item(() -> codec.fromBytes(unwrap(verify(format().body(token)))));
    }

    private byte[] verify(String compact) {
        final var jws = new JsonWebSignature();
        jws.setAlgorithmConstraints(RS256_ONLY);
        final String keyId;
        try {
            jws.setCompactSerialization(compact);
            keyId = jws.getKeyIdHeaderValue();
        } catch (JoseException | RuntimeException e) {
            throw new MalformedTokenException("Token is not a valid JWS", e);
        }

        final var key = keyRegistry
                .getVerificationKey(keyId)
                .orElseThrow(() -> {
                    LOG.debugf("No verification key for kid %s", keyId);
                    return new SignatureInvalidException("Token signed with an unknown key");
                });
        jws.setKey(key.publicKey());

        final boolean verified;
        try {
            verified = jws.verifySignature();
        } catch (JoseException | RuntimeException e) {
            throw new SignatureInvalidException("Token signature could not be verified", e);
        }
        if (!verified) {
            throw new SignatureInvalidException("Token signature is invalid");
        }

        try {
            return jws.getPayloadBytes();
        } catch (JoseException e) {
            throw new MalformedTokenException("Token payload is malformed", e);
        }
    }
}
