package warden.adapter.out.format;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.DecryptionException;
import warden.core.exception.KeyNotFoundException;
import warden.core.exception.MalformedTokenException;
import warden.core.model.key.EncryptionKeyRecord;
import warden.core.model.token.TokenFormat;
import warden.core.model.token.TokenPayload;
import warden.core.service.key.EncryptionKeyRegistry;
import warden.spi.TokenFormatProvider;

/**
 * AES-256-GCM encrypted tokens ({@code fe_}).
 *
 * <p>Token body: {@code keyId.base64url(iv || ciphertext || tag)} with a 12-byte IV and
 * a 128-bit tag. The key id is bound as additional authenticated data, so moving a
 * ciphertext under another key id fails authentication.
 */
@ApplicationScoped
public class EncryptedTokenProvider implements TokenFormatProvider {

    private static final Logger LOG = Logger.getLogger(EncryptedTokenProvider.class);

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final char KEY_ID_SEPARATOR = '.';

    private final EncryptionKeyRegistry keyRegistry;
    private final PayloadCodec codec;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public EncryptedTokenProvider(EncryptionKeyRegistry keyRegistry, PayloadCodec codec) {
        this.keyRegistry = keyRegistry;
        this.codec = codec;
    }

    @Override
    public TokenFormat format() {
        return TokenFormat.ENCRYPTED;
    }

    @Override
    public Uni<String> encode(TokenPayload payload) {
        return Uni.createFrom().item(() -> {
            final var key = keyRegistry.getPrimaryKey();
            final var iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);
            try {
                final var cipher = cipher(Cipher.ENCRYPT_MODE, key, iv);
                final var ciphertext = cipher.doFinal(codec.toBytes(payload));
                final var combined = ByteBuffer.allocate(iv.length + ciphertext.length)
                        .put(iv)
                        .put(ciphertext)
                        .array();
                return format().tag()
                        + key.keyId()
                        + KEY_ID_SEPARATOR
                        + Base64.getUrlEncoder().withoutPadding().encodeToString(combined);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Failed to encrypt token", e);
            }
        });
    }

    @Override
    public Uni<TokenPayload> decode(String token) {
        return Uni.createFrom().item(() -> codec.fromBytes(decrypt(format().body(token))));
    }

    private byte[] decrypt(String body) {
        final var separator = body.indexOf(KEY_ID_SEPARATOR);
        if (separator <= 0 || separator == body.length() - 1) {
            throw new MalformedTokenException("Encrypted token has no key id");
        }
        final var keyId = body.substring(0, separator);

        final byte[] combined;
        try {
            combined = Base64.getUrlDecoder().decode(body.substring(separator + 1));
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Encrypted token body is not base64url", e);
        }
        if (combined.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new MalformedTokenException("Encrypted token body is too short");
        }

        final var key = keyRegistry.getDecryptionKey(keyId).orElseThrow(() -> {
            LOG.debugf("No usable encryption key %s", keyId);
            return new KeyNotFoundException("Token encrypted with an unknown or expired key");
        });

        final var buffer = ByteBuffer.wrap(combined);
        final var iv = new byte[GCM_IV_LENGTH];
        buffer.get(iv);
        final var ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        try {
            return cipher(Cipher.DECRYPT_MODE, key, iv).doFinal(ciphertext);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Token failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Token could not be decrypted", e);
        }
    }

    private static Cipher cipher(int mode, EncryptionKeyRecord key, byte[] iv) throws GeneralSecurityException {
        final var cipher = Cipher.getInstance(CIPHER_ALGORITHM);
        cipher.init(mode, key.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        cipher.updateAAD(key.keyId().getBytes(StandardCharsets.UTF_8));
        return cipher;
    }
}
