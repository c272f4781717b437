package warden.adapter.out.format;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.exception.DecompressionException;
import warden.core.model.token.TokenFormat;
import warden.core.service.key.SigningKeyRegistry;

/**
 * RS256 signed tokens with a DEFLATE compressed payload ({@code jz_}).
 *
 * <p>Compression happens before signing, so inflation only ever runs on verified
 * bytes. Inflated payloads are capped at {@value #MAX_INFLATED_BYTES} bytes.
 */
@ApplicationScoped
public class CompressedSignedTokenProvider extends AbstractSignedTokenProvider {

    static final int MAX_INFLATED_BYTES = 64 * 1024;

    private static final int BUFFER_SIZE = 1024;

    @Inject
    public CompressedSignedTokenProvider(SigningKeyRegistry keyRegistry, PayloadCodec codec) {
        super(keyRegistry, codec);
    }

    @Override
    public TokenFormat format() {
        return TokenFormat.SIGNED_COMPRESSED;
    }

    @Override
    protected byte[] wrap(byte[] payloadBytes) {
        final var deflater = new Deflater(Deflater.BEST_COMPRESSION, true);
        try {
            deflater.setInput(payloadBytes);
            deflater.finish();
            final var out = new ByteArrayOutputStream(payloadBytes.length);
            final var buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                out.write(buffer, 0, deflater.deflate(buffer));
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    protected byte[] unwrap(byte[] signedBytes) {
        final var inflater = new Inflater(true);
        try {
            inflater.setInput(signedBytes);
            final var out = new ByteArrayOutputStream(signedBytes.length * 4);
            final var buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                final var count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecompressionException("Compressed payload is truncated");
                }
                out.write(buffer, 0, count);
                if (out.size() > MAX_INFLATED_BYTES) {
                    throw new DecompressionException("Compressed payload exceeds " + MAX_INFLATED_BYTES + " bytes");
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new DecompressionException("Payload is not valid DEFLATE data", e);
        } finally {
            inflater.end();
        }
    }
}
