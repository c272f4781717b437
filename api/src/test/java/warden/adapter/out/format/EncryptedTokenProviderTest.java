package warden.adapter.out.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.key.InMemoryEncryptionKeyRepository;
import warden.core.exception.DecryptionException;
import warden.core.exception.KeyNotFoundException;
import warden.core.exception.MalformedTokenException;
import warden.core.model.token.TokenPayload;
import warden.core.service.key.EncryptionKeyRegistry;
import warden.support.MutableClock;
import warden.support.TestConfigs;
import warden.support.TestEngine;

@DisplayName("EncryptedTokenProvider")
class EncryptedTokenProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String KEY_A = "key-a:" + Base64.getEncoder().encodeToString(new byte[32]);
    private static final String KEY_B = "key-b:" + Base64.getEncoder().encodeToString(filled((byte) 7));

    private MutableClock clock;
    private EncryptionKeyRegistry keyRegistry;
    private EncryptedTokenProvider provider;

    private static byte[] filled(byte value) {
        final var bytes = new byte[32];
        Arrays.fill(bytes, value);
        return bytes;
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestEngine.START);
        keyRegistry = new EncryptionKeyRegistry(
                new InMemoryEncryptionKeyRepository(),
                TestConfigs.encryptionKeys(Optional.of(List.of(KEY_A, KEY_B))),
                clock);
        keyRegistry.initialize().await().atMost(TestEngine.AWAIT);
        provider = new EncryptedTokenProvider(keyRegistry, new PayloadCodec());
    }

    private String encode(TokenPayload payload) {
        return provider.encode(payload).await().atMost(TIMEOUT);
    }

    private TokenPayload decode(String token) {
        return provider.decode(token).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("encode()")
    class EncodeTests {

        @Test
        @DisplayName("should embed the primary key id after the tag")
        void embedsPrimaryKeyId() {
            final var token = encode(payload().build());

            assertTrue(token.startsWith("fe_key-a."));
        }

        @Test
        @DisplayName("should use a fresh IV for every token")
        void freshIv() {
            final var payload = payload().build();

            assertNotEquals(encode(payload), encode(payload));
        }

        @Test
        @DisplayName("should decode to the encoded payload")
        void decodesToSamePayload() {
            final var payload = payload().trust("t1").build();

            assertEquals(payload, decode(encode(payload)));
        }
    }

    @Nested
    @DisplayName("decode()")
    class DecodeTests {

        @Test
        @DisplayName("should fail authentication when the ciphertext is altered")
        void rejectsTamperedCiphertext() {
            final var token = encode(payload().build());
            final var body = token.substring("fe_key-a.".length());
            final var bytes = Base64.getUrlDecoder().decode(body);
            bytes[bytes.length / 2] ^= 0x01;

            final var tampered = "fe_key-a." + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

            assertThrows(DecryptionException.class, () -> decode(tampered));
        }

        @Test
        @DisplayName("should fail authentication when the key id is swapped")
        void rejectsSwappedKeyId() {
            final var token = encode(payload().build());

            assertThrows(DecryptionException.class, () -> decode(token.replace("fe_key-a.", "fe_key-b.")));
        }

        @Test
        @DisplayName("should report an unknown key id")
        void rejectsUnknownKey() {
            final var token = encode(payload().build());

            assertThrows(KeyNotFoundException.class, () -> decode(token.replace("fe_key-a.", "fe_key-z.")));
        }

        @Test
        @DisplayName("should reject bodies without a key id or with bad base64")
        void rejectsMalformed() {
            assertThrows(MalformedTokenException.class, () -> decode("fe_nokeyid"));
            assertThrows(MalformedTokenException.class, () -> decode("fe_key-a.***"));
            assertThrows(MalformedTokenException.class, () -> decode("fe_key-a.AAAA"));
        }
    }

    @Nested
    @DisplayName("key rotation")
    class RotationTests {

        @Test
        @DisplayName("should decrypt under the previous key until its grace period ends")
        void gracePeriod() {
            final var token = encode(payload().build());

            final var next = keyRegistry.generateAndRegisterKey().await().atMost(TIMEOUT);
            keyRegistry.activateKey(next.keyId()).await().atMost(TIMEOUT);

            assertTrue(encode(payload().build()).startsWith("fe_" + next.keyId() + "."));

            clock.advance(Duration.ofMinutes(59));
            assertEquals("alice", decode(token).subjectId());

            clock.advance(Duration.ofMinutes(2));
            assertThrows(KeyNotFoundException.class, () -> decode(token));
        }
    }
}
