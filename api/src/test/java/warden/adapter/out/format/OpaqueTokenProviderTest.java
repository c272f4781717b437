package warden.adapter.out.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryTokenStore;
import warden.adapter.out.telemetry.MicrometerTokenMetrics;
import warden.core.exception.MalformedTokenException;
import warden.core.exception.TokenExpiredException;
import warden.core.exception.TokenNotFoundException;
import warden.support.MutableClock;
import warden.support.TestConfigs;
import warden.support.TestEngine;

@DisplayName("OpaqueTokenProvider")
class OpaqueTokenProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryTokenStore tokenStore;
    private OpaqueTokenProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestEngine.START);
        tokenStore = new InMemoryTokenStore();
        provider = new OpaqueTokenProvider(
                tokenStore, clock, TestConfigs.storage(), new MicrometerTokenMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("should store the payload under a random 32 byte id")
    void storesPayload() {
        final var payload = payload().build();

        final var token = provider.encode(payload).await().atMost(TIMEOUT);

        assertTrue(token.startsWith("op_"));
        assertEquals(3 + OpaqueTokenProvider.ID_LENGTH, token.length());
        assertEquals(payload, provider.decode(token).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should fail once the token has been deleted from the store")
    void deletedTokenNotFound() {
        final var token = provider.encode(payload().build()).await().atMost(TIMEOUT);

        tokenStore.delete(token.substring(3)).await().atMost(TIMEOUT);

        assertThrows(TokenNotFoundException.class, () -> provider.decode(token).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should reject ids of the wrong length without a lookup")
    void rejectsWrongLength() {
        assertThrows(MalformedTokenException.class, () -> provider.decode("op_short").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should refuse to store a payload that has already expired")
    void refusesExpiredPayload() {
        clock.advance(Duration.ofHours(2));

        assertThrows(
                TokenExpiredException.class,
                () -> provider.encode(payload().build()).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should refuse a payload with less than a millisecond left")
    void refusesSubMillisecondRemainder() {
        final var payload = payload().build();
        clock.set(payload.expiresAt().minusNanos(500_000));

        assertThrows(TokenExpiredException.class, () -> provider.encode(payload).await().atMost(TIMEOUT));
    }
}
