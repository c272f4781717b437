package warden.core.port.out;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.token.TokenScope;

/**
 * Contract tests for TokenStore implementations.
 *
 * <p>Storage providers extend this class and implement {@link #createStore()} to verify
 * their implementation conforms to the contract.
 */
public abstract class TokenStoreContractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration TTL = Duration.ofHours(1);

    /**
     * Create a fresh store connected to a clean backend.
     */
    protected abstract TokenStore createStore();

    private TokenStore store;

    @BeforeEach
    void setUpContract() {
        store = createStore();
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    @Nested
    @DisplayName("put() and get()")
    class PutAndGetTests {

        @Test
        @DisplayName("should return the stored payload")
        void returnsStoredPayload() {
            final var id = newId();
            final var payload = payload().bind("cert").trust("t1").build();

            store.put(id, payload, TTL).await().atMost(TIMEOUT);

            assertEquals(payload, store.get(id).await().atMost(TIMEOUT).orElseThrow());
        }

        @Test
        @DisplayName("should return empty for an unknown id")
        void emptyForUnknown() {
            assertTrue(store.get(newId()).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should keep payloads under different ids apart")
        void isolatesIds() {
            final var first = newId();
            final var second = newId();
            store.put(first, payload().build(), TTL).await().atMost(TIMEOUT);
            store.put(second, payload().subject("bob").scope(TokenScope.unscoped()).build(), TTL)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("alice", store.get(first).await().atMost(TIMEOUT).orElseThrow().subjectId());
            assertEquals("bob", store.get(second).await().atMost(TIMEOUT).orElseThrow().subjectId());
        }
    }

    @Nested
    @DisplayName("delete()")
    class DeleteTests {

        @Test
        @DisplayName("should remove the payload")
        void removesPayload() {
            final var id = newId();
            store.put(id, payload().build(), TTL).await().atMost(TIMEOUT);

            store.delete(id).await().atMost(TIMEOUT);

            assertTrue(store.get(id).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should accept unknown ids")
        void unknownIdIsNoOp() {
            assertDoesNotThrow(() -> store.delete(newId()).await().atMost(TIMEOUT));
        }
    }
}
