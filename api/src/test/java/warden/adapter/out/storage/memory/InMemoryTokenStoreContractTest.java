package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.port.out.TokenStore;
import warden.core.port.out.TokenStoreContractTest;

@DisplayName("InMemoryTokenStore contract")
class InMemoryTokenStoreContractTest extends TokenStoreContractTest {

    @Override
    protected TokenStore createStore() {
        return new InMemoryTokenStore();
    }

    @Test
    @DisplayName("entries should expire after their own TTL")
    void perEntryTtl() {
        final var nanos = new AtomicLong();
        final var store = new InMemoryTokenStore(nanos::get);
        store.put("short", payload().build(), Duration.ofMinutes(1)).await().indefinitely();
        store.put("long", payload().build(), Duration.ofHours(1)).await().indefinitely();

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());

        assertTrue(store.get("short").await().indefinitely().isEmpty());
        assertTrue(store.get("long").await().indefinitely().isPresent());
        assertEquals(1, store.size());
    }
}
