package warden.adapter.out.storage.memory;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.token.TokenPayload;
import warden.core.port.out.TokenStore;

/**
 * In-memory implementation of TokenStore backed by a Caffeine cache.
 *
 * <p>Each entry expires after its own TTL. Intended for development, testing and
 * single-instance deployments.
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStore.class);

    private final Cache<String, Entry> entries;

    public InMemoryTokenStore() {
        this(Ticker.systemTicker());
    }

    InMemoryTokenStore(Ticker ticker) {
        this.entries = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public Uni<Void> put(String id, TokenPayload payload, Duration ttl) {
        return Uni.createFrom().item(() -> {
            entries.put(id, new Entry(payload, ttl));
            LOG.debugf("Stored opaque token %s (TTL: %s)", payload.auditId(), ttl);
            return null;
        });
    }

    @Override
    public Uni<Optional<TokenPayload>> get(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(entries.getIfPresent(id)).map(Entry::payload));
    }

    @Override
    public Uni<Void> delete(String id) {
        return Uni.createFrom().item(() -> {
            entries.invalidate(id);
            return null;
        });
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private record Entry(TokenPayload payload, Duration ttl) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
