package warden.adapter.out.key;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.key.EncryptionKeyRecord;
import warden.core.model.key.KeyStatus;
import warden.spi.EncryptionKeyRepository;

/**
 * In-memory encryption key repository. Same caveats as {@link InMemorySigningKeyRepository}.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryEncryptionKeyRepository implements EncryptionKeyRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryEncryptionKeyRepository.class);

    private final ConcurrentMap<String, EncryptionKeyRecord> keys = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> store(EncryptionKeyRecord key) {
        return Uni.createFrom().item(() -> {
            keys.put(key.keyId(), key);
            LOG.debugv("Stored encryption key: {0} (status: {1})", key.keyId(), key.status());
            return null;
        });
    }

    @Override
    public Uni<Optional<EncryptionKeyRecord>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<Optional<EncryptionKeyRecord>> findActive() {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == KeyStatus.ACTIVE)
                .max(Comparator.comparing(
                        key -> key.activatedAt() != null ? key.activatedAt() : key.createdAt())));
    }

    @Override
    public Uni<List<EncryptionKeyRecord>> findByStatus(KeyStatus status) {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == status)
                .toList());
    }

    @Override
    public Uni<List<EncryptionKeyRecord>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(keys.values()));
    }

    @Override
    public Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime) {
        return Uni.createFrom().item(() -> {
            final var updated = keys.computeIfPresent(keyId, (id, existing) -> existing.withStatus(newStatus, transitionTime));
            if (updated == null) {
                throw new IllegalArgumentException("Key not found: " + keyId);
            }
            LOG.debugv("Updated encryption key {0} status to {1}", keyId, newStatus);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String keyId) {
        return Uni.createFrom().item(() -> {
            if (keys.remove(keyId) != null) {
                LOG.debugv("Deleted encryption key: {0}", keyId);
            }
            return null;
        });
    }
}
