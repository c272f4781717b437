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

import warden.core.model.key.KeyStatus;
import warden.core.model.key.SigningKeyRecord;
import warden.spi.SigningKeyRepository;

/**
 * In-memory signing key repository.
 *
 * <p><strong>Warning:</strong> keys are lost on restart and not shared across
 * instances. With more than one instance, either configure the same static key on
 * each or provide a persistent {@link SigningKeyRepository} (e.g. Vault, database).
 */
@ApplicationScoped
@DefaultBean
public class InMemorySigningKeyRepository implements SigningKeyRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySigningKeyRepository.class);

    private final ConcurrentMap<String, SigningKeyRecord> keys = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> store(SigningKeyRecord key) {
        return Uni.createFrom().item(() -> {
            keys.put(key.keyId(), key);
            LOG.debugv("Stored signing key: {0} (status: {1})", key.keyId(), key.status());
            return null;
        });
    }

    @Override
    public Uni<Optional<SigningKeyRecord>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<Optional<SigningKeyRecord>> findActive() {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == KeyStatus.ACTIVE)
                .max(Comparator.comparing(
                        key -> key.activatedAt() != null ? key.activatedAt() : key.createdAt())));
    }

    @Override
    public Uni<List<SigningKeyRecord>> findAllForVerification() {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(SigningKeyRecord::canVerify)
                .toList());
    }

    @Override
    public Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status) {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == status)
                .toList());
    }

    @Override
    public Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime) {
        return Uni.createFrom().item(() -> {
            final var updated = keys.computeIfPresent(keyId, (id, existing) -> existing.withStatus(newStatus, transitionTime));
            if (updated == null) {
                throw new IllegalArgumentException("Key not found: " + keyId);
            }
            LOG.debugv("Updated signing key {0} status to {1}", keyId, newStatus);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String keyId) {
        return Uni.createFrom().item(() -> {
            if (keys.remove(keyId) != null) {
                LOG.debugv("Deleted signing key: {0}", keyId);
            }
            return null;
        });
    }
}
