package warden.core.service.key;

import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.EncryptionKeyConfig;
import warden.core.model.key.EncryptionKeyRecord;
import warden.core.model.key.KeyStatus;
import warden.spi.EncryptionKeyRepository;

/**
 * Registry for the AES-256 keys of the encrypted token format.
 *
 * <p>Follows the same snapshot model as {@link SigningKeyRegistry}: one immutable
 * state object swapped atomically. Encryption always uses the primary (ACTIVE) key.
 * Decryption accepts the primary key and DEPRECATED keys still inside
 * {@code warden.keys.encryption.grace-period}; the grace check runs against the
 * clock on every lookup so a key stops decrypting exactly when its window closes.
 */
@ApplicationScoped
public class EncryptionKeyRegistry {

    private static final Logger LOG = Logger.getLogger(EncryptionKeyRegistry.class);
    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final EncryptionKeyRepository repository;
    private final EncryptionKeyConfig config;
    private final Clock clock;

    private record CacheState(EncryptionKeyRecord primaryKey, Map<String, EncryptionKeyRecord> keysById) {

        static final CacheState EMPTY = new CacheState(null, Map.of());
    }

    private volatile CacheState cache = CacheState.EMPTY;

    @Inject
    public EncryptionKeyRegistry(EncryptionKeyRepository repository, EncryptionKeyConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    void init(@Observes StartupEvent event) {
        LOG.info("Initializing encryption key registry...");
        initialize().await().atMost(STARTUP_TIMEOUT);
        LOG.info("Encryption key registry initialized");
    }

    /**
     * Ensure a primary key exists and load the cache.
     *
     * <p>Configured keys ({@code keyId:base64} entries) are stored when the repository
     * has no ACTIVE key: the first as primary, the rest as DEPRECATED. Without
     * configured keys a fresh key is generated.
     */
    public Uni<Void> initialize() {
        return repository
                .findActive()
                .flatMap(active -> active.isPresent() ? Uni.createFrom().voidItem() : bootstrap())
                .flatMap(v -> refreshCache());
    }

    /**
     * The key new tokens are encrypted under.
     *
     * @throws IllegalStateException if no primary key is loaded
     */
    public EncryptionKeyRecord getPrimaryKey() {
        final var key = cache.primaryKey();
        if (key == null) {
            throw new IllegalStateException("No active encryption key configured");
        }
        return key;
    }

    /**
     * Find a key able to decrypt tokens now.
     *
     * @param keyId key id embedded in the token
     * @return the key, or empty if unknown, retired or deprecated past the grace period
     */
    public Optional<EncryptionKeyRecord> getDecryptionKey(String keyId) {
        final var key = cache.keysById().get(keyId);
        if (key == null || !key.canDecryptAt(clock.instant(), config.gracePeriod())) {
            return Optional.empty();
        }
        return Optional.of(key);
    }

    /**
     * Register a freshly generated key with PENDING status.
     */
    public Uni<EncryptionKeyRecord> generateAndRegisterKey() {
        final SecretKey secretKey;
        try {
            secretKey = generateSecretKey();
        } catch (NoSuchAlgorithmException e) {
            return Uni.createFrom().failure(new IllegalStateException("AES algorithm not available", e));
        }
        final var key = EncryptionKeyRecord.pending(generateKeyId(), secretKey, clock.instant());
        LOG.infov("Registering new encryption key: {0}", key.keyId());
        return repository.store(key).replaceWith(key);
    }

    /**
     * Make a key primary. The previous primary is deprecated and keeps decrypting for
     * the grace period.
     */
    public Uni<Void> activateKey(String keyId) {
        LOG.infov("Activating encryption key: {0}", keyId);

        return repository
                .findActive()
                .flatMap(currentActive -> {
                    final Uni<Void> deprecateOld = currentActive
                            .filter(old -> !old.keyId().equals(keyId))
                            .map(old -> repository.updateStatus(old.keyId(), KeyStatus.DEPRECATED, clock.instant()))
                            .orElse(Uni.createFrom().voidItem());
                    return deprecateOld.flatMap(v -> repository.updateStatus(keyId, KeyStatus.ACTIVE, clock.instant()));
                })
                .flatMap(v -> refreshCache());
    }

    public Uni<Void> retireKey(String keyId) {
        LOG.warnv("Retiring encryption key: {0} - tokens encrypted with this key will no longer validate", keyId);

        return repository
                .updateStatus(keyId, KeyStatus.RETIRED, clock.instant())
                .flatMap(v -> refreshCache());
    }

    @Scheduled(
            every = "${warden.keys.encryption.cache-refresh-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> refreshCache() {
        return repository
                .findAll()
                .invoke(keys -> {
                    EncryptionKeyRecord primary = null;
                    final var byId = new HashMap<String, EncryptionKeyRecord>();
                    for (var key : keys) {
                        if (key.status() == KeyStatus.ACTIVE) {
                            if (primary == null || activation(key).isAfter(activation(primary))) {
                                primary = key;
                            }
                            byId.put(key.keyId(), key);
                        } else if (key.status() == KeyStatus.DEPRECATED) {
                            byId.put(key.keyId(), key);
                        }
                    }
                    this.cache = new CacheState(primary, Map.copyOf(byId));
                    LOG.debugv(
                            "Encryption key cache refreshed: primary {0}, {1} usable keys",
                            primary != null ? primary.keyId() : "none", byId.size());
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Failed to refresh encryption key cache", e));
    }

    private static Instant activation(EncryptionKeyRecord key) {
        return key.activatedAt() != null ? key.activatedAt() : key.createdAt();
    }

    private Uni<Void> bootstrap() {
        final var now = clock.instant();
        final var configured = config.keys().orElse(List.of());
        if (!configured.isEmpty()) {
            final var records = new ArrayList<EncryptionKeyRecord>();
            for (int i = 0; i < configured.size(); i++) {
                final var entry = configured.get(i).trim();
                final var separator = entry.indexOf(':');
                if (separator <= 0) {
                    return Uni.createFrom()
                            .failure(new IllegalArgumentException("Encryption key entries must be keyId:base64Key"));
                }
                final var keyId = entry.substring(0, separator);
                final var secretKey = EncryptionKeyRecord.parseSecretKey(entry.substring(separator + 1));
                final var active = EncryptionKeyRecord.active(keyId, secretKey, now);
                records.add(i == 0 ? active : active.withStatus(KeyStatus.DEPRECATED, now));
            }
            LOG.infov("Loading {0} configured encryption keys, primary {1}", records.size(), records.get(0).keyId());
            return Uni.join()
                    .all(records.stream().map(repository::store).toList())
                    .andFailFast()
                    .replaceWithVoid();
        }

        LOG.info("No encryption key configured, generating one");
        try {
            final var key = EncryptionKeyRecord.active(generateKeyId(), generateSecretKey(), now);
            return repository.store(key).invoke(() -> LOG.infov("Generated encryption key {0}", key.keyId()));
        } catch (NoSuchAlgorithmException e) {
            return Uni.createFrom().failure(new IllegalStateException("AES algorithm not available", e));
        }
    }

    private static String generateKeyId() {
        return "e-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static SecretKey generateSecretKey() throws NoSuchAlgorithmException {
        final var keyGen = KeyGenerator.getInstance("AES");
        keyGen.init(EncryptionKeyRecord.KEY_LENGTH_BYTES * 8);
        return keyGen.generateKey();
    }
}
