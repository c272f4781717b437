package warden.core.service.key;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SigningKeyConfig;
import warden.core.model.key.KeyStatus;
import warden.core.model.key.SigningKeyRecord;
import warden.spi.SigningKeyRepository;

/**
 * Registry for RSA signing keys with in-memory caching.
 *
 * <p>Provides O(1) access to signing keys on the hot path (token issuance and
 * validation). Keys are cached as one immutable snapshot and refreshed periodically
 * from the repository.
 *
 * <h2>Thread Safety</h2>
 * All public methods are thread-safe. Readers see a single volatile snapshot that is
 * replaced atomically on refresh.
 */
@ApplicationScoped
public class SigningKeyRegistry {

    private static final Logger LOG = Logger.getLogger(SigningKeyRegistry.class);
    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final SigningKeyRepository repository;
    private final SigningKeyConfig config;
    private final Clock clock;

    /**
     * Immutable cache state snapshot.
     */
    private record CacheState(
            SigningKeyRecord activeKey,
            Map<String, SigningKeyRecord> verificationKeyMap,
            List<SigningKeyRecord> verificationKeys) {

        static final CacheState EMPTY = new CacheState(null, Map.of(), List.of());
    }

    private volatile CacheState cache = CacheState.EMPTY;

    @Inject
    public SigningKeyRegistry(SigningKeyRepository repository, SigningKeyConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    void init(@Observes StartupEvent event) {
        LOG.info("Initializing signing key registry...");
        initialize().await().atMost(STARTUP_TIMEOUT);
        LOG.info("Signing key registry initialized");
    }

    /**
     * Ensure an active key exists and load the cache.
     *
     * <p>When the repository has no ACTIVE key, the configured static key is stored, or
     * a fresh key pair is generated when none is configured.
     *
     * @return Uni completing when the registry is ready
     */
    public Uni<Void> initialize() {
        return repository
                .findActive()
                .flatMap(active -> active.isPresent() ? Uni.createFrom().voidItem() : bootstrap())
                .flatMap(v -> refreshCache());
    }

    /**
     * Get the current active signing key.
     *
     * @return the active key
     * @throws IllegalStateException if no active key is loaded
     */
    public SigningKeyRecord getCurrentSigningKey() {
        final var key = cache.activeKey();
        if (key == null) {
            throw new IllegalStateException("No active signing key configured");
        }
        return key;
    }

    /**
     * Get a verification key by its id.
     *
     * @param keyId the {@code kid} header value
     * @return the key if known and ACTIVE or DEPRECATED
     */
    public Optional<SigningKeyRecord> getVerificationKey(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.verificationKeyMap().get(keyId));
    }

    public List<SigningKeyRecord> getVerificationKeys() {
        return cache.verificationKeys();
    }

    /**
     * Generate a new RSA key pair and store it with PENDING status.
     *
     * @return the created key record
     */
    public Uni<SigningKeyRecord> generateAndRegisterKey() {
        try {
            final var keyPair = generateKeyPair();
            final var key = SigningKeyRecord.pending(
                    generateKeyId(),
                    (RSAPrivateKey) keyPair.getPrivate(),
                    (RSAPublicKey) keyPair.getPublic(),
                    clock.instant());

            LOG.infov("Registering new signing key: {0}", key.keyId());

            return repository
                    .store(key)
                    .replaceWith(key)
                    .invoke(k -> LOG.infov("Key {0} registered with PENDING status", k.keyId()));
        } catch (NoSuchAlgorithmException e) {
            return Uni.createFrom().failure(new IllegalStateException("RSA algorithm not available", e));
        }
    }

    /**
     * Activate a pending key, deprecating the current active key.
     *
     * @param keyId the key to activate
     * @return Uni completing when activated and the cache refreshed
     */
    public Uni<Void> activateKey(String keyId) {
        LOG.infov("Activating key: {0}", keyId);

        return repository
                .findActive()
                .flatMap(currentActive -> {
                    final Uni<Void> deprecateOld = currentActive
                            .filter(old -> !old.keyId().equals(keyId))
                            .map(old -> repository.updateStatus(old.keyId(), KeyStatus.DEPRECATED, clock.instant()))
                            .orElse(Uni.createFrom().voidItem());

                    return deprecateOld.flatMap(v -> repository.updateStatus(keyId, KeyStatus.ACTIVE, clock.instant()));
                })
                .invoke(() -> LOG.infov("Key {0} activated", keyId))
                .flatMap(v -> refreshCache());
    }

    /**
     * Retire a key (stop all usage).
     */
    public Uni<Void> retireKey(String keyId) {
        LOG.warnv("Retiring key: {0} - tokens signed with this key will no longer validate", keyId);

        return repository
                .updateStatus(keyId, KeyStatus.RETIRED, clock.instant())
                .invoke(() -> LOG.warnv("Key {0} retired", keyId))
                .flatMap(v -> refreshCache());
    }

    /**
     * Refresh the in-memory cache from the repository.
     *
     * <p>If the refresh fails, the cached keys continue to be used.
     */
    @Scheduled(
            every = "${warden.keys.signing.cache-refresh-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> refreshCache() {
        LOG.debug("Refreshing signing key cache...");

        return Uni.combine()
                .all()
                .unis(repository.findActive(), repository.findAllForVerification())
                .asTuple()
                .invoke(tuple -> {
                    final var newActiveKey = tuple.getItem1().orElse(null);
                    final var newVerificationKeys = tuple.getItem2();

                    final var newMap = new HashMap<String, SigningKeyRecord>();
                    for (var key : newVerificationKeys) {
                        newMap.put(key.keyId(), key);
                    }

                    this.cache =
                            new CacheState(newActiveKey, Map.copyOf(newMap), List.copyOf(newVerificationKeys));

                    LOG.debugv(
                            "Signing key cache refreshed: {0} active key, {1} verification keys",
                            newActiveKey != null ? newActiveKey.keyId() : "none", newVerificationKeys.size());
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Failed to refresh signing key cache", e));
    }

    private Uni<Void> bootstrap() {
        final var now = clock.instant();
        final var configured = config.privateKey();
        if (configured.isPresent()) {
            final var privateKey = SigningKeyRecord.parsePrivateKey(configured.get());
            final var publicKey = SigningKeyRecord.derivePublicKey(privateKey);
            LOG.infov("Loading configured signing key: {0}", config.keyId());
            return repository.store(SigningKeyRecord.active(config.keyId(), privateKey, publicKey, now));
        }

        LOG.info("No signing key configured, generating one");
        try {
            final var keyPair = generateKeyPair();
            final var key = SigningKeyRecord.active(
                    generateKeyId(), (RSAPrivateKey) keyPair.getPrivate(), (RSAPublicKey) keyPair.getPublic(), now);
            return repository.store(key).invoke(() -> LOG.infov("Generated signing key {0}", key.keyId()));
        } catch (NoSuchAlgorithmException e) {
            return Uni.createFrom().failure(new IllegalStateException("RSA algorithm not available", e));
        }
    }

    /**
     * Format: k-{year}-q{quarter}-{short-uuid}, e.g. k-2024-q1-a1b2c3d4.
     */
    private String generateKeyId() {
        final var date = clock.instant().atZone(ZoneOffset.UTC);
        final var quarter = (date.getMonthValue() - 1) / 3 + 1;
        final var shortUuid = UUID.randomUUID().toString().substring(0, 8);
        return String.format("k-%d-q%d-%s", date.getYear(), quarter, shortUuid);
    }

    private KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        final var keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(config.keySize());
        return keyGen.generateKeyPair();
    }
}
