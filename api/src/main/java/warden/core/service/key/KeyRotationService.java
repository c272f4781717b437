package warden.core.service.key;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.EncryptionKeyConfig;
import warden.core.config.SigningKeyConfig;
import warden.core.model.key.EncryptionKeyRecord;
import warden.core.model.key.KeyStatus;
import warden.core.model.key.SigningKeyRecord;
import warden.spi.EncryptionKeyRepository;
import warden.spi.SigningKeyRepository;

/**
 * Rotation and lifecycle management for signing and encryption keys.
 *
 * <h2>Rotation Process</h2>
 * <ol>
 *   <li>Generate a new key with PENDING status</li>
 *   <li>After the activation delay, activate it; the previous key becomes DEPRECATED</li>
 *   <li>Signing keys are retired after the deprecation period, encryption keys after
 *       the grace period</li>
 *   <li>After the retention period, retired keys are deleted</li>
 * </ol>
 */
@ApplicationScoped
public class KeyRotationService {

    private static final Logger LOG = Logger.getLogger(KeyRotationService.class);

    private final SigningKeyRegistry signingRegistry;
    private final SigningKeyRepository signingRepository;
    private final SigningKeyConfig signingConfig;
    private final EncryptionKeyRegistry encryptionRegistry;
    private final EncryptionKeyRepository encryptionRepository;
    private final EncryptionKeyConfig encryptionConfig;
    private final Clock clock;

    @Inject
    public KeyRotationService(
            SigningKeyRegistry signingRegistry,
            SigningKeyRepository signingRepository,
            SigningKeyConfig signingConfig,
            EncryptionKeyRegistry encryptionRegistry,
            EncryptionKeyRepository encryptionRepository,
            EncryptionKeyConfig encryptionConfig,
            Clock clock) {
        this.signingRegistry = signingRegistry;
        this.signingRepository = signingRepository;
        this.signingConfig = signingConfig;
        this.encryptionRegistry = encryptionRegistry;
        this.encryptionRepository = encryptionRepository;
        this.encryptionConfig = encryptionConfig;
        this.clock = clock;
    }

    /**
     * Scheduled signing key rotation. The new key activates after the activation delay.
     */
    @Scheduled(
            cron = "${warden.keys.signing.schedule:0 0 0 1 */3 ?}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> rotateSigningKeys() {
        if (!signingConfig.rotationEnabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.info("Starting scheduled signing key rotation...");

        return signingRegistry
                .generateAndRegisterKey()
                .flatMap(newKey -> signingConfig.activationDelay().isZero()
                        ? signingRegistry.activateKey(newKey.keyId()).replaceWith(newKey)
                        : Uni.createFrom().item(newKey))
                .invoke(key -> LOG.infov("Signing key rotation completed: new key {0}", key.keyId()))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Signing key rotation failed", e));
    }

    /**
     * Scheduled encryption key rotation. The new key activates after the activation delay.
     */
    @Scheduled(
            cron = "${warden.keys.encryption.schedule:0 0 0 * * ?}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> rotateEncryptionKeys() {
        if (!encryptionConfig.rotationEnabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.info("Starting scheduled encryption key rotation...");

        return encryptionRegistry
                .generateAndRegisterKey()
                .flatMap(newKey -> encryptionConfig.activationDelay().isZero()
                        ? encryptionRegistry.activateKey(newKey.keyId()).replaceWith(newKey)
                        : Uni.createFrom().item(newKey))
                .invoke(key -> LOG.infov("Encryption key rotation completed: new key {0}", key.keyId()))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Encryption key rotation failed", e));
    }

    /**
     * Generate and immediately activate a new signing key. Use for emergency rotations.
     *
     * @param reason reason for the rotation (logged)
     * @return the new active key
     */
    public Uni<SigningKeyRecord> triggerSigningRotation(String reason) {
        LOG.warnv("Manual signing key rotation triggered: {0}", reason != null ? reason : "no reason provided");

        return signingRegistry
                .generateAndRegisterKey()
                .flatMap(newKey -> signingRegistry
                        .activateKey(newKey.keyId())
                        .flatMap(v -> signingRepository.findById(newKey.keyId()))
                        .map(opt -> opt.orElse(newKey)));
    }

    /**
     * Generate and immediately activate a new encryption key.
     *
     * @param reason reason for the rotation (logged)
     * @return the new primary key
     */
    public Uni<EncryptionKeyRecord> triggerEncryptionRotation(String reason) {
        LOG.warnv("Manual encryption key rotation triggered: {0}", reason != null ? reason : "no reason provided");

        return encryptionRegistry
                .generateAndRegisterKey()
                .flatMap(newKey -> encryptionRegistry
                        .activateKey(newKey.keyId())
                        .flatMap(v -> encryptionRepository.findById(newKey.keyId()))
                        .map(opt -> opt.orElse(newKey)));
    }

    /**
     * Activate pending signing keys, retire expired deprecated ones, delete old retired ones.
     */
    @Scheduled(
            every = "${warden.keys.signing.cleanup-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> processSigningKeyLifecycle() {
        final var now = clock.instant();
        return activatePending(
                        signingRepository.findByStatus(KeyStatus.PENDING),
                        SigningKeyRecord::createdAt,
                        SigningKeyRecord::keyId,
                        now.minus(signingConfig.activationDelay()),
                        signingRegistry::activateKey)
                .flatMap(v -> retireDeprecated(
                        signingRepository.findByStatus(KeyStatus.DEPRECATED),
                        SigningKeyRecord::deprecatedAt,
                        SigningKeyRecord::keyId,
                        now.minus(signingConfig.deprecationPeriod()),
                        signingRegistry::retireKey))
                .flatMap(v -> deleteRetired(
                        signingRepository.findByStatus(KeyStatus.RETIRED),
                        SigningKeyRecord::retiredAt,
                        SigningKeyRecord::keyId,
                        now.minus(signingConfig.retentionPeriod()),
                        signingRepository::delete))
                .onFailure()
                .invoke(e -> LOG.error("Signing key lifecycle processing failed", e));
    }

    /**
     * Activate pending encryption keys, retire keys past the grace period, delete old retired ones.
     */
    @Scheduled(
            every = "${warden.keys.encryption.cleanup-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> processEncryptionKeyLifecycle() {
        final var now = clock.instant();
        return activatePending(
                        encryptionRepository.findByStatus(KeyStatus.PENDING),
                        EncryptionKeyRecord::createdAt,
                        EncryptionKeyRecord::keyId,
                        now.minus(encryptionConfig.activationDelay()),
                        encryptionRegistry::activateKey)
                .flatMap(v -> retireDeprecated(
                        encryptionRepository.findByStatus(KeyStatus.DEPRECATED),
                        EncryptionKeyRecord::deprecatedAt,
                        EncryptionKeyRecord::keyId,
                        now.minus(encryptionConfig.gracePeriod()),
                        encryptionRegistry::retireKey))
                .flatMap(v -> deleteRetired(
                        encryptionRepository.findByStatus(KeyStatus.RETIRED),
                        EncryptionKeyRecord::retiredAt,
                        EncryptionKeyRecord::keyId,
                        now.minus(encryptionConfig.retentionPeriod()),
                        encryptionRepository::delete))
                .onFailure()
                .invoke(e -> LOG.error("Encryption key lifecycle processing failed", e));
    }

    /**
     * Activate the most recently created pending key past the cutoff.
     */
    private <K> Uni<Void> activatePending(
            Uni<List<K>> pending,
            Function<K, Instant> createdAt,
            Function<K, String> keyId,
            Instant cutoff,
            Function<String, Uni<Void>> activate) {
        return pending.flatMap(keys -> keys.stream()
                .filter(key -> !createdAt.apply(key).isAfter(cutoff))
                .max(Comparator.comparing(createdAt))
                .map(key -> {
                    LOG.infov("Activating pending key {0} (past activation delay)", keyId.apply(key));
                    return activate.apply(keyId.apply(key));
                })
                .orElse(Uni.createFrom().voidItem()));
    }

    private <K> Uni<Void> retireDeprecated(
            Uni<List<K>> deprecated,
            Function<K, Instant> deprecatedAt,
            Function<K, String> keyId,
            Instant cutoff,
            Function<String, Uni<Void>> retire) {
        return deprecated.flatMap(keys -> {
            final var toRetire = keys.stream()
                    .filter(key -> deprecatedAt.apply(key) != null
                            && deprecatedAt.apply(key).isBefore(cutoff))
                    .map(keyId)
                    .toList();
            if (toRetire.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.infov("Retiring {0} deprecated keys", toRetire.size());
            return Uni.join()
                    .all(toRetire.stream().map(retire).toList())
                    .andFailFast()
                    .replaceWithVoid();
        });
    }

    private <K> Uni<Void> deleteRetired(
            Uni<List<K>> retired,
            Function<K, Instant> retiredAt,
            Function<K, String> keyId,
            Instant cutoff,
            Function<String, Uni<Void>> delete) {
        return retired.flatMap(keys -> {
            final var toDelete = keys.stream()
                    .filter(key -> retiredAt.apply(key) != null && retiredAt.apply(key).isBefore(cutoff))
                    .map(keyId)
                    .toList();
            if (toDelete.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.infov("Deleting {0} retired keys past retention period", toDelete.size());
            return Uni.join()
                    .all(toDelete.stream().map(delete).toList())
                    .andFailFast()
                    .replaceWithVoid();
        });
    }
}
