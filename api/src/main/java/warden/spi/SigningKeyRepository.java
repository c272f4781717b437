package warden.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.key.KeyStatus;
import warden.core.model.key.SigningKeyRecord;

/**
 * SPI for RSA signing key storage and retrieval.
 *
 * <p>Deployments can provide custom implementations backed by a key management
 * system. Private keys must never be logged.
 *
 * <h2>Registration</h2>
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class VaultSigningKeyRepository implements SigningKeyRepository {
 * }
 * }</pre>
 */
public interface SigningKeyRepository {

    /**
     * Store a key. A key with the same id is replaced.
     */
    Uni<Void> store(SigningKeyRecord key);

    Uni<Optional<SigningKeyRecord>> findById(String keyId);

    /**
     * The single ACTIVE key, if any.
     */
    Uni<Optional<SigningKeyRecord>> findActive();

    /**
     * Every key usable for verification (ACTIVE and DEPRECATED).
     */
    Uni<List<SigningKeyRecord>> findAllForVerification();

    Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status);

    /**
     * Move a key to a new status.
     *
     * @param keyId          the key
     * @param newStatus      the target status
     * @param transitionTime when the transition happened
     * @return Uni completing when updated; fails if the key is unknown
     */
    Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime);

    Uni<Void> delete(String keyId);
}
