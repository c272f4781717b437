package warden.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.key.EncryptionKeyRecord;
import warden.core.model.key.KeyStatus;

/**
 * SPI for storage of the symmetric keys used by encrypted tokens.
 *
 * <p>Same contract as {@link SigningKeyRepository}, for AES keys.
 */
public interface EncryptionKeyRepository {

    Uni<Void> store(EncryptionKeyRecord key);

    Uni<Optional<EncryptionKeyRecord>> findById(String keyId);

    Uni<Optional<EncryptionKeyRecord>> findActive();

    Uni<List<EncryptionKeyRecord>> findByStatus(KeyStatus status);

    /**
     * Every stored key regardless of status.
     */
    Uni<List<EncryptionKeyRecord>> findAll();

    Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime);

    Uni<Void> delete(String keyId);
}
