package warden.core.port.out;

import warden.core.exception.ErrorKind;
import warden.core.model.token.TokenFormat;

/**
 * Port interface for recording token engine metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface TokenMetrics {

    void recordIssued(TokenFormat format);

    /**
     * Record a successful validation.
     */
    void recordValidated(TokenFormat format);

    /**
     * Record a failed validation.
     *
     * @param kind why validation failed
     */
    void recordRejected(ErrorKind kind);

    void recordRevocationRecorded();

    /**
     * Record events removed from the ledger by pruning.
     *
     * @param count number of events removed
     */
    void recordRevocationsPruned(int count);

    /**
     * Record a storage call that exceeded its timeout.
     *
     * @param repository the repository name
     * @param operation  the operation name
     */
    void recordBackendTimeout(String repository, String operation);
}
