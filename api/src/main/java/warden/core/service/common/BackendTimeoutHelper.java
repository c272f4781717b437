package warden.core.service.common;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.BackendUnavailableException;
import warden.core.exception.WardenException;
import warden.core.port.out.TokenMetrics;

/**
 * Helper for applying timeouts and failure handling to storage operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts and backend failures become
 *       {@link BackendUnavailableException}. Engine exceptions propagate unchanged.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs but ignores timeout or any failure.
 *       Use for best-effort work such as pub/sub notifications.</li>
 * </ul>
 *
 * <p>No operation is retried.
 */
public class BackendTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(BackendTimeoutHelper.class);

    private final Duration defaultTimeout;
    private final TokenMetrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param defaultTimeout timeout used when the caller supplies none
     * @param metrics        metrics for recording timeouts (may be null)
     * @param repositoryName repository name for logging and metrics tagging
     */
    public BackendTimeoutHelper(Duration defaultTimeout, TokenMetrics metrics, String repositoryName) {
        this.defaultTimeout = defaultTimeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return withTimeout(operation, operationName, null);
    }

    /**
     * Apply a timeout to an operation that must fail when the backend does not answer.
     *
     * @param operation     the storage operation
     * @param operationName name for logging and metrics
     * @param timeout       caller-supplied timeout, or null for the default
     * @param <T>           the result type
     * @return a Uni failing with BackendUnavailableException on timeout or backend failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName, Duration timeout) {
        final var effective = timeout != null ? timeout : defaultTimeout;
        return operation
                .ifNoItem()
                .after(effective)
                .failWith(() -> {
                    LOG.warnv("Storage operation timeout: {0} in {1} after {2}", operationName, repositoryName, effective);
                    recordTimeout(operationName);
                    return new BackendUnavailableException(
                            "Storage operation timeout: " + operationName + " in " + repositoryName);
                })
                .onFailure(error -> !(error instanceof WardenException))
                .transform(error -> {
                    LOG.warnv("Storage operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
                    return new BackendUnavailableException(
                            "Storage operation failed: " + operationName + " in " + repositoryName, error);
                });
    }

    /**
     * Apply a timeout to a best-effort operation.
     *
     * @param operation     the operation
     * @param operationName name for logging and metrics
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(defaultTimeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Storage operation timeout (silent): {0} in {1} after {2}",
                            operationName, repositoryName, defaultTimeout);
                    recordTimeout(operationName);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Storage operation failure (silent): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    return null;
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordBackendTimeout(repositoryName, operationName);
        }
    }
}
