package warden.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.exception.ErrorKind;
import warden.core.model.token.TokenFormat;
import warden.core.port.out.TokenMetrics;

/**
 * Micrometer implementation of {@link TokenMetrics}.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.tokens.issued} - tokens issued by format</li>
 *   <li>{@code warden.tokens.validated} - successful validations by format</li>
 *   <li>{@code warden.tokens.rejected} - failed validations by error kind and exposure</li>
 *   <li>{@code warden.revocations.recorded} - revocation events recorded on this instance</li>
 *   <li>{@code warden.revocations.pruned} - events removed by pruning</li>
 *   <li>{@code warden.storage.timeouts} - storage calls that exceeded their timeout</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerTokenMetrics implements TokenMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerTokenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordIssued(TokenFormat format) {
        Counter.builder("warden.tokens.issued")
                .description("Tokens issued")
                .tag("format", format.configName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordValidated(TokenFormat format) {
        Counter.builder("warden.tokens.validated")
                .description("Tokens validated successfully")
                .tag("format", format.configName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordRejected(ErrorKind kind) {
        Counter.builder("warden.tokens.rejected")
                .description("Tokens rejected during validation")
                .tag("kind", kind.tagValue())
                .tag("exposure", kind.exposure().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocationRecorded() {
        Counter.builder("warden.revocations.recorded")
                .description("Revocation events recorded")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocationsPruned(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("warden.revocations.pruned")
                .description("Revocation events pruned")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordBackendTimeout(String repository, String operation) {
        Counter.builder("warden.storage.timeouts")
                .description("Storage operations that timed out")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
