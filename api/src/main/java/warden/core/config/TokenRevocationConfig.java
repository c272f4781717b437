package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the revocation ledger.
 *
 * <p>Configuration prefix: {@code warden.revocation}
 */
@ConfigMapping(prefix = "warden.revocation")
public interface TokenRevocationConfig {

    /**
     * Extra time events are kept beyond the token lifetime before pruning.
     *
     * <p>Covers clock skew between instances.
     *
     * @return buffer (default: 5 minutes)
     */
    @WithName("expiration-buffer")
    @WithDefault("PT5M")
    Duration expirationBuffer();

    /**
     * Interval of the full ledger reload from the repository.
     *
     * <p>This is the longest an instance that missed a pub/sub message keeps
     * accepting a revoked token.
     *
     * @return refresh interval (default: 30 seconds)
     */
    @WithName("refresh-interval")
    @WithDefault("PT30S")
    Duration refreshInterval();

    /**
     * Pub/sub configuration for multi-instance synchronization.
     */
    PubSubConfig pubsub();

    interface PubSubConfig {

        /**
         * Enable pub/sub for revocation events.
         *
         * @return true if pub/sub is enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Redis channel for revocation events.
         *
         * @return channel name (default: warden:revocation:events)
         */
        @WithDefault("warden:revocation:events")
        String channel();
    }
}
