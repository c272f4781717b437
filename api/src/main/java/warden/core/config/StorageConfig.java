package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for token and ledger storage.
 *
 * <p>Configuration prefix: {@code warden.storage}
 */
@ConfigMapping(prefix = "warden.storage")
public interface StorageConfig {

    /**
     * Storage backend, {@code memory} or {@code redis}.
     */
    @WithDefault("memory")
    String provider();

    /**
     * Default timeout for a single storage call when the caller supplies none.
     */
    @WithDefault("PT1S")
    Duration timeout();

    /**
     * Prefix for every key written to Redis.
     */
    @WithName("key-prefix")
    @WithDefault("warden:")
    String keyPrefix();
}
