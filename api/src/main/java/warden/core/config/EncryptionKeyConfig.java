package warden.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the symmetric keys of the encrypted token format.
 *
 * <p>Configuration prefix: {@code warden.keys.encryption}
 *
 * <p>Configured keys are given as {@code keyId:base64Key} entries, primary first:
 * <pre>{@code
 * warden.keys.encryption.keys=k2:BASE64...,k1:BASE64...
 * }</pre>
 */
@ConfigMapping(prefix = "warden.keys.encryption")
public interface EncryptionKeyConfig {

    /**
     * Whether scheduled rotation is enabled.
     */
    @WithName("rotation-enabled")
    @WithDefault("false")
    boolean rotationEnabled();

    /**
     * Cron schedule for automatic rotation (Quartz syntax).
     */
    @WithDefault("0 0 0 * * ?")
    String schedule();

    /**
     * How long a rotated-in key stays PENDING before it becomes ACTIVE.
     *
     * <p>Gives every instance time to load the key before tokens using it appear.
     * Should be at least the cache refresh interval.
     */
    @WithName("activation-delay")
    @WithDefault("PT10M")
    Duration activationDelay();

    /**
     * How often the lifecycle job (activation, retirement, deletion) runs.
     */
    @WithName("cleanup-interval")
    @WithDefault("PT5M")
    Duration cleanupInterval();

    /**
     * How long a deprecated key still decrypts tokens.
     *
     * <p>Must be at least the token lifetime.
     */
    @WithName("grace-period")
    @WithDefault("PT1H")
    Duration gracePeriod();

    /**
     * How often the in-memory key snapshot is reloaded from the repository.
     */
    @WithName("cache-refresh-interval")
    @WithDefault("PT5M")
    Duration cacheRefreshInterval();

    /**
     * How long retired keys are kept before deletion.
     */
    @WithName("retention-period")
    @WithDefault("P7D")
    Duration retentionPeriod();

    /**
     * Statically configured keys, primary first. When absent a key is generated at startup.
     */
    Optional<List<String>> keys();
}
