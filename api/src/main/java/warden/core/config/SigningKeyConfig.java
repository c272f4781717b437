package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for RSA signing keys and their rotation.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.keys.signing.rotation-enabled=true
 * warden.keys.signing.schedule=0 0 0 1 * /3 ?
 * warden.keys.signing.cache-refresh-interval=PT5M
 * warden.keys.signing.deprecation-period=P1D
 * warden.keys.signing.key-size=2048
 * }</pre>
 */
@ConfigMapping(prefix = "warden.keys.signing")
public interface SigningKeyConfig {

    /**
     * Whether scheduled rotation is enabled.
     */
    @WithName("rotation-enabled")
    @WithDefault("false")
    boolean rotationEnabled();

    /**
     * Cron schedule for automatic rotation (Quartz syntax).
     *
     * <p>Default: quarterly.
     */
    @WithDefault("0 0 0 1 */3 ?")
    String schedule();

    /**
     * How often the in-memory key snapshot is reloaded from the repository.
     */
    @WithName("cache-refresh-interval")
    @WithDefault("PT5M")
    Duration cacheRefreshInterval();

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
     * How long deprecated keys keep verifying signatures before retirement.
     *
     * <p>Must be at least the token lifetime or rotation invalidates live tokens.
     */
    @WithName("deprecation-period")
    @WithDefault("P1D")
    Duration deprecationPeriod();

    /**
     * How long retired keys are kept before deletion.
     */
    @WithName("retention-period")
    @WithDefault("P30D")
    Duration retentionPeriod();

    /**
     * RSA key size in bits.
     */
    @WithName("key-size")
    @WithDefault("2048")
    int keySize();

    /**
     * Static signing key (PKCS8, PEM or base64). When absent a key is generated at startup.
     */
    @WithName("private-key")
    Optional<String> privateKey();

    /**
     * Key id of the static signing key.
     */
    @WithName("key-id")
    @WithDefault("warden-static")
    String keyId();
}
