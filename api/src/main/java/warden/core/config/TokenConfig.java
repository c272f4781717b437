package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for token issuance.
 *
 * <p>Configuration prefix: {@code warden.token}
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.token.format=signed-compressed
 * warden.token.lifetime=PT1H
 * warden.token.include-catalog=true
 * warden.token.allow-rescope-scoped-token=true
 * }</pre>
 */
@ConfigMapping(prefix = "warden.token")
public interface TokenConfig {

    /**
     * Format new tokens are issued in.
     *
     * <p>One of {@code opaque}, {@code signed}, {@code signed-compressed}, {@code encrypted}.
     * Tokens of every format are accepted on validation regardless of this value.
     */
    @WithDefault("signed-compressed")
    String format();

    /**
     * Lifetime of issued tokens. Also the maximum token lifetime the revocation
     * ledger assumes when pruning.
     */
    @WithDefault("PT1H")
    Duration lifetime();

    /**
     * Whether the service catalog is embedded in issued tokens.
     */
    @WithName("include-catalog")
    @WithDefault("true")
    boolean includeCatalog();

    /**
     * Whether a scoped token may be exchanged for a token with a different scope.
     *
     * <p>When false only unscoped tokens can be rescoped.
     */
    @WithName("allow-rescope-scoped-token")
    @WithDefault("true")
    boolean allowRescopeScopedToken();
}
