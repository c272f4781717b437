package warden.core.service.token;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.TokenConfig;
import warden.core.exception.UnknownFormatException;
import warden.core.model.token.TokenFormat;
import warden.spi.TokenFormatProvider;

/**
 * Registry of token format providers.
 *
 * <p>Discovers providers via CDI. New tokens are issued in the configured format
 * ({@code warden.token.format}); tokens of every registered format are accepted on
 * validation so a format change never invalidates live tokens.
 */
@ApplicationScoped
public class TokenFormatRegistry {

    private static final Logger LOG = Logger.getLogger(TokenFormatRegistry.class);

    private final Map<TokenFormat, TokenFormatProvider> providers;
    private final TokenFormat issuingFormat;

    @Inject
    public TokenFormatRegistry(Instance<TokenFormatProvider> providers, TokenConfig config) {
        this((Iterable<TokenFormatProvider>) providers, config);
    }

    public TokenFormatRegistry(Iterable<TokenFormatProvider> providers, TokenConfig config) {
        final var byFormat = new EnumMap<TokenFormat, TokenFormatProvider>(TokenFormat.class);
        for (var provider : providers) {
            final var previous = byFormat.put(provider.format(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider for token format " + provider.format());
            }
        }
        this.providers = Map.copyOf(byFormat);
        this.issuingFormat = TokenFormat.fromConfigName(config.format());
        if (!this.providers.containsKey(issuingFormat)) {
            throw new IllegalStateException("No provider registered for configured token format " + issuingFormat);
        }
        LOG.infof("Issuing %s tokens; accepting formats %s", issuingFormat.configName(), this.providers.keySet());
    }

    /**
     * The provider new tokens are encoded with.
     */
    public TokenFormatProvider issuingProvider() {
        return providers.get(issuingFormat);
    }

    public TokenFormat issuingFormat() {
        return issuingFormat;
    }

    /**
     * Find the provider for a token by its tag.
     *
     * @param token the raw token
     * @return the provider
     * @throws UnknownFormatException if no registered format claims the tag
     */
    public TokenFormatProvider providerFor(String token) {
        return TokenFormat.detect(token)
                .map(providers::get)
                .orElseThrow(() -> new UnknownFormatException("Unrecognised token format"));
    }

    public Optional<TokenFormatProvider> provider(TokenFormat format) {
        return Optional.ofNullable(providers.get(format));
    }
}
