package warden.core.service.common;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.spi.TokenStorageProvider;

/**
 * Registry for token storage providers.
 *
 * <p>Discovers providers via CDI and selects one based on configuration and
 * availability. The selection is made once and kept for the life of the instance.
 */
@ApplicationScoped
public class TokenStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(TokenStorageProviderRegistry.class);

    private final List<TokenStorageProvider> providers;
    private final StorageConfig config;

    private volatile TokenStorageProvider selectedProvider;

    @Inject
    public TokenStorageProviderRegistry(Instance<TokenStorageProvider> providers, StorageConfig config) {
        this(providers.stream().toList(), config);
    }

    public TokenStorageProviderRegistry(List<TokenStorageProvider> providers, StorageConfig config) {
        this.providers = List.copyOf(providers);
        this.config = config;
    }

    /**
     * Get the selected storage provider.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is available
     */
    public synchronized TokenStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private TokenStorageProvider selectProvider() {
        final var configuredProvider = config.provider();
        final var availableProviders = providers.stream()
                .filter(TokenStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(TokenStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available token storage providers: %s",
                availableProviders.stream().map(TokenStorageProvider::name).toList());

        final var configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured token storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (availableProviders.isEmpty()) {
            throw new IllegalStateException("No token storage providers available");
        }

        final var provider = availableProviders.get(0);
        LOG.warnf(
                "Configured token storage provider '%s' is not available, using %s (priority: %d)",
                configuredProvider, provider.name(), provider.priority());
        return provider;
    }
}
