package warden.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import warden.core.port.out.RevocationEventPublisher;
import warden.core.port.out.RevocationLedgerRepository;
import warden.core.port.out.TokenStore;
import warden.core.service.common.TokenStorageProviderRegistry;

/**
 * CDI producer for the storage ports.
 *
 * <p>Delegates to the {@link TokenStorageProviderRegistry}, so the token store, the
 * ledger repository and the event publisher always come from the same provider.
 *
 * @see warden.spi.TokenStorageProvider
 */
@ApplicationScoped
public class TokenStorageProducer {

    private final TokenStorageProviderRegistry registry;

    @Inject
    public TokenStorageProducer(TokenStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public TokenStore tokenStore() {
        return registry.getSelectedProvider().tokenStore();
    }

    @Produces
    @ApplicationScoped
    public RevocationLedgerRepository revocationLedgerRepository() {
        return registry.getSelectedProvider().ledgerRepository();
    }

    @Produces
    @ApplicationScoped
    public RevocationEventPublisher revocationEventPublisher() {
        return registry.getSelectedProvider().eventPublisher();
    }
}
