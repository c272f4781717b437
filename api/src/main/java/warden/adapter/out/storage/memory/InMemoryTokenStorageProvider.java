package warden.adapter.out.storage.memory;

import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.port.out.RevocationEventPublisher;
import warden.core.port.out.RevocationLedgerRepository;
import warden.core.port.out.TokenStore;
import warden.spi.TokenStorageProvider;

/**
 * In-memory token storage provider.
 *
 * <p><strong>Warning:</strong> opaque tokens and revocations are not shared between
 * instances. Not recommended for production.
 */
@ApplicationScoped
public class InMemoryTokenStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private final InMemoryTokenStore tokenStore = new InMemoryTokenStore();
    private final InMemoryRevocationLedgerRepository ledgerRepository = new InMemoryRevocationLedgerRepository();
    private final InMemoryRevocationEventPublisher eventPublisher = new InMemoryRevocationEventPublisher();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public TokenStore tokenStore() {
        warnOnce();
        return tokenStore;
    }

    @Override
    public RevocationLedgerRepository ledgerRepository() {
        warnOnce();
        return ledgerRepository;
    }

    @Override
    public RevocationEventPublisher eventPublisher() {
        return eventPublisher;
    }

    private void warnOnce() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: opaque tokens and revocation events are stored in-memory only!");
            LOG.warn("  Revocations recorded on one instance are not seen by the others.");
            LOG.warn("  Set warden.storage.provider=redis for multi-instance deployments.");
            LOG.warn("========================================================================");
        }
    }
}
