package warden.spi;

import warden.core.port.out.RevocationEventPublisher;
import warden.core.port.out.RevocationLedgerRepository;
import warden.core.port.out.TokenStore;

/**
 * SPI for the storage behind opaque tokens and the revocation ledger.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - shared storage and pub/sub across instances</li>
 *   <li>memory (priority: 0) - single instance, development and tests</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider ({@code warden.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <p>A provider hands out the same instances on every call.
 */
public interface TokenStorageProvider {

    /**
     * Provider name for configuration selection.
     */
    String name();

    /**
     * Priority for automatic selection, higher is preferred.
     */
    int priority();

    /**
     * Check if this provider can be used.
     */
    boolean isAvailable();

    TokenStore tokenStore();

    RevocationLedgerRepository ledgerRepository();

    RevocationEventPublisher eventPublisher();
}
