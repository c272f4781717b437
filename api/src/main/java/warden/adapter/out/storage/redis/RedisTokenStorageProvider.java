package warden.adapter.out.storage.redis;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.RedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.format.PayloadCodec;
import warden.core.config.StorageConfig;
import warden.core.config.TokenRevocationConfig;
import warden.core.port.out.RevocationEventPublisher;
import warden.core.port.out.RevocationLedgerRepository;
import warden.core.port.out.TokenStore;
import warden.spi.TokenStorageProvider;

/**
 * Redis-based token storage provider. Recommended for production deployments.
 *
 * <p>The data sources are resolved lazily, so no Redis connection is opened when
 * another provider is selected.
 */
@ApplicationScoped
public class RedisTokenStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisTokenStorageProvider.class);
    private static final int PRIORITY = 100;

    private final Instance<ReactiveRedisDataSource> reactiveDataSource;
    private final Instance<RedisDataSource> blockingDataSource;
    private final PayloadCodec codec;
    private final StorageConfig storageConfig;
    private final TokenRevocationConfig revocationConfig;

    private volatile RedisTokenStore tokenStore;
    private volatile RedisRevocationLedgerRepository ledgerRepository;
    private volatile RedisRevocationEventPublisher eventPublisher;

    @Inject
    public RedisTokenStorageProvider(
            Instance<ReactiveRedisDataSource> reactiveDataSource,
            Instance<RedisDataSource> blockingDataSource,
            PayloadCodec codec,
            StorageConfig storageConfig,
            TokenRevocationConfig revocationConfig) {
        this.reactiveDataSource = reactiveDataSource;
        this.blockingDataSource = blockingDataSource;
        this.codec = codec;
        this.storageConfig = storageConfig;
        this.revocationConfig = revocationConfig;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return reactiveDataSource.isResolvable() && blockingDataSource.isResolvable();
    }

    @Override
    public synchronized TokenStore tokenStore() {
        if (tokenStore == null) {
            tokenStore = new RedisTokenStore(reactiveDataSource.get(), codec, storageConfig.keyPrefix());
            LOG.infof("Created Redis token store with prefix: %s", storageConfig.keyPrefix());
        }
        return tokenStore;
    }

    @Override
    public synchronized RevocationLedgerRepository ledgerRepository() {
        if (ledgerRepository == null) {
            ledgerRepository = new RedisRevocationLedgerRepository(reactiveDataSource.get(), storageConfig.keyPrefix());
        }
        return ledgerRepository;
    }

    @Override
    public synchronized RevocationEventPublisher eventPublisher() {
        if (eventPublisher == null) {
            eventPublisher = new RedisRevocationEventPublisher(
                    blockingDataSource.get(), revocationConfig.pubsub().channel());
        }
        return eventPublisher;
    }

    @PreDestroy
    synchronized void shutdown() {
        if (eventPublisher != null) {
            eventPublisher.close();
        }
    }
}
