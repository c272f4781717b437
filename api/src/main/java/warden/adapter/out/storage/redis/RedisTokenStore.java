package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.format.PayloadCodec;
import warden.core.model.token.TokenPayload;
import warden.core.port.out.TokenStore;

/**
 * Redis implementation of TokenStore.
 *
 * <p>Payloads are stored as JSON with a millisecond TTL under
 * {@code {prefix}token:{id}}.
 */
public class RedisTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(RedisTokenStore.class);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final PayloadCodec codec;
    private final String keyPrefix;

    public RedisTokenStore(ReactiveRedisDataSource redisDataSource, PayloadCodec codec, String keyPrefix) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.codec = codec;
        this.keyPrefix = keyPrefix + "token:";
    }

    @Override
    public Uni<Void> put(String id, TokenPayload payload, Duration ttl) {
        return valueCommands
                .psetex(keyPrefix + id, ttlMillis(ttl), codec.toJson(payload))
                .invoke(() -> LOG.debugf("Stored opaque token %s in Redis (TTL: %s)", payload.auditId(), ttl));
    }

    // Rounded up; PSETEX rejects 0.
    static long ttlMillis(Duration ttl) {
        return Math.max(1, ttl.plusNanos(999_999).toMillis());
    }

    @Override
    public Uni<Optional<TokenPayload>> get(String id) {
        return valueCommands
                .get(keyPrefix + id)
                .map(json -> json == null ? Optional.<TokenPayload>empty() : Optional.of(codec.fromJson(json)));
    }

    @Override
    public Uni<Void> delete(String id) {
        return keyCommands.del(keyPrefix + id).replaceWithVoid();
    }
}
