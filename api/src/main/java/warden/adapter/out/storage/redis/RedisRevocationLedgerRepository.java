package warden.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.sortedset.ReactiveSortedSetCommands;
import io.quarkus.redis.datasource.sortedset.ScoreRange;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationEvent;
import warden.core.port.out.RevocationLedgerRepository;

/**
 * Redis implementation of RevocationLedgerRepository.
 *
 * <p>Events are members of the sorted set {@code {prefix}revocations}, scored by
 * {@code issuedBefore} in epoch milliseconds, so pruning is a single range removal.
 */
public class RedisRevocationLedgerRepository implements RevocationLedgerRepository {

    private static final Logger LOG = Logger.getLogger(RedisRevocationLedgerRepository.class);

    private final ReactiveSortedSetCommands<String, String> sortedSetCommands;
    private final String key;

    public RedisRevocationLedgerRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.sortedSetCommands = redisDataSource.sortedSet(String.class);
        this.key = keyPrefix + "revocations";
    }

    @Override
    public Uni<Void> append(RevocationEvent event) {
        return sortedSetCommands
                .zadd(key, event.issuedBefore().toEpochMilli(), RevocationEventCodec.encode(event))
                .replaceWithVoid();
    }

    @Override
    public Uni<List<RevocationEvent>> findAll() {
        return sortedSetCommands.zrange(key, 0, -1).map(members -> {
            final var events = new ArrayList<RevocationEvent>(members.size());
            for (var member : members) {
                try {
                    events.add(RevocationEventCodec.decode(member));
                } catch (IllegalArgumentException e) {
                    LOG.warnf(e, "Skipping unreadable revocation event in %s", key);
                }
            }
            return events;
        });
    }

    @Override
    public Uni<Integer> pruneIssuedBefore(Instant cutoff) {
        // Scores are whole milliseconds, so "strictly before" is "at most cutoff - 1".
        final var range = new ScoreRange<>(0.0, (double) (cutoff.toEpochMilli() - 1));
        return sortedSetCommands.zremrangebyscore(key, range).map(Long::intValue);
    }
}
