package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationEvent;
import warden.core.port.out.RevocationLedgerRepository;

/**
 * In-memory implementation of RevocationLedgerRepository.
 *
 * <p>Events live only as long as the JVM. Appending an equal event twice stores it once.
 */
public class InMemoryRevocationLedgerRepository implements RevocationLedgerRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRevocationLedgerRepository.class);

    private final Set<RevocationEvent> events = ConcurrentHashMap.newKeySet();

    @Override
    public Uni<Void> append(RevocationEvent event) {
        return Uni.createFrom().item(() -> {
            events.add(event);
            return null;
        });
    }

    @Override
    public Uni<List<RevocationEvent>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(events));
    }

    @Override
    public Uni<Integer> pruneIssuedBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var event : events) {
                if (event.issuedBefore().isBefore(cutoff) && events.remove(event)) {
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debugf("Pruned %d revocation events issued before %s", removed, cutoff);
            }
            return removed;
        });
    }
}
