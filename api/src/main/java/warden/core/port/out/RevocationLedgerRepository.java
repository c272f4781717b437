package warden.core.port.out;

import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.revocation.RevocationEvent;

/**
 * Port interface for durable storage of revocation events.
 *
 * <p>Implementations:
 * <ul>
 *   <li>In-memory - single instance, development and tests</li>
 *   <li>Redis - sorted set scored by the event's {@code issuedBefore}</li>
 * </ul>
 */
public interface RevocationLedgerRepository {

    /**
     * Append an event.
     *
     * @param event the event
     * @return Uni completing when stored
     */
    Uni<Void> append(RevocationEvent event);

    /**
     * Load every stored event.
     *
     * @return all events, in no particular order
     */
    Uni<List<RevocationEvent>> findAll();

    /**
     * Remove every event whose {@code issuedBefore} is strictly before the cutoff.
     *
     * @param cutoff the pruning cutoff
     * @return number of events removed
     */
    Uni<Integer> pruneIssuedBefore(Instant cutoff);
}
