package warden.core.port.out;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.revocation.RevocationEvent;

/**
 * Port interface for distributing revocation events between instances.
 *
 * <p>Delivery is best effort. Instances that miss a message catch up on the
 * next full ledger reload.
 */
public interface RevocationEventPublisher {

    /**
     * Publish an event to all instances, including this one.
     *
     * @param event the event
     * @return Uni completing when published
     */
    Uni<Void> publish(RevocationEvent event);

    /**
     * Subscribe to events published by any instance.
     *
     * @return stream of events
     */
    Multi<RevocationEvent> subscribe();
}
