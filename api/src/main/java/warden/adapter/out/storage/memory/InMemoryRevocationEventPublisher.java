package warden.adapter.out.storage.memory;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationEvent;
import warden.core.port.out.RevocationEventPublisher;

/**
 * In-memory implementation of RevocationEventPublisher.
 *
 * <p>Events are broadcast within the same JVM only.
 */
public class InMemoryRevocationEventPublisher implements RevocationEventPublisher {

    private static final Logger LOG = Logger.getLogger(InMemoryRevocationEventPublisher.class);

    private final BroadcastProcessor<RevocationEvent> processor = BroadcastProcessor.create();

    @Override
    public Uni<Void> publish(RevocationEvent event) {
        return Uni.createFrom().item(() -> {
            processor.onNext(event);
            LOG.debugf("Published revocation event (in-memory) issued before %s", event.issuedBefore());
            return null;
        });
    }

    @Override
    public Multi<RevocationEvent> subscribe() {
        return processor;
    }
}
