package warden.adapter.out.storage.redis;

import java.util.function.Consumer;

import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.pubsub.PubSubCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationEvent;
import warden.core.port.out.RevocationEventPublisher;

/**
 * Redis pub/sub implementation of RevocationEventPublisher.
 *
 * <p>Messages are the JSON form of the event. The channel subscription is opened on
 * the first call to {@link #subscribe()} and closed by {@link #close()}.
 */
public class RedisRevocationEventPublisher implements RevocationEventPublisher, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RedisRevocationEventPublisher.class);

    private final PubSubCommands<String> pubsub;
    private final String channel;

    private volatile PubSubCommands.RedisSubscriber subscriber;
    private volatile MessageHandler messageHandler;

    public RedisRevocationEventPublisher(RedisDataSource redisDataSource, String channel) {
        this.pubsub = redisDataSource.pubsub(String.class);
        this.channel = channel;
        LOG.infof("Initialized Redis revocation event publisher (channel: %s)", channel);
    }

    @Override
    public Uni<Void> publish(RevocationEvent event) {
        final var message = RevocationEventCodec.encode(event);
        return Uni.createFrom()
                .item(() -> {
                    pubsub.publish(channel, message);
                    LOG.debugf("Published revocation event on %s", channel);
                    return null;
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .replaceWithVoid();
    }

    @Override
    public synchronized Multi<RevocationEvent> subscribe() {
        if (messageHandler == null) {
            messageHandler = new MessageHandler();
            subscriber = pubsub.subscribe(channel, messageHandler);
            LOG.infof("Subscribed to revocation events on channel: %s", channel);
        }
        return messageHandler.events();
    }

    @Override
    public void close() {
        final var current = subscriber;
        if (current != null) {
            try {
                current.unsubscribe();
                LOG.info("Unsubscribed from revocation events");
            } catch (RuntimeException e) {
                LOG.warnf(e, "Error unsubscribing from revocation events");
            }
        }
    }

    private static final class MessageHandler implements Consumer<String> {

        private final BroadcastProcessor<RevocationEvent> processor = BroadcastProcessor.create();

        @Override
        public void accept(String message) {
            try {
                processor.onNext(RevocationEventCodec.decode(message));
            } catch (IllegalArgumentException e) {
                LOG.warnf(e, "Failed to parse revocation event: %s", message);
            }
        }

        Multi<RevocationEvent> events() {
            return processor;
        }
    }
}
