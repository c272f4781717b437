package warden.core.service.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.config.TokenConfig;
import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationEvent;
import warden.core.model.token.TokenPayload;
import warden.core.port.out.RevocationEventPublisher;
import warden.core.port.out.RevocationLedgerRepository;
import warden.core.port.out.TokenMetrics;
import warden.core.service.common.BackendTimeoutHelper;

/**
 * Local view of every live revocation event.
 *
 * <p>Readers see an immutable snapshot behind a volatile reference and never block.
 * Writers (local recording, pub/sub deliveries, periodic reloads, pruning) are
 * serialized and swap in a rebuilt snapshot.
 *
 * <p>Events are indexed by their most selective narrowing field, so a lookup only
 * evaluates events that could possibly match, plus the events without any
 * narrowing field.
 *
 * <p>The local view converges with the repository through pub/sub and a full reload
 * every {@code warden.revocation.refresh-interval}. An instance that misses a message
 * may accept a revoked token for at most that long.
 */
@ApplicationScoped
public class RevocationLedger {

    private static final Logger LOG = Logger.getLogger(RevocationLedger.class);

    private final RevocationLedgerRepository repository;
    private final RevocationEventPublisher eventPublisher;
    private final TokenRevocationConfig config;
    private final TokenConfig tokenConfig;
    private final Clock clock;
    private final BackendTimeoutHelper timeoutHelper;

    private final Object writeLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;
    private volatile Cancellable subscription;

    @Inject
    public RevocationLedger(
            RevocationLedgerRepository repository,
            RevocationEventPublisher eventPublisher,
            TokenRevocationConfig config,
            TokenConfig tokenConfig,
            StorageConfig storageConfig,
            Clock clock,
            TokenMetrics metrics) {
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.config = config;
        this.tokenConfig = tokenConfig;
        this.clock = clock;
        this.timeoutHelper = new BackendTimeoutHelper(storageConfig.timeout(), metrics, "revocation-ledger");
    }

    void onStart(@Observes StartupEvent event) {
        reload().subscribe()
                .with(
                        v -> LOG.info("Revocation ledger loaded"),
                        e -> LOG.warnf(e, "Initial revocation ledger load failed, starting empty"));

        subscribeToEvents();
    }

    @PreDestroy
    void shutdown() {
        final var current = subscription;
        if (current != null) {
            current.cancel();
        }
    }

    /**
     * Check whether any live event revokes the payload.
     *
     * <p>Lock-free; evaluates only events indexed under one of the payload's attributes.
     *
     * @param payload the token payload
     * @return true if revoked
     */
    public boolean isRevoked(TokenPayload payload) {
        final var current = snapshot;
        for (var event : current.wildcards()) {
            if (event.matches(payload)) {
                return true;
            }
        }
        if (current.index().isEmpty()) {
            return false;
        }
        for (var key : lookupKeys(payload)) {
            for (var event : current.index().get(key)) {
                if (event.matches(payload)) {
                    LOG.debugf("Token %s revoked by event indexed under %s", payload.auditId(), key);
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Apply an event to the local view. Applying an event twice has no effect.
     *
     * @param event the event
     */
    public void apply(RevocationEvent event) {
        synchronized (writeLock) {
            if (snapshot.events().contains(event)) {
                return;
            }
            final var events = new ArrayList<>(snapshot.events());
            events.add(event);
            snapshot = Snapshot.of(events);
        }
    }

    /**
     * Merge every event in the repository into the local view and drop prunable events.
     *
     * <p>Events already applied locally are kept, so a reload racing with a local
     * recording cannot lose it.
     *
     * @return Uni completing when the view is refreshed
     */
    @Scheduled(
            every = "${warden.revocation.refresh-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> reload() {
        return timeoutHelper
                .withTimeout(repository.findAll(), "findAll")
                .invoke(loaded -> {
                    final var now = clock.instant();
                    final var horizon = pruneHorizon();
                    synchronized (writeLock) {
                        final var merged = new LinkedHashSet<>(snapshot.events());
                        merged.addAll(loaded);
                        merged.removeIf(event -> event.isPrunableAt(now, horizon));
                        snapshot = Snapshot.of(merged);
                    }
                    LOG.debugf("Revocation ledger reloaded: %d live events", snapshot.events().size());
                })
                .replaceWithVoid();
    }

    /**
     * Drop events that can no longer match an unexpired token.
     *
     * @param now the current time
     * @return number of events dropped
     */
    public int prune(Instant now) {
        final var horizon = pruneHorizon();
        synchronized (writeLock) {
            final var events = new ArrayList<>(snapshot.events());
            final var before = events.size();
            events.removeIf(event -> event.isPrunableAt(now, horizon));
            final var removed = before - events.size();
            if (removed > 0) {
                snapshot = Snapshot.of(events);
            }
            return removed;
        }
    }

    /**
     * Live events recorded at or after {@code since}, oldest first.
     *
     * @param since lower bound on {@code revokedAt}, or null for all
     * @return the events
     */
    public List<RevocationEvent> eventsSince(Instant since) {
        return snapshot.events().stream()
                .filter(event -> since == null || !event.revokedAt().isBefore(since))
                .sorted(Comparator.comparing(RevocationEvent::revokedAt))
                .toList();
    }

    public int size() {
        return snapshot.events().size();
    }

    /**
     * Longest time an event can still match an unexpired token.
     */
    public Duration pruneHorizon() {
        return tokenConfig.lifetime().plus(config.expirationBuffer());
    }

    private void subscribeToEvents() {
        if (!config.pubsub().enabled()) {
            LOG.info("Pub/sub disabled, revocation ledger relies on periodic reloads only");
            return;
        }

        subscription = eventPublisher
                .subscribe()
                .subscribe()
                .with(this::apply, e -> LOG.warnf(e, "Revocation event subscription failed"));
        LOG.info("Subscribed to revocation events");
    }

    private static List<String> lookupKeys(TokenPayload payload) {
        final var keys = new ArrayList<String>();
        for (var auditId : payload.auditIds()) {
            keys.add(key(Field.AUDIT, auditId));
        }
        keys.add(key(Field.SUBJECT, payload.subjectId()));
        if (payload.trustId() != null) {
            keys.add(key(Field.TRUST, payload.trustId()));
        }
        if (payload.projectId() != null) {
            keys.add(key(Field.PROJECT, payload.projectId()));
        }
        keys.add(key(Field.DOMAIN, payload.domainId()));
        final var scopeDomain = payload.scope().domainId();
        if (scopeDomain != null && !scopeDomain.equals(payload.domainId())) {
            keys.add(key(Field.DOMAIN, scopeDomain));
        }
        for (var role : payload.roles()) {
            keys.add(key(Field.ROLE, role));
        }
        return keys;
    }

    private static String key(Field field, String value) {
        return field.prefix + value;
    }

    /**
     * Narrowing fields in index priority order (most selective first).
     */
    private enum Field {
        AUDIT("audit:"),
        SUBJECT("subject:"),
        TRUST("trust:"),
        PROJECT("project:"),
        DOMAIN("domain:"),
        ROLE("role:");

        private final String prefix;

        Field(String prefix) {
            this.prefix = prefix;
        }
    }

    /**
     * Immutable ledger state.
     */
    private record Snapshot(
            ImmutableList<RevocationEvent> events,
            ImmutableListMultimap<String, RevocationEvent> index,
            ImmutableList<RevocationEvent> wildcards) {

        static final Snapshot EMPTY = new Snapshot(ImmutableList.of(), ImmutableListMultimap.of(), ImmutableList.of());

        static Snapshot of(Collection<RevocationEvent> events) {
            final var index = ImmutableListMultimap.<String, RevocationEvent>builder();
            final var wildcards = ImmutableList.<RevocationEvent>builder();
            for (var event : events) {
                final var indexKey = indexKey(event);
                if (indexKey == null) {
                    wildcards.add(event);
                } else {
                    index.put(indexKey, event);
                }
            }
            return new Snapshot(ImmutableList.copyOf(events), index.build(), wildcards.build());
        }

        private static String indexKey(RevocationEvent event) {
            if (event.auditId() != null) {
                return key(Field.AUDIT, event.auditId());
            }
            if (event.subjectId() != null) {
                return key(Field.SUBJECT, event.subjectId());
            }
            if (event.trustId() != null) {
                return key(Field.TRUST, event.trustId());
            }
            if (event.projectId() != null) {
                return key(Field.PROJECT, event.projectId());
            }
            if (event.domainId() != null) {
                return key(Field.DOMAIN, event.domainId());
            }
            if (event.roleId() != null) {
                return key(Field.ROLE, event.roleId());
            }
            return null;
        }
    }
}
