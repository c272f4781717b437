package warden.core.service.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.StorageConfig;
import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationCriteria;
import warden.core.model.revocation.RevocationEvent;
import warden.core.port.out.RevocationEventPublisher;
import warden.core.port.out.RevocationLedgerRepository;
import warden.core.port.out.TokenMetrics;
import warden.core.service.common.BackendTimeoutHelper;

/**
 * Records revocation events.
 *
 * <p>Recording stamps the event, persists it, applies it to the local ledger,
 * notifies other instances and prunes events that can no longer match. Once the
 * returned Uni completes, validation on this instance rejects every covered token.
 *
 * <p>The named triggers correspond to the identity events that invalidate tokens.
 */
@ApplicationScoped
public class RevocationPublisher {

    private static final Logger LOG = Logger.getLogger(RevocationPublisher.class);

    private final RevocationLedgerRepository repository;
    private final RevocationEventPublisher eventPublisher;
    private final RevocationLedger ledger;
    private final TokenRevocationConfig config;
    private final Clock clock;
    private final TokenMetrics metrics;
    private final BackendTimeoutHelper timeoutHelper;

    @Inject
    public RevocationPublisher(
            RevocationLedgerRepository repository,
            RevocationEventPublisher eventPublisher,
            RevocationLedger ledger,
            TokenRevocationConfig config,
            StorageConfig storageConfig,
            Clock clock,
            TokenMetrics metrics) {
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.ledger = ledger;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
        this.timeoutHelper = new BackendTimeoutHelper(storageConfig.timeout(), metrics, "revocation-ledger");
    }

    public Uni<RevocationEvent> record(RevocationCriteria criteria) {
        return record(criteria, null);
    }

    /**
     * Record a revocation event.
     *
     * @param criteria which tokens to revoke
     * @param timeout  storage timeout, or null for the configured default
     * @return the recorded event; fails with {@link IllegalArgumentException} when a
     *         present identifier is blank, before anything is stored
     */
    public Uni<RevocationEvent> record(RevocationCriteria criteria, Duration timeout) {
        final var now = clock.instant();
        final RevocationEvent event;
        try {
            event = criteria.toEvent(now);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }

        if (!event.hasNarrowingField()) {
            LOG.warnf("Recording revocation of every token issued before %s", event.issuedBefore());
        } else {
            LOG.infof(
                    "Recording revocation (subject=%s, domain=%s, project=%s, role=%s, trust=%s, audit=%s, issuedBefore=%s)",
                    event.subjectId(),
                    event.domainId(),
                    event.projectId(),
                    event.roleId(),
                    event.trustId(),
                    event.auditId(),
                    event.issuedBefore());
        }

        return timeoutHelper
                .withTimeout(repository.append(event), "append", timeout)
                .invoke(() -> {
                    ledger.apply(event);
                    metrics.recordRevocationRecorded();
                })
                .flatMap(v -> publish(event))
                .flatMap(v -> prune(now, timeout))
                .replaceWith(event);
    }

    /**
     * Live events recorded at or after {@code since}.
     */
    public List<RevocationEvent> listEvents(Instant since) {
        return ledger.eventsSince(since);
    }

    /**
     * A user changed their password or other credential.
     */
    public Uni<RevocationEvent> credentialChanged(String userId) {
        return record(RevocationCriteria.builder().subjectId(userId).build());
    }

    public Uni<RevocationEvent> userDisabled(String userId) {
        return record(RevocationCriteria.builder().subjectId(userId).build());
    }

    /**
     * A role was removed from a user on a project.
     */
    public Uni<RevocationEvent> roleAssignmentRemoved(String userId, String projectId, String roleId) {
        return record(RevocationCriteria.builder()
                .subjectId(userId)
                .projectId(projectId)
                .roleId(roleId)
                .build());
    }

    public Uni<RevocationEvent> roleDeleted(String roleId) {
        return record(RevocationCriteria.builder().roleId(roleId).build());
    }

    public Uni<RevocationEvent> projectDisabled(String projectId) {
        return record(RevocationCriteria.builder().projectId(projectId).build());
    }

    /**
     * A domain was disabled. Covers tokens of principals homed in the domain and
     * tokens scoped to it.
     */
    public Uni<RevocationEvent> domainDisabled(String domainId) {
        return record(RevocationCriteria.builder().domainId(domainId).build());
    }

    public Uni<RevocationEvent> trustDeleted(String trustId) {
        return record(RevocationCriteria.builder().trustId(trustId).build());
    }

    /**
     * Revoke every token issued so far.
     */
    public Uni<RevocationEvent> revokeAll() {
        return record(RevocationCriteria.all());
    }

    private Uni<Void> publish(RevocationEvent event) {
        if (!config.pubsub().enabled()) {
            return Uni.createFrom().voidItem();
        }
        return timeoutHelper.withTimeoutSilent(eventPublisher.publish(event), "publish");
    }

    private Uni<Void> prune(Instant now, Duration timeout) {
        final var cutoff = now.minus(ledger.pruneHorizon());
        return timeoutHelper
                .withTimeout(repository.pruneIssuedBefore(cutoff), "prune", timeout)
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Pruning stored revocation events failed: %s", e.getMessage());
                    return 0;
                })
                .invoke(removed -> {
                    final var local = ledger.prune(now);
                    if (removed > 0 || local > 0) {
                        LOG.infof("Pruned %d stored and %d local revocation events", removed, local);
                        // Both views hold the same events; count the larger removal once.
                        metrics.recordRevocationsPruned(Math.max(removed, local));
                    }
                })
                .replaceWithVoid();
    }
}
