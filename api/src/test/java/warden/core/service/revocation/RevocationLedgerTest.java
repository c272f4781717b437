package warden.core.service.revocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryRevocationEventPublisher;
import warden.adapter.out.storage.memory.InMemoryRevocationLedgerRepository;
import warden.adapter.out.telemetry.MicrometerTokenMetrics;
import warden.core.model.revocation.RevocationCriteria;
import warden.core.model.revocation.RevocationEvent;
import warden.core.model.token.TokenScope;
import warden.support.MutableClock;
import warden.support.TestConfigs;
import warden.support.TestEngine;

@DisplayName("RevocationLedger")
class RevocationLedgerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant T0 = TestEngine.START;

    private MutableClock clock;
    private InMemoryRevocationLedgerRepository repository;
    private InMemoryRevocationEventPublisher eventPublisher;
    private RevocationLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        repository = new InMemoryRevocationLedgerRepository();
        eventPublisher = new InMemoryRevocationEventPublisher();
        ledger = new RevocationLedger(
                repository,
                eventPublisher,
                TestConfigs.revocation(),
                TestConfigs.token("signed"),
                TestConfigs.storage(),
                clock,
                new MicrometerTokenMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        ledger.shutdown();
    }

    private static RevocationEvent event(RevocationCriteria.Builder criteria, Instant at) {
        return criteria.build().toEvent(at);
    }

    @Nested
    @DisplayName("isRevoked()")
    class IsRevokedTests {

        @Test
        @DisplayName("should accept every token while the ledger is empty")
        void emptyLedger() {
            assertFalse(ledger.isRevoked(payload().build()));
        }

        @Test
        @DisplayName("should reject tokens of a revoked subject issued up to the event")
        void subjectRevocation() {
            ledger.apply(event(RevocationCriteria.builder().subjectId("alice"), T0));

            assertTrue(ledger.isRevoked(payload().issuedAt(T0.minusSeconds(30)).build()));
            assertTrue(ledger.isRevoked(payload().issuedAt(T0).build()));
            assertFalse(ledger.isRevoked(payload().issuedAt(T0.plusMillis(1)).build()));
            assertFalse(ledger.isRevoked(payload().subject("bob").issuedAt(T0).build()));
        }

        @Test
        @DisplayName("should find events indexed under a less selective field")
        void secondaryIndexLookup() {
            ledger.apply(event(RevocationCriteria.builder().projectId("p1").roleId("reader"), T0));
            ledger.apply(event(RevocationCriteria.builder().domainId("d9"), T0));

            assertTrue(ledger.isRevoked(payload().roles("member", "reader").issuedAt(T0).build()));
            assertFalse(ledger.isRevoked(payload().roles("member").issuedAt(T0).build()));
            assertTrue(ledger.isRevoked(
                    payload().scope(TokenScope.domain("d9")).roles("admin").issuedAt(T0).build()));
        }

        @Test
        @DisplayName("should match every audit id in a rescoped token's chain")
        void auditChain() {
            ledger.apply(event(RevocationCriteria.builder().auditId("parent"), T0));

            assertTrue(ledger.isRevoked(payload().auditIds("child", "parent").issuedAt(T0).build()));
            assertFalse(ledger.isRevoked(payload().auditIds("sibling").issuedAt(T0).build()));
        }

        @Test
        @DisplayName("should apply events without narrowing fields to every token")
        void wildcard() {
            ledger.apply(event(RevocationCriteria.builder(), T0));

            assertTrue(ledger.isRevoked(payload().subject("anyone").domain("elsewhere").issuedAt(T0).build()));
        }
    }

    @Nested
    @DisplayName("apply()")
    class ApplyTests {

        @Test
        @DisplayName("should ignore an event it already holds")
        void idempotent() {
            final var event = event(RevocationCriteria.builder().subjectId("alice"), T0);

            ledger.apply(event);
            ledger.apply(event);

            assertEquals(1, ledger.size());
        }

        @Test
        @DisplayName("should apply events delivered through pub/sub after startup")
        void appliesPublishedEvents() {
            ledger.onStart(null);

            eventPublisher
                    .publish(event(RevocationCriteria.builder().trustId("t1"), T0))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(ledger.isRevoked(payload().trust("t1").issuedAt(T0).build()));
        }
    }

    @Nested
    @DisplayName("reload()")
    class ReloadTests {

        @Test
        @DisplayName("should merge stored events with events applied locally")
        void mergesWithLocal() {
            final var stored = event(RevocationCriteria.builder().subjectId("bob"), T0);
            final var local = event(RevocationCriteria.builder().subjectId("alice"), T0);
            repository.append(stored).await().atMost(TIMEOUT);
            ledger.apply(local);

            ledger.reload().await().atMost(TIMEOUT);

            assertEquals(2, ledger.size());
            assertTrue(ledger.isRevoked(payload().subject("bob").issuedAt(T0).build()));
            assertTrue(ledger.isRevoked(payload().issuedAt(T0).build()));
        }

        @Test
        @DisplayName("should drop events that can no longer match an unexpired token")
        void dropsPrunable() {
            repository.append(event(RevocationCriteria.builder().subjectId("old"), T0.minus(Duration.ofHours(2))))
                    .await()
                    .atMost(TIMEOUT);
            repository.append(event(RevocationCriteria.builder().subjectId("new"), T0.minusSeconds(60)))
                    .await()
                    .atMost(TIMEOUT);

            ledger.reload().await().atMost(TIMEOUT);

            assertEquals(1, ledger.size());
            assertEquals("new", ledger.eventsSince(null).get(0).subjectId());
        }
    }

    @Nested
    @DisplayName("prune()")
    class PruneTests {

        @Test
        @DisplayName("should keep events until the token lifetime plus buffer has passed")
        void pruneHorizon() {
            ledger.apply(event(RevocationCriteria.builder().subjectId("alice"), T0));

            assertEquals(Duration.ofMinutes(65), ledger.pruneHorizon());
            assertEquals(0, ledger.prune(T0.plus(Duration.ofMinutes(65))));
            assertEquals(1, ledger.prune(T0.plus(Duration.ofMinutes(66))));
            assertEquals(0, ledger.size());
        }
    }

    @Nested
    @DisplayName("eventsSince()")
    class EventsSinceTests {

        @Test
        @DisplayName("should return events recorded at or after the bound, oldest first")
        void filtersAndSorts() {
            final var late = event(RevocationCriteria.builder().subjectId("c"), T0.plusSeconds(20));
            final var early = event(RevocationCriteria.builder().subjectId("a"), T0);
            final var middle = event(RevocationCriteria.builder().subjectId("b"), T0.plusSeconds(10));
            ledger.apply(late);
            ledger.apply(early);
            ledger.apply(middle);

            final var since = ledger.eventsSince(T0.plusSeconds(10));

            assertEquals(2, since.size());
            assertEquals(middle, since.get(0));
            assertEquals(late, since.get(1));
            assertEquals(3, ledger.eventsSince(null).size());
        }
    }

    @Nested
    @DisplayName("concurrent access")
    class ConcurrencyTests {

        @Test
        @DisplayName("should answer lookups consistently while events are applied and reloaded")
        void validateWhileApplying() throws Exception {
            final var readers = 8;
            final var executor = Executors.newFixedThreadPool(readers);
            final var failures = new CopyOnWriteArrayList<Throwable>();
            final var started = new CountDownLatch(readers);
            final var stop = new AtomicBoolean();
            final var target = payload().issuedAt(T0.minusSeconds(1)).build();
            final var bystander = payload().subject("bob").issuedAt(T0.minusSeconds(1)).build();

            try {
                for (int i = 0; i < readers; i++) {
                    executor.submit(() -> {
                        started.countDown();
                        var seenRevoked = false;
                        try {
                            while (!stop.get()) {
                                final var revoked = ledger.isRevoked(target);
                                if (seenRevoked && !revoked) {
                                    failures.add(new AssertionError("Revocation became visible and then vanished"));
                                    return;
                                }
                                seenRevoked |= revoked;
                                if (ledger.isRevoked(bystander)) {
                                    failures.add(new AssertionError("Unrelated token reported revoked"));
                                    return;
                                }
                            }
                        } catch (Throwable t) {
                            failures.add(t);
                        }
                    });
                }
                assertTrue(started.await(5, TimeUnit.SECONDS));

                for (int i = 0; i < 200; i++) {
                    ledger.apply(event(RevocationCriteria.builder().subjectId("user-" + i), T0));
                    if (i == 100) {
                        ledger.apply(event(RevocationCriteria.builder().subjectId("alice"), T0));
                    }
                    if (i % 50 == 0) {
                        ledger.reload().await().atMost(TIMEOUT);
                    }
                }
            } finally {
                stop.set(true);
                executor.shutdown();
            }

            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            assertTrue(failures.isEmpty(), () -> "Concurrent lookups failed: " + failures);
            assertTrue(ledger.isRevoked(target));
            assertFalse(ledger.isRevoked(bystander));
            assertEquals(201, ledger.size());
        }
    }
}
