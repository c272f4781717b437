package warden.core.port.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.revocation.RevocationCriteria;
import warden.core.model.revocation.RevocationEvent;

/**
 * Contract tests for RevocationLedgerRepository implementations.
 *
 * <p>Storage providers extend this class and implement {@link #createRepository()}.
 */
public abstract class RevocationLedgerRepositoryContractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    /**
     * Create a fresh repository connected to a clean backend.
     */
    protected abstract RevocationLedgerRepository createRepository();

    private RevocationLedgerRepository repository;

    @BeforeEach
    void setUpContract() {
        repository = createRepository();
    }

    private static RevocationEvent subjectEvent(String subjectId, Instant issuedBefore) {
        return RevocationCriteria.builder()
                .subjectId(subjectId)
                .issuedBefore(issuedBefore)
                .build()
                .toEvent(issuedBefore);
    }

    @Nested
    @DisplayName("append() and findAll()")
    class AppendTests {

        @Test
        @DisplayName("should return every appended event")
        void returnsAppended() {
            final var first = subjectEvent("alice", T0);
            final var second = RevocationCriteria.builder()
                    .projectId("p1")
                    .roleId("reader")
                    .build()
                    .toEvent(T0.plusSeconds(1));

            repository.append(first).await().atMost(TIMEOUT);
            repository.append(second).await().atMost(TIMEOUT);

            final var all = repository.findAll().await().atMost(TIMEOUT);
            assertEquals(2, all.size());
            assertTrue(all.contains(first));
            assertTrue(all.contains(second));
        }

        @Test
        @DisplayName("should store an equal event once")
        void idempotentAppend() {
            final var event = subjectEvent("alice", T0);

            repository.append(event).await().atMost(TIMEOUT);
            repository.append(event).await().atMost(TIMEOUT);

            assertEquals(1, repository.findAll().await().atMost(TIMEOUT).size());
        }

        @Test
        @DisplayName("should return an empty list when nothing was recorded")
        void emptyInitially() {
            assertTrue(repository.findAll().await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("pruneIssuedBefore()")
    class PruneTests {

        @Test
        @DisplayName("should remove only events strictly before the cutoff")
        void removesOlderEvents() {
            final var old = subjectEvent("alice", T0.minusSeconds(60));
            final var atCutoff = subjectEvent("bob", T0);
            final var recent = subjectEvent("carol", T0.plusSeconds(60));
            repository.append(old).await().atMost(TIMEOUT);
            repository.append(atCutoff).await().atMost(TIMEOUT);
            repository.append(recent).await().atMost(TIMEOUT);

            final int removed = repository.pruneIssuedBefore(T0).await().atMost(TIMEOUT);

            assertEquals(1, removed);
            final var remaining = repository.findAll().await().atMost(TIMEOUT);
            assertEquals(2, remaining.size());
            assertTrue(remaining.contains(atCutoff));
            assertTrue(remaining.contains(recent));
        }

        @Test
        @DisplayName("should report zero when nothing is old enough")
        void nothingToPrune() {
            repository.append(subjectEvent("alice", T0)).await().atMost(TIMEOUT);

            assertEquals(0, repository.pruneIssuedBefore(T0.minusSeconds(1)).await().atMost(TIMEOUT));
        }
    }
}
