package warden.core.model.revocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import warden.core.model.token.TokenScope;

@DisplayName("RevocationEvent")
class RevocationEventTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private static RevocationEvent event(RevocationCriteria criteria, Instant issuedBefore) {
        return new RevocationEvent(
                criteria.subjectId(),
                criteria.domainId(),
                criteria.projectId(),
                criteria.roleId(),
                criteria.trustId(),
                criteria.auditId(),
                issuedBefore,
                issuedBefore);
    }

    @Nested
    @DisplayName("matches()")
    class MatchesTests {

        @Test
        @DisplayName("should match tokens issued exactly at the boundary")
        void boundaryIsInclusive() {
            final var event = event(RevocationCriteria.builder().subjectId("alice").build(), T0);

            assertTrue(event.matches(payload().issuedAt(T0).build()));
            assertFalse(event.matches(payload().issuedAt(T0.plusMillis(1)).build()));
        }

        @Test
        @DisplayName("event without narrowing fields should match every earlier token")
        void wildcardMatchesEverything() {
            final var event = event(RevocationCriteria.all(), T0);

            assertFalse(event.hasNarrowingField());
            assertTrue(event.matches(payload().subject("bob").issuedAt(T0.minusSeconds(5)).build()));
            assertTrue(event.matches(payload().scope(TokenScope.unscoped()).issuedAt(T0).build()));
        }

        @Test
        @DisplayName("every present field must match")
        void allFieldsMustMatch() {
            final var event = event(
                    RevocationCriteria.builder().subjectId("alice").projectId("p1").build(), T0);

            assertTrue(event.matches(payload().issuedAt(T0).build()));
            assertFalse(event.matches(payload().scope(TokenScope.project("p2")).issuedAt(T0).build()));
            assertFalse(event.matches(payload().subject("bob").issuedAt(T0).build()));
        }

        @Test
        @DisplayName("domain should match the home domain or the domain scope")
        void domainMatchesHomeOrScope() {
            final var event = event(RevocationCriteria.builder().domainId("d1").build(), T0);

            assertTrue(event.matches(payload().domain("d1").issuedAt(T0).build()));
            assertTrue(event.matches(payload().scope(TokenScope.domain("d1")).roles("admin").issuedAt(T0).build()));
            assertFalse(event.matches(payload().issuedAt(T0).build()));
        }

        @Test
        @DisplayName("audit id should match anywhere in the chain")
        void auditIdMatchesChain() {
            final var event = event(RevocationCriteria.builder().auditId("root").build(), T0);

            assertTrue(event.matches(payload().auditIds("child", "root").issuedAt(T0).build()));
            assertFalse(event.matches(payload().auditIds("other").issuedAt(T0).build()));
        }

        @Test
        @DisplayName("role and trust should narrow the match")
        void roleAndTrust() {
            final var roleEvent = event(RevocationCriteria.builder().roleId("reader").build(), T0);
            final var trustEvent = event(RevocationCriteria.builder().trustId("t1").build(), T0);

            assertTrue(roleEvent.matches(payload().roles("member", "reader").issuedAt(T0).build()));
            assertFalse(roleEvent.matches(payload().roles("member").issuedAt(T0).build()));
            assertTrue(trustEvent.matches(payload().trust("t1").issuedAt(T0).build()));
            assertFalse(trustEvent.matches(payload().issuedAt(T0).build()));
        }
    }

    @Nested
    @DisplayName("isPrunableAt()")
    class PruneTests {

        @Test
        @DisplayName("should be prunable only once every covered token has expired")
        void prunableAfterHorizon() {
            final var event = event(RevocationCriteria.all(), T0);
            final var horizon = Duration.ofHours(1);

            assertFalse(event.isPrunableAt(T0.plus(horizon), horizon));
            assertTrue(event.isPrunableAt(T0.plus(horizon).plusMillis(1), horizon));
        }
    }

    @Nested
    @DisplayName("RevocationCriteria.toEvent()")
    class CriteriaTests {

        @Test
        @DisplayName("should default the boundary to now and truncate to millis")
        void defaultsBoundary() {
            final var now = Instant.parse("2026-03-01T12:00:00.123456Z");

            final var event = RevocationCriteria.builder().projectId("p1").build().toEvent(now);

            assertNull(event.subjectId());
            assertEquals("p1", event.projectId());
            assertEquals(Instant.parse("2026-03-01T12:00:00.123Z"), event.issuedBefore());
            assertEquals(event.issuedBefore(), event.revokedAt());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "\t"})
        @DisplayName("should reject a blank identifier instead of widening the match")
        void rejectsBlankIdentifier(String blank) {
            final var criteria = RevocationCriteria.builder().projectId(blank).build();

            final var e = assertThrows(IllegalArgumentException.class, () -> criteria.toEvent(T0));
            assertTrue(e.getMessage().contains("project_id"));
        }
    }
}
