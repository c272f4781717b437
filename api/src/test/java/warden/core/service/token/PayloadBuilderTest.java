package warden.core.service.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static warden.support.Payloads.payload;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.exception.EmptyMethodsException;
import warden.core.exception.InvalidScopeException;
import warden.core.exception.TokenExpiredException;
import warden.core.model.token.IssueRequest;
import warden.core.model.token.Principal;
import warden.core.model.token.ScopeRequest;
import warden.core.model.token.TokenScope;
import warden.support.MutableClock;
import warden.support.TestConfigs;
import warden.support.TestEngine;

@DisplayName("PayloadBuilder")
class PayloadBuilderTest {

    private static final Principal ALICE = new Principal("alice", "default");

    private MutableClock clock;
    private PayloadBuilder builder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestEngine.START);
        builder = new PayloadBuilder(clock, TestConfigs.token("signed"));
    }

    private static IssueRequest.Builder request() {
        return IssueRequest.builder(ALICE).methods(Set.of("password"));
    }

    @Nested
    @DisplayName("build()")
    class BuildTests {

        @Test
        @DisplayName("should stamp times from the clock with millisecond precision")
        void stampsTimes() {
            clock.set(Instant.parse("2026-03-01T12:00:00.123456789Z"));

            final var payload = builder.build(request().build());

            assertEquals(Instant.parse("2026-03-01T12:00:00.123Z"), payload.issuedAt());
            assertEquals(payload.issuedAt().plus(Duration.ofHours(1)), payload.expiresAt());
        }

        @Test
        @DisplayName("should start a fresh audit chain")
        void freshAuditChain() {
            final var first = builder.build(request().build());
            final var second = builder.build(request().build());

            assertEquals(1, first.auditIds().size());
            assertEquals(22, first.auditId().length());
            assertNotEquals(first.auditId(), second.auditId());
        }

        @Test
        @DisplayName("should carry roles only for scoped tokens")
        void rolesOnlyWhenScoped() {
            final var scoped = builder.build(
                    request().scope(ScopeRequest.project("p1")).roles(Set.of("member")).build());
            final var unscoped = builder.build(request().roles(Set.of("member")).build());

            assertEquals(TokenScope.project("p1"), scoped.scope());
            assertEquals(Set.of("member"), scoped.roles());
            assertTrue(unscoped.roles().isEmpty());
        }
    }

    @Nested
    @DisplayName("rescoping")
    class RescopeTests {

        @Test
        @DisplayName("should prepend a new audit id to the ancestor's chain")
        void extendsAuditChain() {
            final var ancestor = payload().scope(TokenScope.unscoped()).auditIds("root").build();

            final var payload = builder.build(request()
                    .scope(ScopeRequest.project("p1"))
                    .roles(Set.of("member"))
                    .ancestor(ancestor)
                    .build());

            assertEquals(2, payload.auditIds().size());
            assertEquals("root", payload.auditIds().get(1));
            assertNotEquals("root", payload.auditId());
        }

        @Test
        @DisplayName("should never outlive the ancestor")
        void capsExpiry() {
            final var ancestor = payload()
                    .scope(TokenScope.unscoped())
                    .issuedAt(TestEngine.START.minus(Duration.ofMinutes(50)))
                    .build();

            final var payload = builder.build(request().ancestor(ancestor).build());

            assertEquals(ancestor.expiresAt(), payload.expiresAt());
        }

        @Test
        @DisplayName("should refuse an expired ancestor")
        void expiredAncestor() {
            final var ancestor = payload().issuedAt(TestEngine.START.minus(Duration.ofHours(2))).build();

            assertThrows(TokenExpiredException.class, () -> builder.build(request().ancestor(ancestor).build()));
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should require at least one method")
        void requiresMethods() {
            assertThrows(
                    EmptyMethodsException.class,
                    () -> builder.build(IssueRequest.builder(ALICE).build()));
        }

        @Test
        @DisplayName("should reject a scope naming both a project and a domain")
        void rejectsDoubleScope() {
            assertThrows(
                    InvalidScopeException.class,
                    () -> builder.build(request()
                            .scope(new ScopeRequest("p1", "d1"))
                            .roles(Set.of("member"))
                            .build()));
        }

        @Test
        @DisplayName("should reject blank scope identifiers")
        void rejectsBlankScope() {
            assertThrows(
                    InvalidScopeException.class,
                    () -> builder.build(request().scope(ScopeRequest.project(" ")).build()));
        }

        @Test
        @DisplayName("should reject a scoped token without roles")
        void rejectsScopedWithoutRoles() {
            assertThrows(
                    InvalidScopeException.class,
                    () -> builder.build(request().scope(ScopeRequest.domain("d1")).build()));
        }

        @Test
        @DisplayName("should only delegate through project scoped tokens")
        void delegationNeedsProject() {
            assertThrows(
                    InvalidScopeException.class,
                    () -> builder.build(request().trustId("t1").build()));

            final var delegated = builder.build(request()
                    .scope(ScopeRequest.project("p1"))
                    .roles(Set.of("member"))
                    .trustId("t1")
                    .catalog(List.of())
                    .build());
            assertTrue(delegated.isDelegated());
        }
    }
}
