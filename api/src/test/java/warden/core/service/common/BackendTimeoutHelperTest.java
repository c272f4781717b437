package warden.core.service.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.exception.BackendUnavailableException;
import warden.core.exception.TokenNotFoundException;
import warden.core.port.out.TokenMetrics;

@ExtendWith(MockitoExtension.class)
@DisplayName("BackendTimeoutHelper")
class BackendTimeoutHelperTest {

    private static final Duration AWAIT = Duration.ofSeconds(2);

    @Mock
    private TokenMetrics metrics;

    private BackendTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new BackendTimeoutHelper(Duration.ofMillis(100), metrics, "token-store");
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should pass through a timely result")
        void passesResult() {
            assertEquals("ok", helper.withTimeout(Uni.createFrom().item("ok"), "get").await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should fail with BackendUnavailableException on timeout and record it")
        void failsOnTimeout() {
            assertThrows(
                    BackendUnavailableException.class,
                    () -> helper.withTimeout(Uni.createFrom().nothing(), "get").await().atMost(AWAIT));

            verify(metrics).recordBackendTimeout("token-store", "get");
        }

        @Test
        @DisplayName("should honour a caller-supplied timeout")
        void callerTimeout() {
            final var slow = Uni.createFrom().item("late").onItem().delayIt().by(Duration.ofMillis(300));

            assertEquals("late", helper.withTimeout(slow, "get", Duration.ofSeconds(1)).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should wrap backend failures without recording a timeout")
        void wrapsBackendFailure() {
            final var cause = new IllegalStateException("connection refused");

            final var thrown = assertThrows(
                    BackendUnavailableException.class,
                    () -> helper.withTimeout(Uni.createFrom().failure(cause), "put").await().atMost(AWAIT));

            assertSame(cause, thrown.getCause());
            verify(metrics, never()).recordBackendTimeout("token-store", "put");
        }

        @Test
        @DisplayName("should let engine exceptions through unchanged")
        void keepsEngineExceptions() {
            assertThrows(
                    TokenNotFoundException.class,
                    () -> helper.withTimeout(
                                    Uni.createFrom().failure(new TokenNotFoundException("gone")), "get")
                            .await()
                            .atMost(AWAIT));
        }
    }

    @Nested
    @DisplayName("withTimeoutSilent()")
    class WithTimeoutSilentTests {

        @Test
        @DisplayName("should complete on timeout")
        void completesOnTimeout() {
            assertNull(helper.withTimeoutSilent(Uni.createFrom().nothing(), "publish").await().atMost(AWAIT));

            verify(metrics).recordBackendTimeout("token-store", "publish");
        }

        @Test
        @DisplayName("should complete on failure")
        void completesOnFailure() {
            assertNull(helper.withTimeoutSilent(Uni.createFrom().failure(new RuntimeException("down")), "publish")
                    .await()
                    .atMost(AWAIT));
        }
    }
}
