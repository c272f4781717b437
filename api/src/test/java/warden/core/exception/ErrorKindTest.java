package warden.core.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorKind")
class ErrorKindTest {

    private Locale original;

    @BeforeEach
    void rememberLocale() {
        original = Locale.getDefault();
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(original);
    }

    @Test
    @DisplayName("tag values should not depend on the default locale")
    void tagValueIgnoresLocale() {
        Locale.setDefault(new Locale("tr", "TR"));

        assertEquals("authentication", ErrorKind.AUTHENTICATION.tagValue());
        assertEquals("signature_invalid", ErrorKind.SIGNATURE_INVALID.tagValue());
    }

    @Test
    @DisplayName("only backend failures should be retryable")
    void retryable() {
        for (var kind : ErrorKind.values()) {
            assertEquals(kind == ErrorKind.BACKEND_UNAVAILABLE, kind.exposure().isRetryable(), kind.name());
        }
    }
}
