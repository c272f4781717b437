package warden.core.service.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.exception.UnknownFormatException;
import warden.core.model.token.TokenFormat;
import warden.spi.TokenFormatProvider;
import warden.support.TestConfigs;

@DisplayName("TokenFormatRegistry")
class TokenFormatRegistryTest {

    private static TokenFormatProvider provider(TokenFormat format) {
        final var provider = mock(TokenFormatProvider.class);
        lenient().when(provider.format()).thenReturn(format);
        return provider;
    }

    @Test
    @DisplayName("should issue in the configured format and accept every registered one")
    void issuesConfiguredFormat() {
        final var opaque = provider(TokenFormat.OPAQUE);
        final var signed = provider(TokenFormat.SIGNED);

        final var registry = new TokenFormatRegistry(List.of(opaque, signed), TestConfigs.token("opaque"));

        assertSame(opaque, registry.issuingProvider());
        assertEquals(TokenFormat.OPAQUE, registry.issuingFormat());
        assertSame(signed, registry.providerFor("js_abc"));
        assertSame(opaque, registry.providerFor("op_abc"));
    }

    @Test
    @DisplayName("should reject tokens whose tag no registered format claims")
    void unknownTag() {
        final var registry = new TokenFormatRegistry(
                List.of(provider(TokenFormat.SIGNED)), TestConfigs.token("signed"));

        assertThrows(UnknownFormatException.class, () -> registry.providerFor("fe_key.body"));
        assertThrows(UnknownFormatException.class, () -> registry.providerFor("xx_whatever"));
        assertThrows(UnknownFormatException.class, () -> registry.providerFor("js_"));
        assertThrows(UnknownFormatException.class, () -> registry.providerFor(null));
        assertTrue(registry.provider(TokenFormat.ENCRYPTED).isEmpty());
    }

    @Test
    @DisplayName("should fail fast when the configured format has no provider")
    void missingIssuingProvider() {
        assertThrows(
                IllegalStateException.class,
                () -> new TokenFormatRegistry(List.of(provider(TokenFormat.OPAQUE)), TestConfigs.token("encrypted")));
    }

    @Test
    @DisplayName("should refuse two providers for one format")
    void duplicateProvider() {
        assertThrows(
                IllegalStateException.class,
                () -> new TokenFormatRegistry(
                        List.of(provider(TokenFormat.SIGNED), provider(TokenFormat.SIGNED)),
                        TestConfigs.token("signed")));
    }

    @Test
    @DisplayName("should reject an unknown configured format name")
    void unknownConfiguredName() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new TokenFormatRegistry(List.of(provider(TokenFormat.SIGNED)), TestConfigs.token("fernet")));
    }
}
