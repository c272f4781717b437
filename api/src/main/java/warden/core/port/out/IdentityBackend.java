package warden.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import warden.core.model.token.Principal;

/**
 * Port interface for credential verification.
 *
 * <p>The verification algorithm belongs to the backend; the engine only needs
 * the principal a credential resolves to.
 */
public interface IdentityBackend {

    /**
     * Verify credentials for one authentication method.
     *
     * @param method the method name (e.g. "password", "totp")
     * @param data   credential data for the method
     * @return the principal; fails with {@code AuthenticationException} on rejection
     */
    Uni<Principal> verifyCredentials(String method, Map<String, String> data);
}
