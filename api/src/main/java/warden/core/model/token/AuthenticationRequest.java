package warden.core.model.token;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A request to authenticate with one or more methods and obtain a token.
 *
 * <p>Each method name maps to the credential data for that method. The {@code token}
 * method carries an existing token under the {@code id} key and rescopes it.
 *
 * @param methods     method names in the order they were presented
 * @param credentials credential data keyed by method name
 * @param scope       the requested scope
 * @param bind        client binding assertion, or null
 */
public record AuthenticationRequest(
        List<String> methods, Map<String, Map<String, String>> credentials, ScopeRequest scope, String bind) {

    public static final String TOKEN_METHOD = "token";

    public AuthenticationRequest {
        methods = methods == null ? List.of() : List.copyOf(methods);
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
        scope = scope == null ? ScopeRequest.UNSCOPED : scope;
    }

    /**
     * Credential data for a method.
     *
     * @param method the method name
     * @return the data, empty if none was supplied
     */
    public Map<String, String> credentialsFor(String method) {
        Objects.requireNonNull(method, "method is required");
        return credentials.getOrDefault(method, Map.of());
    }

    public boolean isRescope() {
        return methods.contains(TOKEN_METHOD);
    }
}
