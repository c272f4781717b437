package warden.adapter.in.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.token.AuthenticationRequest;
import warden.core.model.token.ScopeRequest;

/**
 * DTO for token creation requests.
 *
 * <pre>{@code
 * {
 *   "methods": ["password"],
 *   "credentials": {"password": {"user_id": "alice", "password": "secret"}},
 *   "scope": {"project_id": "demo"}
 * }
 * }</pre>
 *
 * @param methods     authentication methods, at least one
 * @param credentials credential data keyed by method; the {@code token} method takes {@code id}
 * @param scope       requested scope, omitted for an unscoped token
 */
public record AuthenticateRequest(
        List<String> methods, Map<String, Map<String, String>> credentials, Scope scope) {

    public record Scope(@JsonProperty("project_id") String projectId, @JsonProperty("domain_id") String domainId) {}

    public AuthenticationRequest toModel(String bind) {
        return new AuthenticationRequest(
                methods,
                credentials,
                scope == null ? ScopeRequest.UNSCOPED : new ScopeRequest(scope.projectId(), scope.domainId()),
                bind);
    }
}
