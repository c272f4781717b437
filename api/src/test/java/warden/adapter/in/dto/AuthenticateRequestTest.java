package warden.adapter.in.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.token.ScopeRequest;

@DisplayName("AuthenticateRequest")
class AuthenticateRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("should read the wire format into the domain request")
    void readsWireFormat() throws Exception {
        final var json = """
                {
                  "methods": ["password"],
                  "credentials": {"password": {"user_id": "alice", "password": "secret"}},
                  "scope": {"project_id": "p1"}
                }
                """;

        final var request = mapper.readValue(json, AuthenticateRequest.class).toModel("cert-a");

        assertEquals(List.of("password"), request.methods());
        assertEquals("secret", request.credentialsFor("password").get("password"));
        assertEquals("p1", request.scope().projectId());
        assertNull(request.scope().domainId());
        assertEquals("cert-a", request.bind());
    }

    @Test
    @DisplayName("should treat a missing scope as unscoped")
    void missingScope() {
        final var request = new AuthenticateRequest(List.of("token"), Map.of("token", Map.of("id", "js_abc")), null)
                .toModel(null);

        assertEquals(ScopeRequest.UNSCOPED, request.scope());
    }
}
