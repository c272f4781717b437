package warden.adapter.out.backend;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.BackendConfig;
import warden.core.exception.AuthenticationException;
import warden.core.model.token.Principal;
import warden.core.port.out.IdentityBackend;

/**
 * In-memory identity backend supporting the {@code password} method.
 *
 * <p>Credential data: {@code user_id} and {@code password}. Users are seeded from
 * {@code warden.backend.users} and may be added at runtime.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryIdentityBackend implements IdentityBackend {

    private static final Logger LOG = Logger.getLogger(InMemoryIdentityBackend.class);

    public static final String PASSWORD_METHOD = "password";

    private record User(Principal principal, byte[] password) {}

    private final ConcurrentMap<String, User> users = new ConcurrentHashMap<>();

    public InMemoryIdentityBackend() {}

    @Inject
    public InMemoryIdentityBackend(BackendConfig config) {
        config.users().forEach((userId, user) -> addUser(userId, user.domain(), user.password()));
        if (!users.isEmpty()) {
            LOG.infof("Loaded %d users into the in-memory identity backend", users.size());
        }
    }

    public void addUser(String userId, String domainId, String password) {
        users.put(userId, new User(new Principal(userId, domainId), password.getBytes(StandardCharsets.UTF_8)));
    }

    public void removeUser(String userId) {
        users.remove(userId);
    }

    @Override
    public Uni<Principal> verifyCredentials(String method, Map<String, String> data) {
        return Uni.createFrom().item(() -> {
            if (!PASSWORD_METHOD.equals(method)) {
                throw new AuthenticationException("Unsupported authentication method: " + method);
            }
            final var userId = data.get("user_id");
            final var password = data.get("password");
            final var user = userId != null ? users.get(userId) : null;
            if (user == null
                    || password == null
                    || !MessageDigest.isEqual(user.password(), password.getBytes(StandardCharsets.UTF_8))) {
                LOG.debugf("Password authentication failed for user %s", userId);
                throw new AuthenticationException("Invalid credentials");
            }
            return user.principal();
        });
    }
}
