package warden.core.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Seed data for the in-memory identity, assignment and catalog backends.
 *
 * <p>Configuration prefix: {@code warden.backend}
 *
 * <pre>
 * warden.backend.users.alice.password=secret
 * warden.backend.users.alice.domain=default
 * warden.backend.users.alice.project-roles.demo=member,reader
 * warden.backend.endpoints.identity.type=identity
 * warden.backend.endpoints.identity.url=http://localhost:8080/v3
 * </pre>
 */
@ConfigMapping(prefix = "warden.backend")
public interface BackendConfig {

    /**
     * Users keyed by user id.
     */
    Map<String, UserConfig> users();

    /**
     * Catalog endpoints keyed by service id.
     */
    Map<String, EndpointConfig> endpoints();

    interface UserConfig {

        String password();

        @WithDefault("default")
        String domain();

        /**
         * Comma-separated role ids keyed by project id.
         */
        @WithName("project-roles")
        Map<String, String> projectRoles();

        /**
         * Comma-separated role ids keyed by domain id.
         */
        @WithName("domain-roles")
        Map<String, String> domainRoles();
    }

    interface EndpointConfig {

        String type();

        @WithName("interface")
        @WithDefault("public")
        String interfaceName();

        Optional<String> region();

        String url();
    }
}
