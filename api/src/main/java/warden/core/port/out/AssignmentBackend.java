package warden.core.port.out;

import java.util.Set;

import io.smallrye.mutiny.Uni;

import warden.core.model.token.TokenScope;

/**
 * Port interface for role assignment lookups.
 */
public interface AssignmentBackend {

    /**
     * Roles a principal holds in a scope.
     *
     * @param subjectId the principal
     * @param scope     the scope; unscoped yields no roles
     * @return role ids, empty if none
     */
    Uni<Set<String>> rolesFor(String subjectId, TokenScope scope);
}
