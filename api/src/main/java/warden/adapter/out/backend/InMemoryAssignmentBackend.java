package warden.adapter.out.backend;

import java.util.Arrays;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import com.google.common.collect.SetMultimap;
import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;

import warden.core.config.BackendConfig;
import warden.core.model.token.TokenScope;
import warden.core.port.out.AssignmentBackend;

/**
 * In-memory role assignments, seeded from {@code warden.backend.users.*.project-roles}
 * and {@code domain-roles}.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryAssignmentBackend implements AssignmentBackend {

    private final SetMultimap<String, String> assignments = Multimaps.synchronizedSetMultimap(HashMultimap.create());

    public InMemoryAssignmentBackend() {}

    @Inject
    public InMemoryAssignmentBackend(BackendConfig config) {
        config.users().forEach((userId, user) -> {
            user.projectRoles().forEach((projectId, roles) -> assignAll(userId, TokenScope.project(projectId), roles));
            user.domainRoles().forEach((domainId, roles) -> assignAll(userId, TokenScope.domain(domainId), roles));
        });
    }

    public void assign(String subjectId, TokenScope scope, String roleId) {
        assignments.put(key(subjectId, scope), roleId);
    }

    public void unassign(String subjectId, TokenScope scope, String roleId) {
        assignments.remove(key(subjectId, scope), roleId);
    }

    @Override
    public Uni<Set<String>> rolesFor(String subjectId, TokenScope scope) {
        if (!scope.isScoped()) {
            return Uni.createFrom().item(Set.of());
        }
        return Uni.createFrom().item(() -> {
            synchronized (assignments) {
                return ImmutableSet.copyOf(assignments.get(key(subjectId, scope)));
            }
        });
    }

    private void assignAll(String subjectId, TokenScope scope, String roles) {
        Arrays.stream(roles.split(","))
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .forEach(role -> assign(subjectId, scope, role));
    }

    private static String key(String subjectId, TokenScope scope) {
        return subjectId + "|" + scope.type() + ":" + (scope.projectId() != null ? scope.projectId() : scope.domainId());
    }
}
