package warden.adapter.out.backend;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;

import warden.core.config.BackendConfig;
import warden.core.model.token.EndpointRecord;
import warden.core.model.token.TokenScope;
import warden.core.port.out.CatalogBackend;

/**
 * In-memory service catalog. Every scope sees the same endpoints.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryCatalogBackend implements CatalogBackend {

    private final List<EndpointRecord> endpoints = new CopyOnWriteArrayList<>();

    public InMemoryCatalogBackend() {}

    @Inject
    public InMemoryCatalogBackend(BackendConfig config) {
        config.endpoints().forEach((serviceId, endpoint) -> addEndpoint(new EndpointRecord(
                serviceId,
                endpoint.type(),
                endpoint.interfaceName(),
                endpoint.region().orElse(null),
                endpoint.url())));
    }

    public void addEndpoint(EndpointRecord endpoint) {
        endpoints.add(endpoint);
    }

    @Override
    public Uni<List<EndpointRecord>> endpointsFor(TokenScope scope) {
        if (!scope.isScoped()) {
            return Uni.createFrom().item(List.of());
        }
        return Uni.createFrom().item(() -> List.copyOf(endpoints));
    }
}
