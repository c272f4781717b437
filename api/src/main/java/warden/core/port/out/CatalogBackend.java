package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.token.EndpointRecord;
import warden.core.model.token.TokenScope;

/**
 * Port interface for the service catalog.
 */
public interface CatalogBackend {

    Uni<List<EndpointRecord>> endpointsFor(TokenScope scope);
}
