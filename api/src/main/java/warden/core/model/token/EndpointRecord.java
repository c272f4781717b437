package warden.core.model.token;

import java.util.Objects;

/**
 * One service endpoint in a catalog snapshot.
 *
 * @param serviceId     catalog service identifier
 * @param serviceType   service type (e.g. "compute", "identity")
 * @param interfaceName endpoint interface (public, internal, admin)
 * @param region        region the endpoint lives in, may be null
 * @param url           endpoint URL
 */
public record EndpointRecord(String serviceId, String serviceType, String interfaceName, String region, String url) {

    public EndpointRecord {
        Objects.requireNonNull(serviceId, "serviceId is required");
        Objects.requireNonNull(serviceType, "serviceType is required");
        Objects.requireNonNull(interfaceName, "interfaceName is required");
        Objects.requireNonNull(url, "url is required");
    }
}
