package warden.core.model.token;

import java.util.List;
import java.util.Objects;

/**
 * Federation attributes of a token issued for an externally authenticated principal.
 *
 * @param identityProviderId the identity provider that asserted the principal
 * @param protocolId         the federation protocol (e.g. "saml2", "openid")
 * @param groupIds           groups the principal was mapped into
 */
public record FederationInfo(String identityProviderId, String protocolId, List<String> groupIds) {

    public FederationInfo {
        Objects.requireNonNull(identityProviderId, "identityProviderId is required");
        Objects.requireNonNull(protocolId, "protocolId is required");
        groupIds = groupIds == null ? List.of() : List.copyOf(groupIds);
    }
}
