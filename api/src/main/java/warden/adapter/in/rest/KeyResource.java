package warden.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.dto.KeySummaryResponse;
import warden.core.service.key.KeyRotationService;
import warden.core.service.key.SigningKeyRegistry;

/**
 * REST resource for key administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Listing signing keys usable for verification</li>
 *   <li>Triggering an immediate signing or encryption key rotation</li>
 * </ul>
 */
@Path("/v3/auth/keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class KeyResource {

    private final SigningKeyRegistry signingKeyRegistry;
    private final KeyRotationService keyRotationService;

    @Inject
    public KeyResource(SigningKeyRegistry signingKeyRegistry, KeyRotationService keyRotationService) {
        this.signingKeyRegistry = signingKeyRegistry;
        this.keyRotationService = keyRotationService;
    }

    @GET
    @Path("/signing")
    public List<KeySummaryResponse> listSigningKeys() {
        return signingKeyRegistry.getVerificationKeys().stream()
                .map(KeySummaryResponse::from)
                .toList();
    }

    /**
     * Generate and activate a new signing key. The previous key keeps verifying
     * until it is retired.
     */
    @POST
    @Path("/signing/rotate")
    public Uni<KeySummaryResponse> rotateSigningKey(@QueryParam("reason") String reason) {
        return keyRotationService.triggerSigningRotation(reason).map(KeySummaryResponse::from);
    }

    /**
     * Generate and activate a new encryption key. The previous key keeps decrypting
     * for the grace period.
     */
    @POST
    @Path("/encryption/rotate")
    public Uni<KeySummaryResponse> rotateEncryptionKey(@QueryParam("reason") String reason) {
        return keyRotationService.triggerEncryptionRotation(reason).map(KeySummaryResponse::from);
    }
}
