package warden.adapter.in.rest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.RevocationEventDto;
import warden.adapter.in.dto.RevocationRequest;
import warden.adapter.in.problem.TokenProblem;
import warden.core.model.revocation.RevocationCriteria;
import warden.core.port.in.TokenLifecycle;

/**
 * REST resource for revocation events.
 */
@Path("/v3/auth/revocations")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RevocationResource {

    private static final Logger LOG = Logger.getLogger(RevocationResource.class);

    private final TokenLifecycle lifecycle;

    @Inject
    public RevocationResource(TokenLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * Record a revocation event. An empty body revokes every token issued so far.
     *
     * @param request the narrowing fields
     * @return 201 with the recorded event
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> revoke(RevocationRequest request) {
        final var criteria = request != null ? request.toCriteria() : RevocationCriteria.all();
        return lifecycle.revoke(criteria).map(event -> {
            LOG.debugf("Revocation event recorded via API, issued before %s", event.issuedBefore());
            return Response.status(Response.Status.CREATED)
                    .entity(RevocationEventDto.from(event))
                    .build();
        });
    }

    /**
     * List live revocation events.
     *
     * @param since ISO-8601 instant; only events recorded at or after it are returned
     * @return the events, oldest first
     */
    @GET
    public Uni<List<RevocationEventDto>> list(@QueryParam("since") String since) {
        final Instant sinceInstant;
        try {
            sinceInstant = since == null || since.isBlank() ? null : Instant.parse(since);
        } catch (DateTimeParseException e) {
            throw TokenProblem.badRequest("Invalid 'since' timestamp: " + since);
        }
        return lifecycle
                .listRevocations(sinceInstant)
                .map(events -> events.stream().map(RevocationEventDto::from).toList());
    }
}
