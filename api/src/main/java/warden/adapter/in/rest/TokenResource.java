package warden.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.dto.AuthenticateRequest;
import warden.adapter.in.dto.TokenResponse;
import warden.adapter.in.problem.TokenProblem;
import warden.core.port.in.TokenLifecycle;

/**
 * REST resource for the token lifecycle.
 *
 * <ul>
 *   <li>{@code POST} - authenticate and issue a token</li>
 *   <li>{@code GET} - validate a token and return its payload</li>
 *   <li>{@code HEAD} - validate a token without a body</li>
 *   <li>{@code DELETE} - log a token out</li>
 * </ul>
 *
 * <p>The token travels in {@code X-Subject-Token}; a client bind assertion, when
 * used, in {@code X-Token-Bind}.
 */
@Path("/v3/auth/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    static final String SUBJECT_TOKEN = "X-Subject-Token";
    static final String TOKEN_BIND = "X-Token-Bind";

    private final TokenLifecycle lifecycle;

    @Inject
    public TokenResource(TokenLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> authenticate(AuthenticateRequest request, @HeaderParam(TOKEN_BIND) String bind) {
        if (request == null) {
            throw TokenProblem.badRequest("Request body is required");
        }
        return lifecycle.authenticate(request.toModel(bind)).map(issued -> Response.status(Response.Status.CREATED)
                .header(SUBJECT_TOKEN, issued.token())
                .entity(TokenResponse.from(issued.payload()))
                .build());
    }

    @GET
    public Uni<Response> validate(@HeaderParam(SUBJECT_TOKEN) String token, @HeaderParam(TOKEN_BIND) String bind) {
        requireToken(token);
        return lifecycle.validate(token, bind).map(payload -> Response.ok(TokenResponse.from(payload))
                .header(SUBJECT_TOKEN, token)
                .build());
    }

    @HEAD
    public Uni<Response> check(@HeaderParam(SUBJECT_TOKEN) String token, @HeaderParam(TOKEN_BIND) String bind) {
        requireToken(token);
        return lifecycle.validate(token, bind).map(payload -> Response.ok().build());
    }

    @DELETE
    public Uni<Response> logout(@HeaderParam(SUBJECT_TOKEN) String token, @HeaderParam(TOKEN_BIND) String bind) {
        requireToken(token);
        return lifecycle.logout(token, bind).map(v -> Response.noContent().build());
    }

    private static void requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw TokenProblem.missingSubjectToken();
        }
    }
}
