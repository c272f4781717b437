package warden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.core.exception.WardenException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapWardenException(WardenException e) {
        if (e.kind().exposure().isRetryable()) {
            LOG.warnv("Request failed on backend: {0}", e.getMessage());
        } else {
            LOG.debugv("Request rejected ({0}): {1}", e.kind().tagValue(), e.getMessage());
        }
        return toResponse(TokenProblem.forKind(e.kind(), e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(TokenProblem.badRequest("Invalid request"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
