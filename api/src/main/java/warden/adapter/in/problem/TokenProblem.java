package warden.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import warden.core.exception.ErrorKind;

/**
 * RFC 7807 Problem Details factory for token engine errors.
 *
 * <p>Token failures collapse to one generic 401 so callers cannot tell which check
 * rejected a token.
 */
public final class TokenProblem {

    private TokenProblem() {}

    public static HttpProblem forKind(ErrorKind kind, String detail) {
        return switch (kind.exposure()) {
            case UNAUTHORIZED -> unauthorized();
            case BAD_REQUEST -> badRequest(detail);
            case SERVICE_UNAVAILABLE -> serviceUnavailable();
        };
    }

    public static HttpProblem unauthorized() {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("The request you have made requires authentication.")
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable() {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("Token storage is temporarily unavailable, retry later")
                .build();
    }

    public static HttpProblem missingSubjectToken() {
        return badRequest("X-Subject-Token header is required");
    }
}
