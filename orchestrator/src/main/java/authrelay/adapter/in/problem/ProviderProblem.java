package authrelay.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for provider and session errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across the
 * provider and settings endpoints.
 */
public final class ProviderProblem {

    private ProviderProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem providerNotFound(String providerId) {
        return HttpProblem.builder()
                .withTitle("Provider Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("Authentication provider '%s' is not registered".formatted(providerId))
                .build();
    }

    public static HttpProblem identityBackendError(String detail) {
        return HttpProblem.builder()
                .withTitle("Identity Backend Error")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }
}
