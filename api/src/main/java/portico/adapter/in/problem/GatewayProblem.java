package portico.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for gateway errors.
 *
 * <p>Every problem raised for a denied request carries its machine-readable
 * reason code as the {@code reason} extension member.
 */
public final class GatewayProblem {

    public static final String REASON = "reason";
    public static final String UPSTREAM = "upstream";

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Client Errors ==========

    public static HttpProblem forbidden(String reason) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail("Access denied: %s".formatted(reason))
                .with(REASON, reason)
                .build();
    }

    public static HttpProblem methodNotAllowed(String method) {
        return HttpProblem.builder()
                .withTitle("Method Not Allowed")
                .withStatus(Status.METHOD_NOT_ALLOWED)
                .withDetail("Method %s is not supported for this route".formatted(method))
                .build();
    }

    public static HttpProblem invalidRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Invalid Gateway Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    /**
     * A request stopped by a pre-processor, with the status the hook chose.
     */
    public static HttpProblem aborted(int status, String reason) {
        var resolved = Status.fromStatusCode(status);
        return HttpProblem.builder()
                .withTitle("Request Rejected")
                .withStatus(resolved != null ? resolved : Status.FORBIDDEN)
                .withDetail("Request rejected: %s".formatted(reason))
                .with(REASON, reason)
                .build();
    }

    // ========== Gateway Errors ==========

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    /**
     * The gateway could not log in to the upstream with its configured identity.
     */
    public static HttpProblem upstreamAuthFailed(String upstream) {
        return HttpProblem.builder()
                .withTitle("Upstream Authentication Failed")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail("Could not authenticate to upstream %s".formatted(upstream))
                .with(UPSTREAM, upstream)
                .build();
    }

    public static HttpProblem upstreamUnreachable(String upstream, String detail) {
        return HttpProblem.builder()
                .withTitle("Upstream Unreachable")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .with(UPSTREAM, upstream)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
