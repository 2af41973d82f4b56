package portico.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import portico.core.model.auth.CredentialException;
import portico.core.model.gateway.UpstreamStatusException;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.spi.HookAbortedException;

/**
 * Maps gateway exceptions that escape the pipeline to problem responses.
 *
 * <p>Upstream status failures keep the upstream's own status and body.
 */
@ApplicationScoped
public class GatewayExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GatewayExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapCredentialException(CredentialException e) {
        LOG.warnv("Login to upstream {0} failed: {1}", e.upstream(), e.getMessage());
        return toResponse(GatewayProblem.upstreamAuthFailed(e.upstream()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamUnreachable(UpstreamUnreachableException e) {
        LOG.warnv("Upstream unreachable: {0}", e.getMessage());
        return toResponse(GatewayProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamStatus(UpstreamStatusException e) {
        LOG.debugv("Passing upstream status {0} through", e.statusCode());
        return Response.status(e.statusCode()).entity(e.body()).build();
    }

    @ServerExceptionMapper
    public Response mapHookAborted(HookAbortedException e) {
        LOG.debugv("Request rejected by pre-processor: {0}", e.reason());
        return toResponse(GatewayProblem.aborted(e.statusCode(), e.reason()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Invalid gateway request: {0}", e.getMessage());
        return toResponse(GatewayProblem.invalidRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatusCode())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
