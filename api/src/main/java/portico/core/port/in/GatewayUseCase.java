package portico.core.port.in;

import io.smallrye.mutiny.Uni;

import portico.core.model.auth.CallerIdentity;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.RequestContext;

/**
 * Use case for forwarding a caller's request to a named upstream under the upstream's rule table.
 */
public interface GatewayUseCase {

    /**
     * Run the full pipeline for one request.
     *
     * @param upstream name of the target upstream
     * @param request  the inbound request below the upstream prefix
     * @param identity the resolved caller identity
     * @return the result; {@link GatewayResult.Streaming} for streaming rules
     */
    Uni<GatewayResult> forward(String upstream, RequestContext request, CallerIdentity identity);

    /**
     * Whether the request would be served by a streaming rule.
     * Inbound adapters use this to pick the chunked response path before reading the body.
     */
    boolean isStreamingRoute(String upstream, String subPath, String method);
}
