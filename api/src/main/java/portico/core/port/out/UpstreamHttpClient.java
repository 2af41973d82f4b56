package portico.core.port.out;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.UpstreamRequest;
import portico.core.model.gateway.UpstreamResponse;

/**
 * Sends one request to an upstream and buffers the complete response.
 *
 * <p>Non-2xx answers are returned as responses. The {@link Uni} fails with
 * {@link portico.core.model.gateway.UpstreamUnreachableException} only when no answer was obtained.
 */
public interface UpstreamHttpClient {

    Uni<UpstreamResponse> send(UpstreamRequest request);
}
