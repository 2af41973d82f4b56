package portico.core.model.gateway;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Multi;

/**
 * Outcome of running the pipeline for one inbound request.
 */
public sealed interface GatewayResult {

    record Success(int statusCode, Map<String, List<String>> headers, byte[] body) implements GatewayResult {
        public Success {
            if (headers == null) {
                headers = Map.of();
            }
            if (body == null) {
                body = new byte[0];
            }
        }
    }

    /**
     * An open-ended chunk stream. Cancelling the subscription closes the upstream connection.
     */
    record Streaming(Multi<byte[]> chunks) implements GatewayResult {}

    /**
     * Unmapped path, denied permission or denied role.
     *
     * @param reason stable, machine-readable reason code
     */
    record Forbidden(String reason) implements GatewayResult {}

    record MethodNotAllowed(String method) implements GatewayResult {}

    /**
     * A pre-processor stopped the request before anything was forwarded.
     */
    record Aborted(int statusCode, String reason) implements GatewayResult {}

    /**
     * The upstream call succeeded but a post-processor failed.
     */
    record PostProcessingFailed(String processor, String message) implements GatewayResult {}

    /**
     * The upstream could not be reached or did not answer in time.
     */
    record UpstreamUnreachable(String message) implements GatewayResult {}
}
