package portico.core.port.out;

import portico.core.model.gateway.GatewayResult;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a forwarded request.
     *
     * @param upstream the target upstream
     * @param method the HTTP method
     * @param statusCode the response status code
     */
    void recordRequest(String upstream, String method, int statusCode);

    /**
     * Record proxy latency.
     *
     * @param upstream the target upstream
     * @param method the HTTP method
     * @param statusCode the response status code
     * @param latencyMs latency in milliseconds
     */
    void recordProxyLatency(String upstream, String method, int statusCode, long latencyMs);

    /**
     * Record the outcome of a pipeline run.
     *
     * @param upstream the target upstream
     * @param result the gateway result
     */
    void recordGatewayResult(String upstream, GatewayResult result);

    /**
     * Record an access denied event.
     *
     * @param upstream the target upstream
     * @param reason the reason for denial
     */
    void recordAccessDenied(String upstream, String reason);

    /**
     * Record a stream re-issued over the fallback transport.
     */
    void recordStreamFallback(String upstream);

    /**
     * Record why a stream ended.
     *
     * @param upstream the target upstream
     * @param cause completed, sentinel, empty_reads, cancelled or error
     */
    void recordStreamTermination(String upstream, String cause);

    /**
     * Record a login attempt against an upstream.
     *
     * @param upstream the target upstream
     * @param success whether a token was obtained
     */
    void recordLogin(String upstream, boolean success);

    /**
     * Record a retry after the upstream rejected a token.
     */
    void recordReauthentication(String upstream);
}
