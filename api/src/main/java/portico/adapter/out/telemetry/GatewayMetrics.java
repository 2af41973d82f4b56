package portico.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import portico.core.model.gateway.GatewayResult;
import portico.core.port.out.Metrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never check configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code portico.requests.total} - forwarded requests by upstream, method, status</li>
 *   <li>{@code portico.proxy.latency} - upstream latency</li>
 *   <li>{@code portico.gateway.results} - pipeline outcomes</li>
 *   <li>{@code portico.access.denied.total} - denials by reason</li>
 *   <li>{@code portico.stream.fallbacks.total} - streams re-issued over the fallback transport</li>
 *   <li>{@code portico.stream.terminations.total} - stream endings by cause</li>
 *   <li>{@code portico.upstream.logins.total} - logins by outcome</li>
 *   <li>{@code portico.upstream.reauthentications.total} - retries after a rejected token</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public GatewayMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Request Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRequest(String upstream, String method, int statusCode) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.requests.total")
                .description("Total number of forwarded requests")
                .tag("upstream", nullSafe(upstream))
                .tag("method", method)
                .tag("status", String.valueOf(statusCode))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();
    }

    @Override
    public void recordProxyLatency(String upstream, String method, int statusCode, long latencyMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("portico.proxy.latency")
                .description("Time to receive a response from the upstream")
                .tag("upstream", nullSafe(upstream))
                .tag("method", method)
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordGatewayResult(String upstream, GatewayResult result) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.gateway.results")
                .description("Gateway result types")
                .tag("upstream", nullSafe(upstream))
                .tag("result_type", getResultType(result))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAccessDenied(String upstream, String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.access.denied.total")
                .description("Access denied events")
                .tag("upstream", nullSafe(upstream))
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Streaming Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordStreamFallback(String upstream) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.stream.fallbacks.total")
                .description("Streams re-issued over the fallback transport")
                .tag("upstream", nullSafe(upstream))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStreamTermination(String upstream, String cause) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.stream.terminations.total")
                .description("Stream endings by cause")
                .tag("upstream", nullSafe(upstream))
                .tag("cause", nullSafe(cause))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Credential Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordLogin(String upstream, boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.upstream.logins.total")
                .description("Logins against upstreams")
                .tag("upstream", nullSafe(upstream))
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordReauthentication(String upstream) {
        if (!enabled) {
            return;
        }

        Counter.builder("portico.upstream.reauthentications.total")
                .description("Retries after an upstream rejected the gateway token")
                .tag("upstream", nullSafe(upstream))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Helper Methods
    // -------------------------------------------------------------------------

    private String getResultType(GatewayResult result) {
        if (result instanceof GatewayResult.Success) {
            return "success";
        } else if (result instanceof GatewayResult.Streaming) {
            return "streaming";
        } else if (result instanceof GatewayResult.Forbidden) {
            return "forbidden";
        } else if (result instanceof GatewayResult.MethodNotAllowed) {
            return "method_not_allowed";
        } else if (result instanceof GatewayResult.Aborted) {
            return "aborted";
        } else if (result instanceof GatewayResult.PostProcessingFailed) {
            return "post_processing_failed";
        }
        return "upstream_unreachable";
    }

    private String statusClass(int statusCode) {
        return switch (statusCode / 100) {
            case 1 -> "1xx";
            case 2 -> "2xx";
            case 3 -> "3xx";
            case 4 -> "4xx";
            case 5 -> "5xx";
            default -> "unknown";
        };
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
