package portico.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for metrics collection.
 *
 * <p>Example configuration:
 * <pre>{@code
 * portico.telemetry.metrics.enabled=false
 * }</pre>
 */
@ConfigMapping(prefix = "portico.telemetry")
public interface TelemetryConfig {

    MetricsConfig metrics();

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
