package portico.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for upstream timeouts and connection limits.
 *
 * <p>Configuration prefix: {@code portico.resiliency}
 */
@ConfigMapping(prefix = "portico.resiliency")
public interface ResiliencyConfig {

    HttpConfig http();

    StreamConfig stream();

    /**
     * Timeouts for request/response forwarding.
     */
    interface HttpConfig {

        /**
         * Maximum time to wait for a complete upstream response.
         *
         * @return Request timeout duration (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration requestTimeout();

        /**
         * Maximum time to establish a TCP connection to the upstream.
         *
         * @return Connect timeout duration (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration connectTimeout();

        /**
         * Maximum read/write inactivity on an open connection.
         *
         * @return Idle timeout duration (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration idleTimeout();

        /**
         * Maximum pooled connections per upstream host.
         *
         * @return Max connections per host (default: 50)
         */
        @WithDefault("50")
        int maxConnectionsPerHost();
    }

    /**
     * Timeouts for streamed responses.
     */
    interface StreamConfig {

        @WithDefault("PT5S")
        Duration connectTimeout();

        /**
         * Longest silence tolerated between two chunks.
         * Exceeding it before the first chunk triggers the fallback transport.
         *
         * @return Inactivity timeout (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration inactivityTimeout();

        @WithDefault("20")
        int maxConnectionsPerHost();
    }
}
