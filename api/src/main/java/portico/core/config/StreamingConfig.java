package portico.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Streaming relay behaviour.
 *
 * <p>Configuration prefix: {@code portico.streaming}
 */
@ConfigMapping(prefix = "portico.streaming")
public interface StreamingConfig {

    /**
     * Consecutive empty reads that end a stream.
     */
    @WithDefault("5")
    int emptyReadThreshold();

    /**
     * Pause after each forwarded chunk so it is flushed before the next read. Zero disables it.
     */
    @WithDefault("PT0.001S")
    Duration flushInterval();

    /**
     * A chunk containing this line is forwarded and then ends the stream.
     */
    @WithDefault("event: end")
    String sentinel();

    /**
     * Re-issue a failed stream once over the fallback transport.
     */
    @WithDefault("true")
    boolean fallbackEnabled();
}
