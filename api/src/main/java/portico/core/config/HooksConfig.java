package portico.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Settings of the built-in hooks.
 *
 * <p>Configuration prefix: {@code portico.hooks}
 */
@ConfigMapping(prefix = "portico.hooks")
public interface HooksConfig {

    ScopeFilter scopeFilter();

    ScopeGuard scopeGuard();

    interface ScopeFilter {

        /**
         * Dotted paths of the response arrays to filter, besides a top-level array.
         */
        @WithDefault("data,data.kbs")
        List<String> paths();
    }

    interface ScopeGuard {

        /**
         * Field of the request body naming the target resource.
         */
        @WithDefault("graph_id")
        String field();
    }
}
