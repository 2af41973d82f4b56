package portico.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Names of the trusted headers carrying the caller identity resolved by the front layer.
 *
 * <p>Configuration prefix: {@code portico.identity}
 */
@ConfigMapping(prefix = "portico.identity")
public interface IdentityConfig {

    @WithDefault("X-Caller-Id")
    String userIdHeader();

    /**
     * Comma-separated permission strings.
     */
    @WithDefault("X-Caller-Permissions")
    String permissionsHeader();

    /**
     * Comma-separated role keys.
     */
    @WithDefault("X-Caller-Roles")
    String rolesHeader();

    @WithDefault("X-Caller-Admin")
    String adminHeader();

    /**
     * Comma-separated ids of resources the caller may see.
     */
    @WithDefault("X-Caller-Scope-Ids")
    String scopeIdsHeader();
}
