package portico.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Upstreams, their rule tables and machine credentials.
 *
 * <p>Configuration prefix: {@code portico.gateway}
 *
 * <p>Example:
 * <pre>
 * portico.gateway.upstreams.ragflow.base-url=http://ragflow:9380
 * portico.gateway.upstreams.ragflow.rules[0].path=/v1/kb/list
 * portico.gateway.upstreams.ragflow.rules[0].method=POST
 * portico.gateway.upstreams.ragflow.rules[0].permission=ai:knowledge:list
 * </pre>
 *
 * <p>The rule table is read once at startup.
 */
@ConfigMapping(prefix = "portico.gateway")
public interface GatewayConfig {

    /**
     * Upstreams keyed by the name used in the inbound path.
     */
    Map<String, UpstreamProperties> upstreams();

    interface UpstreamProperties {

        @WithName("base-url")
        String baseUrl();

        /**
         * Machine credential used to authenticate to the upstream. Absent for open upstreams.
         */
        Optional<CredentialProperties> credential();

        @WithName("data-scope")
        DataScopeProperties dataScope();

        /**
         * Ordered rule table. Order decides ties between equally long matches.
         */
        List<RuleProperties> rules();
    }

    interface CredentialProperties {

        String identity();

        String password();

        /**
         * The upstream's RSA public key in PEM form.
         */
        @WithName("public-key")
        String publicKey();

        @WithName("login-path")
        @WithDefault("/v1/user/login")
        String loginPath();

        @WithName("register-path")
        @WithDefault("/v1/user/register")
        String registerPath();

        @WithDefault("service")
        String nickname();

        @WithName("expiry-window")
        @WithDefault("PT24H")
        Duration expiryWindow();
    }

    interface DataScopeProperties {

        /**
         * Entity name used in scope predicates. Defaults to the upstream name.
         */
        Optional<String> entity();

        @WithDefault("scope_id")
        String column();
    }

    interface RuleProperties {

        /**
         * Regular expression matched against the start of the sub-path.
         */
        String path();

        @WithDefault("*")
        String method();

        @WithDefault("")
        List<String> permission();

        /**
         * When true every listed permission is required, otherwise any one of them.
         */
        @WithName("permission-strict")
        @WithDefault("false")
        boolean permissionStrict();

        @WithDefault("")
        List<String> role();

        @WithName("role-strict")
        @WithDefault("false")
        boolean roleStrict();

        @WithDefault("false")
        boolean straightforward();

        @WithDefault("false")
        boolean streaming();

        @WithName("upstream-path")
        Optional<String> upstreamPath();

        @WithName("pre-processors")
        @WithDefault("")
        List<String> preProcessors();

        @WithName("post-processors")
        @WithDefault("")
        List<String> postProcessors();

        Optional<String> description();
    }
}
