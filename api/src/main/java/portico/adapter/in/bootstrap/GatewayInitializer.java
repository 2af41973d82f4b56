package portico.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import portico.core.service.auth.CredentialManagerRegistry;
import portico.core.service.routing.UpstreamRegistry;

/**
 * Loads and validates the rule tables on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>An invalid rule pattern: startup FAILS</li>
 *   <li>A streaming rule declaring post-processors: startup FAILS</li>
 *   <li>A rule naming an unknown hook: startup FAILS</li>
 *   <li>An unreadable credential public key: startup FAILS</li>
 * </ul>
 *
 * <p>No login happens here; the first request to an upstream obtains its token.
 */
@ApplicationScoped
public class GatewayInitializer {

    private static final Logger LOG = Logger.getLogger(GatewayInitializer.class);

    private final UpstreamRegistry upstreamRegistry;
    private final CredentialManagerRegistry credentials;

    @Inject
    public GatewayInitializer(UpstreamRegistry upstreamRegistry, CredentialManagerRegistry credentials) {
        this.upstreamRegistry = upstreamRegistry;
        this.credentials = credentials;
    }

    void onStart(@Observes StartupEvent event) {
        var upstreams = upstreamRegistry.all();
        if (upstreams.isEmpty()) {
            LOG.warn("No upstreams configured, every request will be rejected");
            return;
        }
        for (var upstream : upstreams) {
            credentials.forUpstream(upstream);
        }
        LOG.infof("Gateway ready with %d upstream(s)", upstreams.size());
    }
}
