package portico.adapter.out.identity;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import portico.core.config.IdentityConfig;
import portico.core.model.auth.CallerIdentity;
import portico.core.port.out.CallerIdentityResolver;

/**
 * Reads the caller identity from headers set by the authenticating layer in front of the gateway.
 *
 * <p>The gateway must only be reachable through that layer; these headers are trusted as given.
 * Multi-valued headers are comma-separated. A request without a caller id is anonymous.
 */
@ApplicationScoped
public class TrustedHeaderIdentityResolver implements CallerIdentityResolver {

    private static final Logger LOG = Logger.getLogger(TrustedHeaderIdentityResolver.class);

    private final IdentityConfig config;

    @Inject
    public TrustedHeaderIdentityResolver(IdentityConfig config) {
        this.config = config;
    }

    @Override
    public CallerIdentity resolve(Map<String, List<String>> headers) {
        var userId = first(headers, config.userIdHeader());
        if (userId == null || userId.isBlank()) {
            LOG.debug("No caller id header, treating request as anonymous");
            return CallerIdentity.anonymous();
        }
        return new CallerIdentity(
                userId.trim(),
                new LinkedHashSet<>(split(headers, config.permissionsHeader())),
                new LinkedHashSet<>(split(headers, config.rolesHeader())),
                Boolean.parseBoolean(trimmed(first(headers, config.adminHeader()))),
                split(headers, config.scopeIdsHeader()));
    }

    private static List<String> split(Map<String, List<String>> headers, String name) {
        return values(headers, name).stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
    }

    private static String first(Map<String, List<String>> headers, String name) {
        var values = values(headers, name);
        return values.isEmpty() ? null : values.get(0);
    }

    private static List<String> values(Map<String, List<String>> headers, String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }
}
