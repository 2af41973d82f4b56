package portico.core.service.routing;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import portico.core.config.GatewayConfig;
import portico.core.model.auth.CredentialSettings;
import portico.core.model.routing.AccessRequirement;
import portico.core.model.routing.ProxyRule;
import portico.core.model.upstream.Upstream;
import portico.core.service.hook.ProcessorRegistry;

/**
 * Read-only table of upstreams and their rules, built once from configuration.
 *
 * <p>Every rule is validated when the table is built: its pattern must compile, streaming rules
 * may not declare post-processors and every hook name must resolve to a registered hook.
 * Any violation is an {@link IllegalStateException}, which fails startup.
 */
@ApplicationScoped
public class UpstreamRegistry {

    private static final Logger LOG = Logger.getLogger(UpstreamRegistry.class);

    private final Map<String, Upstream> upstreams;

    @Inject
    public UpstreamRegistry(GatewayConfig config, ProcessorRegistry processors) {
        this(load(config), processors);
    }

    public UpstreamRegistry(List<Upstream> upstreams, ProcessorRegistry processors) {
        var byName = new LinkedHashMap<String, Upstream>();
        for (var upstream : upstreams) {
            validateHooks(upstream, processors);
            byName.put(upstream.name(), upstream);
            LOG.infov(
                    "Registered upstream {0} -> {1} ({2} rules, credential={3})",
                    upstream.name(),
                    upstream.baseUri(),
                    upstream.rules().size(),
                    upstream.credential().isPresent());
        }
        this.upstreams = byName;
    }

    public Optional<Upstream> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(upstreams.get(name));
    }

    public Collection<Upstream> all() {
        return upstreams.values();
    }

    static List<Upstream> load(GatewayConfig config) {
        var result = new ArrayList<Upstream>();
        for (var entry : config.upstreams().entrySet()) {
            result.add(toUpstream(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private static Upstream toUpstream(String name, GatewayConfig.UpstreamProperties properties) {
        var rules = new ArrayList<ProxyRule>();
        var index = 0;
        for (var rule : properties.rules()) {
            try {
                rules.add(toRule(rule));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                        "Invalid rule %d of upstream '%s': %s".formatted(index, name, e.getMessage()), e);
            }
            index++;
        }
        var credential = properties.credential().map(UpstreamRegistry::toCredential);
        var scope = properties.dataScope();
        return new Upstream(
                name,
                URI.create(properties.baseUrl()),
                rules,
                credential,
                scope.entity().orElse(name),
                scope.column());
    }

    private static ProxyRule toRule(GatewayConfig.RuleProperties rule) {
        return ProxyRule.builder(rule.path())
                .method(rule.method())
                .permission(AccessRequirement.of(rule.permission(), rule.permissionStrict()))
                .role(AccessRequirement.of(rule.role(), rule.roleStrict()))
                .straightforward(rule.straightforward())
                .streaming(rule.streaming())
                .upstreamPathOverride(rule.upstreamPath().orElse(null))
                .preProcessors(nonBlank(rule.preProcessors()))
                .postProcessors(nonBlank(rule.postProcessors()))
                .description(rule.description().orElse(""))
                .build();
    }

    private static CredentialSettings toCredential(GatewayConfig.CredentialProperties credential) {
        return new CredentialSettings(
                credential.identity(),
                credential.password(),
                credential.publicKey(),
                credential.loginPath(),
                credential.registerPath(),
                credential.nickname(),
                credential.expiryWindow());
    }

    private static List<String> nonBlank(List<String> values) {
        return values.stream().filter(v -> !v.isBlank()).map(String::trim).toList();
    }

    private static void validateHooks(Upstream upstream, ProcessorRegistry processors) {
        for (var rule : upstream.rules()) {
            try {
                processors.resolvePre(rule.preProcessors());
                processors.resolvePost(rule.postProcessors());
            } catch (IllegalStateException e) {
                throw new IllegalStateException(
                        "Upstream '%s' rule '%s': %s"
                                .formatted(upstream.name(), rule.pathPattern().pattern(), e.getMessage()),
                        e);
            }
        }
    }
}
