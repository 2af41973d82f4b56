package portico.adapter.out.hook;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.config.HooksConfig;
import portico.core.model.auth.DataScopePredicate;
import portico.core.model.gateway.Body;
import portico.spi.HookContext;
import portico.spi.PostProcessor;

/**
 * Removes list entries the caller may not see.
 *
 * <p>Filters a JSON array response, and every array found at one of the configured dotted paths
 * (e.g. {@code data.kbs}). An element is kept when the value of the predicate's scope column
 * matches the caller's data scope. Callers who see everything keep every element, callers who
 * see nothing keep none. Other payloads pass through unchanged.
 */
@ApplicationScoped
public class ScopeFilterPostProcessor implements PostProcessor {

    public static final String NAME = "scope-filter";

    private static final Logger LOG = Logger.getLogger(ScopeFilterPostProcessor.class);

    private final List<String> paths;

    @Inject
    public ScopeFilterPostProcessor(HooksConfig config) {
        this(config.scopeFilter().paths());
    }

    public ScopeFilterPostProcessor(List<String> paths) {
        this.paths = paths.stream().map(String::trim).filter(p -> !p.isEmpty()).toList();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<Body> process(HookContext context, Body response) {
        if (!(response instanceof Body.Json json)) {
            return Uni.createFrom().item(response);
        }
        var scope = context.dataScope();
        var root = json.value().deepCopy();
        if (root.isArray()) {
            return Uni.createFrom().item(new Body.Json(filter((ArrayNode) root, scope)));
        }
        if (root.isObject()) {
            for (var path : paths) {
                filterAt((ObjectNode) root, path, scope);
            }
        }
        return Uni.createFrom().item(new Body.Json(root));
    }

    private void filterAt(ObjectNode root, String path, DataScopePredicate scope) {
        var segments = path.split("\\.");
        JsonNode parent = root;
        for (int i = 0; i < segments.length - 1; i++) {
            parent = parent.get(segments[i]);
            if (parent == null || !parent.isObject()) {
                return;
            }
        }
        var last = segments[segments.length - 1];
        var target = parent.get(last);
        if (target != null && target.isArray()) {
            ((ObjectNode) parent).set(last, filter((ArrayNode) target, scope));
        }
    }

    private ArrayNode filter(ArrayNode elements, DataScopePredicate scope) {
        var kept = elements.arrayNode();
        for (JsonNode element : elements) {
            if (isVisible(element, scope)) {
                kept.add(element);
            }
        }
        LOG.debugf("Kept %d of %d entries", kept.size(), elements.size());
        return kept;
    }

    private boolean isVisible(JsonNode element, DataScopePredicate scope) {
        if (scope instanceof DataScopePredicate.MatchAll) {
            return true;
        }
        if (!(scope instanceof DataScopePredicate.ScopeIn scopeIn)) {
            return false;
        }
        var value = element.get(scopeIn.column());
        if (value == null || value.isNull()) {
            return false;
        }
        return scope.matches(value.asText());
    }
}
