package portico.adapter.out.hook;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;

import portico.core.config.HooksConfig;
import portico.core.model.gateway.Body;
import portico.spi.HookAbortedException;
import portico.spi.HookContext;
import portico.spi.PreProcessor;

/**
 * Rejects requests that name a resource outside the caller's data scope.
 *
 * <p>The resource id is read from the scope field of a JSON object body, or else from the query
 * parameter of the same name. Raw bodies of straightforward rules are read as JSON when they parse;
 * the forwarded bytes are left untouched. Requests naming no resource pass.
 */
@ApplicationScoped
public class ScopeGuardPreProcessor implements PreProcessor {

    public static final String NAME = "scope-guard";
    public static final String REASON = "scope_denied";

    private final String field;
    private final ObjectMapper objectMapper;

    @Inject
    public ScopeGuardPreProcessor(HooksConfig config, ObjectMapper objectMapper) {
        this(config.scopeGuard().field(), objectMapper);
    }

    public ScopeGuardPreProcessor(String field, ObjectMapper objectMapper) {
        this.field = field;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<Body> process(HookContext context, Body payload) {
        var target = targetId(context, payload);
        if (target != null && !context.dataScope().matches(target)) {
            return Uni.createFrom().failure(new HookAbortedException(REASON));
        }
        return Uni.createFrom().item(payload);
    }

    private String targetId(HookContext context, Body payload) {
        if (payload instanceof Body.Raw raw) {
            payload = Body.parse(raw.bytes(), objectMapper);
        }
        if (payload instanceof Body.Json json && json.value().isObject()) {
            var value = json.value().get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        var values = context.queryParams().get(field);
        if (values != null && !values.isEmpty()) {
            return values.get(0);
        }
        return null;
    }
}
