package portico.spi;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.Body;

/**
 * Hook run before a request is forwarded.
 *
 * <p>Implementations are CDI beans and are referenced from rules by {@link #name()}.
 * Failing the returned {@link Uni} with {@link HookAbortedException} stops the request;
 * nothing is forwarded and no post-processor runs.
 */
public interface PreProcessor {

    /**
     * Name used to reference this hook from a rule.
     */
    String name();

    /**
     * Inspect or rewrite the request payload.
     *
     * @param context the request context
     * @param payload the current payload
     * @return the payload to forward
     */
    Uni<Body> process(HookContext context, Body payload);
}
