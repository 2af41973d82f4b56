package portico.spi;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.Body;

/**
 * Hook run on a successful (2xx) upstream response.
 *
 * <p>A failure surfaces as a 500 to the caller. The upstream call is not rolled back.
 */
public interface PostProcessor {

    String name();

    Uni<Body> process(HookContext context, Body response);
}
