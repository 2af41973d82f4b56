package portico.spi;

import java.util.List;
import java.util.Map;

import portico.core.model.auth.CallerIdentity;
import portico.core.model.auth.DataScopePredicate;

/**
 * Read-only view of the request handed to every hook.
 *
 * @param upstream    name of the target upstream
 * @param subPath     inbound sub-path
 * @param method      HTTP verb
 * @param headers     inbound headers
 * @param queryParams inbound query parameters
 * @param identity    resolved caller identity
 * @param dataScope   data scope predicate built for the caller
 */
public record HookContext(
        String upstream,
        String subPath,
        String method,
        Map<String, List<String>> headers,
        Map<String, List<String>> queryParams,
        CallerIdentity identity,
        DataScopePredicate dataScope) {

    public HookContext {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
    }
}
