package portico.core.model.gateway;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One inbound call, as seen below the gateway's mount prefix.
 *
 * @param method      HTTP verb
 * @param subPath     path after {@code /{mount}/{upstream}}, always starting with '/'
 * @param queryParams decoded query parameters
 * @param rawQuery    raw query string without '?', or null
 * @param headers     inbound headers
 * @param body        raw body bytes
 */
public record RequestContext(
        String method,
        String subPath,
        Map<String, List<String>> queryParams,
        String rawQuery,
        Map<String, List<String>> headers,
        byte[] body) {

    public RequestContext {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        method = method.toUpperCase(Locale.ROOT);
        if (subPath == null || subPath.isEmpty()) {
            subPath = "/";
        } else if (!subPath.startsWith("/")) {
            subPath = "/" + subPath;
        }
        if (queryParams == null) {
            queryParams = Map.of();
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public String getHeaderString(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
