package portico.core.model.gateway;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A request ready to be sent to an upstream.
 */
public record UpstreamRequest(String method, URI targetUri, Map<String, List<String>> headers, byte[] body) {

    public UpstreamRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (targetUri == null) {
            throw new IllegalArgumentException("targetUri is required");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (body == null) {
            body = new byte[0];
        }
    }

    /**
     * Copy of this request with a header replaced (case-insensitively).
     */
    public UpstreamRequest withHeader(String name, String value) {
        var copy = new HashMap<String, List<String>>();
        for (var entry : headers.entrySet()) {
            if (!entry.getKey().equalsIgnoreCase(name)) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        copy.put(name, List.of(value));
        return new UpstreamRequest(method, targetUri, copy, body);
    }
}
