package portico.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * A streaming request handed to a stream transport.
 */
public record StreamRequest(String method, URI targetUri, Map<String, List<String>> headers, byte[] body) {

    public StreamRequest {
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
}
