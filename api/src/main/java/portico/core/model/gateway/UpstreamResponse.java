package portico.core.model.gateway;

import java.util.List;
import java.util.Map;

public record UpstreamResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public UpstreamResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String getHeaderString(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
