package portico.core.model.gateway;

/**
 * An upstream answered a stream open with a non-2xx status.
 *
 * <p>This is an upstream answer, not a transport failure, so it never triggers a transport fallback.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int statusCode;
    private final byte[] body;

    public UpstreamStatusException(int statusCode, byte[] body) {
        super("Upstream answered with status " + statusCode);
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public byte[] body() {
        return body;
    }
}
