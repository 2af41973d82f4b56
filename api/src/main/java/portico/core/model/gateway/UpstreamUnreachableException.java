package portico.core.model.gateway;

/**
 * The upstream could not be reached, or stopped answering.
 */
public class UpstreamUnreachableException extends RuntimeException {

    public UpstreamUnreachableException(String message) {
        super(message);
    }

    public UpstreamUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
