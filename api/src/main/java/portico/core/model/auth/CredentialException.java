package portico.core.model.auth;

/**
 * Thrown when the gateway cannot obtain a token for an upstream identity.
 */
public class CredentialException extends RuntimeException {

    private final String upstream;

    public CredentialException(String upstream, String message) {
        super(message);
        this.upstream = upstream;
    }

    public CredentialException(String upstream, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
    }

    public String upstream() {
        return upstream;
    }
}
