package portico.core.model.auth;

/**
 * Lifecycle of a machine credential.
 */
public enum CredentialState {
    NO_TOKEN,
    AUTHENTICATING,
    VALID,
    EXPIRED,
    REAUTHENTICATING,
    FAILED
}
