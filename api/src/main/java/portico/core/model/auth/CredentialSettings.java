package portico.core.model.auth;

import java.time.Duration;

/**
 * Static settings of a machine credential for one upstream.
 *
 * @param identity       login identity (email)
 * @param password       clear-text password, encrypted before it leaves the gateway
 * @param publicKeyPem   upstream's published RSA public key (PEM, X.509)
 * @param loginPath      upstream login path
 * @param registerPath   upstream registration path
 * @param nickname       nickname sent on registration
 * @param expiryWindow   how long a token is trusted after it was obtained
 */
public record CredentialSettings(
        String identity,
        String password,
        String publicKeyPem,
        String loginPath,
        String registerPath,
        String nickname,
        Duration expiryWindow) {

    public static final Duration DEFAULT_EXPIRY_WINDOW = Duration.ofHours(24);

    public CredentialSettings {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Credential identity is required");
        }
        if (password == null) {
            throw new IllegalArgumentException("Credential password is required");
        }
        if (publicKeyPem == null || publicKeyPem.isBlank()) {
            throw new IllegalArgumentException("Credential public key is required");
        }
        if (loginPath == null || loginPath.isBlank()) {
            loginPath = "/v1/user/login";
        }
        if (registerPath == null || registerPath.isBlank()) {
            registerPath = "/v1/user/register";
        }
        if (nickname == null || nickname.isBlank()) {
            nickname = "service";
        }
        if (expiryWindow == null || expiryWindow.isNegative() || expiryWindow.isZero()) {
            expiryWindow = DEFAULT_EXPIRY_WINDOW;
        }
    }

    @Override
    public String toString() {
        return "CredentialSettings[identity=%s, loginPath=%s, registerPath=%s, expiryWindow=%s]"
                .formatted(identity, loginPath, registerPath, expiryWindow);
    }
}
