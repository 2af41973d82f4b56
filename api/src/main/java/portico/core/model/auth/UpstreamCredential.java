package portico.core.model.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * A bearer token obtained for an upstream identity.
 *
 * <p>Only the token string ever leaves the credential manager.
 */
public record UpstreamCredential(String identity, String token, Instant refreshedAt, Duration expiryWindow) {

    public UpstreamCredential {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
        if (refreshedAt == null) {
            throw new IllegalArgumentException("refreshedAt is required");
        }
        if (expiryWindow == null) {
            expiryWindow = CredentialSettings.DEFAULT_EXPIRY_WINDOW;
        }
    }

    /**
     * A token is usable while {@code now - refreshedAt < expiryWindow}.
     */
    public boolean isValidAt(Instant now) {
        return Duration.between(refreshedAt, now).compareTo(expiryWindow) < 0;
    }

    @Override
    public String toString() {
        return "UpstreamCredential[identity=%s, refreshedAt=%s, expiryWindow=%s]"
                .formatted(identity, refreshedAt, expiryWindow);
    }
}
