package portico.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

import javax.crypto.Cipher;

/**
 * Encrypts a login password the way the upstream expects it.
 *
 * <p>The clear text is base64-encoded, encrypted with RSA/ECB/PKCS1Padding under the upstream's
 * published public key, and the ciphertext base64-encoded again.
 */
public final class RsaPasswordEncryptor {

    private static final String TRANSFORMATION = "RSA/ECB/PKCS1Padding";

    private final RSAPublicKey publicKey;

    public RsaPasswordEncryptor(RSAPublicKey publicKey) {
        this.publicKey = publicKey;
    }

    public static RsaPasswordEncryptor fromPem(String pem) {
        return new RsaPasswordEncryptor(parsePublicKey(pem));
    }

    /**
     * Encrypt a password.
     *
     * @param password clear-text password
     * @return base64 ciphertext
     * @throws IllegalStateException if the JCA provider cannot perform the encryption
     */
    public String encrypt(String password) {
        var encoded = Base64.getEncoder().encode(password.getBytes(StandardCharsets.UTF_8));
        try {
            var cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, publicKey);
            return Base64.getEncoder().encodeToString(cipher.doFinal(encoded));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt password", e);
        }
    }

    /**
     * Parse an RSA public key from PEM or raw base64 X.509 format.
     *
     * @param keyData PEM-encoded or raw base64 X.509 public key
     * @return the parsed RSA public key
     * @throws IllegalArgumentException if the key data is invalid
     */
    public static RSAPublicKey parsePublicKey(String keyData) {
        if (keyData == null || keyData.isBlank()) {
            throw new IllegalArgumentException("Public key is required");
        }
        try {
            final var keyContent = keyData.replace("-----BEGIN PUBLIC KEY-----", "")
                    .replace("-----END PUBLIC KEY-----", "")
                    .replaceAll("\\s", "");

            final var keyBytes = Base64.getDecoder().decode(keyContent);
            final var keySpec = new X509EncodedKeySpec(keyBytes);
            final var keyFactory = KeyFactory.getInstance("RSA");
            return (RSAPublicKey) keyFactory.generatePublic(keySpec);
        } catch (IllegalArgumentException | GeneralSecurityException | ClassCastException e) {
            throw new IllegalArgumentException("Failed to parse RSA public key", e);
        }
    }
}
