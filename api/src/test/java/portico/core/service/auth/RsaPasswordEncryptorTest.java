package portico.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.fixture.TestKeys;

@DisplayName("RsaPasswordEncryptor")
class RsaPasswordEncryptorTest {

    @Test
    @DisplayName("Should encrypt the base64 of the password under the public key")
    void shouldEncryptBase64Password() throws Exception {
        var encryptor = RsaPasswordEncryptor.fromPem(TestKeys.publicKeyPem());

        var ciphertext = encryptor.encrypt("s3cret-pässword");

        assertEquals("s3cret-pässword", TestKeys.decryptPassword(ciphertext));
    }

    @Test
    @DisplayName("Should produce a different ciphertext on every call")
    void shouldUseRandomPadding() {
        var encryptor = RsaPasswordEncryptor.fromPem(TestKeys.publicKeyPem());

        assertNotEquals(encryptor.encrypt("secret"), encryptor.encrypt("secret"));
    }

    @Test
    @DisplayName("Should accept a raw base64 key without PEM armour")
    void shouldAcceptRawBase64() throws Exception {
        var raw = Base64.getEncoder().encodeToString(TestKeys.keyPair().getPublic().getEncoded());

        var ciphertext = RsaPasswordEncryptor.fromPem(raw).encrypt("secret");

        assertEquals("secret", TestKeys.decryptPassword(ciphertext));
    }

    @Test
    @DisplayName("Should reject missing and malformed keys")
    void shouldRejectInvalidKeys() {
        assertThrows(IllegalArgumentException.class, () -> RsaPasswordEncryptor.parsePublicKey(null));
        assertThrows(IllegalArgumentException.class, () -> RsaPasswordEncryptor.parsePublicKey("not a key!"));
        assertThrows(
                IllegalArgumentException.class,
                () -> RsaPasswordEncryptor.parsePublicKey(
                        Base64.getEncoder().encodeToString("garbage".getBytes(StandardCharsets.UTF_8))));
    }
}
