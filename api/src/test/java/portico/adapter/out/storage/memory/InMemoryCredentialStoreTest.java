package portico.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.core.model.auth.UpstreamCredential;

@DisplayName("InMemoryCredentialStore")
class InMemoryCredentialStoreTest {

    private final InMemoryCredentialStore store = new InMemoryCredentialStore();

    private static UpstreamCredential credential(String identity, String token) {
        return new UpstreamCredential(identity, token, Instant.parse("2026-01-01T00:00:00Z"), Duration.ofHours(24));
    }

    @Test
    @DisplayName("Should find a saved credential by upstream and identity")
    void shouldFindSaved() {
        store.save("ragflow", credential("svc@example.com", "t1")).await().indefinitely();

        var found = store.find("ragflow", "svc@example.com").await().indefinitely();

        assertEquals("t1", found.orElseThrow().token());
        assertTrue(store.find("other", "svc@example.com").await().indefinitely().isEmpty());
        assertTrue(store.find("ragflow", "someone@example.com").await().indefinitely().isEmpty());
    }

    @Test
    @DisplayName("Should replace the credential on save")
    void shouldReplace() {
        store.save("ragflow", credential("svc@example.com", "t1")).await().indefinitely();
        store.save("ragflow", credential("svc@example.com", "t2")).await().indefinitely();

        assertEquals("t2", store.find("ragflow", "svc@example.com").await().indefinitely().orElseThrow().token());
    }

    @Test
    @DisplayName("Should report whether a credential was removed")
    void shouldRemove() {
        store.save("ragflow", credential("svc@example.com", "t1")).await().indefinitely();

        assertTrue(store.remove("ragflow", "svc@example.com").await().indefinitely());
        assertFalse(store.remove("ragflow", "svc@example.com").await().indefinitely());
        assertTrue(store.find("ragflow", "svc@example.com").await().indefinitely().isEmpty());
    }
}
