package portico.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import portico.core.model.auth.UpstreamCredential;
import portico.core.port.out.CredentialStore;

/**
 * In-memory implementation of CredentialStore.
 *
 * <p>Tokens are NOT persisted across restarts; the first request after a restart logs in again.
 */
@ApplicationScoped
public class InMemoryCredentialStore implements CredentialStore {

    private final ConcurrentHashMap<String, UpstreamCredential> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<UpstreamCredential>> find(String upstream, String identity) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(key(upstream, identity))));
    }

    @Override
    public Uni<Void> save(String upstream, UpstreamCredential credential) {
        return Uni.createFrom().item(() -> {
            storage.put(key(upstream, credential.identity()), credential);
            return null;
        });
    }

    @Override
    public Uni<Boolean> remove(String upstream, String identity) {
        return Uni.createFrom().item(() -> storage.remove(key(upstream, identity)) != null);
    }

    private static String key(String upstream, String identity) {
        return upstream + "|" + identity;
    }
}
