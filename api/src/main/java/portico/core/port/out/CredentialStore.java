package portico.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import portico.core.model.auth.UpstreamCredential;

/**
 * Persistence for upstream tokens, keyed by upstream name and login identity.
 */
public interface CredentialStore {

    Uni<Optional<UpstreamCredential>> find(String upstream, String identity);

    Uni<Void> save(String upstream, UpstreamCredential credential);

    /**
     * @return true if a credential was removed
     */
    Uni<Boolean> remove(String upstream, String identity);
}
