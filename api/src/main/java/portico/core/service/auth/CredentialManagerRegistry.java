package portico.core.service.auth;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;

import portico.core.model.upstream.Upstream;
import portico.core.port.out.CredentialStore;
import portico.core.port.out.Metrics;
import portico.core.port.out.UpstreamHttpClient;

/**
 * Holds one {@link CredentialManager} per upstream that has a credential configured.
 */
@ApplicationScoped
public class CredentialManagerRegistry {

    private final UpstreamHttpClient httpClient;
    private final CredentialStore store;
    private final Metrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, CredentialManager> managers = new ConcurrentHashMap<>();

    @Inject
    public CredentialManagerRegistry(
            UpstreamHttpClient httpClient, CredentialStore store, Metrics metrics, ObjectMapper objectMapper) {
        this(httpClient, store, metrics, objectMapper, Clock.systemUTC());
    }

    public CredentialManagerRegistry(
            UpstreamHttpClient httpClient,
            CredentialStore store,
            Metrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.httpClient = httpClient;
        this.store = store;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * The manager for an upstream, created on first use. Empty for upstreams without a credential.
     */
    public Optional<CredentialManager> forUpstream(Upstream upstream) {
        if (upstream.credential().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(managers.computeIfAbsent(upstream.name(), name -> create(upstream)));
    }

    private CredentialManager create(Upstream upstream) {
        var settings = upstream.credential().orElseThrow();
        return new CredentialManager(
                upstream,
                RsaPasswordEncryptor.fromPem(settings.publicKeyPem()),
                httpClient,
                store,
                metrics,
                objectMapper,
                clock);
    }
}
