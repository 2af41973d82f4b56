package portico.core.service.auth;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.auth.CredentialException;
import portico.core.model.auth.CredentialSettings;
import portico.core.model.auth.CredentialState;
import portico.core.model.auth.UpstreamCredential;
import portico.core.model.gateway.UpstreamRequest;
import portico.core.model.gateway.UpstreamResponse;
import portico.core.model.upstream.Upstream;
import portico.core.port.out.CredentialStore;
import portico.core.port.out.Metrics;
import portico.core.port.out.UpstreamHttpClient;

/**
 * Obtains, caches and renews the bearer token the gateway presents to one upstream.
 *
 * <p>Lifecycle: {@code NO_TOKEN -> AUTHENTICATING -> VALID -> EXPIRED -> REAUTHENTICATING -> VALID}.
 * Either authenticating state moves to {@code FAILED} when no token could be obtained; the next
 * call tries again.
 *
 * <p>Thread-safety: concurrent callers that find no valid token share a single in-flight login.
 * The login re-reads the store first, so a caller arriving just after a login completed reuses
 * the fresh token instead of logging in again.
 */
public class CredentialManager {

    private static final Logger LOG = Logger.getLogger(CredentialManager.class);

    static final String TOKEN_HEADER = "Authorization";
    private static final int UNAUTHORIZED = 401;

    private final Upstream upstream;
    private final CredentialSettings settings;
    private final RsaPasswordEncryptor encryptor;
    private final UpstreamHttpClient httpClient;
    private final CredentialStore store;
    private final Metrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<CredentialState> state = new AtomicReference<>(CredentialState.NO_TOKEN);
    private Uni<String> inFlightLogin;

    public CredentialManager(
            Upstream upstream,
            RsaPasswordEncryptor encryptor,
            UpstreamHttpClient httpClient,
            CredentialStore store,
            Metrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.upstream = upstream;
        this.settings = upstream.credential()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Upstream '%s' has no credential configured".formatted(upstream.name())));
        this.encryptor = encryptor;
        this.httpClient = httpClient;
        this.store = store;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public CredentialState state() {
        return state.get();
    }

    /**
     * Return a token younger than the expiry window, logging in when there is none.
     *
     * @return the token; fails with {@link CredentialException} if no token can be obtained
     */
    public Uni<String> getValidToken() {
        return store.find(upstream.name(), settings.identity()).flatMap(cached -> {
            if (cached.isPresent() && cached.get().isValidAt(clock.instant())) {
                state.set(CredentialState.VALID);
                return Uni.createFrom().item(cached.get().token());
            }
            if (cached.isPresent()) {
                LOG.debugv("Token for upstream {0} expired", upstream.name());
                state.set(CredentialState.EXPIRED);
            }
            return sharedLogin();
        });
    }

    /**
     * Run a call with the current token, renewing the token once if the upstream rejects it.
     *
     * <p>When the answer says the token was rejected, the token is invalidated, a new one is
     * obtained and the call is made exactly once more. The second answer is returned as is.
     *
     * @param call the upstream call, given the token to present
     * @return the upstream answer
     */
    public Uni<UpstreamResponse> execute(Function<String, Uni<UpstreamResponse>> call) {
        return getValidToken().flatMap(token -> call.apply(token).flatMap(response -> {
            if (!isTokenRejected(response)) {
                return Uni.createFrom().item(response);
            }
            LOG.infov("Upstream {0} rejected the gateway token, re-authenticating", upstream.name());
            metrics.recordReauthentication(upstream.name());
            return invalidate(token).flatMap(ignored -> getValidToken()).flatMap(t -> call.apply(t));
        }));
    }

    /**
     * Drop the cached token if it is still the rejected one.
     *
     * @param rejectedToken the token the upstream refused
     * @return true if the cached token was removed
     */
    public Uni<Boolean> invalidate(String rejectedToken) {
        return store.find(upstream.name(), settings.identity()).flatMap(cached -> {
            if (cached.isEmpty() || !cached.get().token().equals(rejectedToken)) {
                return Uni.createFrom().item(false);
            }
            state.set(CredentialState.EXPIRED);
            return store.remove(upstream.name(), settings.identity());
        });
    }

    /**
     * Whether an upstream answer means the presented token was refused: HTTP 401, or HTTP 200
     * with a JSON body carrying {@code code == 401} and a message mentioning "unauthorized".
     */
    public boolean isTokenRejected(UpstreamResponse response) {
        if (response.statusCode() == UNAUTHORIZED) {
            return true;
        }
        if (response.statusCode() != 200 || response.body().length == 0) {
            return false;
        }
        try {
            var json = objectMapper.readTree(response.body());
            if (json == null || !json.isObject() || json.path("code").asInt() != UNAUTHORIZED) {
                return false;
            }
            return json.path("message").asText("").toLowerCase(Locale.ROOT).contains("unauthorized");
        } catch (IOException e) {
            return false;
        }
    }

    private synchronized Uni<String> sharedLogin() {
        if (inFlightLogin == null) {
            inFlightLogin = authenticate()
                    .onTermination()
                    .invoke(this::clearInFlightLogin)
                    .memoize()
                    .indefinitely();
        }
        return inFlightLogin;
    }

    private synchronized void clearInFlightLogin() {
        inFlightLogin = null;
    }

    private Uni<String> authenticate() {
        return store.find(upstream.name(), settings.identity())
                .flatMap(cached -> {
                    if (cached.isPresent() && cached.get().isValidAt(clock.instant())) {
                        return Uni.createFrom().item(cached.get().token());
                    }
                    var previous = state.get();
                    state.set(
                            previous == CredentialState.EXPIRED || previous == CredentialState.VALID
                                    ? CredentialState.REAUTHENTICATING
                                    : CredentialState.AUTHENTICATING);
                    return login();
                })
                .invoke(token -> state.set(CredentialState.VALID))
                .onFailure()
                .transform(this::toCredentialException)
                .onFailure()
                .invoke(error -> {
                    state.set(CredentialState.FAILED);
                    LOG.warnv("Authentication to upstream {0} failed: {1}", upstream.name(), error.getMessage());
                });
    }

    private Uni<String> login() {
        var encryptedPassword = encryptor.encrypt(settings.password());
        return sendLogin(encryptedPassword).flatMap(response -> {
            if (response.statusCode() == UNAUTHORIZED) {
                LOG.infov("Login to upstream {0} refused, registering identity", upstream.name());
                return register(encryptedPassword)
                        .flatMap(registered -> sendLogin(encryptedPassword))
                        .flatMap(this::storeToken);
            }
            return storeToken(response);
        });
    }

    private Uni<UpstreamResponse> sendLogin(String encryptedPassword) {
        var body = objectMapper.createObjectNode();
        body.put("email", settings.identity());
        body.put("password", encryptedPassword);
        return postJson(settings.loginPath(), body);
    }

    private Uni<Void> register(String encryptedPassword) {
        var body = objectMapper.createObjectNode();
        body.put("nickname", settings.nickname());
        body.put("email", settings.identity());
        body.put("password", encryptedPassword);
        return postJson(settings.registerPath(), body).flatMap(response -> {
            if (!response.isSuccessful()) {
                return Uni.createFrom()
                        .failure(new CredentialException(
                                upstream.name(), "Registration failed with status " + response.statusCode()));
            }
            LOG.infov("Registered identity {0} at upstream {1}", settings.identity(), upstream.name());
            return Uni.createFrom().voidItem();
        });
    }

    private Uni<String> storeToken(UpstreamResponse response) {
        var token = response.getHeaderString(TOKEN_HEADER);
        if (response.statusCode() != 200 || token == null || token.isBlank()) {
            metrics.recordLogin(upstream.name(), false);
            var reason = response.statusCode() != 200
                    ? "Login failed with status " + response.statusCode()
                    : "Login response carried no token";
            return Uni.createFrom().failure(new CredentialException(upstream.name(), reason));
        }
        metrics.recordLogin(upstream.name(), true);
        var credential = new UpstreamCredential(
                settings.identity(), token, clock.instant(), settings.expiryWindow());
        LOG.infov("Obtained token for {0} at upstream {1}", settings.identity(), upstream.name());
        return store.save(upstream.name(), credential).replaceWith(token);
    }

    private Uni<UpstreamResponse> postJson(String path, ObjectNode body) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (IOException e) {
            return Uni.createFrom().failure(e);
        }
        var request = new UpstreamRequest(
                "POST",
                upstream.resolve(path, null),
                Map.of("Content-Type", List.of("application/json")),
                bytes);
        return httpClient.send(request);
    }

    private Throwable toCredentialException(Throwable error) {
        if (error instanceof CredentialException) {
            return error;
        }
        return new CredentialException(
                upstream.name(), "Could not authenticate to upstream: " + error.getMessage(), error);
    }
}
