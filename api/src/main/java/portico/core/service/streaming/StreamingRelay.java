package portico.core.service.streaming;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.config.ResiliencyConfig;
import portico.core.config.StreamingConfig;
import portico.core.model.gateway.Body;
import portico.core.model.gateway.RequestContext;
import portico.core.model.gateway.StreamRequest;
import portico.core.model.gateway.UpstreamStatusException;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.core.model.routing.RuleMatch;
import portico.core.port.out.Metrics;
import portico.core.port.out.StreamTransport;
import portico.core.service.auth.CredentialManager;
import portico.core.service.auth.CredentialManagerRegistry;
import portico.core.service.gateway.ProxyRequestPreparer;

/**
 * Relays a chunked upstream response to the caller as it arrives.
 *
 * <p>Each non-empty chunk is emitted as soon as it is read, followed by a short pause so the
 * caller-facing writer flushes it before the next read. The stream ends when the upstream
 * completes, or earlier by the {@link EndOfStreamDetector} heuristic.
 *
 * <p>If the primary transport fails before any chunk was delivered, the request is sent once more
 * over the fallback transport. An upstream non-2xx answer is not a transport failure and is never
 * retried that way. A 401 from an upstream with a machine credential renews the token and
 * reopens the stream once.
 *
 * <p>Cancelling the returned {@link Multi} closes the upstream connection.
 */
@ApplicationScoped
public class StreamingRelay {

    private static final Logger LOG = Logger.getLogger(StreamingRelay.class);

    private static final int UNAUTHORIZED = 401;

    private final StreamTransport primary;
    private final StreamTransport fallback;
    private final ProxyRequestPreparer requestPreparer;
    private final CredentialManagerRegistry credentials;
    private final Metrics metrics;
    private final EndOfStreamDetector detector;
    private final Duration flushInterval;
    private final Duration inactivityTimeout;
    private final boolean fallbackEnabled;

    @Inject
    public StreamingRelay(
            @Named("primary") StreamTransport primary,
            @Named("fallback") StreamTransport fallback,
            ProxyRequestPreparer requestPreparer,
            CredentialManagerRegistry credentials,
            Metrics metrics,
            StreamingConfig streamingConfig,
            ResiliencyConfig resiliencyConfig) {
        this.primary = primary;
        this.fallback = fallback;
        this.requestPreparer = requestPreparer;
        this.credentials = credentials;
        this.metrics = metrics;
        this.detector = new EndOfStreamDetector(streamingConfig.emptyReadThreshold(), streamingConfig.sentinel());
        this.flushInterval = streamingConfig.flushInterval();
        this.inactivityTimeout = resiliencyConfig.stream().inactivityTimeout();
        this.fallbackEnabled = streamingConfig.fallbackEnabled();
    }

    /**
     * Open the stream for a matched request.
     *
     * @param match   the matched streaming rule
     * @param request the inbound request
     * @param payload the payload after pre-processing
     * @return the chunks to write to the caller
     */
    public Multi<byte[]> stream(RuleMatch match, RequestContext request, Body payload) {
        var upstream = match.upstream().name();
        var prepared = requestPreparer.prepareStream(match, request, payload);
        var endCause = new AtomicReference<String>();

        var manager = credentials.forUpstream(match.upstream());
        var chunks = manager.isPresent()
                ? withCredential(manager.get(), prepared, upstream, endCause)
                : openWithFallback(prepared, upstream, endCause);

        return pace(chunks).onTermination().invoke((failure, cancelled) -> {
            var cause = cancelled ? "cancelled" : failure != null ? "error" : endCause.get();
            metrics.recordStreamTermination(upstream, cause == null ? "completed" : cause);
            LOG.debugv("Stream from {0} ended ({1})", upstream, cause == null ? "completed" : cause);
        });
    }

    private Multi<byte[]> withCredential(
            CredentialManager manager, StreamRequest prepared, String upstream, AtomicReference<String> endCause) {
        return Multi.createFrom()
                .uni(manager.getValidToken())
                .onItem()
                .transformToMultiAndConcatenate(token -> openWithFallback(
                                authorized(prepared, token), upstream, endCause)
                        .onFailure(StreamingRelay::isRejected)
                        .recoverWithMulti(error -> {
                            LOG.infov("Upstream {0} rejected the gateway token on stream open", upstream);
                            metrics.recordReauthentication(upstream);
                            return Multi.createFrom()
                                    .uni(manager.invalidate(token).flatMap(ignored -> manager.getValidToken()))
                                    .onItem()
                                    .transformToMultiAndConcatenate(renewed -> openWithFallback(
                                            authorized(prepared, renewed), upstream, endCause));
                        }));
    }

    private Multi<byte[]> openWithFallback(StreamRequest request, String upstream, AtomicReference<String> endCause) {
        return Multi.createFrom().deferred(() -> {
            var delivered = new AtomicBoolean();
            return relay(primary, request, endCause)
                    .onItem()
                    .invoke(chunk -> delivered.set(true))
                    .onFailure(error -> fallbackEnabled && !delivered.get() && !(error instanceof UpstreamStatusException))
                    .recoverWithMulti(error -> {
                        LOG.warnv(
                                "Primary stream transport failed for {0} ({1}), retrying over {2}",
                                upstream,
                                error.getMessage(),
                                fallback.name());
                        metrics.recordStreamFallback(upstream);
                        return relay(fallback, request, endCause);
                    });
        });
    }

    private Multi<byte[]> relay(StreamTransport transport, StreamRequest request, AtomicReference<String> endCause) {
        var source = transport.open(request)
                .ifNoItem()
                .after(inactivityTimeout)
                .failWith(() -> new UpstreamUnreachableException(
                        "No data from %s within %s".formatted(request.targetUri(), inactivityTimeout)));
        return detector.apply(source, endCause::set);
    }

    private Multi<byte[]> pace(Multi<byte[]> chunks) {
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            return chunks;
        }
        return chunks.onItem().transformToMultiAndConcatenate(chunk -> Multi.createBy()
                .concatenating()
                .streams(Multi.createFrom().item(chunk), pause()));
    }

    private Multi<byte[]> pause() {
        return Uni.createFrom()
                .item(Boolean.TRUE)
                .onItem()
                .delayIt()
                .by(flushInterval)
                .onItem()
                .transformToMulti(ignored -> Multi.createFrom().<byte[]>empty());
    }

    private static boolean isRejected(Throwable error) {
        return error instanceof UpstreamStatusException status && status.statusCode() == UNAUTHORIZED;
    }

    private static StreamRequest authorized(StreamRequest request, String token) {
        var headers = new HashMap<>(request.headers());
        headers.put(ProxyRequestPreparer.AUTHORIZATION, List.of(token));
        return new StreamRequest(request.method(), request.targetUri(), headers, request.body());
    }
}
