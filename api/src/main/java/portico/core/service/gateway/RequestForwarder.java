package portico.core.service.gateway;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.gateway.Body;
import portico.core.model.gateway.RequestContext;
import portico.core.model.gateway.UpstreamResponse;
import portico.core.model.routing.RuleMatch;
import portico.core.port.out.UpstreamHttpClient;
import portico.core.service.auth.CredentialManagerRegistry;

/**
 * Forwards a matched request to its upstream and buffers the answer.
 *
 * <p>Upstreams with a machine credential are called through their
 * {@link portico.core.service.auth.CredentialManager}, which attaches the token and renews it once
 * if the upstream rejects it. Non-2xx answers are returned unchanged apart from hop-by-hop headers.
 */
@ApplicationScoped
public class RequestForwarder {

    private static final Logger LOG = Logger.getLogger(RequestForwarder.class);

    private final ProxyRequestPreparer requestPreparer;
    private final UpstreamHttpClient httpClient;
    private final CredentialManagerRegistry credentials;

    @Inject
    public RequestForwarder(
            ProxyRequestPreparer requestPreparer,
            UpstreamHttpClient httpClient,
            CredentialManagerRegistry credentials) {
        this.requestPreparer = requestPreparer;
        this.httpClient = httpClient;
        this.credentials = credentials;
    }

    /**
     * Forward a request.
     *
     * @param match   the matched rule and upstream
     * @param request the inbound request
     * @param payload the payload after pre-processing
     * @return the upstream answer
     * @throws IllegalStateException if a structured rule is asked to forward an unsupported method
     */
    public Uni<UpstreamResponse> forward(RuleMatch match, RequestContext request, Body payload) {
        if (!requestPreparer.canForward(match, request.method())) {
            throw new IllegalStateException("Method %s cannot be forwarded by a structured rule"
                    .formatted(request.method()));
        }
        var prepared = requestPreparer.prepare(match, request, payload);
        LOG.debugv("Forwarding {0} {1}", prepared.method(), prepared.targetUri());

        var manager = credentials.forUpstream(match.upstream());
        Uni<UpstreamResponse> response = manager.isPresent()
                ? manager.get().execute(token -> httpClient.send(
                        prepared.withHeader(ProxyRequestPreparer.AUTHORIZATION, token)))
                : httpClient.send(prepared);

        return response.map(answer -> new UpstreamResponse(
                answer.statusCode(), requestPreparer.filterResponseHeaders(answer.headers()), answer.body()));
    }
}
