package portico.adapter.out.http;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import portico.core.config.ResiliencyConfig;
import portico.core.model.gateway.UpstreamRequest;
import portico.core.model.gateway.UpstreamResponse;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.core.port.out.UpstreamHttpClient;

/**
 * HTTP adapter for forwarding prepared upstream requests using Vert.x WebClient.
 * All header preparation is done in core by {@link portico.core.service.gateway.ProxyRequestPreparer}.
 */
@ApplicationScoped
public class VertxUpstreamHttpClient implements UpstreamHttpClient {

    private static final Logger LOG = Logger.getLogger(VertxUpstreamHttpClient.class);

    private final WebClient webClient;
    private final long requestTimeoutMs;

    @Inject
    public VertxUpstreamHttpClient(Vertx vertx, ResiliencyConfig resiliencyConfig) {
        var http = resiliencyConfig.http();
        var options = new WebClientOptions()
                .setConnectTimeout((int) http.connectTimeout().toMillis())
                .setIdleTimeout((int) http.idleTimeout().toSeconds())
                .setMaxPoolSize(http.maxConnectionsPerHost())
                .setFollowRedirects(false);
        this.webClient = WebClient.create(vertx, options);
        this.requestTimeoutMs = http.requestTimeout().toMillis();
    }

    @Override
    public Uni<UpstreamResponse> send(UpstreamRequest upstreamRequest) {
        var request = webClient
                .requestAbs(HttpMethod.valueOf(upstreamRequest.method()), upstreamRequest.targetUri().toString())
                .timeout(requestTimeoutMs);
        applyHeaders(upstreamRequest, request);

        return executeRequest(request, upstreamRequest.body())
                .map(this::toUpstreamResponse)
                .onFailure()
                .transform(error -> {
                    LOG.debugv(error, "Request to {0} failed", upstreamRequest.targetUri());
                    return new UpstreamUnreachableException(
                            "Upstream %s unreachable: %s".formatted(upstreamRequest.targetUri(), error.getMessage()),
                            error);
                });
    }

    private void applyHeaders(UpstreamRequest upstreamRequest, HttpRequest<Buffer> httpRequest) {
        for (var entry : upstreamRequest.headers().entrySet()) {
            for (var value : entry.getValue()) {
                httpRequest.headers().add(entry.getKey(), value);
            }
        }
    }

    private Uni<HttpResponse<Buffer>> executeRequest(HttpRequest<Buffer> request, byte[] body) {
        if (body != null && body.length > 0) {
            return request.sendBuffer(Buffer.buffer(body));
        }

        return request.send();
    }

    private UpstreamResponse toUpstreamResponse(HttpResponse<Buffer> response) {
        Map<String, List<String>> headers = new HashMap<>();

        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>())
                    .addAll(response.headers().getAll(name));
        }

        var responseBody = response.body() != null ? response.body().getBytes() : new byte[0];

        return new UpstreamResponse(response.statusCode(), headers, responseBody);
    }
}
