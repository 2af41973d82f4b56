package portico.adapter.out.http;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import io.smallrye.mutiny.Multi;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import io.vertx.mutiny.core.http.HttpClientResponse;
import org.jboss.logging.Logger;

import portico.core.config.ResiliencyConfig;
import portico.core.model.gateway.StreamRequest;
import portico.core.model.gateway.UpstreamStatusException;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.core.port.out.StreamTransport;

/**
 * Primary stream transport on a pooled Vert.x {@link HttpClient}.
 *
 * <p>Response buffers are emitted as they arrive. Cancelling the stream resets the request,
 * which closes the upstream connection.
 */
@ApplicationScoped
@Named("primary")
public class VertxStreamTransport implements StreamTransport {

    private static final Logger LOG = Logger.getLogger(VertxStreamTransport.class);

    private final HttpClient client;

    @Inject
    public VertxStreamTransport(Vertx vertx, ResiliencyConfig resiliencyConfig) {
        var stream = resiliencyConfig.stream();
        var options = new HttpClientOptions()
                .setConnectTimeout((int) stream.connectTimeout().toMillis())
                .setMaxPoolSize(stream.maxConnectionsPerHost())
                .setKeepAlive(true);
        this.client = vertx.createHttpClient(options);
    }

    @Override
    public String name() {
        return "vertx";
    }

    @Override
    public Multi<byte[]> open(StreamRequest request) {
        return Multi.createFrom().deferred(() -> {
            var inFlight = new AtomicReference<HttpClientRequest>();
            var options = new RequestOptions()
                    .setMethod(HttpMethod.valueOf(request.method()))
                    .setAbsoluteURI(request.targetUri().toString());
            request.headers().forEach((name, values) -> values.forEach(value -> options.addHeader(name, value)));

            return client.request(options)
                    .invoke(inFlight::set)
                    .flatMap(httpRequest -> request.body().length > 0
                            ? httpRequest.send(Buffer.buffer(request.body()))
                            : httpRequest.send())
                    .onItem()
                    .transformToMulti(this::toChunks)
                    .onCancellation()
                    .invoke(() -> {
                        var httpRequest = inFlight.get();
                        if (httpRequest != null) {
                            LOG.debugv("Closing stream to {0}", request.targetUri());
                            httpRequest.reset();
                        }
                    })
                    .onFailure(error -> !(error instanceof UpstreamStatusException))
                    .transform(error -> new UpstreamUnreachableException(
                            "Stream from %s failed: %s".formatted(request.targetUri(), error.getMessage()), error));
        });
    }

    private Multi<byte[]> toChunks(HttpClientResponse response) {
        var status = response.statusCode();
        if (status < 200 || status >= 300) {
            return response.body()
                    .onItem()
                    .transformToMulti(body -> Multi.createFrom()
                            .<byte[]>failure(new UpstreamStatusException(status, body == null ? null : body.getBytes())));
        }
        return response.toMulti().map(Buffer::getBytes);
    }
}
