package portico.adapter.out.http;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Flow;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import portico.core.config.ResiliencyConfig;
import portico.core.model.gateway.StreamRequest;
import portico.core.model.gateway.UpstreamStatusException;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.core.port.out.StreamTransport;

/**
 * Fallback stream transport on the JDK {@link HttpClient}, with its own connection pool.
 *
 * <p>Each body read becomes one chunk, so an empty read reaches the end-of-stream heuristic
 * as an empty chunk. Cancelling the stream cancels the body subscription, which closes the
 * connection.
 */
@ApplicationScoped
@Named("fallback")
public class JdkStreamTransport implements StreamTransport {

    /**
     * Headers the JDK client sets itself and refuses from callers.
     */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade", "keep-alive", "transfer-encoding");

    private final HttpClient client;

    @Inject
    public JdkStreamTransport(ResiliencyConfig resiliencyConfig) {
        this(HttpClient.newBuilder()
                .connectTimeout(resiliencyConfig.stream().connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    JdkStreamTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "jdk";
    }

    @Override
    public Multi<byte[]> open(StreamRequest request) {
        return Uni.createFrom()
                .completionStage(() -> client.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofPublisher()))
                .onItem()
                .transformToMulti(this::toChunks)
                .onFailure(error -> !(error instanceof UpstreamStatusException))
                .transform(error -> new UpstreamUnreachableException(
                        "Stream from %s failed: %s".formatted(request.targetUri(), error.getMessage()), error));
    }

    private HttpRequest buildRequest(StreamRequest request) {
        var body = request.body().length > 0
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody();
        var builder = HttpRequest.newBuilder(request.targetUri())
                .version(HttpClient.Version.HTTP_1_1)
                .method(request.method(), body);
        request.headers().forEach((name, values) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                values.forEach(value -> builder.header(name, value));
            }
        });
        return builder.build();
    }

    private Multi<byte[]> toChunks(HttpResponse<Flow.Publisher<List<ByteBuffer>>> response) {
        var chunks = Multi.createFrom().publisher(response.body()).map(JdkStreamTransport::concat);
        var status = response.statusCode();
        if (status < 200 || status >= 300) {
            return chunks.collect()
                    .asList()
                    .onItem()
                    .transformToMulti(parts -> Multi.createFrom()
                            .<byte[]>failure(new UpstreamStatusException(status, join(parts))));
        }
        return chunks;
    }

    private static byte[] concat(List<ByteBuffer> buffers) {
        var out = new ByteArrayOutputStream();
        for (var buffer : buffers) {
            var bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            out.writeBytes(bytes);
        }
        return out.toByteArray();
    }

    private static byte[] join(List<byte[]> parts) {
        var out = new ByteArrayOutputStream();
        parts.forEach(out::writeBytes);
        return out.toByteArray();
    }
}
