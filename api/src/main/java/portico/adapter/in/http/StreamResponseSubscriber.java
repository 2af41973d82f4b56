package portico.adapter.in.http;

import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.smallrye.mutiny.subscription.MultiSubscriber;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerResponse;
import org.jboss.logging.Logger;

/**
 * Writes relayed chunks to the caller's response, one chunk requested at a time.
 *
 * <p>The next chunk is requested only once the response write queue has room; a full queue waits
 * for the drain handler. A closed response cancels the subscription, which closes the upstream
 * connection. Headers are committed with the first chunk, so a failure before it goes to the
 * failure writer instead.
 */
final class StreamResponseSubscriber implements MultiSubscriber<byte[]> {

    private static final Logger LOG = Logger.getLogger(StreamResponseSubscriber.class);

    private final HttpServerResponse response;
    private final Consumer<Throwable> failureWriter;
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile Flow.Subscription subscription;

    StreamResponseSubscriber(HttpServerResponse response, Consumer<Throwable> failureWriter) {
        this.response = response;
        this.failureWriter = failureWriter;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (response.closed()) {
            LOG.debug("Caller disconnected before the stream opened, cancelling");
            subscription.cancel();
            return;
        }
        response.closeHandler(ignored -> {
            LOG.debug("Caller disconnected, cancelling stream");
            subscription.cancel();
        });
        subscription.request(1);
    }

    @Override
    public void onItem(byte[] chunk) {
        if (response.closed()) {
            subscription.cancel();
            return;
        }
        if (started.compareAndSet(false, true)) {
            startStream(response);
        }
        response.write(Buffer.buffer(chunk));
        if (response.writeQueueFull()) {
            response.drainHandler(ignored -> {
                response.drainHandler(null);
                subscription.request(1);
            });
        } else {
            subscription.request(1);
        }
    }

    @Override
    public void onFailure(Throwable error) {
        if (!started.get()) {
            failureWriter.accept(error);
            return;
        }
        LOG.warnv("Stream failed after it started: {0}", error.getMessage());
        if (!response.ended() && !response.closed()) {
            response.end();
        }
    }

    @Override
    public void onCompletion() {
        if (response.ended() || response.closed()) {
            return;
        }
        if (started.compareAndSet(false, true)) {
            startStream(response);
        }
        response.end();
    }

    private static void startStream(HttpServerResponse response) {
        response.setStatusCode(200)
                .setChunked(true)
                .putHeader("Content-Type", "text/event-stream")
                .putHeader("Cache-Control", "no-cache")
                .putHeader("Connection", "keep-alive")
                .putHeader("X-Accel-Buffering", "no");
    }
}
