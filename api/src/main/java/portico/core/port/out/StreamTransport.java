package portico.core.port.out;

import io.smallrye.mutiny.Multi;

import portico.core.model.gateway.StreamRequest;

/**
 * Opens a chunked upstream response.
 *
 * <p>The returned {@link Multi} is cold: the request is sent on subscription, and cancelling the
 * subscription closes the connection. A non-2xx answer fails the stream with
 * {@link portico.core.model.gateway.UpstreamStatusException}; anything else that goes wrong is a
 * transport failure. A chunk may be empty.
 */
public interface StreamTransport {

    Multi<byte[]> open(StreamRequest request);

    /**
     * Short name used in logs and metrics.
     */
    String name();
}
