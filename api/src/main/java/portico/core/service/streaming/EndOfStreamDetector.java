package portico.core.service.streaming;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import io.smallrye.mutiny.Multi;

/**
 * Ends a chunk stream whose upstream never closes it.
 *
 * <p>The stream ends after {@code emptyReadThreshold} consecutive empty chunks, or right after a
 * chunk containing the sentinel line, which is still forwarded. Ending cancels the source, so the
 * upstream connection is closed. Empty chunks are never forwarded.
 */
public class EndOfStreamDetector {

    public static final String CAUSE_SENTINEL = "sentinel";
    public static final String CAUSE_EMPTY_READS = "empty_reads";

    private static final byte[] END = new byte[0];

    private final int emptyReadThreshold;
    private final String sentinel;

    public EndOfStreamDetector(int emptyReadThreshold, String sentinel) {
        if (emptyReadThreshold < 1) {
            throw new IllegalArgumentException("emptyReadThreshold must be at least 1");
        }
        this.emptyReadThreshold = emptyReadThreshold;
        this.sentinel = sentinel == null || sentinel.isBlank() ? null : sentinel.strip();
    }

    public Multi<byte[]> apply(Multi<byte[]> chunks) {
        return apply(chunks, cause -> {});
    }

    /**
     * Apply the heuristic.
     *
     * @param chunks source chunks
     * @param onEnd  told {@link #CAUSE_SENTINEL} or {@link #CAUSE_EMPTY_READS} when the heuristic ends the stream
     * @return the forwarded chunks
     */
    public Multi<byte[]> apply(Multi<byte[]> chunks, Consumer<String> onEnd) {
        return Multi.createFrom().deferred(() -> {
            var emptyReads = new AtomicInteger();
            return chunks.onItem()
                    .transformToIterable(chunk -> classify(chunk, emptyReads, onEnd))
                    .select()
                    .first(chunk -> chunk != END);
        });
    }

    private List<byte[]> classify(byte[] chunk, AtomicInteger emptyReads, Consumer<String> onEnd) {
        if (chunk == null || chunk.length == 0) {
            if (emptyReads.incrementAndGet() >= emptyReadThreshold) {
                onEnd.accept(CAUSE_EMPTY_READS);
                return List.of(END);
            }
            return List.of();
        }
        emptyReads.set(0);
        if (containsSentinel(chunk)) {
            onEnd.accept(CAUSE_SENTINEL);
            return List.of(chunk, END);
        }
        return List.of(chunk);
    }

    private boolean containsSentinel(byte[] chunk) {
        if (sentinel == null) {
            return false;
        }
        return new String(chunk, StandardCharsets.UTF_8).lines().anyMatch(line -> line.strip().equals(sentinel));
    }
}
