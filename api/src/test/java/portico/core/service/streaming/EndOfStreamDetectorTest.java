package portico.core.service.streaming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Multi;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EndOfStreamDetector")
class EndOfStreamDetectorTest {

    private final EndOfStreamDetector detector = new EndOfStreamDetector(5, "event: end");

    private static Multi<byte[]> chunks(String... values) {
        return Multi.createFrom()
                .iterable(Arrays.stream(values).map(v -> v.getBytes(StandardCharsets.UTF_8)).toList());
    }

    private static List<String> collect(Multi<byte[]> chunks) {
        return chunks.map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .collect()
                .asList()
                .await()
                .indefinitely();
    }

    @Test
    @DisplayName("Should end after the threshold of consecutive empty reads")
    void shouldEndAfterEmptyReads() {
        var cancelled = new AtomicBoolean();
        var causes = new ArrayList<String>();
        var source = chunks("a", "b", "", "", "", "", "", "never").onCancellation().invoke(() -> cancelled.set(true));

        var result = collect(detector.apply(source, causes::add));

        assertEquals(List.of("a", "b"), result);
        assertEquals(List.of(EndOfStreamDetector.CAUSE_EMPTY_READS), causes);
        assertTrue(cancelled.get());
    }

    @Test
    @DisplayName("Should reset the empty-read count on a non-empty chunk")
    void shouldResetCounter() {
        var result = collect(detector.apply(chunks("a", "", "", "", "", "b", "", "", "", "", "c")));

        assertEquals(List.of("a", "b", "c"), result);
    }

    @Test
    @DisplayName("Should forward the sentinel chunk and then stop")
    void shouldStopAfterSentinel() {
        var causes = new ArrayList<String>();

        var result = collect(detector.apply(
                chunks("data: 1\n\n", "event: end\ndata: {}\n\n", "data: late\n\n"), causes::add));

        assertEquals(List.of("data: 1\n\n", "event: end\ndata: {}\n\n"), result);
        assertEquals(List.of(EndOfStreamDetector.CAUSE_SENTINEL), causes);
    }

    @Test
    @DisplayName("Should only match the sentinel as a whole line")
    void shouldIgnoreSentinelInsideLine() {
        var result = collect(detector.apply(chunks("data: event: end\n\n", "data: 2\n\n")));

        assertEquals(2, result.size());
    }

    @Test
    @DisplayName("Should never forward empty chunks")
    void shouldDropEmptyChunks() {
        var result = collect(detector.apply(chunks("", "a", "", "b")));

        assertEquals(List.of("a", "b"), result);
    }

    @Test
    @DisplayName("Should run without a sentinel")
    void shouldRunWithoutSentinel() {
        var result = collect(new EndOfStreamDetector(2, "").apply(chunks("event: end", "x", "", "", "y")));

        assertEquals(List.of("event: end", "x"), result);
    }

    @Test
    @DisplayName("Should reject a threshold below one")
    void shouldRejectThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new EndOfStreamDetector(0, "event: end"));
    }
}
