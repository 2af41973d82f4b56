package portico.core.model.gateway;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Body")
class BodyTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should parse a JSON object")
    void shouldParseJson() {
        var body = Body.parse("{\"name\":\"kb\"}".getBytes(StandardCharsets.UTF_8), mapper);

        var json = assertInstanceOf(Body.Json.class, body);
        assertEquals("kb", json.value().get("name").asText());
    }

    @Test
    @DisplayName("Should keep non-JSON bytes raw and unchanged")
    void shouldKeepNonJsonRaw() {
        var bytes = "name=kb&x=1".getBytes(StandardCharsets.UTF_8);

        var body = Body.parse(bytes, mapper);

        var raw = assertInstanceOf(Body.Raw.class, body);
        assertArrayEquals(bytes, raw.toBytes(mapper));
    }

    @Test
    @DisplayName("Should treat an empty body as empty raw")
    void shouldTreatEmptyAsRaw() {
        assertTrue(Body.parse(new byte[0], mapper).isEmpty());
        assertTrue(Body.parse(null, mapper).isEmpty());
        assertTrue(Body.raw(null).isEmpty());
    }

    @Test
    @DisplayName("Should re-serialize JSON compactly")
    void shouldSerializeJson() {
        var body = Body.parse("{ \"a\" : [1, 2] }".getBytes(StandardCharsets.UTF_8), mapper);

        assertEquals("{\"a\":[1,2]}", new String(body.toBytes(mapper), StandardCharsets.UTF_8));
    }
}
