package portico.core.model.gateway;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Request or response payload: parsed JSON, or the raw bytes when parsing is not possible.
 */
public sealed interface Body {

    /**
     * Best-effort parse. Empty input and anything that is not JSON stay {@link Raw}.
     */
    static Body parse(byte[] bytes, ObjectMapper mapper) {
        if (bytes == null || bytes.length == 0) {
            return Raw.EMPTY;
        }
        try {
            var node = mapper.readTree(bytes);
            if (node == null || node.isMissingNode()) {
                return new Raw(bytes);
            }
            return new Json(node);
        } catch (IOException e) {
            return new Raw(bytes);
        }
    }

    static Body raw(byte[] bytes) {
        return bytes == null || bytes.length == 0 ? Raw.EMPTY : new Raw(bytes);
    }

    byte[] toBytes(ObjectMapper mapper);

    boolean isEmpty();

    record Json(JsonNode value) implements Body {
        public Json {
            if (value == null) {
                throw new IllegalArgumentException("value is required");
            }
        }

        @Override
        public byte[] toBytes(ObjectMapper mapper) {
            try {
                return mapper.writeValueAsBytes(value);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to serialize JSON payload", e);
            }
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    record Raw(byte[] bytes) implements Body {
        static final Raw EMPTY = new Raw(new byte[0]);

        public Raw {
            if (bytes == null) {
                bytes = new byte[0];
            }
        }

        @Override
        public byte[] toBytes(ObjectMapper mapper) {
            return bytes;
        }

        @Override
        public boolean isEmpty() {
            return bytes.length == 0;
        }
    }
}
