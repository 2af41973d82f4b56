package portico.core.service.hook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.core.model.gateway.Body;
import portico.spi.HookContext;
import portico.spi.PostProcessor;
import portico.spi.PreProcessor;

@DisplayName("ProcessorRegistry")
class ProcessorRegistryTest {

    private static PreProcessor pre(String name) {
        return new PreProcessor() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Uni<Body> process(HookContext context, Body payload) {
                return Uni.createFrom().item(payload);
            }
        };
    }

    private static PostProcessor post(String name) {
        return new PostProcessor() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Uni<Body> process(HookContext context, Body response) {
                return Uni.createFrom().item(response);
            }
        };
    }

    @Test
    @DisplayName("Should resolve hooks by name in the given order")
    void shouldResolveInOrder() {
        var audit = pre("audit");
        var guard = pre("guard");
        var registry = new ProcessorRegistry(List.of(audit, guard), List.of());

        var resolved = registry.resolvePre(List.of("guard", "audit"));

        assertEquals(2, resolved.size());
        assertSame(guard, resolved.get(0));
        assertSame(audit, resolved.get(1));
    }

    @Test
    @DisplayName("Should keep pre- and post-processor names separate")
    void shouldKeepKindsSeparate() {
        var registry = new ProcessorRegistry(List.of(pre("scope")), List.of(post("scope")));

        assertTrue(registry.preProcessor("scope").isPresent());
        assertTrue(registry.postProcessor("scope").isPresent());
        assertTrue(registry.postProcessor("missing").isEmpty());
    }

    @Test
    @DisplayName("Should fail on an unknown hook name")
    void shouldFailOnUnknownName() {
        var registry = new ProcessorRegistry(List.of(), List.of(post("scope-filter")));

        var error = assertThrows(IllegalStateException.class, () -> registry.resolvePost(List.of("nope")));
        assertTrue(error.getMessage().contains("nope"));
        assertThrows(IllegalStateException.class, () -> registry.resolvePre(List.of("scope-filter")));
    }

    @Test
    @DisplayName("Should fail on duplicate names of the same kind")
    void shouldFailOnDuplicates() {
        assertThrows(
                IllegalStateException.class, () -> new ProcessorRegistry(List.of(pre("a"), pre("a")), List.of()));
    }
}
