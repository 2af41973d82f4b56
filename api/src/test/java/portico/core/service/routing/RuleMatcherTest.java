package portico.core.service.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import portico.core.model.routing.ProxyRule;
import portico.core.model.upstream.Upstream;

@DisplayName("RuleMatcher")
class RuleMatcherTest {

    private RuleMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new RuleMatcher();
    }

    private Upstream upstream(ProxyRule... rules) {
        return new Upstream("langgraph", URI.create("http://localhost:2024"), List.of(rules), null, null, null);
    }

    @Nested
    @DisplayName("Prefix matching")
    class PrefixMatchingTests {

        @Test
        @DisplayName("Should match a pattern at the start of the sub-path")
        void shouldMatchPrefix() {
            var upstream = upstream(ProxyRule.builder("/v1/kb").method("POST").build());

            var result = matcher.match(upstream, "/v1/kb/list", "POST");

            assertTrue(result.isPresent());
            assertEquals(6, result.get().matchedLength());
            assertEquals("/v1/kb/list", result.get().subPath());
        }

        @Test
        @DisplayName("Should not match a pattern found only in the middle of the sub-path")
        void shouldNotMatchInTheMiddle() {
            var upstream = upstream(ProxyRule.builder("/list").build());

            assertTrue(matcher.match(upstream, "/v1/kb/list", "GET").isEmpty());
        }

        @Test
        @DisplayName("Should ignore rules whose pattern only matches the empty prefix")
        void shouldIgnoreEmptyMatches() {
            var upstream = upstream(ProxyRule.builder("x*").build());

            assertTrue(matcher.match(upstream, "/threads", "GET").isEmpty());
        }

        @Test
        @DisplayName("Should return empty for an upstream without rules")
        void shouldReturnEmptyWithoutRules() {
            assertTrue(matcher.match(upstream(), "/threads", "GET").isEmpty());
        }
    }

    @Nested
    @DisplayName("Method filtering")
    class MethodTests {

        @Test
        @DisplayName("Should skip rules for another method")
        void shouldSkipOtherMethods() {
            var upstream = upstream(ProxyRule.builder("/v1/llm/list").method("GET").build());

            assertTrue(matcher.match(upstream, "/v1/llm/list", "POST").isEmpty());
            assertTrue(matcher.match(upstream, "/v1/llm/list", "get").isPresent());
        }

        @Test
        @DisplayName("Should match any method with a wildcard rule")
        void shouldMatchWildcard() {
            var upstream = upstream(ProxyRule.builder("/v1").build());

            assertTrue(matcher.match(upstream, "/v1/anything", "DELETE").isPresent());
        }
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("Should prefer the longest match regardless of order")
        void shouldPreferLongestMatch() {
            var runs = ProxyRule.builder("/threads/.*/runs").method("POST").build();
            var stream = ProxyRule.builder("/threads/.*/runs/stream")
                    .method("POST")
                    .streaming(true)
                    .build();
            var threads = ProxyRule.builder("/threads").method("POST").build();

            var result = matcher.match(upstream(threads, runs, stream), "/threads/abc/runs/stream", "POST");

            assertTrue(result.isPresent());
            assertTrue(result.get().rule().streaming());
        }

        @Test
        @DisplayName("Should choose the background run rule for a plain runs path")
        void shouldChooseRunsRule() {
            var runs = ProxyRule.builder("/threads/.*/runs").method("POST").description("runs").build();
            var stream = ProxyRule.builder("/threads/.*/runs/stream")
                    .method("POST")
                    .description("stream")
                    .build();

            var result = matcher.match(upstream(stream, runs), "/threads/abc/runs", "POST");

            assertEquals("runs", result.orElseThrow().rule().description());
        }

        @Test
        @DisplayName("Should resolve equal-length matches to the first registered rule")
        void shouldResolveTiesToFirstRule() {
            var first = ProxyRule.builder("/v1/kb/list").description("first").build();
            var second = ProxyRule.builder("/v1/kb/lis.").description("second").build();

            var result = matcher.match(upstream(first, second), "/v1/kb/list", "POST");

            assertEquals("first", result.orElseThrow().rule().description());
        }
    }
}
