package portico;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests against the upstream rule tables in application.properties. The test profile
 * points both upstreams at a WireMock server on port 18089.
 */
@QuarkusTest
@DisplayName("Gateway Integration Tests")
class GatewayIntegrationTest {

    private static final int UPSTREAM_PORT = 18089;

    private WireMockServer upstreamServer;

    @BeforeEach
    void setUp() {
        upstreamServer = new WireMockServer(WireMockConfiguration.options().port(UPSTREAM_PORT));
        upstreamServer.start();
    }

    @AfterEach
    void tearDown() {
        if (upstreamServer != null) {
            upstreamServer.stop();
        }
    }

    @Nested
    @DisplayName("Access control")
    class AccessControlTests {

        @Test
        @DisplayName("Should forward a request the caller is permitted to make")
        void shouldForwardPermittedRequest() {
            upstreamServer.stubFor(get(urlEqualTo("/ragflow/v1/llm/factories"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"code\":0,\"data\":[{\"name\":\"OpenAI\"}]}")));

            given().header("X-Caller-Id", "42")
                    .header("X-Caller-Permissions", "model:model:add")
                    .header("Authorization", "Bearer caller-token")
                    .when()
                    .get("/proxy/ragflow/v1/llm/factories")
                    .then()
                    .statusCode(200)
                    .body("data[0].name", is("OpenAI"));

            upstreamServer.verify(getRequestedFor(urlEqualTo("/ragflow/v1/llm/factories"))
                    .withHeader("Authorization", absent()));
        }

        @Test
        @DisplayName("Should deny a caller missing the permission without calling the upstream")
        void shouldDenyMissingPermission() {
            given().header("X-Caller-Id", "42")
                    .when()
                    .get("/proxy/ragflow/v1/llm/factories")
                    .then()
                    .statusCode(403)
                    .contentType(startsWith("application/problem+json"))
                    .body(containsString("permission_denied"));

            upstreamServer.verify(0, getRequestedFor(anyUrl()));
        }

        @Test
        @DisplayName("Should answer 403 rule_not_found for an unmapped path")
        void shouldRejectUnmappedPath() {
            given().header("X-Caller-Id", "42")
                    .header("X-Caller-Admin", "true")
                    .when()
                    .get("/proxy/ragflow/v1/user/info")
                    .then()
                    .statusCode(403)
                    .body(containsString("rule_not_found"));
        }

        @Test
        @DisplayName("Should answer 403 rule_not_found for an unknown upstream")
        void shouldRejectUnknownUpstream() {
            given().when().get("/proxy/unknown/anything").then().statusCode(403).body(containsString("rule_not_found"));
        }

        @Test
        @DisplayName("Should answer 403 rule_not_found for an upstream without a sub-path")
        void shouldRejectBareUpstream() {
            given().when().get("/proxy/ragflow").then().statusCode(403).body(containsString("rule_not_found"));
        }

        @Test
        @DisplayName("Should answer 403 rule_not_found for the bare mount")
        void shouldRejectBareMount() {
            given().when().get("/proxy").then().statusCode(403).body(containsString("rule_not_found"));

            upstreamServer.verify(0, getRequestedFor(anyUrl()));
        }
    }

    @Nested
    @DisplayName("Hooks")
    class HookTests {

        @Test
        @DisplayName("Should filter the knowledge base list to the caller's scope")
        void shouldFilterKnowledgeBases() {
            upstreamServer.stubFor(post(urlEqualTo("/ragflow/v1/kb/list?page=1"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"code\":0,\"data\":{\"kbs\":[{\"id\":\"kb1\"},{\"id\":\"kb2\"}],\"total\":2}}")));

            given().header("X-Caller-Id", "42")
                    .header("X-Caller-Scope-Ids", "kb2")
                    .contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .post("/proxy/ragflow/v1/kb/list?page=1")
                    .then()
                    .statusCode(200)
                    .contentType(ContentType.JSON)
                    .body("data.kbs.id", contains("kb2"))
                    .body("data.total", is(2));
        }

        @Test
        @DisplayName("Should stream a run the caller may use")
        void shouldStreamRun() {
            upstreamServer.stubFor(post(urlEqualTo("/langgraph/threads/t1/runs/stream"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "text/event-stream")
                            .withBody("event: metadata\ndata: {}\n\nevent: end\n\n")));

            given().header("X-Caller-Id", "42")
                    .header("X-Caller-Scope-Ids", "g1")
                    .contentType(ContentType.JSON)
                    .body("{\"assistant_id\":\"a1\",\"graph_id\":\"g1\"}")
                    .when()
                    .post("/proxy/langgraph/threads/t1/runs/stream")
                    .then()
                    .statusCode(200)
                    .header("Content-Type", startsWith("text/event-stream"))
                    .header("Cache-Control", "no-cache")
                    .header("X-Accel-Buffering", "no")
                    .body(containsString("event: end"));

            upstreamServer.verify(postRequestedFor(urlEqualTo("/langgraph/threads/t1/runs/stream"))
                    .withHeader("Accept", equalTo("text/event-stream"))
                    .withHeader("X-Caller-Id", absent())
                    .withHeader("X-Caller-Scope-Ids", absent()));
        }

        @Test
        @DisplayName("Should refuse a run on an agent outside the caller's scope")
        void shouldRefuseForeignAgent() {
            given().header("X-Caller-Id", "42")
                    .header("X-Caller-Scope-Ids", "g1")
                    .contentType(ContentType.JSON)
                    .body("{\"assistant_id\":\"a1\",\"graph_id\":\"g9\"}")
                    .when()
                    .post("/proxy/langgraph/threads/t1/runs/stream")
                    .then()
                    .statusCode(403)
                    .body(containsString("scope_denied"));

            upstreamServer.verify(0, postRequestedFor(anyUrl()));
        }
    }
}
