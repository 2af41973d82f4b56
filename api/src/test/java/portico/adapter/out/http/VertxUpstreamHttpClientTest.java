package portico.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.core.config.ResiliencyConfig;
import portico.core.model.gateway.UpstreamRequest;
import portico.core.model.gateway.UpstreamUnreachableException;

@DisplayName("VertxUpstreamHttpClient")
class VertxUpstreamHttpClientTest {

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VertxUpstreamHttpClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        vertx = Vertx.vertx();

        var httpConfig = mock(ResiliencyConfig.HttpConfig.class);
        when(httpConfig.connectTimeout()).thenReturn(Duration.ofSeconds(2));
        when(httpConfig.idleTimeout()).thenReturn(Duration.ofSeconds(10));
        when(httpConfig.requestTimeout()).thenReturn(Duration.ofMillis(500));
        when(httpConfig.maxConnectionsPerHost()).thenReturn(5);
        var resiliencyConfig = mock(ResiliencyConfig.class);
        when(resiliencyConfig.http()).thenReturn(httpConfig);

        client = new VertxUpstreamHttpClient(vertx, resiliencyConfig);
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
        vertx.closeAndAwait();
    }

    private URI uri(String path) {
        return URI.create(wireMockServer.baseUrl() + path);
    }

    @Test
    @DisplayName("Should send a GET and return status, headers and body")
    void shouldSendGet() {
        wireMockServer.stubFor(get(urlEqualTo("/v1/llm/list?model_type=chat"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"code\":0}")));

        var response = client.send(new UpstreamRequest(
                        "GET",
                        uri("/v1/llm/list?model_type=chat"),
                        Map.of("Authorization", List.of("tok")),
                        null))
                .await()
                .indefinitely();

        assertEquals(200, response.statusCode());
        assertEquals("application/json", response.getHeaderString("content-type"));
        assertEquals("{\"code\":0}", new String(response.body(), StandardCharsets.UTF_8));
        wireMockServer.verify(getRequestedFor(urlEqualTo("/v1/llm/list?model_type=chat"))
                .withHeader("Authorization", equalTo("tok")));
    }

    @Test
    @DisplayName("Should send the body with its content type")
    void shouldSendBody() {
        wireMockServer.stubFor(post(urlEqualTo("/v1/kb/create")).willReturn(aResponse().withStatus(201)));

        var response = client.send(new UpstreamRequest(
                        "POST",
                        uri("/v1/kb/create"),
                        Map.of("Content-Type", List.of("application/json")),
                        "{\"name\":\"docs\"}".getBytes(StandardCharsets.UTF_8)))
                .await()
                .indefinitely();

        assertEquals(201, response.statusCode());
        assertEquals(0, response.body().length);
        wireMockServer.verify(postRequestedFor(urlEqualTo("/v1/kb/create"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("X-Caller-Id", absent())
                .withRequestBody(equalToJson("{\"name\":\"docs\"}")));
    }

    @Test
    @DisplayName("Should pass an upstream error answer through")
    void shouldPassErrorThrough() {
        wireMockServer.stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404).withBody("nope")));

        var response = client.send(new UpstreamRequest("GET", uri("/missing"), Map.of(), null))
                .await()
                .indefinitely();

        assertEquals(404, response.statusCode());
        assertEquals("nope", new String(response.body(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should report a slow upstream as unreachable")
    void shouldTimeOut() {
        wireMockServer.stubFor(get(urlEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(3000)));

        assertThrows(
                UpstreamUnreachableException.class,
                () -> client.send(new UpstreamRequest("GET", uri("/slow"), Map.of(), null))
                        .await()
                        .indefinitely());
    }

    @Test
    @DisplayName("Should report a refused connection as unreachable")
    void shouldReportRefusedConnection() throws IOException {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        var request = new UpstreamRequest("GET", URI.create("http://localhost:" + port + "/x"), Map.of(), null);

        assertThrows(UpstreamUnreachableException.class, () -> client.send(request).await().indefinitely());
    }
}
