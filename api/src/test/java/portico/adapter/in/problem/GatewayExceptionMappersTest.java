package portico.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.nio.charset.StandardCharsets;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.core.model.auth.CredentialException;
import portico.core.model.gateway.UpstreamStatusException;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.spi.HookAbortedException;

@DisplayName("GatewayExceptionMappers")
class GatewayExceptionMappersTest {

    private final GatewayExceptionMappers mappers = new GatewayExceptionMappers();

    @Test
    @DisplayName("Should map a failed upstream login to 502 naming the upstream")
    void shouldMapCredentialFailure() {
        var response = mappers.mapCredentialException(new CredentialException("ragflow", "bad password"));

        assertEquals(502, response.getStatus());
        assertEquals("problem+json", response.getMediaType().getSubtype());
        var problem = assertInstanceOf(HttpProblem.class, response.getEntity());
        assertEquals("Upstream Authentication Failed", problem.getTitle());
        assertEquals("Could not authenticate to upstream ragflow", problem.getDetail());
        assertEquals("ragflow", problem.getParameters().get(GatewayProblem.UPSTREAM));
    }

    @Test
    @DisplayName("Should map an unreachable upstream to 502")
    void shouldMapUnreachable() {
        var response = mappers.mapUpstreamUnreachable(new UpstreamUnreachableException("connect timed out"));

        assertEquals(502, response.getStatus());
        assertEquals("connect timed out", ((HttpProblem) response.getEntity()).getDetail());
    }

    @Test
    @DisplayName("Should pass an upstream status and body through unchanged")
    void shouldPassUpstreamStatusThrough() {
        var body = "{\"detail\":\"thread busy\"}".getBytes(StandardCharsets.UTF_8);

        var response = mappers.mapUpstreamStatus(new UpstreamStatusException(409, body));

        assertEquals(409, response.getStatus());
        assertArrayEquals(body, (byte[]) response.getEntity());
    }

    @Test
    @DisplayName("Should keep the status and reason chosen by a pre-processor")
    void shouldMapHookAbort() {
        var response = mappers.mapHookAborted(new HookAbortedException(409, "run_in_progress"));

        assertEquals(409, response.getStatus());
        var problem = (HttpProblem) response.getEntity();
        assertEquals("run_in_progress", problem.getParameters().get(GatewayProblem.REASON));
    }

    @Test
    @DisplayName("Should map an invalid request to 400")
    void shouldMapInvalidRequest() {
        var response = mappers.mapIllegalArgumentException(new IllegalArgumentException("method is required"));

        assertEquals(400, response.getStatus());
        var problem = (HttpProblem) response.getEntity();
        assertEquals("Invalid Gateway Request", problem.getTitle());
        assertEquals("method is required", problem.getDetail());
    }
}
