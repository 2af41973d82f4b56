package portico.adapter.in.http;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.vertx.web.RouteFilter;
import io.smallrye.mutiny.Multi;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import portico.adapter.in.problem.GatewayProblem;
import portico.adapter.in.rest.GatewayResource;
import portico.core.model.auth.CredentialException;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.RequestContext;
import portico.core.model.gateway.UpstreamStatusException;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.core.port.in.GatewayUseCase;
import portico.core.port.out.CallerIdentityResolver;

/**
 * Vert.x route filter that serves streaming rules before JAX-RS sees the request.
 *
 * <p>Paths are matched in their normalized form, as the buffered resource sees them. Chunks are
 * written by {@link StreamResponseSubscriber}.
 */
@ApplicationScoped
public class StreamingRouteFilter {

    private static final Logger LOG = Logger.getLogger(StreamingRouteFilter.class);

    private static final String PREFIX = "/" + GatewayResource.MOUNT + "/";
    private static final String PROBLEM_JSON = "application/problem+json";

    private final GatewayUseCase gatewayUseCase;
    private final CallerIdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    @Inject
    public StreamingRouteFilter(
            GatewayUseCase gatewayUseCase, CallerIdentityResolver identityResolver, ObjectMapper objectMapper) {
        this.gatewayUseCase = gatewayUseCase;
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    /**
     * Take over requests matched by a streaming rule.
     */
    @RouteFilter(40)
    void interceptStreaming(RoutingContext ctx) {
        var path = ctx.normalizedPath();
        if (path == null || !path.startsWith(PREFIX)) {
            ctx.next();
            return;
        }
        var target = GatewayResource.Target.of(path.substring(PREFIX.length()));
        var upstream = target.upstream();
        var subPath = target.subPath();
        var method = ctx.request().method().name();

        if (upstream.isEmpty() || !gatewayUseCase.isStreamingRoute(upstream, subPath, method)) {
            ctx.next();
            return;
        }

        LOG.debugv("Streaming request detected: {0} {1}", method, path);
        ctx.request().body().onComplete(body -> {
            if (body.failed()) {
                writeProblem(ctx.response(), 400, "Bad Request", "Could not read request body", null);
                return;
            }
            var request = toRequestContext(ctx, method, subPath, body.result());
            var identity = identityResolver.resolve(request.headers());
            gatewayUseCase
                    .forward(upstream, request, identity)
                    .subscribe()
                    .with(result -> respond(ctx.response(), result), error -> writeFailure(ctx.response(), error));
        });
        ctx.request().resume();
    }

    private void respond(HttpServerResponse response, GatewayResult result) {
        if (result instanceof GatewayResult.Streaming streaming) {
            relay(response, streaming.chunks());
        } else if (result instanceof GatewayResult.Forbidden forbidden) {
            writeProblem(response, 403, "Forbidden", "Access denied: " + forbidden.reason(), forbidden.reason());
        } else if (result instanceof GatewayResult.MethodNotAllowed notAllowed) {
            writeProblem(
                    response,
                    405,
                    "Method Not Allowed",
                    "Method %s is not supported for this route".formatted(notAllowed.method()),
                    null);
        } else if (result instanceof GatewayResult.Aborted aborted) {
            writeProblem(
                    response,
                    aborted.statusCode(),
                    "Request Rejected",
                    "Request rejected: " + aborted.reason(),
                    aborted.reason());
        } else if (result instanceof GatewayResult.UpstreamUnreachable unreachable) {
            writeProblem(response, 502, "Bad Gateway", unreachable.message(), null);
        } else if (result instanceof GatewayResult.Success success) {
            success.headers().forEach((name, values) -> response.headers().add(name, values));
            response.setStatusCode(success.statusCode()).end(Buffer.buffer(success.body()));
        } else {
            writeProblem(response, 500, "Internal Server Error", "Unexpected gateway result", null);
        }
    }

    private void relay(HttpServerResponse response, Multi<byte[]> chunks) {
        var subscriber = new StreamResponseSubscriber(response, error -> writeFailure(response, error));
        chunks.subscribe().withSubscriber(subscriber);
    }

    private void writeFailure(HttpServerResponse response, Throwable error) {
        if (error instanceof UpstreamStatusException status) {
            response.setStatusCode(status.statusCode()).end(Buffer.buffer(status.body()));
        } else if (error instanceof UpstreamUnreachableException) {
            writeProblem(response, 502, "Bad Gateway", error.getMessage(), null);
        } else if (error instanceof CredentialException credential) {
            LOG.warnv("Upstream authentication failed for {0}: {1}", credential.upstream(), error.getMessage());
            writeProblem(
                    response,
                    502,
                    "Upstream Authentication Failed",
                    "Could not authenticate to upstream " + credential.upstream(),
                    null);
        } else {
            LOG.errorv(error, "Streaming request failed");
            writeProblem(response, 500, "Internal Server Error", "Streaming request failed", null);
        }
    }

    private void writeProblem(HttpServerResponse response, int status, String title, String detail, String reason) {
        if (response.ended() || response.closed()) {
            return;
        }
        var problem = objectMapper.createObjectNode();
        problem.put("title", title);
        problem.put("status", status);
        problem.put("detail", detail);
        if (reason != null) {
            problem.put(GatewayProblem.REASON, reason);
        }
        try {
            response.setStatusCode(status)
                    .putHeader("Content-Type", PROBLEM_JSON)
                    .end(Buffer.buffer(objectMapper.writeValueAsBytes(problem)));
        } catch (JsonProcessingException e) {
            response.setStatusCode(status).end();
        }
    }

    private RequestContext toRequestContext(RoutingContext ctx, String method, String subPath, Buffer body) {
        return new RequestContext(
                method,
                subPath,
                toMap(ctx.queryParams(), new LinkedHashMap<>()),
                ctx.request().query(),
                toMap(ctx.request().headers(), new HashMap<>()),
                body == null ? null : body.getBytes());
    }

    private static Map<String, List<String>> toMap(MultiMap multiMap, Map<String, List<String>> target) {
        for (var name : multiMap.names()) {
            target.put(name, List.copyOf(multiMap.getAll(name)));
        }
        return target;
    }
}
