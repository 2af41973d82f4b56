package portico.adapter.in.rest;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import portico.adapter.in.problem.GatewayProblem;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.RequestContext;
import portico.core.port.in.GatewayUseCase;
import portico.core.port.out.CallerIdentityResolver;

/**
 * Inbound surface for buffered requests: {@code /proxy/{upstream}/{subPath}}.
 *
 * <p>Requests served by streaming rules are taken over earlier by
 * {@link portico.adapter.in.http.StreamingRouteFilter}.
 */
@Path("/" + GatewayResource.MOUNT)
@ApplicationScoped
public class GatewayResource {

    public static final String MOUNT = "proxy";

    private final GatewayUseCase gatewayUseCase;
    private final CallerIdentityResolver identityResolver;

    @Inject
    public GatewayResource(GatewayUseCase gatewayUseCase, CallerIdentityResolver identityResolver) {
        this.gatewayUseCase = gatewayUseCase;
        this.identityResolver = identityResolver;
    }

    @GET
    @Path("{path:.*}")
    public Uni<Response> proxyGet(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext) {
        return proxyRequest(path, requestContext, null);
    }

    @POST
    @Path("{path:.*}")
    public Uni<Response> proxyPost(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext,
            byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @PUT
    @Path("{path:.*}")
    public Uni<Response> proxyPut(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext,
            byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @DELETE
    @Path("{path:.*}")
    public Uni<Response> proxyDelete(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext,
            byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @PATCH
    @Path("{path:.*}")
    public Uni<Response> proxyPatch(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext,
            byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @HEAD
    @Path("{path:.*}")
    public Uni<Response> proxyHead(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext) {
        return proxyRequest(path, requestContext, null);
    }

    @OPTIONS
    @Path("{path:.*}")
    public Uni<Response> proxyOptions(
            @PathParam("path") String path,
            @Context ContainerRequestContext requestContext) {
        return proxyRequest(path, requestContext, null);
    }

    private Uni<Response> proxyRequest(String path, ContainerRequestContext requestContext, byte[] body) {
        var target = Target.of(path);
        var request = toRequestContext(target.subPath(), requestContext, body);
        var identity = identityResolver.resolve(request.headers());
        return gatewayUseCase.forward(target.upstream(), request, identity).map(result -> toResponse(target.upstream(), result));
    }

    private RequestContext toRequestContext(String path, ContainerRequestContext requestContext, byte[] body) {
        var headers = new HashMap<String, List<String>>();
        for (var entry : requestContext.getHeaders().entrySet()) {
            headers.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        Map<String, List<String>> query = new LinkedHashMap<>();
        for (var entry : requestContext.getUriInfo().getQueryParameters().entrySet()) {
            query.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        return new RequestContext(
                requestContext.getMethod(),
                path,
                query,
                requestContext.getUriInfo().getRequestUri().getRawQuery(),
                headers,
                body);
    }

    private Response toResponse(String upstream, GatewayResult result) {
        if (result instanceof GatewayResult.Success success) {
            var responseBuilder = Response.status(success.statusCode());
            for (var entry : success.headers().entrySet()) {
                for (var value : entry.getValue()) {
                    responseBuilder.header(entry.getKey(), value);
                }
            }
            if (success.body().length > 0) {
                responseBuilder.entity(success.body());
            }
            return responseBuilder.build();
        }
        if (result instanceof GatewayResult.Forbidden forbidden) {
            throw GatewayProblem.forbidden(forbidden.reason());
        }
        if (result instanceof GatewayResult.MethodNotAllowed notAllowed) {
            throw GatewayProblem.methodNotAllowed(notAllowed.method());
        }
        if (result instanceof GatewayResult.Aborted aborted) {
            throw GatewayProblem.aborted(aborted.statusCode(), aborted.reason());
        }
        if (result instanceof GatewayResult.PostProcessingFailed failed) {
            throw GatewayProblem.internalError("Response processing failed in " + failed.processor());
        }
        if (result instanceof GatewayResult.UpstreamUnreachable unreachable) {
            throw GatewayProblem.upstreamUnreachable(upstream, unreachable.message());
        }
        // Streaming results are cold and never subscribed here
        throw GatewayProblem.internalError("Streaming route reached the buffered handler");
    }

    /**
     * Upstream name and sub-path of a path below the mount. A missing upstream is empty and a
     * missing sub-path is {@code /}.
     */
    public record Target(String upstream, String subPath) {

        public static Target of(String path) {
            var rest = path == null ? "" : path;
            while (rest.startsWith("/")) {
                rest = rest.substring(1);
            }
            int slash = rest.indexOf('/');
            if (slash < 0) {
                return new Target(rest, "/");
            }
            return new Target(rest.substring(0, slash), rest.substring(slash));
        }
    }
}
