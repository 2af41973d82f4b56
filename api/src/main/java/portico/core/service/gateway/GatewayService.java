package portico.core.service.gateway;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.auth.AccessDecision;
import portico.core.model.auth.CallerIdentity;
import portico.core.model.gateway.Body;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.RequestContext;
import portico.core.model.gateway.UpstreamResponse;
import portico.core.model.gateway.UpstreamUnreachableException;
import portico.core.model.routing.RuleMatch;
import portico.core.port.in.GatewayUseCase;
import portico.core.port.out.Metrics;
import portico.core.service.auth.PermissionEvaluator;
import portico.core.service.hook.ProcessorRegistry;
import portico.core.service.routing.RuleMatcher;
import portico.core.service.routing.UpstreamRegistry;
import portico.core.service.streaming.StreamingRelay;
import portico.spi.HookAbortedException;
import portico.spi.HookContext;
import portico.spi.PostProcessor;
import portico.spi.PreProcessor;

/**
 * Runs the gateway pipeline for one request.
 *
 * <p>Order: rule match, role check, permission check, data scope, pre-processors, forward or
 * stream, post-processors (2xx answers only). Each step can end the request:
 * <ul>
 *   <li>no rule, unknown upstream or a failed check: 403 with a reason code</li>
 *   <li>a pre-processor abort: the abort's status, nothing is forwarded</li>
 *   <li>a post-processor failure: 500, the upstream effect stays in place</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayService implements GatewayUseCase {

    private static final Logger LOG = Logger.getLogger(GatewayService.class);

    private final UpstreamRegistry upstreamRegistry;
    private final RuleMatcher ruleMatcher;
    private final PermissionEvaluator permissionEvaluator;
    private final ProcessorRegistry processors;
    private final ProxyRequestPreparer requestPreparer;
    private final RequestForwarder forwarder;
    private final StreamingRelay streamingRelay;
    private final Metrics metrics;
    private final ObjectMapper objectMapper;

    @Inject
    public GatewayService(
            UpstreamRegistry upstreamRegistry,
            RuleMatcher ruleMatcher,
            PermissionEvaluator permissionEvaluator,
            ProcessorRegistry processors,
            ProxyRequestPreparer requestPreparer,
            RequestForwarder forwarder,
            StreamingRelay streamingRelay,
            Metrics metrics,
            ObjectMapper objectMapper) {
        this.upstreamRegistry = upstreamRegistry;
        this.ruleMatcher = ruleMatcher;
        this.permissionEvaluator = permissionEvaluator;
        this.processors = processors;
        this.requestPreparer = requestPreparer;
        this.forwarder = forwarder;
        this.streamingRelay = streamingRelay;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isStreamingRoute(String upstream, String subPath, String method) {
        return upstreamRegistry
                .find(upstream)
                .flatMap(u -> ruleMatcher.match(u, normalize(subPath), method))
                .map(match -> match.rule().streaming())
                .orElse(false);
    }

    @Override
    public Uni<GatewayResult> forward(String upstreamName, RequestContext request, CallerIdentity identity) {
        long startTime = System.nanoTime();
        return Uni.createFrom().deferred(() -> run(upstreamName, request, identity)).map(result -> {
            if (result instanceof GatewayResult.Streaming streaming) {
                // A stream's outcome and duration are known only once its chunks end.
                return new GatewayResult.Streaming(streaming.chunks()
                        .onTermination()
                        .invoke((failure, cancelled) ->
                                recordStreamMetrics(upstreamName, request, streaming, failure, startTime)));
            }
            recordMetrics(upstreamName, request, result, startTime);
            return result;
        });
    }

    private Uni<GatewayResult> run(String upstreamName, RequestContext request, CallerIdentity identity) {
        var match = upstreamRegistry
                .find(upstreamName)
                .flatMap(upstream -> ruleMatcher.match(upstream, request.subPath(), request.method()));
        if (match.isEmpty()) {
            LOG.debugv("No rule for {0} {1} on upstream {2}", request.method(), request.subPath(), upstreamName);
            return forbidden(AccessDecision.RULE_NOT_FOUND);
        }
        var matched = match.get();
        var rule = matched.rule();

        var roleDecision = permissionEvaluator.checkRole(identity, rule);
        if (roleDecision instanceof AccessDecision.Deny deny) {
            return forbidden(deny.reason());
        }
        var permissionDecision = permissionEvaluator.checkPermission(identity, rule);
        if (permissionDecision instanceof AccessDecision.Deny deny) {
            return forbidden(deny.reason());
        }
        if (!requestPreparer.canForward(matched, request.method())) {
            return Uni.createFrom().item(new GatewayResult.MethodNotAllowed(request.method()));
        }

        var upstream = matched.upstream();
        var dataScope = permissionEvaluator.buildDataScope(identity, upstream.scopeEntity(), upstream.scopeColumn());
        var hookContext = new HookContext(
                upstream.name(),
                request.subPath(),
                request.method(),
                request.headers(),
                request.queryParams(),
                identity,
                dataScope);
        var payload = rule.straightforward()
                ? Body.raw(request.body())
                : Body.parse(request.body(), objectMapper);

        return runPreProcessors(processors.resolvePre(rule.preProcessors()), hookContext, payload)
                .flatMap(processed -> rule.streaming()
                        ? Uni.createFrom().<GatewayResult>item(
                                new GatewayResult.Streaming(streamingRelay.stream(matched, request, processed)))
                        : forwardAndPostProcess(matched, request, processed, hookContext))
                .onFailure(HookAbortedException.class)
                .recoverWithItem(error -> {
                    var abort = (HookAbortedException) error;
                    LOG.debugv("Request to {0} aborted by pre-processor: {1}", upstream.name(), abort.reason());
                    return new GatewayResult.Aborted(abort.statusCode(), abort.reason());
                })
                .onFailure(UpstreamUnreachableException.class)
                .recoverWithItem(error -> {
                    LOG.warnv("Upstream {0} unreachable: {1}", upstream.name(), error.getMessage());
                    return new GatewayResult.UpstreamUnreachable(error.getMessage());
                });
    }

    private Uni<Body> runPreProcessors(List<PreProcessor> hooks, HookContext context, Body payload) {
        Uni<Body> chain = Uni.createFrom().item(payload);
        for (var hook : hooks) {
            chain = chain.flatMap(body -> hook.process(context, body));
        }
        return chain;
    }

    private Uni<GatewayResult> forwardAndPostProcess(
            RuleMatch match, RequestContext request, Body payload, HookContext context) {
        var hooks = processors.resolvePost(match.rule().postProcessors());
        return forwarder.forward(match, request, payload).flatMap(response -> {
            if (!response.isSuccessful() || hooks.isEmpty()) {
                return Uni.createFrom().item(toSuccess(response));
            }
            return runPostProcessors(hooks, context, Body.parse(response.body(), objectMapper))
                    .map(body -> toSuccess(response, body))
                    .onFailure(PostProcessorFailure.class)
                    .recoverWithItem(error -> {
                        var failure = (PostProcessorFailure) error;
                        LOG.errorv(
                                failure.getCause(),
                                "Post-processor {0} failed for upstream {1}",
                                failure.processor,
                                match.upstream().name());
                        return new GatewayResult.PostProcessingFailed(
                                failure.processor, failure.getCause().getMessage());
                    });
        });
    }

    private Uni<Body> runPostProcessors(List<PostProcessor> hooks, HookContext context, Body body) {
        Uni<Body> chain = Uni.createFrom().item(body);
        for (var hook : hooks) {
            chain = chain.flatMap(current -> Uni.createFrom()
                    .deferred(() -> hook.process(context, current))
                    .onFailure()
                    .transform(error -> new PostProcessorFailure(hook.name(), error)));
        }
        return chain;
    }

    private GatewayResult toSuccess(UpstreamResponse response) {
        return new GatewayResult.Success(response.statusCode(), response.headers(), response.body());
    }

    private GatewayResult toSuccess(UpstreamResponse response, Body body) {
        Map<String, List<String>> headers = new HashMap<>();
        response.headers().forEach((name, values) -> {
            if (!(body instanceof Body.Json) || !ProxyRequestPreparer.CONTENT_TYPE.equalsIgnoreCase(name)) {
                headers.put(name, values);
            }
        });
        if (body instanceof Body.Json) {
            headers.put(ProxyRequestPreparer.CONTENT_TYPE, List.of(ProxyRequestPreparer.APPLICATION_JSON));
        }
        return new GatewayResult.Success(response.statusCode(), headers, body.toBytes(objectMapper));
    }

    private Uni<GatewayResult> forbidden(String reason) {
        return Uni.createFrom().item(new GatewayResult.Forbidden(reason));
    }

    private void recordMetrics(String upstream, RequestContext request, GatewayResult result, long startTime) {
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        metrics.recordGatewayResult(upstream, result);

        if (result instanceof GatewayResult.Success success) {
            metrics.recordRequest(upstream, request.method(), success.statusCode());
            metrics.recordProxyLatency(upstream, request.method(), success.statusCode(), durationMs);
        } else if (result instanceof GatewayResult.Forbidden forbidden) {
            metrics.recordAccessDenied(upstream, forbidden.reason());
        }
    }

    private void recordStreamMetrics(
            String upstream, RequestContext request, GatewayResult result, Throwable failure, long startTime) {
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        int status = failure == null ? 200 : 502;

        metrics.recordGatewayResult(upstream, result);
        metrics.recordRequest(upstream, request.method(), status);
        metrics.recordProxyLatency(upstream, request.method(), status, durationMs);
    }

    private static String normalize(String subPath) {
        if (subPath == null || subPath.isEmpty()) {
            return "/";
        }
        return subPath.startsWith("/") ? subPath : "/" + subPath;
    }

    /**
     * Carries the name of the failing post-processor.
     */
    private static final class PostProcessorFailure extends RuntimeException {
        private final String processor;

        PostProcessorFailure(String processor, Throwable cause) {
            super(cause.getMessage(), cause);
            this.processor = processor;
        }
    }
}
