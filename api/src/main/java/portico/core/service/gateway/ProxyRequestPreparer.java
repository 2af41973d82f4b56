package portico.core.service.gateway;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;

import portico.core.config.IdentityConfig;
import portico.core.model.gateway.Body;
import portico.core.model.gateway.RequestContext;
import portico.core.model.gateway.StreamRequest;
import portico.core.model.gateway.UpstreamRequest;
import portico.core.model.routing.RuleMatch;

/**
 * Builds upstream requests from inbound requests.
 *
 * <p>Straightforward rules copy the inbound headers (minus hop-by-hop, client-specific and trusted
 * identity headers), the raw query string and the body bytes. Structured rules send the decoded query parameters and
 * the payload, JSON payloads re-serialized with {@code Content-Type: application/json}.
 */
@ApplicationScoped
public class ProxyRequestPreparer {

    /**
     * HTTP hop-by-hop headers that must not be forwarded (RFC 2616 Section 13.5.1).
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    /**
     * Set by the client for the gateway, never meant for the upstream.
     */
    private static final Set<String> CLIENT_HEADERS = Set.of("host", "content-length", "authorization");

    /**
     * Methods a structured rule can forward.
     */
    public static final Set<String> STRUCTURED_METHODS = Set.of("GET", "POST", "PUT", "DELETE");

    public static final String CONTENT_TYPE = "Content-Type";
    static final String ACCEPT = "Accept";
    public static final String APPLICATION_JSON = "application/json";
    static final String EVENT_STREAM = "text/event-stream";
    public static final String AUTHORIZATION = "Authorization";

    /**
     * Identity headers stripped when no configuration is given.
     */
    static final Set<String> DEFAULT_IDENTITY_HEADERS = Set.of(
            "X-Caller-Id", "X-Caller-Permissions", "X-Caller-Roles", "X-Caller-Admin", "X-Caller-Scope-Ids");

    private final ObjectMapper objectMapper;
    private final Set<String> identityHeaders;

    @Inject
    public ProxyRequestPreparer(ObjectMapper objectMapper, IdentityConfig identity) {
        this(
                objectMapper,
                Stream.of(
                                identity.userIdHeader(),
                                identity.permissionsHeader(),
                                identity.rolesHeader(),
                                identity.adminHeader(),
                                identity.scopeIdsHeader())
                        .collect(Collectors.toSet()));
    }

    public ProxyRequestPreparer(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_IDENTITY_HEADERS);
    }

    public ProxyRequestPreparer(ObjectMapper objectMapper, Set<String> identityHeaders) {
        this.objectMapper = objectMapper;
        this.identityHeaders = identityHeaders.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean canForward(RuleMatch match, String method) {
        return match.rule().straightforward() || STRUCTURED_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    public UpstreamRequest prepare(RuleMatch match, RequestContext request, Body payload) {
        var target = match.upstream().resolve(match.upstreamPath(), query(match, request));
        var headers = headers(match, request, payload);
        return new UpstreamRequest(request.method(), target, headers, payload.toBytes(objectMapper));
    }

    public StreamRequest prepareStream(RuleMatch match, RequestContext request, Body payload) {
        var target = match.upstream().resolve(match.upstreamPath(), query(match, request));
        var headers = headers(match, request, payload);
        headers.keySet().removeIf(ACCEPT::equalsIgnoreCase);
        headers.put(ACCEPT, List.of(EVENT_STREAM));
        return new StreamRequest(request.method(), target, headers, payload.toBytes(objectMapper));
    }

    /**
     * Filters hop-by-hop headers from a response.
     * Call this when processing upstream responses before returning to the client.
     */
    public Map<String, List<String>> filterResponseHeaders(Map<String, List<String>> responseHeaders) {
        Map<String, List<String>> filtered = new HashMap<>();
        for (var entry : responseHeaders.entrySet()) {
            var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP_HEADERS.contains(lowerName) && !"content-length".equals(lowerName)) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }

    private Map<String, List<String>> headers(RuleMatch match, RequestContext request, Body payload) {
        Map<String, List<String>> headers = new HashMap<>();
        if (match.rule().straightforward()) {
            copyFilteredHeaders(request, headers);
            return headers;
        }
        if (payload instanceof Body.Json) {
            headers.put(CONTENT_TYPE, List.of(APPLICATION_JSON));
        } else if (!payload.isEmpty()) {
            var contentType = request.getHeaderString(CONTENT_TYPE);
            if (contentType != null) {
                headers.put(CONTENT_TYPE, List.of(contentType));
            }
        }
        return headers;
    }

    private void copyFilteredHeaders(RequestContext request, Map<String, List<String>> headers) {
        for (var entry : request.headers().entrySet()) {
            var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName)
                    || CLIENT_HEADERS.contains(lowerName)
                    || identityHeaders.contains(lowerName)) {
                continue;
            }
            headers.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
    }

    private String query(RuleMatch match, RequestContext request) {
        if (match.rule().straightforward()) {
            return request.rawQuery();
        }
        if (request.queryParams().isEmpty()) {
            return null;
        }
        var joiner = new StringJoiner("&");
        for (var entry : request.queryParams().entrySet()) {
            var name = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            for (var value : entry.getValue()) {
                joiner.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        return joiner.toString();
    }
}
