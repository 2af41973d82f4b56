package portico.core.model.routing;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Declarative routing rule for one upstream.
 *
 * <p>Rules are loaded once at startup and never change afterwards.
 *
 * @param pathPattern          regular expression matched against the start of the sub-path
 * @param method               HTTP verb or {@code *}
 * @param permission           required permissions
 * @param role                 required role keys
 * @param straightforward      forward headers, query and body unchanged instead of parsing the body
 * @param streaming            relay the response as an open-ended chunked stream
 * @param upstreamPathOverride literal path sent upstream in place of the matched sub-path
 * @param preProcessors        hook names run before forwarding, in order
 * @param postProcessors       hook names run after forwarding, in order
 * @param description          free-form description for logs
 */
public record ProxyRule(
        Pattern pathPattern,
        String method,
        AccessRequirement permission,
        AccessRequirement role,
        boolean straightforward,
        boolean streaming,
        Optional<String> upstreamPathOverride,
        List<String> preProcessors,
        List<String> postProcessors,
        String description) {

    public static final String ANY_METHOD = "*";

    public ProxyRule {
        if (pathPattern == null) {
            throw new IllegalArgumentException("pathPattern is required");
        }
        if (method == null || method.isBlank()) {
            method = ANY_METHOD;
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        if (permission == null) {
            permission = new AccessRequirement.None();
        }
        if (role == null) {
            role = new AccessRequirement.None();
        }
        if (upstreamPathOverride == null) {
            upstreamPathOverride = Optional.empty();
        }
        preProcessors = preProcessors == null ? List.of() : List.copyOf(preProcessors);
        postProcessors = postProcessors == null ? List.of() : List.copyOf(postProcessors);
        if (description == null) {
            description = "";
        }
        if (streaming && !postProcessors.isEmpty()) {
            throw new IllegalArgumentException(
                    "Streaming rule '%s' cannot declare post-processors".formatted(pathPattern.pattern()));
        }
    }

    public boolean acceptsMethod(String requestMethod) {
        return ANY_METHOD.equals(method) || method.equalsIgnoreCase(requestMethod);
    }

    public static Builder builder(String pathPattern) {
        return new Builder(pathPattern);
    }

    public static final class Builder {
        private final String pathPattern;
        private String method = ANY_METHOD;
        private AccessRequirement permission = new AccessRequirement.None();
        private AccessRequirement role = new AccessRequirement.None();
        private boolean straightforward;
        private boolean streaming;
        private String upstreamPathOverride;
        private List<String> preProcessors = List.of();
        private List<String> postProcessors = List.of();
        private String description = "";

        private Builder(String pathPattern) {
            this.pathPattern = pathPattern;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder permission(AccessRequirement permission) {
            this.permission = permission;
            return this;
        }

        public Builder role(AccessRequirement role) {
            this.role = role;
            return this;
        }

        public Builder straightforward(boolean straightforward) {
            this.straightforward = straightforward;
            return this;
        }

        public Builder streaming(boolean streaming) {
            this.streaming = streaming;
            return this;
        }

        public Builder upstreamPathOverride(String upstreamPathOverride) {
            this.upstreamPathOverride = upstreamPathOverride;
            return this;
        }

        public Builder preProcessors(List<String> preProcessors) {
            this.preProcessors = preProcessors;
            return this;
        }

        public Builder postProcessors(List<String> postProcessors) {
            this.postProcessors = postProcessors;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public ProxyRule build() {
            return new ProxyRule(
                    Pattern.compile(pathPattern),
                    method,
                    permission,
                    role,
                    straightforward,
                    streaming,
                    Optional.ofNullable(upstreamPathOverride).filter(p -> !p.isBlank()),
                    preProcessors,
                    postProcessors,
                    description);
        }
    }
}
