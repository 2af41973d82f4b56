package portico.core.model.routing;

import portico.core.model.upstream.Upstream;

/**
 * A rule selected for a request.
 *
 * @param upstream      the upstream owning the rule
 * @param rule          the matched rule
 * @param matchedLength number of leading sub-path characters matched by the rule's pattern
 * @param subPath       the request sub-path that was matched
 */
public record RuleMatch(Upstream upstream, ProxyRule rule, int matchedLength, String subPath) {

    public RuleMatch {
        if (upstream == null) {
            throw new IllegalArgumentException("Upstream cannot be null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("Rule cannot be null");
        }
    }

    /**
     * Path sent to the upstream: the override when configured, otherwise the sub-path.
     */
    public String upstreamPath() {
        return rule.upstreamPathOverride().orElse(subPath);
    }
}
