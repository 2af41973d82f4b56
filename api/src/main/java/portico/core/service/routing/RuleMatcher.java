package portico.core.service.routing;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import portico.core.model.routing.ProxyRule;
import portico.core.model.routing.RuleMatch;
import portico.core.model.upstream.Upstream;

/**
 * Select the rule governing a request.
 *
 * <p>A rule applies when its method accepts the request method and its pattern matches a
 * non-empty prefix of the sub-path. Among applicable rules the longest matched prefix wins;
 * on equal length the rule registered first wins.
 */
@ApplicationScoped
public class RuleMatcher {

    /**
     * Find the rule for a request.
     *
     * @param upstream the upstream whose rule table is searched
     * @param subPath  the request path below the upstream prefix (e.g., "/v1/kb/list")
     * @param method   the HTTP method (e.g., "POST")
     * @return the selected rule, or empty if none applies
     */
    public Optional<RuleMatch> match(Upstream upstream, String subPath, String method) {
        RuleMatch best = null;
        for (var rule : upstream.rules()) {
            if (!rule.acceptsMethod(method)) {
                continue;
            }
            var length = matchedLength(rule, subPath);
            // strictly longer only, so earlier rules keep ties
            if (length > 0 && (best == null || length > best.matchedLength())) {
                best = new RuleMatch(upstream, rule, length, subPath);
            }
        }
        return Optional.ofNullable(best);
    }

    private int matchedLength(ProxyRule rule, String subPath) {
        var matcher = rule.pathPattern().matcher(subPath);
        return matcher.lookingAt() ? matcher.end() : 0;
    }
}
