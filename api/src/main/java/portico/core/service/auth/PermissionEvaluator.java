package portico.core.service.auth;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import portico.core.model.auth.AccessDecision;
import portico.core.model.auth.CallerIdentity;
import portico.core.model.auth.DataScopePredicate;
import portico.core.model.routing.AccessRequirement;
import portico.core.model.routing.ProxyRule;

/**
 * Evaluates a caller's identity against rule requirements and builds data scope predicates.
 *
 * <p>Administrators pass every check. The {@code *:*:*} permission passes every permission check
 * but no role check.
 */
@ApplicationScoped
public class PermissionEvaluator {

    public AccessDecision checkPermission(CallerIdentity identity, ProxyRule rule) {
        var requirement = rule.permission();
        if (requirement instanceof AccessRequirement.None || identity.admin()) {
            return AccessDecision.allow();
        }
        if (identity.permissions().contains(CallerIdentity.ALL_PERMISSIONS)
                || requirement.isSatisfiedBy(identity.permissions())) {
            return AccessDecision.allow();
        }
        return AccessDecision.deny(AccessDecision.PERMISSION_DENIED);
    }

    public AccessDecision checkRole(CallerIdentity identity, ProxyRule rule) {
        var requirement = rule.role();
        if (requirement instanceof AccessRequirement.None || identity.admin()) {
            return AccessDecision.allow();
        }
        if (requirement.isSatisfiedBy(identity.roles())) {
            return AccessDecision.allow();
        }
        return AccessDecision.deny(AccessDecision.ROLE_DENIED);
    }

    /**
     * Build the predicate restricting which records the caller may see.
     *
     * <p>An empty scope set yields {@link DataScopePredicate.MatchNone}, never "no filter".
     *
     * @param identity     the caller
     * @param targetEntity entity the predicate applies to
     * @param scopeColumn  ownership column of the entity
     * @return the predicate
     */
    public DataScopePredicate buildDataScope(CallerIdentity identity, String targetEntity, String scopeColumn) {
        if (identity.admin()) {
            return new DataScopePredicate.MatchAll();
        }
        List<String> ids = identity.scopeIds().stream()
                .filter(id -> id != null && !id.isBlank())
                .toList();
        if (ids.isEmpty()) {
            return new DataScopePredicate.MatchNone();
        }
        return DataScopePredicate.ScopeIn.of(targetEntity, scopeColumn, ids);
    }
}
