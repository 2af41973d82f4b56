package portico.core.model.auth;

import java.util.List;
import java.util.Set;

/**
 * Resolved identity of the caller of an inbound request.
 *
 * @param userId      caller's unique id
 * @param permissions permission strings held
 * @param roles       role keys held
 * @param admin       administrators pass every permission and role check
 * @param scopeIds    ids of the resources (agents, workspaces) the caller may act on
 */
public record CallerIdentity(
        String userId, Set<String> permissions, Set<String> roles, boolean admin, List<String> scopeIds) {

    /**
     * Permission marker granting every permission check.
     */
    public static final String ALL_PERMISSIONS = "*:*:*";

    public CallerIdentity {
        if (userId == null) {
            userId = "";
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        scopeIds = scopeIds == null ? List.of() : List.copyOf(scopeIds);
    }

    public static CallerIdentity anonymous() {
        return new CallerIdentity("", Set.of(), Set.of(), false, List.of());
    }
}
