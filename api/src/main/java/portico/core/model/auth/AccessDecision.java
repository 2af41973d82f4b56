package portico.core.model.auth;

/**
 * Outcome of a permission or role check.
 */
public sealed interface AccessDecision {

    String RULE_NOT_FOUND = "rule_not_found";
    String PERMISSION_DENIED = "permission_denied";
    String ROLE_DENIED = "role_denied";

    static AccessDecision allow() {
        return Allow.INSTANCE;
    }

    static AccessDecision deny(String reason) {
        return new Deny(reason);
    }

    default boolean allowed() {
        return this instanceof Allow;
    }

    final class Allow implements AccessDecision {
        private static final Allow INSTANCE = new Allow();

        private Allow() {}

        @Override
        public String toString() {
            return "Allow";
        }
    }

    /**
     * @param reason stable, machine-readable reason code
     */
    record Deny(String reason) implements AccessDecision {}
}
