package portico.core.model.auth;

import java.util.List;
import java.util.Set;

/**
 * Row visibility predicate handed to the storage layer.
 *
 * <p>The gateway builds these but never runs them against storage. An empty
 * scope set is {@link MatchNone}, never "no filter".
 */
public sealed interface DataScopePredicate {

    /**
     * Evaluate the predicate for a single scope value.
     *
     * @param scopeValue the row's scope column value (may be null)
     * @return true if the row is visible
     */
    boolean matches(Object scopeValue);

    record MatchAll() implements DataScopePredicate {
        @Override
        public boolean matches(Object scopeValue) {
            return true;
        }
    }

    record MatchNone() implements DataScopePredicate {
        @Override
        public boolean matches(Object scopeValue) {
            return false;
        }
    }

    /**
     * OR of equality checks of {@code entity.column} against each id.
     */
    record ScopeIn(String entity, String column, Set<String> ids) implements DataScopePredicate {
        public ScopeIn {
            if (ids == null || ids.isEmpty()) {
                throw new IllegalArgumentException("ScopeIn requires at least one id, use MatchNone instead");
            }
            ids = Set.copyOf(ids);
        }

        public static ScopeIn of(String entity, String column, List<String> ids) {
            return new ScopeIn(entity, column, Set.copyOf(ids));
        }

        @Override
        public boolean matches(Object scopeValue) {
            return scopeValue != null && ids.contains(scopeValue.toString());
        }
    }
}
