package portico.core.model.routing;

import java.util.List;
import java.util.Set;

/**
 * Permission or role requirement attached to a rule.
 *
 * <p>A requirement is one of:
 * <ul>
 *   <li>{@link None} - nothing is required</li>
 *   <li>{@link Single} - one value must be held</li>
 *   <li>{@link Listed} - all values (strict) or any value (non-strict) must be held</li>
 * </ul>
 */
public sealed interface AccessRequirement {

    /**
     * Check the requirement against the values held by a caller.
     *
     * @param held the values held (permissions or role keys)
     * @return true if the requirement is met
     */
    boolean isSatisfiedBy(Set<String> held);

    /**
     * Build a requirement from configured values.
     *
     * <p>Blank values are ignored. No values yields {@link None}, one value
     * yields {@link Single}.
     *
     * @param values configured values
     * @param strict whether every value is required when more than one is given
     * @return the requirement
     */
    static AccessRequirement of(List<String> values, boolean strict) {
        if (values == null) {
            return new None();
        }
        var cleaned = values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
        if (cleaned.isEmpty()) {
            return new None();
        }
        if (cleaned.size() == 1) {
            return new Single(cleaned.get(0));
        }
        return new Listed(cleaned, strict);
    }

    record None() implements AccessRequirement {
        @Override
        public boolean isSatisfiedBy(Set<String> held) {
            return true;
        }
    }

    record Single(String value) implements AccessRequirement {
        public Single {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("value is required");
            }
        }

        @Override
        public boolean isSatisfiedBy(Set<String> held) {
            return held.contains(value);
        }
    }

    record Listed(List<String> values, boolean strict) implements AccessRequirement {
        public Listed {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("values cannot be empty");
            }
            values = List.copyOf(values);
        }

        @Override
        public boolean isSatisfiedBy(Set<String> held) {
            if (strict) {
                return held.containsAll(values);
            }
            return values.stream().anyMatch(held::contains);
        }
    }
}
