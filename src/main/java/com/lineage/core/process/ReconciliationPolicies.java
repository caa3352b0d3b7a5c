package com.lineage.core.process;

import java.util.List;

/**
 * Creates a {@link ReconciliationPolicy} from its configured strategy name.
 */
public final class ReconciliationPolicies {

    public static final List<String> STRATEGIES = List.of("none", "n-commits", "n-trunk-commits", "token-count");

    private ReconciliationPolicies() {}

    public static ReconciliationPolicy create(String strategy, int interval, long tokenThreshold) {
        return switch (strategy) {
            case "none" -> ReconciliationPolicy.NONE;
            case "n-commits" -> new NCommitsPolicy(requirePositive(interval, "interval"));
            case "n-trunk-commits" -> new NTrunkCommitsPolicy(requirePositive(interval, "interval"));
            case "token-count" -> new TokenCountPolicy(requirePositive(tokenThreshold, "token threshold"));
            default -> throw new IllegalArgumentException("Unknown reconciliation strategy '" + strategy
                    + "'. Valid strategies: " + String.join(", ", STRATEGIES));
        };
    }

    private static <N extends Number> N requirePositive(N value, String name) {
        if (value.longValue() < 1) {
            throw new IllegalArgumentException("Reconciliation " + name + " must be at least 1, got " + value);
        }
        return value;
    }
}
