package io.mindmesh.balancer;

import java.util.Locale;

public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    RANDOM,
    LEAST_LOADED,
    WEIGHTED,
    PERFORMANCE_BASED;

    /**
     * Accepts {@code round_robin}, {@code round-robin} and {@code ROUND_ROBIN} alike.
     */
    public static LoadBalancingStrategy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("strategy cannot be empty");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown strategy: " + raw + " (expected one of round_robin, random, "
                    + "least_loaded, weighted, performance_based)");
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
