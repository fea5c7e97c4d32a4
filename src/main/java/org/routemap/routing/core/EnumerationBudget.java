package org.routemap.routing.core;

import org.routemap.core.RouteMapException;

/**
 * Per-query bounds on enumeration work and memory growth.
 *
 * <p>Exhaustive enumeration grows combinatorially with network density and bound. These
 * limits turn a runaway query into a fast, reason-coded failure instead of an out-of-memory
 * condition.</p>
 */
public final class EnumerationBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_BUDGET_EXCEEDED = "ENUMERATION_BUDGET_EXCEEDED";

    static final String PROP_MAX_ROUTES = "routemap.enumeration.maxRoutes";
    static final String PROP_MAX_FRONTIER = "routemap.enumeration.maxFrontier";

    private static final EnumerationBudget UNLIMITED = new EnumerationBudget(UNBOUNDED, UNBOUNDED);

    private final int maxRoutes;
    private final int maxFrontier;

    private EnumerationBudget(int maxRoutes, int maxFrontier) {
        this.maxRoutes = normalizeBound(maxRoutes);
        this.maxFrontier = normalizeBound(maxFrontier);
    }

    /**
     * Creates a budget with explicit bounds; values {@code <= 0} mean unbounded.
     */
    public static EnumerationBudget of(int maxRoutes, int maxFrontier) {
        return new EnumerationBudget(maxRoutes, maxFrontier);
    }

    public static EnumerationBudget unlimited() {
        return UNLIMITED;
    }

    /**
     * Loads bounds from system properties. Missing or unparsable values are unbounded.
     */
    public static EnumerationBudget defaults() {
        return EnumerationBudget.of(readBound(PROP_MAX_ROUTES), readBound(PROP_MAX_FRONTIER));
    }

    public int maxRoutes() {
        return maxRoutes;
    }

    public int maxFrontier() {
        return maxFrontier;
    }

    void checkRouteCount(int routeCount) {
        if (routeCount > maxRoutes) {
            throw new RouteMapException(
                    REASON_BUDGET_EXCEEDED,
                    "route budget exceeded: " + routeCount + " > " + maxRoutes
            );
        }
    }

    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontier) {
            throw new RouteMapException(
                    REASON_BUDGET_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontier
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "EnumerationBudget{maxRoutes=" + maxRoutes + ", maxFrontier=" + maxFrontier + "}";
    }
}
