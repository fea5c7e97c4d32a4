package org.routemap.routing.core;

/**
 * Enumerator configuration derived from a {@link DistancePolicy}.
 *
 * @param cumulative include every route whose consumption stays within the bound, not only
 *                   those that exhaust it exactly.
 * @param weighted consume the edge weight per leg instead of one unit per stop.
 */
public record EnumerationMode(boolean cumulative, boolean weighted) {

    /**
     * Budget consumed by traversing one edge of the given weight.
     */
    int consumption(int edgeWeight) {
        return weighted ? edgeWeight : 1;
    }
}
