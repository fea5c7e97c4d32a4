package org.routemap.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.slf4j.Slf4j;
import org.routemap.core.RouteMapException;
import org.routemap.network.TransitNetwork;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Exhaustive, bound-limited route search.
 *
 * <p>Expands every walk leaving a source stop depth-first, using an explicit worklist rather
 * than native recursion. Each leg consumes budget according to the {@link EnumerationMode}:
 * one unit per stop, or the edge weight. A leg is only taken when its consumption fits in the
 * remaining budget. Cycles are followed like any other edge. Zero-weight legs keep the budget
 * unchanged in weighted mode; they are followed unless they close a cycle of zero-consumption
 * legs, which is rejected because the walk could never exhaust its budget.</p>
 *
 * <p>Collected routes:</p>
 * <ul>
 * <li>every walk whose remaining budget reaches exactly zero;</li>
 * <li>in cumulative mode, additionally every walk visited on the way.</li>
 * </ul>
 * <p>A single stop is a starting point, never a result. Duplicate stop sequences collapse;
 * iteration order of the result is discovery order.</p>
 */
@Slf4j
public final class RouteEnumerator {
    public static final String REASON_NEGATIVE_BOUND = "NEGATIVE_BOUND";
    public static final String REASON_ZERO_WEIGHT_CYCLE = "ZERO_WEIGHT_CYCLE";

    private final EnumerationBudget budget;

    public RouteEnumerator() {
        this(EnumerationBudget.unlimited());
    }

    public RouteEnumerator(EnumerationBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Enumerates the distinct routes leaving {@code source} within {@code bound}.
     *
     * @param network network to walk.
     * @param source internal index of the starting stop.
     * @param bound traversal budget, {@code >= 0}.
     * @param mode consumption and inclusion rules.
     * @return unmodifiable set of routes with at least one leg.
     * @throws RouteMapException when the bound is negative, the budget is exhausted, or a
     *                           zero-weight cycle is reachable in weighted mode.
     */
    public Set<Route> enumerate(TransitNetwork network, int source, int bound, EnumerationMode mode) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(mode, "mode");
        if (bound < 0) {
            throw new RouteMapException(REASON_NEGATIVE_BOUND, "bound must be >= 0, got " + bound);
        }

        Set<Route> routes = new LinkedHashSet<>();
        Deque<Frame> worklist = new ArrayDeque<>();
        worklist.push(new Frame(source, bound, null, 1));

        while (!worklist.isEmpty()) {
            Frame frame = worklist.pop();

            if (frame.remaining() == 0) {
                collect(routes, frame);
                continue;
            }
            if (mode.cumulative()) {
                collect(routes, frame);
            }

            // pushed in reverse so successors are expanded in ascending order
            IntList successors = network.successors(frame.stop());
            for (int i = successors.size() - 1; i >= 0; i--) {
                int next = successors.getInt(i);
                int consumption = mode.consumption(network.edgeWeight(frame.stop(), next));
                if (consumption == 0) {
                    checkNoZeroCycle(network, frame, next);
                }
                if (consumption <= frame.remaining()) {
                    worklist.push(new Frame(next, frame.remaining() - consumption, frame, frame.stopCount() + 1));
                }
            }
            budget.checkFrontierSize(worklist.size());
        }

        log.debug("Enumerated {} routes from stop {} (bound={}, mode={})",
                routes.size(), network.stopId(source), bound, mode);
        return Collections.unmodifiableSet(routes);
    }

    /**
     * Frames sharing {@code frame}'s remaining budget were reached through zero-consumption legs;
     * another such leg back to any of them closes a cycle that never consumes budget.
     */
    private static void checkNoZeroCycle(TransitNetwork network, Frame frame, int next) {
        for (Frame cursor = frame; cursor != null && cursor.remaining() == frame.remaining(); cursor = cursor.parent()) {
            if (cursor.stop() == next) {
                throw new RouteMapException(
                        REASON_ZERO_WEIGHT_CYCLE,
                        "zero-weight cycle through stop " + network.stopId(next) + " cannot be enumerated by distance"
                );
            }
        }
    }

    private void collect(Set<Route> routes, Frame frame) {
        if (frame.stopCount() < 2) {
            return;
        }
        if (routes.add(frame.toRoute())) {
            budget.checkRouteCount(routes.size());
        }
    }

    /**
     * Worklist entry: a walk ending at {@code stop}, linked to its prefix through {@code parent}.
     */
    private record Frame(int stop, int remaining, Frame parent, int stopCount) {

        Route toRoute() {
            int[] stops = new int[stopCount];
            Frame cursor = this;
            for (int i = stopCount - 1; i >= 0; i--) {
                stops[i] = cursor.stop;
                cursor = cursor.parent;
            }
            return Route.of(stops);
        }
    }
}
