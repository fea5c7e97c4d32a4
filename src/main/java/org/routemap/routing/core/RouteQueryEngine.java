package org.routemap.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.routemap.core.RouteMapException;
import org.routemap.core.id.StopIdMapper;
import org.routemap.network.TransitNetwork;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Default {@link RouteQueryService} over one immutable {@link TransitNetwork}.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate request shape and translate external stop ids into network indices.</li>
 * <li>Route counting: map the {@link DistancePolicy} to an {@link EnumerationMode}, enumerate
 * with {@link RouteEnumerator}, keep the routes ending at the target.</li>
 * <li>Shortest route: delegate to the network's shortest-path primitive, except when source and
 * target coincide, where the trivial zero-length path is replaced by the lightest cycle.</li>
 * </ul>
 * <p>Stops the network does not know produce "no route" answers, never lookup exceptions.</p>
 */
@Slf4j
public final class RouteQueryEngine implements RouteQueryService {
    public static final String REASON_MALFORMED_ROUTE = "MALFORMED_ROUTE";
    public static final String REASON_POLICY_REQUIRED = "POLICY_REQUIRED";
    public static final String REASON_STOP_ID_REQUIRED = "STOP_ID_REQUIRED";
    public static final String REASON_REQUEST_REQUIRED = "REQUEST_REQUIRED";

    static final String ROUTE_SEPARATOR = "-";

    private final TransitNetwork network;
    private final RouteEnumerator enumerator;

    /**
     * Creates an engine with the budget configured through system properties.
     */
    public RouteQueryEngine(TransitNetwork network) {
        this(network, null);
    }

    /**
     * @param network network to answer queries on.
     * @param enumerationBudget optional enumeration guardrails, {@link EnumerationBudget#defaults()} when null.
     */
    @Builder
    public RouteQueryEngine(TransitNetwork network, EnumerationBudget enumerationBudget) {
        this.network = Objects.requireNonNull(network, "network");
        this.enumerator = new RouteEnumerator(
                enumerationBudget == null ? EnumerationBudget.defaults() : enumerationBudget
        );
    }

    @Override
    public RouteResult routeLength(String routeText) {
        return routeLength(parseRouteText(routeText));
    }

    @Override
    public RouteResult routeLength(List<String> stopIds) {
        if (stopIds == null || stopIds.isEmpty()) {
            throw new RouteMapException(REASON_MALFORMED_ROUTE, "a route needs at least one stop: " + stopIds);
        }
        if (stopIds.size() == 1) {
            requireStopId(stopIds.get(0));
            log.debug("No route {}: a single stop traverses no edge", stopIds);
            return RouteResult.noSuchRoute();
        }
        long total = 0L;
        try {
            int from = network.stopIndex(requireStopId(stopIds.get(0)));
            for (int i = 1; i < stopIds.size(); i++) {
                int to = network.stopIndex(requireStopId(stopIds.get(i)));
                total += network.edgeWeight(from, to);
                from = to;
            }
        } catch (StopIdMapper.UnknownStopException | NoSuchElementException ex) {
            log.debug("No route {}: {}", stopIds, ex.getMessage());
            return RouteResult.noSuchRoute();
        }
        return RouteResult.of(total);
    }

    @Override
    public int countRoutes(String sourceStopId, String targetStopId, int bound, DistancePolicy policy) {
        requireStopId(sourceStopId);
        requireStopId(targetStopId);
        EnumerationMode mode = requirePolicy(policy).mode();
        if (!network.containsStop(sourceStopId) || !network.containsStop(targetStopId)) {
            log.debug("countRoutes {} -> {}: unknown stop, no routes", sourceStopId, targetStopId);
            return 0;
        }

        int source = network.stopIndex(sourceStopId);
        int target = network.stopIndex(targetStopId);
        int count = 0;
        for (Route route : enumerator.enumerate(network, source, bound, mode)) {
            if (route.lastStop() == target) {
                count++;
            }
        }
        log.debug("countRoutes {} -> {} (bound={}, policy={}): {}", sourceStopId, targetStopId, bound, policy, count);
        return count;
    }

    @Override
    public int countRoutes(RouteCountRequest request) {
        if (request == null) {
            throw new RouteMapException(REASON_REQUEST_REQUIRED, "route count request must be non-null");
        }
        return countRoutes(request.getSourceStopId(), request.getTargetStopId(), request.getBound(), request.getPolicy());
    }

    @Override
    public List<String> findRoutes(String sourceStopId, int bound, DistancePolicy policy) {
        requireStopId(sourceStopId);
        EnumerationMode mode = requirePolicy(policy).mode();
        if (!network.containsStop(sourceStopId)) {
            return List.of();
        }
        Set<Route> routes = enumerator.enumerate(network, network.stopIndex(sourceStopId), bound, mode);
        List<String> rendered = new ArrayList<>(routes.size());
        for (Route route : routes) {
            rendered.add(render(route));
        }
        return List.copyOf(rendered);
    }

    @Override
    public RouteResult shortestRoute(String sourceStopId, String targetStopId) {
        requireStopId(sourceStopId);
        requireStopId(targetStopId);
        if (!network.containsStop(sourceStopId) || !network.containsStop(targetStopId)) {
            return RouteResult.noSuchRoute();
        }
        int source = network.stopIndex(sourceStopId);
        int target = network.stopIndex(targetStopId);

        if (source != target) {
            OptionalLong length = network.shortestPathLength(source, target);
            return length.isPresent() ? RouteResult.of(length.getAsLong()) : RouteResult.noSuchRoute();
        }
        return shortestCycle(source);
    }

    /**
     * Lightest walk that leaves {@code stop} and returns to it: one leg to a successor plus the
     * shortest path back.
     */
    private RouteResult shortestCycle(int stop) {
        long best = Long.MAX_VALUE;
        IntList successors = network.successors(stop);
        for (int i = 0; i < successors.size(); i++) {
            int next = successors.getInt(i);
            OptionalLong back = network.shortestPathLength(next, stop);
            if (back.isEmpty()) {
                continue;
            }
            best = Math.min(best, network.edgeWeight(stop, next) + back.getAsLong());
        }
        if (best == Long.MAX_VALUE) {
            log.debug("Stop {} lies on no cycle", network.stopId(stop));
            return RouteResult.noSuchRoute();
        }
        return RouteResult.of(best);
    }

    /**
     * Splits route text into stop ids: on {@code -} when present, otherwise one id per character.
     */
    static List<String> parseRouteText(String routeText) {
        if (routeText == null || routeText.isBlank()) {
            throw new RouteMapException(REASON_MALFORMED_ROUTE, "route text must be non-blank");
        }
        String text = routeText.trim();
        List<String> stops = new ArrayList<>();
        if (text.contains(ROUTE_SEPARATOR)) {
            for (String token : text.split(ROUTE_SEPARATOR, -1)) {
                String stop = token.trim();
                if (stop.isEmpty()) {
                    throw new RouteMapException(REASON_MALFORMED_ROUTE, "empty stop in route '" + routeText + "'");
                }
                stops.add(stop);
            }
        } else {
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (Character.isWhitespace(c)) {
                    throw new RouteMapException(REASON_MALFORMED_ROUTE, "whitespace in route '" + routeText + "'");
                }
                stops.add(String.valueOf(c));
            }
        }
        return stops;
    }

    private String render(Route route) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < route.stopCount(); i++) {
            if (i > 0) {
                sb.append(ROUTE_SEPARATOR);
            }
            sb.append(network.stopId(route.stopAt(i)));
        }
        return sb.toString();
    }

    private static String requireStopId(String stopId) {
        if (stopId == null || stopId.isBlank()) {
            throw new RouteMapException(REASON_STOP_ID_REQUIRED, "stop id must be non-blank");
        }
        return stopId;
    }

    private static DistancePolicy requirePolicy(DistancePolicy policy) {
        if (policy == null) {
            throw new RouteMapException(REASON_POLICY_REQUIRED, "distance policy must be non-null");
        }
        return policy;
    }
}
