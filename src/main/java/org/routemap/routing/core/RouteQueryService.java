package org.routemap.routing.core;

import java.util.List;

/**
 * Query contract over a transit network. Stops are addressed by external id.
 */
public interface RouteQueryService {

    /**
     * Total weight of a fully specified route.
     *
     * @param routeText concatenated single-character stop ids ({@code "ABC"}) or
     *                  {@code -}-separated stop ids ({@code "A-B-C"}).
     * @return the summed weight, or no-such-route when a leg has no edge or the route is a
     *         single stop.
     */
    RouteResult routeLength(String routeText);

    /**
     * Total weight of the route visiting {@code stopIds} in order.
     */
    RouteResult routeLength(List<String> stopIds);

    /**
     * Number of distinct routes from source to target within the bound.
     */
    int countRoutes(String sourceStopId, String targetStopId, int bound, DistancePolicy policy);

    int countRoutes(RouteCountRequest request);

    /**
     * Distinct routes leaving {@code sourceStopId} within the bound, each rendered as
     * {@code -}-joined stop ids.
     */
    List<String> findRoutes(String sourceStopId, int bound, DistancePolicy policy);

    /**
     * Weight of the lightest route from source to target. When both are the same stop the
     * route must leave and return, so the answer is the lightest cycle through it.
     */
    RouteResult shortestRoute(String sourceStopId, String targetStopId);
}
