package org.routemap.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Client-facing route counting request.
 *
 * <p>Stops are expressed as external ids.</p>
 */
@Value
@Builder
public class RouteCountRequest {
    /** Stop the routes start from. */
    String sourceStopId;
    /** Stop the routes must end at. */
    String targetStopId;
    /** Stop count or total weight limit, depending on {@link #policy}. */
    int bound;
    /** How {@link #bound} is interpreted. */
    DistancePolicy policy;
}
