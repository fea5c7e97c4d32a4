package org.routemap.routing.core;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.util.NoSuchElementException;

/**
 * Outcome of a distance query: either a distance or the distinguished "no such route" case.
 *
 * <p>A missing route is an ordinary answer, not an error, so it is modelled as a value.</p>
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RouteResult {
    public static final String NO_SUCH_ROUTE_TEXT = "NO SUCH ROUTE";

    private static final RouteResult NO_SUCH_ROUTE = new RouteResult(false, 0L);

    private final boolean found;
    private final long distance;

    public static RouteResult of(long distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("distance must be >= 0, got " + distance);
        }
        return new RouteResult(true, distance);
    }

    public static RouteResult noSuchRoute() {
        return NO_SUCH_ROUTE;
    }

    public boolean isFound() {
        return found;
    }

    /**
     * @throws NoSuchElementException when there is no route.
     */
    public long getDistance() {
        if (!found) {
            throw new NoSuchElementException(NO_SUCH_ROUTE_TEXT);
        }
        return distance;
    }

    public long orElse(long fallback) {
        return found ? distance : fallback;
    }

    /**
     * The distance in decimal, or {@value #NO_SUCH_ROUTE_TEXT}.
     */
    @Override
    public String toString() {
        return found ? Long.toString(distance) : NO_SUCH_ROUTE_TEXT;
    }
}
