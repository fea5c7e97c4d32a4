package org.routemap.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Arrays;

/**
 * Immutable walk through the network expressed as internal stop indices.
 *
 * <p>Equality is structural: two routes are equal when they visit the same stops in the
 * same order.</p>
 */
public final class Route {
    private final int[] stops;

    private Route(int[] stops) {
        this.stops = stops;
    }

    /**
     * Snapshots the given stop sequence.
     *
     * @throws IllegalArgumentException when the sequence is empty.
     */
    public static Route of(IntList stops) {
        if (stops.isEmpty()) {
            throw new IllegalArgumentException("route must contain at least one stop");
        }
        return new Route(stops.toIntArray());
    }

    public static Route of(int... stops) {
        if (stops.length == 0) {
            throw new IllegalArgumentException("route must contain at least one stop");
        }
        return new Route(stops.clone());
    }

    public int stopCount() {
        return stops.length;
    }

    /** Number of traversed edges. */
    public int legCount() {
        return stops.length - 1;
    }

    public int stopAt(int position) {
        return stops[position];
    }

    public int firstStop() {
        return stops[0];
    }

    public int lastStop() {
        return stops[stops.length - 1];
    }

    public int[] toStopArray() {
        return stops.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Route)) {
            return false;
        }
        return Arrays.equals(stops, ((Route) o).stops);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(stops);
    }

    @Override
    public String toString() {
        return "Route" + Arrays.toString(stops);
    }
}
