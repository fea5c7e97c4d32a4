package org.routemap.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping contract between external stop ids and dense internal stop indices.
 */
public interface StopIdMapper {

    /**
     * Converts an external stop id to its internal index.
     * @param stopId The client-facing stop id.
     * @return The internal index.
     * @throws UnknownStopException If the stop is not mapped.
     */
    int toInternal(String stopId) throws UnknownStopException;

    /**
     * Converts an internal index back to the external stop id.
     * @param index The internal index.
     * @return The client-facing stop id.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String toExternal(int index);

    /**
     * Checks whether an external stop id is mapped.
     *
     * @param stopId stop id to test.
     * @return true when the stop is present.
     */
    boolean containsExternal(String stopId);

    /**
     * Returns number of mapped stops.
     *
     * @return mapping size.
     */
    int size();

    /**
     * Thrown when an external stop id has no internal index.
     */
    @StandardException
    class UnknownStopException extends RuntimeException {
    }

    /**
     * Creates an immutable mapper where each stop's index is its position in {@code stopIds}.
     *
     * @param stopIds distinct stop ids in index order.
     * @return An immutable mapper instance.
     */
    static StopIdMapper ofOrdered(List<String> stopIds) {
        return new FastUtilStopIdMapper(stopIds);
    }
}
