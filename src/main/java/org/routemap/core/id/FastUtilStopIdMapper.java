package org.routemap.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * fastutil-backed {@link StopIdMapper}.
 * <p>
 * Immutable after construction and safe for concurrent reads.
 */
public class FastUtilStopIdMapper implements StopIdMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapper; the index of each stop is its list position.
     *
     * @throws IllegalArgumentException on null, blank or duplicate stop ids.
     */
    public FastUtilStopIdMapper(List<String> stopIds) {
        if (stopIds == null) {
            throw new IllegalArgumentException("Stop ids cannot be null");
        }
        this.forward = new Object2IntOpenHashMap<>(stopIds.size());
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[stopIds.size()];

        for (int i = 0; i < stopIds.size(); i++) {
            String stopId = stopIds.get(i);
            if (stopId == null || stopId.isBlank()) {
                throw new IllegalArgumentException("Stop id at index " + i + " must be non-blank");
            }
            if (forward.containsKey(stopId)) {
                throw new IllegalArgumentException("Duplicate stop id: " + stopId);
            }
            forward.put(stopId, i);
            reverse[i] = stopId;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String stopId) throws UnknownStopException {
        if (stopId == null) {
            throw new IllegalArgumentException("Stop id cannot be null");
        }
        int index = forward.getInt(stopId);
        if (index == MISSING) {
            throw new UnknownStopException("Unknown stop: " + stopId);
        }
        return index;
    }

    @Override
    public String toExternal(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("Stop index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public boolean containsExternal(String stopId) {
        return stopId != null && forward.containsKey(stopId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
