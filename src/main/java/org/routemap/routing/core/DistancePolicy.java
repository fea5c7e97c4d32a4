package org.routemap.routing.core;

/**
 * Interpretation of the distance bound used when counting routes.
 */
public enum DistancePolicy {
    /** At most N stops. */
    MAX_STOPS(new EnumerationMode(true, false)),
    /** Exactly N stops. */
    EXACT_STOPS(new EnumerationMode(false, false)),
    /** Total weight of at most N. */
    MAX_DISTANCE(new EnumerationMode(true, true));

    private final EnumerationMode mode;

    DistancePolicy(EnumerationMode mode) {
        this.mode = mode;
    }

    public EnumerationMode mode() {
        return mode;
    }
}
