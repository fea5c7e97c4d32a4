package org.routemap.core;

import lombok.Getter;

/**
 * Invalid input to the route map: a bad edge list, unusable route text, a missing distance
 * policy, or an enumeration that outgrew its guardrails.
 *
 * <p>Every instance carries a stable reason code, published as a {@code REASON_*} constant by
 * the class that throws it, so callers can branch without parsing messages. The message reads
 * {@code [REASON] detail}.</p>
 *
 * <p>Queries whose answer is simply "there is no such route" return
 * {@code RouteResult.noSuchRoute()} instead of throwing.</p>
 */
@Getter
public final class RouteMapException extends RuntimeException {
    private final String reasonCode;

    public RouteMapException(String reasonCode, String detail) {
        super(prefixed(reasonCode, detail));
        this.reasonCode = reasonCode;
    }

    public RouteMapException(String reasonCode, String detail, Throwable cause) {
        super(prefixed(reasonCode, detail), cause);
        this.reasonCode = reasonCode;
    }

    /**
     * @throws NullPointerException when the code or detail is null.
     * @throws IllegalArgumentException when the code is blank.
     */
    private static String prefixed(String reasonCode, String detail) {
        if (reasonCode == null || detail == null) {
            throw new NullPointerException(reasonCode == null ? "reasonCode" : "detail");
        }
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + detail;
    }
}
