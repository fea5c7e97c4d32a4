package org.routemap.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RouteMapExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessageFormat() {
        RouteMapException ex = new RouteMapException("SOME_REASON", "details");
        assertEquals("SOME_REASON", ex.getReasonCode());
        assertEquals("[SOME_REASON] details", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        RouteMapException ex = new RouteMapException("SOME_REASON", "details", cause);
        assertSame(cause, ex.getCause());
        assertEquals("SOME_REASON", ex.getReasonCode());
        assertEquals("[SOME_REASON] details", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new RouteMapException("", "details", cause));
    }

    @Test
    @DisplayName("Reason code must be non-null and non-blank")
    void testReasonCodeValidation() {
        assertThrows(NullPointerException.class, () -> new RouteMapException(null, "details"));
        assertThrows(IllegalArgumentException.class, () -> new RouteMapException("  ", "details"));
        assertThrows(NullPointerException.class, () -> new RouteMapException("REASON", null));
    }
}
