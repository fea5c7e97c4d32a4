package org.routemap.routing.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.routemap.core.RouteMapException;

import static org.junit.jupiter.api.Assertions.*;

class EnumerationBudgetTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(EnumerationBudget.PROP_MAX_ROUTES);
        System.clearProperty(EnumerationBudget.PROP_MAX_FRONTIER);
    }

    @Test
    @DisplayName("Non-positive bounds mean unbounded")
    void testNormalization() {
        EnumerationBudget budget = EnumerationBudget.of(0, -5);

        assertEquals(EnumerationBudget.UNBOUNDED, budget.maxRoutes());
        assertEquals(EnumerationBudget.UNBOUNDED, budget.maxFrontier());
        assertDoesNotThrow(() -> budget.checkRouteCount(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Defaults read system properties")
    void testDefaultsFromProperties() {
        System.setProperty(EnumerationBudget.PROP_MAX_ROUTES, "100");
        System.setProperty(EnumerationBudget.PROP_MAX_FRONTIER, " 20 ");

        EnumerationBudget budget = EnumerationBudget.defaults();

        assertEquals(100, budget.maxRoutes());
        assertEquals(20, budget.maxFrontier());
    }

    @Test
    @DisplayName("Missing or invalid properties are unbounded")
    void testDefaultsInvalidProperties() {
        System.setProperty(EnumerationBudget.PROP_MAX_ROUTES, "lots");

        EnumerationBudget budget = EnumerationBudget.defaults();

        assertEquals(EnumerationBudget.UNBOUNDED, budget.maxRoutes());
        assertEquals(EnumerationBudget.UNBOUNDED, budget.maxFrontier());
    }

    @Test
    @DisplayName("Exceeding a bound fails with a reason code")
    void testChecks() {
        EnumerationBudget budget = EnumerationBudget.of(2, 3);

        assertDoesNotThrow(() -> budget.checkRouteCount(2));
        assertDoesNotThrow(() -> budget.checkFrontierSize(3));

        RouteMapException routes = assertThrows(RouteMapException.class, () -> budget.checkRouteCount(3));
        assertEquals(EnumerationBudget.REASON_BUDGET_EXCEEDED, routes.getReasonCode());
        RouteMapException frontier = assertThrows(RouteMapException.class, () -> budget.checkFrontierSize(4));
        assertEquals(EnumerationBudget.REASON_BUDGET_EXCEEDED, frontier.getReasonCode());
    }
}
