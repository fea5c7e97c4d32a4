package org.routemap.network;

import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.routemap.core.RouteMapException;
import org.routemap.core.id.StopIdMapper;
import org.routemap.testutil.NetworkFixtures;

import java.util.NoSuchElementException;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransitNetwork Tests")
class TransitNetworkTest {

    @Test
    @DisplayName("Stops are created implicitly and indexed in first-seen order")
    void testImplicitStops() {
        TransitNetwork network = NetworkFixtures.sampleNetwork();

        assertEquals(5, network.stopCount());
        assertEquals(9, network.edgeCount());
        assertEquals(0, network.stopIndex("A"));
        assertEquals(4, network.stopIndex("E"));
        assertEquals("C", network.stopId(2));
        assertTrue(network.containsStop("D"));
        assertFalse(network.containsStop("F"));
    }

    @Test
    @DisplayName("Redefining an edge overwrites its weight")
    void testLastWriteWins() {
        TransitNetwork network = TransitNetwork.builder()
                .addEdge("A", "B", 5)
                .addEdge("A", "B", 7)
                .build();

        assertEquals(1, network.edgeCount());
        assertEquals(7, network.edgeWeight(0, 1));
    }

    @Test
    @DisplayName("Edges are directed")
    void testDirectedEdges() {
        TransitNetwork network = TransitNetwork.builder().addEdge("A", "B", 3).build();

        assertTrue(network.hasEdge(0, 1));
        assertFalse(network.hasEdge(1, 0));
        assertThrows(NoSuchElementException.class, () -> network.edgeWeight(1, 0));
        assertTrue(network.successors(1).isEmpty());
    }

    @Test
    @DisplayName("Successors are listed in ascending stop index")
    void testSuccessorOrder() {
        TransitNetwork network = TransitNetwork.builder()
                .addEdge("A", "D", 1)
                .addEdge("A", "B", 1)
                .addEdge("B", "C", 1)
                .addEdge("A", "C", 1)
                .build();

        // A=0, D=1, B=2, C=3
        assertEquals(IntList.of(1, 2, 3), network.successors(0));
    }

    @Test
    @DisplayName("Successor lists are read-only")
    void testSuccessorsUnmodifiable() {
        TransitNetwork network = NetworkFixtures.sampleNetwork();
        assertThrows(UnsupportedOperationException.class, () -> network.successors(0).add(4));
    }

    @Test
    @DisplayName("Self loops are permitted")
    void testSelfLoop() {
        TransitNetwork network = NetworkFixtures.selfLoopNetwork();

        assertTrue(network.hasEdge(0, 0));
        assertEquals(4, network.edgeWeight(0, 0));
        assertEquals(IntList.of(0, 1), network.successors(0));
    }

    @Test
    @DisplayName("Shortest path length: reachable, trivial and unreachable")
    void testShortestPathLength() {
        TransitNetwork network = NetworkFixtures.sampleNetwork();
        int a = network.stopIndex("A");
        int c = network.stopIndex("C");
        int e = network.stopIndex("E");
        int d = network.stopIndex("D");

        assertEquals(OptionalLong.of(9), network.shortestPathLength(a, c));
        assertEquals(OptionalLong.of(15), network.shortestPathLength(e, d));
        assertEquals(OptionalLong.of(0), network.shortestPathLength(c, c));
        assertEquals(OptionalLong.empty(), network.shortestPathLength(c, a));

        assertTrue(network.hasPath(a, e));
        assertFalse(network.hasPath(e, a));
    }

    @Test
    @DisplayName("Validation: weights must be non-negative")
    void testWeightValidation() {
        TransitNetwork.Builder builder = TransitNetwork.builder();

        RouteMapException negative = assertThrows(RouteMapException.class, () -> builder.addEdge("A", "B", -2));
        assertEquals(TransitNetwork.REASON_INVALID_EDGE_WEIGHT, negative.getReasonCode());
        assertEquals(0, builder.build().stopCount());

        TransitNetwork network = builder.addEdge("A", "B", 0).addEdge("B", "C", 3).build();
        assertEquals(0, network.edgeWeight(0, 1));
        assertEquals(OptionalLong.of(3), network.shortestPathLength(0, 2));
    }

    @Test
    @DisplayName("Stop order follows first appearance across redefined and reversed edges")
    void testStopOrderWithRedefinitions() {
        TransitNetwork network = TransitNetwork.builder()
                .addEdge("C", "A", 2)
                .addEdge("A", "C", 1)
                .addEdge("C", "A", 6)
                .addEdge("B", "B", 0)
                .build();

        assertEquals(3, network.stopCount());
        assertEquals(3, network.edgeCount());
        assertEquals("C", network.stopId(0));
        assertEquals("A", network.stopId(1));
        assertEquals("B", network.stopId(2));
        assertEquals(6, network.edgeWeight(0, 1));
        assertEquals(0, network.edgeWeight(2, 2));
    }

    @Test
    @DisplayName("Validation: stop ids must be non-blank tokens")
    void testStopIdValidation() {
        TransitNetwork.Builder builder = TransitNetwork.builder();

        for (String invalid : new String[]{null, "", " ", "A B", "A-B", "A,B"}) {
            RouteMapException ex = assertThrows(RouteMapException.class, () -> builder.addEdge(invalid, "B", 1));
            assertEquals(TransitNetwork.REASON_INVALID_STOP_ID, ex.getReasonCode());
        }
        assertEquals(0, builder.build().stopCount());
    }

    @Test
    @DisplayName("Multi-character stop ids are supported")
    void testMultiCharacterStops() {
        TransitNetwork network = TransitNetwork.builder()
                .addEdge("Central", "Harbour", 12)
                .build();

        assertEquals(12, network.edgeWeight(network.stopIndex("Central"), network.stopIndex("Harbour")));
    }

    @Test
    @DisplayName("Lookups outside the network fail")
    void testOutOfBounds() {
        TransitNetwork network = NetworkFixtures.sampleNetwork();

        assertThrows(StopIdMapper.UnknownStopException.class, () -> network.stopIndex("Z"));
        assertThrows(IndexOutOfBoundsException.class, () -> network.successors(5));
        assertThrows(IndexOutOfBoundsException.class, () -> network.edgeWeight(-1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> network.shortestPathLength(0, 9));
    }
}
