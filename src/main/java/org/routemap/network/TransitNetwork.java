package org.routemap.network;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.longs.Long2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm;
import org.jgrapht.alg.shortestpath.DijkstraShortestPath;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedWeightedGraph;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.routemap.core.RouteMapException;
import org.routemap.core.id.StopIdMapper;

import java.util.ArrayList;
import java.util.NoSuchElementException;
import java.util.OptionalLong;

/**
 * Immutable directed, edge-weighted transit network.
 * <p>
 * Stops are addressed by dense internal indices (first-seen order at build time);
 * {@link #stopIndex(String)} and {@link #stopId(int)} translate to and from external ids.
 * Storage and shortest-path primitives are delegated to JGraphT. At most one edge exists
 * per ordered stop pair and self loops are allowed. Weights are non-negative; zero-weight
 * edges are legal.
 * <p>
 * Instances are read-only after {@link Builder#build()} and safe to share.
 */
public final class TransitNetwork {
    public static final String REASON_INVALID_STOP_ID = "INVALID_STOP_ID";
    public static final String REASON_INVALID_EDGE_WEIGHT = "INVALID_EDGE_WEIGHT";

    private final Graph<Integer, DefaultWeightedEdge> graph;
    private final StopIdMapper stopIds;
    private final ShortestPathAlgorithm<Integer, DefaultWeightedEdge> shortestPaths;

    // successors[stop] sorted ascending, so traversal order is deterministic
    private final IntList[] successors;

    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private TransitNetwork(StopIdMapper stopIds, Long2IntMap edgeWeights) {
        this.stopIds = stopIds;
        Graph<Integer, DefaultWeightedEdge> g = new DefaultDirectedWeightedGraph<>(DefaultWeightedEdge.class);
        for (int stop = 0; stop < stopIds.size(); stop++) {
            g.addVertex(stop);
        }

        IntArrayList[] adjacency = new IntArrayList[stopIds.size()];
        for (int stop = 0; stop < adjacency.length; stop++) {
            adjacency[stop] = new IntArrayList();
        }
        for (Long2IntMap.Entry entry : edgeWeights.long2IntEntrySet()) {
            int from = fromStop(entry.getLongKey());
            int to = toStop(entry.getLongKey());
            DefaultWeightedEdge edge = g.addEdge(from, to);
            g.setEdgeWeight(edge, entry.getIntValue());
            adjacency[from].add(to);
        }

        this.successors = new IntList[adjacency.length];
        for (int stop = 0; stop < adjacency.length; stop++) {
            IntArrays.quickSort(adjacency[stop].elements(), 0, adjacency[stop].size());
            adjacency[stop].trim();
            successors[stop] = IntLists.unmodifiable(adjacency[stop]);
        }

        this.graph = new AsUnmodifiableGraph<>(g);
        this.edgeCount = edgeWeights.size();
        this.shortestPaths = new DijkstraShortestPath<>(graph);
    }

    /**
     * Starts a new network definition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int stopCount() {
        return stopIds.size();
    }

    public boolean containsStop(String stopId) {
        return stopIds.containsExternal(stopId);
    }

    /**
     * Resolves an external stop id.
     *
     * @throws StopIdMapper.UnknownStopException when the stop is not part of the network.
     */
    public int stopIndex(String stopId) {
        return stopIds.toInternal(stopId);
    }

    public String stopId(int stopIndex) {
        return stopIds.toExternal(stopIndex);
    }

    /**
     * Returns the direct successors of a stop in ascending index order.
     */
    public IntList successors(int stopIndex) {
        checkStop(stopIndex);
        return successors[stopIndex];
    }

    public boolean hasEdge(int from, int to) {
        checkStop(from);
        checkStop(to);
        return graph.containsEdge(from, to);
    }

    /**
     * Returns the weight of the edge {@code from -> to}.
     *
     * @throws NoSuchElementException when no such edge exists.
     */
    public int edgeWeight(int from, int to) {
        checkStop(from);
        checkStop(to);
        DefaultWeightedEdge edge = graph.getEdge(from, to);
        if (edge == null) {
            throw new NoSuchElementException("No edge " + stopId(from) + " -> " + stopId(to));
        }
        return (int) graph.getEdgeWeight(edge);
    }

    /**
     * Weighted shortest-path length between two stops.
     * <p>
     * For {@code from == to} this is the trivial zero-length path.
     *
     * @return the length, or empty when {@code to} is unreachable from {@code from}.
     */
    public OptionalLong shortestPathLength(int from, int to) {
        checkStop(from);
        checkStop(to);
        double weight = shortestPaths.getPathWeight(from, to);
        if (Double.isInfinite(weight)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.round(weight));
    }

    public boolean hasPath(int from, int to) {
        return shortestPathLength(from, to).isPresent();
    }

    private void checkStop(int stopIndex) {
        if (stopIndex < 0 || stopIndex >= successors.length) {
            throw new IndexOutOfBoundsException("Stop index out of bounds: " + stopIndex);
        }
    }

    private static long edgeKey(int from, int to) {
        return ((long) from << 32) | (to & 0xFFFFFFFFL);
    }

    private static int fromStop(long edgeKey) {
        return (int) (edgeKey >>> 32);
    }

    private static int toStop(long edgeKey) {
        return (int) edgeKey;
    }

    /**
     * Mutable network definition. Stops are created implicitly by the edges that reference them.
     */
    public static final class Builder {
        // first-seen order; becomes the internal index order
        private final ObjectLinkedOpenHashSet<String> stops = new ObjectLinkedOpenHashSet<>();
        private final Object2IntLinkedOpenHashMap<Leg> legWeights = new Object2IntLinkedOpenHashMap<>();

        private Builder() {
        }

        /**
         * Adds or replaces the directed edge {@code from -> to}.
         * A repeated pair overwrites the earlier weight.
         *
         * @throws RouteMapException when a stop id is invalid or the weight is negative.
         */
        public Builder addEdge(String from, String to, int weight) {
            if (weight < 0) {
                throw new RouteMapException(
                        REASON_INVALID_EDGE_WEIGHT,
                        "edge " + from + " -> " + to + " must have a non-negative weight, got " + weight
                );
            }
            validateStopId(from);
            validateStopId(to);
            stops.add(from);
            stops.add(to);
            legWeights.put(new Leg(from, to), weight);
            return this;
        }

        public TransitNetwork build() {
            StopIdMapper stopIds = StopIdMapper.ofOrdered(new ArrayList<>(stops));
            Long2IntLinkedOpenHashMap edgeWeights = new Long2IntLinkedOpenHashMap(legWeights.size());
            for (Object2IntMap.Entry<Leg> entry : legWeights.object2IntEntrySet()) {
                Leg leg = entry.getKey();
                edgeWeights.put(
                        edgeKey(stopIds.toInternal(leg.from()), stopIds.toInternal(leg.to())),
                        entry.getIntValue()
                );
            }
            return new TransitNetwork(stopIds, edgeWeights);
        }

        private static void validateStopId(String stopId) {
            if (stopId == null || stopId.isBlank()) {
                throw new RouteMapException(REASON_INVALID_STOP_ID, "stop id must be non-blank");
            }
            for (int i = 0; i < stopId.length(); i++) {
                char c = stopId.charAt(i);
                if (Character.isWhitespace(c) || c == '-' || c == ',') {
                    throw new RouteMapException(
                            REASON_INVALID_STOP_ID,
                            "stop id must not contain whitespace, '-' or ',': '" + stopId + "'"
                    );
                }
            }
        }

        private record Leg(String from, String to) {
        }
    }
}
