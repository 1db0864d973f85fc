package org.graphsearch.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable search graph: ordered adjacency lists plus optional planar positions.
 *
 * <p>Node iteration order and neighbor order follow insertion order. Neighbor lists may
 * contain duplicates; searches treat a repeated neighbor as a single successor.
 * Positions may be partial or absent; only A* consumes them.</p>
 *
 * <p>Instances are read-only after construction and safe to share between concurrent
 * searches.</p>
 *
 * @param <N> node identifier type (needs value-based {@code equals}/{@code hashCode}).
 */
public final class Graph<N> {
    private final Map<N, List<N>> adjacency;
    private final Map<N, Position> positions;
    private final int edgeCount;

    private Graph(Map<N, List<N>> adjacency, Map<N, Position> positions) {
        Map<N, List<N>> frozen = new LinkedHashMap<>(adjacency.size());
        int edges = 0;
        for (Map.Entry<N, List<N>> entry : adjacency.entrySet()) {
            List<N> neighbors = List.copyOf(entry.getValue());
            frozen.put(entry.getKey(), neighbors);
            edges += neighbors.size();
        }
        this.adjacency = Collections.unmodifiableMap(frozen);
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        this.edgeCount = edges;
    }

    /**
     * Copies an adjacency mapping and position mapping into an immutable graph.
     *
     * @param adjacency node to ordered neighbors mapping.
     * @param positions node positions (may be {@code null} or partial).
     * @param <N> node identifier type.
     * @return immutable graph snapshot.
     */
    public static <N> Graph<N> of(Map<N, ? extends Collection<N>> adjacency, Map<N, Position> positions) {
        Objects.requireNonNull(adjacency, "adjacency");
        Builder<N> builder = builder();
        for (Map.Entry<N, ? extends Collection<N>> entry : adjacency.entrySet()) {
            builder.addNode(entry.getKey());
            for (N neighbor : Objects.requireNonNull(entry.getValue(), "neighbors")) {
                builder.addEdge(entry.getKey(), neighbor);
            }
        }
        if (positions != null) {
            positions.forEach(builder::position);
        }
        return builder.build();
    }

    /**
     * Creates an empty graph builder.
     */
    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    /**
     * @return read-only adjacency mapping in node insertion order.
     */
    public Map<N, List<N>> adjacency() {
        return adjacency;
    }

    /**
     * @return read-only position mapping (possibly partial or empty).
     */
    public Map<N, Position> positions() {
        return positions;
    }

    /**
     * @return read-only node set in insertion order.
     */
    public Set<N> nodes() {
        return adjacency.keySet();
    }

    /**
     * Returns ordered neighbors of one node, or an empty list for unknown nodes.
     */
    public List<N> neighbors(N node) {
        return adjacency.getOrDefault(node, List.of());
    }

    /**
     * Returns node position, or {@code null} when the node has none.
     */
    public Position position(N node) {
        return positions.get(node);
    }

    public boolean containsNode(N node) {
        return adjacency.containsKey(node);
    }

    /**
     * Returns whether {@code to} is listed among the neighbors of {@code from}.
     */
    public boolean hasEdge(N from, N to) {
        return neighbors(from).contains(to);
    }

    public int nodeCount() {
        return adjacency.size();
    }

    /**
     * @return number of directed adjacency entries (an undirected edge counts twice).
     */
    public int edgeCount() {
        return edgeCount;
    }

    public boolean hasPositions() {
        return !positions.isEmpty();
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodeCount() + ", edges=" + edgeCount + ", positions=" + positions.size() + "}";
    }

    /**
     * Mutable graph assembly helper. Not thread-safe; discard after {@link #build()}.
     *
     * @param <N> node identifier type.
     */
    public static final class Builder<N> {
        private final Map<N, List<N>> adjacency = new LinkedHashMap<>();
        private final Map<N, Position> positions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a node with no edges (no-op when already present).
         */
        public Builder<N> addNode(N node) {
            adjacency.computeIfAbsent(Objects.requireNonNull(node, "node"), ignored -> new ArrayList<>());
            return this;
        }

        /**
         * Appends a directed edge {@code from -> to}. Both endpoints become graph nodes.
         */
        public Builder<N> addEdge(N from, N to) {
            addNode(from);
            addNode(to);
            adjacency.get(from).add(to);
            return this;
        }

        /**
         * Appends {@code a -> b} and {@code b -> a}.
         */
        public Builder<N> addUndirectedEdge(N a, N b) {
            addEdge(a, b);
            addEdge(b, a);
            return this;
        }

        /**
         * Removes the first occurrence of {@code a -> b} and of {@code b -> a}, when present.
         */
        public Builder<N> removeUndirectedEdge(N a, N b) {
            List<N> fromA = adjacency.get(a);
            if (fromA != null) {
                fromA.remove(b);
            }
            List<N> fromB = adjacency.get(b);
            if (fromB != null) {
                fromB.remove(a);
            }
            return this;
        }

        /**
         * Assigns a planar position. Positions may be given for nodes without edges.
         */
        public Builder<N> position(N node, Position position) {
            positions.put(Objects.requireNonNull(node, "node"), Objects.requireNonNull(position, "position"));
            return this;
        }

        public Builder<N> position(N node, double x, double y) {
            return position(node, new Position(x, y));
        }

        public Graph<N> build() {
            return new Graph<>(adjacency, positions);
        }
    }
}
