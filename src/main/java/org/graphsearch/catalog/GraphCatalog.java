package org.graphsearch.catalog;

import org.graphsearch.graph.Graph;
import org.graphsearch.graph.id.NodeId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of named graphs.
 *
 * <p>Built once at startup and handed to the presentation layer; names keep registration
 * order.</p>
 */
public final class GraphCatalog {
    public static final String REASON_NAME_REQUIRED = "CATALOG_NAME_REQUIRED";
    public static final String REASON_GRAPH_UNKNOWN = "CATALOG_GRAPH_UNKNOWN";
    public static final String REASON_DUPLICATE_NAME = "CATALOG_DUPLICATE_NAME";

    private final Map<String, Graph<NodeId>> graphs;

    private GraphCatalog(Map<String, Graph<NodeId>> graphs) {
        this.graphs = Collections.unmodifiableMap(new LinkedHashMap<>(graphs));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return graph names in registration order.
     */
    public Set<String> names() {
        return graphs.keySet();
    }

    /**
     * @return read-only name to graph mapping.
     */
    public Map<String, Graph<NodeId>> graphs() {
        return graphs;
    }

    /**
     * Returns the graph registered under {@code name}.
     *
     * @throws GraphCatalogException when the name is blank or unknown.
     */
    public Graph<NodeId> graph(String name) {
        if (name == null || name.isBlank()) {
            throw new GraphCatalogException(REASON_NAME_REQUIRED, "graph name must be non-blank");
        }
        Graph<NodeId> graph = graphs.get(name);
        if (graph == null) {
            throw new GraphCatalogException(
                    REASON_GRAPH_UNKNOWN,
                    "unknown graph '" + name + "', available: " + String.join(", ", graphs.keySet())
            );
        }
        return graph;
    }

    public Optional<Graph<NodeId>> find(String name) {
        return Optional.ofNullable(name == null ? null : graphs.get(name));
    }

    public boolean contains(String name) {
        return name != null && graphs.containsKey(name);
    }

    public int size() {
        return graphs.size();
    }

    /**
     * Catalog assembly helper.
     */
    public static final class Builder {
        private final Map<String, Graph<NodeId>> graphs = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers one graph.
         *
         * @throws GraphCatalogException when the name is blank or already registered.
         */
        public Builder register(String name, Graph<NodeId> graph) {
            if (name == null || name.isBlank()) {
                throw new GraphCatalogException(REASON_NAME_REQUIRED, "graph name must be non-blank");
            }
            if (graphs.containsKey(name)) {
                throw new GraphCatalogException(REASON_DUPLICATE_NAME, "graph already registered: " + name);
            }
            graphs.put(name, Objects.requireNonNull(graph, "graph"));
            return this;
        }

        public GraphCatalog build() {
            return new GraphCatalog(graphs);
        }
    }
}
