package org.graphsearch.catalog;

import lombok.experimental.UtilityClass;
import org.graphsearch.graph.Graph;
import org.graphsearch.graph.id.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The five built-in demonstration graphs.
 *
 * <p>Every edge is inserted in both directions. Positions are consistent planar embeddings
 * usable by the Euclidean heuristic.</p>
 */
@UtilityClass
public class ReferenceGraphs {
    public static final String URBAN_GRID = "UrbanGrid-6x6";
    public static final String LADDER = "Ladder-10";
    public static final String BINARY_TREE = "BinaryTree-15";
    public static final String HEX_RING = "HexRing-12";
    public static final String CAMPUS_MAP = "CampusMap";

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceGraphs.class);

    private static final int GRID_SIZE = 6;
    private static final int LADDER_RUNGS = 5;
    private static final double LADDER_RAIL_GAP = 2.0d;
    private static final int TREE_NODES = 15;
    private static final double TREE_WIDTH = 10.0d;
    private static final double TREE_LEVEL_HEIGHT = 2.0d;
    private static final int HEX_SIDES = 6;
    private static final double HEX_OUTER_RADIUS = 6.0d;
    private static final double HEX_INNER_RADIUS = 3.5d;
    private static final int HEX_CHORD_STRIDE = 4;

    /**
     * Builds a catalog containing all reference graphs in display order.
     */
    public static GraphCatalog catalog() {
        GraphCatalog catalog = GraphCatalog.builder()
                .register(URBAN_GRID, urbanGrid())
                .register(LADDER, ladder())
                .register(BINARY_TREE, binaryTree())
                .register(HEX_RING, hexRing())
                .register(CAMPUS_MAP, campusMap())
                .build();
        if (LOG.isDebugEnabled()) {
            catalog.graphs().forEach((name, graph) -> LOG.debug("Registered graph {}: {}", name, graph));
        }
        return catalog;
    }

    /**
     * 6x6 street grid with two blocked streets and one diagonal shortcut.
     *
     * <p>Nodes are {@code (row, col)} cells positioned at {@code (col, row)}.</p>
     */
    public static Graph<NodeId> urbanGrid() {
        Graph.Builder<NodeId> builder = Graph.builder();
        for (int r = 0; r < GRID_SIZE; r++) {
            for (int c = 0; c < GRID_SIZE; c++) {
                builder.position(NodeId.grid(r, c), c, r);
            }
        }
        for (int r = 0; r < GRID_SIZE; r++) {
            for (int c = 0; c < GRID_SIZE; c++) {
                if (r + 1 < GRID_SIZE) {
                    builder.addUndirectedEdge(NodeId.grid(r, c), NodeId.grid(r + 1, c));
                }
                if (c + 1 < GRID_SIZE) {
                    builder.addUndirectedEdge(NodeId.grid(r, c), NodeId.grid(r, c + 1));
                }
            }
        }
        builder.removeUndirectedEdge(NodeId.grid(1, 1), NodeId.grid(1, 2));
        builder.removeUndirectedEdge(NodeId.grid(2, 3), NodeId.grid(3, 3));
        builder.addUndirectedEdge(NodeId.grid(0, 0), NodeId.grid(2, 2));
        return builder.build();
    }

    /**
     * Two parallel rails {@code L0..L4} and {@code R0..R4} joined by rungs.
     */
    public static Graph<NodeId> ladder() {
        Graph.Builder<NodeId> builder = Graph.builder();
        for (int i = 0; i < LADDER_RUNGS; i++) {
            NodeId left = NodeId.named("L" + i);
            NodeId right = NodeId.named("R" + i);
            builder.position(left, 0.0d, i);
            builder.position(right, LADDER_RAIL_GAP, i);
            if (i > 0) {
                builder.addUndirectedEdge(NodeId.named("L" + (i - 1)), left);
                builder.addUndirectedEdge(NodeId.named("R" + (i - 1)), right);
            }
            builder.addUndirectedEdge(left, right);
        }
        return builder.build();
    }

    /**
     * Complete binary tree labelled {@code 1..15} in heap order, drawn top-down.
     */
    public static Graph<NodeId> binaryTree() {
        Graph.Builder<NodeId> builder = Graph.builder();
        for (int i = 1; i <= TREE_NODES; i++) {
            int level = 31 - Integer.numberOfLeadingZeros(i);
            int nodesInLevel = 1 << level;
            int indexInLevel = i - nodesInLevel;
            double x = (indexInLevel + 1) / (double) (nodesInLevel + 1) * TREE_WIDTH;
            double y = level * TREE_LEVEL_HEIGHT;
            builder.position(NodeId.of(i), x, -y);

            int left = 2 * i;
            int right = 2 * i + 1;
            if (left <= TREE_NODES) {
                builder.addUndirectedEdge(NodeId.of(i), NodeId.of(left));
            }
            if (right <= TREE_NODES) {
                builder.addUndirectedEdge(NodeId.of(i), NodeId.of(right));
            }
        }
        return builder.build();
    }

    /**
     * Outer hexagon {@code O0..O5} and rotated inner hexagon {@code I0..I5} with spokes and
     * two chords.
     */
    public static Graph<NodeId> hexRing() {
        Graph.Builder<NodeId> builder = Graph.builder();
        NodeId[] outer = new NodeId[HEX_SIDES];
        NodeId[] inner = new NodeId[HEX_SIDES];
        for (int i = 0; i < HEX_SIDES; i++) {
            outer[i] = NodeId.named("O" + i);
            inner[i] = NodeId.named("I" + i);
            double outerAngle = 2.0d * Math.PI * i / HEX_SIDES;
            double innerAngle = 2.0d * Math.PI * (i + 0.5d) / HEX_SIDES;
            builder.position(outer[i], Math.cos(outerAngle) * HEX_OUTER_RADIUS, Math.sin(outerAngle) * HEX_OUTER_RADIUS);
            builder.position(inner[i], Math.cos(innerAngle) * HEX_INNER_RADIUS, Math.sin(innerAngle) * HEX_INNER_RADIUS);
        }
        for (int i = 0; i < HEX_SIDES; i++) {
            builder.addUndirectedEdge(outer[i], outer[(i + 1) % HEX_SIDES]);
            builder.addUndirectedEdge(inner[i], inner[(i + 1) % HEX_SIDES]);
        }
        for (int i = 0; i < HEX_SIDES; i++) {
            builder.addUndirectedEdge(outer[i], inner[i]);
        }
        for (int i = 0; i < HEX_SIDES; i += HEX_CHORD_STRIDE) {
            builder.addUndirectedEdge(outer[i], inner[(i + 3) % HEX_SIDES]);
        }
        return builder.build();
    }

    /**
     * Ten named campus places connected by footpaths.
     */
    public static Graph<NodeId> campusMap() {
        Graph.Builder<NodeId> builder = Graph.builder();
        builder.position(NodeId.named("Gate"), -5.0d, -1.0d);
        builder.position(NodeId.named("Parking"), -6.0d, -3.0d);
        builder.position(NodeId.named("Admin"), -2.0d, 0.0d);
        builder.position(NodeId.named("Library"), 0.0d, 2.5d);
        builder.position(NodeId.named("Cafeteria"), 1.0d, -1.5d);
        builder.position(NodeId.named("LabA"), 3.0d, 1.5d);
        builder.position(NodeId.named("LabB"), 4.5d, -0.5d);
        builder.position(NodeId.named("Sports"), 6.0d, -2.5d);
        builder.position(NodeId.named("Auditorium"), 2.0d, 3.5d);
        builder.position(NodeId.named("Hostel"), 5.5d, 2.5d);

        String[][] paths = {
                {"Gate", "Admin"},
                {"Gate", "Parking"},
                {"Admin", "Library"},
                {"Admin", "Cafeteria"},
                {"Library", "Auditorium"},
                {"Library", "LabA"},
                {"Cafeteria", "LabB"},
                {"LabA", "LabB"},
                {"LabB", "Sports"},
                {"Auditorium", "Hostel"},
                {"LabA", "Hostel"}
        };
        for (String[] path : paths) {
            builder.addUndirectedEdge(NodeId.named(path[0]), NodeId.named(path[1]));
        }
        return builder.build();
    }
}
