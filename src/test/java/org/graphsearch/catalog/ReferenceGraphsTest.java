package org.graphsearch.catalog;

import org.graphsearch.graph.Graph;
import org.graphsearch.graph.id.NodeId;
import org.graphsearch.search.PathSearch;
import org.graphsearch.search.SearchAlgorithm;
import org.graphsearch.search.SearchResult;
import org.graphsearch.testutil.SearchFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Reference Graph Tests")
class ReferenceGraphsTest {
    private static final GraphCatalog CATALOG = ReferenceGraphs.catalog();
    private static final PathSearch PATH_SEARCH = new PathSearch();

    private static NodeId n(String name) {
        return NodeId.named(name);
    }

    @Nested
    @DisplayName("1. Structure")
    class StructureTests {

        @Test
        @DisplayName("Catalog lists graphs in display order")
        void testCatalogOrder() {
            assertEquals(
                    List.of(
                            ReferenceGraphs.URBAN_GRID,
                            ReferenceGraphs.LADDER,
                            ReferenceGraphs.BINARY_TREE,
                            ReferenceGraphs.HEX_RING,
                            ReferenceGraphs.CAMPUS_MAP
                    ),
                    List.copyOf(CATALOG.names())
            );
        }

        @Test
        @DisplayName("Node and directed edge counts")
        void testCounts() {
            assertCounts(ReferenceGraphs.urbanGrid(), 36, 118);
            assertCounts(ReferenceGraphs.ladder(), 10, 26);
            assertCounts(ReferenceGraphs.binaryTree(), 15, 28);
            assertCounts(ReferenceGraphs.hexRing(), 12, 40);
            assertCounts(ReferenceGraphs.campusMap(), 10, 22);
        }

        @Test
        @DisplayName("Urban grid: blocked streets removed and diagonal shortcut added")
        void testUrbanGridEdits() {
            Graph<NodeId> grid = ReferenceGraphs.urbanGrid();

            assertFalse(grid.hasEdge(NodeId.grid(1, 1), NodeId.grid(1, 2)));
            assertFalse(grid.hasEdge(NodeId.grid(1, 2), NodeId.grid(1, 1)));
            assertFalse(grid.hasEdge(NodeId.grid(2, 3), NodeId.grid(3, 3)));
            assertTrue(grid.hasEdge(NodeId.grid(0, 0), NodeId.grid(2, 2)));
            assertTrue(grid.hasEdge(NodeId.grid(2, 2), NodeId.grid(0, 0)));
            assertEquals(List.of(NodeId.grid(1, 0), NodeId.grid(0, 1), NodeId.grid(2, 2)), grid.neighbors(NodeId.grid(0, 0)));
        }

        @Test
        @DisplayName("Hex ring: chords join O0-I3 and O4-I1 only")
        void testHexChords() {
            Graph<NodeId> hex = ReferenceGraphs.hexRing();

            assertTrue(hex.hasEdge(n("O0"), n("I3")));
            assertTrue(hex.hasEdge(n("I1"), n("O4")));
            assertFalse(hex.hasEdge(n("O2"), n("I5")));
            assertEquals(List.of(n("O1"), n("O5"), n("I0"), n("I3")), hex.neighbors(n("O0")));
        }

        @Test
        @DisplayName("Campus map: node order follows path insertion")
        void testCampusOrder() {
            List<String> names = ReferenceGraphs.campusMap().nodes().stream()
                    .map(NodeId::toString)
                    .collect(Collectors.toList());

            assertEquals(
                    List.of("Gate", "Admin", "Parking", "Library", "Cafeteria",
                            "Auditorium", "LabA", "LabB", "Sports", "Hostel"),
                    names
            );
        }

        @Test
        @DisplayName("Every graph is undirected and fully positioned")
        void testSymmetryAndPositions() {
            for (Map.Entry<String, Graph<NodeId>> entry : CATALOG.graphs().entrySet()) {
                Graph<NodeId> graph = entry.getValue();
                for (NodeId node : graph.nodes()) {
                    assertTrue(graph.positions().containsKey(node), entry.getKey() + " missing position " + node);
                    for (NodeId neighbor : graph.neighbors(node)) {
                        assertTrue(graph.hasEdge(neighbor, node), entry.getKey() + " asymmetric " + node + "-" + neighbor);
                    }
                }
            }
        }

        @Test
        @DisplayName("Binary tree is drawn top-down with evenly spread levels")
        void testTreeLayout() {
            Graph<NodeId> tree = ReferenceGraphs.binaryTree();

            assertEquals(5.0d, tree.position(NodeId.of(1)).x(), 1e-9);
            assertEquals(0.0d, tree.position(NodeId.of(1)).y(), 1e-9);
            assertEquals(20.0d / 3.0d, tree.position(NodeId.of(3)).x(), 1e-9);
            assertEquals(-2.0d, tree.position(NodeId.of(3)).y(), 1e-9);
            assertEquals(-6.0d, tree.position(NodeId.of(15)).y(), 1e-9);
        }

        private void assertCounts(Graph<NodeId> graph, int nodes, int edges) {
            assertEquals(nodes, graph.nodeCount());
            assertEquals(edges, graph.edgeCount());
        }
    }

    @Nested
    @DisplayName("2. Searches")
    class SearchTests {

        @Test
        @DisplayName("Campus BFS Gate to Sports")
        void testCampusBfs() {
            SearchResult<NodeId> result = PATH_SEARCH.search(
                    SearchAlgorithm.BFS, ReferenceGraphs.campusMap(), n("Gate"), n("Sports"));

            assertEquals(List.of(n("Gate"), n("Admin"), n("Cafeteria"), n("LabB"), n("Sports")), result.getPath());
            assertEquals(4, result.getDistance());
            assertEquals(10, result.getVisitedCount());
        }

        @Test
        @DisplayName("BFS shortest distances on reference graphs")
        void testBfsDistances() {
            assertEquals(7, bfsDistance(ReferenceGraphs.urbanGrid(), NodeId.grid(0, 0), NodeId.grid(5, 5)));
            assertEquals(5, bfsDistance(ReferenceGraphs.ladder(), n("L0"), n("R4")));
            assertEquals(6, bfsDistance(ReferenceGraphs.binaryTree(), NodeId.of(8), NodeId.of(15)));
            assertEquals(2, bfsDistance(ReferenceGraphs.hexRing(), n("O0"), n("O3")));
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"UrbanGrid-6x6", "Ladder-10", "BinaryTree-15", "HexRing-12", "CampusMap"})
        @DisplayName("All algorithms return valid paths; BFS is never beaten")
        void testAllPairs(String name) {
            Graph<NodeId> graph = CATALOG.graph(name);
            for (List<NodeId> pair : SearchFixtures.allPairs(graph)) {
                NodeId start = pair.get(0);
                NodeId goal = pair.get(1);
                SearchResult<NodeId> bfs = PATH_SEARCH.search(SearchAlgorithm.BFS, graph, start, goal);
                assertTrue(bfs.isFound(), name + " is connected");
                for (SearchAlgorithm algorithm : SearchAlgorithm.values()) {
                    SearchResult<NodeId> result = PATH_SEARCH.search(algorithm, graph, start, goal);
                    SearchFixtures.assertValidPath(graph.adjacency(), result.getPath(), start, goal);
                    assertTrue(result.isFound());
                    assertTrue(result.getDistance() >= bfs.getDistance());
                    assertEquals(start, result.getVisitedOrder().get(0));
                }
            }
        }

        private int bfsDistance(Graph<NodeId> graph, NodeId start, NodeId goal) {
            return PATH_SEARCH.search(SearchAlgorithm.BFS, graph, start, goal).getDistance();
        }
    }
}
