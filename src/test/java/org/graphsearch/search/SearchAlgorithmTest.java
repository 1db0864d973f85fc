package org.graphsearch.search;

import org.graphsearch.heuristic.HeuristicType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Search Algorithm Selector Tests")
class SearchAlgorithmTest {

    @ParameterizedTest
    @CsvSource({
            "bfs, BFS",
            "DFS, DFS",
            " astar , A_STAR",
            "AStar, A_STAR"
    })
    @DisplayName("Keys resolve case-insensitively")
    void testFromKey(String key, SearchAlgorithm expected) {
        assertEquals(Optional.of(expected), SearchAlgorithm.fromKey(key));
    }

    @Test
    @DisplayName("Unknown or null keys resolve to empty")
    void testUnknownKey() {
        assertTrue(SearchAlgorithm.fromKey("dijkstra").isEmpty());
        assertTrue(SearchAlgorithm.fromKey(null).isEmpty());
    }

    @Test
    @DisplayName("Only A* binds a geometry heuristic")
    void testHeuristicBinding() {
        assertEquals(HeuristicType.NONE, SearchAlgorithm.BFS.heuristicType());
        assertEquals(HeuristicType.NONE, SearchAlgorithm.DFS.heuristicType());
        assertEquals(HeuristicType.EUCLIDEAN, SearchAlgorithm.A_STAR.heuristicType());
    }
}
