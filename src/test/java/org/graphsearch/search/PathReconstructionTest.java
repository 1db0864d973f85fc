package org.graphsearch.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Path Reconstruction Tests")
class PathReconstructionTest {

    @Test
    @DisplayName("Predecessor chain is reversed into start-to-goal order")
    void testReconstructsChain() {
        Map<String, String> cameFrom = new HashMap<>();
        cameFrom.put("A", null);
        cameFrom.put("B", "A");
        cameFrom.put("C", "B");

        assertEquals(List.of("A", "B", "C"), PathReconstruction.reconstruct(cameFrom, "A", "C"));
    }

    @Test
    @DisplayName("Undiscovered goal yields empty path")
    void testUndiscoveredGoal() {
        Map<String, String> cameFrom = new HashMap<>();
        cameFrom.put("A", null);

        assertTrue(PathReconstruction.reconstruct(cameFrom, "A", "Z").isEmpty());
    }

    @Test
    @DisplayName("Chain ending at a node other than start yields empty path")
    void testChainNotRootedAtStart() {
        Map<String, String> cameFrom = new HashMap<>();
        cameFrom.put("X", null);
        cameFrom.put("G", "X");

        assertTrue(PathReconstruction.reconstruct(cameFrom, "S", "G").isEmpty());
    }

    @Test
    @DisplayName("Predecessor cycle yields empty path instead of looping")
    void testCycleGuard() {
        Map<String, String> cameFrom = new HashMap<>();
        cameFrom.put("A", "B");
        cameFrom.put("B", "A");

        assertTrue(PathReconstruction.reconstruct(cameFrom, "S", "A").isEmpty());
    }

    @Test
    @DisplayName("Start equal to goal yields single-node path")
    void testTrivialChain() {
        Map<String, String> cameFrom = new HashMap<>();
        cameFrom.put("A", null);

        assertEquals(List.of("A"), PathReconstruction.reconstruct(cameFrom, "A", "A"));
    }
}
