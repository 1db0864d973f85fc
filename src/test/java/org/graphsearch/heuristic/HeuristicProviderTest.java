package org.graphsearch.heuristic;

import org.graphsearch.graph.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Heuristic Provider Tests")
class HeuristicProviderTest {
    private static final Map<String, Position> POSITIONS = Map.of(
            "A", new Position(0.0d, 0.0d),
            "B", new Position(3.0d, 4.0d),
            "C", new Position(6.0d, 8.0d)
    );

    @Test
    @DisplayName("Known-distance: Euclidean estimate equals straight-line distance")
    void testKnownEuclideanDistance() {
        HeuristicProvider<String> provider = HeuristicFactory.create(HeuristicType.EUCLIDEAN, POSITIONS);
        GoalBoundHeuristic<String> bound = provider.bindGoal("C");

        assertEquals(HeuristicType.EUCLIDEAN, provider.type());
        assertEquals(10.0d, bound.estimateFromNode("A"), 1e-9);
        assertEquals(5.0d, bound.estimateFromNode("B"), 1e-9);
        assertEquals(0.0d, bound.estimateFromNode("C"), 1e-12);
    }

    @Test
    @DisplayName("Degradation: node without position estimates zero")
    void testNodeWithoutPosition() {
        GoalBoundHeuristic<String> bound = new EuclideanHeuristicProvider<>(POSITIONS).bindGoal("C");

        assertEquals(0.0d, bound.estimateFromNode("UNPLACED"), 0.0d);
    }

    @Test
    @DisplayName("Degradation: goal without position estimates zero everywhere")
    void testGoalWithoutPosition() {
        GoalBoundHeuristic<String> bound = new EuclideanHeuristicProvider<>(POSITIONS).bindGoal("UNPLACED");

        assertEquals(0.0d, bound.estimateFromNode("A"), 0.0d);
        assertEquals(0.0d, bound.estimateFromNode("B"), 0.0d);
    }

    @Test
    @DisplayName("Overflowing coordinates clamp to zero")
    void testOverflowClamped() {
        Map<String, Position> extreme = Map.of(
                "A", new Position(-Double.MAX_VALUE, 0.0d),
                "B", new Position(Double.MAX_VALUE, 0.0d)
        );
        GoalBoundHeuristic<String> bound = new EuclideanHeuristicProvider<>(extreme).bindGoal("B");

        assertEquals(0.0d, bound.estimateFromNode("A"), 0.0d);
    }

    @Test
    @DisplayName("Null provider always estimates zero")
    void testNullProvider() {
        HeuristicProvider<String> provider = HeuristicFactory.create(HeuristicType.NONE, POSITIONS);

        assertInstanceOf(NullHeuristicProvider.class, provider);
        assertEquals(HeuristicType.NONE, provider.type());
        assertEquals(0.0d, provider.bindGoal("C").estimateFromNode("A"), 0.0d);
    }

    @Test
    @DisplayName("Factory: missing positions still yields a usable Euclidean provider")
    void testFactoryNullPositions() {
        HeuristicProvider<String> provider = HeuristicFactory.create(HeuristicType.EUCLIDEAN, null);

        assertEquals(0.0d, provider.bindGoal("C").estimateFromNode("A"), 0.0d);
    }

    @Test
    @DisplayName("Factory: heuristic type is required")
    void testFactoryTypeRequired() {
        HeuristicConfigurationException ex = assertThrows(
                HeuristicConfigurationException.class,
                () -> HeuristicFactory.create(null, POSITIONS)
        );
        assertEquals(HeuristicFactory.REASON_TYPE_REQUIRED, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + HeuristicFactory.REASON_TYPE_REQUIRED + "]"));
    }
}
