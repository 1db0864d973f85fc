package org.graphsearch.heuristic;

import org.graphsearch.graph.Position;

import java.util.Map;
import java.util.Objects;

/**
 * Euclidean heuristic provider.
 *
 * <p>Uses straight-line (L2) distance between node positions. With unit edge costs the
 * estimate is admissible only when the graph is embedded so that every edge spans at
 * least its cost in plane distance; otherwise A* may return a longer path.</p>
 *
 * <p>Missing positions degrade gracefully: when the goal has no position every estimate is
 * zero, and a node without a position estimates zero.</p>
 *
 * @param <N> node identifier type.
 */
public final class EuclideanHeuristicProvider<N> implements HeuristicProvider<N> {
    private final Map<N, Position> positions;

    /**
     * Creates a Euclidean heuristic provider.
     *
     * @param positions read-only node positions (may be partial).
     */
    public EuclideanHeuristicProvider(Map<N, Position> positions) {
        this.positions = Objects.requireNonNull(positions, "positions");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.EUCLIDEAN;
    }

    /**
     * Binds this provider to one goal node and returns a reusable estimator.
     *
     * @param goal goal node.
     * @return goal-bound heuristic estimator.
     */
    @Override
    public GoalBoundHeuristic<N> bindGoal(N goal) {
        Position goalPosition = positions.get(goal);
        if (goalPosition == null) {
            return node -> 0.0d;
        }
        return new BoundEuclideanHeuristic<>(positions, goalPosition);
    }

    private static final class BoundEuclideanHeuristic<N> implements GoalBoundHeuristic<N> {
        private final Map<N, Position> positions;
        private final Position goalPosition;

        private BoundEuclideanHeuristic(Map<N, Position> positions, Position goalPosition) {
            this.positions = positions;
            this.goalPosition = goalPosition;
        }

        /**
         * Returns straight-line estimate from node to bound goal.
         */
        @Override
        public double estimateFromNode(N node) {
            Position nodePosition = positions.get(node);
            if (nodePosition == null) {
                return 0.0d;
            }
            double estimate = GeometryDistance.euclideanDistance(nodePosition, goalPosition);
            if (!Double.isFinite(estimate) || estimate < 0.0d) {
                // Overflow on extreme coordinates.
                return 0.0d;
            }
            return estimate;
        }
    }
}
