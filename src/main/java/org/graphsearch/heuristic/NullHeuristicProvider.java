package org.graphsearch.heuristic;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates, so A* degrades to uniform-cost search.</p>
 *
 * @param <N> node identifier type.
 */
public final class NullHeuristicProvider<N> implements HeuristicProvider<N> {
    private final GoalBoundHeuristic<N> zeroEstimator = node -> 0.0d;

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic<N> bindGoal(N goal) {
        return zeroEstimator;
    }
}
