package org.graphsearch.heuristic;

/**
 * Heuristic provider contract used by informed planners.
 *
 * <p>Providers are immutable and thread-safe. Binding returns an estimator for one goal
 * that can be reused for the whole search.</p>
 *
 * @param <N> node identifier type.
 */
public interface HeuristicProvider<N> {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal node and returns a reusable estimator.
     *
     * @param goal goal node.
     * @return estimator bound to the provided goal.
     */
    GoalBoundHeuristic<N> bindGoal(N goal);
}
