package org.graphsearch.heuristic;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * @param <N> node identifier type.
 */
@FunctionalInterface
public interface GoalBoundHeuristic<N> {

    /**
     * Estimates remaining cost from a node to a pre-bound goal.
     *
     * @param node candidate node.
     * @return non-negative finite estimate.
     */
    double estimateFromNode(N node);
}
