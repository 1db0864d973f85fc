package org.graphsearch.search;

import org.graphsearch.heuristic.GoalBoundHeuristic;

import java.util.List;
import java.util.Map;

/**
 * Internal planner abstraction for {@link PathSearch}.
 *
 * <p>Planners are stateless; all frontier state is local to one {@code compute} call.</p>
 */
interface SearchPlanner {
    /**
     * Computes one start-to-goal search.
     *
     * @param adjacency validated adjacency mapping (start and goal are keys).
     * @param heuristic goal-bound heuristic (ignored by uninformed planners).
     * @param start start node.
     * @param goal goal node.
     * @param <N> node identifier type.
     * @return search result with path and visitation trace.
     */
    <N> SearchResult<N> compute(
            Map<N, ? extends List<N>> adjacency,
            GoalBoundHeuristic<N> heuristic,
            N start,
            N goal
    );
}
