package org.graphsearch.search;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.graphsearch.heuristic.GoalBoundHeuristic;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Node-based A* planner with unit edge costs.
 *
 * <p>Frontier priority is {@code g + h}. Entries are never removed from the queue on
 * improvement; instead a neighbor is re-pushed whenever its tentative {@code g} strictly
 * improves its best known {@code g}. Outdated entries still pop (and are recorded in the
 * visitation trace) but cannot relax any neighbor.</p>
 *
 * <p>The search returns as soon as the goal pops. With an admissible heuristic the path has
 * minimum edge count; an overestimating heuristic may yield a longer path.</p>
 */
final class AStarSearchPlanner implements SearchPlanner {
    static final double EDGE_COST = 1.0d;

    @Override
    public <N> SearchResult<N> compute(
            Map<N, ? extends List<N>> adjacency,
            GoalBoundHeuristic<N> heuristic,
            N start,
            N goal
    ) {
        PriorityQueue<FrontierEntry<N>> frontier = new PriorityQueue<>();
        Object2ObjectOpenHashMap<N, N> cameFrom = new Object2ObjectOpenHashMap<>();
        Object2DoubleOpenHashMap<N> gScore = new Object2DoubleOpenHashMap<>();
        gScore.defaultReturnValue(Double.POSITIVE_INFINITY);
        SearchResult.SearchResultBuilder<N> result = SearchResult.<N>builder().algorithm(SearchAlgorithm.A_STAR);

        long sequence = 0L;
        frontier.add(new FrontierEntry<>(start, 0.0d, sequence++));
        cameFrom.put(start, null);
        gScore.put(start, 0.0d);

        while (!frontier.isEmpty()) {
            N current = frontier.poll().node();
            result.visitedNode(current);
            if (Objects.equals(current, goal)) {
                return result.path(PathReconstruction.reconstruct(cameFrom, start, goal)).build();
            }

            List<N> neighbors = adjacency.get(current);
            if (neighbors == null) {
                continue;
            }
            double currentG = gScore.getDouble(current);
            for (N neighbor : neighbors) {
                double tentativeG = currentG + EDGE_COST;
                if (tentativeG < gScore.getDouble(neighbor)) {
                    cameFrom.put(neighbor, current);
                    gScore.put(neighbor, tentativeG);
                    double priority = tentativeG + estimate(heuristic, neighbor);
                    frontier.add(new FrontierEntry<>(neighbor, priority, sequence++));
                }
            }
        }

        return result.build();
    }

    /**
     * Returns a heuristic estimate clamped to a finite non-negative value.
     */
    private static <N> double estimate(GoalBoundHeuristic<N> heuristic, N node) {
        double estimate = heuristic.estimateFromNode(node);
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            return 0.0d;
        }
        return estimate;
    }
}
