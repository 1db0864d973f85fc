package org.graphsearch.search;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;
import org.graphsearch.heuristic.GoalBoundHeuristic;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Frontier-driven graph traversal for BFS and DFS.
 *
 * <p>Both strategies share the same loop and differ only in which end of the frontier is
 * removed:</p>
 * <ul>
 * <li>{@link Discipline#FIFO}: breadth-first, minimum edge count guaranteed.</li>
 * <li>{@link Discipline#LIFO}: depth-first, neighbors pushed in adjacency order so they
 * are explored in reverse adjacency order.</li>
 * </ul>
 *
 * <p>A node is marked discovered when it enters the frontier and is never enqueued again.
 * The search stops when the goal is removed from the frontier, so the goal's own
 * neighbors are never expanded.</p>
 */
final class UninformedSearchPlanner implements SearchPlanner {

    /**
     * Frontier removal discipline.
     */
    enum Discipline {
        FIFO,
        LIFO
    }

    private final Discipline discipline;
    private final SearchAlgorithm algorithm;

    UninformedSearchPlanner(Discipline discipline) {
        this.discipline = Objects.requireNonNull(discipline, "discipline");
        this.algorithm = discipline == Discipline.FIFO ? SearchAlgorithm.BFS : SearchAlgorithm.DFS;
    }

    @Override
    public <N> SearchResult<N> compute(
            Map<N, ? extends List<N>> adjacency,
            GoalBoundHeuristic<N> heuristic,
            N start,
            N goal
    ) {
        ObjectArrayFIFOQueue<N> frontier = new ObjectArrayFIFOQueue<>();
        Object2ObjectOpenHashMap<N, N> cameFrom = new Object2ObjectOpenHashMap<>();
        SearchResult.SearchResultBuilder<N> result = SearchResult.<N>builder().algorithm(algorithm);

        frontier.enqueue(start);
        cameFrom.put(start, null);

        while (!frontier.isEmpty()) {
            N current = discipline == Discipline.FIFO ? frontier.dequeue() : frontier.dequeueLast();
            result.visitedNode(current);
            if (Objects.equals(current, goal)) {
                break;
            }
            List<N> neighbors = adjacency.get(current);
            if (neighbors == null) {
                continue;
            }
            for (N neighbor : neighbors) {
                if (!cameFrom.containsKey(neighbor)) {
                    cameFrom.put(neighbor, current);
                    frontier.enqueue(neighbor);
                }
            }
        }

        return result.path(PathReconstruction.reconstruct(cameFrom, start, goal)).build();
    }
}
