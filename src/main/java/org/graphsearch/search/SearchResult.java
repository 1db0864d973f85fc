package org.graphsearch.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one search call.
 *
 * <p>When no path exists {@code path} is empty and {@link #getDistance()} is zero.
 * {@code visitedOrder} lists every frontier removal in order, including the goal and any
 * stale A* re-pops, so it can drive step-through playback.</p>
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class SearchResult<N> {
    /** Strategy that produced this result. */
    SearchAlgorithm algorithm;
    /** Nodes from start to goal inclusive; empty when unreachable. */
    @Singular("pathNode")
    List<N> path;
    /** Nodes in frontier-removal order. */
    @Singular("visitedNode")
    List<N> visitedOrder;

    /**
     * @return edge count along {@link #getPath()}.
     */
    public int getDistance() {
        return Math.max(0, path.size() - 1);
    }

    /**
     * @return number of frontier removals; always equals {@code visitedOrder.size()}.
     */
    public int getVisitedCount() {
        return visitedOrder.size();
    }

    /**
     * @return whether a path from start to goal was found.
     */
    public boolean isFound() {
        return !path.isEmpty();
    }
}
