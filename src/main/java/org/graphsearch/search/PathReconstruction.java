package org.graphsearch.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds start-to-goal paths from per-search came-from maps.
 */
@UtilityClass
class PathReconstruction {

    /**
     * Walks predecessors from goal back to start.
     *
     * <p>The start node maps to {@code null}. Returns an empty list when the goal was never
     * discovered or the predecessor chain does not lead back to {@code start}.</p>
     */
    static <N> List<N> reconstruct(Map<N, N> cameFrom, N start, N goal) {
        if (!cameFrom.containsKey(goal)) {
            return List.of();
        }
        ObjectArrayList<N> reversed = new ObjectArrayList<>();
        N current = goal;
        while (current != null) {
            if (reversed.size() > cameFrom.size()) {
                // Predecessor cycle; no chain to start.
                return List.of();
            }
            reversed.add(current);
            current = cameFrom.get(current);
        }
        Collections.reverse(reversed);
        if (reversed.isEmpty() || !Objects.equals(reversed.get(0), start)) {
            return List.of();
        }
        return reversed;
    }
}
