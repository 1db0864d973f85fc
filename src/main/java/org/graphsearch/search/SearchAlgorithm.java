package org.graphsearch.search;

import org.graphsearch.heuristic.HeuristicType;

import java.util.Locale;
import java.util.Optional;

/**
 * Search strategy selector used by {@link PathSearch}.
 */
public enum SearchAlgorithm {
    BFS("bfs", HeuristicType.NONE),
    DFS("dfs", HeuristicType.NONE),
    A_STAR("astar", HeuristicType.EUCLIDEAN);

    private final String key;
    private final HeuristicType heuristicType;

    SearchAlgorithm(String key, HeuristicType heuristicType) {
        this.key = key;
        this.heuristicType = heuristicType;
    }

    /**
     * @return short lower-case key used on the command line.
     */
    public String key() {
        return key;
    }

    /**
     * @return heuristic mode bound for this strategy.
     */
    public HeuristicType heuristicType() {
        return heuristicType;
    }

    /**
     * Looks up an algorithm by key, case-insensitively.
     */
    public static Optional<SearchAlgorithm> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (SearchAlgorithm algorithm : values()) {
            if (algorithm.key.equals(normalized)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}
