package org.graphsearch.search;

import org.graphsearch.graph.Graph;
import org.graphsearch.graph.Position;
import org.graphsearch.heuristic.GoalBoundHeuristic;
import org.graphsearch.heuristic.HeuristicConfigurationException;
import org.graphsearch.heuristic.HeuristicFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single entry point for start-to-goal graph searches.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate request contracts (non-null inputs, start and goal are adjacency keys).</li>
 * <li>Bind the heuristic selected by the algorithm to the goal.</li>
 * <li>Delegate to the BFS, DFS or A* planner.</li>
 * </ul>
 *
 * <p>The facade is stateless and performs no I/O besides debug logging. Concurrent calls
 * over the same immutable graph are safe because every call allocates its own frontier
 * state. Invalid endpoints fail fast with {@link PathSearchException}; an unreachable goal
 * is not an error and yields an empty path.</p>
 */
public final class PathSearch {
    public static final String REASON_ALGORITHM_REQUIRED = "PS_ALGORITHM_REQUIRED";
    public static final String REASON_ADJACENCY_REQUIRED = "PS_ADJACENCY_REQUIRED";
    public static final String REASON_START_NODE_REQUIRED = "PS_START_NODE_REQUIRED";
    public static final String REASON_GOAL_NODE_REQUIRED = "PS_GOAL_NODE_REQUIRED";
    public static final String REASON_START_NODE_UNKNOWN = "PS_START_NODE_UNKNOWN";
    public static final String REASON_GOAL_NODE_UNKNOWN = "PS_GOAL_NODE_UNKNOWN";
    public static final String REASON_HEURISTIC_CONFIGURATION_FAILED = "PS_HEURISTIC_CONFIGURATION_FAILED";

    private static final Logger LOG = LoggerFactory.getLogger(PathSearch.class);

    private final SearchPlanner breadthFirstPlanner;
    private final SearchPlanner depthFirstPlanner;
    private final SearchPlanner aStarPlanner;

    /**
     * Creates a search facade with the default planners.
     */
    public PathSearch() {
        this.breadthFirstPlanner = new UninformedSearchPlanner(UninformedSearchPlanner.Discipline.FIFO);
        this.depthFirstPlanner = new UninformedSearchPlanner(UninformedSearchPlanner.Discipline.LIFO);
        this.aStarPlanner = new AStarSearchPlanner();
    }

    /**
     * Runs one search over a catalog graph.
     *
     * @param algorithm strategy to execute.
     * @param graph immutable graph.
     * @param start start node.
     * @param goal goal node.
     * @return search result.
     * @throws PathSearchException when request contracts fail.
     */
    public <N> SearchResult<N> search(SearchAlgorithm algorithm, Graph<N> graph, N start, N goal) {
        if (graph == null) {
            throw new PathSearchException(REASON_ADJACENCY_REQUIRED, "graph must be provided");
        }
        return search(algorithm, graph.adjacency(), graph.positions(), start, goal);
    }

    /**
     * Runs one search over a raw adjacency mapping.
     *
     * @param algorithm strategy to execute.
     * @param adjacency node to ordered neighbors mapping; treated as read-only.
     * @param positions node positions for A*; may be {@code null} or partial.
     * @param start start node (must be an adjacency key).
     * @param goal goal node (must be an adjacency key).
     * @return search result.
     * @throws PathSearchException when request contracts fail.
     */
    public <N> SearchResult<N> search(
            SearchAlgorithm algorithm,
            Map<N, ? extends List<N>> adjacency,
            Map<N, Position> positions,
            N start,
            N goal
    ) {
        validate(algorithm, adjacency, start, goal);
        GoalBoundHeuristic<N> heuristic = bindHeuristic(algorithm, positions, goal);
        SearchPlanner planner = switch (algorithm) {
            case BFS -> breadthFirstPlanner;
            case DFS -> depthFirstPlanner;
            case A_STAR -> aStarPlanner;
        };

        SearchResult<N> result = planner.compute(adjacency, heuristic, start, goal);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "{} {} -> {}: found={}, distance={}, visited={}",
                    algorithm,
                    start,
                    goal,
                    result.isFound(),
                    result.getDistance(),
                    result.getVisitedCount()
            );
        }
        return result;
    }

    /**
     * Breadth-first search shortcut.
     */
    public <N> SearchResult<N> bfs(Map<N, ? extends List<N>> adjacency, N start, N goal) {
        return search(SearchAlgorithm.BFS, adjacency, null, start, goal);
    }

    /**
     * Depth-first search shortcut.
     */
    public <N> SearchResult<N> dfs(Map<N, ? extends List<N>> adjacency, N start, N goal) {
        return search(SearchAlgorithm.DFS, adjacency, null, start, goal);
    }

    /**
     * A* shortcut with Euclidean heuristic over {@code positions}.
     */
    public <N> SearchResult<N> aStar(
            Map<N, ? extends List<N>> adjacency,
            Map<N, Position> positions,
            N start,
            N goal
    ) {
        return search(SearchAlgorithm.A_STAR, adjacency, positions, start, goal);
    }

    private static <N> void validate(
            SearchAlgorithm algorithm,
            Map<N, ? extends List<N>> adjacency,
            N start,
            N goal
    ) {
        if (algorithm == null) {
            throw new PathSearchException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        if (adjacency == null) {
            throw new PathSearchException(REASON_ADJACENCY_REQUIRED, "adjacency must be provided");
        }
        if (start == null) {
            throw new PathSearchException(REASON_START_NODE_REQUIRED, "start node must be provided");
        }
        if (goal == null) {
            throw new PathSearchException(REASON_GOAL_NODE_REQUIRED, "goal node must be provided");
        }
        if (!adjacency.containsKey(start)) {
            throw new PathSearchException(REASON_START_NODE_UNKNOWN, "start node not in graph: " + start);
        }
        if (!adjacency.containsKey(goal)) {
            throw new PathSearchException(REASON_GOAL_NODE_UNKNOWN, "goal node not in graph: " + goal);
        }
    }

    private static <N> GoalBoundHeuristic<N> bindHeuristic(
            SearchAlgorithm algorithm,
            Map<N, Position> positions,
            N goal
    ) {
        try {
            return HeuristicFactory.create(algorithm.heuristicType(), positions).bindGoal(goal);
        } catch (HeuristicConfigurationException ex) {
            throw new PathSearchException(
                    REASON_HEURISTIC_CONFIGURATION_FAILED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
    }
}
