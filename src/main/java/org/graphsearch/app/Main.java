package org.graphsearch.app;

import org.graphsearch.catalog.GraphCatalog;
import org.graphsearch.catalog.ReferenceGraphs;
import org.graphsearch.graph.Graph;
import org.graphsearch.graph.id.NodeId;
import org.graphsearch.search.PathSearch;
import org.graphsearch.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Command-line pathfinder over the reference graph catalog.
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private final GraphCatalog catalog;
    private final PathSearch pathSearch;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * Creates a CLI runner bound to one catalog and output streams.
     */
    Main(GraphCatalog catalog, PathSearch pathSearch, PrintStream out, PrintStream err) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.pathSearch = Objects.requireNonNull(pathSearch, "pathSearch");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * Runs the pathfinder CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        Main main = new Main(ReferenceGraphs.catalog(), new PathSearch(), System.out, System.err);
        System.exit(main.run(args));
    }

    /**
     * Executes one CLI invocation.
     *
     * @return process exit code.
     */
    int run(String[] args) {
        CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return EXIT_USAGE;
        }
        if (arguments.isHelpRequested()) {
            out.println("Graph Pathfinder: shortest path finder on predefined graphs (BFS, DFS, A*).");
            out.println(CommandLineArguments.USAGE_MESSAGE);
            out.println(ResultFormatter.formatGraphs(catalog));
            return EXIT_OK;
        }

        String graphName = arguments.getGraphName();
        if (!catalog.contains(graphName)) {
            err.println("Unknown graph: " + graphName + ". Available graphs: " + String.join(", ", catalog.names()));
            return EXIT_USAGE;
        }
        Graph<NodeId> graph = catalog.graph(graphName);

        if (arguments.isListRequested()) {
            out.println(ResultFormatter.formatGraphs(catalog));
            out.println(ResultFormatter.formatNodes(graph));
            return EXIT_OK;
        }

        NodeId start;
        NodeId goal;
        try {
            start = NodeIdParser.parse(arguments.getStartLiteral());
            goal = NodeIdParser.parse(arguments.getGoalLiteral());
        } catch (IllegalArgumentException ex) {
            err.println("Invalid node: " + ex.getMessage());
            return EXIT_USAGE;
        }
        if (!graph.containsNode(start)) {
            err.println("Start node " + start + " not in selected graph");
            return EXIT_USAGE;
        }
        if (!graph.containsNode(goal)) {
            err.println("Goal node " + goal + " not in selected graph");
            return EXIT_USAGE;
        }

        SearchResult<NodeId> result = pathSearch.search(arguments.getAlgorithm(), graph, start, goal);
        out.println(ResultFormatter.formatResult(graphName, result));

        if (arguments.isAnimate()) {
            return animate(result, arguments.playbackConfig());
        }
        return EXIT_OK;
    }

    private int animate(SearchResult<NodeId> result, PlaybackConfig config) {
        try (TracePlayer<NodeId> player = new TracePlayer<>(result, config)) {
            player.play(step -> out.println(ResultFormatter.formatStep(step))).join();
            return EXIT_OK;
        } catch (CompletionException ex) {
            LOG.error("Trace playback failed", ex.getCause());
            err.println("Playback failed: " + ex.getCause().getMessage());
            return EXIT_FAILURE;
        }
    }
}
