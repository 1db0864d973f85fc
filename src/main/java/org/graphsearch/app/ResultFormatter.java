package org.graphsearch.app;

import lombok.experimental.UtilityClass;
import org.graphsearch.catalog.GraphCatalog;
import org.graphsearch.graph.Graph;
import org.graphsearch.search.SearchResult;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders catalog listings and search results as console text.
 */
@UtilityClass
public class ResultFormatter {

    /**
     * Formats the catalog listing, one graph per line.
     */
    public static String formatGraphs(GraphCatalog catalog) {
        StringBuilder out = new StringBuilder("Available graphs:");
        catalog.graphs().forEach((name, graph) ->
                out.append('\n').append("- ").append(name).append(": ").append(graph.nodeCount()).append(" nodes"));
        return out.toString();
    }

    /**
     * Formats the node list of one graph in insertion order.
     */
    public static String formatNodes(Graph<?> graph) {
        return "Nodes:\n" + graph.nodes().stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    /**
     * Formats one search result.
     */
    public static String formatResult(String graphName, SearchResult<?> result) {
        StringBuilder out = new StringBuilder()
                .append("Algorithm: ").append(result.getAlgorithm().key().toUpperCase(Locale.ROOT)).append('\n')
                .append("Graph: ").append(graphName).append('\n')
                .append("Visited nodes: ").append(result.getVisitedCount()).append('\n');
        if (result.isFound()) {
            out.append("Path length (edges): ").append(result.getDistance()).append('\n')
                    .append("Path: ").append(formatNodeList(result.getPath()));
        } else {
            out.append("No path found");
        }
        return out.toString();
    }

    /**
     * Formats one playback step.
     */
    public static String formatStep(TraceStep<?> step) {
        if (step.phase() == TraceStep.Phase.VISIT) {
            return String.format(Locale.ROOT, "visit #%d: %s", step.index() + 1, step.node());
        }
        return String.format(Locale.ROOT, "path %d: %s -> %s", step.index() + 1, step.node(), step.next());
    }

    static String formatNodeList(List<?> nodes) {
        return nodes.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
