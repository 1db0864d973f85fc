package org.graphsearch.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables guidance (uniform-cost behavior).</p>
 * <p>{@code EUCLIDEAN} uses straight-line distance between node positions.</p>
 */
public enum HeuristicType {
    NONE,
    EUCLIDEAN
}
