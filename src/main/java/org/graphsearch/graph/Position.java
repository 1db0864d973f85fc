package org.graphsearch.graph;

/**
 * Planar node position used by geometry heuristics.
 *
 * @param x horizontal coordinate.
 * @param y vertical coordinate.
 */
public record Position(double x, double y) {

    public Position {
        if (!Double.isFinite(x)) {
            throw new IllegalArgumentException("x must be finite, got " + x);
        }
        if (!Double.isFinite(y)) {
            throw new IllegalArgumentException("y must be finite, got " + y);
        }
    }
}
