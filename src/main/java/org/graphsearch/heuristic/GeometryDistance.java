package org.graphsearch.heuristic;

import lombok.experimental.UtilityClass;
import org.graphsearch.graph.Position;

/**
 * Numeric helpers for geometry distance computations.
 */
@UtilityClass
class GeometryDistance {

    /**
     * Computes Euclidean distance in cartesian coordinate space.
     */
    static double euclideanDistance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    /**
     * Computes Euclidean distance between two positions.
     */
    static double euclideanDistance(Position a, Position b) {
        return euclideanDistance(a.x(), a.y(), b.x(), b.y());
    }
}
