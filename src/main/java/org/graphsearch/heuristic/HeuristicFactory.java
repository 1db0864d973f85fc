package org.graphsearch.heuristic;

import lombok.experimental.UtilityClass;
import org.graphsearch.graph.Position;

import java.util.Map;

/**
 * Heuristic provider factory.
 *
 * <p>Centralizes provider validation so callers get deterministic failure reason codes.</p>
 */
@UtilityClass
public class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "H_TYPE_REQUIRED";

    /**
     * Creates a heuristic provider over a position mapping.
     *
     * @param type requested heuristic type.
     * @param positions node positions; {@code null} is treated as empty.
     * @param <N> node identifier type.
     * @return initialized heuristic provider.
     */
    public static <N> HeuristicProvider<N> create(HeuristicType type, Map<N, Position> positions) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, EUCLIDEAN)"
            );
        }
        return switch (type) {
            case NONE -> new NullHeuristicProvider<>();
            case EUCLIDEAN -> new EuclideanHeuristicProvider<>(positions == null ? Map.of() : positions);
        };
    }
}
