package org.graphsearch.app;

/**
 * One playback step of a precomputed search trace.
 *
 * @param phase step kind.
 * @param index zero-based index within its phase.
 * @param node visited node, or segment origin for {@link Phase#PATH}.
 * @param next segment destination for {@link Phase#PATH}; {@code null} for visits.
 * @param <N> node identifier type.
 */
public record TraceStep<N>(Phase phase, int index, N node, N next) {

    /**
     * Step kinds in playback order.
     */
    public enum Phase {
        VISIT,
        PATH
    }

    static <N> TraceStep<N> visit(int index, N node) {
        return new TraceStep<>(Phase.VISIT, index, node, null);
    }

    static <N> TraceStep<N> segment(int index, N from, N to) {
        return new TraceStep<>(Phase.PATH, index, from, to);
    }
}
