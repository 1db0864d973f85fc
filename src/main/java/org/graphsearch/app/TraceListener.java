package org.graphsearch.app;

/**
 * Receives paced playback steps from {@link TracePlayer}.
 *
 * @param <N> node identifier type.
 */
@FunctionalInterface
public interface TraceListener<N> {
    void onStep(TraceStep<N> step);
}
