package org.graphsearch.app;

import org.graphsearch.search.SearchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Step-through and timed playback over a finished search.
 *
 * <p>The search result is fully computed before playback starts; this class only paces
 * delivery of its visitation order followed by its path segments. Manual stepping
 * ({@link #stepOnce()}) and timed playback ({@link #play(TraceListener)}) share one cursor.</p>
 *
 * <p>Not thread-safe for concurrent manual stepping; timed playback runs on one private
 * daemon thread.</p>
 *
 * @param <N> node identifier type.
 */
public final class TracePlayer<N> implements AutoCloseable {
    private final List<TraceStep<N>> steps;
    private final PlaybackConfig config;

    private int cursor;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;
    private CompletableFuture<Void> playback;

    /**
     * Creates a player for one search result.
     *
     * @param result finished search result.
     * @param config pacing and phase selection.
     */
    public TracePlayer(SearchResult<N> result, PlaybackConfig config) {
        Objects.requireNonNull(result, "result");
        this.config = Objects.requireNonNull(config, "config");
        this.steps = Collections.unmodifiableList(buildSteps(result, config));
    }

    private static <N> List<TraceStep<N>> buildSteps(SearchResult<N> result, PlaybackConfig config) {
        List<TraceStep<N>> built = new ArrayList<>();
        if (config.isShowVisits()) {
            List<N> visited = result.getVisitedOrder();
            for (int i = 0; i < visited.size(); i++) {
                built.add(TraceStep.visit(i, visited.get(i)));
            }
        }
        if (config.isShowPath()) {
            List<N> path = result.getPath();
            for (int i = 0; i + 1 < path.size(); i++) {
                built.add(TraceStep.segment(i, path.get(i), path.get(i + 1)));
            }
        }
        return built;
    }

    /**
     * @return all steps in playback order.
     */
    public List<TraceStep<N>> steps() {
        return steps;
    }

    public int totalSteps() {
        return steps.size();
    }

    /**
     * @return number of steps already delivered.
     */
    public synchronized int position() {
        return cursor;
    }

    public synchronized boolean hasNext() {
        return cursor < steps.size();
    }

    /**
     * Advances the cursor by one step.
     *
     * @return delivered step, or empty when playback is exhausted.
     */
    public synchronized Optional<TraceStep<N>> stepOnce() {
        if (cursor >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(cursor++));
    }

    /**
     * Cancels any running playback and rewinds to the first step.
     */
    public synchronized void reset() {
        cancelPending();
        cursor = 0;
    }

    /**
     * Delivers remaining steps to {@code listener}, one per tick.
     *
     * <p>Visit steps are spaced by {@link PlaybackConfig#visitStepMillis()}, path segments by
     * {@link PlaybackConfig#pathStepMillis()}. The returned future completes after the last
     * step, completes exceptionally if the listener throws, and is cancelled by
     * {@link #reset()} or {@link #close()}.</p>
     *
     * @param listener step consumer (invoked on the playback thread).
     * @return completion handle.
     * @throws IllegalStateException when a playback is already running.
     */
    public synchronized CompletableFuture<Void> play(TraceListener<N> listener) {
        Objects.requireNonNull(listener, "listener");
        if (playback != null && !playback.isDone()) {
            throw new IllegalStateException("playback already running");
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        playback = future;
        if (!hasNext()) {
            future.complete(null);
            return future;
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "trace-player");
                thread.setDaemon(true);
                return thread;
            });
        }
        scheduleNext(listener, future, 0L);
        return future;
    }

    private synchronized void scheduleNext(TraceListener<N> listener, CompletableFuture<Void> future, long delayMillis) {
        if (future.isDone() || scheduler == null) {
            return;
        }
        pending = scheduler.schedule(() -> tick(listener, future), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void tick(TraceListener<N> listener, CompletableFuture<Void> future) {
        if (future.isDone()) {
            return;
        }
        Optional<TraceStep<N>> step = stepOnce();
        if (step.isEmpty()) {
            future.complete(null);
            return;
        }
        try {
            listener.onStep(step.get());
        } catch (RuntimeException ex) {
            future.completeExceptionally(ex);
            return;
        }
        TraceStep<N> upcoming;
        synchronized (this) {
            if (cursor >= steps.size()) {
                future.complete(null);
                return;
            }
            upcoming = steps.get(cursor);
        }
        scheduleNext(listener, future, delayBefore(upcoming));
    }

    private long delayBefore(TraceStep<N> step) {
        return step.phase() == TraceStep.Phase.VISIT ? config.visitStepMillis() : config.pathStepMillis();
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        if (playback != null && !playback.isDone()) {
            playback.cancel(false);
        }
    }

    /**
     * Cancels playback and releases the playback thread.
     */
    @Override
    public synchronized void close() {
        cancelPending();
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
