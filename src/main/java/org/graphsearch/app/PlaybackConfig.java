package org.graphsearch.app;

import lombok.Builder;
import lombok.Value;

/**
 * Pacing options for trace playback.
 */
@Value
@Builder
public class PlaybackConfig {
    public static final long MIN_SPEED_MILLIS = 50L;
    public static final long MAX_SPEED_MILLIS = 800L;
    public static final long DEFAULT_SPEED_MILLIS = 200L;

    /**
     * Delay between path segments; visitation steps run at half this delay, never below
     * {@link #MIN_SPEED_MILLIS}.
     */
    @Builder.Default
    long speedMillis = DEFAULT_SPEED_MILLIS;

    /** Replay the visitation trace. */
    @Builder.Default
    boolean showVisits = true;

    /** Replay the found path segment by segment. */
    @Builder.Default
    boolean showPath = true;

    /**
     * Returns default playback configuration.
     */
    public static PlaybackConfig defaults() {
        return PlaybackConfig.builder().build();
    }

    /**
     * @return {@link #getSpeedMillis()} clamped to {@code [MIN_SPEED_MILLIS, MAX_SPEED_MILLIS]}.
     */
    public long pathStepMillis() {
        return Math.max(MIN_SPEED_MILLIS, Math.min(MAX_SPEED_MILLIS, speedMillis));
    }

    /**
     * @return delay between visitation steps.
     */
    public long visitStepMillis() {
        return Math.max(MIN_SPEED_MILLIS, pathStepMillis() / 2);
    }
}
