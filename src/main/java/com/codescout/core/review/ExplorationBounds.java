package com.codescout.core.review;

import java.time.Duration;

/**
 * Limits on how far one review may explore before it is asked to conclude.
 */
public record ExplorationBounds(int maxToolCalls, Duration maxDuration, int maxDistinctFiles) {

    /**
     * Returns a copy with any non-null override applied.
     *
     * @throws IllegalArgumentException if an override is zero or negative
     */
    public ExplorationBounds withOverrides(Integer toolCalls, Duration duration, Integer distinctFiles) {
        requirePositive("max_tool_calls", toolCalls);
        requirePositive("max_duration_seconds", duration != null ? duration.getSeconds() : null);
        requirePositive("max_distinct_files", distinctFiles);
        return new ExplorationBounds(
                toolCalls != null ? toolCalls : maxToolCalls,
                duration != null ? duration : maxDuration,
                distinctFiles != null ? distinctFiles : maxDistinctFiles);
    }

    static void requirePositive(String name, Number value) {
        if (value != null && value.longValue() <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
