package com.codescout.core.review;

import com.codescout.core.index.IndexStats;
import com.codescout.core.llm.TokenUsage;
import com.codescout.core.navigation.NavigationSummary;
import com.codescout.core.navigation.TraceEntry;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a review. Always produced, whichever terminal state was reached.
 *
 * @param answer the engine's verdict, {@code null} when the review failed before one
 * @param error  set only for {@link ReviewState#TERMINATED_ERROR}
 */
public record ReviewResult(
        @JsonProperty("review_id") String reviewId,
        @JsonProperty("state") ReviewState state,
        @JsonProperty("answer") String answer,
        @JsonProperty("error") ReviewError error,
        @JsonProperty("trace") List<TraceEntry> trace,
        @JsonProperty("navigation_summary") NavigationSummary navigationSummary,
        @JsonProperty("token_usage") TokenUsage tokenUsage,
        @JsonProperty("session") SessionInfo session,
        @JsonProperty("index_stats") IndexStats indexStats,
        @JsonProperty("duration_ms") long durationMs
) {
    public boolean failed() {
        return state == ReviewState.TERMINATED_ERROR;
    }
}
