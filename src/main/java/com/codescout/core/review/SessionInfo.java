package com.codescout.core.review;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Session details reported with a review result.
 *
 * @param status {@code new} or {@code continued}
 */
public record SessionInfo(
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("iteration") int iteration,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("message_count") int messageCount,
        @JsonProperty("previous_issue_count") Integer previousIssueCount
) {
}
