package com.codescout.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SessionSummary(
        @JsonProperty("name") String name,
        @JsonProperty("project_root") String projectRoot,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("iteration_count") int iterationCount,
        @JsonProperty("message_count") int messageCount,
        @JsonProperty("last_issue_count") Integer lastIssueCount
) {
    public static SessionSummary of(Session session) {
        return new SessionSummary(session.name(), session.projectRoot(), session.createdAt(),
                session.lastUpdated(), session.iterationCount(), session.messageHistory().size(),
                session.lastIssueCount());
    }
}
