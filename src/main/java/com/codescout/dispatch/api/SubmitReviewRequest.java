package com.codescout.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/reviews.
 *
 * @param projectRoot   absolute path to the project directory
 * @param sessionName   session to start or continue; nullable, a one-off name is generated when absent
 * @param changedFiles  paths grouped by status, e.g. {@code {"modified": ["src/a.py"]}}
 * @param diffs         unified diffs keyed by path; nullable
 * @param model         engine model; nullable, defaults to {@code codescout.engine.model}
 */
public record SubmitReviewRequest(
    @JsonProperty("project_root") String projectRoot,
    @JsonProperty("session_name") String sessionName,
    @JsonProperty("changed_files") Map<String, List<String>> changedFiles,
    @JsonProperty("diffs") Map<String, String> diffs,
    @JsonProperty("show_all") boolean showAll,
    @JsonProperty("design_doc") String designDoc,
    @JsonProperty("story") String story,
    @JsonProperty("model") String model,
    @JsonProperty("max_tool_calls") Integer maxToolCalls,
    @JsonProperty("max_duration_seconds") Integer maxDurationSeconds,
    @JsonProperty("max_distinct_files") Integer maxDistinctFiles
) {}
