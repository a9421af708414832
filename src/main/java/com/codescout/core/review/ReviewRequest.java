package com.codescout.core.review;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one review.
 *
 * @param sessionName  session to start or continue; {@code null} for a one-off review
 * @param changedFiles project-relative paths grouped by status ({@code modified}, {@code added}, ...)
 * @param diffs        unified diffs keyed by path
 * @param model        engine model, or {@code null} for the configured default
 * @param bounds       overrides of the configured exploration bounds, or {@code null}
 */
public record ReviewRequest(
        Path projectRoot,
        String sessionName,
        Map<String, List<String>> changedFiles,
        Map<String, String> diffs,
        boolean showAll,
        String designDoc,
        String story,
        String model,
        BoundsOverride bounds
) {
    public ReviewRequest {
        changedFiles = normalizeChanges(changedFiles);
        diffs = normalizeDiffs(diffs);
    }

    /**
     * Per-request bound overrides; null fields fall back to configuration.
     *
     * @throws IllegalArgumentException if a value is zero or negative
     */
    public record BoundsOverride(Integer maxToolCalls, Integer maxDurationSeconds, Integer maxDistinctFiles) {
        public BoundsOverride {
            ExplorationBounds.requirePositive("max_tool_calls", maxToolCalls);
            ExplorationBounds.requirePositive("max_duration_seconds", maxDurationSeconds);
            ExplorationBounds.requirePositive("max_distinct_files", maxDistinctFiles);
        }
    }

    public static ReviewRequest of(Path projectRoot, String sessionName, Map<String, List<String>> changedFiles) {
        return new ReviewRequest(projectRoot, sessionName, changedFiles, Map.of(), false, null, null, null, null);
    }

    // JSON bodies may carry null groups, null entries or null diffs
    private static Map<String, List<String>> normalizeChanges(Map<String, List<String>> changedFiles) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (changedFiles == null) {
            return normalized;
        }
        changedFiles.forEach((status, paths) -> {
            if (status == null) {
                return;
            }
            List<String> kept = new ArrayList<>();
            if (paths != null) {
                paths.stream().filter(Objects::nonNull).filter(path -> !path.isBlank()).forEach(kept::add);
            }
            normalized.put(status, List.copyOf(kept));
        });
        return normalized;
    }

    private static Map<String, String> normalizeDiffs(Map<String, String> diffs) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (diffs != null) {
            diffs.forEach((path, diff) -> {
                if (path != null && diff != null) {
                    normalized.put(path, diff);
                }
            });
        }
        return normalized;
    }

    /** All changed paths, in status order. */
    public List<String> allChangedPaths() {
        List<String> paths = new ArrayList<>();
        changedFiles.values().forEach(paths::addAll);
        return paths;
    }
}
