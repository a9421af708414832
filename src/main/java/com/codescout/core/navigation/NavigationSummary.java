package com.codescout.core.navigation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record NavigationSummary(
        @JsonProperty("files_read") List<String> filesRead,
        @JsonProperty("symbols_searched") int symbolsSearched,
        @JsonProperty("total_calls") int totalCalls,
        @JsonProperty("cached_calls") int cachedCalls
) {
}
