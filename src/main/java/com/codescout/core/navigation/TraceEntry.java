package com.codescout.core.navigation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

/**
 * One dispatched navigation call.
 *
 * @param arguments normalized arguments, sorted by name
 * @param resultSize characters returned to the engine
 * @param reasonTag  see {@link ToolOutcome#tag()}
 */
public record TraceEntry(
        @JsonProperty("tool") String tool,
        @JsonProperty("arguments") Map<String, String> arguments,
        @JsonProperty("result_size") int resultSize,
        @JsonProperty("reason_tag") String reasonTag
) {
    public TraceEntry {
        arguments = arguments == null ? Map.of() : new TreeMap<>(arguments);
    }
}
