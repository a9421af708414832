package com.codescout.core.navigation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A textual reference to a symbol outside its definition sites.
 *
 * @param importsDefinition true when {@code file} imports a file defining the symbol
 */
public record UsageMatch(
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("content") String content,
        @JsonProperty("imports_definition") boolean importsDefinition
) {
}
