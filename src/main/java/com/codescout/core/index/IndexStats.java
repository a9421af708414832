package com.codescout.core.index;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IndexStats(
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("source_files") int sourceFiles,
        @JsonProperty("total_symbols") int totalSymbols,
        @JsonProperty("unique_symbols") int uniqueSymbols,
        @JsonProperty("test_files") int testFiles,
        @JsonProperty("unparsed_files") int unparsedFiles
) {
}
