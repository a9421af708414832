package com.codescout.core.llm;

import java.util.List;

public record EngineResponse(String text, List<ToolCallRequest> toolCalls, TokenUsage usage) {

    public EngineResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? TokenUsage.ZERO : usage;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
