package com.codescout.core.navigation;

/**
 * Rendered outcome of one navigation call, as handed back to the engine.
 *
 * @param content plain text or JSON
 */
public record ToolResult(String toolName, ToolOutcome outcome, String content) {

    public int size() {
        return content.length();
    }

    public ToolResult withOutcome(ToolOutcome newOutcome) {
        return new ToolResult(toolName, newOutcome, content);
    }
}
