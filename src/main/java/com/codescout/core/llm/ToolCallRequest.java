package com.codescout.core.llm;

/**
 * A tool invocation issued by the engine.
 *
 * @param arguments raw JSON arguments object
 */
public record ToolCallRequest(String id, String name, String arguments) {
}
