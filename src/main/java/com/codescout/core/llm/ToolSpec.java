package com.codescout.core.llm;

/**
 * A callable tool offered to the engine.
 *
 * @param inputSchema JSON schema of the arguments object
 */
public record ToolSpec(String name, String description, String inputSchema) {
}
