package com.codescout.core.llm;

import java.util.List;

/**
 * One stateless request: the whole conversation so far plus the tools the
 * engine may call. An empty tool list asks for a final answer.
 *
 * @param model model name, or {@code null} for the configured default
 */
public record EngineRequest(String model, String systemPrompt, List<ConversationMessage> messages,
                            List<ToolSpec> tools) {

    public EngineRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
