package com.codescout.core.llm;

import java.util.List;

/**
 * Provider-neutral conversation turn, stored in session history and
 * resubmitted to the engine on every request.
 *
 * @param toolCalls  calls issued by an assistant turn
 * @param toolCallId for TOOL messages, the call being answered
 * @param toolName   for TOOL messages, the tool that produced the content
 */
public record ConversationMessage(Role role, String content, List<ToolCallRequest> toolCalls,
                                  String toolCallId, String toolName) {

    public enum Role { SYSTEM, USER, ASSISTANT, TOOL }

    public ConversationMessage {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content, List.of(), null, null);
    }

    public static ConversationMessage assistant(String content, List<ToolCallRequest> toolCalls) {
        return new ConversationMessage(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static ConversationMessage tool(ToolCallRequest call, String content) {
        return new ConversationMessage(Role.TOOL, content, List.of(), call.id(), call.name());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
