package com.codescout.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningEngine} backed by a Spring AI {@link ChatModel}.
 * <p>
 * Tools are declared to the model but never executed by Spring AI: internal
 * tool execution is disabled so that the review loop sees every tool call and
 * can bound, cache and trace it. Transport retries are left to Spring AI's own
 * retry template ({@code spring.ai.retry.*}).
 */
@Service
public class SpringAiReasoningEngine implements ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(SpringAiReasoningEngine.class);

    private final ChatModel chatModel;
    private final EngineProperties properties;

    public SpringAiReasoningEngine(ChatModel chatModel, EngineProperties properties) {
        this.chatModel = chatModel;
        this.properties = properties;
    }

    @Override
    public EngineResponse respond(EngineRequest request) {
        String model = request.model() != null ? request.model() : properties.getModel();
        var options = ToolCallingChatOptions.builder()
                .model(model)
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .toolCallbacks(toCallbacks(request.tools()))
                .internalToolExecutionEnabled(false)
                .build();
        Prompt prompt = new Prompt(toMessages(request), options);

        log.debug("Engine call → {} ({} messages, {} tools)", model, request.messages().size(), request.tools().size());
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (TransientAiException | ResourceAccessException e) {
            throw new EngineUnreachableException("Reasoning engine unreachable: " + e.getMessage(), e);
        } catch (NonTransientAiException e) {
            throw new EngineProtocolException("Reasoning engine rejected the request: " + e.getMessage(), e);
        }
        log.debug("Engine responded in {}s", String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new EngineProtocolException("Reasoning engine returned no result");
        }
        AssistantMessage output = response.getResult().getOutput();
        List<ToolCallRequest> toolCalls = new ArrayList<>();
        for (AssistantMessage.ToolCall call : output.getToolCalls()) {
            toolCalls.add(new ToolCallRequest(call.id(), call.name(), call.arguments()));
        }
        String text = output.getText();
        if (toolCalls.isEmpty() && (text == null || text.isBlank())) {
            throw new EngineProtocolException("Reasoning engine returned empty content for model " + model);
        }
        return new EngineResponse(text, toolCalls, usageOf(response));
    }

    static List<Message> toMessages(EngineRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        List<ToolResponseMessage.ToolResponse> pendingResponses = new ArrayList<>();
        for (ConversationMessage message : request.messages()) {
            if (message.role() != ConversationMessage.Role.TOOL && !pendingResponses.isEmpty()) {
                messages.add(new ToolResponseMessage(List.copyOf(pendingResponses)));
                pendingResponses.clear();
            }
            switch (message.role()) {
                case SYSTEM -> messages.add(new SystemMessage(message.content()));
                case USER -> messages.add(new UserMessage(message.content()));
                case ASSISTANT -> messages.add(new AssistantMessage(
                        message.content() != null ? message.content() : "",
                        Map.of(),
                        message.toolCalls().stream()
                                .map(call -> new AssistantMessage.ToolCall(call.id(), "function", call.name(), call.arguments()))
                                .toList()));
                case TOOL -> pendingResponses.add(new ToolResponseMessage.ToolResponse(
                        message.toolCallId(), message.toolName(), message.content()));
            }
        }
        if (!pendingResponses.isEmpty()) {
            messages.add(new ToolResponseMessage(List.copyOf(pendingResponses)));
        }
        return messages;
    }

    private static List<ToolCallback> toCallbacks(List<ToolSpec> tools) {
        List<ToolCallback> callbacks = new ArrayList<>();
        for (ToolSpec tool : tools) {
            callbacks.add(new DeclaredToolCallback(ToolDefinition.builder()
                    .name(tool.name())
                    .description(tool.description())
                    .inputSchema(tool.inputSchema())
                    .build()));
        }
        return callbacks;
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.ZERO;
        }
        Usage usage = response.getMetadata().getUsage();
        long input = toLong(usage.getPromptTokens());
        long output = toLong(usage.getCompletionTokens());
        long total = toLong(usage.getTotalTokens());
        return new TokenUsage(input, output, total > 0 ? total : input + output);
    }

    private static long toLong(Number value) {
        return value != null ? value.longValue() : 0L;
    }

    /**
     * Declaration-only callback: the review loop executes navigation calls itself.
     */
    private record DeclaredToolCallback(ToolDefinition definition) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new IllegalStateException("Tool " + definition.name() + " is executed by the review loop");
        }
    }
}
