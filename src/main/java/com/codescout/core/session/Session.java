package com.codescout.core.session;

import com.codescout.core.llm.ConversationMessage;
import com.codescout.core.navigation.TraceEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted review state for one {@code (name, projectRoot)} pair.
 *
 * @param navigationState          trace of the most recent review
 * @param iterationCount           completed reviews, including failed ones
 * @param cumulativeTokenEstimate  tokens used across all reviews
 * @param lastIssueCount           issues reported by the last verdict, {@code null} before the first
 */
public record Session(
        String id,
        String name,
        String projectRoot,
        Instant createdAt,
        Instant lastUpdated,
        List<ConversationMessage> messageHistory,
        List<TraceEntry> navigationState,
        int iterationCount,
        long cumulativeTokenEstimate,
        Integer lastIssueCount
) {
    public Session {
        messageHistory = messageHistory == null ? List.of() : List.copyOf(messageHistory);
        navigationState = navigationState == null ? List.of() : List.copyOf(navigationState);
    }

    public static Session create(String name, String projectRoot, Instant now) {
        return new Session(UUID.randomUUID().toString(), name, projectRoot, now, now,
                List.of(), List.of(), 0, 0L, null);
    }

    public SessionKey key() {
        return new SessionKey(name, projectRoot);
    }

    /**
     * Returns the session after one more completed review.
     *
     * @param newMessages     messages exchanged during the review
     * @param trace           the review's navigation trace, replacing the previous one
     * @param tokens          tokens consumed by the review
     * @param issueCount      issue count of the new verdict, or {@code null} to keep the previous one
     * @param maxMessages     history is trimmed to the most recent messages beyond this size
     */
    public Session afterReview(List<ConversationMessage> newMessages, List<TraceEntry> trace,
                               long tokens, Integer issueCount, Instant now, int maxMessages) {
        List<ConversationMessage> history = new ArrayList<>(messageHistory);
        history.addAll(newMessages);
        if (maxMessages > 0 && history.size() > maxMessages) {
            history = history.subList(history.size() - maxMessages, history.size());
        }
        return new Session(id, name, projectRoot, createdAt, now, history, trace,
                iterationCount + 1, cumulativeTokenEstimate + tokens,
                issueCount != null ? issueCount : lastIssueCount);
    }

    /** The most recent assistant message that carried no tool calls. */
    public String lastVerdict() {
        for (int i = messageHistory.size() - 1; i >= 0; i--) {
            ConversationMessage message = messageHistory.get(i);
            if (message.role() == ConversationMessage.Role.ASSISTANT && !message.hasToolCalls()
                    && message.content() != null && !message.content().isBlank()) {
                return message.content();
            }
        }
        return null;
    }
}
