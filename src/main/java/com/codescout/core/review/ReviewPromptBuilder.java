package com.codescout.core.review;

import com.codescout.core.index.CodebaseIndex;
import com.codescout.core.index.SymbolEntry;
import com.codescout.core.llm.ConversationMessage;
import com.codescout.core.llm.ToolCallRequest;
import com.codescout.core.navigation.NavigationOperation;
import com.codescout.core.navigation.TraceEntry;
import com.codescout.core.session.Session;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Composes the system prompt and the seed context of a review.
 */
@Component
public class ReviewPromptBuilder {

    public static final String FINAL_SUMMARY_INSTRUCTION = "Summarize what you have found so far.";

    private static final int SYMBOLS_PER_FILE = 20;
    private static final int USER_TURN_CHARS = 300;
    private static final int ASSISTANT_TURN_CHARS = 600;
    private static final int TOOL_TURN_CHARS = 200;

    private static final String CRITICAL_ONLY_PROMPT = """
            You are an expert code reviewer focused on identifying issues that must be fixed before merging.
            You do not receive the whole repository. Use the navigation tools to read the changed files,
            follow their dependencies and check their tests before you conclude.

            ## Report only HIGH PRIORITY issues
            1. Violations of the design document, when one is provided
            2. Functional changes without meaningful tests
            3. Critical security vulnerabilities (injection, auth bypass, remote code execution, exposed secrets, unsafe deserialization)
            4. Bugs and defects: logic errors, runtime failures, breaking changes
            5. Performance anti-patterns worth fixing (algorithmic blow-ups, N+1 queries, loading whole datasets)
            6. Data integrity risks with real consequences

            Skip style preferences, hardening ideas and micro-optimizations.

            ## Output format
            For each issue:
            FILE: path/to/file.ext
            LINE: <line_number>
            ISSUE: <clear description of the problem>
            FIX: <specific, actionable solution>

            If there is nothing that must be fixed, say so in one sentence.""";

    private static final String SHOW_ALL_PROMPT = """
            You are an expert code reviewer providing comprehensive feedback.
            You do not receive the whole repository. Use the navigation tools to read the changed files,
            follow their dependencies and check their tests before you conclude.

            ## Priorities
            HIGH (must fix): design-document violations, missing tests, critical security flaws, bugs,
            performance anti-patterns worth fixing, data integrity risks.
            MEDIUM (should consider): maintainability problems, missing error handling for likely cases,
            undocumented complex logic.
            DEFER (note for later): hardening, low-risk findings, style, minor optimizations, refactoring.

            Weigh every finding by the value of fixing it against the effort.

            ## Output format
            For each issue:
            PRIORITY: HIGH | MEDIUM | DEFER
            FILE: path/to/file.ext
            LINE: <line_number>
            ISSUE: <clear description of the problem>
            FIX: <specific, actionable solution>""";

    private final ReviewProperties properties;

    public ReviewPromptBuilder(ReviewProperties properties) {
        this.properties = properties;
    }

    public String systemPrompt(boolean showAll) {
        return showAll ? SHOW_ALL_PROMPT : CRITICAL_ONLY_PROMPT;
    }

    /**
     * Builds the first user turn of a review.
     *
     * @param prior the continued session, or {@code null} for a new one
     */
    public String seedContext(ReviewRequest request, CodebaseIndex index, Session prior, Instant now) {
        StringBuilder context = new StringBuilder();

        if (prior != null) {
            appendContinuation(context, prior, now);
        }

        context.append("## Codebase Overview\n")
                .append(index.summary()).append("\n\n")
                .append("### Project structure\n")
                .append(index.fileTree().render(properties.getSeedTreeMaxLines())).append("\n\n");

        if (request.designDoc() != null && !request.designDoc().isBlank()) {
            context.append("## Project Design Document (mandatory compliance)\n")
                    .append("Violations of these principles are HIGH priority issues.\n\n")
                    .append(request.designDoc().strip()).append("\n\n");
        }
        if (request.story() != null && !request.story().isBlank()) {
            context.append("## Story / Change Context\n")
                    .append("Use this to tell intentional choices from actual issues.\n\n")
                    .append(request.story().strip()).append("\n\n");
        }

        appendChangedFiles(context, request, index);

        if (!request.diffs().isEmpty()) {
            context.append("## Diffs\n");
            request.diffs().forEach((file, diff) ->
                    context.append("### ").append(file).append("\n```diff\n").append(diff.strip()).append("\n```\n\n"));
        }

        context.append("## Available Tools\n");
        for (NavigationOperation operation : NavigationOperation.values()) {
            String args = operation.parameters().stream()
                    .map(p -> p.required() ? p.name() : p.name() + "?")
                    .collect(Collectors.joining(", "));
            context.append("- ").append(operation.toolName()).append('(').append(args).append("): ")
                    .append(operation.description()).append('\n');
        }
        context.append("\nStart by reading the changed files, then explore only what you need.");
        return context.toString();
    }

    /**
     * Counts reported issues: lines starting with {@code ISSUE:}.
     */
    public static int countIssues(String verdict) {
        if (verdict == null) {
            return 0;
        }
        int count = 0;
        for (String line : verdict.split("\n")) {
            if (line.strip().toUpperCase(Locale.ROOT).startsWith("ISSUE:")) {
                count++;
            }
        }
        return count;
    }

    static String formatTimeAgo(Duration elapsed) {
        long seconds = Math.max(0, elapsed.getSeconds());
        if (seconds < 60) {
            return seconds + " seconds ago";
        }
        if (seconds < 3600) {
            return seconds / 60 + " minutes ago";
        }
        if (seconds < 86400) {
            return seconds / 3600 + " hours ago";
        }
        return seconds / 86400 + " days ago";
    }

    private void appendContinuation(StringBuilder context, Session prior, Instant now) {
        context.append("## Continuing review session (iteration ").append(prior.iterationCount() + 1).append(")\n")
                .append("Last reviewed: ").append(formatTimeAgo(Duration.between(prior.lastUpdated(), now))).append('\n');
        if (prior.lastIssueCount() != null) {
            context.append("Previous review reported ").append(prior.lastIssueCount()).append(" issue(s).\n");
        }
        Set<String> explored = new LinkedHashSet<>();
        for (TraceEntry entry : prior.navigationState()) {
            if (entry.tool().equals(NavigationOperation.READ_FILE.toolName()) && entry.arguments().containsKey("filepath")) {
                explored.add(entry.arguments().get("filepath"));
            }
        }
        if (!explored.isEmpty()) {
            context.append("Files explored previously: ").append(String.join(", ", explored)).append('\n');
        }
        String verdict = prior.lastVerdict();
        if (verdict != null) {
            int max = properties.getDigestMaxChars();
            String digest = verdict.length() > max ? verdict.substring(0, max) + "\n[...]" : verdict;
            context.append("\n### Previous findings\n").append(digest.strip()).append('\n');
        }
        String transcript = condensedHistory(prior.messageHistory(), properties.getHistoryMaxChars());
        if (!transcript.isEmpty()) {
            context.append("\n### Earlier conversation (condensed)\n").append(transcript);
        }
        context.append("\nFocus on what changed since then and whether earlier issues were addressed.\n\n");
    }

    /**
     * Renders the stored history as one clipped line per turn, keeping the most
     * recent turns that fit in {@code maxChars}. Earlier turns are dropped first.
     */
    static String condensedHistory(List<ConversationMessage> history, int maxChars) {
        if (maxChars <= 0 || history.isEmpty()) {
            return "";
        }
        Deque<String> lines = new ArrayDeque<>();
        int used = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            String line = condense(history.get(i));
            if (line == null) {
                continue;
            }
            if (used + line.length() > maxChars) {
                break;
            }
            lines.addFirst(line);
            used += line.length();
        }
        if (lines.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        int omitted = countRendered(history) - lines.size();
        if (omitted > 0) {
            out.append("[").append(omitted).append(" earlier turn(s) omitted]\n");
        }
        lines.forEach(out::append);
        return out.toString();
    }

    private static int countRendered(List<ConversationMessage> history) {
        int count = 0;
        for (ConversationMessage message : history) {
            if (message.role() != ConversationMessage.Role.SYSTEM) {
                count++;
            }
        }
        return count;
    }

    private static String condense(ConversationMessage message) {
        return switch (message.role()) {
            case SYSTEM -> null;
            case USER -> "[user] " + clip(message.content(), USER_TURN_CHARS) + "\n";
            case TOOL -> "[tool " + message.toolName() + "] " + clip(message.content(), TOOL_TURN_CHARS) + "\n";
            case ASSISTANT -> {
                StringBuilder line = new StringBuilder("[assistant]");
                if (message.content() != null && !message.content().isBlank()) {
                    line.append(' ').append(clip(message.content(), ASSISTANT_TURN_CHARS));
                }
                for (ToolCallRequest call : message.toolCalls()) {
                    line.append(" -> ").append(call.name()).append(' ').append(clip(call.arguments(), TOOL_TURN_CHARS));
                }
                yield line.append('\n').toString();
            }
        };
    }

    private static String clip(String text, int max) {
        if (text == null) {
            return "";
        }
        String flat = text.strip().replaceAll("\\s+", " ");
        return flat.length() > max ? flat.substring(0, max) + "..." : flat;
    }

    private static void appendChangedFiles(StringBuilder context, ReviewRequest request, CodebaseIndex index) {
        context.append("## Changed Files\n");
        if (request.changedFiles().isEmpty()) {
            context.append("(none reported)\n\n");
            return;
        }
        for (Map.Entry<String, List<String>> group : request.changedFiles().entrySet()) {
            if (group.getValue().isEmpty()) {
                continue;
            }
            context.append(capitalize(group.getKey())).append(":\n");
            for (String file : group.getValue()) {
                context.append("  - ").append(file).append('\n');
            }
        }
        context.append('\n');

        StringBuilder details = new StringBuilder();
        for (String file : request.allChangedPaths()) {
            List<SymbolEntry> symbols = index.symbolsIn(file);
            List<String> imports = index.importGraph().dependenciesOf(file);
            if (symbols.isEmpty() && imports.isEmpty()) {
                continue;
            }
            details.append("### ").append(file).append('\n');
            symbols.stream().limit(SYMBOLS_PER_FILE).forEach(symbol -> details.append("  - ")
                    .append(symbol.kind().wireName()).append(' ')
                    .append(symbol.parent() != null ? symbol.parent() + "." : "")
                    .append(symbol.name()).append(" (line ").append(symbol.line()).append(")\n"));
            if (symbols.size() > SYMBOLS_PER_FILE) {
                details.append("  - ... ").append(symbols.size() - SYMBOLS_PER_FILE).append(" more\n");
            }
            if (!imports.isEmpty()) {
                details.append("  imports: ").append(String.join(", ", imports)).append('\n');
            }
        }
        if (details.length() > 0) {
            context.append("## Symbols and imports of changed files\n").append(details).append('\n');
        }
    }

    private static String capitalize(String status) {
        if (status == null || status.isEmpty()) {
            return "Changed";
        }
        return Character.toUpperCase(status.charAt(0)) + status.substring(1);
    }
}
