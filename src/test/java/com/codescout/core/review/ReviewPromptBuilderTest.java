package com.codescout.core.review;

import com.codescout.core.index.CodebaseIndex;
import com.codescout.core.index.CodebaseIndexer;
import com.codescout.core.index.IndexProperties;
import com.codescout.core.index.SourceParserRegistry;
import com.codescout.core.llm.ConversationMessage;
import com.codescout.core.llm.ToolCallRequest;
import com.codescout.core.metrics.ReviewMetrics;
import com.codescout.core.navigation.TraceEntry;
import com.codescout.core.session.Session;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReviewPromptBuilderTest {

    private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");

    @TempDir
    Path root;

    private ReviewProperties properties;
    private ReviewPromptBuilder builder;
    private CodebaseIndex index;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("service.py"), """
                import repository

                class OrderService:
                    def place(self, order):
                        return repository.save(order)
                """);
        Files.writeString(root.resolve("repository.py"), """
                def save(order):
                    return order
                """);
        properties = new ReviewProperties();
        builder = new ReviewPromptBuilder(properties);
        index = new CodebaseIndexer(new IndexProperties(), new SourceParserRegistry(),
                new ReviewMetrics(new SimpleMeterRegistry())).build(root);
    }

    private ReviewRequest request(Map<String, List<String>> changed, Map<String, String> diffs,
                                  String designDoc, String story) {
        return new ReviewRequest(root, "feature", changed, diffs, false, designDoc, story, null, null);
    }

    @Nested
    @DisplayName("seedContext")
    class SeedContext {

        @Test
        @DisplayName("lists changed files with their symbols and imports")
        void changedFiles() {
            String seed = builder.seedContext(request(
                    Map.of("modified", List.of("service.py"), "added", List.of()), Map.of(), null, null),
                    index, null, NOW);

            assertTrue(seed.contains("## Codebase Overview"));
            assertTrue(seed.contains("### Project structure"));
            assertTrue(seed.contains("Modified:\n  - service.py\n"));
            assertFalse(seed.contains("Added:"));
            assertTrue(seed.contains("## Symbols and imports of changed files"));
            assertTrue(seed.contains("type OrderService (line 3)"));
            assertTrue(seed.contains("method OrderService.place (line 4)"));
            assertTrue(seed.contains("imports: repository.py"));
            assertTrue(seed.endsWith("Start by reading the changed files, then explore only what you need."));
        }

        @Test
        @DisplayName("includes design document, story and diffs when given")
        void optionalSections() {
            String seed = builder.seedContext(request(
                    Map.of("modified", List.of("service.py")),
                    Map.of("service.py", "@@ -1 +1 @@\n-old\n+new\n"),
                    "All writes go through the repository.", "Orders can now be placed twice."),
                    index, null, NOW);

            assertTrue(seed.contains("## Project Design Document (mandatory compliance)"));
            assertTrue(seed.contains("All writes go through the repository."));
            assertTrue(seed.contains("## Story / Change Context"));
            assertTrue(seed.contains("```diff\n@@ -1 +1 @@\n-old\n+new\n```"));
        }

        @Test
        @DisplayName("reports an empty change set and lists every tool")
        void noChanges() {
            String seed = builder.seedContext(request(Map.of(), Map.of(), " ", null), index, null, NOW);

            assertTrue(seed.contains("## Changed Files\n(none reported)"));
            assertFalse(seed.contains("## Project Design Document"));
            assertFalse(seed.contains("## Diffs"));
            assertTrue(seed.contains("- read_file(filepath): "));
            assertTrue(seed.contains("- search_text(pattern, file_pattern?): "));
            assertTrue(seed.contains("- get_file_tree(): "));
        }

        @Test
        @DisplayName("a continued session starts with a digest of the previous review")
        void continuation() {
            Session prior = new Session("id", "feature", root.toString(),
                    NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofHours(3)),
                    List.of(ConversationMessage.user("seed"),
                            ConversationMessage.assistant("ISSUE: place() skips validation", List.of())),
                    List.of(new TraceEntry("read_file", Map.of("filepath", "service.py"), 120, "ok"),
                            new TraceEntry("search_symbol", Map.of("symbol_name", "save"), 80, "ok")),
                    1, 900L, 1);

            String seed = builder.seedContext(request(Map.of(), Map.of(), null, null), index, prior, NOW);

            assertTrue(seed.startsWith("## Continuing review session (iteration 2)\nLast reviewed: 3 hours ago\n"));
            assertTrue(seed.contains("Previous review reported 1 issue(s)."));
            assertTrue(seed.contains("Files explored previously: service.py\n"));
            assertTrue(seed.contains("### Previous findings\nISSUE: place() skips validation"));
        }

        @Test
        @DisplayName("long previous findings are truncated")
        void digestTruncated() {
            properties.setDigestMaxChars(10);
            Session prior = new Session("id", "feature", root.toString(), NOW, NOW,
                    List.of(ConversationMessage.assistant("ISSUE: a very long finding", List.of())),
                    List.of(), 1, 0L, 1);

            String seed = builder.seedContext(request(Map.of(), Map.of(), null, null), index, prior, NOW);

            assertTrue(seed.contains("### Previous findings\nISSUE: a v\n[...]"));
            assertFalse(seed.contains("### Previous findings\nISSUE: a very"));
        }
    }

    @Test
    @DisplayName("system prompt depends on show-all")
    void systemPrompt() {
        assertTrue(builder.systemPrompt(false).contains("HIGH PRIORITY"));
        assertFalse(builder.systemPrompt(false).contains("PRIORITY: HIGH | MEDIUM | DEFER"));
        assertTrue(builder.systemPrompt(true).contains("PRIORITY: HIGH | MEDIUM | DEFER"));
    }

    @Test
    @DisplayName("countIssues counts ISSUE lines only")
    void countIssues() {
        String verdict = """
                FILE: a.py
                LINE: 3
                ISSUE: first
                FIX: something
                  issue: second, indented and lower case
                No ISSUE: here
                """;
        assertEquals(2, ReviewPromptBuilder.countIssues(verdict));
        assertEquals(0, ReviewPromptBuilder.countIssues(null));
        assertEquals(0, ReviewPromptBuilder.countIssues("No blocking issues."));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0 seconds ago",
            "59, 59 seconds ago",
            "60, 1 minutes ago",
            "7199, 119 minutes ago",
            "7200, 2 hours ago",
            "172800, 2 days ago"
    })
    @DisplayName("formatTimeAgo picks the largest fitting unit")
    void formatTimeAgo(long seconds, String expected) {
        assertEquals(expected, ReviewPromptBuilder.formatTimeAgo(Duration.ofSeconds(seconds)));
    }

    @Nested
    @DisplayName("condensed history")
    class CondensedHistory {

        private final ToolCallRequest read = new ToolCallRequest("c1", "read_file", "{\"filepath\":\"service.py\"}");

        private List<ConversationMessage> history() {
            return List.of(
                    ConversationMessage.user("Review service.py\nplease"),
                    ConversationMessage.assistant(null, List.of(read)),
                    ConversationMessage.tool(read, "x".repeat(500)),
                    ConversationMessage.assistant("ISSUE: save result ignored", List.of()));
        }

        @Test
        @DisplayName("renders one clipped line per turn")
        void rendersTurns() {
            String transcript = ReviewPromptBuilder.condensedHistory(history(), 6000);

            assertEquals("""
                    [user] Review service.py please
                    [assistant] -> read_file {"filepath":"service.py"}
                    [tool read_file] %s...
                    [assistant] ISSUE: save result ignored
                    """.formatted("x".repeat(200)), transcript);
        }

        @Test
        @DisplayName("keeps the most recent turns within the budget")
        void keepsRecentTurns() {
            String transcript = ReviewPromptBuilder.condensedHistory(history(), 80);

            assertTrue(transcript.startsWith("[3 earlier turn(s) omitted]"));
            assertTrue(transcript.endsWith("[assistant] ISSUE: save result ignored\n"));
            assertFalse(transcript.contains("[user]"));
        }

        @Test
        @DisplayName("an empty history or budget renders nothing")
        void empty() {
            assertEquals("", ReviewPromptBuilder.condensedHistory(List.of(), 6000));
            assertEquals("", ReviewPromptBuilder.condensedHistory(history(), 0));
        }
    }
}
