package com.codescout.core.navigation;

import com.codescout.core.index.CodebaseIndex;
import com.codescout.core.index.CodebaseIndexer;
import com.codescout.core.index.IndexProperties;
import com.codescout.core.index.SourceParserRegistry;
import com.codescout.core.index.SymbolEntry;
import com.codescout.core.index.SymbolKind;
import com.codescout.core.metrics.ReviewMetrics;
import com.codescout.core.sandbox.NotFoundException;
import com.codescout.core.sandbox.OutsideSandboxException;
import com.codescout.core.sandbox.SandboxedFileAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NavigationToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path root;
    private NavigationProperties properties;
    private NavigationTools tools;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("project"));
        write("a.py", """
                def foo():
                    return 1
                """);
        write("b.py", """
                from a import foo

                def bar():
                    return foo() + 1
                """);
        write("c.py", """
                # foo is mentioned here without importing it
                food = 3
                """);
        write("docs/notes.md", "foo appears in docs\n");
        Files.writeString(tempDir.resolve("outside.py"), "SECRET = 1\n");

        properties = new NavigationProperties();
        tools = newTools();
    }

    private NavigationTools newTools() {
        CodebaseIndexer indexer = new CodebaseIndexer(new IndexProperties(), new SourceParserRegistry(),
                new ReviewMetrics(new SimpleMeterRegistry()));
        CodebaseIndex index = indexer.build(root);
        return new NavigationTools(index, new SandboxedFileAccessor(root), properties);
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Nested
    @DisplayName("typed operations")
    class Operations {

        @Test
        @DisplayName("search_symbol finds the definition site")
        void searchSymbol() {
            List<SymbolEntry> found = tools.searchSymbol("foo");

            assertEquals(1, found.size());
            assertEquals("a.py", found.get(0).file());
            assertEquals(1, found.get(0).line());
            assertEquals(SymbolKind.FUNCTION, found.get(0).kind());
        }

        @Test
        @DisplayName("find_usages lists callers, importers first, and skips the definition")
        void findUsages() {
            List<UsageMatch> usages = tools.findUsages("foo");

            assertTrue(usages.contains(new UsageMatch("b.py", 4, "return foo() + 1", true)));
            assertTrue(usages.contains(new UsageMatch("b.py", 1, "from a import foo", true)));
            assertTrue(usages.stream().noneMatch(u -> u.file().equals("a.py") && u.line() == 1));
            assertTrue(usages.stream().noneMatch(u -> u.content().startsWith("food")));
            assertTrue(usages.get(0).importsDefinition());
            assertFalse(usages.get(usages.size() - 1).importsDefinition());
        }

        @Test
        @DisplayName("unknown symbols give empty lists")
        void unknownSymbol() {
            assertEquals(List.of(), tools.searchSymbol("doesNotExist"));
            assertEquals(List.of(), tools.findUsages("doesNotExist"));
        }

        @Test
        void getImportsResolvesToFiles() {
            assertEquals(List.of("a.py"), tools.getImports("b.py"));
            assertThrows(NotFoundException.class, () -> tools.getImports("missing.py"));
        }

        @Test
        void readFileStaysInSandbox() {
            assertThrows(OutsideSandboxException.class, () -> tools.readFile("../outside.py"));
            assertThrows(NotFoundException.class, () -> tools.readFile("missing.py"));
        }

        @Test
        @DisplayName("read_file truncates long content with a marker")
        void truncation() throws IOException {
            write("long.txt", "x".repeat(50));
            properties.setReadMaxChars(10);

            String content = tools.readFile("long.txt");

            assertEquals("x".repeat(10) + "\n\n[truncated: showing first 10 of 50 characters]", content);
        }

        @Test
        @DisplayName("read_file serves the snapshot taken on first read")
        void snapshot() throws IOException {
            String first = tools.readFile("a.py");
            write("a.py", "def changed():\n    pass\n");

            assertEquals(first, tools.readFile("a.py"));
        }

        @Test
        void fileTreeRendersProject() {
            String tree = tools.getFileTree();
            assertTrue(tree.startsWith("project/"));
            assertTrue(tree.contains("notes.md"));
        }

        @Test
        @DisplayName("search_text honours glob and prefix scopes")
        void searchText() {
            // a.py:1, b.py:1, b.py:4, c.py:1 and "food" on c.py:2
            assertEquals(5, tools.searchText("foo", "*.py").size());
            assertTrue(tools.searchText("foo", "docs").stream().allMatch(m -> m.file().equals("docs/notes.md")));
            assertEquals(List.of(new TextMatch("c.py", 2, "food = 3")), tools.searchText("^food", null));
            assertThrows(InvalidToolCallException.class, () -> tools.searchText("(", null));
            assertThrows(OutsideSandboxException.class, () -> tools.searchText("x", "../"));
        }
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("valid calls return JSON and are traced")
        void validCall() throws Exception {
            ToolResult result = tools.execute("search_symbol", "{\"symbol_name\":\"foo\"}");

            assertEquals(ToolOutcome.OK, result.outcome());
            JsonNode json = MAPPER.readTree(result.content());
            assertEquals("a.py", json.get(0).get("file").asText());
            assertEquals("function", json.get(0).get("kind").asText());

            TraceEntry entry = tools.trace().entries().get(0);
            assertEquals("search_symbol", entry.tool());
            assertEquals(Map.of("symbol_name", "foo"), entry.arguments());
            assertEquals(result.size(), entry.resultSize());
            assertEquals("ok", entry.reasonTag());
        }

        @Test
        @DisplayName("repeated calls are served from the cache")
        void cacheHit() {
            ToolResult first = tools.execute("read_file", "{\"filepath\":\"a.py\"}");
            ToolResult second = tools.execute("read_file", "{\"filepath\": \"a.py\" }");

            assertEquals(ToolOutcome.OK, first.outcome());
            assertEquals(ToolOutcome.CACHED, second.outcome());
            assertEquals(first.content(), second.content());

            NavigationSummary summary = tools.trace().summary();
            assertEquals(2, summary.totalCalls());
            assertEquals(1, summary.cachedCalls());
            assertEquals(List.of("a.py"), summary.filesRead());
        }

        @Test
        @DisplayName("unknown tools and malformed arguments become invalid_call results")
        void invalidCalls() throws Exception {
            ToolResult unknown = tools.execute("delete_file", "{\"filepath\":\"a.py\"}");
            ToolResult missingArg = tools.execute("read_file", "{}");
            ToolResult wrongType = tools.execute("search_symbol", "{\"symbol_name\": 42}");
            ToolResult notJson = tools.execute("read_file", "not json");

            for (ToolResult result : List.of(unknown, missingArg, wrongType, notJson)) {
                assertEquals(ToolOutcome.INVALID_CALL, result.outcome());
                assertEquals("invalid_call", MAPPER.readTree(result.content()).get("error").asText());
            }
            assertEquals(4, tools.trace().size());
        }

        @Test
        @DisplayName("sandbox escapes and missing files are error results, not exceptions")
        void errorResults() throws Exception {
            ToolResult outside = tools.execute("read_file", "{\"filepath\":\"../outside.py\"}");
            ToolResult missing = tools.execute("read_file", "{\"filepath\":\"nope.py\"}");

            assertEquals(ToolOutcome.OUTSIDE_SANDBOX, outside.outcome());
            assertEquals("outside_sandbox", MAPPER.readTree(outside.content()).get("error").asText());
            assertFalse(outside.content().contains("SECRET"));
            assertEquals(ToolOutcome.NOT_FOUND, missing.outcome());
            assertTrue(tools.filesRead().isEmpty());
        }

        @Test
        void getFileTreeTakesNoArguments() {
            assertEquals(ToolOutcome.OK, tools.execute("get_file_tree", null).outcome());
        }

        @Test
        @DisplayName("wouldReadNewFile only flags unread read_file targets")
        void wouldReadNewFile() {
            assertTrue(tools.wouldReadNewFile("read_file", "{\"filepath\":\"a.py\"}"));
            tools.execute("read_file", "{\"filepath\":\"a.py\"}");
            assertFalse(tools.wouldReadNewFile("read_file", "{\"filepath\":\"./a.py\"}"));
            assertFalse(tools.wouldReadNewFile("search_symbol", "{\"symbol_name\":\"foo\"}"));
        }
    }
}
