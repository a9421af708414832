package com.codescout.core.navigation;

import com.codescout.core.CodescoutException;
import com.codescout.core.index.CodebaseIndex;
import com.codescout.core.index.IndexedFile;
import com.codescout.core.index.ParseStatus;
import com.codescout.core.index.SymbolEntry;
import com.codescout.core.sandbox.NotFoundException;
import com.codescout.core.sandbox.OutsideSandboxException;
import com.codescout.core.sandbox.SandboxedFileAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The navigation operations of one review, bound to a single index snapshot.
 * <p>
 * Instances hold the review's result cache, file-content snapshot and trace,
 * so a new instance is created for every review and never shared.
 */
public class NavigationTools {

    private static final Logger log = LoggerFactory.getLogger(NavigationTools.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_LINE_CHARS = 200;

    private final CodebaseIndex index;
    private final SandboxedFileAccessor accessor;
    private final NavigationProperties properties;

    private final Map<String, ToolResult> resultCache = new HashMap<>();
    private final Map<String, Optional<String>> contentSnapshot = new HashMap<>();
    private final Set<String> filesRead = new LinkedHashSet<>();
    private final NavigationTrace trace = new NavigationTrace();

    public NavigationTools(CodebaseIndex index, SandboxedFileAccessor accessor, NavigationProperties properties) {
        this.index = index;
        this.accessor = accessor;
        this.properties = properties;
    }

    public NavigationTrace trace() {
        return trace;
    }

    /** Distinct project-relative files returned by {@link #readFile} so far. */
    public Set<String> filesRead() {
        return Set.copyOf(filesRead);
    }

    // --- Dispatch ---

    /**
     * Executes one tool call requested by the engine. Never throws for bad
     * input: unknown tools, malformed arguments and failed lookups come back as
     * error results. Every call is appended to the trace.
     *
     * @param rawArguments the JSON arguments object as sent by the engine
     */
    public ToolResult execute(String toolName, String rawArguments) {
        Optional<NavigationOperation> operation = NavigationOperation.fromToolName(toolName);
        if (operation.isEmpty()) {
            return record(toolName, Map.of(), error(toolName, ToolOutcome.INVALID_CALL,
                    new InvalidToolCallException("Unknown tool '" + toolName + "'. Available: " + availableTools())));
        }

        Map<String, String> arguments;
        try {
            arguments = operation.get().validate(parseArguments(rawArguments));
        } catch (InvalidToolCallException e) {
            return record(toolName, Map.of(), error(toolName, ToolOutcome.INVALID_CALL, e));
        }

        String cacheKey = toolName + arguments;
        ToolResult cached = resultCache.get(cacheKey);
        if (cached != null) {
            return record(toolName, arguments, cached.withOutcome(ToolOutcome.CACHED));
        }

        ToolResult result;
        try {
            result = new ToolResult(toolName, ToolOutcome.OK, render(dispatch(operation.get(), arguments)));
        } catch (OutsideSandboxException e) {
            result = error(toolName, ToolOutcome.OUTSIDE_SANDBOX, e);
        } catch (NotFoundException e) {
            result = error(toolName, ToolOutcome.NOT_FOUND, e);
        } catch (InvalidToolCallException e) {
            result = error(toolName, ToolOutcome.INVALID_CALL, e);
        }
        resultCache.put(cacheKey, result);
        return record(toolName, arguments, result);
    }

    /**
     * Whether executing this call would read a file not yet read in this review.
     * Used to enforce the distinct-files bound before dispatch.
     */
    public boolean wouldReadNewFile(String toolName, String rawArguments) {
        if (!NavigationOperation.READ_FILE.toolName().equals(toolName)) {
            return false;
        }
        try {
            Object path = parseArguments(rawArguments).get("filepath");
            if (!(path instanceof String requested)) {
                return false;
            }
            return !filesRead.contains(accessor.relativize(accessor.resolve(requested.strip())));
        } catch (InvalidToolCallException | OutsideSandboxException e) {
            return false;
        }
    }

    private Object dispatch(NavigationOperation operation, Map<String, String> arguments) {
        return switch (operation) {
            case READ_FILE -> readFile(arguments.get("filepath"));
            case SEARCH_SYMBOL -> searchSymbol(arguments.get("symbol_name"));
            case FIND_USAGES -> findUsages(arguments.get("symbol_name"));
            case GET_IMPORTS -> getImports(arguments.get("filepath"));
            case GET_FILE_TREE -> getFileTree();
            case SEARCH_TEXT -> searchText(arguments.get("pattern"), arguments.get("file_pattern"));
        };
    }

    // --- Operations ---

    /**
     * Returns file content, truncated past the configured character limit.
     *
     * @throws OutsideSandboxException if the path escapes the project root
     * @throws NotFoundException       if the file is missing, a directory or binary
     */
    public String readFile(String filepath) {
        Path resolved = accessor.resolve(filepath);
        String relative = accessor.relativize(resolved);
        Optional<String> snapshot = contentSnapshot.get(relative);
        String content;
        if (snapshot != null && snapshot.isPresent()) {
            content = snapshot.get();
        } else {
            content = accessor.read(relative);
            contentSnapshot.put(relative, Optional.of(content));
        }
        filesRead.add(relative);

        int max = properties.getReadMaxChars();
        if (content.length() <= max) {
            return content;
        }
        return content.substring(0, max)
                + "\n\n[truncated: showing first " + max + " of " + content.length() + " characters]";
    }

    public List<SymbolEntry> searchSymbol(String symbolName) {
        return index.symbols().getOrDefault(symbolName, List.of());
    }

    /**
     * Word-boundary matches of a symbol name outside its definition sites.
     * Files that import a defining file are listed first.
     */
    public List<UsageMatch> findUsages(String symbolName) {
        if (symbolName == null || symbolName.isBlank()) {
            return List.of();
        }
        Pattern pattern = Pattern.compile("(?<![\\w$])" + Pattern.quote(symbolName) + "(?![\\w$])");
        List<SymbolEntry> definitions = searchSymbol(symbolName);
        Set<String> definitionSites = new HashSet<>();
        Set<String> importers = new HashSet<>();
        for (SymbolEntry definition : definitions) {
            definitionSites.add(definition.file() + ":" + definition.line());
            importers.addAll(index.importGraph().dependentsOf(definition.file()));
        }

        List<UsageMatch> matches = new ArrayList<>();
        for (IndexedFile file : index.files().values()) {
            Optional<String> content = textOf(file);
            if (content.isEmpty()) {
                continue;
            }
            String[] lines = content.get().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (pattern.matcher(lines[i]).find() && !definitionSites.contains(file.path() + ":" + (i + 1))) {
                    matches.add(new UsageMatch(file.path(), i + 1, clip(lines[i]), importers.contains(file.path())));
                }
            }
        }
        matches.sort(Comparator.comparing((UsageMatch match) -> !match.importsDefinition()));
        return matches.size() > properties.getMaxResults()
                ? List.copyOf(matches.subList(0, properties.getMaxResults()))
                : matches;
    }

    /**
     * @throws OutsideSandboxException if the path escapes the project root
     * @throws NotFoundException       if the file is not part of the index
     */
    public List<String> getImports(String filepath) {
        String relative = accessor.relativize(accessor.resolve(filepath));
        if (!index.files().containsKey(relative)) {
            throw new NotFoundException("File not indexed: " + filepath);
        }
        return index.importGraph().dependenciesOf(relative);
    }

    public String getFileTree() {
        return index.fileTree().render();
    }

    /**
     * Regex search across indexed text files.
     *
     * @param scope optional glob ({@code *.py}, {@code src/**}) or a directory/file prefix
     * @throws InvalidToolCallException if the pattern or glob does not compile
     */
    public List<TextMatch> searchText(String regex, String scope) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidToolCallException("Invalid regular expression: " + e.getDescription(), e);
        }
        Predicate<String> inScope = scopeFilter(scope);

        List<TextMatch> matches = new ArrayList<>();
        for (IndexedFile file : index.files().values()) {
            if (!inScope.test(file.path())) {
                continue;
            }
            Optional<String> content = textOf(file);
            if (content.isEmpty()) {
                continue;
            }
            String[] lines = content.get().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                Matcher m = pattern.matcher(lines[i]);
                if (m.find()) {
                    matches.add(new TextMatch(file.path(), i + 1, clip(lines[i])));
                    if (matches.size() >= properties.getMaxResults()) {
                        return matches;
                    }
                }
            }
        }
        return matches;
    }

    // --- Helpers ---

    private Predicate<String> scopeFilter(String scope) {
        if (scope == null || scope.isBlank()) {
            return path -> true;
        }
        String trimmed = scope.strip();
        if (trimmed.chars().anyMatch(c -> c == '*' || c == '?' || c == '[' || c == '{')) {
            PathMatcher matcher;
            try {
                matcher = FileSystems.getDefault().getPathMatcher("glob:" + trimmed);
            } catch (IllegalArgumentException e) {
                throw new InvalidToolCallException("Invalid file pattern: " + trimmed, e);
            }
            boolean byName = !trimmed.contains("/");
            return path -> {
                Path candidate = Paths.get(path);
                return matcher.matches(byName ? candidate.getFileName() : candidate);
            };
        }
        String prefix = accessor.relativize(accessor.resolve(trimmed));
        if (prefix.isEmpty()) {
            return path -> true;
        }
        return path -> path.equals(prefix) || path.startsWith(prefix + "/");
    }

    /** Snapshot of a file's text; empty for oversized, binary or unreadable files. */
    private Optional<String> textOf(IndexedFile file) {
        if (file.status() == ParseStatus.TOO_LARGE || file.status() == ParseStatus.FAILED) {
            return Optional.empty();
        }
        return contentSnapshot.computeIfAbsent(file.path(), path -> {
            try {
                return Optional.of(accessor.read(path));
            } catch (NotFoundException | OutsideSandboxException e) {
                log.debug("Skipping {} during text scan: {}", path, e.getMessage());
                return Optional.empty();
            }
        });
    }

    private static Map<String, Object> parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = MAPPER.readValue(rawArguments, new TypeReference<LinkedHashMap<String, Object>>() {});
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new InvalidToolCallException("Arguments are not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    private ToolResult record(String toolName, Map<String, String> arguments, ToolResult result) {
        trace.append(new TraceEntry(toolName, arguments, result.size(), result.outcome().tag()));
        log.debug("Tool {} {} -> {} ({} chars)", toolName, arguments, result.outcome().tag(), result.size());
        return result;
    }

    private static ToolResult error(String toolName, ToolOutcome outcome, CodescoutException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.kind());
        body.put("message", e.getMessage());
        return new ToolResult(toolName, outcome, render(body));
    }

    private static String render(Object payload) {
        if (payload instanceof String text) {
            return text;
        }
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tool result", e);
        }
    }

    private static String clip(String line) {
        String trimmed = line.strip();
        return trimmed.length() > MAX_LINE_CHARS ? trimmed.substring(0, MAX_LINE_CHARS) + "..." : trimmed;
    }

    private static String availableTools() {
        StringBuilder names = new StringBuilder();
        for (NavigationOperation operation : NavigationOperation.values()) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(operation.toolName());
        }
        return names.toString();
    }
}
