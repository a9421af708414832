package com.codescout.core.index;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable structural snapshot of a project: indexed files plus the views
 * derived from them (tree, symbol table, import graph, test mapping, stats).
 * <p>
 * Two indexes are equal when they cover the same root with the same ignore
 * rules and the same per-file parse results. Build duration is informational.
 */
public final class CodebaseIndex {

    private static final Comparator<SymbolEntry> LOCATION_ORDER =
            Comparator.comparing(SymbolEntry::file).thenComparingInt(SymbolEntry::line);

    private final Path root;
    private final IgnoreRules ignoreRules;
    private final SortedMap<String, IndexedFile> files;
    private final Duration buildDuration;

    private final FileNode fileTree;
    private final Map<String, List<SymbolEntry>> symbols;
    private final ImportGraph importGraph;
    private final Map<String, List<String>> testMapping;
    private final IndexStats stats;

    CodebaseIndex(Path root, IgnoreRules ignoreRules, Map<String, IndexedFile> files, Duration buildDuration) {
        this.root = root;
        this.ignoreRules = ignoreRules;
        this.files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
        this.buildDuration = buildDuration;

        Path fileName = root.getFileName();
        this.fileTree = FileNode.build(fileName != null ? fileName.toString() : root.toString(), this.files.values());
        this.symbols = buildSymbolTable(this.files);
        this.importGraph = buildImportGraph(this.files);
        this.testMapping = Collections.unmodifiableMap(TestFileMatcher.map(this.files, importGraph));
        this.stats = computeStats();
    }

    public Path root() {
        return root;
    }

    public IgnoreRules ignoreRules() {
        return ignoreRules;
    }

    public SortedMap<String, IndexedFile> files() {
        return files;
    }

    public Duration buildDuration() {
        return buildDuration;
    }

    public FileNode fileTree() {
        return fileTree;
    }

    /** Name to definition sites, ordered by file then line. */
    public Map<String, List<SymbolEntry>> symbols() {
        return symbols;
    }

    public List<SymbolEntry> symbolsIn(String file) {
        IndexedFile indexed = files.get(file);
        return indexed != null ? indexed.symbols() : List.of();
    }

    public ImportGraph importGraph() {
        return importGraph;
    }

    public Map<String, List<String>> testMapping() {
        return testMapping;
    }

    public IndexStats stats() {
        return stats;
    }

    public String summary() {
        return """
                Indexed %d files (%d source, %d tests) in %d ms
                Symbols: %d definitions, %d unique names
                Import edges: %d files with dependencies
                Unparsed files: %d""".formatted(
                stats.totalFiles(), stats.sourceFiles(), stats.testFiles(), buildDuration.toMillis(),
                stats.totalSymbols(), stats.uniqueSymbols(),
                importGraph.asMap().values().stream().filter(deps -> !deps.isEmpty()).count(),
                stats.unparsedFiles());
    }

    private static Map<String, List<SymbolEntry>> buildSymbolTable(Map<String, IndexedFile> files) {
        Map<String, List<SymbolEntry>> table = new HashMap<>();
        for (IndexedFile file : files.values()) {
            for (SymbolEntry symbol : file.symbols()) {
                table.computeIfAbsent(symbol.name(), k -> new ArrayList<>()).add(symbol);
            }
        }
        TreeMap<String, List<SymbolEntry>> sorted = new TreeMap<>();
        table.forEach((name, entries) -> {
            entries.sort(LOCATION_ORDER);
            sorted.put(name, List.copyOf(entries));
        });
        return Collections.unmodifiableMap(sorted);
    }

    private static ImportGraph buildImportGraph(Map<String, IndexedFile> files) {
        ImportResolver resolver = new ImportResolver(files.keySet());
        Map<String, List<String>> edges = new TreeMap<>();
        for (IndexedFile file : files.values()) {
            if (file.status() == ParseStatus.PARSED) {
                edges.put(file.path(), resolver.resolveAll(file.path(), file.imports()));
            }
        }
        return new ImportGraph(edges);
    }

    private IndexStats computeStats() {
        int source = 0;
        int unparsed = 0;
        int symbolCount = 0;
        int tests = 0;
        for (IndexedFile file : files.values()) {
            if (file.isSource()) {
                source++;
                if (TestFileMatcher.isTestFile(file.path())) {
                    tests++;
                }
            }
            if (file.status() == ParseStatus.FAILED) {
                unparsed++;
            }
            symbolCount += file.symbols().size();
        }
        return new IndexStats(files.size(), source, symbolCount, symbols.size(), tests, unparsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodebaseIndex other)) return false;
        return root.equals(other.root) && ignoreRules.equals(other.ignoreRules) && files.equals(other.files);
    }

    @Override
    public int hashCode() {
        return root.hashCode() * 31 + files.hashCode();
    }

    @Override
    public String toString() {
        return "CodebaseIndex[root=" + root + ", files=" + files.size() + "]";
    }
}
