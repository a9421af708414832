package com.codescout.core.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Detects test files by naming convention and links each to the source files
 * it most likely exercises.
 */
final class TestFileMatcher {

    private static final Set<String> TEST_DIRECTORIES = Set.of("test", "tests", "__tests__", "spec");

    private TestFileMatcher() {}

    static boolean isTestFile(String path) {
        String[] parts = path.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (TEST_DIRECTORIES.contains(parts[i])) {
                return true;
            }
        }
        String name = parts[parts.length - 1];
        String stem = stemOf(name);
        return name.startsWith("test_")
                || stem.endsWith("_test")
                || stem.endsWith("Test") || stem.endsWith("Tests")
                || name.contains(".test.") || name.contains(".spec.");
    }

    /**
     * Builds the mapping from test file to source files. Tests without any
     * linked source are left out.
     */
    static Map<String, List<String>> map(Map<String, IndexedFile> files, ImportGraph graph) {
        Map<String, List<String>> sourcesByStem = new TreeMap<>();
        for (IndexedFile file : files.values()) {
            if (file.isSource() && !isTestFile(file.path())) {
                sourcesByStem.computeIfAbsent(stemOf(fileName(file.path())), k -> new ArrayList<>()).add(file.path());
            }
        }

        Map<String, List<String>> mapping = new TreeMap<>();
        for (IndexedFile file : files.values()) {
            if (!file.isSource() || !isTestFile(file.path())) {
                continue;
            }
            LinkedHashSet<String> sources = new LinkedHashSet<>(
                    sourcesByStem.getOrDefault(subjectStem(fileName(file.path())), List.of()));
            for (String dependency : graph.dependenciesOf(file.path())) {
                IndexedFile target = files.get(dependency);
                if (target != null && target.isSource() && !isTestFile(dependency)) {
                    sources.add(dependency);
                }
            }
            if (!sources.isEmpty()) {
                mapping.put(file.path(), List.copyOf(sources));
            }
        }
        return mapping;
    }

    /** Strips test prefixes and suffixes: {@code test_foo.py} and {@code FooTest.java} give {@code foo}/{@code Foo}. */
    static String subjectStem(String name) {
        String stem = name;
        for (String marker : List.of(".test.", ".spec.")) {
            int idx = stem.indexOf(marker);
            if (idx > 0) {
                return stem.substring(0, idx);
            }
        }
        stem = stemOf(stem);
        if (stem.startsWith("test_")) {
            return stem.substring("test_".length());
        }
        for (String suffix : List.of("_test", "Tests", "Test")) {
            if (stem.endsWith(suffix) && stem.length() > suffix.length()) {
                return stem.substring(0, stem.length() - suffix.length());
            }
        }
        return stem;
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static String stemOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
