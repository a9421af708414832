package com.codescout.core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * File to dependency edges. A dependency is a project-relative path when the
 * import resolved to an indexed file, otherwise the raw specifier.
 * Reverse edges are computed on demand.
 */
public final class ImportGraph {

    private final Map<String, List<String>> dependencies;

    ImportGraph(Map<String, List<String>> dependencies) {
        TreeMap<String, List<String>> copy = new TreeMap<>();
        dependencies.forEach((file, deps) -> copy.put(file, List.copyOf(deps)));
        this.dependencies = Collections.unmodifiableMap(copy);
    }

    public List<String> dependenciesOf(String file) {
        return dependencies.getOrDefault(file, List.of());
    }

    /** Files whose dependencies include {@code file}, in path order. */
    public List<String> dependentsOf(String file) {
        List<String> dependents = new ArrayList<>();
        dependencies.forEach((source, deps) -> {
            if (deps.contains(file)) {
                dependents.add(source);
            }
        });
        return dependents;
    }

    public Set<String> files() {
        return dependencies.keySet();
    }

    public Map<String, List<String>> asMap() {
        return dependencies;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ImportGraph other && dependencies.equals(other.dependencies);
    }

    @Override
    public int hashCode() {
        return dependencies.hashCode();
    }
}
