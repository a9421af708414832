package com.codescout.core.index;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Gitignore-style matcher over project-relative paths.
 * <p>
 * Supported syntax: blank lines and {@code #} comments are skipped, a trailing
 * {@code /} limits a pattern to directories, a pattern containing {@code /} is
 * anchored at the root, any other pattern matches a path component at any depth,
 * and {@code !} re-includes. The last matching pattern wins.
 */
public final class IgnoreRules {

    private final List<String> patterns;
    private final List<Rule> rules;

    private record Rule(PathMatcher matcher, boolean anchored, boolean directoryOnly, boolean negated) {}

    private IgnoreRules(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
        this.rules = new ArrayList<>();
        for (String line : this.patterns) {
            Rule rule = compile(line);
            if (rule != null) {
                rules.add(rule);
            }
        }
    }

    public static IgnoreRules of(List<String> patterns) {
        return new IgnoreRules(patterns);
    }

    public List<String> patterns() {
        return patterns;
    }

    /**
     * Evaluates only the path itself, for use while walking where ignored
     * parents have already been pruned.
     */
    public boolean matches(String relativePath, boolean directory) {
        if (relativePath.isEmpty()) {
            return false;
        }
        Path path = Paths.get(relativePath);
        Path name = path.getFileName();
        boolean ignored = false;
        for (Rule rule : rules) {
            if (rule.directoryOnly() && !directory) {
                continue;
            }
            boolean hit = rule.anchored() ? rule.matcher().matches(path) : rule.matcher().matches(name);
            if (hit) {
                ignored = !rule.negated();
            }
        }
        return ignored;
    }

    /**
     * Evaluates the path and each of its ancestor directories.
     */
    public boolean isIgnored(String relativePath, boolean directory) {
        String[] parts = relativePath.split("/");
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < parts.length - 1; i++) {
            if (i > 0) {
                prefix.append('/');
            }
            prefix.append(parts[i]);
            if (matches(prefix.toString(), true)) {
                return true;
            }
        }
        return matches(relativePath, directory);
    }

    private static Rule compile(String line) {
        String pattern = line.strip();
        if (pattern.isEmpty() || pattern.startsWith("#")) {
            return null;
        }
        boolean negated = pattern.startsWith("!");
        if (negated) {
            pattern = pattern.substring(1);
        }
        boolean directoryOnly = pattern.endsWith("/");
        if (directoryOnly) {
            pattern = pattern.substring(0, pattern.length() - 1);
        }
        boolean anchored = pattern.contains("/");
        if (pattern.startsWith("/")) {
            pattern = pattern.substring(1);
        }
        if (pattern.isEmpty()) {
            return null;
        }
        try {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            return new Rule(matcher, anchored, directoryOnly, negated);
        } catch (IllegalArgumentException e) {
            // malformed glob in a .gitignore line: the line is ignored, as git does
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IgnoreRules other && patterns.equals(other.patterns);
    }

    @Override
    public int hashCode() {
        return patterns.hashCode();
    }
}
