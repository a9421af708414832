package com.codescout.core.index;

import com.codescout.core.metrics.ReviewMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Walks a project directory and builds a {@link CodebaseIndex}.
 * <p>
 * Dependency, build-output and VCS directories are excluded by default. The
 * project {@code .gitignore} and caller-supplied patterns are merged on top.
 * A file that cannot be read or scanned is recorded as unparsed and the walk
 * carries on.
 */
@Service
public class CodebaseIndexer {

    private static final Logger log = LoggerFactory.getLogger(CodebaseIndexer.class);

    private final IndexProperties properties;
    private final SourceParserRegistry parsers;
    private final ReviewMetrics metrics;

    public CodebaseIndexer(IndexProperties properties, SourceParserRegistry parsers, ReviewMetrics metrics) {
        this.properties = properties;
        this.parsers = parsers;
        this.metrics = metrics;
    }

    public CodebaseIndex build(Path projectRoot) {
        return build(projectRoot, List.of());
    }

    /**
     * Indexes every non-ignored file under the project root.
     *
     * @param projectRoot    directory to index
     * @param ignorePatterns extra gitignore-style patterns for this build
     * @throws IllegalArgumentException if the root is not a directory
     */
    public CodebaseIndex build(Path projectRoot, List<String> ignorePatterns) {
        long start = System.nanoTime();
        Path root = canonicalRoot(projectRoot);
        IgnoreRules rules = IgnoreRules.of(mergePatterns(root, ignorePatterns));

        Map<String, IndexedFile> files = new TreeMap<>();
        walk(root, root, rules, files);

        CodebaseIndex index = new CodebaseIndex(root, rules, files, Duration.ofNanos(System.nanoTime() - start));
        report(index, "Built");
        return index;
    }

    /**
     * Re-indexes only the given paths. Paths that no longer exist, or that are
     * now ignored, are removed together with anything below them.
     *
     * @param changedPaths project-relative or absolute paths
     */
    public CodebaseIndex update(CodebaseIndex index, Collection<String> changedPaths) {
        if (changedPaths == null || changedPaths.isEmpty()) {
            return index;
        }
        long start = System.nanoTime();
        Path root = index.root();
        IgnoreRules rules = index.ignoreRules();
        Map<String, IndexedFile> files = new TreeMap<>(index.files());

        for (String changed : changedPaths) {
            Path candidate = root.resolve(changed).normalize();
            if (!candidate.startsWith(root) || candidate.equals(root)) {
                log.warn("Ignoring changed path outside the project root: {}", changed);
                continue;
            }
            String relative = toRelative(root, candidate);
            removeUnder(files, relative);
            if (Files.isDirectory(candidate, LinkOption.NOFOLLOW_LINKS)) {
                if (!rules.isIgnored(relative, true)) {
                    walk(root, candidate, rules, files);
                }
            } else if (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)
                    && !rules.isIgnored(relative, false)) {
                Path readable = insideRoot(root, candidate);
                if (readable != null && Files.isRegularFile(readable)) {
                    files.put(relative, indexFile(relative, readable));
                }
            }
        }

        CodebaseIndex updated = new CodebaseIndex(root, rules, files, Duration.ofNanos(System.nanoTime() - start));
        report(updated, "Updated");
        return updated;
    }

    private void walk(Path root, Path start, IgnoreRules rules, Map<String, IndexedFile> files) {
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && rules.matches(toRelative(root, dir), true)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String relative = toRelative(root, file);
                    if (rules.matches(relative, false)) {
                        return FileVisitResult.CONTINUE;
                    }
                    Path readable = attrs.isSymbolicLink() ? insideRoot(root, file) : file;
                    if (readable != null && Files.isRegularFile(readable)) {
                        files.put(relative, indexFile(relative, readable));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + start, e);
        }
    }

    private IndexedFile indexFile(String relative, Path path) {
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", relative, e.getMessage());
            return IndexedFile.withoutContent(relative, 0, ParseStatus.FAILED);
        }

        var parser = parsers.parserFor(relative);
        if (parser.isEmpty()) {
            return IndexedFile.withoutContent(relative, size, ParseStatus.NOT_SOURCE);
        }
        if (size > properties.getMaxFileBytes()) {
            return IndexedFile.withoutContent(relative, size, ParseStatus.TOO_LARGE);
        }

        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            ParsedSource parsed = parser.get().parse(relative, content);
            return new IndexedFile(relative, size, ParseStatus.PARSED, parsed.symbols(), parsed.imports());
        } catch (IOException | SourceParseException e) {
            log.warn("Unparsed file {}: {}", relative, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Parser failed on {}", relative, e);
        }
        return IndexedFile.withoutContent(relative, size, ParseStatus.FAILED);
    }

    private List<String> mergePatterns(Path root, List<String> extra) {
        List<String> patterns = new ArrayList<>(properties.getIgnorePatterns());
        Path gitignore = root.resolve(".gitignore");
        if (properties.isRespectGitignore() && Files.isRegularFile(gitignore)) {
            try {
                patterns.addAll(Files.readAllLines(gitignore, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Cannot read {}: {}", gitignore, e.getMessage());
            }
        }
        if (extra != null) {
            patterns.addAll(extra);
        }
        return patterns;
    }

    private void report(CodebaseIndex index, String verb) {
        IndexStats stats = index.stats();
        log.info("{} index for {}: {} files, {} symbols in {} ms",
                verb, index.root(), stats.totalFiles(), stats.totalSymbols(), index.buildDuration().toMillis());
        if (stats.unparsedFiles() > 0) {
            log.warn("{} file(s) could not be parsed", stats.unparsedFiles());
        }
        metrics.recordIndexBuild(index.buildDuration(), stats.unparsedFiles());
    }

    /** Real path of a symlinked file, or {@code null} when it leaves the root or is broken. */
    private static Path insideRoot(Path root, Path path) {
        try {
            Path real = path.toRealPath();
            return real.startsWith(root) ? real : null;
        } catch (IOException e) {
            log.debug("Skipping unresolvable link {}: {}", path, e.getMessage());
            return null;
        }
    }

    private static void removeUnder(Map<String, IndexedFile> files, String relative) {
        files.remove(relative);
        files.keySet().removeIf(path -> path.startsWith(relative + "/"));
    }

    private static Path canonicalRoot(Path projectRoot) {
        if (!Files.isDirectory(projectRoot)) {
            throw new IllegalArgumentException("Project root is not a directory: " + projectRoot);
        }
        try {
            return projectRoot.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot canonicalize " + projectRoot, e);
        }
    }

    private static String toRelative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
