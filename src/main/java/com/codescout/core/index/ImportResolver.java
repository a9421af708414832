package com.codescout.core.index;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw import specifiers to project-relative paths where possible.
 */
final class ImportResolver {

    private static final List<String> SCRIPT_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs");

    private final Set<String> files;
    private final Map<String, List<String>> byFileName = new HashMap<>();

    ImportResolver(Set<String> files) {
        this.files = files;
        for (String file : files) {
            String name = file.substring(file.lastIndexOf('/') + 1);
            byFileName.computeIfAbsent(name, k -> new ArrayList<>()).add(file);
        }
    }

    /**
     * Resolves every import of one file, keeping first-seen order and dropping duplicates.
     */
    List<String> resolveAll(String importer, List<String> specifiers) {
        LinkedHashSet<String> resolved = new LinkedHashSet<>();
        for (String specifier : specifiers) {
            resolved.add(resolve(importer, specifier));
        }
        return new ArrayList<>(resolved);
    }

    String resolve(String importer, String specifier) {
        String extension = SourceParserRegistry.extensionOf(importer);
        String result = switch (extension) {
            case "py", "pyi" -> resolvePython(importer, specifier);
            case "js", "jsx", "ts", "tsx", "mjs", "cjs" -> resolveScript(importer, specifier);
            case "java", "kt", "kts" -> resolveJvm(specifier);
            case "php" -> resolvePhp(importer, specifier);
            default -> null;
        };
        return result != null ? result : specifier;
    }

    private String resolvePython(String importer, String specifier) {
        int level = 0;
        while (level < specifier.length() && specifier.charAt(level) == '.') {
            level++;
        }
        String module = specifier.substring(level).replace('.', '/');
        if (level > 0) {
            String base = parentOf(importer);
            for (int i = 1; i < level; i++) {
                if (base.isEmpty()) {
                    return null;
                }
                base = parentOf(base);
            }
            String target = join(base, module);
            return module.isEmpty() ? firstExisting(join(base, "__init__.py")) : pythonModule(target);
        }
        if (module.isEmpty()) {
            return null;
        }
        String found = pythonModule(module);
        if (found == null) {
            found = pythonModule("src/" + module);
        }
        if (found == null) {
            String dir = parentOf(importer);
            found = dir == null || dir.isEmpty() ? null : pythonModule(join(dir, module));
        }
        return found;
    }

    private String pythonModule(String base) {
        return firstExisting(base + ".py", base + "/__init__.py", base + ".pyi");
    }

    private String resolveScript(String importer, String specifier) {
        if (!specifier.startsWith(".") && !specifier.startsWith("/")) {
            return null;
        }
        String dir = specifier.startsWith("/") ? "" : parentOf(importer);
        String target = normalize(join(dir == null ? "" : dir, specifier));
        if (target == null) {
            return null;
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(target);
        for (String ext : SCRIPT_EXTENSIONS) {
            candidates.add(target + ext);
        }
        for (String ext : SCRIPT_EXTENSIONS) {
            candidates.add(target + "/index" + ext);
        }
        return firstExisting(candidates.toArray(String[]::new));
    }

    private String resolveJvm(String specifier) {
        if (specifier.endsWith(".*")) {
            return null;
        }
        String found = bySuffix(specifier);
        if (found == null && specifier.contains(".")) {
            // static member import: drop the member name
            found = bySuffix(specifier.substring(0, specifier.lastIndexOf('.')));
        }
        return found;
    }

    private String bySuffix(String qualifiedName) {
        String relative = qualifiedName.replace('.', '/');
        for (String ext : List.of(".java", ".kt")) {
            String suffix = relative + ext;
            String name = suffix.substring(suffix.lastIndexOf('/') + 1);
            for (String candidate : byFileName.getOrDefault(name, List.of())) {
                if (candidate.equals(suffix) || candidate.endsWith("/" + suffix)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private String resolvePhp(String importer, String specifier) {
        if (specifier.contains("\\")) {
            String suffix = specifier.replace('\\', '/') + ".php";
            String name = suffix.substring(suffix.lastIndexOf('/') + 1);
            for (String candidate : byFileName.getOrDefault(name, List.of())) {
                if (candidate.equals(suffix) || candidate.endsWith("/" + suffix)) {
                    return candidate;
                }
            }
            return null;
        }
        String dir = parentOf(importer);
        String relative = normalize(join(dir == null ? "" : dir, specifier));
        return relative != null ? firstExisting(relative, normalize(specifier)) : firstExisting(normalize(specifier));
    }

    private String firstExisting(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && files.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String join(String dir, String path) {
        if (dir.isEmpty()) {
            return path;
        }
        return path.isEmpty() ? dir : dir + "/" + path;
    }

    /** Lexically normalizes a relative path; {@code null} when it climbs above the root. */
    private static String normalize(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        Path normalized = Paths.get(trimmed).normalize();
        String result = normalized.toString().replace('\\', '/');
        if (result.startsWith("..")) {
            return null;
        }
        return result;
    }
}
