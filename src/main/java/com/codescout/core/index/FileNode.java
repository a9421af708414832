package com.codescout.core.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Node of the project file tree. Children are sorted by name.
 *
 * @param size file size in bytes, {@code null} for directories
 */
public record FileNode(String name, String path, boolean directory, Long size, List<FileNode> children) {

    public FileNode {
        children = List.copyOf(children);
    }

    /**
     * Builds the tree for a set of indexed files.
     *
     * @param rootName display name of the root directory
     */
    public static FileNode build(String rootName, Collection<IndexedFile> files) {
        Builder root = new Builder(rootName, "");
        for (IndexedFile file : files) {
            String[] parts = file.path().split("/");
            Builder current = root;
            for (int i = 0; i < parts.length - 1; i++) {
                String dirPath = current.path.isEmpty() ? parts[i] : current.path + "/" + parts[i];
                current = current.directories.computeIfAbsent(parts[i], n -> new Builder(n, dirPath));
            }
            current.files.put(parts[parts.length - 1], file);
        }
        return root.build();
    }

    /** Total number of nodes below this one. */
    public int descendantCount() {
        int count = 0;
        for (FileNode child : children) {
            count += 1 + child.descendantCount();
        }
        return count;
    }

    /**
     * Renders the tree with box-drawing connectors.
     */
    public String render() {
        return render(Integer.MAX_VALUE);
    }

    /**
     * Renders at most {@code maxLines} lines, followed by a count of omitted entries.
     */
    public String render(int maxLines) {
        List<String> lines = new ArrayList<>();
        lines.add(name + "/");
        appendChildren(this, "", lines);
        if (lines.size() <= maxLines) {
            return String.join("\n", lines);
        }
        int omitted = lines.size() - maxLines;
        List<String> shown = new ArrayList<>(lines.subList(0, maxLines));
        shown.add("... (" + omitted + " more entries)");
        return String.join("\n", shown);
    }

    private static void appendChildren(FileNode node, String prefix, List<String> lines) {
        for (int i = 0; i < node.children.size(); i++) {
            FileNode child = node.children.get(i);
            boolean last = i == node.children.size() - 1;
            lines.add(prefix + (last ? "└── " : "├── ") + child.name + (child.directory ? "/" : ""));
            if (child.directory) {
                appendChildren(child, prefix + (last ? "    " : "│   "), lines);
            }
        }
    }

    private static final class Builder {
        private final String name;
        private final String path;
        private final Map<String, Builder> directories = new TreeMap<>();
        private final Map<String, IndexedFile> files = new TreeMap<>();

        private Builder(String name, String path) {
            this.name = name;
            this.path = path;
        }

        private FileNode build() {
            TreeMap<String, FileNode> children = new TreeMap<>();
            directories.forEach((n, dir) -> children.put(n, dir.build()));
            files.forEach((n, file) -> children.put(n, new FileNode(n, file.path(), false, file.size(), List.of())));
            return new FileNode(name, path, true, null, new ArrayList<>(children.values()));
        }
    }
}
