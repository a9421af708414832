package com.codescout.core.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileNodeTest {

    private static IndexedFile file(String path) {
        return IndexedFile.withoutContent(path, 10, ParseStatus.NOT_SOURCE);
    }

    private final List<IndexedFile> files = List.of(
            file("README.md"), file("src/app.py"), file("src/util/strings.py"), file("tests/test_app.py"));

    @Test
    void buildsSortedTree() {
        FileNode root = FileNode.build("demo", files);

        assertTrue(root.directory());
        assertEquals(List.of("README.md", "src", "tests"),
                root.children().stream().map(FileNode::name).toList());
        assertEquals(7, root.descendantCount());

        FileNode util = root.children().get(1).children().stream()
                .filter(FileNode::directory).findFirst().orElseThrow();
        assertEquals("src/util", util.path());
    }

    @Test
    void rendersWithConnectors() {
        String expected = String.join("\n",
                "demo/",
                "├── README.md",
                "├── src/",
                "│   ├── app.py",
                "│   └── util/",
                "│       └── strings.py",
                "└── tests/",
                "    └── test_app.py");

        assertEquals(expected, FileNode.build("demo", files).render());
    }

    @Test
    void truncatesLongTrees() {
        String rendered = FileNode.build("demo", files).render(3);

        assertEquals(4, rendered.split("\n").length);
        assertTrue(rendered.endsWith("... (5 more entries)"));
    }
}
