package com.codescout.core.sandbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SandboxedFileAccessorTest {

    @TempDir
    Path tempDir;

    private Path root;
    private SandboxedFileAccessor accessor;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("project"));
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/app.py"), "print('hi')\n");
        Files.writeString(tempDir.resolve("secret.txt"), "top secret");
        accessor = new SandboxedFileAccessor(root);
    }

    private static boolean trySymlink(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            return false;
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("relative paths resolve under the canonical root")
        void relativeInsideRoot() {
            Path resolved = accessor.resolve("src/app.py");
            assertTrue(resolved.startsWith(accessor.root()));
            assertEquals("src/app.py", accessor.relativize(resolved));
        }

        @Test
        @DisplayName("dot-dot segments that stay inside are accepted")
        void dotDotInside() {
            assertEquals("src/app.py", accessor.relativize(accessor.resolve("src/../src/./app.py")));
        }

        @Test
        @DisplayName("dot-dot segments that escape are rejected")
        void dotDotEscape() {
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve("../secret.txt"));
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve("src/../../secret.txt"));
        }

        @Test
        @DisplayName("absolute paths outside the root are rejected")
        void absoluteOutside() {
            assertThrows(OutsideSandboxException.class,
                    () -> accessor.resolve(tempDir.resolve("secret.txt").toString()));
        }

        @Test
        @DisplayName("missing paths inside the root resolve without error")
        void missingInside() {
            assertEquals("src/new/file.py", accessor.relativize(accessor.resolve("src/new/file.py")));
        }

        @Test
        @DisplayName("NUL bytes and null paths fail closed")
        void nulByte() {
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve("src/a\0.py"));
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve(null));
        }

        @Test
        @DisplayName("a symlink pointing outside the root is rejected")
        void symlinkEscape() {
            assumeTrue(trySymlink(root.resolve("leak.txt"), tempDir.resolve("secret.txt")));
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve("leak.txt"));
            assertThrows(OutsideSandboxException.class, () -> accessor.read("leak.txt"));
        }

        @Test
        @DisplayName("a symlinked directory pointing outside cannot be traversed")
        void symlinkDirectoryEscape() {
            assumeTrue(trySymlink(root.resolve("outside"), tempDir));
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve("outside/secret.txt"));
        }

        @Test
        @DisplayName("a symlink that stays inside the root is followed")
        void symlinkInside() {
            assumeTrue(trySymlink(root.resolve("alias.py"), root.resolve("src/app.py")));
            assertEquals("src/app.py", accessor.relativize(accessor.resolve("alias.py")));
        }

        @Test
        @DisplayName("a symlink loop fails closed")
        void symlinkLoop() {
            assumeTrue(trySymlink(root.resolve("loop-a"), root.resolve("loop-b")));
            assumeTrue(trySymlink(root.resolve("loop-b"), root.resolve("loop-a")));
            assertThrows(OutsideSandboxException.class, () -> accessor.resolve("loop-a"));
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        void readsFileContent() {
            assertEquals("print('hi')\n", accessor.read("src/app.py"));
        }

        @Test
        void missingFileIsNotFound() {
            assertThrows(NotFoundException.class, () -> accessor.read("src/missing.py"));
        }

        @Test
        void directoryIsNotFound() {
            assertThrows(NotFoundException.class, () -> accessor.read("src"));
        }

        @Test
        void binaryContentIsRejected() throws IOException {
            Files.write(root.resolve("image.bin"), new byte[]{(byte) 0xFF, (byte) 0xFE, 0x00, (byte) 0xC3});
            BinaryContentException e = assertThrows(BinaryContentException.class, () -> accessor.read("image.bin"));
            assertEquals("not_found", e.kind());
        }
    }
}
