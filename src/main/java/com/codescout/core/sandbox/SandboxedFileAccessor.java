package com.codescout.core.sandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Resolves and reads paths on behalf of the reasoning engine while keeping
 * every access inside a single project root.
 * <p>
 * Paths are normalized and symlinks resolved before they are compared against
 * the canonical root. Anything that cannot be resolved unambiguously is
 * rejected with {@link OutsideSandboxException}.
 */
public class SandboxedFileAccessor {

    private final Path root;

    public SandboxedFileAccessor(Path projectRoot) {
        try {
            this.root = projectRoot.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot canonicalize project root " + projectRoot, e);
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Resolves a requested path against the project root.
     *
     * @param requested a project-relative path, or an absolute path inside the root
     * @return the canonical absolute path, which may not exist
     * @throws OutsideSandboxException if the path escapes the root or cannot be resolved
     */
    public Path resolve(String requested) {
        if (requested == null) {
            throw new OutsideSandboxException("Path is required");
        }
        if (requested.indexOf('\0') >= 0) {
            throw new OutsideSandboxException("Path contains a NUL byte");
        }

        Path candidate;
        try {
            Path given = root.getFileSystem().getPath(requested);
            candidate = (given.isAbsolute() ? given : root.resolve(given)).normalize();
        } catch (InvalidPathException e) {
            throw new OutsideSandboxException("Malformed path: " + requested, e);
        }

        Path real;
        try {
            real = Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)
                    ? candidate.toRealPath()
                    : realPathOfMissing(candidate);
        } catch (NoSuchFileException e) {
            throw new OutsideSandboxException("Broken symlink: " + requested, e);
        } catch (FileSystemException e) {
            throw new OutsideSandboxException("Cannot resolve " + requested + ": " + e.getReason(), e);
        } catch (IOException e) {
            throw new OutsideSandboxException("Cannot resolve " + requested, e);
        }

        if (!real.startsWith(root)) {
            throw new OutsideSandboxException("Path is outside the project root: " + requested);
        }
        return real;
    }

    /**
     * Maps an absolute path under the root back to its project-relative form.
     */
    public String relativize(Path absolute) {
        return toRelative(root, absolute);
    }

    /**
     * Reads a file as UTF-8 text.
     *
     * @throws OutsideSandboxException if the path escapes the root
     * @throws NotFoundException       if the path is missing, a directory or unreadable
     * @throws BinaryContentException  if the content is not valid UTF-8
     */
    public String read(String requested) {
        Path path = resolve(requested);
        if (!Files.exists(path)) {
            throw new NotFoundException("File not found: " + requested);
        }
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Not a file: " + requested);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new BinaryContentException("Binary or non UTF-8 file: " + requested, e);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("File not found: " + requested, e);
        } catch (IOException e) {
            throw new NotFoundException("Cannot read " + requested + ": " + e.getMessage(), e);
        }
    }

    static String toRelative(Path root, Path absolute) {
        String relative = root.relativize(absolute).toString();
        return relative.replace('\\', '/');
    }

    /**
     * Canonicalizes the deepest existing ancestor and re-appends the missing tail.
     */
    private Path realPathOfMissing(Path candidate) throws IOException {
        Deque<Path> missing = new ArrayDeque<>();
        Path existing = candidate;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            missing.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new OutsideSandboxException("No existing ancestor for " + candidate);
        }
        Path real = existing.toRealPath();
        while (!missing.isEmpty()) {
            real = real.resolve(missing.pop());
        }
        return real;
    }
}
