package com.codescout.core.index;

import java.util.Set;

/**
 * Extracts symbol definitions and import specifiers from one language family.
 * Implementations must be stateless and deterministic.
 */
public interface SourceParser {

    /** Lower-case file extensions, without the dot, handled by this parser. */
    Set<String> extensions();

    /**
     * @param path    project-relative path, recorded on every symbol
     * @param content decoded file content
     * @throws SourceParseException if the content cannot be scanned
     */
    ParsedSource parse(String path, String content);
}
