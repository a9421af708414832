package com.codescout.core.index;

/**
 * A symbol definition found in an indexed file.
 *
 * @param name   the declared name
 * @param kind   what was declared
 * @param file   project-relative path of the defining file
 * @param line   1-based line of the declaration
 * @param parent enclosing type for methods and properties, otherwise {@code null}
 */
public record SymbolEntry(String name, SymbolKind kind, String file, int line, String parent) {
}
