package com.codescout.core.index;

import java.util.List;

/**
 * One file of the index together with its parse contribution.
 */
public record IndexedFile(String path, long size, ParseStatus status,
                          List<SymbolEntry> symbols, List<String> imports) {

    public IndexedFile {
        symbols = List.copyOf(symbols);
        imports = List.copyOf(imports);
    }

    public static IndexedFile withoutContent(String path, long size, ParseStatus status) {
        return new IndexedFile(path, size, status, List.of(), List.of());
    }

    public boolean isSource() {
        return status != ParseStatus.NOT_SOURCE;
    }
}
