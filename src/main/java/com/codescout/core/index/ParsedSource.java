package com.codescout.core.index;

import java.util.List;

/**
 * Output of a {@link SourceParser}: symbols in declaration order and raw
 * import specifiers in source order.
 */
public record ParsedSource(List<SymbolEntry> symbols, List<String> imports) {

    public static final ParsedSource EMPTY = new ParsedSource(List.of(), List.of());

    public ParsedSource {
        symbols = List.copyOf(symbols);
        imports = List.copyOf(imports);
    }
}
