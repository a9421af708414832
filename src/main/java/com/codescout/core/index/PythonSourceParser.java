package com.codescout.core.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indentation-tracking scanner for Python modules.
 * <p>
 * A {@code def} directly inside a class body is a method of that class; a
 * {@code def} nested inside a method is local and not indexed.
 */
public class PythonSourceParser implements SourceParser {

    private static final Pattern CLASS = Pattern.compile("^class\\s+([A-Za-z_]\\w*)");
    private static final Pattern DEF = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(.+)$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\.*[\\w.]*)\\s+import\\b");

    private enum ScopeKind { CLASS, FUNCTION }

    private record Scope(ScopeKind kind, String name, int indent) {}

    @Override
    public Set<String> extensions() {
        return Set.of("py", "pyi");
    }

    @Override
    public ParsedSource parse(String path, String content) {
        List<SymbolEntry> symbols = new ArrayList<>();
        List<String> imports = new ArrayList<>();
        Deque<Scope> scopes = new ArrayDeque<>();
        String openString = null;

        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].replace("\t", "    ").stripTrailing();
            if (openString != null) {
                if (line.contains(openString)) {
                    openString = null;
                }
                continue;
            }
            String code = line.strip();
            if (code.isEmpty() || code.startsWith("#")) {
                continue;
            }

            int indent = line.length() - line.stripLeading().length();
            while (!scopes.isEmpty() && scopes.peek().indent() >= indent) {
                scopes.pop();
            }

            int lineNumber = i + 1;
            Matcher m;
            if ((m = CLASS.matcher(code)).find()) {
                String enclosing = enclosingClass(scopes);
                symbols.add(new SymbolEntry(m.group(1), SymbolKind.TYPE, path, lineNumber, enclosing));
                scopes.push(new Scope(ScopeKind.CLASS, m.group(1), indent));
            } else if ((m = DEF.matcher(code)).find()) {
                addFunction(symbols, scopes, m.group(1), path, lineNumber);
                scopes.push(new Scope(ScopeKind.FUNCTION, m.group(1), indent));
            } else if ((m = FROM_IMPORT.matcher(code)).find()) {
                imports.add(m.group(1));
            } else if ((m = IMPORT.matcher(code)).find()) {
                for (String part : m.group(1).split(",")) {
                    String module = part.strip().split("\\s+as\\s+")[0].strip();
                    if (!module.isEmpty() && !module.startsWith("(")) {
                        imports.add(module);
                    }
                }
            }

            openString = unterminatedTripleQuote(code);
        }
        return new ParsedSource(symbols, imports);
    }

    private static void addFunction(List<SymbolEntry> symbols, Deque<Scope> scopes,
                                    String name, String path, int lineNumber) {
        Scope top = scopes.peek();
        if (top != null && top.kind() == ScopeKind.CLASS) {
            symbols.add(new SymbolEntry(name, SymbolKind.METHOD, path, lineNumber, top.name()));
        } else if (enclosingClass(scopes) == null) {
            symbols.add(new SymbolEntry(name, SymbolKind.FUNCTION, path, lineNumber, null));
        }
    }

    private static String enclosingClass(Deque<Scope> scopes) {
        for (Scope scope : scopes) {
            if (scope.kind() == ScopeKind.CLASS) {
                return scope.name();
            }
        }
        return null;
    }

    private static String unterminatedTripleQuote(String code) {
        for (String quote : List.of("\"\"\"", "'''")) {
            int count = 0;
            int from = 0;
            int idx;
            while ((idx = code.indexOf(quote, from)) >= 0) {
                count++;
                from = idx + quote.length();
            }
            if (count % 2 == 1) {
                return quote;
            }
        }
        return null;
    }
}
