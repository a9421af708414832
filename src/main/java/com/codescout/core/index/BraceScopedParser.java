package com.codescout.core.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line scanner for curly-brace languages.
 * <p>
 * String literals and comments are blanked before braces are counted so that
 * methods can be attributed to the innermost enclosing type by depth.
 * Subclasses inspect each line through {@link #scanLine}.
 */
abstract class BraceScopedParser implements SourceParser {

    /** Words that may precede {@code name(} at type-body depth without declaring a method. */
    private static final Set<String> NON_DECLARING = Set.of(
            "return", "new", "throw", "else", "if", "for", "while", "switch", "catch",
            "synchronized", "using", "lock", "foreach", "await", "yield", "case", "this", "super");

    private static final Pattern METHOD_DECLARATION = Pattern.compile(
            "^\\s*((?:[\\w<>\\[\\],.?]+\\s+)*?)([A-Za-z_$][\\w$]*)\\s*(?:<[^>()]*>)?\\s*\\(");

    private final boolean hashComments;

    protected BraceScopedParser(boolean hashComments) {
        this.hashComments = hashComments;
    }

    @Override
    public ParsedSource parse(String path, String content) {
        ScanContext context = new ScanContext(path);
        String[] lines = content.split("\n", -1);
        boolean inBlockComment = false;
        for (int i = 0; i < lines.length; i++) {
            String raw = lines[i].stripTrailing();
            StringBuilder code = new StringBuilder(raw.length());
            inBlockComment = sanitize(raw, code, inBlockComment);
            String sanitized = code.toString();
            scanLine(raw, sanitized, i + 1, context);
            context.track(sanitized);
        }
        return new ParsedSource(context.symbols, context.imports);
    }

    /**
     * @param raw       the original line, with string literals intact (for imports)
     * @param code      the line with literals and comments blanked
     * @param lineNumber 1-based line number
     */
    protected abstract void scanLine(String raw, String code, int lineNumber, ScanContext context);

    /**
     * Recognises a method-like declaration at type-body depth, or returns {@code null}.
     * A declaration needs a return type or modifier before the name, unless the
     * name matches the enclosing type (a constructor).
     */
    protected static String methodName(String code, ScanContext context) {
        if (!context.atTypeBodyLevel() || code.stripLeading().startsWith("@")) {
            return null;
        }
        var m = METHOD_DECLARATION.matcher(code);
        if (!m.find()) {
            return null;
        }
        String prefix = m.group(1).strip();
        String name = m.group(2);
        if (NON_DECLARING.contains(name) || code.substring(0, m.end()).contains("=")) {
            return null;
        }
        if (!prefix.isEmpty()) {
            String first = prefix.split("\\s+")[0];
            if (NON_DECLARING.contains(first)) {
                return null;
            }
            return name;
        }
        return name.equals(context.enclosingType()) ? name : null;
    }

    private boolean sanitize(String raw, StringBuilder out, boolean inBlockComment) {
        int i = 0;
        int n = raw.length();
        while (i < n) {
            char c = raw.charAt(i);
            if (inBlockComment) {
                if (c == '*' && i + 1 < n && raw.charAt(i + 1) == '/') {
                    inBlockComment = false;
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
                inBlockComment = true;
                i += 2;
                continue;
            }
            if ((c == '/' && i + 1 < n && raw.charAt(i + 1) == '/') || (hashComments && c == '#')) {
                break;
            }
            if (c == '"' || c == '\'' || c == '`') {
                int end = i + 1;
                while (end < n && raw.charAt(end) != c) {
                    end += raw.charAt(end) == '\\' ? 2 : 1;
                }
                out.append(c).append(c);
                i = end + 1;
                continue;
            }
            out.append(c);
            i++;
        }
        return inBlockComment;
    }

    /**
     * Mutable per-file scan state: collected output plus the brace and type stack.
     */
    protected static final class ScanContext {

        private final String path;
        private final List<SymbolEntry> symbols = new ArrayList<>();
        private final List<String> imports = new ArrayList<>();
        private final Deque<TypeScope> types = new ArrayDeque<>();
        private int depth;

        private ScanContext(String path) {
            this.path = path;
        }

        public void declareType(String name, int lineNumber) {
            symbols.add(new SymbolEntry(name, SymbolKind.TYPE, path, lineNumber, innermostOpenType()));
            types.push(new TypeScope(name, depth + 1));
        }

        public void addSymbol(String name, SymbolKind kind, int lineNumber, String parent) {
            symbols.add(new SymbolEntry(name, kind, path, lineNumber, parent));
        }

        public void addImport(String specifier) {
            if (specifier != null && !specifier.isBlank()) {
                imports.add(specifier.strip());
            }
        }

        /** True when the current line sits directly inside an opened type body. */
        public boolean atTypeBodyLevel() {
            TypeScope top = types.peek();
            return top != null && top.opened && depth == top.bodyDepth;
        }

        /** Name of the innermost opened type, or {@code null} at top level. */
        public String enclosingType() {
            return innermostOpenType();
        }

        public int depth() {
            return depth;
        }

        private String innermostOpenType() {
            for (TypeScope scope : types) {
                if (scope.opened) {
                    return scope.name;
                }
            }
            return null;
        }

        private void track(String code) {
            for (int i = 0; i < code.length(); i++) {
                char c = code.charAt(i);
                if (c == '{') {
                    depth++;
                    TypeScope top = types.peek();
                    if (top != null && !top.opened && depth == top.bodyDepth) {
                        top.opened = true;
                    }
                } else if (c == '}') {
                    depth = Math.max(0, depth - 1);
                    while (!types.isEmpty() && types.peek().opened && depth < types.peek().bodyDepth) {
                        types.pop();
                    }
                } else if (c == ';') {
                    TypeScope top = types.peek();
                    if (top != null && !top.opened && depth == top.bodyDepth - 1) {
                        types.pop();
                    }
                }
            }
        }
    }

    private static final class TypeScope {
        private final String name;
        private final int bodyDepth;
        private boolean opened;

        private TypeScope(String name, int bodyDepth) {
            this.name = name;
            this.bodyDepth = bodyDepth;
        }
    }
}
