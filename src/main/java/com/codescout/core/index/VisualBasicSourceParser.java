package com.codescout.core.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VB.NET scanner. Blocks are closed by {@code End <Kind>} rather than braces.
 */
public class VisualBasicSourceParser implements SourceParser {

    private static final Pattern IMPORTS = Pattern.compile("^Imports\\s+(?:\\w+\\s*=\\s*)?([\\w.]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TYPE = Pattern.compile(
            "^(?:(?:Public|Private|Friend|Protected|Partial|MustInherit|NotInheritable|Shared)\\s+)*(Class|Module|Structure|Interface)\\s+(\\w+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MEMBER = Pattern.compile(
            "^(?:(?:Public|Private|Friend|Protected|Shared|Overrides|Overridable|MustOverride|Async|Overloads|Static)\\s+)*(Sub|Function|Property)\\s+(\\w+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern END_TYPE = Pattern.compile("^End\\s+(Class|Module|Structure|Interface)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Set<String> extensions() {
        return Set.of("vb");
    }

    @Override
    public ParsedSource parse(String path, String content) {
        List<SymbolEntry> symbols = new ArrayList<>();
        List<String> imports = new ArrayList<>();
        Deque<String> types = new ArrayDeque<>();
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String code = lines[i].strip();
            if (code.isEmpty() || code.startsWith("'")) {
                continue;
            }
            Matcher m;
            if ((m = END_TYPE.matcher(code)).find()) {
                if (!types.isEmpty()) {
                    types.pop();
                }
            } else if ((m = IMPORTS.matcher(code)).find()) {
                imports.add(m.group(1));
            } else if ((m = TYPE.matcher(code)).find()) {
                symbols.add(new SymbolEntry(m.group(2), SymbolKind.TYPE, path, i + 1, types.peek()));
                types.push(m.group(2));
            } else if ((m = MEMBER.matcher(code)).find()) {
                String parent = types.peek();
                SymbolKind kind;
                if (m.group(1).toLowerCase(Locale.ROOT).equals("property")) {
                    kind = SymbolKind.PROPERTY;
                } else {
                    kind = parent == null ? SymbolKind.FUNCTION : SymbolKind.METHOD;
                }
                symbols.add(new SymbolEntry(m.group(2), kind, path, i + 1, parent));
            }
        }
        return new ParsedSource(symbols, imports);
    }
}
