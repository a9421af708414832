package com.codescout.core.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go scanner. Methods are recognised from their receiver type rather than by nesting.
 */
public class GoSourceParser implements SourceParser {

    private static final Pattern TYPE = Pattern.compile("^type\\s+([A-Za-z_]\\w*)(?:\\[[^\\]]*\\])?\\s+\\S");
    private static final Pattern METHOD = Pattern.compile(
            "^func\\s+\\(\\s*\\w*\\s*\\*?\\s*([A-Za-z_]\\w*)(?:\\[[^\\]]*\\])?\\s*\\)\\s*([A-Za-z_]\\w*)\\s*[\\[(]");
    private static final Pattern FUNCTION = Pattern.compile("^func\\s+([A-Za-z_]\\w*)\\s*[\\[(]");
    private static final Pattern SINGLE_IMPORT = Pattern.compile("^import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"");
    private static final Pattern GROUPED_TYPE = Pattern.compile("^([A-Za-z_]\\w*)\\s+\\S");
    private static final Pattern BLOCK_IMPORT = Pattern.compile("^(?:[\\w.]+\\s+)?\"([^\"]+)\"");

    @Override
    public Set<String> extensions() {
        return Set.of("go");
    }

    @Override
    public ParsedSource parse(String path, String content) {
        List<SymbolEntry> symbols = new ArrayList<>();
        List<String> imports = new ArrayList<>();
        boolean inImportBlock = false;
        boolean inTypeBlock = false;
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            String code = line.strip();
            int lineNumber = i + 1;
            Matcher m;
            if (inImportBlock) {
                if (code.startsWith(")")) {
                    inImportBlock = false;
                } else if ((m = BLOCK_IMPORT.matcher(code)).find()) {
                    imports.add(m.group(1));
                }
                continue;
            }
            if (inTypeBlock) {
                if (code.startsWith(")")) {
                    inTypeBlock = false;
                } else if (line.length() - line.stripLeading().length() == 1 && line.startsWith("\t")) {
                    Matcher member = GROUPED_TYPE.matcher(code);
                    if (member.find() && !code.startsWith("//")) {
                        symbols.add(new SymbolEntry(member.group(1), SymbolKind.TYPE, path, lineNumber, null));
                    }
                }
                continue;
            }
            if (code.equals("import (")) {
                inImportBlock = true;
            } else if (code.equals("type (")) {
                inTypeBlock = true;
            } else if ((m = SINGLE_IMPORT.matcher(line)).find()) {
                imports.add(m.group(1));
            } else if ((m = TYPE.matcher(line)).find()) {
                symbols.add(new SymbolEntry(m.group(1), SymbolKind.TYPE, path, lineNumber, null));
            } else if ((m = METHOD.matcher(line)).find()) {
                symbols.add(new SymbolEntry(m.group(2), SymbolKind.METHOD, path, lineNumber, m.group(1)));
            } else if ((m = FUNCTION.matcher(line)).find()) {
                symbols.add(new SymbolEntry(m.group(1), SymbolKind.FUNCTION, path, lineNumber, null));
            }
        }
        return new ParsedSource(symbols, imports);
    }
}
