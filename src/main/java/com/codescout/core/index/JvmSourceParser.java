package com.codescout.core.index;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Java and Kotlin scanner. Types are classes, interfaces, enums, records,
 * annotation types and Kotlin objects; methods belong to the innermost type.
 */
public class JvmSourceParser extends BraceScopedParser {

    private static final Pattern IMPORT = Pattern.compile("^\\s*import\\s+(?:static\\s+)?([\\w.]+(?:\\.\\*)?)");
    private static final Pattern TYPE = Pattern.compile(
            "(?<![.\\w])(?:enum\\s+class|annotation\\s+class|class|interface|enum|record|@interface|object)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern KOTLIN_FUN = Pattern.compile(
            "^\\s*(?:[\\w]+\\s+)*fun\\s+(?:<[^>]+>\\s*)?(?:[\\w.<>]+\\.)?([A-Za-z_][\\w]*)\\s*\\(");

    public JvmSourceParser() {
        super(false);
    }

    @Override
    public Set<String> extensions() {
        return Set.of("java", "kt", "kts");
    }

    @Override
    protected void scanLine(String raw, String code, int lineNumber, ScanContext context) {
        Matcher m = IMPORT.matcher(raw);
        if (context.depth() == 0 && m.find()) {
            context.addImport(m.group(1));
            return;
        }
        if ((m = TYPE.matcher(code)).find()) {
            context.declareType(m.group(1), lineNumber);
            return;
        }
        if ((m = KOTLIN_FUN.matcher(code)).find()) {
            String parent = context.enclosingType();
            if (parent == null && context.depth() == 0) {
                context.addSymbol(m.group(1), SymbolKind.FUNCTION, lineNumber, null);
            } else if (context.atTypeBodyLevel()) {
                context.addSymbol(m.group(1), SymbolKind.METHOD, lineNumber, parent);
            }
            return;
        }
        String method = methodName(code, context);
        if (method != null) {
            context.addSymbol(method, SymbolKind.METHOD, lineNumber, context.enclosingType());
        }
    }
}
