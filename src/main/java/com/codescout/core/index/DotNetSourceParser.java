package com.codescout.core.index;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C# scanner: classes, records, structs and interfaces, their methods and
 * auto-properties; {@code using} directives as imports.
 */
public class DotNetSourceParser extends BraceScopedParser {

    private static final Pattern USING = Pattern.compile(
            "^\\s*(?:global\\s+)?using\\s+(?:static\\s+)?(?:\\w+\\s*=\\s*)?([\\w.]+)\\s*;");
    private static final Pattern TYPE = Pattern.compile(
            "(?<![.\\w])(?:record\\s+struct|record\\s+class|class|struct|interface|record|enum)\\s+([A-Za-z_]\\w*)");
    private static final Pattern PROPERTY = Pattern.compile(
            "^\\s*(?:[\\w<>\\[\\],.?]+\\s+)+([A-Za-z_]\\w*)\\s*\\{\\s*(?:get|set|init)\\b");

    public DotNetSourceParser() {
        super(false);
    }

    @Override
    public Set<String> extensions() {
        return Set.of("cs");
    }

    @Override
    protected void scanLine(String raw, String code, int lineNumber, ScanContext context) {
        Matcher m = USING.matcher(code);
        if (context.enclosingType() == null && m.find()) {
            context.addImport(m.group(1));
            return;
        }
        if ((m = TYPE.matcher(code)).find()) {
            context.declareType(m.group(1), lineNumber);
            return;
        }
        if (context.atTypeBodyLevel() && (m = PROPERTY.matcher(code)).find()) {
            context.addSymbol(m.group(1), SymbolKind.PROPERTY, lineNumber, context.enclosingType());
            return;
        }
        String method = methodName(code, context);
        if (method != null) {
            context.addSymbol(method, SymbolKind.METHOD, lineNumber, context.enclosingType());
        }
    }
}
