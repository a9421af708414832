package com.codescout.core.index;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaScript and TypeScript scanner: classes, function declarations, arrow
 * function constants and class methods; ES imports and {@code require()}.
 */
public class JavaScriptSourceParser extends BraceScopedParser {

    private static final Pattern FROM = Pattern.compile("(?:^|[\\s}])from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern SIDE_EFFECT_IMPORT = Pattern.compile("^\\s*import\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern REQUIRE = Pattern.compile("\\brequire\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final Pattern CLASS = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?(?:class|interface)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern FUNCTION = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*([A-Za-z_$][\\w$]*)\\s*[(<]");
    private static final Pattern ARROW = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*(?::\\s*[^=]+)?=>");
    private static final Pattern CLASS_METHOD = Pattern.compile(
            "^\\s*(?:(?:static|async|get|set|public|private|protected|readonly|override)\\s+)*\\*?#?([A-Za-z_$][\\w$]*)\\s*(?:<[^>]*>)?\\s*\\([^;]*$");
    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "constructor", "super", "new");

    public JavaScriptSourceParser() {
        super(false);
    }

    @Override
    public Set<String> extensions() {
        return Set.of("js", "jsx", "ts", "tsx", "mjs", "cjs");
    }

    @Override
    protected void scanLine(String raw, String code, int lineNumber, ScanContext context) {
        String trimmed = raw.strip();
        Matcher m;
        if (trimmed.startsWith("import") || trimmed.startsWith("export") || trimmed.startsWith("}")) {
            if ((m = FROM.matcher(raw)).find() || (m = SIDE_EFFECT_IMPORT.matcher(raw)).find()) {
                context.addImport(m.group(1));
            }
        }
        m = REQUIRE.matcher(raw);
        while (m.find()) {
            context.addImport(m.group(1));
        }

        if ((m = CLASS.matcher(code)).find()) {
            context.declareType(m.group(1), lineNumber);
        } else if ((m = FUNCTION.matcher(code)).find()) {
            context.addSymbol(m.group(1), SymbolKind.FUNCTION, lineNumber, null);
        } else if ((m = ARROW.matcher(code)).find()) {
            context.addSymbol(m.group(1), SymbolKind.FUNCTION, lineNumber, null);
        } else if (context.atTypeBodyLevel() && (m = CLASS_METHOD.matcher(code)).find()
                && !KEYWORDS.contains(m.group(1))) {
            context.addSymbol(m.group(1), SymbolKind.METHOD, lineNumber, context.enclosingType());
        }
    }
}
