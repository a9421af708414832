package com.codescout.core.index;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PHP scanner: classes, interfaces, traits, enums and functions. Functions
 * declared inside a type are methods; magic methods are skipped.
 */
public class PhpSourceParser extends BraceScopedParser {

    private static final Pattern USE = Pattern.compile("^\\s*use\\s+(?:function\\s+|const\\s+)?([\\w\\\\]+)");
    private static final Pattern INCLUDE = Pattern.compile(
            "\\b(?:include|require)(?:_once)?\\s*\\(?\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern TYPE = Pattern.compile(
            "^\\s*(?:(?:abstract|final|readonly)\\s+)*(?:class|interface|trait|enum)\\s+([A-Za-z_]\\w*)");
    private static final Pattern FUNCTION = Pattern.compile("\\bfunction\\s+&?\\s*([A-Za-z_]\\w*)\\s*\\(");

    public PhpSourceParser() {
        super(true);
    }

    @Override
    public Set<String> extensions() {
        return Set.of("php");
    }

    @Override
    protected void scanLine(String raw, String code, int lineNumber, ScanContext context) {
        Matcher m = USE.matcher(code);
        if (context.enclosingType() == null && m.find()) {
            context.addImport(m.group(1));
            return;
        }
        m = INCLUDE.matcher(raw);
        while (m.find()) {
            context.addImport(m.group(1));
        }
        if ((m = TYPE.matcher(code)).find()) {
            context.declareType(m.group(1), lineNumber);
        } else if ((m = FUNCTION.matcher(code)).find() && !m.group(1).startsWith("__")) {
            if (context.atTypeBodyLevel()) {
                context.addSymbol(m.group(1), SymbolKind.METHOD, lineNumber, context.enclosingType());
            } else if (context.enclosingType() == null) {
                context.addSymbol(m.group(1), SymbolKind.FUNCTION, lineNumber, null);
            }
        }
    }
}
