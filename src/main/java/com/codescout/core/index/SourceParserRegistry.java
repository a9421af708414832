package com.codescout.core.index;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link SourceParser} for a file by its extension.
 */
@Component
public class SourceParserRegistry {

    private final Map<String, SourceParser> byExtension = new HashMap<>();

    public SourceParserRegistry() {
        this(List.of(
                new PythonSourceParser(),
                new JavaScriptSourceParser(),
                new JvmSourceParser(),
                new DotNetSourceParser(),
                new VisualBasicSourceParser(),
                new PhpSourceParser(),
                new GoSourceParser()));
    }

    public SourceParserRegistry(List<SourceParser> parsers) {
        for (SourceParser parser : parsers) {
            for (String extension : parser.extensions()) {
                byExtension.put(extension, parser);
            }
        }
    }

    public Optional<SourceParser> parserFor(String path) {
        return Optional.ofNullable(byExtension.get(extensionOf(path)));
    }

    public boolean isSource(String path) {
        return byExtension.containsKey(extensionOf(path));
    }

    static String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
