package com.codescout.core.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonSourceParserTest {

    private final PythonSourceParser parser = new PythonSourceParser();

    @Test
    void extractsClassesFunctionsAndMethods() {
        ParsedSource parsed = parser.parse("svc.py", """
                import os, sys as system
                from .models import User
                from ..core import base

                class Service:
                    \"\"\"Docstring mentioning
                    def not_a_function():
                    \"\"\"

                    def run(self):
                        def local():
                            pass
                        return local()

                    class Config:
                        pass

                async def fetch():
                    pass
                """);

        List<SymbolEntry> symbols = parsed.symbols();
        assertEquals(List.of("Service", "run", "Config", "fetch"),
                symbols.stream().map(SymbolEntry::name).toList());

        SymbolEntry run = symbols.get(1);
        assertEquals(SymbolKind.METHOD, run.kind());
        assertEquals("Service", run.parent());
        assertEquals(10, run.line());

        SymbolEntry config = symbols.get(2);
        assertEquals(SymbolKind.TYPE, config.kind());
        assertEquals("Service", config.parent());

        assertEquals(SymbolKind.FUNCTION, symbols.get(3).kind());
        assertEquals(List.of("os", "sys", ".models", "..core"), parsed.imports());
    }

    @Test
    void emptySourceHasNoSymbols() {
        assertEquals(ParsedSource.EMPTY.symbols(), parser.parse("empty.py", "").symbols());
    }
}
