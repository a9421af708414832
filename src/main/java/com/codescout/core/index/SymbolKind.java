package com.codescout.core.index;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SymbolKind {
    TYPE,
    FUNCTION,
    METHOD,
    PROPERTY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
