package io.github.jbellis.refactor.analyzer;

import java.util.Locale;

public enum SymbolKind {
    CLASS,
    FUNCTION,
    METHOD,
    VARIABLE,
    PARAMETER,
    ATTRIBUTE;

    /**
     * Lower-case name used in results.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }
}
