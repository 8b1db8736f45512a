package io.github.jbellis.refactor.analyzer;

public enum ScopeKind {
    MODULE,
    CLASS,
    FUNCTION,
    LAMBDA,
    COMPREHENSION;

    /**
     * Scopes whose local bindings can be captured by a nested function.
     */
    public boolean isFunctionLike() {
        return this == FUNCTION || this == LAMBDA || this == COMPREHENSION;
    }
}
