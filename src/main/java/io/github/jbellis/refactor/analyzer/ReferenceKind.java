package io.github.jbellis.refactor.analyzer;

public enum ReferenceKind {
    DEFINITION,
    USAGE,
    IMPORT,
    /** A use through a local alias such as {@code from m import f as g}; the token is the alias, not the name. */
    ALIASED_USAGE;

    /**
     * Whether a rename rewrites the token. Aliased uses keep their alias.
     */
    public boolean renamed() {
        return this != ALIASED_USAGE;
    }
}
