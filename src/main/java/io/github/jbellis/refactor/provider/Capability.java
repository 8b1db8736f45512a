package io.github.jbellis.refactor.provider;

/**
 * Operations a provider can perform.
 */
public enum Capability {
    ANALYZE,
    FIND,
    SHOW,
    RENAME,
    EXTRACT
}
