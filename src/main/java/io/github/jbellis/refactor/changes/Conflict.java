package io.github.jbellis.refactor.changes;

import org.jetbrains.annotations.Nullable;

/**
 * Why a proposed name cannot be used.
 *
 * @param existing qualified name of the symbol the name already denotes, if it is a project symbol
 * @param location where the clash was found, as {@code file:line}, if anywhere
 */
public record Conflict(String name, @Nullable String existing, @Nullable String location, String description) {

    @Override
    public String toString() {
        return description;
    }
}
