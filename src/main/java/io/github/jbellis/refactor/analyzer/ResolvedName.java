package io.github.jbellis.refactor.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A plain name token together with what it resolved to.
 *
 * @param symbolId     qualified name of the project symbol, or null for builtins, externals and unbound names
 * @param bindingScope scope holding the binding the name resolved through, or null if unbound
 */
public record ResolvedName(Occurrence.Kind kind,
                           String name,
                           ByteRange range,
                           Scope scope,
                           @Nullable String symbolId,
                           @Nullable Scope bindingScope) {

    public boolean isLoad() {
        return kind == Occurrence.Kind.LOAD;
    }

    public boolean isWrite() {
        return kind == Occurrence.Kind.STORE || kind == Occurrence.Kind.DEFINITION;
    }
}
