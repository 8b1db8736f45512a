package io.github.jbellis.refactor.analyzer;

import java.util.List;

/**
 * Everything learned from walking one file: its scope tree, the symbols it defines and every
 * identifier occurrence in document order.
 */
public record FileScopes(SourceFile source,
                         String moduleName,
                         Scope moduleScope,
                         List<Scope> scopes,
                         List<Symbol> symbols,
                         List<Occurrence> occurrences) {

    public ProjectFile file() {
        return source.file();
    }

    /**
     * Innermost scope whose construct contains the offset.
     */
    public Scope scopeAt(int offset) {
        var current = moduleScope;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (var child : current.children()) {
                if (child.range().contains(offset)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }
}
