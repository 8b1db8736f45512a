package io.github.jbellis.refactor.analyzer;

import java.util.List;

/**
 * A named program entity.
 *
 * @param qualifiedName   dotted path from the module, e.g. {@code pkg.mod.Class.method}; unique in a project
 * @param name            the bare name
 * @param file            file holding the definition
 * @param nameRange       bytes of the defining name token
 * @param definitionRange bytes of the whole defining construct
 * @param line            1-based line of the name token
 * @param scopeChain      qualified names of the enclosing scopes, outermost (the module) first
 */
public record Symbol(String qualifiedName,
                     String name,
                     SymbolKind kind,
                     ProjectFile file,
                     ByteRange nameRange,
                     ByteRange definitionRange,
                     int line,
                     List<String> scopeChain) {

    public Symbol {
        scopeChain = List.copyOf(scopeChain);
    }

    /**
     * Qualified name of the scope the symbol is defined in.
     */
    public String scope() {
        return scopeChain.get(scopeChain.size() - 1);
    }

    public String location() {
        return file + ":" + line;
    }

    public boolean isMember() {
        return kind == SymbolKind.METHOD || kind == SymbolKind.ATTRIBUTE;
    }
}
