package io.github.jbellis.refactor.analyzer;

/**
 * One find result. Definitions are project symbols; the rest are names imported from outside the project.
 */
public record FindMatch(String name, String qualifiedName, String kind, String location, boolean definition) {
    static FindMatch of(Symbol symbol) {
        return new FindMatch(symbol.name(), symbol.qualifiedName(), symbol.kind().label(), symbol.location(), true);
    }

    static FindMatch of(ImportedName imported) {
        return new FindMatch(imported.name(), imported.qualifiedName(), "import", imported.location(), false);
    }
}
