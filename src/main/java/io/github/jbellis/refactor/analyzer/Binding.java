package io.github.jbellis.refactor.analyzer;

/**
 * What a name is bound to inside one scope.
 */
public sealed interface Binding {
    String localName();

    /**
     * The name is bound by a definition, assignment or parameter in this scope.
     */
    record SymbolBinding(Symbol symbol) implements Binding {
        @Override
        public String localName() {
            return symbol.name();
        }
    }

    /**
     * The name is bound by an import.
     *
     * @param target     dotted name the import refers to, e.g. {@code pkg.mod.func} or {@code pkg.mod}
     * @param moduleImport true for {@code import x.y [as z]}, false for {@code from x import y}
     */
    record ImportBinding(String localName, String target, boolean moduleImport) implements Binding {
        public String importedName() {
            int lastDot = target.lastIndexOf('.');
            return lastDot < 0 ? target : target.substring(lastDot + 1);
        }
    }
}
