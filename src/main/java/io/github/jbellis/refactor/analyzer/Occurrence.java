package io.github.jbellis.refactor.analyzer;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * An identifier token seen while walking a file, before it is linked to a symbol.
 *
 * @param context      for ATTRIBUTE, the object expression; for KEYWORD, the callee expression
 * @param importTarget for IMPORT_NAME, the dotted name being imported
 */
public record Occurrence(Kind kind,
                         String name,
                         ByteRange range,
                         Scope scope,
                         @Nullable TSNode context,
                         @Nullable String importTarget) {

    public enum Kind {
        /** name of a def, class or parameter */
        DEFINITION,
        LOAD,
        STORE,
        /** operand of global or nonlocal */
        DECLARATION,
        ATTRIBUTE,
        KEYWORD,
        IMPORT_NAME
    }

    static Occurrence simple(Kind kind, String name, ByteRange range, Scope scope) {
        return new Occurrence(kind, name, range, scope, null, null);
    }

    public boolean isNameToken() {
        return kind == Kind.DEFINITION || kind == Kind.LOAD || kind == Kind.STORE || kind == Kind.DECLARATION;
    }
}
