package io.github.jbellis.refactor.analyzer;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Per-language parsing and syntax classification. Everything above this interface works on
 * {@link SourceFile}s and the node categories exposed through {@link #syntaxProfile()}.
 */
public interface LanguageBackend {

    Language language();

    /**
     * Parses the given bytes. Implementations must be safe to call from several threads at once.
     *
     * @throws ParseException if the bytes do not decode or the resulting tree contains syntax errors
     */
    SourceFile parse(ProjectFile file, byte[] content) throws ParseException;

    default SourceFile parse(ProjectFile file) throws IOException, ParseException {
        return parse(file, file.readBytes());
    }

    LanguageSyntaxProfile syntaxProfile();

    /**
     * Builds the scope and reference index over a set of successfully parsed files.
     *
     * @param warnings files left out of the index, with the reason; carried into the table
     * @param partial  whether the set of files is known to be incomplete
     */
    SymbolTable buildSymbolTable(List<SourceFile> sources, Map<ProjectFile, String> warnings, boolean partial);

    /**
     * True if {@code name} is lexically an identifier and not a keyword.
     */
    boolean isValidIdentifier(String name);

    /**
     * Keywords and builtin names that a rename may never introduce.
     */
    boolean isReserved(String name);

    default boolean isSourceFile(ProjectFile file) {
        return language().getExtensions().contains(file.extension());
    }
}
