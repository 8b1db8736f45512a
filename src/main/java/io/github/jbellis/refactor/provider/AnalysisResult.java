package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param suggestions refactoring hints on success, remedies on failure
 * @param partial     the project scan behind the answer was incomplete
 */
public record AnalysisResult(boolean success,
                             @Nullable SymbolInfo symbol,
                             List<ReferenceInfo> references,
                             int referenceCount,
                             List<String> suggestions,
                             boolean partial,
                             @Nullable ErrorKind errorKind,
                             @Nullable String message) implements OperationResult {

    /**
     * @param docstring the symbol's docstring, if it has one
     */
    public record SymbolInfo(String name,
                             String qualifiedName,
                             String kind,
                             String definitionLocation,
                             String scope,
                             @Nullable String docstring) {
    }

    /**
     * @param column 0-based byte column
     */
    public record ReferenceInfo(String file, int line, int column, String kind) {
    }

    public static AnalysisResult success(SymbolInfo symbol, List<ReferenceInfo> references, List<String> suggestions,
                                         boolean partial) {
        return new AnalysisResult(true, symbol, List.copyOf(references), references.size(), List.copyOf(suggestions),
                                  partial, null, null);
    }

    public static AnalysisResult failure(ErrorKind kind, String message, List<String> suggestions) {
        return new AnalysisResult(false, null, List.of(), 0, List.copyOf(suggestions), false, kind, message);
    }

    public static AnalysisResult failure(RefactoringException e) {
        return failure(e.kind(), e.getMessage(), e.suggestions());
    }
}
