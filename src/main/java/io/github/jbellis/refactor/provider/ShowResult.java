package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public record ShowResult(boolean success,
                         String functionName,
                         @Nullable String qualifiedName,
                         List<ElementInfo> elements,
                         List<String> suggestions,
                         @Nullable ErrorKind errorKind,
                         @Nullable String message) implements OperationResult {

    /**
     * @param id       usable as an extraction source until the function changes
     * @param location "file:line" of the element's first line
     */
    public record ElementInfo(String id, String kind, String code, String location) {
    }

    public static ShowResult success(String functionName, String qualifiedName, List<ElementInfo> elements) {
        return new ShowResult(true, functionName, qualifiedName, List.copyOf(elements), List.of(), null, null);
    }

    public static ShowResult failure(String functionName, ErrorKind kind, String message, List<String> suggestions) {
        return new ShowResult(false, functionName, null, List.of(), List.copyOf(suggestions), kind, message);
    }

    public static ShowResult failure(String functionName, RefactoringException e) {
        return failure(functionName, e.kind(), e.getMessage(), e.suggestions());
    }
}
