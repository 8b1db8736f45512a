package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param extractedCode the new function's definition
 * @param parameters    the new function's parameters, in order
 * @param returns       names the extracted statements hand back to the caller
 */
public record ExtractResult(boolean success,
                            String source,
                            String newName,
                            @Nullable String extractedCode,
                            List<String> parameters,
                            List<String> returns,
                            List<String> filesModified,
                            @Nullable String backupId,
                            List<String> suggestions,
                            @Nullable ErrorKind errorKind,
                            @Nullable String message) implements OperationResult {

    public static ExtractResult success(String source, String newName, String extractedCode, List<String> parameters,
                                        List<String> returns, List<String> filesModified, String backupId) {
        return new ExtractResult(true, source, newName, extractedCode, List.copyOf(parameters), List.copyOf(returns),
                                 List.copyOf(filesModified), backupId, List.of(), null, null);
    }

    public static ExtractResult failure(String source, String newName, ErrorKind kind, String message,
                                        List<String> suggestions) {
        return new ExtractResult(false, source, newName, null, List.of(), List.of(), List.of(), null,
                                 List.copyOf(suggestions), kind, message);
    }

    public static ExtractResult failure(String source, String newName, RefactoringException e) {
        return failure(source, newName, e.kind(), e.getMessage(), e.suggestions());
    }
}
