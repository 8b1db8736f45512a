package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.FindMatch;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param totalCount number of matches before the configured cap
 */
public record FindResult(boolean success,
                         String pattern,
                         List<FindMatch> matches,
                         int totalCount,
                         boolean partial,
                         List<String> suggestions,
                         @Nullable ErrorKind errorKind,
                         @Nullable String message) implements OperationResult {

    public static FindResult success(String pattern, List<FindMatch> matches, int totalCount, boolean partial) {
        return new FindResult(true, pattern, List.copyOf(matches), totalCount, partial, List.of(), null, null);
    }

    public static FindResult failure(String pattern, ErrorKind kind, String message, List<String> suggestions) {
        return new FindResult(false, pattern, List.of(), 0, false, List.copyOf(suggestions), kind, message);
    }

    public static FindResult failure(String pattern, RefactoringException e) {
        return failure(pattern, e.kind(), e.getMessage(), e.suggestions());
    }
}
