package io.github.jbellis.refactor;

import java.util.List;

/**
 * A refactoring step failed for a reason the caller can act on. Always carries at least one suggestion.
 */
public class RefactoringException extends Exception {
    private final ErrorKind kind;
    private final List<String> suggestions;

    public RefactoringException(ErrorKind kind, String message, List<String> suggestions) {
        this(kind, message, suggestions, null);
    }

    public RefactoringException(ErrorKind kind, String message, List<String> suggestions, Throwable cause) {
        super(message, cause);
        if (suggestions.isEmpty()) {
            throw new IllegalArgumentException("A refactoring failure needs at least one suggestion: " + message);
        }
        this.kind = kind;
        this.suggestions = List.copyOf(suggestions);
    }

    public RefactoringException(ErrorKind kind, String message, String suggestion) {
        this(kind, message, List.of(suggestion));
    }

    public ErrorKind kind() {
        return kind;
    }

    public List<String> suggestions() {
        return suggestions;
    }
}
