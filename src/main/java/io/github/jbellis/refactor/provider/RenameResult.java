package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param conflicts         descriptions of the naming conflicts that blocked the rename, if any
 * @param referencesUpdated identifier tokens rewritten, the definition included
 */
public record RenameResult(boolean success,
                           String oldName,
                           String newName,
                           @Nullable String qualifiedName,
                           List<String> filesModified,
                           int referencesUpdated,
                           List<String> conflicts,
                           @Nullable String backupId,
                           List<String> suggestions,
                           @Nullable ErrorKind errorKind,
                           @Nullable String message) implements OperationResult {

    public static RenameResult success(String oldName, String newName, String qualifiedName,
                                       List<String> filesModified, int referencesUpdated, String backupId) {
        return new RenameResult(true, oldName, newName, qualifiedName, List.copyOf(filesModified), referencesUpdated,
                                List.of(), backupId, List.of(), null, null);
    }

    public static RenameResult conflicts(String oldName, String newName, String qualifiedName, List<String> conflicts,
                                         List<String> suggestions) {
        return new RenameResult(false, oldName, newName, qualifiedName, List.of(), 0, List.copyOf(conflicts), null,
                                List.copyOf(suggestions), ErrorKind.NAMING_CONFLICT,
                                "Renaming " + qualifiedName + " to '" + newName + "' conflicts with "
                                + String.join("; ", conflicts));
    }

    public static RenameResult failure(String oldName, String newName, ErrorKind kind, String message,
                                       List<String> suggestions) {
        return new RenameResult(false, oldName, newName, null, List.of(), 0, List.of(), null,
                                List.copyOf(suggestions), kind, message);
    }

    public static RenameResult failure(String oldName, String newName, RefactoringException e) {
        return failure(oldName, newName, e.kind(), e.getMessage(), e.suggestions());
    }
}
