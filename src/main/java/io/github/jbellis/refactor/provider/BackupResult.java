package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.backup.Backup;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of restoring, removing or listing backups.
 *
 * @param files   files rewritten by a restore
 * @param backups backups on disk, for a listing
 */
public record BackupResult(boolean success,
                           @Nullable String backupId,
                           List<String> files,
                           List<Backup> backups,
                           List<String> suggestions,
                           @Nullable ErrorKind errorKind,
                           @Nullable String message) implements OperationResult {

    public static BackupResult restored(String backupId, List<String> files) {
        return new BackupResult(true, backupId, List.copyOf(files), List.of(), List.of(), null, null);
    }

    public static BackupResult removed(String backupId) {
        return new BackupResult(true, backupId, List.of(), List.of(), List.of(), null, null);
    }

    public static BackupResult listing(List<Backup> backups) {
        return new BackupResult(true, null, List.of(), List.copyOf(backups), List.of(), null, null);
    }

    public static BackupResult failure(@Nullable String backupId, ErrorKind kind, String message, List<String> suggestions) {
        return new BackupResult(false, backupId, List.of(), List.of(), List.copyOf(suggestions), kind, message);
    }

    public static BackupResult failure(@Nullable String backupId, RefactoringException e) {
        return failure(backupId, e.kind(), e.getMessage(), e.suggestions());
    }
}
