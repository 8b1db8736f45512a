package io.github.jbellis.refactor.backup;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import io.github.jbellis.refactor.changes.ChangeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link ChangeSet} to disk. The caller backs the affected files up first; if any write fails,
 * every file is restored from that backup before the failure is reported.
 */
public class TransactionManager {
    private static final Logger logger = LogManager.getLogger(TransactionManager.class);

    private final BackupManager backups;
    private final ContentWriter writer;

    public TransactionManager(BackupManager backups) {
        this(backups, ContentWriter.ATOMIC);
    }

    public TransactionManager(BackupManager backups, ContentWriter writer) {
        this.backups = backups;
        this.writer = writer;
    }

    /**
     * Checks that every file still holds the content the change set was planned against.
     */
    public void preflight(ChangeSet changes) throws RefactoringException {
        for (var file : changes.files()) {
            byte[] current;
            try {
                current = file.readBytes();
            } catch (IOException e) {
                throw new RefactoringException(ErrorKind.APPLY_ERROR, "Cannot read " + file + ": " + e.getMessage(),
                                               List.of("Check that the file exists and is readable"), e);
            }
            if (!changes.matchesOriginal(file, current)) {
                throw new RefactoringException(ErrorKind.IDENTIFIER_STALE,
                                               file + " changed on disk after it was analyzed",
                                               "Re-run the operation against the current content");
            }
        }
    }

    /**
     * Writes the edited content of every file in the change set.
     *
     * @param backup a backup covering every file of the change set, created just before this call
     * @return the files written
     * @throws RefactoringException {@link ErrorKind#APPLY_ERROR} if a write fails; the message says
     *                              whether the rollback succeeded
     */
    public List<ProjectFile> apply(ChangeSet changes, Backup backup) throws RefactoringException {
        var written = new ArrayList<ProjectFile>();
        for (var file : changes.files()) {
            try {
                writer.write(file.absPath(), changes.result(file));
                written.add(file);
            } catch (IOException | RuntimeException e) {
                logger.warn("Writing {} failed after {} of {} files, rolling back from backup {}",
                            file, written.size(), changes.files().size(), backup.id());
                throw rollback(backup, file, e);
            }
        }
        logger.info("Applied {} edits to {} files", changes.editCount(), written.size());
        return List.copyOf(written);
    }

    private RefactoringException rollback(Backup backup, ProjectFile failed, Exception cause) {
        var message = "Could not write " + failed + ": " + cause.getMessage();
        try {
            backups.restore(backup.id());
            return new RefactoringException(ErrorKind.APPLY_ERROR, message + "; all files were rolled back",
                                            List.of("No file was changed; fix the I/O problem and retry"), cause);
        } catch (RefactoringException | IOException e) {
            logger.error("Rollback from backup {} failed: {}", backup.id(), e.getMessage());
            cause.addSuppressed(e);
            return new RefactoringException(ErrorKind.APPLY_ERROR, message + "; rollback failed: " + e.getMessage(),
                                            List.of("Restore backup " + backup.id() + " once the I/O problem is fixed"),
                                            cause);
        }
    }
}
