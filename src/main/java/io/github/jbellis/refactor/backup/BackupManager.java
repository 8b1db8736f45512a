package io.github.jbellis.refactor.backup;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import io.github.jbellis.refactor.util.AtomicWrites;
import io.github.jbellis.refactor.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Byte-exact snapshots of project files. Each backup is a directory under the backup root holding
 * {@code manifest.json} and {@code files/<n>.bak}, one copy per captured file. Backups stay on disk until
 * they are removed.
 */
public class BackupManager {
    private static final Logger logger = LogManager.getLogger(BackupManager.class);

    static final String MANIFEST = "manifest.json";
    private static final String FILES = "files";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9-]+");

    private final Path backupDir;
    private final Path projectRoot;
    private final ContentWriter writer;

    public BackupManager(Path backupDir, Path projectRoot) {
        this(backupDir, projectRoot, ContentWriter.ATOMIC);
    }

    public BackupManager(Path backupDir, Path projectRoot, ContentWriter writer) {
        this.backupDir = backupDir;
        this.projectRoot = projectRoot;
        this.writer = writer;
    }

    public Path backupDir() {
        return backupDir;
    }

    /**
     * Captures the current content of every file. The backup is complete on disk when this returns;
     * a failure part way through removes what was written.
     */
    public Backup create(Collection<ProjectFile> files) throws IOException {
        var id = UUID.randomUUID().toString();
        var dir = backupDir.resolve(id);
        var entries = new ArrayList<Backup.BackedUpFile>();
        try {
            Files.createDirectories(dir.resolve(FILES));
            int n = 0;
            for (var file : files.stream().sorted().toList()) {
                var bytes = file.readBytes();
                AtomicWrites.atomicOverwrite(dir.resolve(FILES).resolve(n++ + ".bak"), bytes);
                entries.add(new Backup.BackedUpFile(file.toString(), bytes.length));
            }
            var backup = new Backup(id, System.currentTimeMillis(), entries);
            Json.write(dir.resolve(MANIFEST), backup);
            logger.info("Created backup {} of {} files", id, entries.size());
            return backup;
        } catch (IOException e) {
            logger.warn("Backup {} failed, removing partial copy: {}", id, e.getMessage());
            try {
                deleteRecursively(dir);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    public Optional<Backup> get(String id) {
        if (!VALID_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        var manifest = backupDir.resolve(id).resolve(MANIFEST);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Json.read(manifest, Backup.class));
        } catch (IOException e) {
            logger.error("Error reading backup manifest {}: {}", manifest, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Backups on disk, newest first.
     */
    public List<Backup> list() {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(backupDir)) {
            return dirs.filter(Files::isDirectory)
                    .map(dir -> get(dir.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparingLong(Backup::createdAt).reversed())
                    .toList();
        } catch (IOException e) {
            logger.error("Error listing backups in {}: {}", backupDir, e.getMessage());
            return List.of();
        }
    }

    /**
     * Rewrites every captured file with its backed-up bytes.
     *
     * @return the files restored
     */
    public List<ProjectFile> restore(String id) throws RefactoringException, IOException {
        var backup = require(id);
        var dir = backupDir.resolve(id).resolve(FILES);
        var restored = new ArrayList<ProjectFile>();
        for (int n = 0; n < backup.files().size(); n++) {
            var entry = backup.files().get(n);
            var file = new ProjectFile(projectRoot, entry.path());
            var bytes = Files.readAllBytes(dir.resolve(n + ".bak"));
            if (bytes.length != entry.size()) {
                throw new IOException("Backup copy of " + entry.path() + " has " + bytes.length
                                      + " bytes, manifest says " + entry.size());
            }
            writer.write(file.absPath(), bytes);
            restored.add(file);
        }
        logger.info("Restored backup {} ({} files)", id, restored.size());
        return restored;
    }

    public void remove(String id) throws RefactoringException, IOException {
        require(id);
        deleteRecursively(backupDir.resolve(id));
        logger.info("Removed backup {}", id);
    }

    private Backup require(String id) throws RefactoringException {
        return get(id).orElseThrow(() -> new RefactoringException(
                ErrorKind.BACKUP_NOT_FOUND,
                "No backup with id '" + id + "' in " + backupDir,
                "List the available backups to find a valid id"));
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (var path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
