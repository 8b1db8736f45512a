package io.github.jbellis.refactor.backup;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BackupManagerTest {

    @Test
    void testCreateAndRestore(@TempDir Path dir) throws Exception {
        var project = TestProject.withFiles(dir.resolve("src"),
                                            "a.py", "x = 1\n",
                                            "pkg/b.py", "y = 'é'\n");
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        var backup = backups.create(List.of(project.file("pkg/b.py"), project.file("a.py")));

        assertEquals(List.of("a.py", "pkg/b.py"), backup.files().stream().map(Backup.BackedUpFile::path).toList());
        assertEquals(9, backup.files().get(1).size());
        assertTrue(Files.isRegularFile(dir.resolve("backups").resolve(backup.id()).resolve(BackupManager.MANIFEST)));

        TestProject.write(project.getRoot().resolve("a.py"), "x = 2\n");
        Files.delete(project.getRoot().resolve("pkg/b.py"));

        var restored = backups.restore(backup.id());
        assertEquals(List.of(project.file("a.py"), project.file("pkg/b.py")), restored);
        assertEquals("x = 1\n", project.read("a.py"));
        assertEquals("y = 'é'\n", project.read("pkg/b.py"));
    }

    @Test
    void testManifestRoundTrips(@TempDir Path dir) throws Exception {
        var project = TestProject.withFiles(dir.resolve("src"), "a.py", "x = 1\n");
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        var backup = backups.create(List.of(project.file("a.py")));

        var loaded = backups.get(backup.id()).orElseThrow();
        assertEquals(backup, loaded);
        var manifest = Files.readString(dir.resolve("backups").resolve(backup.id()).resolve(BackupManager.MANIFEST));
        assertTrue(manifest.contains("\"created_at\""), manifest);
    }

    @Test
    void testListNewestFirstAndRemove(@TempDir Path dir) throws Exception {
        var project = TestProject.withFiles(dir.resolve("src"), "a.py", "x = 1\n");
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        assertTrue(backups.list().isEmpty());

        var first = backups.create(List.of(project.file("a.py")));
        Thread.sleep(5);
        var second = backups.create(List.of(project.file("a.py")));
        assertEquals(List.of(second.id(), first.id()), backups.list().stream().map(Backup::id).toList());

        backups.remove(first.id());
        assertEquals(List.of(second.id()), backups.list().stream().map(Backup::id).toList());
        assertFalse(Files.exists(dir.resolve("backups").resolve(first.id())));
    }

    @Test
    void testUnknownIdIsReported(@TempDir Path dir) {
        var backups = new BackupManager(dir.resolve("backups"), dir);
        var e = assertThrows(RefactoringException.class, () -> backups.restore("no-such-backup"));
        assertEquals(ErrorKind.BACKUP_NOT_FOUND, e.kind());
        assertEquals(List.of("List the available backups to find a valid id"), e.suggestions());
        assertThrows(RefactoringException.class, () -> backups.remove("no-such-backup"));
    }

    @Test
    void testIdsThatEscapeTheBackupDirectoryAreRejected(@TempDir Path dir) {
        var backups = new BackupManager(dir.resolve("backups"), dir);
        assertTrue(backups.get("../src").isEmpty());
        assertTrue(backups.get("").isEmpty());
    }

    @Test
    void testTruncatedCopyIsNotRestored(@TempDir Path dir) throws Exception {
        var project = TestProject.withFiles(dir.resolve("src"), "a.py", "x = 1\n");
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        var backup = backups.create(List.of(project.file("a.py")));
        TestProject.write(dir.resolve("backups").resolve(backup.id()).resolve("files").resolve("0.bak"), "x");

        assertThrows(IOException.class, () -> backups.restore(backup.id()));
        assertEquals("x = 1\n", project.read("a.py"));
    }

    @Test
    void testFailedCreateLeavesNothingBehind(@TempDir Path dir) {
        var project = TestProject.withFiles(dir.resolve("src"), "a.py", "x = 1\n");
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        assertThrows(IOException.class, () -> backups.create(List.of(project.file("a.py"), project.file("missing.py"))));
        assertTrue(backups.list().isEmpty());
    }
}
