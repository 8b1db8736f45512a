package io.github.jbellis.refactor.backup;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.changes.ChangeSet;
import io.github.jbellis.refactor.changes.Edit;
import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionManagerTest {

    private static ChangeSet renameXtoZ(TestProject project) {
        var a = "x = 1\n".getBytes(StandardCharsets.UTF_8);
        var b = "print(x)\n".getBytes(StandardCharsets.UTF_8);
        return ChangeSet.builder()
                .add(new Edit(project.file("a.py"), new ByteRange(0, 1), "z"), a)
                .add(new Edit(project.file("b.py"), new ByteRange(6, 7), "z"), b)
                .build();
    }

    private static TestProject project(Path dir) {
        return TestProject.withFiles(dir.resolve("src"),
                                     "a.py", "x = 1\n",
                                     "b.py", "print(x)\n");
    }

    @Test
    void testApplyWritesEveryFile(@TempDir Path dir) throws Exception {
        var project = project(dir);
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        var transactions = new TransactionManager(backups);
        var changes = renameXtoZ(project);

        transactions.preflight(changes);
        var written = transactions.apply(changes, backups.create(changes.files()));
        assertEquals(List.of(project.file("a.py"), project.file("b.py")), written);
        assertEquals("z = 1\n", project.read("a.py"));
        assertEquals("print(z)\n", project.read("b.py"));
    }

    @Test
    void testFailedWriteRollsBack(@TempDir Path dir) throws Exception {
        var project = project(dir);
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        var calls = new AtomicInteger();
        ContentWriter failsOnSecond = (path, content) -> {
            if (calls.incrementAndGet() == 2) {
                throw new IOException("disk full");
            }
            ContentWriter.ATOMIC.write(path, content);
        };
        var transactions = new TransactionManager(backups, failsOnSecond);
        var changes = renameXtoZ(project);
        var backup = backups.create(changes.files());

        var e = assertThrows(RefactoringException.class, () -> transactions.apply(changes, backup));
        assertEquals(ErrorKind.APPLY_ERROR, e.kind());
        assertTrue(e.getMessage().contains("disk full"), e.getMessage());
        assertTrue(e.getMessage().endsWith("all files were rolled back"), e.getMessage());
        assertEquals("x = 1\n", project.read("a.py"));
        assertEquals("print(x)\n", project.read("b.py"));
    }

    @Test
    void testUncheckedWriterFailureRollsBack(@TempDir Path dir) throws Exception {
        var project = project(dir);
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot());
        var calls = new AtomicInteger();
        ContentWriter failsOnSecond = (path, content) -> {
            if (calls.incrementAndGet() == 2) {
                throw new IllegalStateException("writer closed");
            }
            ContentWriter.ATOMIC.write(path, content);
        };
        var transactions = new TransactionManager(backups, failsOnSecond);
        var changes = renameXtoZ(project);
        var backup = backups.create(changes.files());

        var e = assertThrows(RefactoringException.class, () -> transactions.apply(changes, backup));
        assertEquals(ErrorKind.APPLY_ERROR, e.kind());
        assertTrue(e.getMessage().contains("writer closed"), e.getMessage());
        assertTrue(e.getMessage().endsWith("all files were rolled back"), e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("x = 1\n", project.read("a.py"));
        assertEquals("print(x)\n", project.read("b.py"));
    }

    @Test
    void testFailedRollbackIsReported(@TempDir Path dir) throws Exception {
        var project = project(dir);
        ContentWriter broken = (path, content) -> {
            throw new IOException("read-only filesystem");
        };
        var backups = new BackupManager(dir.resolve("backups"), project.getRoot(), broken);
        var transactions = new TransactionManager(backups, broken);
        var changes = renameXtoZ(project);
        var backup = backups.create(changes.files());

        var e = assertThrows(RefactoringException.class, () -> transactions.apply(changes, backup));
        assertEquals(ErrorKind.APPLY_ERROR, e.kind());
        assertTrue(e.getMessage().contains("rollback failed"), e.getMessage());
        assertTrue(e.suggestions().get(0).contains(backup.id()), e.suggestions().toString());
    }

    @Test
    void testPreflightDetectsConcurrentEdit(@TempDir Path dir) {
        var project = project(dir);
        var transactions = new TransactionManager(new BackupManager(dir.resolve("backups"), project.getRoot()));
        var changes = renameXtoZ(project);
        TestProject.write(project.getRoot().resolve("b.py"), "print(x, x)\n");

        var e = assertThrows(RefactoringException.class, () -> transactions.preflight(changes));
        assertEquals(ErrorKind.IDENTIFIER_STALE, e.kind());
        assertTrue(e.getMessage().startsWith("b.py"), e.getMessage());
    }

    @Test
    void testPreflightReportsUnreadableFile(@TempDir Path dir) throws Exception {
        var project = project(dir);
        var transactions = new TransactionManager(new BackupManager(dir.resolve("backups"), project.getRoot()));
        var changes = renameXtoZ(project);
        Files.delete(project.getRoot().resolve("a.py"));

        var e = assertThrows(RefactoringException.class, () -> transactions.preflight(changes));
        assertEquals(ErrorKind.APPLY_ERROR, e.kind());
    }
}
