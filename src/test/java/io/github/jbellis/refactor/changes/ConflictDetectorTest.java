package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.PythonBackend;
import io.github.jbellis.refactor.analyzer.SymbolTable;
import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConflictDetectorTest {
    private static final PythonBackend backend = new PythonBackend();
    private static SymbolTable table;
    private static ConflictDetector detector;

    @BeforeAll
    static void setup() {
        table = TestProject.createTestProject("testcode-py").symbolTable();
        detector = new ConflictDetector(backend, table);
    }

    private static List<Conflict> check(ConflictDetector detector, SymbolTable table, String qualifiedName, String newName) {
        return detector.check(table.symbol(qualifiedName).orElseThrow(), newName);
    }

    @Test
    void testExistingModuleBinding() {
        var conflicts = check(detector, table, "a.x", "y");
        assertEquals(1, conflicts.size());
        assertEquals("a.y", conflicts.get(0).existing());
        assertEquals("a.py:2", conflicts.get(0).location());
    }

    @Test
    void testReservedName() {
        var conflicts = check(detector, table, "a.x", "print");
        assertFalse(conflicts.isEmpty());
        assertTrue(conflicts.get(0).description().contains("reserved"), conflicts.toString());
    }

    @Test
    void testBindingInImportingModule() {
        var conflicts = check(detector, table, "app.models.User", "create_user");
        assertTrue(conflicts.stream().anyMatch(c -> "app.service.create_user".equals(c.existing())),
                   conflicts.toString());
    }

    @Test
    void testClassMemberClash() {
        var conflicts = check(detector, table, "app.models.User.is_adult", "age");
        assertEquals(1, conflicts.size());
        assertEquals("app.models.User.age", conflicts.get(0).existing());
    }

    @Test
    void testSafeRenames() {
        assertTrue(check(detector, table, "a.x", "width").isEmpty());
        assertTrue(check(detector, table, "app.models.User", "Account").isEmpty());
        assertTrue(check(detector, table, "app.models.User.is_adult", "is_grown_up").isEmpty());
    }

    @Test
    void testUnresolvedUseWouldBeCaptured(@TempDir Path dir) {
        var project = TestProject.withFiles(dir, "tools.py", """
                def helper():
                    return 1


                def run():
                    return count()
                """);
        var scratch = project.symbolTable();
        var conflicts = check(new ConflictDetector(backend, scratch), scratch, "tools.helper", "count");
        assertEquals(1, conflicts.size());
        assertEquals("tools.py:6", conflicts.get(0).location());
        assertTrue(conflicts.get(0).description().contains("captured"), conflicts.toString());
    }

    @Test
    void testLocalShadowingEnclosingName(@TempDir Path dir) {
        var project = TestProject.withFiles(dir, "calc.py", """
                rate = 2


                def scale(value):
                    factor = value * rate
                    return factor
                """);
        var scratch = project.symbolTable();
        var conflicts = check(new ConflictDetector(backend, scratch), scratch, "calc.scale.factor", "rate");
        assertTrue(conflicts.stream().anyMatch(c -> "calc.rate".equals(c.existing())), conflicts.toString());
    }
}
