package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.PythonBackend;
import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectCacheTest {

    private static ProjectState open(ProjectCache cache, Path root) {
        return cache.computeIfAbsent(root, r -> new ProjectState(new LocalProject(r), new PythonBackend(),
                                                                 RefactorConfig.load(r)));
    }

    @Test
    void testStatesAreKeyedByNormalizedRoot(@TempDir Path dir) {
        TestProject.withFiles(dir, "m.py", "x = 1\n");
        var cache = new ProjectCache();
        var state = open(cache, dir);
        assertSame(state, open(cache, dir.resolve("sub").resolve("..")));
        assertSame(state, cache.get(dir));
        assertEquals(1, cache.size());

        cache.evict(dir);
        assertNull(cache.get(dir));
        assertEquals(0, cache.size());
    }

    @Test
    void testFileChangedRebuildsTable(@TempDir Path dir) {
        TestProject.withFiles(dir, "m.py", "x = 1\n");
        var cache = new ProjectCache();
        var state = open(cache, dir);
        var before = state.table();
        assertTrue(before.symbol("m.x").isPresent());
        assertSame(before, state.table());

        TestProject.write(dir.resolve("m.py"), "y = 1\n");
        cache.fileChanged(dir, List.of(dir.resolve("m.py").toAbsolutePath()));
        var after = state.table();
        assertNotSame(before, after);
        assertTrue(after.symbol("m.y").isPresent());
        assertTrue(after.symbol("m.x").isEmpty());

        TestProject.write(dir.resolve("m.py"), "z = 1\n");
        cache.fileChanged(dir, List.of(Path.of("m.py")));
        assertTrue(state.table().symbol("m.z").isPresent());
    }

    @Test
    void testUnknownProjectIsIgnored(@TempDir Path dir) {
        new ProjectCache().fileChanged(dir, List.of(Path.of("m.py")));
    }
}
