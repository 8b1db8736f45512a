package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LocalProjectTest {

    @Test
    void testStateAndBuildDirectoriesAreSkipped(@TempDir Path dir) {
        TestProject.withFiles(dir,
                              "main.py", "x = 1\n",
                              "pkg/util.py", "y = 2\n",
                              ".refactor/backups/0/files/0.bak", "x = 0\n",
                              "__pycache__/main.py", "stale\n",
                              "venv/lib/site.py", "z = 3\n",
                              "README.md", "# readme\n");
        var project = new LocalProject(dir);
        var files = project.getAllFiles().stream().map(Object::toString).collect(Collectors.toSet());
        assertEquals(Set.of("main.py", "pkg/util.py", "README.md"), files);
        assertEquals(Language.PYTHON, project.getPrimaryLanguage());
    }

    @Test
    void testRootMustBeDirectory(@TempDir Path dir) {
        assertThrows(IllegalArgumentException.class, () -> new LocalProject(dir.resolve("missing")));
    }

    @Test
    void testNoSources(@TempDir Path dir) {
        TestProject.write(dir.resolve("notes.txt"), "hello");
        assertEquals(Language.NONE, new LocalProject(dir).getPrimaryLanguage());
    }
}
