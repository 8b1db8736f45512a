package io.github.jbellis.refactor;

import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class RefactorConfigTest {

    @Test
    void testDefaults(@TempDir Path root) {
        var config = RefactorConfig.load(root);
        assertEquals(RefactorConfig.defaults(root), config);
        assertEquals(100, config.findLimit());
        assertEquals(root.resolve(".refactor").resolve("backups"), config.backupDir());
    }

    @Test
    void testOverridesFromProperties() {
        var root = Path.of("/work/project").toAbsolutePath().normalize();
        var props = new Properties();
        props.setProperty("find.limit", "10");
        props.setProperty("suggestions.limit", " 3 ");
        props.setProperty("scan.timeoutMillis", "500");
        props.setProperty("backup.dir", "../backups");

        var config = RefactorConfig.fromProperties(root, props);
        assertEquals(10, config.findLimit());
        assertEquals(3, config.suggestionLimit());
        assertEquals(Duration.ofMillis(500), config.scanTimeout());
        assertEquals(root.resolve("../backups").normalize(), config.backupDir());
        assertEquals(RefactorConfig.DEFAULT_SUGGESTION_DISTANCE, config.suggestionDistance());
    }

    @Test
    void testMalformedValuesFallBackToDefaults() {
        var root = Path.of("/work/project").toAbsolutePath().normalize();
        var props = new Properties();
        props.setProperty("find.limit", "lots");
        props.setProperty("scan.maxFiles", "-5");

        var config = RefactorConfig.fromProperties(root, props);
        assertEquals(RefactorConfig.DEFAULT_FIND_LIMIT, config.findLimit());
        assertEquals(RefactorConfig.DEFAULT_MAX_SCAN_FILES, config.maxScanFiles());
    }

    @Test
    void testLoadReadsProjectFile(@TempDir Path root) {
        TestProject.write(root.resolve(".refactor").resolve("refactor.properties"),
                          "find.limit=7\nanalysis.longFunctionLines=40\n");
        var config = RefactorConfig.load(root);
        assertEquals(7, config.findLimit());
        assertEquals(40, config.longFunctionLines());
    }
}
