package io.github.jbellis.refactor.testutil;

import io.github.jbellis.refactor.IProject;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import io.github.jbellis.refactor.analyzer.PythonBackend;
import io.github.jbellis.refactor.analyzer.SourceModel;
import io.github.jbellis.refactor.analyzer.SymbolTable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Lightweight IProject over a directory of test sources.
 */
public final class TestProject implements IProject {
    private final Path root;

    public TestProject(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /** Creates a TestProject rooted under src/test/resources/{subDir}. Only for tests that do not write. */
    public static TestProject createTestProject(String subDir) {
        Path testDir = Path.of("src/test/resources", subDir);
        assertTrue(Files.exists(testDir), "Test resource dir missing: " + testDir);
        assertTrue(Files.isDirectory(testDir), testDir + " is not a directory");
        return new TestProject(testDir);
    }

    /** Copies src/test/resources/{subDir} into {@code target} and roots a project there. */
    public static TestProject copyOf(String subDir, Path target) {
        var source = createTestProject(subDir).getRoot();
        try (Stream<Path> stream = Files.walk(source)) {
            for (var path : stream.toList()) {
                var destination = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(path, destination);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new TestProject(target);
    }

    /** A project holding the given files, written under {@code target}. */
    public static TestProject withFiles(Path target, String... namesAndContents) {
        for (int i = 0; i < namesAndContents.length; i += 2) {
            write(target.resolve(namesAndContents[i]), namesAndContents[i + 1]);
        }
        return new TestProject(target);
    }

    public static void write(Path file, String content) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String read(String relativePath) {
        try {
            return Files.readString(root.resolve(relativePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ProjectFile file(String relativePath) {
        return new ProjectFile(root, relativePath);
    }

    /** Parses every Python file and builds a fresh symbol table. */
    public SymbolTable symbolTable() {
        var backend = new PythonBackend();
        var scan = new SourceModel(this, backend, 10_000, Duration.ofMinutes(1)).scan();
        return backend.buildSymbolTable(scan.files(), scan.warnings(), scan.partial());
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Set<ProjectFile> getAllFiles() {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !root.relativize(p).startsWith(".refactor"))
                    .map(p -> new ProjectFile(root, root.relativize(p)))
                    .collect(Collectors.toSet());
        } catch (IOException e) {
            System.err.printf("ERROR (TestProject.getAllFiles): walk failed on %s: %s%n",
                              root, e.getMessage());
            e.printStackTrace(System.err);
            return Collections.emptySet();
        }
    }
}
