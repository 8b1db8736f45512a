package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.ProjectFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.Set;

/**
 * A project backed by a directory on the local filesystem. Files are listed fresh on every call.
 */
public final class LocalProject implements IProject {
    private static final Logger logger = LogManager.getLogger(LocalProject.class);

    /** Directories that never hold project sources. */
    static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
            RefactorConfig.STATE_DIRECTORY, "__pycache__", "node_modules", "venv", "site-packages",
            "build", "dist", "target");

    private final Path root;

    public LocalProject(Path root) {
        var absolute = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute)) {
            throw new IllegalArgumentException("Project root is not a directory: " + absolute);
        }
        this.root = absolute;
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Set<ProjectFile> getAllFiles() {
        var files = new HashSet<ProjectFile>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    var name = dir.getFileName().toString();
                    if (name.startsWith(".") || EXCLUDED_DIRECTORIES.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(new ProjectFile(root, root.relativize(file)));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files under " + root, e);
        }
        return files;
    }

    @Override
    public String toString() {
        return "LocalProject[" + root + "]";
    }
}
