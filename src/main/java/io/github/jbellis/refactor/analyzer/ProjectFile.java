package io.github.jbellis.refactor.analyzer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file identified by its path relative to the project root. Two ProjectFiles are equal when they
 * name the same file under the same root, however the path was spelled when it was created.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /**
     * root must be absolute and normalized; relPath is normalized here
     */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute() || !root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be absolute and normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("Relative path expected, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String getFileName() {
        return relPath.getFileName().toString();
    }

    /**
     * The extension without its dot, or the empty string.
     */
    public String extension() {
        var name = getFileName();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }

    public boolean exists() {
        return Files.exists(absPath());
    }

    public byte[] readBytes() throws IOException {
        return Files.readAllBytes(absPath());
    }

    public Language getLanguage() {
        return Language.fromExtension(extension());
    }

    /**
     * Relative path with forward slashes, as used in locations reported to callers.
     */
    @Override
    public String toString() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public int compareTo(ProjectFile o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile other)) return false;
        return root.equals(other.root) && relPath.equals(other.relPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, relPath);
    }
}
