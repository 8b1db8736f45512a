package io.github.jbellis.refactor.backup;

import java.util.List;

/**
 * Metadata of a backup, stored as {@code manifest.json} in the backup's directory. File contents live
 * next to the manifest, one copy per entry.
 *
 * @param createdAt epoch millis
 */
public record Backup(String id, long createdAt, List<BackedUpFile> files) {

    /**
     * @param path project-relative path, with forward slashes
     * @param size bytes captured
     */
    public record BackedUpFile(String path, long size) {
    }

    public Backup {
        files = List.copyOf(files);
    }
}
