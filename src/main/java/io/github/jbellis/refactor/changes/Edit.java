package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.ProjectFile;

/**
 * Replace the bytes of {@code range} in {@code file} with {@code replacement}. An empty range inserts.
 */
public record Edit(ProjectFile file, ByteRange range, String replacement) {

    public static Edit insert(ProjectFile file, int offset, String text) {
        return new Edit(file, new ByteRange(offset, offset), text);
    }
}
