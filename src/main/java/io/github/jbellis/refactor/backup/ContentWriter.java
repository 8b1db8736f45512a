package io.github.jbellis.refactor.backup;

import io.github.jbellis.refactor.util.AtomicWrites;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes new file content during apply and restore.
 */
@FunctionalInterface
public interface ContentWriter {
    ContentWriter ATOMIC = AtomicWrites::atomicOverwrite;

    void write(Path file, byte[] content) throws IOException;
}
