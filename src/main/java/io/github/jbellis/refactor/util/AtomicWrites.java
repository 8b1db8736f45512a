package io.github.jbellis.refactor.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class AtomicWrites {
    private AtomicWrites() {
    }

    /**
     * Replaces the content of a file with the given bytes.
     * <p>
     * The bytes are written to a temporary file next to the target, which is then moved over the target.
     * If the filesystem cannot move atomically we fall back to a plain replacing move, so a reader can
     * observe the old content or the new content but never a truncated file.
     *
     * @param targetPath the file to overwrite; its parent directories are created if missing
     * @param content    the new content
     * @throws IOException if writing or moving fails; the temporary file is removed in that case
     */
    public static void atomicOverwrite(Path targetPath, byte[] content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, ".refactor-", ".tmp");

        try {
            Files.write(tempFile, content);
            try {
                Files.move(tempFile, targetPath,
                           StandardCopyOption.ATOMIC_MOVE,
                           StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /**
     * UTF-8 convenience overload of {@link #atomicOverwrite(Path, byte[])}.
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        atomicOverwrite(targetPath, content.getBytes(StandardCharsets.UTF_8));
    }
}
