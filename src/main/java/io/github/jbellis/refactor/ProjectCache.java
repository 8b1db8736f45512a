package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.ProjectFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Project states keyed by normalized root. Owned by whoever creates the engine; entries live until they are
 * evicted, and files are refreshed only through {@link #fileChanged}.
 */
public final class ProjectCache {
    private static final Logger logger = LogManager.getLogger(ProjectCache.class);

    private final Map<Path, ProjectState> states = new ConcurrentHashMap<>();

    public static Path key(Path root) {
        return root.toAbsolutePath().normalize();
    }

    public @Nullable ProjectState get(Path root) {
        return states.get(key(root));
    }

    public ProjectState computeIfAbsent(Path root, Function<Path, ProjectState> factory) {
        return states.computeIfAbsent(key(root), r -> {
            logger.debug("Opening project {}", r);
            return factory.apply(r);
        });
    }

    /**
     * Marks files of a cached project as changed. Paths may be absolute or relative to the root; a project
     * that is not cached is ignored.
     */
    public void fileChanged(Path root, Collection<Path> paths) {
        var state = get(root);
        if (state == null) {
            return;
        }
        var projectRoot = state.project().getRoot();
        var files = paths.stream()
                .map(p -> p.isAbsolute() ? projectRoot.relativize(p.normalize()) : p.normalize())
                .map(rel -> new ProjectFile(projectRoot, rel))
                .toList();
        state.invalidate(files);
    }

    public void evict(Path root) {
        if (states.remove(key(root)) != null) {
            logger.debug("Evicted project {}", key(root));
        }
    }

    public int size() {
        return states.size();
    }
}
