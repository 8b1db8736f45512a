package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.provider.AnalysisResult;
import io.github.jbellis.refactor.provider.BackupResult;
import io.github.jbellis.refactor.provider.ExtractResult;
import io.github.jbellis.refactor.provider.ExtractSource;
import io.github.jbellis.refactor.provider.FindResult;
import io.github.jbellis.refactor.provider.RefactoringProvider;
import io.github.jbellis.refactor.provider.RenameResult;
import io.github.jbellis.refactor.provider.ShowResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Entry point for callers. Picks the provider for a project's language, keeps per-project state in the
 * {@link ProjectCache} it was given, and turns every failure, expected or not, into an unsuccessful result.
 */
public class RefactoringEngine {
    private static final Logger logger = LogManager.getLogger(RefactoringEngine.class);

    private static final String UNEXPECTED = "Unexpected failure; see the log for details";

    private final ProviderRegistry registry;
    private final ProjectCache cache;

    public RefactoringEngine(ProviderRegistry registry, ProjectCache cache) {
        this.registry = registry;
        this.cache = cache;
    }

    private record Bound(ProjectState state, RefactoringProvider provider) {
    }

    public AnalysisResult analyze(Path root, String name) {
        try {
            var bound = bind(root);
            return bound.provider().analyze(bound.state(), name);
        } catch (RefactoringException e) {
            return AnalysisResult.failure(e);
        } catch (RuntimeException e) {
            logger.error("analyze {} in {} failed", name, root, e);
            return AnalysisResult.failure(ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    public FindResult find(Path root, String pattern) {
        try {
            var bound = bind(root);
            return bound.provider().find(bound.state(), pattern);
        } catch (RefactoringException e) {
            return FindResult.failure(pattern, e);
        } catch (RuntimeException e) {
            logger.error("find {} in {} failed", pattern, root, e);
            return FindResult.failure(pattern, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    public ShowResult show(Path root, String functionName) {
        try {
            var bound = bind(root);
            return bound.provider().show(bound.state(), functionName);
        } catch (RefactoringException e) {
            return ShowResult.failure(functionName, e);
        } catch (RuntimeException e) {
            logger.error("show {} in {} failed", functionName, root, e);
            return ShowResult.failure(functionName, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    public RenameResult rename(Path root, String oldName, String newName) {
        try {
            var bound = bind(root);
            return bound.provider().rename(bound.state(), oldName, newName);
        } catch (RefactoringException e) {
            return RenameResult.failure(oldName, newName, e);
        } catch (RuntimeException e) {
            logger.error("rename {} -> {} in {} failed", oldName, newName, root, e);
            return RenameResult.failure(oldName, newName, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    /**
     * @param source an element id listed by show ({@code login.lambda_1}) or a line range
     *               ({@code login:3-5})
     */
    public ExtractResult extract(Path root, String source, String newName) {
        try {
            var parsed = ExtractSource.parse(source);
            var bound = bind(root);
            return bound.provider().extract(bound.state(), parsed, newName);
        } catch (RefactoringException e) {
            return ExtractResult.failure(source, newName, e);
        } catch (RuntimeException e) {
            logger.error("extract {} -> {} in {} failed", source, newName, root, e);
            return ExtractResult.failure(source, newName, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    /**
     * Extracts an exact byte range of the named function's file.
     */
    public ExtractResult extract(Path root, String function, ByteRange range, String newName) {
        var source = new ExtractSource.ByteSpan(function, range);
        try {
            var bound = bind(root);
            return bound.provider().extract(bound.state(), source, newName);
        } catch (RefactoringException e) {
            return ExtractResult.failure(source.toString(), newName, e);
        } catch (RuntimeException e) {
            logger.error("extract {} -> {} in {} failed", source, newName, root, e);
            return ExtractResult.failure(source.toString(), newName, ErrorKind.OPERATION_FAILED, describe(e),
                                         List.of(UNEXPECTED));
        }
    }

    public BackupResult restore(Path root, String backupId) {
        try {
            var bound = bind(root);
            return bound.provider().restore(bound.state(), backupId);
        } catch (RefactoringException e) {
            return BackupResult.failure(backupId, e);
        } catch (RuntimeException e) {
            logger.error("restore {} in {} failed", backupId, root, e);
            return BackupResult.failure(backupId, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    public BackupResult listBackups(Path root) {
        try {
            return BackupResult.listing(bind(root).state().backups().list());
        } catch (RefactoringException e) {
            return BackupResult.failure(null, e);
        } catch (RuntimeException e) {
            logger.error("Listing backups of {} failed", root, e);
            return BackupResult.failure(null, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    public BackupResult removeBackup(Path root, String backupId) {
        try {
            var state = bind(root).state();
            var lock = state.lock().writeLock();
            lock.lock();
            try {
                state.backups().remove(backupId);
            } finally {
                lock.unlock();
            }
            return BackupResult.removed(backupId);
        } catch (RefactoringException e) {
            return BackupResult.failure(backupId, e);
        } catch (IOException e) {
            logger.warn("Removing backup {} of {} failed: {}", backupId, root, e.getMessage());
            return BackupResult.failure(backupId, ErrorKind.APPLY_ERROR, "Could not remove backup " + backupId + ": " + e.getMessage(),
                                        List.of("Check the permissions of the backup directory"));
        } catch (RuntimeException e) {
            logger.error("Removing backup {} of {} failed", backupId, root, e);
            return BackupResult.failure(backupId, ErrorKind.OPERATION_FAILED, describe(e), List.of(UNEXPECTED));
        }
    }

    /**
     * Tells the engine that files changed outside of it, so the next operation re-reads them.
     */
    public void fileChanged(Path root, Collection<Path> files) {
        cache.fileChanged(root, files);
    }

    private Bound bind(Path root) throws RefactoringException {
        var existing = cache.get(root);
        if (existing != null) {
            return new Bound(existing, provider(existing.language(), root));
        }
        if (!Files.isDirectory(root)) {
            throw new RefactoringException(ErrorKind.VALIDATION_FAILED, root + " is not a directory",
                                           "Pass the root directory of the project");
        }
        var project = new LocalProject(root);
        var language = project.getPrimaryLanguage();
        var provider = provider(language, root);
        var state = cache.computeIfAbsent(project.getRoot(), r -> new ProjectState(project,
                                                                                   provider.newBackend(),
                                                                                   RefactorConfig.load(r)));
        return new Bound(state, provider);
    }

    private RefactoringProvider provider(Language language, Path root) throws RefactoringException {
        return registry.providerFor(language)
                .orElseThrow(() -> new RefactoringException(
                        ErrorKind.UNSUPPORTED_LANGUAGE,
                        language == Language.NONE
                        ? "No supported source files under " + root
                        : "No provider supports " + language.name(),
                        "Supported languages: " + String.join(", ", registry.providers().stream()
                                .map(p -> p.language().name())
                                .toList())));
    }

    private static String describe(RuntimeException e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }
}
