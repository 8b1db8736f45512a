package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.analyzer.LanguageBackend;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import io.github.jbellis.refactor.analyzer.SourceModel;
import io.github.jbellis.refactor.analyzer.SymbolResolver;
import io.github.jbellis.refactor.analyzer.SymbolTable;
import io.github.jbellis.refactor.backup.BackupManager;
import io.github.jbellis.refactor.backup.TransactionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Everything the engine keeps for one project: parsed files, the current symbol table, discovery
 * fingerprints, and the backup and transaction managers.
 * <p>
 * Reads (analyze, find, show) share {@link #lock()}'s read lock; mutations hold the write lock from
 * resolution until the edits are on disk.
 */
public final class ProjectState {
    private static final Logger logger = LogManager.getLogger(ProjectState.class);

    private final IProject project;
    private final LanguageBackend backend;
    private final RefactorConfig config;
    private final SourceModel sourceModel;
    private final BackupManager backups;
    private final TransactionManager transactions;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> discoveries = new ConcurrentHashMap<>();

    private volatile @Nullable SymbolTable table;

    public ProjectState(IProject project, LanguageBackend backend, RefactorConfig config) {
        this(project, backend, config, new BackupManager(config.backupDir(), project.getRoot()));
    }

    private ProjectState(IProject project, LanguageBackend backend, RefactorConfig config, BackupManager backups) {
        this(project, backend, config, backups, new TransactionManager(backups));
    }

    public ProjectState(IProject project,
                        LanguageBackend backend,
                        RefactorConfig config,
                        BackupManager backups,
                        TransactionManager transactions) {
        this.project = project;
        this.backend = backend;
        this.config = config;
        this.sourceModel = new SourceModel(project, backend, config.maxScanFiles(), config.scanTimeout());
        this.backups = backups;
        this.transactions = transactions;
    }

    public IProject project() {
        return project;
    }

    public Language language() {
        return backend.language();
    }

    public LanguageBackend backend() {
        return backend;
    }

    public RefactorConfig config() {
        return config;
    }

    public SourceModel sourceModel() {
        return sourceModel;
    }

    public BackupManager backups() {
        return backups;
    }

    public TransactionManager transactions() {
        return transactions;
    }

    public ReadWriteLock lock() {
        return lock;
    }

    /**
     * The symbol table of the current snapshot, built on first use after an invalidation.
     */
    public SymbolTable table() {
        var current = table;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            var built = table;
            if (built == null) {
                long start = System.currentTimeMillis();
                var scan = sourceModel.scan();
                built = backend.buildSymbolTable(scan.files(), scan.warnings(), scan.partial());
                table = built;
                logger.debug("Built symbol table for {} in {} ms: {}", project.getRoot(),
                             System.currentTimeMillis() - start, built);
            }
            return built;
        }
    }

    public SymbolResolver resolver() {
        return new SymbolResolver(table(), config.suggestionLimit(), config.suggestionDistance());
    }

    /**
     * Remembers the content fingerprint a function had when its anonymous elements were listed.
     */
    public void recordDiscovery(String qualifiedName, String fingerprint) {
        discoveries.put(qualifiedName, fingerprint);
    }

    public Optional<String> discovery(String qualifiedName) {
        return Optional.ofNullable(discoveries.get(qualifiedName));
    }

    /**
     * Drops cached state for files that changed. The symbol table is rebuilt on next use.
     */
    public void invalidate(Collection<ProjectFile> files) {
        sourceModel.invalidate(files);
        table = null;
        logger.debug("Invalidated {} files of {}", files.size(), project.getRoot());
    }

    public void invalidateAll() {
        sourceModel.invalidateAll();
        table = null;
        logger.debug("Invalidated all files of {}", project.getRoot());
    }
}
