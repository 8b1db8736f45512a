package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.ProjectState;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.AnonymousElementIndexer;
import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import io.github.jbellis.refactor.analyzer.Resolution;
import io.github.jbellis.refactor.analyzer.SourceFile;
import io.github.jbellis.refactor.analyzer.Symbol;
import io.github.jbellis.refactor.analyzer.SymbolKind;
import io.github.jbellis.refactor.analyzer.SymbolResolver;
import io.github.jbellis.refactor.analyzer.SymbolTable;
import io.github.jbellis.refactor.analyzer.SyntaxNodes;
import io.github.jbellis.refactor.backup.Backup;
import io.github.jbellis.refactor.changes.ChangePlanner;
import io.github.jbellis.refactor.changes.ChangeSet;
import io.github.jbellis.refactor.changes.Conflict;
import io.github.jbellis.refactor.changes.ConflictDetector;
import io.github.jbellis.refactor.changes.ExtractionTarget;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The five operations, written once against the tree-sitter backends. Subclasses supply the backend and
 * the few language details the results need.
 */
public abstract sealed class TreeSitterRefactoringProvider implements RefactoringProvider
        permits PythonRefactoringProvider {
    protected static final Logger logger = LogManager.getLogger(TreeSitterRefactoringProvider.class);

    private static final Set<Capability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.allOf(Capability.class));

    private record Committed(Backup backup, List<String> files) {
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    /**
     * The docstring of a class or function definition, without quotes and common indentation.
     */
    protected abstract @Nullable String docstring(SourceFile source, TSNode definition);

    // ---------------------------------------------------------------- read operations

    @Override
    public AnalysisResult analyze(ProjectState state, String name) {
        var lock = state.lock().readLock();
        lock.lock();
        try {
            var resolver = state.resolver();
            var table = resolver.table();
            var symbol = resolve(resolver, name);

            var references = resolver.references(symbol).stream()
                    .map(r -> new AnalysisResult.ReferenceInfo(r.file().toString(),
                                                               r.line(),
                                                               table.source(r.file()).column(r.range().start()),
                                                               r.kind().name().toLowerCase(Locale.ROOT)))
                    .toList();

            var source = table.source(symbol.file());
            var definition = definitionNode(state, source, symbol);
            var info = new AnalysisResult.SymbolInfo(symbol.name(),
                                                     symbol.qualifiedName(),
                                                     symbol.kind().label(),
                                                     symbol.location(),
                                                     symbol.scope(),
                                                     definition == null ? null : docstring(source, definition));
            return AnalysisResult.success(info, references,
                                          refactoringHints(state, source, symbol, definition, references.size()),
                                          table.partial());
        } catch (RefactoringException e) {
            logger.debug("analyze {} failed: {}", name, e.getMessage());
            return AnalysisResult.failure(e);
        } finally {
            lock.unlock();
        }
    }

    private List<String> refactoringHints(ProjectState state, SourceFile source, Symbol symbol,
                                          @Nullable TSNode definition, int referenceCount) {
        var hints = new ArrayList<String>();
        if (referenceCount <= 1) {
            hints.add("No references besides the definition; " + symbol.name() + " may be unused");
        }
        if (definition == null || !symbol.kind().isCallable()) {
            return hints;
        }
        int lines = source.line(definition.getEndByte()) - source.line(definition.getStartByte()) + 1;
        if (lines > state.config().longFunctionLines()) {
            hints.add("Function is long (" + lines + " lines), consider extracting methods");
        }
        var indexer = new AnonymousElementIndexer(state.backend().syntaxProfile());
        int elements = indexer.index(source, definition, symbol.name()).size();
        if (elements > 0) {
            hints.add(elements + " extractable elements; run show " + symbol.qualifiedName() + " to list them");
        }
        return hints;
    }

    @Override
    public FindResult find(ProjectState state, String pattern) {
        if (pattern.isBlank()) {
            return FindResult.failure(pattern, ErrorKind.VALIDATION_FAILED, "Empty search pattern",
                                      List.of("Give a name or a glob pattern such as 'get_*'"));
        }
        var lock = state.lock().readLock();
        lock.lock();
        try {
            var outcome = state.resolver().find(pattern, state.config().findLimit());
            if (outcome.totalCount() > outcome.matches().size()) {
                logger.debug("find {}: returning {} of {} matches", pattern, outcome.matches().size(), outcome.totalCount());
            }
            return FindResult.success(pattern, outcome.matches(), outcome.totalCount(), outcome.partial());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ShowResult show(ProjectState state, String functionName) {
        var lock = state.lock().readLock();
        lock.lock();
        try {
            var resolver = state.resolver();
            var function = resolveFunction(resolver, functionName);
            var source = resolver.table().source(function.file());
            var definition = requireDefinition(state, source, function);

            var indexer = new AnonymousElementIndexer(state.backend().syntaxProfile());
            var elements = indexer.index(source, definition, functionName.strip()).stream()
                    .map(e -> new ShowResult.ElementInfo(e.id(), e.kind().label(), e.code(), e.location()))
                    .toList();
            state.recordDiscovery(function.qualifiedName(), source.fingerprint(SourceFile.range(definition)));
            logger.debug("show {}: {} elements", function.qualifiedName(), elements.size());
            return ShowResult.success(functionName, function.qualifiedName(), elements);
        } catch (RefactoringException e) {
            logger.debug("show {} failed: {}", functionName, e.getMessage());
            return ShowResult.failure(functionName, e);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- mutations

    @Override
    public RenameResult rename(ProjectState state, String oldName, String newName) {
        var tracker = new MutationPhase.Tracker("rename " + oldName + " -> " + newName);
        var lock = state.lock().writeLock();
        lock.lock();
        try {
            tracker.advance(MutationPhase.RESOLVING);
            requireIdentifier(state, newName);
            var resolver = state.resolver();
            var table = resolver.table();
            var symbol = resolve(resolver, oldName);
            if (symbol.name().equals(newName)) {
                throw new RefactoringException(ErrorKind.VALIDATION_FAILED,
                                               symbol.qualifiedName() + " is already named '" + newName + "'",
                                               "Choose a name different from the current one");
            }

            tracker.advance(MutationPhase.CONFLICT_CHECK);
            var conflicts = new ConflictDetector(state.backend(), table).check(symbol, newName);
            if (!conflicts.isEmpty()) {
                logger.debug("rename {} -> {} blocked by {} conflicts", symbol.qualifiedName(), newName, conflicts.size());
                var suggestions = new ArrayList<String>();
                suggestions.add("Choose a name that is not already visible where " + symbol.name() + " is used");
                conflicts.stream()
                        .map(Conflict::location)
                        .filter(l -> l != null)
                        .distinct()
                        .forEach(l -> suggestions.add("See the existing definition at " + l));
                return RenameResult.conflicts(oldName, newName, symbol.qualifiedName(),
                                              conflicts.stream().map(Conflict::description).toList(), suggestions);
            }

            tracker.advance(MutationPhase.PLANNING);
            var changes = new ChangePlanner(state.backend(), table).planRename(symbol, newName);
            var committed = commit(state, tracker, changes);
            return RenameResult.success(oldName, newName, symbol.qualifiedName(), committed.files(),
                                        changes.editCount(), committed.backup().id());
        } catch (RefactoringException e) {
            logger.debug("rename {} -> {} failed in {}: {}", oldName, newName, tracker.phase(), e.getMessage());
            return RenameResult.failure(oldName, newName, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ExtractResult extract(ProjectState state, ExtractSource source, String newName) {
        var label = source.toString();
        var tracker = new MutationPhase.Tracker("extract " + label + " -> " + newName);
        var lock = state.lock().writeLock();
        lock.lock();
        try {
            tracker.advance(MutationPhase.RESOLVING);
            requireIdentifier(state, newName);
            var resolver = state.resolver();
            var table = resolver.table();
            var function = resolveFunction(resolver, source.function());
            var planner = new ChangePlanner(state.backend(), table);
            var target = target(state, table, planner, function, source);

            tracker.advance(MutationPhase.CONFLICT_CHECK);
            planner.checkExtractionName(target, newName);

            tracker.advance(MutationPhase.PLANNING);
            var plan = planner.planExtract(target, newName);
            var committed = commit(state, tracker, plan.changes());
            return ExtractResult.success(label, newName, plan.definition(), plan.parameters(), plan.returns(),
                                         committed.files(), committed.backup().id());
        } catch (RefactoringException e) {
            logger.debug("extract {} failed in {}: {}", label, tracker.phase(), e.getMessage());
            return ExtractResult.failure(label, newName, e);
        } finally {
            lock.unlock();
        }
    }

    private ExtractionTarget target(ProjectState state, SymbolTable table, ChangePlanner planner, Symbol function,
                                    ExtractSource source) throws RefactoringException {
        var file = table.source(function.file());
        var definition = requireDefinition(state, file, function);

        if (source instanceof ExtractSource.ElementId id) {
            var current = file.fingerprint(SourceFile.range(definition));
            var recorded = state.discovery(function.qualifiedName());
            if (recorded.isPresent() && !recorded.get().equals(current)) {
                throw stale(id.toString(), function);
            }
            var indexer = new AnonymousElementIndexer(state.backend().syntaxProfile());
            var element = indexer.index(file, definition, id.function().strip()).stream()
                    .filter(e -> e.kind() == id.kind() && e.ordinal() == id.ordinal())
                    .findFirst()
                    .orElseThrow(() -> stale(id.toString(), function));
            return planner.targetFor(function, element);
        }
        if (source instanceof ExtractSource.LineRange lines) {
            int first = file.line(definition.getStartByte());
            int last = file.line(definition.getEndByte());
            if (lines.startLine() <= first || lines.endLine() > last) {
                throw new RefactoringException(ErrorKind.EXTRACTION_SHAPE_ERROR,
                                               "Lines " + lines.startLine() + "-" + lines.endLine() + " are not inside the body of "
                                               + function.qualifiedName() + " (lines " + first + "-" + last + ")",
                                               "Give lines between " + (first + 1) + " and " + last);
            }
            var range = new ByteRange(file.lineStart(lines.startLine()), file.lineEnd(lines.endLine()));
            return planner.targetFor(function, range);
        }
        var span = (ExtractSource.ByteSpan) source;
        return planner.targetFor(function, span.range());
    }

    private static RefactoringException stale(String id, Symbol function) {
        return new RefactoringException(ErrorKind.IDENTIFIER_STALE,
                                        "'" + id + "' does not identify an element of the current "
                                        + function.qualifiedName(),
                                        "Run show " + function.name() + " again to get current element ids");
    }

    /**
     * Backs up, applies and invalidates. The caller holds the write lock and is in the planning phase.
     */
    private Committed commit(ProjectState state, MutationPhase.Tracker tracker, ChangeSet changes)
            throws RefactoringException {
        state.transactions().preflight(changes);

        tracker.advance(MutationPhase.BACKING_UP);
        Backup backup;
        try {
            backup = state.backups().create(changes.files());
        } catch (IOException e) {
            throw new RefactoringException(ErrorKind.APPLY_ERROR, "Could not back up the files to change: " + e.getMessage(),
                                           List.of("No file was changed; check that " + state.backups().backupDir()
                                                   + " is writable"), e);
        }

        tracker.advance(MutationPhase.APPLYING);
        List<ProjectFile> written;
        try {
            written = state.transactions().apply(changes, backup);
        } catch (RefactoringException e) {
            tracker.advance(MutationPhase.ROLLED_BACK);
            state.invalidate(changes.files());
            throw e;
        }
        tracker.advance(MutationPhase.COMMITTED);
        state.invalidate(written);
        return new Committed(backup, written.stream().map(ProjectFile::toString).toList());
    }

    @Override
    public BackupResult restore(ProjectState state, String backupId) {
        var lock = state.lock().writeLock();
        lock.lock();
        try {
            var restored = state.backups().restore(backupId);
            state.invalidate(restored);
            return BackupResult.restored(backupId, restored.stream().map(ProjectFile::toString).toList());
        } catch (RefactoringException e) {
            return BackupResult.failure(backupId, e);
        } catch (IOException e) {
            logger.warn("Restoring backup {} failed: {}", backupId, e.getMessage());
            state.invalidateAll();
            return BackupResult.failure(backupId, ErrorKind.APPLY_ERROR,
                                        "Could not restore backup " + backupId + ": " + e.getMessage(),
                                        List.of("Fix the I/O problem and restore the backup again"));
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- helpers

    private static Symbol resolve(SymbolResolver resolver, String name) throws RefactoringException {
        var resolution = resolver.resolve(name);
        if (resolution instanceof Resolution.Resolved resolved) {
            return resolved.symbol();
        }
        if (resolution instanceof Resolution.Ambiguous ambiguous) {
            throw new RefactoringException(ErrorKind.AMBIGUOUS_SYMBOL,
                                           "'" + name + "' matches " + ambiguous.candidates().size() + " symbols: "
                                           + String.join(", ", ambiguous.candidates()),
                                           ambiguous.candidates().stream().map(c -> "Use the qualified name " + c).toList());
        }
        var notFound = (Resolution.NotFound) resolution;
        var suggestions = new ArrayList<String>();
        notFound.suggestions().forEach(s -> suggestions.add("Did you mean " + s + "?"));
        var table = resolver.table();
        table.warnings().keySet().stream()
                .sorted()
                .forEach(f -> suggestions.add(f + " was left out of the analysis: " + table.warnings().get(f)));
        suggestions.add("Run find with a pattern such as '*" + notFound.name() + "*' to search the project");
        throw new RefactoringException(ErrorKind.SYMBOL_NOT_FOUND, "No symbol named '" + name + "'", suggestions);
    }

    private static Symbol resolveFunction(SymbolResolver resolver, String name) throws RefactoringException {
        var symbol = resolve(resolver, name);
        if (!symbol.kind().isCallable()) {
            throw new RefactoringException(ErrorKind.VALIDATION_FAILED,
                                           symbol.qualifiedName() + " is a " + symbol.kind().label() + ", not a function",
                                           "Name a function or method; find lists the functions of the project");
        }
        return symbol;
    }

    private static void requireIdentifier(ProjectState state, String newName) throws RefactoringException {
        if (!state.backend().isValidIdentifier(newName)) {
            throw new RefactoringException(ErrorKind.VALIDATION_FAILED,
                                           "'" + newName + "' is not a valid " + state.language().name() + " identifier",
                                           "Use letters, digits and underscores, not starting with a digit, and not a keyword");
        }
    }

    private static @Nullable TSNode definitionNode(ProjectState state, SourceFile source, Symbol symbol) {
        var profile = state.backend().syntaxProfile();
        if (symbol.kind() == SymbolKind.CLASS) {
            return SyntaxNodes.findByRange(source.root(), symbol.definitionRange(), profile.classLikeNodeTypes());
        }
        if (symbol.kind().isCallable()) {
            return SyntaxNodes.findByRange(source.root(), symbol.definitionRange(), profile.functionLikeNodeTypes());
        }
        return null;
    }

    private static TSNode requireDefinition(ProjectState state, SourceFile source, Symbol function)
            throws RefactoringException {
        var node = definitionNode(state, source, function);
        if (node == null) {
            throw new RefactoringException(ErrorKind.OPERATION_FAILED,
                                           "Cannot locate the definition of " + function.qualifiedName() + " in " + source.file(),
                                           "Report the file changed to refresh the project index, then retry");
        }
        return node;
    }
}
