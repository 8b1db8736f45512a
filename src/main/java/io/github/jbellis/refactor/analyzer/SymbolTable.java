package io.github.jbellis.refactor.analyzer;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable index of one project snapshot: every file's scopes, the symbols keyed by qualified name,
 * the references of each symbol, and the resolution of every plain name token.
 * <p>
 * A table is never updated in place. When files change the owner builds a new one.
 */
public final class SymbolTable {
    private final Map<ProjectFile, FileScopes> files;
    private final Map<String, FileScopes> modules;
    private final Map<String, Symbol> symbols;
    private final Map<String, Scope> scopes;
    private final ImmutableListMultimap<String, Reference> references;
    private final Map<ProjectFile, List<ResolvedName>> names;
    private final List<ImportedName> importedNames;
    private final Map<ProjectFile, String> warnings;
    private final boolean partial;

    SymbolTable(Map<ProjectFile, FileScopes> files,
                Map<String, FileScopes> modules,
                Map<String, Symbol> symbols,
                Map<String, Scope> scopes,
                ListMultimap<String, Reference> references,
                Map<ProjectFile, List<ResolvedName>> names,
                List<ImportedName> importedNames,
                Map<ProjectFile, String> warnings,
                boolean partial) {
        this.files = Map.copyOf(files);
        this.modules = Map.copyOf(modules);
        this.symbols = Map.copyOf(symbols);
        this.scopes = Map.copyOf(scopes);
        this.references = ImmutableListMultimap.copyOf(references);
        this.names = Map.copyOf(names);
        this.importedNames = List.copyOf(importedNames);
        this.warnings = Map.copyOf(warnings);
        this.partial = partial;
    }

    public Optional<Symbol> symbol(String qualifiedName) {
        return Optional.ofNullable(symbols.get(qualifiedName));
    }

    public Collection<Symbol> symbols() {
        return symbols.values();
    }

    /**
     * References of a symbol, definition included, ordered by file and position.
     */
    public List<Reference> references(String qualifiedName) {
        return references.get(qualifiedName);
    }

    public @Nullable FileScopes fileScopes(ProjectFile file) {
        return files.get(file);
    }

    public Collection<FileScopes> allFiles() {
        return files.values();
    }

    public @Nullable FileScopes module(String moduleName) {
        return modules.get(moduleName);
    }

    public @Nullable Scope scope(String id) {
        return scopes.get(id);
    }

    public SourceFile source(ProjectFile file) {
        var scopes = files.get(file);
        if (scopes == null) {
            throw new IllegalArgumentException("File is not part of this snapshot: " + file);
        }
        return scopes.source();
    }

    public List<ResolvedName> names(ProjectFile file) {
        return names.getOrDefault(file, List.of());
    }

    public List<ImportedName> importedNames() {
        return importedNames;
    }

    /**
     * Files that could not be read or parsed, with the reason.
     */
    public Map<ProjectFile, String> warnings() {
        return warnings;
    }

    /**
     * True if the scan stopped early, so results may be incomplete.
     */
    public boolean partial() {
        return partial;
    }

    @Override
    public String toString() {
        return "SymbolTable[" + files.size() + " files, " + symbols.size() + " symbols"
               + (partial ? ", partial" : "") + "]";
    }
}
