package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.Binding;
import io.github.jbellis.refactor.analyzer.LanguageBackend;
import io.github.jbellis.refactor.analyzer.ReferenceKind;
import io.github.jbellis.refactor.analyzer.Scope;
import io.github.jbellis.refactor.analyzer.ScopeKind;
import io.github.jbellis.refactor.analyzer.Symbol;
import io.github.jbellis.refactor.analyzer.SymbolTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks whether a symbol can take a new name without changing what any name in the project refers to.
 * <p>
 * Every scope that defines or uses the symbol is examined together
 * with its enclosing scopes, and any other binding of the new name there is a conflict, even where
 * Python's shadowing rules would happen to keep the program correct.
 */
public final class ConflictDetector {
    private static final Logger logger = LogManager.getLogger(ConflictDetector.class);

    private final LanguageBackend backend;
    private final SymbolTable table;

    public ConflictDetector(LanguageBackend backend, SymbolTable table) {
        this.backend = backend;
        this.table = table;
    }

    /**
     * Conflicts for renaming {@code symbol} to {@code newName}; empty if the rename is safe.
     */
    public List<Conflict> check(Symbol symbol, String newName) {
        var conflicts = new LinkedHashMap<String, Conflict>();
        if (backend.isReserved(newName)) {
            add(conflicts, new Conflict(newName, null, null,
                                        "'" + newName + "' is a reserved word or builtin name"));
        }

        var definingScope = table.scope(symbol.scope());
        if (definingScope == null) {
            logger.warn("No scope {} for {}", symbol.scope(), symbol.qualifiedName());
            return List.copyOf(conflicts.values());
        }

        if (definingScope.kind() == ScopeKind.CLASS) {
            checkClassMembers(symbol, definingScope, newName, conflicts);
        } else {
            for (var scope : affectedScopes(symbol, definingScope)) {
                checkVisibleBindings(symbol, scope, newName, conflicts);
            }
            checkCaptures(symbol, definingScope, newName, conflicts);
            for (var reference : table.references(symbol.qualifiedName())) {
                var scope = table.scope(reference.scopeId());
                if (reference.kind() == ReferenceKind.IMPORT && scope != null) {
                    checkCaptures(symbol, scope, newName, conflicts);
                }
            }
        }
        if (!conflicts.isEmpty()) {
            logger.debug("Renaming {} to {}: {} conflicts", symbol.qualifiedName(), newName, conflicts.size());
        }
        return List.copyOf(conflicts.values());
    }

    private Set<Scope> affectedScopes(Symbol symbol, Scope definingScope) {
        var scopes = new LinkedHashSet<Scope>();
        scopes.add(definingScope);
        for (var reference : table.references(symbol.qualifiedName())) {
            if (!reference.kind().renamed()) {
                continue;
            }
            var scope = table.scope(reference.scopeId());
            if (scope != null) {
                scopes.add(scope);
            }
        }
        return scopes;
    }

    /**
     * Bindings of {@code newName} in {@code scope} or anywhere a name used there could resolve to.
     */
    private void checkVisibleBindings(Symbol symbol, Scope scope, String newName, Map<String, Conflict> conflicts) {
        for (var current = scope; current != null; current = current.parent()) {
            if (current != scope && current.kind() == ScopeKind.CLASS) {
                continue;
            }
            var binding = current.binding(newName);
            if (binding == null) {
                continue;
            }
            var existing = existingSymbol(binding);
            if (existing != null && existing.qualifiedName().equals(symbol.qualifiedName())) {
                continue;
            }
            if (existing != null) {
                add(conflicts, new Conflict(newName, existing.qualifiedName(), existing.location(),
                                            "'" + newName + "' already refers to " + existing.qualifiedName()
                                            + " (" + existing.kind().label() + " at " + existing.location() + ")"));
            } else {
                var imported = (Binding.ImportBinding) binding;
                add(conflicts, new Conflict(newName, null, current.file().toString(),
                                            "'" + newName + "' is already imported from " + imported.target()
                                            + " in " + current.file()));
            }
        }
    }

    /**
     * Uses of {@code newName} inside {@code scope} that currently resolve past it, and would resolve to
     * the renamed symbol instead.
     */
    private void checkCaptures(Symbol symbol, Scope scope, String newName, Map<String, Conflict> conflicts) {
        var source = table.source(scope.file());
        for (var name : table.names(scope.file())) {
            if (!name.isLoad() || !name.name().equals(newName) || !name.scope().isWithin(scope)) {
                continue;
            }
            if (symbol.qualifiedName().equals(name.symbolId())) {
                continue;
            }
            var bindingScope = name.bindingScope();
            // bound in this scope or below: either reported as a visible binding, or shadowed already
            if (bindingScope != null && bindingScope.isWithin(scope)) {
                continue;
            }
            String location = source.location(name.range().start());
            add(conflicts, new Conflict(newName, name.symbolId(), location,
                                        "'" + newName + "' at " + location + " refers to "
                                        + (name.symbolId() == null ? "a name outside the project" : name.symbolId())
                                        + " and would be captured"));
        }
    }

    private void checkClassMembers(Symbol symbol, Scope classScope, String newName, Map<String, Conflict> conflicts) {
        var existing = new ArrayList<Symbol>();
        var binding = classScope.binding(newName);
        if (binding instanceof Binding.SymbolBinding sb) {
            existing.add(sb.symbol());
        }
        var attribute = classScope.attributes().get(newName);
        if (attribute != null) {
            existing.add(attribute);
        }
        for (var member : existing) {
            if (member.qualifiedName().equals(symbol.qualifiedName())) {
                continue;
            }
            add(conflicts, new Conflict(newName, member.qualifiedName(), member.location(),
                                        "class " + classScope.id() + " already has a member '" + newName + "' ("
                                        + member.kind().label() + " at " + member.location() + ")"));
        }
    }

    private @Nullable Symbol existingSymbol(Binding binding) {
        if (binding instanceof Binding.SymbolBinding sb) {
            return sb.symbol();
        }
        var imported = (Binding.ImportBinding) binding;
        return imported.moduleImport() ? null : table.symbol(imported.target()).orElse(null);
    }

    private static void add(Map<String, Conflict> conflicts, Conflict conflict) {
        conflicts.putIfAbsent(conflict.description(), conflict);
    }
}
