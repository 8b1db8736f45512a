package io.github.jbellis.refactor.analyzer;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Second pass over the walked files: links every occurrence to the project symbol it denotes and
 * produces the {@link SymbolTable}.
 * <p>
 * Plain names resolve through the enclosing scopes (a class body is visible only to itself), then
 * the module's star imports. Attribute accesses resolve when the object expression is a module, a class,
 * an instance created by calling a project class, or the {@code self}/{@code cls} parameter of a method.
 * Keyword arguments resolve to the parameter of the called function, or of {@code __init__} when a class
 * is called. Nothing else is inferred: an attribute of an arbitrary variable stays unresolved.
 */
public final class PythonReferenceLinker {
    private static final Logger logger = LogManager.getLogger(PythonReferenceLinker.class);

    private static final int MAX_DEPTH = 16;

    private final Map<ProjectFile, FileScopes> files = new TreeMap<>();
    private final Map<String, FileScopes> modules = new HashMap<>();
    private final Map<String, Symbol> symbols = new TreeMap<>();
    private final Map<String, Scope> scopes = new HashMap<>();
    private final Map<String, Set<Reference>> references = new HashMap<>();
    private final Map<ProjectFile, List<ResolvedName>> names = new HashMap<>();
    private final List<ImportedName> importedNames = new ArrayList<>();

    /** What an expression evaluates to, as far as the linker can tell. */
    private sealed interface Target {
    }

    private record ModuleTarget(String module) implements Target {
    }

    private record SymbolTarget(Symbol symbol) implements Target {
    }

    private record InstanceTarget(Symbol cls) implements Target {
    }

    private record NameTarget(Binding binding, Scope scope) {
    }

    private PythonReferenceLinker(List<FileScopes> walked) {
        for (var fs : walked) {
            files.put(fs.file(), fs);
            modules.putIfAbsent(fs.moduleName(), fs);
            for (var scope : fs.scopes()) {
                scopes.putIfAbsent(scope.id(), scope);
            }
            for (var symbol : fs.symbols()) {
                symbols.putIfAbsent(symbol.qualifiedName(), symbol);
            }
        }
    }

    public static SymbolTable link(List<FileScopes> walked, Map<ProjectFile, String> warnings, boolean partial) {
        var linker = new PythonReferenceLinker(walked);
        for (var fs : linker.files.values()) {
            linker.linkFile(fs);
        }
        ListMultimap<String, Reference> sorted = ArrayListMultimap.create();
        linker.references.forEach((id, refs) -> sorted.putAll(id, refs.stream().sorted().toList()));
        logger.debug("Linked {} files: {} symbols, {} referenced", linker.files.size(), linker.symbols.size(),
                     linker.references.size());
        return new SymbolTable(linker.files, linker.modules, linker.symbols, linker.scopes, sorted, linker.names,
                               linker.importedNames, warnings, partial);
    }

    private void linkFile(FileScopes fs) {
        var resolvedNames = new ArrayList<ResolvedName>();
        for (var o : fs.occurrences()) {
            switch (o.kind()) {
                case DEFINITION -> {
                    var binding = o.scope().binding(o.name());
                    var symbol = binding instanceof Binding.SymbolBinding sb ? sb.symbol() : null;
                    if (symbol != null) {
                        addReference(symbol, fs, o, symbol.nameRange().equals(o.range()) && symbol.file().equals(fs.file())
                                                    ? ReferenceKind.DEFINITION : ReferenceKind.USAGE);
                    }
                    resolvedNames.add(new ResolvedName(o.kind(), o.name(), o.range(), o.scope(),
                                                       symbol == null ? null : symbol.qualifiedName(), o.scope()));
                }
                case LOAD, STORE, DECLARATION -> resolvedNames.add(linkName(fs, o));
                case ATTRIBUTE -> {
                    assert o.context() != null;
                    var symbol = member(evaluate(o.context(), o.scope(), fs, 0), o.name(), 0);
                    if (symbol != null) {
                        addReference(symbol, fs, o, symbol.nameRange().equals(o.range()) && symbol.file().equals(fs.file())
                                                    ? ReferenceKind.DEFINITION : ReferenceKind.USAGE);
                    }
                }
                case KEYWORD -> {
                    assert o.context() != null;
                    var parameter = keywordParameter(evaluate(o.context(), o.scope(), fs, 0), o.name());
                    if (parameter != null) {
                        addReference(parameter, fs, o, ReferenceKind.USAGE);
                    }
                }
                case IMPORT_NAME -> {
                    assert o.importTarget() != null;
                    var symbol = resolveQualified(o.importTarget(), 0);
                    if (symbol != null) {
                        addReference(symbol, fs, o, ReferenceKind.IMPORT);
                    } else if (!modules.containsKey(o.importTarget())) {
                        importedNames.add(new ImportedName(o.name(), o.importTarget(), fs.file(),
                                                           fs.source().line(o.range().start())));
                    }
                }
            }
        }
        names.put(fs.file(), List.copyOf(resolvedNames));
    }

    private ResolvedName linkName(FileScopes fs, Occurrence o) {
        var target = lookup(o.scope(), o.name(), fs);
        if (target == null) {
            return new ResolvedName(o.kind(), o.name(), o.range(), o.scope(), null, null);
        }
        Symbol symbol = null;
        ReferenceKind kind = ReferenceKind.USAGE;
        if (target.binding() instanceof Binding.SymbolBinding sb) {
            symbol = sb.symbol();
            if (symbol.nameRange().equals(o.range()) && symbol.file().equals(fs.file())) {
                kind = ReferenceKind.DEFINITION;
            }
        } else if (target.binding() instanceof Binding.ImportBinding ib && !ib.moduleImport()) {
            symbol = resolveQualified(ib.target(), 0);
            if (symbol != null && !ib.localName().equals(symbol.name())) {
                kind = ReferenceKind.ALIASED_USAGE;
            }
        }
        if (symbol != null) {
            addReference(symbol, fs, o, kind);
        }
        return new ResolvedName(o.kind(), o.name(), o.range(), o.scope(),
                                symbol == null ? null : symbol.qualifiedName(), target.scope());
    }

    private void addReference(Symbol symbol, FileScopes fs, Occurrence o, ReferenceKind kind) {
        var reference = new Reference(symbol.qualifiedName(), fs.file(), o.range(),
                                      fs.source().line(o.range().start()), kind, o.scope().id());
        var refs = references.computeIfAbsent(symbol.qualifiedName(), k -> new HashSet<>());
        // the same token can be reached twice, e.g. a parameter's definition seen through a rebinding
        if (refs.stream().noneMatch(r -> r.file().equals(reference.file()) && r.range().equals(reference.range()))) {
            refs.add(reference);
        }
    }

    // ---------------------------------------------------------------- names

    private @Nullable NameTarget lookup(Scope scope, String name, FileScopes fs) {
        for (var current = scope; current != null; current = current.parent()) {
            boolean visible = current == scope || current.kind() != ScopeKind.CLASS;
            if (!visible) {
                continue;
            }
            if (current.globals().contains(name)) {
                return moduleLookup(current.module(), name, 0);
            }
            if (current.nonlocals().contains(name)) {
                continue;
            }
            var binding = current.binding(name);
            if (binding != null) {
                return new NameTarget(binding, current);
            }
        }
        return starImportLookup(fs.moduleScope(), name, 0);
    }

    private @Nullable NameTarget moduleLookup(Scope module, String name, int depth) {
        var binding = module.binding(name);
        if (binding != null) {
            return new NameTarget(binding, module);
        }
        return starImportLookup(module, name, depth);
    }

    private @Nullable NameTarget starImportLookup(Scope module, String name, int depth) {
        if (depth > MAX_DEPTH || name.startsWith("_")) {
            return null;
        }
        for (var base : module.wildcardImports()) {
            var imported = modules.get(base);
            if (imported != null) {
                var found = moduleLookup(imported.moduleScope(), name, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * Resolves a dotted name such as {@code pkg.mod.Class.method} to a project symbol, following
     * re-exports through imports.
     */
    private @Nullable Symbol resolveQualified(String qualifiedName, int depth) {
        var direct = symbols.get(qualifiedName);
        if (direct != null) {
            return direct;
        }
        if (depth > MAX_DEPTH) {
            return null;
        }
        var parts = qualifiedName.split("\\.");
        for (int i = parts.length - 1; i >= 1; i--) {
            var fs = modules.get(String.join(".", List.of(parts).subList(0, i)));
            if (fs == null) {
                continue;
            }
            var target = moduleLookup(fs.moduleScope(), parts[i], depth + 1);
            var symbol = target == null ? null : bindingSymbol(target.binding(), depth + 1);
            for (int j = i + 1; j < parts.length && symbol != null; j++) {
                symbol = symbol.kind() == SymbolKind.CLASS ? classMember(symbol, parts[j], depth + 1) : null;
            }
            return symbol;
        }
        return null;
    }

    private @Nullable Symbol bindingSymbol(Binding binding, int depth) {
        if (binding instanceof Binding.SymbolBinding sb) {
            return sb.symbol();
        }
        var ib = (Binding.ImportBinding) binding;
        return ib.moduleImport() ? null : resolveQualified(ib.target(), depth);
    }

    // ---------------------------------------------------------------- expressions

    private @Nullable Target evaluate(TSNode expression, Scope scope, FileScopes fs, int depth) {
        if (depth > MAX_DEPTH) {
            return null;
        }
        var source = fs.source();
        switch (expression.getType()) {
            case "identifier" -> {
                String name = source.text(expression);
                var target = lookup(scope, name, fs);
                if (target == null) {
                    return null;
                }
                if (target.binding() instanceof Binding.SymbolBinding sb) {
                    var symbol = sb.symbol();
                    var owner = target.scope().ownerClass();
                    if (symbol.kind() == SymbolKind.PARAMETER && owner != null && name.equals(target.scope().selfName())) {
                        var cls = symbols.get(owner.id());
                        return cls == null ? null : new InstanceTarget(cls);
                    }
                    return new SymbolTarget(symbol);
                }
                return importTarget((Binding.ImportBinding) target.binding(), depth);
            }
            case "attribute" -> {
                var object = SyntaxNodes.field(expression, "object");
                var attribute = SyntaxNodes.field(expression, "attribute");
                if (object == null || attribute == null) {
                    return null;
                }
                var base = evaluate(object, scope, fs, depth + 1);
                String name = source.text(attribute);
                if (base instanceof ModuleTarget m && isModuleOrPackage(m.module() + "." + name)) {
                    return new ModuleTarget(m.module() + "." + name);
                }
                var symbol = member(base, name, depth + 1);
                return symbol == null ? null : new SymbolTarget(symbol);
            }
            case "call" -> {
                var function = SyntaxNodes.field(expression, "function");
                var callee = function == null ? null : evaluate(function, scope, fs, depth + 1);
                if (callee instanceof SymbolTarget st && st.symbol().kind() == SymbolKind.CLASS) {
                    return new InstanceTarget(st.symbol());
                }
                return null;
            }
            case "parenthesized_expression" -> {
                var inner = expression.getNamedChildCount() == 1 ? expression.getNamedChild(0) : null;
                return inner == null ? null : evaluate(inner, scope, fs, depth + 1);
            }
            default -> {
                return null;
            }
        }
    }

    private @Nullable Target importTarget(Binding.ImportBinding binding, int depth) {
        if (isModuleOrPackage(binding.target())) {
            return new ModuleTarget(binding.target());
        }
        var symbol = resolveQualified(binding.target(), depth + 1);
        return symbol == null ? null : new SymbolTarget(symbol);
    }

    private boolean isModuleOrPackage(String name) {
        if (modules.containsKey(name)) {
            return true;
        }
        var prefix = name + ".";
        return modules.keySet().stream().anyMatch(m -> m.startsWith(prefix));
    }

    private @Nullable Symbol member(@Nullable Target target, String name, int depth) {
        if (target instanceof ModuleTarget m) {
            var fs = modules.get(m.module());
            if (fs == null) {
                return null;
            }
            var found = moduleLookup(fs.moduleScope(), name, depth + 1);
            return found == null ? null : bindingSymbol(found.binding(), depth + 1);
        }
        if (target instanceof SymbolTarget st && st.symbol().kind() == SymbolKind.CLASS) {
            return classMember(st.symbol(), name, depth + 1);
        }
        if (target instanceof InstanceTarget it) {
            return classMember(it.cls(), name, depth + 1);
        }
        return null;
    }

    /**
     * A member of a class or, failing that, of its project base classes in declaration order.
     */
    private @Nullable Symbol classMember(Symbol cls, String name, int depth) {
        if (depth > MAX_DEPTH) {
            return null;
        }
        var classScope = scopes.get(cls.qualifiedName());
        if (classScope == null || classScope.kind() != ScopeKind.CLASS) {
            return null;
        }
        if (classScope.binding(name) instanceof Binding.SymbolBinding sb) {
            return sb.symbol();
        }
        var attribute = classScope.attributes().get(name);
        if (attribute != null) {
            return attribute;
        }
        var fs = files.get(classScope.file());
        var outer = classScope.parent();
        if (fs == null || outer == null) {
            return null;
        }
        for (var superclass : classScope.superclasses()) {
            if (evaluate(superclass, outer, fs, depth + 1) instanceof SymbolTarget st
                && st.symbol().kind() == SymbolKind.CLASS) {
                var inherited = classMember(st.symbol(), name, depth + 1);
                if (inherited != null) {
                    return inherited;
                }
            }
        }
        return null;
    }

    private @Nullable Symbol keywordParameter(@Nullable Target callee, String name) {
        Symbol function = null;
        if (callee instanceof SymbolTarget st) {
            if (st.symbol().kind().isCallable()) {
                function = st.symbol();
            } else if (st.symbol().kind() == SymbolKind.CLASS) {
                function = classMember(st.symbol(), "__init__", 0);
            }
        }
        if (function == null) {
            return null;
        }
        var parameter = symbols.get(function.qualifiedName() + "." + name);
        return parameter != null && parameter.kind() == SymbolKind.PARAMETER ? parameter : null;
    }
}
