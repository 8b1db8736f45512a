package io.github.jbellis.refactor.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.github.jbellis.refactor.analyzer.SyntaxNodes.field;
import static io.github.jbellis.refactor.analyzer.SyntaxNodes.namedChildren;

/**
 * Walks one Python file and records its scopes, the symbols each scope binds, and every identifier
 * occurrence. Linking occurrences to symbols needs the whole project and happens in
 * {@link PythonReferenceLinker}.
 * <p>
 * Qualified names follow the scope nesting: {@code mod.func}, {@code mod.Class.method},
 * {@code mod.func.local}. Lambdas and comprehensions are numbered in pre-order within the nearest named
 * scope, giving scope names such as {@code mod.func.lambda_2}. Assignments to {@code self.x} inside a
 * method define the attribute {@code mod.Class.x}.
 */
public final class PythonScopeBuilder {
    private static final Logger logger = LogManager.getLogger(PythonScopeBuilder.class);

    private static final Set<String> TARGET_OWNERS = Set.of("assignment", "augmented_assignment",
                                                            "for_statement", "for_in_clause");
    private static final Set<String> ALIAS_OWNERS = Set.of("as_pattern", "except_clause");
    private static final Set<String> TARGET_CONTAINERS = Set.of("pattern_list", "tuple_pattern", "list_pattern",
                                                                "tuple", "list", "parenthesized_expression",
                                                                "list_splat_pattern", "list_splat",
                                                                "as_pattern_target", "expression_list");

    private final SourceFile source;
    private final LanguageSyntaxProfile profile;
    private final String moduleName;
    private final List<Scope> scopes = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private final List<Occurrence> occurrences = new ArrayList<>();
    private final List<PendingAttribute> pendingAttributes = new ArrayList<>();

    private record PendingAttribute(Scope classScope, String name, TSNode nameNode, TSNode statement) {
    }

    private PythonScopeBuilder(SourceFile source, LanguageSyntaxProfile profile) {
        this.source = source;
        this.profile = profile;
        this.moduleName = PythonBackend.moduleName(source.file());
    }

    public static FileScopes build(SourceFile source, LanguageSyntaxProfile profile) {
        return new PythonScopeBuilder(source, profile).run();
    }

    private FileScopes run() {
        var root = source.root();
        var module = newScope(moduleName, ScopeKind.MODULE, null, root);
        numberAnonymous(module, root);
        visitChildren(root, module);
        finishAttributes();
        logger.trace("{}: {} scopes, {} symbols, {} occurrences",
                     source.file(), scopes.size(), symbols.size(), occurrences.size());
        return new FileScopes(source, moduleName, module, List.copyOf(scopes), List.copyOf(symbols),
                              List.copyOf(occurrences));
    }

    private Scope newScope(String id, ScopeKind kind, @Nullable Scope parent, TSNode node) {
        var range = kind == ScopeKind.MODULE ? new ByteRange(0, source.content().length) : SourceFile.range(node);
        var scope = new Scope(id, kind, parent, source.file(), range);
        scopes.add(scope);
        return scope;
    }

    private void numberAnonymous(Scope named, TSNode container) {
        int lambdas = 0;
        int comprehensions = 0;
        var owned = AnonymousElementIndexer.ownedNodes(container, profile, n ->
                profile.lambdaNodeTypes().contains(n.getType()) || profile.comprehensionNodeTypes().contains(n.getType()));
        for (var node : owned) {
            String suffix = profile.lambdaNodeTypes().contains(node.getType())
                            ? "lambda_" + (++lambdas)
                            : "comprehension_" + (++comprehensions);
            named.anonymousIds().put(nodeKey(node), named.id() + "." + suffix);
        }
    }

    private static String nodeKey(TSNode node) {
        return node.getStartByte() + ":" + node.getType();
    }

    // ---------------------------------------------------------------- walking

    private void visit(TSNode node, Scope scope) {
        switch (node.getType()) {
            case "function_definition" -> visitFunction(node, scope, List.of());
            case "class_definition" -> visitClass(node, scope);
            case "decorated_definition" -> visitDecorated(node, scope);
            case "lambda" -> visitLambda(node, scope);
            case "list_comprehension", "set_comprehension", "dictionary_comprehension", "generator_expression" ->
                    visitComprehension(node, scope);
            case "global_statement" -> visitDeclaration(node, scope, true);
            case "nonlocal_statement" -> visitDeclaration(node, scope, false);
            case "import_statement" -> visitImport(node, scope);
            case "import_from_statement" -> visitImportFrom(node, scope);
            case "future_import_statement", "comment" -> { }
            case "attribute" -> visitAttribute(node, scope, false);
            case "keyword_argument" -> visitKeywordArgument(node, scope);
            case "identifier" -> occurrences.add(Occurrence.simple(Occurrence.Kind.LOAD, source.text(node),
                                                                   SourceFile.range(node), scope));
            default -> visitChildren(node, scope);
        }
    }

    private void visitChildren(TSNode node, Scope scope) {
        String type = node.getType();
        int count = node.getChildCount();
        // targets are bound after the value they receive is evaluated
        @Nullable TSNode pendingTarget = null;
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (!child.isNamed()) {
                continue;
            }
            String fieldName = node.getFieldNameForChild(i);
            if ("left".equals(fieldName) && TARGET_OWNERS.contains(type)) {
                if (type.equals("augmented_assignment") && child.getType().equals("identifier")) {
                    occurrences.add(Occurrence.simple(Occurrence.Kind.LOAD, source.text(child),
                                                      SourceFile.range(child), scope));
                }
                pendingTarget = child;
            } else if ("right".equals(fieldName) && pendingTarget != null) {
                visit(child, scope);
                visitTarget(pendingTarget, scope, scope);
                pendingTarget = null;
            } else if ("alias".equals(fieldName) && ALIAS_OWNERS.contains(type)) {
                visitTarget(child, scope, scope);
            } else if ("name".equals(fieldName) && type.equals("named_expression")) {
                visitTarget(child, scope, bindingScopeForWalrus(scope));
            } else {
                visit(child, scope);
            }
        }
        if (pendingTarget != null) {
            visitTarget(pendingTarget, scope, scope);
        }
    }

    private static Scope bindingScopeForWalrus(Scope scope) {
        var current = scope;
        while (current.kind() == ScopeKind.COMPREHENSION && current.parent() != null) {
            current = current.parent();
        }
        return current;
    }

    private void visitTarget(TSNode node, Scope scope, Scope bindScope) {
        String type = node.getType();
        if (type.equals("identifier")) {
            store(node, scope, bindScope);
        } else if (TARGET_CONTAINERS.contains(type)) {
            for (var child : namedChildren(node)) {
                visitTarget(child, scope, bindScope);
            }
        } else if (type.equals("attribute")) {
            visitAttribute(node, scope, true);
        } else {
            visit(node, scope);
        }
    }

    private void store(TSNode nameNode, Scope scope, Scope bindScope) {
        String name = source.text(nameNode);
        var range = SourceFile.range(nameNode);
        @Nullable Scope target = bindScope;
        if (scope.globals().contains(name)) {
            target = scope.module();
        } else if (scope.nonlocals().contains(name)) {
            target = null;
        }
        if (target != null && target.binding(name) == null) {
            var statement = enclosingStatement(nameNode);
            define(target, name, SymbolKind.VARIABLE, nameNode, statement);
        }
        occurrences.add(Occurrence.simple(Occurrence.Kind.STORE, name, range, scope));
    }

    private TSNode enclosingStatement(TSNode node) {
        var current = node;
        var parent = SyntaxNodes.parent(current);
        while (parent != null && !parent.getType().equals("block") && !parent.getType().equals("module")) {
            current = parent;
            parent = SyntaxNodes.parent(current);
        }
        return current;
    }

    private Symbol define(Scope scope, String name, SymbolKind kind, TSNode nameNode, TSNode definitionNode) {
        var symbol = new Symbol(scope.id() + "." + name,
                                name,
                                kind,
                                source.file(),
                                SourceFile.range(nameNode),
                                SourceFile.range(definitionNode),
                                source.line(nameNode.getStartByte()),
                                scope.chain());
        symbols.add(symbol);
        scope.bindings().put(name, new Binding.SymbolBinding(symbol));
        return symbol;
    }

    /**
     * Defines a name, or records a rebinding of an existing one as an ordinary store.
     */
    private String defineOrRebind(Scope scope, TSNode nameNode, SymbolKind kind, TSNode definitionNode) {
        String name = source.text(nameNode);
        var existing = scope.binding(name);
        if (existing instanceof Binding.SymbolBinding sb) {
            occurrences.add(Occurrence.simple(Occurrence.Kind.DEFINITION, name, SourceFile.range(nameNode), scope));
            return sb.symbol().qualifiedName();
        }
        var symbol = define(scope, name, kind, nameNode, definitionNode);
        occurrences.add(Occurrence.simple(Occurrence.Kind.DEFINITION, name, symbol.nameRange(), scope));
        return symbol.qualifiedName();
    }

    private void visitDecorated(TSNode node, Scope scope) {
        var decorators = new ArrayList<String>();
        for (var child : namedChildren(node)) {
            if (child.getType().equals("decorator")) {
                decorators.add(source.text(child).substring(1).strip());
                visitChildren(child, scope);
            }
        }
        var definition = field(node, "definition");
        if (definition == null) {
            return;
        }
        if (definition.getType().equals("function_definition")) {
            visitFunction(definition, scope, decorators);
        } else {
            visit(definition, scope);
        }
    }

    private void visitFunction(TSNode node, Scope scope, List<String> decorators) {
        var nameNode = field(node, profile.identifierFieldName());
        var parameters = field(node, profile.parametersFieldName());
        var returnType = field(node, "return_type");
        var body = field(node, profile.bodyFieldName());
        if (nameNode == null || body == null) {
            logger.debug("Incomplete function definition at {}", source.location(node.getStartByte()));
            visitChildren(node, scope);
            return;
        }

        var kind = scope.kind() == ScopeKind.CLASS ? SymbolKind.METHOD : SymbolKind.FUNCTION;
        String qualifiedName = defineOrRebind(scope, nameNode, kind, node);

        var functionScope = newScope(qualifiedName, ScopeKind.FUNCTION, scope, node);
        numberAnonymous(functionScope, body);

        if (parameters != null) {
            visitParameters(parameters, scope, functionScope);
            boolean isStatic = decorators.stream().anyMatch(d -> d.equals("staticmethod"));
            if (scope.kind() == ScopeKind.CLASS && !isStatic) {
                var first = firstParameterName(parameters);
                if (first != null) {
                    functionScope.setSelf(first, scope);
                }
            }
        }
        if (returnType != null) {
            visit(returnType, scope);
        }
        visit(body, functionScope);
    }

    private @Nullable String firstParameterName(TSNode parameters) {
        var all = namedChildren(parameters);
        if (all.isEmpty() || all.get(0).getType().contains("splat")) {
            return null;
        }
        var nameNode = parameterName(all.get(0));
        return nameNode == null ? null : source.text(nameNode);
    }

    private static @Nullable TSNode parameterName(TSNode parameter) {
        return switch (parameter.getType()) {
            case "identifier" -> parameter;
            case "default_parameter", "typed_default_parameter" -> {
                var name = field(parameter, "name");
                yield name != null && name.getType().equals("identifier") ? name : null;
            }
            case "typed_parameter" -> {
                var inner = namedChildren(parameter).isEmpty() ? null : parameter.getNamedChild(0);
                yield inner == null ? null : parameterName(inner);
            }
            case "list_splat_pattern", "dictionary_splat_pattern" -> {
                var inner = namedChildren(parameter).isEmpty() ? null : parameter.getNamedChild(0);
                yield inner != null && inner.getType().equals("identifier") ? inner : null;
            }
            default -> null;
        };
    }

    /**
     * Parameters are bound in {@code inner}; default values and annotations are evaluated in {@code outer}.
     */
    private void visitParameters(TSNode parameters, Scope outer, Scope inner) {
        for (var parameter : namedChildren(parameters)) {
            var nameNode = parameterName(parameter);
            if (nameNode != null) {
                defineOrRebind(inner, nameNode, SymbolKind.PARAMETER, parameter);
            }
            var type = field(parameter, "type");
            if (type != null) {
                visit(type, outer);
            }
            var value = field(parameter, "value");
            if (value != null) {
                visit(value, outer);
            }
        }
    }

    private String anonymousId(TSNode node, Scope scope, String kind) {
        var named = scope.namedScope();
        var id = named.anonymousIds().get(nodeKey(node));
        if (id == null) {
            // not reachable through the named scope's body, e.g. a lambda in a class's base list
            id = named.id() + "." + kind + "_" + node.getStartByte();
            logger.debug("Unnumbered {} at {}", kind, source.location(node.getStartByte()));
        }
        return id;
    }

    private void visitLambda(TSNode node, Scope scope) {
        var lambdaScope = newScope(anonymousId(node, scope, "lambda"), ScopeKind.LAMBDA, scope, node);
        var parameters = field(node, profile.parametersFieldName());
        if (parameters != null) {
            visitParameters(parameters, scope, lambdaScope);
        }
        var body = field(node, profile.bodyFieldName());
        if (body != null) {
            visit(body, lambdaScope);
        }
    }

    private void visitComprehension(TSNode node, Scope scope) {
        var comprehensionScope = newScope(anonymousId(node, scope, "comprehension"), ScopeKind.COMPREHENSION, scope, node);
        boolean firstClause = true;
        for (var child : namedChildren(node)) {
            if (!child.getType().equals("for_in_clause")) {
                visit(child, comprehensionScope);
                continue;
            }
            // the outermost iterable is evaluated in the enclosing scope
            int count = child.getChildCount();
            for (int i = 0; i < count; i++) {
                var part = child.getChild(i);
                if (!part.isNamed()) {
                    continue;
                }
                String fieldName = child.getFieldNameForChild(i);
                if ("left".equals(fieldName)) {
                    visitTarget(part, comprehensionScope, comprehensionScope);
                } else {
                    visit(part, firstClause ? scope : comprehensionScope);
                }
            }
            firstClause = false;
        }
    }

    private void visitClass(TSNode node, Scope scope) {
        var nameNode = field(node, profile.identifierFieldName());
        var body = field(node, profile.bodyFieldName());
        if (nameNode == null || body == null) {
            visitChildren(node, scope);
            return;
        }
        String qualifiedName = defineOrRebind(scope, nameNode, SymbolKind.CLASS, node);
        var classScope = newScope(qualifiedName, ScopeKind.CLASS, scope, node);

        var superclasses = field(node, "superclasses");
        if (superclasses != null) {
            for (var argument : namedChildren(superclasses)) {
                if (!argument.getType().equals("keyword_argument")) {
                    classScope.superclasses().add(argument);
                }
            }
            visit(superclasses, scope);
        }
        numberAnonymous(classScope, body);
        visit(body, classScope);
    }

    private void visitDeclaration(TSNode node, Scope scope, boolean global) {
        for (var child : namedChildren(node)) {
            if (!child.getType().equals("identifier")) {
                continue;
            }
            String name = source.text(child);
            if (global) {
                scope.globals().add(name);
            } else {
                scope.nonlocals().add(name);
            }
            occurrences.add(Occurrence.simple(Occurrence.Kind.DECLARATION, name, SourceFile.range(child), scope));
        }
    }

    private void visitAttribute(TSNode node, Scope scope, boolean store) {
        var object = field(node, "object");
        var attribute = field(node, "attribute");
        if (object == null || attribute == null) {
            visitChildren(node, scope);
            return;
        }
        visit(object, scope);
        String name = source.text(attribute);
        occurrences.add(new Occurrence(Occurrence.Kind.ATTRIBUTE, name, SourceFile.range(attribute), scope, object, null));

        if (store && object.getType().equals("identifier")
            && scope.kind() == ScopeKind.FUNCTION && scope.ownerClass() != null
            && source.text(object).equals(scope.selfName())) {
            pendingAttributes.add(new PendingAttribute(scope.ownerClass(), name, attribute, enclosingStatement(node)));
        }
    }

    private void visitKeywordArgument(TSNode node, Scope scope) {
        var name = field(node, "name");
        var value = field(node, "value");
        var argumentList = SyntaxNodes.parent(node);
        var call = argumentList == null ? null : SyntaxNodes.parent(argumentList);
        if (name != null && call != null && call.getType().equals("call")) {
            var function = field(call, "function");
            if (function != null) {
                occurrences.add(new Occurrence(Occurrence.Kind.KEYWORD, source.text(name), SourceFile.range(name),
                                               scope, function, null));
            }
        }
        if (value != null) {
            visit(value, scope);
        }
    }

    // ---------------------------------------------------------------- imports

    private void visitImport(TSNode node, Scope scope) {
        for (var child : namedChildren(node)) {
            if (child.getType().equals("dotted_name")) {
                // import a.b.c binds a
                String dotted = source.text(child);
                String head = dotted.split("\\.", 2)[0];
                bindImport(scope, new Binding.ImportBinding(head, head, true));
            } else if (child.getType().equals("aliased_import")) {
                var name = field(child, "name");
                var alias = field(child, "alias");
                if (name != null && alias != null) {
                    bindImport(scope, new Binding.ImportBinding(source.text(alias), source.text(name), true));
                }
            }
        }
    }

    private void visitImportFrom(TSNode node, Scope scope) {
        var moduleNode = field(node, "module_name");
        if (moduleNode == null) {
            return;
        }
        String base = moduleNode.getType().equals("relative_import")
                      ? resolveRelative(moduleNode)
                      : source.text(moduleNode);

        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (child.getType().equals("wildcard_import")) {
                scope.wildcardImports().add(base);
                continue;
            }
            if (!"name".equals(node.getFieldNameForChild(i))) {
                continue;
            }
            TSNode nameNode;
            String localName;
            if (child.getType().equals("aliased_import")) {
                nameNode = field(child, "name");
                var alias = field(child, "alias");
                if (nameNode == null || alias == null) {
                    continue;
                }
                localName = source.text(alias);
            } else {
                nameNode = child;
                localName = source.text(child);
            }
            String imported = source.text(nameNode);
            String target = base.isEmpty() ? imported : base + "." + imported;
            bindImport(scope, new Binding.ImportBinding(localName, target, false));
            occurrences.add(new Occurrence(Occurrence.Kind.IMPORT_NAME, imported, SourceFile.range(nameNode), scope,
                                           null, target));
        }
    }

    private void bindImport(Scope scope, Binding.ImportBinding binding) {
        var target = scope.globals().contains(binding.localName()) ? scope.module() : scope;
        var existing = target.binding(binding.localName());
        if (existing == null || existing instanceof Binding.ImportBinding) {
            target.bindings().put(binding.localName(), binding);
        }
    }

    private String resolveRelative(TSNode relativeImport) {
        int level = 0;
        String rest = "";
        for (var child : SyntaxNodes.children(relativeImport)) {
            if (child.getType().equals("import_prefix")) {
                level = source.text(child).length();
            } else if (child.getType().equals("dotted_name")) {
                rest = source.text(child);
            }
        }
        var parts = new ArrayList<>(List.of(PythonBackend.packageName(source.file()).split("\\.")));
        parts.removeIf(String::isEmpty);
        for (int i = 1; i < level && !parts.isEmpty(); i++) {
            parts.remove(parts.size() - 1);
        }
        if (!rest.isEmpty()) {
            parts.add(rest);
        }
        return String.join(".", parts);
    }

    // ---------------------------------------------------------------- attributes

    private void finishAttributes() {
        for (var pending : pendingAttributes) {
            var classScope = pending.classScope();
            if (classScope.binding(pending.name()) != null || classScope.attributes().containsKey(pending.name())) {
                continue;
            }
            var symbol = new Symbol(classScope.id() + "." + pending.name(),
                                    pending.name(),
                                    SymbolKind.ATTRIBUTE,
                                    source.file(),
                                    SourceFile.range(pending.nameNode()),
                                    SourceFile.range(pending.statement()),
                                    source.line(pending.nameNode().getStartByte()),
                                    classScope.chain());
            symbols.add(symbol);
            classScope.attributes().put(pending.name(), symbol);
        }
    }
}
