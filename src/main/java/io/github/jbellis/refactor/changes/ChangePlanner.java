package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.AnonymousElementIndexer;
import io.github.jbellis.refactor.analyzer.AnonymousElementIndexer.AnonymousElement;
import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.LanguageBackend;
import io.github.jbellis.refactor.analyzer.LanguageSyntaxProfile;
import io.github.jbellis.refactor.analyzer.Occurrence;
import io.github.jbellis.refactor.analyzer.ParseException;
import io.github.jbellis.refactor.analyzer.SourceFile;
import io.github.jbellis.refactor.analyzer.Symbol;
import io.github.jbellis.refactor.analyzer.SymbolTable;
import io.github.jbellis.refactor.analyzer.SyntaxNodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.github.jbellis.refactor.analyzer.SyntaxNodes.field;
import static io.github.jbellis.refactor.analyzer.SyntaxNodes.namedChildren;

/**
 * Turns a rename or an extraction into a {@link ChangeSet}. Nothing is written here; every plan is
 * applied in memory and re-parsed before it is returned.
 */
public final class ChangePlanner {
    private static final Logger logger = LogManager.getLogger(ChangePlanner.class);

    private static final String INDENT = "    ";

    private static final Set<String> EXPRESSION_TYPES = Set.of(
            "attribute", "subscript", "parenthesized_expression", "unary_operator", "list", "tuple", "set",
            "dictionary", "string", "concatenated_string", "list_comprehension", "set_comprehension",
            "dictionary_comprehension", "generator_expression", "integer", "float", "identifier", "await");

    private final LanguageBackend backend;
    private final LanguageSyntaxProfile profile;
    private final SymbolTable table;
    private final AnonymousElementIndexer indexer;

    public ChangePlanner(LanguageBackend backend, SymbolTable table) {
        this.backend = backend;
        this.profile = backend.syntaxProfile();
        this.table = table;
        this.indexer = new AnonymousElementIndexer(profile);
    }

    // ---------------------------------------------------------------- rename

    /**
     * One edit per renamed reference of the symbol. References made through a local alias keep the alias.
     */
    public ChangeSet planRename(Symbol symbol, String newName) throws RefactoringException {
        var builder = ChangeSet.builder();
        for (var reference : table.references(symbol.qualifiedName())) {
            if (!reference.kind().renamed()) {
                continue;
            }
            var source = table.source(reference.file());
            var token = source.text(reference.range());
            if (!token.equals(symbol.name())) {
                // resolution and text disagree; refuse rather than corrupt the file
                throw new RefactoringException(ErrorKind.OPERATION_FAILED,
                                               "Reference at " + reference.location() + " reads '" + token
                                               + "', expected '" + symbol.name() + "'",
                                               "Refresh the project index and retry the rename");
            }
            builder.add(new Edit(reference.file(), reference.range(), newName), source.content());
        }
        var changes = builder.build();
        verify(changes, ErrorKind.OPERATION_FAILED);
        logger.debug("Planned rename {} -> {}: {}", symbol.qualifiedName(), newName, changes);
        return changes;
    }

    // ---------------------------------------------------------------- extraction targets

    public ExtractionTarget targetFor(Symbol function, AnonymousElement element) {
        var source = table.source(function.file());
        var kind = switch (element.kind()) {
            case LAMBDA -> ExtractionTarget.Kind.LAMBDA;
            case EXPRESSION -> ExtractionTarget.Kind.EXPRESSION;
            case BLOCK -> ExtractionTarget.Kind.STATEMENTS;
        };
        return new ExtractionTarget(kind, source, function, element.range());
    }

    /**
     * Classifies an arbitrary byte range of a function as a lambda, an expression or a run of whole
     * statements of one block.
     */
    public ExtractionTarget targetFor(Symbol function, ByteRange requested) throws RefactoringException {
        var source = table.source(function.file());
        var body = functionBody(source, function);
        var range = trimWhitespace(source, requested);
        if (range.isEmpty() || !SourceFile.range(body).contains(range)) {
            throw shapeError("The selected range is empty or not inside the body of " + function.qualifiedName());
        }

        for (var node : SyntaxNodes.exactNodes(source.root(), range)) {
            var type = node.getType();
            if (profile.lambdaNodeTypes().contains(type)) {
                return new ExtractionTarget(ExtractionTarget.Kind.LAMBDA, source, function, range);
            }
            var parent = SyntaxNodes.parent(node);
            if (parent != null && parent.getType().equals("block")) {
                return statementsTarget(source, function, parent, range);
            }
            if (profile.operationNodeTypes().contains(type) || EXPRESSION_TYPES.contains(type)) {
                var fieldName = SyntaxNodes.fieldName(node);
                if (parent != null && parent.getType().endsWith("assignment") && "left".equals(fieldName)) {
                    throw shapeError("The selected expression is an assignment target");
                }
                if (indexer.containsFlowEscape(node)) {
                    throw shapeError("The selected expression contains yield or await");
                }
                return new ExtractionTarget(ExtractionTarget.Kind.EXPRESSION, source, function, range);
            }
        }

        var covering = SyntaxNodes.smallestCovering(source.root(), range);
        var block = covering.getType().equals("block") ? covering : null;
        if (block == null) {
            throw shapeError("The selected range is not a complete expression or statement sequence");
        }
        return statementsTarget(source, function, block, range);
    }

    private ExtractionTarget statementsTarget(SourceFile source, Symbol function, TSNode block, ByteRange range)
            throws RefactoringException {
        var selected = new ArrayList<TSNode>();
        for (var statement : AnonymousElementIndexer.statements(block)) {
            var statementRange = SourceFile.range(statement);
            if (range.contains(statementRange)) {
                selected.add(statement);
            } else if (range.overlaps(statementRange)) {
                throw shapeError("The selected range cuts through the statement at " + source.location(statement.getStartByte()));
            }
        }
        if (selected.isEmpty() || selected.get(0).getStartByte() != range.start()) {
            throw shapeError("The selected range does not start at a statement");
        }
        int end = selected.get(selected.size() - 1).getEndByte();
        var trailing = source.text(end, range.end());
        if (!trailing.lines().map(String::strip).allMatch(l -> l.isEmpty() || l.startsWith("#"))) {
            throw shapeError("The selected range does not end at a statement boundary");
        }
        for (var statement : selected) {
            if (indexer.containsFlowEscape(statement)) {
                throw shapeError("The statement at " + source.location(statement.getStartByte())
                                 + " returns, yields, breaks, continues or rebinds a global");
            }
        }
        return new ExtractionTarget(ExtractionTarget.Kind.STATEMENTS, source, function,
                                    new ByteRange(range.start(), end));
    }

    private TSNode functionBody(SourceFile source, Symbol function) throws RefactoringException {
        var node = SyntaxNodes.findByRange(source.root(), function.definitionRange(), profile.functionLikeNodeTypes());
        var body = node == null ? null : field(node, profile.bodyFieldName());
        if (body == null) {
            throw new RefactoringException(ErrorKind.VALIDATION_FAILED,
                                           function.qualifiedName() + " is not a function",
                                           "Extract from code inside a function; use find to locate one");
        }
        return body;
    }

    private static ByteRange trimWhitespace(SourceFile source, ByteRange range) {
        var content = source.content();
        int start = Math.min(range.start(), content.length);
        int end = Math.min(range.end(), content.length);
        while (start < end && Character.isWhitespace(content[start])) start++;
        while (end > start && Character.isWhitespace(content[end - 1])) end--;
        return new ByteRange(start, end);
    }

    // ---------------------------------------------------------------- extraction

    /**
     * Plans the extraction of {@code target} into a new module-level function {@code newName}.
     */
    public ExtractionPlan planExtract(ExtractionTarget target, String newName) throws RefactoringException {
        var source = target.source();
        var range = target.range();
        checkExtractionName(target, newName);

        for (var name : table.names(source.file())) {
            if (range.contains(name.range()) && name.kind() == Occurrence.Kind.DECLARATION) {
                throw shapeError("The selected code declares '" + name.name() + "' global or nonlocal");
            }
        }

        checkClassContext(source, range);

        var analysis = FreeVariableAnalysis.analyze(table, source.file(), range);
        if (target.kind() != ExtractionTarget.Kind.STATEMENTS && !analysis.written().isEmpty()) {
            throw shapeError("The selected expression assigns to " + String.join(", ", analysis.written()));
        }

        var generated = switch (target.kind()) {
            case LAMBDA -> generateFromLambda(target, newName, analysis);
            case EXPRESSION -> generateFromExpression(target, newName, analysis);
            case STATEMENTS -> generateFromStatements(target, newName, analysis);
        };

        int insertAt = topLevelStatement(source, range).getStartByte();
        var changes = ChangeSet.builder()
                .add(Edit.insert(source.file(), insertAt, generated.definition() + "\n\n"), source.content())
                .add(new Edit(source.file(), range, generated.replacement()), source.content())
                .build();
        verify(changes, ErrorKind.EXTRACTION_SHAPE_ERROR);

        logger.debug("Planned extraction of {} {} from {} into {}({})", target.kind(), range,
                     target.function().qualifiedName(), newName, String.join(", ", generated.parameters()));
        return new ExtractionPlan(changes, generated.definition().stripTrailing(), generated.parameters(),
                                  target.kind() == ExtractionTarget.Kind.STATEMENTS ? analysis.escaping() : List.of());
    }

    /**
     * Inside a class body, zero-argument {@code super()} relies on the implicit {@code __class__} cell and
     * {@code __private} names are mangled with the class name; neither works from a module-level function.
     */
    private void checkClassContext(SourceFile source, ByteRange range) throws RefactoringException {
        var covering = SyntaxNodes.smallestCovering(source.root(), range);
        if (SyntaxNodes.ancestor(covering, profile.classLikeNodeTypes()) == null) {
            return;
        }
        var problems = new ArrayList<String>();
        SyntaxNodes.preorder(covering, node -> {
            if (!problems.isEmpty() || !range.overlaps(SourceFile.range(node))) {
                return false;
            }
            if (!range.contains(SourceFile.range(node))) {
                return true;
            }
            if (node.getType().equals("call")) {
                var function = field(node, "function");
                var arguments = field(node, "arguments");
                if (function != null && arguments != null && source.text(function).equals("super")
                    && namedChildren(arguments).isEmpty()) {
                    problems.add("calls super() without arguments at " + source.location(node.getStartByte()));
                }
            } else if (node.getType().equals("identifier")) {
                var name = source.text(node);
                if (name.startsWith("__") && !name.endsWith("__")) {
                    problems.add("uses the class-private name " + name + " at " + source.location(node.getStartByte()));
                }
            }
            return problems.isEmpty();
        });
        if (!problems.isEmpty()) {
            throw shapeError("The selected code " + problems.get(0) + " and cannot move out of its class");
        }
    }

    private record Generated(String definition, String replacement, List<String> parameters) {
    }

    private Generated generateFromExpression(ExtractionTarget target, String newName, FreeVariableAnalysis analysis) {
        var expression = target.source().text(target.range());
        var parameters = analysis.captured();
        var definition = "def " + newName + "(" + String.join(", ", parameters) + "):\n"
                         + INDENT + "return " + parenthesizeIfMultiline(expression) + "\n";
        return new Generated(definition, newName + "(" + String.join(", ", parameters) + ")", parameters);
    }

    private Generated generateFromLambda(ExtractionTarget target, String newName, FreeVariableAnalysis analysis)
            throws RefactoringException {
        var source = target.source();
        var lambda = SyntaxNodes.findByRange(source.root(), target.range(), profile.lambdaNodeTypes());
        if (lambda == null) {
            throw shapeError("No lambda at " + source.location(target.range().start()));
        }
        var body = field(lambda, profile.bodyFieldName());
        if (body == null) {
            throw shapeError("The lambda at " + source.location(target.range().start()) + " has no body");
        }
        var parametersNode = field(lambda, profile.parametersFieldName());
        var captured = analysis.captured();

        var parameterNames = new ArrayList<String>();
        var forwarded = new ArrayList<String>();
        boolean keywordOnly = false;
        boolean hasKeywordSplat = false;
        if (parametersNode != null) {
            for (var parameter : namedChildren(parametersNode)) {
                switch (parameter.getType()) {
                    case "identifier" -> {
                        var name = source.text(parameter);
                        parameterNames.add(name);
                        forwarded.add(keywordOnly ? name + "=" + name : name);
                    }
                    case "default_parameter" -> {
                        var nameNode = field(parameter, "name");
                        var name = nameNode == null ? source.text(parameter) : source.text(nameNode);
                        parameterNames.add(name);
                        forwarded.add(keywordOnly ? name + "=" + name : name);
                    }
                    case "list_splat_pattern" -> {
                        var name = source.text(parameter).substring(1).strip();
                        parameterNames.add(name);
                        forwarded.add("*" + name);
                        keywordOnly = true;
                    }
                    case "dictionary_splat_pattern" -> {
                        var name = source.text(parameter).substring(2).strip();
                        parameterNames.add(name);
                        forwarded.add("**" + name);
                        hasKeywordSplat = true;
                    }
                    case "keyword_separator" -> keywordOnly = true;
                    default -> { }
                }
            }
        }
        if (hasKeywordSplat && !captured.isEmpty()) {
            throw shapeError("The lambda takes **kwargs and captures " + String.join(", ", captured)
                             + "; the captured values cannot be passed after **kwargs");
        }

        var parametersText = parametersNode == null ? "" : source.text(parametersNode);
        var definitionParameters = new ArrayList<String>();
        if (!parametersText.isBlank()) {
            definitionParameters.add(parametersText);
        }
        definitionParameters.addAll(captured);

        var definition = "def " + newName + "(" + String.join(", ", definitionParameters) + "):\n"
                         + INDENT + "return " + parenthesizeIfMultiline(source.text(body)) + "\n";

        String replacement;
        if (captured.isEmpty()) {
            replacement = newName;
        } else {
            for (var name : captured) {
                forwarded.add(keywordOnly ? name + "=" + name : name);
            }
            replacement = "lambda" + (parametersText.isBlank() ? "" : " " + parametersText) + ": "
                          + newName + "(" + String.join(", ", forwarded) + ")";
        }

        var parameters = new ArrayList<>(parameterNames);
        parameters.addAll(captured);
        return new Generated(definition, replacement, List.copyOf(parameters));
    }

    private Generated generateFromStatements(ExtractionTarget target, String newName, FreeVariableAnalysis analysis) {
        var source = target.source();
        var range = target.range();
        var indentation = source.indentationAt(range.start());
        var parameters = analysis.captured();
        var returns = analysis.escaping();

        var definition = new StringBuilder("def ").append(newName)
                .append("(").append(String.join(", ", parameters)).append("):\n");
        var lines = source.text(range).split("\n", -1);
        int lineStart = range.start();
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i];
            if (i > 0 && insideString(source, lineStart)) {
                // continuation of a multi-line string literal; its text is part of the value
                definition.append(line).append("\n");
            } else {
                if (i > 0 && line.startsWith(indentation)) {
                    line = line.substring(indentation.length());
                }
                definition.append(line.isBlank() ? "" : INDENT + line).append("\n");
            }
            lineStart += lines[i].getBytes(StandardCharsets.UTF_8).length + 1;
        }
        if (!returns.isEmpty()) {
            definition.append(INDENT).append("return ").append(String.join(", ", returns)).append("\n");
        }

        var call = newName + "(" + String.join(", ", parameters) + ")";
        var replacement = returns.isEmpty() ? call : String.join(", ", returns) + " = " + call;
        return new Generated(definition.toString(), replacement, parameters);
    }

    private static boolean insideString(SourceFile source, int offset) {
        var node = SyntaxNodes.smallestCovering(source.root(), new ByteRange(offset, offset));
        for (TSNode current = node; current != null; current = SyntaxNodes.parent(current)) {
            if (current.getType().equals("string")
                && current.getStartByte() < offset && offset < current.getEndByte()) {
                return true;
            }
        }
        return false;
    }

    private static String parenthesizeIfMultiline(String expression) {
        return expression.contains("\n") ? "(" + expression + ")" : expression;
    }

    /**
     * The module-level statement (a definition, possibly decorated) containing the range.
     */
    private static TSNode topLevelStatement(SourceFile source, ByteRange range) {
        var node = SyntaxNodes.smallestCovering(source.root(), range);
        var parent = SyntaxNodes.parent(node);
        while (parent != null && SyntaxNodes.parent(parent) != null) {
            node = parent;
            parent = SyntaxNodes.parent(node);
        }
        return node;
    }

    /**
     * Fails with {@link ErrorKind#NAMING_CONFLICT} if a module-level function {@code newName} would clash with
     * an existing binding or capture a name that currently resolves elsewhere.
     */
    public void checkExtractionName(ExtractionTarget target, String newName) throws RefactoringException {
        var fileScopes = table.fileScopes(target.source().file());
        if (fileScopes == null) {
            throw new IllegalStateException("No scopes for " + target.source().file());
        }
        @Nullable String clash = null;
        if (backend.isReserved(newName)) {
            clash = "'" + newName + "' is a reserved word or builtin name";
        } else if (fileScopes.moduleScope().binding(newName) != null) {
            clash = "'" + newName + "' is already defined in module " + fileScopes.moduleName();
        } else {
            for (var scope = fileScopes.scopeAt(target.range().start()); scope != null; scope = scope.parent()) {
                if (scope.binding(newName) != null) {
                    clash = "'" + newName + "' is already bound in " + scope.id();
                    break;
                }
            }
        }
        if (clash == null) {
            for (var name : table.names(target.source().file())) {
                if (name.isLoad() && name.name().equals(newName) && name.bindingScope() == null) {
                    clash = "'" + newName + "' is used at " + target.source().location(name.range().start())
                            + " and would refer to the new function";
                    break;
                }
            }
        }
        if (clash != null) {
            throw new RefactoringException(ErrorKind.NAMING_CONFLICT, clash,
                                           List.of("Choose a different name for the extracted function",
                                                   "Run find with the name to see existing definitions"));
        }
    }

    private void verify(ChangeSet changes, ErrorKind failureKind) throws RefactoringException {
        for (var file : changes.files()) {
            try {
                backend.parse(file, changes.result(file));
            } catch (ParseException e) {
                logger.debug("Planned change does not parse: {}", e.getMessage());
                throw new RefactoringException(failureKind,
                                               "The change would leave " + file + " with a syntax error at line " + e.line(),
                                               List.of("Select a complete expression, lambda or statement sequence",
                                                       "Run show on the function to list extractable elements"),
                                               e);
            }
        }
    }

    private static RefactoringException shapeError(String message) {
        return new RefactoringException(ErrorKind.EXTRACTION_SHAPE_ERROR, message,
                                        List.of("Run show on the function to list extractable elements",
                                                "Select a complete expression, lambda or statement sequence"));
    }
}
