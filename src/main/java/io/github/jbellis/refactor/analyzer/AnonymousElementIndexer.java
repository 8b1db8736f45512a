package io.github.jbellis.refactor.analyzer;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

import static io.github.jbellis.refactor.analyzer.SyntaxNodes.field;
import static io.github.jbellis.refactor.analyzer.SyntaxNodes.namedChildren;
import static io.github.jbellis.refactor.analyzer.SyntaxNodes.parent;

/**
 * Gives unnamed constructs of a function (lambdas, complex expressions and statement blocks) ids of the
 * form {@code <scope>.<kind>_<n>}, numbered per kind in document order. The ids describe one version of
 * the source; nothing is cached between calls.
 */
public final class AnonymousElementIndexer {

    public enum ElementKind {
        LAMBDA,
        EXPRESSION,
        BLOCK;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static ElementKind fromLabel(String label) {
            return valueOf(label.toUpperCase(Locale.ROOT));
        }
    }

    /**
     * @param id    {@code <scope>.<kind>_<ordinal>}
     * @param range the bytes of the element; for a block, from its first statement to the end of its last
     */
    public record AnonymousElement(String id, ElementKind kind, int ordinal, ProjectFile file, ByteRange range,
                                   int line, String code) {
        public String location() {
            return file + ":" + line;
        }
    }

    private static final int MIN_OPERATIONS = 2;
    private static final int MIN_BLOCK_STATEMENTS = 2;

    private final LanguageSyntaxProfile profile;

    public AnonymousElementIndexer(LanguageSyntaxProfile profile) {
        this.profile = profile;
    }

    /**
     * Indexes the elements owned by a definition node (or the module root).
     *
     * @param scopeName prefix for the ids, normally the name the caller used for the scope
     */
    public List<AnonymousElement> index(SourceFile source, TSNode scopeNode, String scopeName) {
        var container = container(scopeNode);
        var result = new ArrayList<AnonymousElement>();
        addAll(result, source, scopeName, ElementKind.LAMBDA,
               ownedNodes(container, profile, n -> profile.lambdaNodeTypes().contains(n.getType())));
        addAll(result, source, scopeName, ElementKind.EXPRESSION,
               ownedNodes(container, profile, n -> isExtractableExpression(n, container)));
        addAll(result, source, scopeName, ElementKind.BLOCK,
               ownedNodes(container, profile, n -> isExtractableBlock(n, container)));
        result.sort(Comparator.comparing(AnonymousElement::range).thenComparing(AnonymousElement::kind));
        return result;
    }

    private void addAll(List<AnonymousElement> result, SourceFile source, String scopeName, ElementKind kind,
                        List<TSNode> nodes) {
        int ordinal = 0;
        for (var node : nodes) {
            ordinal++;
            var range = kind == ElementKind.BLOCK ? blockStatementsRange(node) : SourceFile.range(node);
            result.add(new AnonymousElement(scopeName + "." + kind.label() + "_" + ordinal, kind, ordinal,
                                            source.file(), range, source.line(range.start()), source.text(range)));
        }
    }

    /**
     * The node whose descendants belong to the scope: a definition's body, or the module itself.
     */
    public TSNode container(TSNode scopeNode) {
        if (profile.isDefinition(scopeNode.getType())) {
            var body = field(scopeNode, profile.bodyFieldName());
            if (body != null) {
                return body;
            }
        }
        return scopeNode;
    }

    /**
     * Nodes under {@code container} matching the predicate, in pre-order, that belong to the container's
     * own scope. Nested definitions are not entered, except for a function's parameter list, since default
     * values are evaluated in the enclosing scope.
     */
    public static List<TSNode> ownedNodes(TSNode container, LanguageSyntaxProfile profile, Predicate<TSNode> match) {
        var result = new ArrayList<TSNode>();
        collectOwned(container, profile, match, result);
        return result;
    }

    private static void collectOwned(TSNode node, LanguageSyntaxProfile profile, Predicate<TSNode> match,
                                     List<TSNode> result) {
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            var type = child.getType();
            if (profile.functionLikeNodeTypes().contains(type)) {
                var parameters = field(child, profile.parametersFieldName());
                if (parameters != null) {
                    collectOwned(parameters, profile, match, result);
                }
                continue;
            }
            if (profile.classLikeNodeTypes().contains(type)) {
                continue;
            }
            if (match.test(child)) {
                result.add(child);
            }
            collectOwned(child, profile, match, result);
        }
    }

    /**
     * An operation-kind expression in the scope's own code that no enclosing expression of the same kinds
     * contains, that is neither an assignment target nor part of a decorator, and that holds at least two
     * operations.
     */
    public boolean isExtractableExpression(TSNode node, TSNode container) {
        if (!profile.operationNodeTypes().contains(node.getType())) {
            return false;
        }
        var current = node;
        for (var up = parent(node); up != null && !SyntaxNodes.same(up, container); up = parent(up)) {
            var type = up.getType();
            if (type.equals("block")) {
                break;
            }
            if (profile.operationNodeTypes().contains(type)
                || profile.lambdaNodeTypes().contains(type)
                || profile.isDefinition(type)
                || type.equals("decorator")) {
                return false;
            }
            if (type.endsWith("assignment") && "left".equals(SyntaxNodes.fieldName(current))) {
                return false;
            }
            current = up;
        }
        if (containsAny(node, List.of("yield", "await", "named_expression"))) {
            return false;
        }
        return countOperations(node) >= MIN_OPERATIONS;
    }

    private int countOperations(TSNode node) {
        int[] count = {0};
        SyntaxNodes.preorder(node, n -> {
            if (profile.operationNodeTypes().contains(n.getType())) {
                count[0]++;
            }
            return true;
        });
        return count[0];
    }

    /**
     * The body of a compound statement or clause, with at least two statements and nothing that would
     * change control flow or name binding if moved into a function.
     */
    public boolean isExtractableBlock(TSNode node, TSNode container) {
        if (!node.getType().equals("block") || SyntaxNodes.same(node, container)) {
            return false;
        }
        var owner = parent(node);
        if (owner == null || !profile.blockOwnerNodeTypes().contains(owner.getType())) {
            return false;
        }
        if (statements(node).size() < MIN_BLOCK_STATEMENTS) {
            return false;
        }
        return !containsFlowEscape(node);
    }

    /**
     * True if the subtree holds a flow escape outside nested definitions and lambdas.
     */
    public boolean containsFlowEscape(TSNode node) {
        boolean[] found = {false};
        SyntaxNodes.preorder(node, n -> {
            if (found[0]) {
                return false;
            }
            var type = n.getType();
            if (!SyntaxNodes.same(n, node)
                && (profile.isDefinition(type) || profile.lambdaNodeTypes().contains(type))) {
                return false;
            }
            if (profile.flowEscapeNodeTypes().contains(type)) {
                found[0] = true;
                return false;
            }
            return true;
        });
        return found[0];
    }

    private static boolean containsAny(TSNode node, List<String> types) {
        boolean[] found = {false};
        SyntaxNodes.preorder(node, n -> {
            if (types.contains(n.getType())) {
                found[0] = true;
            }
            return !found[0];
        });
        return found[0];
    }

    /**
     * Statements of a block, without comments.
     */
    public static List<TSNode> statements(TSNode block) {
        return namedChildren(block).stream()
                .filter(n -> !n.getType().equals("comment"))
                .toList();
    }

    private static ByteRange blockStatementsRange(TSNode block) {
        var statements = statements(block);
        if (statements.isEmpty()) {
            return SourceFile.range(block);
        }
        return new ByteRange(statements.get(0).getStartByte(), statements.get(statements.size() - 1).getEndByte());
    }
}
