package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import io.github.jbellis.refactor.analyzer.ResolvedName;
import io.github.jbellis.refactor.analyzer.Scope;
import io.github.jbellis.refactor.analyzer.SourceFile;
import io.github.jbellis.refactor.analyzer.SymbolTable;
import io.github.jbellis.refactor.analyzer.SyntaxNodes;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-before-write analysis of a byte range inside a function.
 * <p>
 * Only names bound in an enclosing function-like scope matter: module globals and builtins stay
 * reachable from a new module-level function, and names bound inside the range travel with the code.
 * A write inside an {@code if}, loop, {@code try} or short-circuiting expression may not happen, so it
 * does not stop a later read from needing the value the name had before the range.
 *
 * @param captured names whose value from before the range may be read in it; these become parameters
 * @param escaping names written in the range and read elsewhere in their scope; these are returned
 * @param written  every enclosing-scope name the range writes
 */
public record FreeVariableAnalysis(List<String> captured, List<String> escaping, List<String> written) {

    private static final Set<String> CONDITIONAL_TYPES = Set.of(
            "if_statement", "elif_clause", "else_clause", "for_statement", "while_statement", "try_statement",
            "except_clause", "except_group_clause", "finally_clause", "match_statement", "case_clause",
            "conditional_expression", "boolean_operator", "list_comprehension", "set_comprehension",
            "dictionary_comprehension", "generator_expression", "lambda");

    public static FreeVariableAnalysis analyze(SymbolTable table, ProjectFile file, ByteRange range) {
        var source = table.source(file);
        var names = table.names(file);
        var captured = new LinkedHashSet<String>();
        var written = new LinkedHashSet<String>();
        var definitelyWritten = new HashSet<String>();
        var writtenScopes = new ArrayList<ResolvedName>();

        // names are in evaluation order, so the right-hand side of an assignment comes before its targets
        for (var name : names) {
            if (!range.contains(name.range())) {
                continue;
            }
            var bindingScope = name.bindingScope();
            if (!isEnclosingFunctionBinding(bindingScope, range)) {
                continue;
            }
            if (name.isWrite()) {
                if (written.add(name.name())) {
                    writtenScopes.add(name);
                }
                if (isUnconditional(source, name.range(), range)) {
                    definitelyWritten.add(name.name());
                }
            } else if (name.isLoad() && !definitelyWritten.contains(name.name())) {
                if (!written.contains(name.name()) || isBoundOutside(names, name, range)) {
                    captured.add(name.name());
                }
            }
        }

        var escaping = new ArrayList<String>();
        for (var write : writtenScopes) {
            boolean readOutside = names.stream().anyMatch(n -> n.isLoad()
                                                               && !range.contains(n.range())
                                                               && n.name().equals(write.name())
                                                               && n.bindingScope() == write.bindingScope());
            if (readOutside) {
                escaping.add(write.name());
            }
        }
        return new FreeVariableAnalysis(List.copyOf(captured), List.copyOf(escaping), List.copyOf(written));
    }

    private static boolean isEnclosingFunctionBinding(@Nullable Scope bindingScope, ByteRange range) {
        return bindingScope != null
               && bindingScope.kind().isFunctionLike()
               && !range.contains(bindingScope.range());
    }

    /**
     * True if the name also has a binding in its scope outside the range, i.e. it may already hold a value
     * when the range starts.
     */
    private static boolean isBoundOutside(List<ResolvedName> names, ResolvedName read, ByteRange range) {
        return names.stream().anyMatch(n -> n.isWrite()
                                            && !range.contains(n.range())
                                            && n.name().equals(read.name())
                                            && n.bindingScope() == read.bindingScope());
    }

    /**
     * True if no construct between the write and the top level of the range can skip it.
     */
    private static boolean isUnconditional(SourceFile source, ByteRange write, ByteRange range) {
        var node = SyntaxNodes.smallestCovering(source.root(), write);
        while (node != null && range.contains(SourceFile.range(node))) {
            if (CONDITIONAL_TYPES.contains(node.getType())) {
                return false;
            }
            node = SyntaxNodes.parent(node);
        }
        return true;
    }
}
