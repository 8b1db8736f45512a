package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.analyzer.AnonymousElementIndexer;
import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.analyzer.LanguageBackend;
import io.github.jbellis.refactor.analyzer.PythonBackend;
import io.github.jbellis.refactor.analyzer.SourceFile;
import io.github.jbellis.refactor.analyzer.SyntaxNodes;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

public final class PythonRefactoringProvider extends TreeSitterRefactoringProvider {

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    public LanguageBackend newBackend() {
        return new PythonBackend();
    }

    /**
     * A string literal that is the first statement of the body.
     */
    @Override
    protected @Nullable String docstring(SourceFile source, TSNode definition) {
        var body = SyntaxNodes.field(definition, "body");
        if (body == null) {
            return null;
        }
        var statements = AnonymousElementIndexer.statements(body);
        if (statements.isEmpty() || !statements.get(0).getType().equals("expression_statement")) {
            return null;
        }
        var expressions = SyntaxNodes.namedChildren(statements.get(0));
        if (expressions.size() != 1 || !expressions.get(0).getType().equals("string")) {
            return null;
        }
        var text = new StringBuilder();
        for (var part : SyntaxNodes.namedChildren(expressions.get(0))) {
            if (part.getType().equals("string_content")) {
                text.append(source.text(part));
            }
        }
        var docstring = cleanDocstring(text.toString());
        return docstring.isEmpty() ? null : docstring;
    }

    /**
     * Strips the indentation shared by every line after the first, as Python's {@code inspect.cleandoc} does.
     */
    static String cleanDocstring(String raw) {
        var lines = raw.lines().toList();
        if (lines.isEmpty()) {
            return "";
        }
        int indent = lines.stream()
                .skip(1)
                .filter(l -> !l.isBlank())
                .mapToInt(l -> l.length() - l.stripLeading().length())
                .min()
                .orElse(0);
        var result = new StringBuilder(lines.get(0).strip());
        for (var line : lines.subList(1, lines.size())) {
            result.append('\n').append(line.isBlank() ? "" : line.substring(indent).stripTrailing());
        }
        return result.toString().strip();
    }
}
