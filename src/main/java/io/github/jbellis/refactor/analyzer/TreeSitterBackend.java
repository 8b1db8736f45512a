package io.github.jbellis.refactor.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Base class for backends built on a tree-sitter grammar.
 */
public abstract class TreeSitterBackend implements LanguageBackend {
    protected static final Logger logger = LogManager.getLogger(TreeSitterBackend.class);

    // TSParser is not threadsafe, so we keep one per thread
    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(this::createParser);

    protected abstract TSLanguage getTSLanguage();

    protected abstract LanguageSyntaxProfile getLanguageSyntaxProfile();

    @Override
    public final LanguageSyntaxProfile syntaxProfile() {
        return getLanguageSyntaxProfile();
    }

    private TSParser createParser() {
        var parser = new TSParser();
        if (!parser.setLanguage(getTSLanguage())) {
            throw new IllegalStateException("Failed to set language " + language() + " on TSParser");
        }
        return parser;
    }

    @Override
    public SourceFile parse(ProjectFile file, byte[] content) throws ParseException {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ParseException(file, "file is not valid UTF-8", e);
        }

        TSTree tree = parsers.get().parseString(null, text);
        var sourceFile = new SourceFile(file, content, tree);
        var root = sourceFile.root();
        if (root.isNull()) {
            throw new ParseException(file, 1, "parser produced no tree");
        }
        if (root.hasError()) {
            var error = firstError(root);
            int line = error == null ? 1 : error.getStartPoint().getRow() + 1;
            String what = error == null || error.isMissing() ? "missing token" : "syntax error";
            logger.debug("{} in {} at line {}", what, file, line);
            throw new ParseException(file, line, what);
        }
        return sourceFile;
    }

    private static @Nullable TSNode firstError(TSNode node) {
        if (node.getType().equals("ERROR") || node.isMissing()) {
            return node;
        }
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                var found = firstError(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
