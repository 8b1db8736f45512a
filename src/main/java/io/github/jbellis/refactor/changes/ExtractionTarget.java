package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.SourceFile;
import io.github.jbellis.refactor.analyzer.Symbol;

/**
 * Code chosen for extraction, already checked to be a whole lambda, expression or statement run.
 *
 * @param function the named function containing the code
 * @param range    the exact bytes to extract
 */
public record ExtractionTarget(Kind kind, SourceFile source, Symbol function, ByteRange range) {

    public enum Kind {
        LAMBDA,
        EXPRESSION,
        STATEMENTS
    }
}
