package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.AnonymousElementIndexer.ElementKind;
import io.github.jbellis.refactor.analyzer.ByteRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExtractSourceTest {

    @Test
    void testElementIds() throws RefactoringException {
        assertEquals(new ExtractSource.ElementId("login", ElementKind.LAMBDA, 1), ExtractSource.parse("login.lambda_1"));
        assertEquals(new ExtractSource.ElementId("app.models.User.is_adult", ElementKind.EXPRESSION, 12),
                     ExtractSource.parse(" app.models.User.is_adult.expression_12 "));
        assertEquals("f.block_2", ExtractSource.parse("f.block_2").toString());
    }

    @Test
    void testLineRanges() throws RefactoringException {
        var parsed = ExtractSource.parse("final_price:5-6");
        assertEquals(new ExtractSource.LineRange("final_price", 5, 6), parsed);
        assertEquals("final_price", parsed.function());
        assertEquals("final_price:5-6", parsed.toString());
        assertEquals(new ExtractSource.LineRange("f", 3, 3), ExtractSource.parse("f:3-3"));
    }

    @Test
    void testByteSpanLabel() {
        assertEquals("f@10-20", new ExtractSource.ByteSpan("f", new ByteRange(10, 20)).toString());
    }

    @Test
    void testInvalidSources() {
        for (var text : new String[]{"login", "login.lambda", "login.closure_1", "f:6-5", "f:0-2", "f:1-99999999999"}) {
            var e = assertThrows(RefactoringException.class, () -> ExtractSource.parse(text), text);
            assertEquals(ErrorKind.VALIDATION_FAILED, e.kind(), text);
            assertEquals(2, e.suggestions().size());
        }
    }
}
