package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.analyzer.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PythonRefactoringProviderTest {

    @Test
    void testCleanDocstring() {
        assertEquals("Summary line.", PythonRefactoringProvider.cleanDocstring("Summary line."));
        assertEquals("Summary.\n\nDetails here.\n  indented more.",
                     PythonRefactoringProvider.cleanDocstring("Summary.\n\n    Details here.\n      indented more.\n    "));
        assertEquals("Starts on second line.",
                     PythonRefactoringProvider.cleanDocstring("\n    Starts on second line.\n    "));
        assertEquals("", PythonRefactoringProvider.cleanDocstring(""));
    }

    @Test
    void testSupportsOnlyPython() {
        var provider = new PythonRefactoringProvider();
        assertTrue(provider.supportsLanguage(Language.PYTHON));
        assertFalse(provider.supportsLanguage(Language.NONE));
        assertEquals(Language.PYTHON, provider.newBackend().language());
    }
}
