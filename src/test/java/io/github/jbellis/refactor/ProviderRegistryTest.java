package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.provider.Capability;
import io.github.jbellis.refactor.provider.PythonRefactoringProvider;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class ProviderRegistryTest {

    @Test
    void testDefaultsServePython() {
        var registry = ProviderRegistry.withDefaults();
        var provider = registry.providerFor(Language.PYTHON).orElseThrow();
        assertEquals(Language.PYTHON, provider.language());
        assertEquals(EnumSet.allOf(Capability.class), provider.capabilities());
        assertTrue(registry.providerFor(Language.NONE).isEmpty());
    }

    @Test
    void testFirstRegisteredProviderWins() {
        var registry = ProviderRegistry.withDefaults();
        var first = registry.providerFor(Language.PYTHON).orElseThrow();
        registry.register(new PythonRefactoringProvider());
        assertEquals(2, registry.providers().size());
        assertSame(first, registry.providerFor(Language.PYTHON).orElseThrow());
    }

    @Test
    void testEmptyRegistry() {
        assertTrue(new ProviderRegistry().providerFor(Language.PYTHON).isEmpty());
    }
}
