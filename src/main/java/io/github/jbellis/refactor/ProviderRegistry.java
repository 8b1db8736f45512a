package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.provider.PythonRefactoringProvider;
import io.github.jbellis.refactor.provider.RefactoringProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Providers available to an engine, in registration order. The first provider that supports a language
 * serves it; that choice is cached until another provider is registered.
 */
public final class ProviderRegistry {
    private static final Logger logger = LogManager.getLogger(ProviderRegistry.class);

    private final List<RefactoringProvider> providers = new CopyOnWriteArrayList<>();
    private final Map<Language, RefactoringProvider> chosen = new ConcurrentHashMap<>();

    /**
     * A registry holding every built-in provider.
     */
    public static ProviderRegistry withDefaults() {
        var registry = new ProviderRegistry();
        registry.register(new PythonRefactoringProvider());
        return registry;
    }

    public void register(RefactoringProvider provider) {
        providers.add(provider);
        chosen.clear();
        logger.debug("Registered {} provider with {}", provider.language().name(), provider.capabilities());
    }

    public Optional<RefactoringProvider> providerFor(Language language) {
        var cached = chosen.get(language);
        if (cached != null) {
            return Optional.of(cached);
        }
        var found = providers.stream().filter(p -> p.supportsLanguage(language)).findFirst();
        found.ifPresent(p -> chosen.put(language, p));
        return found;
    }

    public List<RefactoringProvider> providers() {
        return List.copyOf(providers);
    }
}
