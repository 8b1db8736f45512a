package io.github.jbellis.refactor.analyzer;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A source language the engine knows how to recognize. Whether a language can actually be refactored
 * depends on which providers are registered; see {@code ProviderRegistry}.
 */
public interface Language {

    List<String> getExtensions();

    String name(); // Human-friendly

    String internalName(); // Filesystem-safe

    Language PYTHON = new Language() {
        private final List<String> extensions = List.of("py");

        @Override
        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String name() {
            return "Python";
        }

        @Override
        public String internalName() {
            return "PYTHON";
        }

        @Override
        public String toString() {
            return name();
        }
    };

    Language NONE = new Language() {
        private final List<String> extensions = Collections.emptyList();

        @Override
        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String name() {
            return "None";
        }

        @Override
        public String internalName() {
            return "NONE";
        }

        @Override
        public String toString() {
            return name();
        }
    };

    List<Language> ALL_LANGUAGES = List.of(PYTHON, NONE);

    /**
     * Returns the Language for a file extension, with or without the leading dot, or NONE.
     */
    static Language fromExtension(String extension) {
        if (extension.isEmpty()) {
            return NONE;
        }
        String lowerExt = extension.toLowerCase(Locale.ROOT);
        String normalizedExt = lowerExt.startsWith(".") ? lowerExt.substring(1) : lowerExt;
        for (Language lang : ALL_LANGUAGES) {
            if (lang.getExtensions().contains(normalizedExt)) {
                return lang;
            }
        }
        return NONE;
    }

    /**
     * Looks a language up by either of its names, case-insensitively. Returns NONE when unknown.
     */
    static Language valueOf(String name) {
        for (Language lang : ALL_LANGUAGES) {
            if (lang.name().equalsIgnoreCase(name) || lang.internalName().equalsIgnoreCase(name)) {
                return lang;
            }
        }
        return NONE;
    }
}
