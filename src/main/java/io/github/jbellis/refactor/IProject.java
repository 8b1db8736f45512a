package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.analyzer.ProjectFile;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A project the engine operates on: a root directory and the files under it.
 */
public interface IProject {

    /**
     * Absolute, normalized project root.
     */
    Path getRoot();

    /**
     * All source files of the project. Build output, VCS metadata and the engine's own state directory
     * are not included.
     */
    Set<ProjectFile> getAllFiles();

    /**
     * The recognized languages of the project's files.
     */
    default Set<Language> getAnalyzerLanguages() {
        return getAllFiles().stream()
                .map(ProjectFile::getLanguage)
                .filter(l -> l != Language.NONE)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * The language with the most files, or NONE for a project without recognized sources.
     */
    default Language getPrimaryLanguage() {
        Map<Language, Long> counts = getAllFiles().stream()
                .map(ProjectFile::getLanguage)
                .filter(l -> l != Language.NONE)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.<Language, Long>comparingByValue()
                             .thenComparing(e -> e.getKey().internalName(), Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse(Language.NONE);
    }
}
