package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ProjectState;
import io.github.jbellis.refactor.analyzer.Language;
import io.github.jbellis.refactor.analyzer.LanguageBackend;

import java.util.Set;

/**
 * The operations of the engine for one language. Failures a caller can act on come back as unsuccessful
 * results, never as exceptions.
 */
public sealed interface RefactoringProvider permits TreeSitterRefactoringProvider {

    Language language();

    default boolean supportsLanguage(Language language) {
        return language() == language;
    }

    Set<Capability> capabilities();

    /**
     * Creates the backend a project of this provider's language is analyzed with.
     */
    LanguageBackend newBackend();

    AnalysisResult analyze(ProjectState state, String name);

    FindResult find(ProjectState state, String pattern);

    ShowResult show(ProjectState state, String functionName);

    RenameResult rename(ProjectState state, String oldName, String newName);

    ExtractResult extract(ProjectState state, ExtractSource source, String newName);

    BackupResult restore(ProjectState state, String backupId);
}
