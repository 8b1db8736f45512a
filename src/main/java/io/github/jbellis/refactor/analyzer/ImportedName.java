package io.github.jbellis.refactor.analyzer;

/**
 * A name imported from outside the project, or from a project module that does not define it.
 */
public record ImportedName(String name, String qualifiedName, ProjectFile file, int line) {
    public String location() {
        return file + ":" + line;
    }
}
