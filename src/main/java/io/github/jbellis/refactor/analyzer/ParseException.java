package io.github.jbellis.refactor.analyzer;

/**
 * A file could not be turned into a usable syntax tree: it does not decode, or it contains syntax errors.
 */
public class ParseException extends Exception {
    private final ProjectFile file;
    private final int line;

    public ParseException(ProjectFile file, int line, String message) {
        super(file + ":" + line + ": " + message);
        this.file = file;
        this.line = line;
    }

    public ParseException(ProjectFile file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
        this.line = 0;
    }

    public ProjectFile file() {
        return file;
    }

    /**
     * 1-based line of the first error, or 0 when the failure is not tied to a position.
     */
    public int line() {
        return line;
    }
}
