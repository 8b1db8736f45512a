package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.RefactoringException;
import io.github.jbellis.refactor.analyzer.AnonymousElementIndexer.ElementKind;
import io.github.jbellis.refactor.analyzer.ByteRange;

import java.util.List;
import java.util.regex.Pattern;

/**
 * What an extract operation should pull out of a function.
 */
public sealed interface ExtractSource {

    /**
     * The function the code lives in, as the caller named it.
     */
    String function();

    /**
     * An id listed by show, such as {@code login.lambda_1}.
     */
    record ElementId(String function, ElementKind kind, int ordinal) implements ExtractSource {
        @Override
        public String toString() {
            return function + "." + kind.label() + "_" + ordinal;
        }
    }

    /**
     * 1-based, inclusive file lines inside the function, written {@code login:3-5}.
     */
    record LineRange(String function, int startLine, int endLine) implements ExtractSource {
        @Override
        public String toString() {
            return function + ":" + startLine + "-" + endLine;
        }
    }

    /**
     * Exact bytes of the function's file.
     */
    record ByteSpan(String function, ByteRange range) implements ExtractSource {
        @Override
        public String toString() {
            return function + "@" + range.start() + "-" + range.end();
        }
    }

    Pattern ELEMENT_ID = Pattern.compile("^(.+)\\.(lambda|expression|block)_(\\d+)$");
    Pattern LINE_RANGE = Pattern.compile("^(.+):(\\d+)-(\\d+)$");

    static ExtractSource parse(String text) throws RefactoringException {
        var trimmed = text.strip();
        var element = ELEMENT_ID.matcher(trimmed);
        if (element.matches()) {
            return new ElementId(element.group(1), ElementKind.fromLabel(element.group(2)), parseNumber(element.group(3), text));
        }
        var lines = LINE_RANGE.matcher(trimmed);
        if (lines.matches()) {
            int start = parseNumber(lines.group(2), text);
            int end = parseNumber(lines.group(3), text);
            if (start < 1 || end < start) {
                throw invalid(text, "line range " + start + "-" + end + " is empty or starts before line 1");
            }
            return new LineRange(lines.group(1), start, end);
        }
        throw invalid(text, "expected an element id such as 'login.lambda_1' or a line range such as 'login:3-5'");
    }

    private static int parseNumber(String digits, String text) throws RefactoringException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw invalid(text, "'" + digits + "' is out of range");
        }
    }

    private static RefactoringException invalid(String text, String reason) {
        return new RefactoringException(ErrorKind.VALIDATION_FAILED,
                                        "Invalid extraction source '" + text + "': " + reason,
                                        List.of("Run show on the function to list element ids",
                                                "Give a line range as function:START-END"));
    }
}
