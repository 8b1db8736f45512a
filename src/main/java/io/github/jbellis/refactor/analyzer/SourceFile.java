package io.github.jbellis.refactor.analyzer;

import com.google.common.hash.Hashing;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * One parsed file: the exact bytes that were read, and the syntax tree built from them.
 * <p>
 * Tree-sitter reports positions as UTF-8 byte offsets, so every slice is taken from {@link #content()}
 * rather than from a decoded String. Nodes obtained from {@link #root()} stay valid only as long as this
 * object (and therefore its tree) is reachable.
 */
public final class SourceFile {
    private final ProjectFile file;
    private final byte[] content;
    private final TSTree tree;
    private final int[] lineStarts;

    public SourceFile(ProjectFile file, byte[] content, TSTree tree) {
        this.file = file;
        this.content = content;
        this.tree = tree;
        this.lineStarts = computeLineStarts(content);
    }

    private static int[] computeLineStarts(byte[] content) {
        int count = 1;
        for (byte b : content) {
            if (b == '\n') count++;
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < content.length; i++) {
            if (content[i] == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    public ProjectFile file() {
        return file;
    }

    public byte[] content() {
        return content;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public String text(TSNode node) {
        return text(node.getStartByte(), node.getEndByte());
    }

    public String text(ByteRange range) {
        return text(range.start(), range.end());
    }

    public String text(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, content.length));
        int end = Math.max(start, Math.min(endByte, content.length));
        return new String(content, start, end - start, StandardCharsets.UTF_8);
    }

    public static ByteRange range(TSNode node) {
        return new ByteRange(node.getStartByte(), node.getEndByte());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * 1-based line containing the byte offset.
     */
    public int line(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /**
     * 0-based byte column of the offset within its line.
     */
    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1];
    }

    /**
     * Byte offset where a 1-based line starts. Lines past the end map to the end of the content.
     */
    public int lineStart(int line) {
        if (line < 1) return 0;
        if (line > lineStarts.length) return content.length;
        return lineStarts[line - 1];
    }

    /**
     * Byte offset of the end of a 1-based line, excluding its line terminator.
     */
    public int lineEnd(int line) {
        if (line >= lineStarts.length) return content.length;
        int end = lineStarts[line] - 1;
        if (end > 0 && content[end - 1] == '\r') end--;
        return end;
    }

    /**
     * Converts a 1-based line and 0-based byte column into an offset, clamped to the line.
     */
    public int offset(int line, int column) {
        int start = lineStart(line);
        return Math.min(start + Math.max(0, column), lineEnd(line));
    }

    /**
     * "relative/path.py:LINE" for the line containing the offset.
     */
    public String location(int offset) {
        return file + ":" + line(offset);
    }

    /**
     * The leading whitespace of the line containing the offset.
     */
    public String indentationAt(int offset) {
        int start = lineStarts[line(offset) - 1];
        int i = start;
        while (i < content.length && (content[i] == ' ' || content[i] == '\t')) i++;
        return text(start, i);
    }

    /**
     * Content hash of a byte range, used to notice that a scope changed between two operations.
     */
    public String fingerprint(ByteRange range) {
        return Hashing.sha256().hashBytes(content, range.start(), range.length()).toString();
    }

    public String contentHash() {
        return Hashing.sha256().hashBytes(content).toString();
    }

    public boolean hasErrors() {
        return root().hasError();
    }

    @Override
    public String toString() {
        return "SourceFile[" + file + ", " + content.length + " bytes]";
    }
}
