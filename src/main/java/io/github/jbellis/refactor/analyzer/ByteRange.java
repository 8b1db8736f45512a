package io.github.jbellis.refactor.analyzer;

/**
 * Half-open range of UTF-8 byte offsets into a source file.
 */
public record ByteRange(int start, int end) implements Comparable<ByteRange> {
    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean contains(ByteRange other) {
        return other.start >= start && other.end <= end;
    }

    public boolean overlaps(ByteRange other) {
        return start < other.end && other.start < end;
    }

    @Override
    public int compareTo(ByteRange o) {
        int c = Integer.compare(start, o.start);
        return c != 0 ? c : Integer.compare(end, o.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
