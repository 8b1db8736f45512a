package io.github.jbellis.refactor.analyzer;

/**
 * One occurrence of a symbol's identity in source.
 *
 * @param symbolId qualified name of the referenced symbol
 * @param range    the bytes of the name token
 * @param scopeId  qualified name of the innermost scope containing the occurrence
 */
public record Reference(String symbolId,
                        ProjectFile file,
                        ByteRange range,
                        int line,
                        ReferenceKind kind,
                        String scopeId) implements Comparable<Reference> {

    public String location() {
        return file + ":" + line;
    }

    @Override
    public int compareTo(Reference o) {
        int c = file.compareTo(o.file);
        return c != 0 ? c : range.compareTo(o.range);
    }
}
