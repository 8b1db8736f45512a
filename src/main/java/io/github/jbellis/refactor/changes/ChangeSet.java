package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.ProjectFile;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The edits of one operation, grouped by file, together with the content each file had when the edits
 * were planned. Edits to the same file never overlap. Two insertions at the same offset are allowed and
 * keep the order in which they were added.
 */
public final class ChangeSet {
    private final Map<ProjectFile, List<Edit>> edits;
    private final Map<ProjectFile, byte[]> originals;

    private ChangeSet(Map<ProjectFile, List<Edit>> edits, Map<ProjectFile, byte[]> originals) {
        this.edits = edits;
        this.originals = originals;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<ProjectFile, List<Edit>> edits = new TreeMap<>();
        private final Map<ProjectFile, byte[]> originals = new LinkedHashMap<>();

        /**
         * @param original the file content the edit's offsets refer to
         */
        public Builder add(Edit edit, byte[] original) {
            if (edit.range().end() > original.length) {
                throw new IllegalArgumentException("Edit " + edit.range() + " lies outside " + edit.file());
            }
            edits.computeIfAbsent(edit.file(), f -> new ArrayList<>()).add(edit);
            originals.putIfAbsent(edit.file(), original);
            return this;
        }

        public ChangeSet build() {
            var sorted = new TreeMap<ProjectFile, List<Edit>>();
            edits.forEach((file, list) -> {
                var ordered = new ArrayList<>(list);
                // stable: same-offset insertions keep their order
                ordered.sort(Comparator.comparing(Edit::range));
                for (int i = 1; i < ordered.size(); i++) {
                    var previous = ordered.get(i - 1).range();
                    var current = ordered.get(i).range();
                    if (current.start() < previous.end()) {
                        throw new IllegalArgumentException("Overlapping edits in " + file + ": " + previous + " and " + current);
                    }
                }
                sorted.put(file, List.copyOf(ordered));
            });
            return new ChangeSet(Collections.unmodifiableMap(sorted), Map.copyOf(originals));
        }
    }

    public Set<ProjectFile> files() {
        return edits.keySet();
    }

    /**
     * Edits of one file in ascending offset order.
     */
    public List<Edit> edits(ProjectFile file) {
        return edits.getOrDefault(file, List.of());
    }

    public int editCount() {
        return edits.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public byte[] original(ProjectFile file) {
        var content = originals.get(file);
        if (content == null) {
            throw new IllegalArgumentException("No edits for " + file);
        }
        return content;
    }

    /**
     * True if {@code current} is still the content the edits were planned against.
     */
    public boolean matchesOriginal(ProjectFile file, byte[] current) {
        return Arrays.equals(original(file), current);
    }

    /**
     * The file's content after the edits.
     */
    public byte[] result(ProjectFile file) {
        return apply(original(file), edits(file));
    }

    /**
     * Applies edits to a byte array, last offset first so earlier offsets stay valid.
     */
    public static byte[] apply(byte[] content, List<Edit> edits) {
        var descending = new ArrayList<>(edits);
        Collections.reverse(descending);
        descending.sort(Comparator.comparingInt((Edit e) -> e.range().start()).reversed());
        var result = content;
        for (var edit : descending) {
            var out = new ByteArrayOutputStream(result.length + edit.replacement().length());
            out.write(result, 0, edit.range().start());
            out.writeBytes(edit.replacement().getBytes(StandardCharsets.UTF_8));
            out.write(result, edit.range().end(), result.length - edit.range().end());
            result = out.toByteArray();
        }
        return result;
    }

    @Override
    public String toString() {
        return "ChangeSet[" + editCount() + " edits in " + edits.size() + " files]";
    }
}
