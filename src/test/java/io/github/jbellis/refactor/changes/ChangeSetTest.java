package io.github.jbellis.refactor.changes;

import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.ProjectFile;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChangeSetTest {
    private static final Path ROOT = Path.of("/tmp/changes").toAbsolutePath().normalize();
    private static final ProjectFile A = new ProjectFile(ROOT, "a.py");
    private static final ProjectFile B = new ProjectFile(ROOT, "pkg/b.py");

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String string(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void testEditsApplyAgainstOriginalOffsets() {
        var original = bytes("foo = 1\nprint(foo)\n");
        var changes = ChangeSet.builder()
                .add(new Edit(A, new ByteRange(14, 17), "bar"), original)
                .add(new Edit(A, new ByteRange(0, 3), "bar"), original)
                .build();
        assertEquals("bar = 1\nprint(bar)\n", string(changes.result(A)));
        assertEquals(2, changes.editCount());
        assertEquals(List.of(new ByteRange(0, 3), new ByteRange(14, 17)),
                     changes.edits(A).stream().map(Edit::range).toList());
    }

    @Test
    void testReplacementLengthMayDiffer() {
        var original = bytes("x = compute()\n");
        var changes = ChangeSet.builder()
                .add(new Edit(A, new ByteRange(4, 11), "c"), original)
                .add(Edit.insert(A, 0, "# header\n"), original)
                .build();
        assertEquals("# header\nx = c()\n", string(changes.result(A)));
    }

    @Test
    void testSameOffsetInsertionsKeepOrder() {
        var original = bytes("body\n");
        var changes = ChangeSet.builder()
                .add(Edit.insert(A, 0, "first\n"), original)
                .add(Edit.insert(A, 0, "second\n"), original)
                .build();
        assertEquals("first\nsecond\nbody\n", string(changes.result(A)));
    }

    @Test
    void testOverlappingEditsAreRejected() {
        var original = bytes("abcdef");
        var builder = ChangeSet.builder()
                .add(new Edit(A, new ByteRange(0, 4), "x"), original)
                .add(new Edit(A, new ByteRange(2, 5), "y"), original);
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void testEditOutsideContentIsRejected() {
        var builder = ChangeSet.builder();
        assertThrows(IllegalArgumentException.class,
                     () -> builder.add(new Edit(A, new ByteRange(2, 10), "x"), bytes("abc")));
    }

    @Test
    void testFilesAreSortedAndOriginalsKept() {
        var a = bytes("a = 1\n");
        var b = bytes("b = 2\n");
        var changes = ChangeSet.builder()
                .add(new Edit(B, new ByteRange(0, 1), "c"), b)
                .add(new Edit(A, new ByteRange(0, 1), "d"), a)
                .build();
        assertEquals(List.of(A, B), List.copyOf(changes.files()));
        assertTrue(changes.matchesOriginal(A, bytes("a = 1\n")));
        assertFalse(changes.matchesOriginal(B, bytes("b = 3\n")));
        assertThrows(IllegalArgumentException.class, () -> changes.original(new ProjectFile(ROOT, "c.py")));
        assertTrue(changes.edits(new ProjectFile(ROOT, "c.py")).isEmpty());
    }

    @Test
    void testEmptyChangeSet() {
        var changes = ChangeSet.builder().build();
        assertTrue(changes.isEmpty());
        assertEquals(0, changes.editCount());
    }
}
