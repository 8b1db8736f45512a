package io.github.jbellis.refactor.analyzer;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SourceFileTest {
    private static final Path ROOT = Path.of("/tmp/project").toAbsolutePath().normalize();
    private final PythonBackend backend = new PythonBackend();

    private SourceFile parse(String code) throws ParseException {
        return backend.parse(new ProjectFile(ROOT, "m.py"), code.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testLinesAndColumns() throws ParseException {
        var source = parse("x = 1\ny = 2\n");
        assertEquals(3, source.lineCount());
        assertEquals(1, source.line(0));
        assertEquals(2, source.line(6));
        assertEquals(4, source.column(10));
        assertEquals(6, source.lineStart(2));
        assertEquals(11, source.lineEnd(2));
        assertEquals(10, source.offset(2, 4));
        assertEquals(11, source.offset(2, 99));
    }

    @Test
    void testSlicesUseByteOffsets() throws ParseException {
        var source = parse("s = 'héllo'\nt = s\n");
        // é is two bytes in UTF-8
        int t = source.lineStart(2);
        assertEquals(13, t);
        assertEquals("t", source.text(t, t + 1));
        assertEquals("'héllo'", source.text(new ByteRange(4, 12)));
    }

    @Test
    void testSyntaxErrorIsRejected() {
        var e = assertThrows(ParseException.class, () -> parse("def broken(:\n    pass\n"));
        assertEquals("m.py", e.file().toString());
        assertTrue(e.line() >= 1);
    }

    @Test
    void testInvalidUtf8IsRejected() {
        var file = new ProjectFile(ROOT, "bad.py");
        var e = assertThrows(ParseException.class, () -> backend.parse(file, new byte[]{'x', '=', (byte) 0xff}));
        assertEquals(0, e.line());
    }

    @Test
    void testFingerprintTracksContent() throws ParseException {
        var first = parse("def f():\n    return 1\n");
        var second = parse("def f():\n    return 2\n");
        var range = new ByteRange(0, first.content().length);
        assertEquals(first.fingerprint(range), parse("def f():\n    return 1\n").fingerprint(range));
        assertNotEquals(first.fingerprint(range), second.fingerprint(range));
    }
}
