package io.github.jbellis.refactor.util;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.backup.Backup;
import io.github.jbellis.refactor.provider.ShowResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonTest {

    @Test
    void testResultsUseSnakeCaseAndOmitNulls() {
        var ok = Json.toJson(ShowResult.success("login", "auth.login",
                                                List.of(new ShowResult.ElementInfo("login.lambda_1", "lambda", "lambda u: u", "auth.py:5"))));
        assertTrue(ok.contains("\"function_name\" : \"login\""), ok);
        assertTrue(ok.contains("\"qualified_name\" : \"auth.login\""), ok);
        assertFalse(ok.contains("error_kind"), ok);

        var failed = Json.toJson(ShowResult.failure("nope", ErrorKind.SYMBOL_NOT_FOUND, "No symbol named 'nope'",
                                                    List.of("Run find")));
        assertTrue(failed.contains("\"error_kind\" : \"symbol_not_found\""), failed);
        assertTrue(failed.contains("\"success\" : false"), failed);
    }

    @Test
    void testFileRoundTrip(@TempDir Path dir) throws IOException {
        var backup = new Backup("abc-123", 42L, List.of(new Backup.BackedUpFile("pkg/m.py", 10)));
        var file = dir.resolve("nested").resolve("manifest.json");
        Json.write(file, backup);
        assertEquals(backup, Json.read(file, Backup.class));
    }

    @Test
    void testMalformedJson() {
        assertThrows(UncheckedIOException.class, () -> Json.fromJson("{", Backup.class));
    }
}
