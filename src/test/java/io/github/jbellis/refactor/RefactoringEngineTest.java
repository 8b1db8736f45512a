package io.github.jbellis.refactor;

import io.github.jbellis.refactor.analyzer.ByteRange;
import io.github.jbellis.refactor.analyzer.PythonBackend;
import io.github.jbellis.refactor.provider.AnalysisResult;
import io.github.jbellis.refactor.provider.OperationResult;
import io.github.jbellis.refactor.testutil.TestProject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class RefactoringEngineTest {
    @TempDir
    Path root;

    private TestProject project;
    private RefactoringEngine engine;

    @BeforeEach
    void setup() {
        project = TestProject.copyOf("testcode-py", root);
        engine = new RefactoringEngine(ProviderRegistry.withDefaults(), new ProjectCache());
    }

    // ---------------------------------------------------------------- analyze / find / show

    @Test
    void testAnalyzeFunction() {
        var result = engine.analyze(root, "login");
        assertTrue(result.success(), result.toString());
        var symbol = result.symbol();
        assertNotNull(symbol);
        assertEquals("auth.login", symbol.qualifiedName());
        assertEquals("function", symbol.kind());
        assertEquals("auth.py:4", symbol.definitionLocation());
        assertEquals("auth", symbol.scope());
        assertEquals(List.of(new AnalysisResult.ReferenceInfo("auth.py", 4, 4, "definition")), result.references());
        assertTrue(result.suggestions().contains("No references besides the definition; login may be unused"),
                   result.suggestions().toString());
        assertTrue(result.suggestions().contains("1 extractable elements; run show auth.login to list them"),
                   result.suggestions().toString());
        assertFalse(result.partial());
    }

    @Test
    void testAnalyzeReportsDocstringAndUsages() {
        var help = engine.analyze(root, "a.help");
        assertTrue(help.success());
        assertNotNull(help.symbol());
        assertEquals("Print help for module a.\n\nShows x and y.", help.symbol().docstring());

        var user = engine.analyze(root, "User");
        assertTrue(user.success());
        assertEquals(3, user.referenceCount());
        assertTrue(user.references().stream().anyMatch(r -> r.file().equals("app/service.py") && r.kind().equals("import")));
        assertNull(user.symbol().docstring());
    }

    @Test
    void testAnalyzeAmbiguousName() {
        var result = engine.analyze(root, "help");
        assertFalse(result.success());
        assertEquals(ErrorKind.AMBIGUOUS_SYMBOL, result.errorKind());
        assertEquals(List.of("Use the qualified name a.help", "Use the qualified name b.help"), result.suggestions());
    }

    @Test
    void testAnalyzeUnknownNameSuggestsAlternatives() {
        var result = engine.analyze(root, "logn");
        assertFalse(result.success());
        assertEquals(ErrorKind.SYMBOL_NOT_FOUND, result.errorKind());
        assertTrue(result.suggestions().contains("Did you mean auth.login?"), result.suggestions().toString());
    }

    @Test
    void testFind() {
        var result = engine.find(root, "help");
        assertTrue(result.success());
        assertEquals(2, result.totalCount());

        var blank = engine.find(root, "  ");
        assertFalse(blank.success());
        assertEquals(ErrorKind.VALIDATION_FAILED, blank.errorKind());
    }

    @Test
    void testShowListsElements() {
        var result = engine.show(root, "process_data_set");
        assertTrue(result.success());
        assertEquals("data.process_data_set", result.qualifiedName());
        assertEquals(7, result.elements().size());
        assertTrue(result.elements().stream().anyMatch(e -> e.id().equals("process_data_set.block_1")
                                                            && e.kind().equals("block")
                                                            && e.location().equals("data.py:8")));
    }

    @Test
    void testShowRejectsNonFunction() {
        var result = engine.show(root, "a.x");
        assertFalse(result.success());
        assertEquals(ErrorKind.VALIDATION_FAILED, result.errorKind());
    }

    // ---------------------------------------------------------------- rename

    @Test
    void testRenameClassAcrossModules() {
        var result = engine.rename(root, "User", "Account");
        assertTrue(result.success(), result.toString());
        assertEquals("app.models.User", result.qualifiedName());
        assertEquals(List.of("app/models.py", "app/service.py"), result.filesModified());
        assertEquals(3, result.referencesUpdated());
        assertNotNull(result.backupId());

        assertTrue(project.read("app/service.py").startsWith("from app.models import Account\n"));
        assertTrue(project.read("app/service.py").contains("user = Account(name, age)"));

        var analyzed = engine.analyze(root, "Account");
        assertTrue(analyzed.success());
        assertEquals("app.models.Account", analyzed.symbol().qualifiedName());
        assertEquals("app/models.py:1", analyzed.symbol().definitionLocation());
        assertEquals(ErrorKind.SYMBOL_NOT_FOUND, engine.analyze(root, "User").errorKind());
    }

    @Test
    void testRestoreUndoesRename() {
        var original = project.read("app/service.py");
        var renamed = engine.rename(root, "User", "Account");
        assertTrue(renamed.success());

        var listing = engine.listBackups(root);
        assertEquals(1, listing.backups().size());
        assertEquals(renamed.backupId(), listing.backups().get(0).id());

        var restored = engine.restore(root, renamed.backupId());
        assertTrue(restored.success(), restored.toString());
        assertEquals(List.of("app/models.py", "app/service.py"), restored.files());
        assertEquals(original, project.read("app/service.py"));
        assertTrue(engine.analyze(root, "app.models.User").success());

        assertTrue(engine.removeBackup(root, renamed.backupId()).success());
        assertTrue(engine.listBackups(root).backups().isEmpty());
    }

    @Test
    void testConflictingRenameChangesNothing() {
        var before = project.read("a.py");
        var result = engine.rename(root, "a.x", "y");
        assertFalse(result.success());
        assertEquals(ErrorKind.NAMING_CONFLICT, result.errorKind());
        assertEquals(1, result.conflicts().size());
        assertTrue(result.filesModified().isEmpty());
        assertNull(result.backupId());
        assertTrue(result.suggestions().contains("See the existing definition at a.py:2"), result.suggestions().toString());
        assertEquals(before, project.read("a.py"));
        assertTrue(engine.listBackups(root).backups().isEmpty());
        assertTrue(result.toJson().contains("\"error_kind\" : \"naming_conflict\""), result.toJson());
    }

    @Test
    void testRenameValidation() {
        assertEquals(ErrorKind.VALIDATION_FAILED, engine.rename(root, "a.x", "1abc").errorKind());
        assertEquals(ErrorKind.VALIDATION_FAILED, engine.rename(root, "a.x", "class").errorKind());
        assertEquals(ErrorKind.VALIDATION_FAILED, engine.rename(root, "a.x", "x").errorKind());
        assertEquals(ErrorKind.NAMING_CONFLICT, engine.rename(root, "a.x", "print").errorKind());
    }

    // ---------------------------------------------------------------- extract

    @Test
    void testExtractLambdaById() {
        assertTrue(engine.show(root, "login").success());
        var result = engine.extract(root, "login.lambda_1", "is_adult");
        assertTrue(result.success(), result.toString());
        assertEquals(List.of("u"), result.parameters());
        assertEquals(List.of("auth.py"), result.filesModified());
        assertEquals("def is_adult(u):\n    return u.age >= 18 and u.verified", result.extractedCode());
        assertEquals("""
                             \"""Authentication helpers.\"""


                             def is_adult(u):
                                 return u.age >= 18 and u.verified


                             def login():
                                 return is_adult
                             """, project.read("auth.py"));

        var analyzed = engine.analyze(root, "is_adult");
        assertTrue(analyzed.success());
        assertEquals("auth.is_adult", analyzed.symbol().qualifiedName());
    }

    @Test
    void testExtractLineRange() {
        var result = engine.extract(root, "final_price:5-6", "compute_total");
        assertTrue(result.success(), result.toString());
        assertEquals(List.of("price", "discount"), result.parameters());
        assertEquals(List.of("total"), result.returns());
        assertTrue(project.read("pricing.py").contains("    total = compute_total(price, discount)\n    return round(total, 2)\n"));
    }

    @Test
    void testExtractKeepsValueOfConditionallyAssignedVariable() {
        TestProject.write(root.resolve("pick.py"), """
                def pick(c):
                    x = 0
                    if c:
                        x = 1
                    print(x)
                    return x
                """);
        var result = engine.extract(root, "pick:3-5", "choose");
        assertTrue(result.success(), result.toString());
        assertEquals(List.of("c", "x"), result.parameters());
        assertEquals(List.of("x"), result.returns());
        assertEquals("""
                             def choose(c, x):
                                 if c:
                                     x = 1
                                 print(x)
                                 return x


                             def pick(c):
                                 x = 0
                                 x = choose(c, x)
                                 return x
                             """, project.read("pick.py"));
    }

    @Test
    void testExtractByteRange() {
        var text = project.read("pricing.py");
        int start = text.indexOf("subtotal + subtotal * TAX_RATE");
        var result = engine.extract(root, "final_price", new ByteRange(start, start + "subtotal + subtotal * TAX_RATE".length()),
                                    "with_tax");
        assertTrue(result.success(), result.toString());
        assertEquals(List.of("subtotal"), result.parameters());
        assertTrue(result.returns().isEmpty());

        var partial = engine.extract(root, "final_price", new ByteRange(start, start + 1), "broken");
        assertFalse(partial.success());
    }

    @Test
    void testExtractRejectsPartialExpression() {
        var text = project.read("pricing.py");
        int start = text.indexOf("subtotal + subtotal");
        var result = engine.extract(root, "final_price", new ByteRange(start, start + "subtotal + subtotal".length()),
                                    "half");
        assertFalse(result.success());
        assertEquals(ErrorKind.EXTRACTION_SHAPE_ERROR, result.errorKind());
        assertNull(result.backupId());
        assertEquals(text, project.read("pricing.py"));
    }

    @Test
    void testExtractLinesOutsideFunctionBody() {
        var result = engine.extract(root, "final_price:1-5", "bad");
        assertEquals(ErrorKind.EXTRACTION_SHAPE_ERROR, result.errorKind());
    }

    @Test
    void testElementIdGoesStaleAfterEdit() {
        assertTrue(engine.show(root, "process_data_set").success());
        var text = project.read("data.py");
        TestProject.write(root.resolve("data.py"), text.replace("r.value > threshold", "r.value >= threshold"));
        engine.fileChanged(root, List.of(Path.of("data.py")));

        var result = engine.extract(root, "process_data_set.lambda_1", "is_valid");
        assertFalse(result.success());
        assertEquals(ErrorKind.IDENTIFIER_STALE, result.errorKind());
        assertTrue(result.suggestions().get(0).startsWith("Run show process_data_set"), result.suggestions().toString());

        assertTrue(engine.show(root, "process_data_set").success());
        assertTrue(engine.extract(root, "process_data_set.lambda_1", "is_valid").success());
    }

    @Test
    void testUnknownElementOrdinalIsStale() {
        var result = engine.extract(root, "login.lambda_5", "nothing");
        assertEquals(ErrorKind.IDENTIFIER_STALE, result.errorKind());
    }

    @Test
    void testMalformedExtractSource() {
        var result = engine.extract(root, "login", "f");
        assertEquals(ErrorKind.VALIDATION_FAILED, result.errorKind());
        assertFalse(result.suggestions().isEmpty());
    }

    @Test
    void testEditOutsideEngineIsDetected() {
        assertTrue(engine.analyze(root, "login").success());
        // the cached index still describes the old content
        TestProject.write(root.resolve("auth.py"), project.read("auth.py") + "\n# trailing comment\n");
        var result = engine.extract(root, "login.lambda_1", "is_adult");
        assertEquals(ErrorKind.IDENTIFIER_STALE, result.errorKind());
        assertTrue(project.read("auth.py").endsWith("# trailing comment\n"));
    }

    // ---------------------------------------------------------------- concurrency

    @Test
    void testConcurrentMutationsLeaveConsistentFiles() throws Exception {
        List<Callable<OperationResult>> tasks = new ArrayList<>();
        tasks.add(() -> engine.rename(root, "User", "Account"));
        tasks.add(() -> engine.rename(root, "User", "Person"));
        tasks.add(() -> engine.rename(root, "final_price", "net_price"));
        tasks.add(() -> engine.extract(root, "final_price:5-6", "compute_total"));
        tasks.add(() -> engine.extract(root, "process_data_set:8-9", "tally"));
        for (int i = 0; i < 3; i++) {
            tasks.add(() -> engine.analyze(root, "login"));
            tasks.add(() -> engine.find(root, "*"));
            tasks.add(() -> engine.show(root, "process_data_set"));
        }

        var start = new CountDownLatch(1);
        var executor = Executors.newFixedThreadPool(tasks.size());
        List<OperationResult> results = new ArrayList<>();
        try {
            var futures = new ArrayList<Future<OperationResult>>();
            for (var task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            for (var future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        var allowedFailures = Set.of(ErrorKind.IDENTIFIER_STALE, ErrorKind.SYMBOL_NOT_FOUND);
        for (var result : results) {
            assertTrue(result.success() || allowedFailures.contains(result.errorKind()), result.toString());
            assertTrue(result.success() || !result.suggestions().isEmpty(), result.toString());
        }
        // exactly one of the two renames of User won
        var userRenames = results.subList(0, 2);
        assertEquals(1, userRenames.stream().filter(OperationResult::success).count(), userRenames.toString());
        assertTrue(results.get(2).success(), results.get(2).toString());
        assertTrue(results.get(4).success(), results.get(4).toString());

        var backend = new PythonBackend();
        for (var file : project.getAllFiles()) {
            if (file.extension().equals("py")) {
                assertDoesNotThrow(() -> backend.parse(file), file.toString());
            }
        }

        var models = project.read("app/models.py");
        var service = project.read("app/service.py");
        var newName = models.startsWith("class Account:") ? "Account" : "Person";
        assertTrue(models.startsWith("class " + newName + ":"), models);
        assertTrue(service.startsWith("from app.models import " + newName + "\n"), service);
        assertFalse(service.contains("User"), service);

        var pricing = project.read("pricing.py");
        assertTrue(pricing.contains("def net_price(price, discount):"), pricing);
        assertFalse(pricing.contains("final_price"), pricing);
        assertEquals(results.get(3).success(), pricing.contains("total = compute_total(price, discount)"), pricing);
        assertTrue(project.read("data.py").contains("total = tally(total, r)"));
    }

    // ---------------------------------------------------------------- backups and projects

    @Test
    void testUnknownBackup() {
        assertEquals(ErrorKind.BACKUP_NOT_FOUND, engine.restore(root, "0000-missing").errorKind());
        assertEquals(ErrorKind.BACKUP_NOT_FOUND, engine.removeBackup(root, "0000-missing").errorKind());
    }

    @Test
    void testProjectWithoutPythonSources(@TempDir Path other) {
        TestProject.write(other.resolve("README.txt"), "nothing here");
        var result = engine.analyze(other, "main");
        assertEquals(ErrorKind.UNSUPPORTED_LANGUAGE, result.errorKind());
        assertTrue(result.suggestions().get(0).contains("Python"), result.suggestions().toString());
    }

    @Test
    void testMissingRoot() {
        var result = engine.find(root.resolve("missing"), "x");
        assertEquals(ErrorKind.VALIDATION_FAILED, result.errorKind());
    }

    @Test
    void testBrokenFileIsReportedNotFatal() {
        TestProject.write(root.resolve("broken.py"), "def login_helper(:\n");
        var result = engine.analyze(root, "login_helper");
        assertEquals(ErrorKind.SYMBOL_NOT_FOUND, result.errorKind());
        assertTrue(result.suggestions().stream().anyMatch(s -> s.startsWith("broken.py was left out of the analysis")),
                   result.suggestions().toString());
        assertTrue(engine.analyze(root, "login").success());
    }
}
