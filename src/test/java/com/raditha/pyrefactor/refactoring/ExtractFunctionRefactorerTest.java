package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.analysis.BuiltinNames;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixRecord;
import com.raditha.pyrefactor.history.InMemoryFixHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractFunctionRefactorerTest {

    private static final String PROCESS = """
            def process():
                x = 1
                y = 2
                z = x + y
                print(z)
            """;

    private static final String REPORT = """
            def report(items, rate):
                total = 0
                for item in items:
                    total += item.price
                tax = total * rate
                return total + tax
            """;

    @TempDir
    Path tempDir;

    private InMemoryFixHistory history;
    private ExtractFunctionRefactorer refactorer;

    @BeforeEach
    void setUp() {
        history = new InMemoryFixHistory();
        refactorer = new ExtractFunctionRefactorer(RefactoringConfig.defaults(), history, BuiltinNames.standard());
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("module.py");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testExtractBlockWithOutput() throws IOException {
        Path file = write(PROCESS);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 4, "compute_z");

        assertTrue(result.isSuccess(), () -> "Extraction failed: " + result);
        ExtractedFunction extracted = result.getValue();
        assertEquals(Set.of(), extracted.variables().inputs());
        assertEquals(Set.of("z"), extracted.variables().outputs());
        assertEquals(Set.of("x", "y"), extracted.variables().locals());
        assertEquals("""
                def compute_z():
                    x = 1
                    y = 2
                    z = x + y
                    return z
                """, extracted.definition());
        assertEquals("z = compute_z()", extracted.callSite());

        String expected = """
                def compute_z():
                    x = 1
                    y = 2
                    z = x + y
                    return z


                def process():
                    z = compute_z()
                    print(z)
                """;
        assertEquals(expected, Files.readString(file));
        assertEquals(expected, extracted.newContent());
    }

    @Test
    void testSuccessIsRecordedInHistory() throws IOException {
        Path file = write(PROCESS);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 4, "compute_z");

        String fixId = ((RefactorResult.Success<ExtractedFunction>) result).fixId();
        assertNotNull(fixId);
        List<FixRecord> fixes = history.getAllFixes();
        assertEquals(1, fixes.size());
        FixRecord record = fixes.get(0);
        assertEquals(fixId, record.id());
        assertEquals(ExtractFunctionRefactorer.KIND, record.kind());
        assertEquals(PROCESS, record.originalContent());
        assertEquals(Files.readString(file), record.newContent());
        assertEquals(file.toAbsolutePath().toString(), record.filePath());
        assertTrue(record.rollbackAvailable());
    }

    @Test
    void testInputsBecomeParameters() throws IOException {
        Path file = write(REPORT);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 4, "sum_prices");

        assertTrue(result.isSuccess());
        ExtractedFunction extracted = result.getValue();
        assertEquals(Set.of("items"), extracted.variables().inputs());
        assertEquals(Set.of("total"), extracted.variables().outputs());
        assertEquals(Set.of("item"), extracted.variables().locals());
        assertEquals("total = sum_prices(items)", extracted.callSite());
        assertTrue(extracted.definition().startsWith("def sum_prices(items):\n"));
        assertTrue(extracted.newContent().contains("""
                def report(items, rate):
                    total = sum_prices(items)
                    tax = total * rate
                """));
    }

    @Test
    void testWithoutReturn() throws IOException {
        Path file = write(REPORT);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 4, "sum_prices", false, false);

        assertTrue(result.isSuccess());
        assertEquals("sum_prices(items)", result.getValue().callSite());
        assertFalse(result.getValue().definition().contains("return"));
    }

    @Test
    void testExtractFromMethodPlacesFunctionBeforeClass() throws IOException {
        Path file = write("""
                class Cart:
                    def total(self):
                        subtotal = sum(self.prices)
                        return subtotal * 2
                """);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 3, 3, "compute_subtotal");

        assertTrue(result.isSuccess());
        assertEquals("""
                def compute_subtotal(self):
                    subtotal = sum(self.prices)
                    return subtotal


                class Cart:
                    def total(self):
                        subtotal = compute_subtotal(self)
                        return subtotal * 2
                """, Files.readString(file));
    }

    @Test
    void testDryRunLeavesFileAndHistoryUntouched() throws IOException {
        Path file = write(PROCESS);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 4, "compute_z", true, true);

        assertTrue(result.isSuccess());
        assertNull(((RefactorResult.Success<ExtractedFunction>) result).fixId());
        assertTrue(result.getValue().newContent().contains("def compute_z():"));
        assertEquals(PROCESS, Files.readString(file));
        assertTrue(history.getAllFixes().isEmpty());
    }

    @Test
    void testInvalidRanges() throws IOException {
        Path file = write(PROCESS);

        assertEquals(ErrorKind.INVALID_RANGE, refactorer.extractFunction(file, 0, 2, "f").getError().kind());
        assertEquals(ErrorKind.INVALID_RANGE, refactorer.extractFunction(file, 3, 2, "f").getError().kind());
        assertEquals(ErrorKind.INVALID_RANGE, refactorer.extractFunction(file, 2, 6, "f").getError().kind());
    }

    @Test
    void testRangeMustHoldWholeStatements() throws IOException {
        Path file = write(REPORT);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 3, 3, "loop_header");

        assertEquals(ErrorKind.INVALID_RANGE, result.getError().kind());
    }

    @Test
    void testInvalidFunctionNames() throws IOException {
        Path file = write(PROCESS);

        assertEquals(ErrorKind.INVALID_IDENTIFIER, refactorer.extractFunction(file, 2, 4, "2bad").getError().kind());
        assertEquals(ErrorKind.INVALID_IDENTIFIER, refactorer.extractFunction(file, 2, 4, "lambda").getError().kind());
        assertEquals(ErrorKind.INVALID_IDENTIFIER, refactorer.extractFunction(file, 2, 4, "_hidden").getError().kind());
    }

    @Test
    void testPrivateNamesAllowedWhenPermissive() throws IOException {
        Path file = write(PROCESS);
        ExtractFunctionRefactorer permissive = new ExtractFunctionRefactorer(RefactoringConfig.permissive(), history,
                BuiltinNames.standard());

        assertTrue(permissive.extractFunction(file, 2, 4, "_compute").isSuccess());
    }

    @Test
    void testNameAlreadyDefined() throws IOException {
        Path file = write(PROCESS + "\n\ndef compute_z():\n    return 0\n");

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 4, "compute_z");

        assertEquals(ErrorKind.ALREADY_EXISTS, result.getError().kind());
    }

    @Test
    void testReturnInsideSelectionIsRefused() throws IOException {
        Path file = write(REPORT);

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 5, 6, "finish");

        assertEquals(ErrorKind.UNSAFE_OPERATION, result.getError().kind());
    }

    @Test
    void testFailuresLeaveFileUnchanged() throws IOException {
        Path file = write(PROCESS);

        refactorer.extractFunction(file, 2, 4, "class");
        refactorer.extractFunction(file, 2, 9, "f");
        refactorer.extractFunction(file, 1, 2, "f");

        assertEquals(PROCESS, Files.readString(file));
        assertTrue(history.getAllFixes().isEmpty());
    }

    @Test
    void testSyntaxErrorInSource() throws IOException {
        Path file = write("def broken(:\n    pass\n");

        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(file, 2, 2, "f");

        assertEquals(ErrorKind.SYNTAX_ERROR_IN_SOURCE, result.getError().kind());
        assertEquals("def broken(:\n    pass\n", Files.readString(file));
    }

    @Test
    void testMissingFile() {
        RefactorResult<ExtractedFunction> result = refactorer.extractFunction(tempDir.resolve("absent.py"), 1, 1, "f");

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.FILE_NOT_FOUND, result.getError().kind());
        assertThrows(IllegalStateException.class, result::getValue);
    }

    @Test
    void testExtractionCandidates() throws IOException {
        Path file = write(REPORT + "\n\ndef short():\n    return 1\n");

        RefactorResult<List<ExtractionCandidate>> result = refactorer.analyzeExtractionCandidates(file, 3);

        assertTrue(result.isSuccess());
        List<ExtractionCandidate> candidates = result.getValue();
        assertEquals(1, candidates.size());
        ExtractionCandidate candidate = candidates.get(0);
        assertEquals("report", candidate.functionName());
        assertEquals(1, candidate.startLine());
        assertEquals(6, candidate.endLine());
        assertEquals("Long function 'report' (5 lines)", candidate.reason());
    }
}
