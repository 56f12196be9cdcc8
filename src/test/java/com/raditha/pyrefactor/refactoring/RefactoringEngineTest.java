package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.history.FixRecord;
import com.raditha.pyrefactor.history.JsonFixHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RefactoringEngineTest {

    @TempDir
    Path tempDir;

    @Mock
    FixHistory history;

    private RefactoringEngine engine;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        engine = new RefactoringEngine(RefactoringConfig.defaults(), history);
        file = tempDir.resolve("calc.py");
        Files.writeString(file, """
                def double(x):
                    return x * 2


                result = double(5)
                """);
    }

    @Test
    void testAppliedRefactoringIsRecorded() throws IOException {
        RefactorResult<InlinedFunction> result = engine.inlineFunction(file, "double", true, false);

        assertTrue(result.isSuccess());
        ArgumentCaptor<FixRecord> captor = ArgumentCaptor.forClass(FixRecord.class);
        verify(history).record(captor.capture());
        FixRecord record = captor.getValue();
        assertEquals(InlineFunctionRefactorer.KIND, record.kind());
        assertEquals(file.toAbsolutePath().toString(), record.filePath());
        assertEquals("result = 5 * 2\n", record.newContent());
        assertEquals(record.newContent(), Files.readString(file));
        assertTrue(record.id().startsWith("fix-"));
    }

    @Test
    void testDryRunIsNotRecorded() {
        RefactorResult<InlinedFunction> result = engine.inlineFunction(file, "double", true, true);

        assertTrue(result.isSuccess());
        verify(history, never()).record(any());
    }

    @Test
    void testFailureIsNotRecorded() {
        RefactorResult<InlinedFunction> result = engine.inlineFunction(file, "triple", true, false);

        assertFalse(result.isSuccess());
        verify(history, never()).record(any());
    }

    @Test
    void testPreview() throws IOException {
        InlinedFunction inlined = engine.inlineFunction(file, "double", true, true).getValue();

        String diff = engine.preview(file, inlined.newContent());

        assertTrue(diff.startsWith("--- a/calc.py"));
        assertTrue(diff.contains("+result = 5 * 2"));
    }

    @Test
    void testHistoryFromConfig() {
        Path historyFile = tempDir.resolve("history.json");
        RefactoringEngine configured = new RefactoringEngine(RefactoringConfig.defaults().withHistoryFile(historyFile));

        JsonFixHistory json = assertInstanceOf(JsonFixHistory.class, configured.getHistory());
        assertEquals(historyFile, json.getHistoryFile());
        assertSame(history, engine.getHistory());
    }
}
