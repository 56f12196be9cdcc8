package com.raditha.pyrefactor.history;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFixHistoryTest {

    @TempDir
    Path tempDir;

    private InMemoryFixHistory history;

    @BeforeEach
    void setUp() {
        history = new InMemoryFixHistory();
    }

    static FixRecord record(String id, Path file, String kind, long second, boolean rollback) {
        return new FixRecord(id, file.toAbsolutePath().toString(), kind, "before\n", "after\n",
                Instant.ofEpochSecond(second), "Changed " + file.getFileName(), rollback);
    }

    @Test
    void testNewestFirst() {
        Path a = tempDir.resolve("a.py");
        history.record(record("fix-1", a, "extract_function", 100, true));
        history.record(record("fix-2", a, "inline_function", 300, true));
        history.record(record("fix-3", a, "move_method", 200, true));

        assertEquals(List.of("fix-2", "fix-3", "fix-1"), history.getAllFixes().stream().map(FixRecord::id).toList());
    }

    @Test
    void testQueries() {
        Path a = tempDir.resolve("a.py");
        Path b = tempDir.resolve("b.py");
        history.record(record("fix-1", a, "extract_function", 100, true));
        history.record(record("fix-2", b, "extract_function", 200, true));
        history.record(record("fix-3", a, "constructor_injection", 300, true));

        assertEquals(List.of("fix-3", "fix-1"),
                history.getFixesForFile(a.toAbsolutePath().toString()).stream().map(FixRecord::id).toList());
        assertEquals("extract_function", history.getFixById("fix-2").orElseThrow().kind());
        assertTrue(history.getFixById("fix-9").isEmpty());

        HistoryStatistics statistics = history.getStatistics();
        assertEquals(3, statistics.totalFixes());
        assertEquals(2, statistics.filesFixed());
        assertEquals(Map.of("extract_function", 2, "constructor_injection", 1), statistics.fixesByKind());
    }

    @Test
    void testRollback() throws IOException {
        Path file = tempDir.resolve("a.py");
        Files.writeString(file, "after\n");
        history.record(record("fix-1", file, "inline_function", 100, true));

        assertTrue(history.rollback("fix-1"));
        assertEquals("before\n", Files.readString(file));
    }

    @Test
    void testRollbackRefused() throws IOException {
        Path file = tempDir.resolve("a.py");
        Files.writeString(file, "after\n");
        history.record(record("fix-1", file, "inline_function", 100, false));
        history.record(record("fix-2", tempDir.resolve("gone.py"), "inline_function", 200, true));

        assertFalse(history.rollback("fix-1"), "Rollback not allowed");
        assertFalse(history.rollback("fix-2"), "File missing");
        assertFalse(history.rollback("fix-3"), "Unknown id");
        assertEquals("after\n", Files.readString(file));
    }

    @Test
    void testClear() {
        history.record(record("fix-1", tempDir.resolve("a.py"), "move_method", 100, true));

        history.clear();

        assertTrue(history.getAllFixes().isEmpty());
        assertEquals(0, history.getStatistics().totalFixes());
    }
}
