package com.raditha.pyrefactor.refactoring;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void testUnifiedDiff() {
        String diff = new DiffGenerator().generateUnifiedDiff("module.py", "a\nb\nc\n", "a\nB\nc\n", 3);

        assertEquals(String.join("\n",
                "--- a/module.py",
                "+++ b/module.py",
                "@@ -1,3 +1,3 @@",
                " a",
                "-b",
                "+B",
                " c"), diff);
    }

    @Test
    void testNoChanges() {
        assertEquals("", new DiffGenerator().generateUnifiedDiff("module.py", "x = 1\n", "x = 1\n", 3));
    }

    @Test
    void testDiffAgainstFile() throws IOException {
        Path file = tempDir.resolve("calc.py");
        Files.writeString(file, "def f():\n    return 1\n");

        String diff = new DiffGenerator(0).generateUnifiedDiff(file, "def f():\n    return 2\n");

        assertTrue(diff.startsWith("--- a/calc.py\n+++ b/calc.py\n"), diff);
        assertTrue(diff.contains("-    return 1"));
        assertTrue(diff.contains("+    return 2"));
        assertFalse(diff.contains(" def f():"), "No context lines requested");
    }
}
