package com.raditha.pyrefactor.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RefactoringSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("pyrefactor.yml");
        Files.writeString(file, """
                refactoring:
                  indent_unit: "  "
                  reject_private_names: false
                  history_file: state/history.json
                  extraction_candidate_min_lines: 20
                  extra_builtins: [settings, app]
                  diff_context_lines: 1
                """);

        RefactoringConfig config = RefactoringSettings.loadConfig(file);

        assertEquals("  ", config.indentUnit());
        assertFalse(config.rejectPrivateNames());
        assertEquals(Path.of("state/history.json"), config.historyFile());
        assertEquals(20, config.extractionCandidateMinLines());
        assertEquals(List.of("settings", "app"), config.extraBuiltins());
        assertEquals(1, config.diffContextLines());
    }

    @Test
    void testOverridesWinOverFile() throws IOException {
        Path file = tempDir.resolve("pyrefactor.yml");
        Files.writeString(file, """
                refactoring:
                  reject_private_names: false
                  extraction_candidate_min_lines: 20
                """);
        Path history = tempDir.resolve("h.json");

        RefactoringConfig config = RefactoringSettings.loadConfig(file,
                new RefactoringSettings.Overrides("\t", true, history, 5));

        assertEquals("\t", config.indentUnit());
        assertTrue(config.rejectPrivateNames());
        assertEquals(history, config.historyFile());
        assertEquals(5, config.extractionCandidateMinLines());
    }

    @Test
    void testFileWithoutSection() throws IOException {
        Path file = tempDir.resolve("other.yml");
        Files.writeString(file, "something_else:\n  key: 1\n");

        assertEquals(RefactoringConfig.defaults(), RefactoringSettings.loadConfig(file));
    }

    @Test
    void testMissingExplicitFile() {
        Path missing = tempDir.resolve("missing.yml");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RefactoringSettings.loadConfig(missing));
        assertTrue(e.getMessage().contains("missing.yml"));
    }

    @Test
    void testMalformedFile() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "refactoring: [unclosed\n");

        assertThrows(IllegalArgumentException.class, () -> RefactoringSettings.loadConfig(file));
    }

    @Test
    void testBuildIgnoresWrongTypes() {
        RefactoringConfig config = RefactoringSettings.build(
                Map.of("reject_private_names", "no", "diff_context_lines", "many"),
                RefactoringSettings.Overrides.none());

        assertTrue(config.rejectPrivateNames());
        assertEquals(3, config.diffContextLines());
    }
}
