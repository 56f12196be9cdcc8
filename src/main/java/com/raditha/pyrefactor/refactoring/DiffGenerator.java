package com.raditha.pyrefactor.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.pyrefactor.util.Indentation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates unified diffs for refactoring previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private final int contextLines;

    public DiffGenerator() {
        this(3);
    }

    public DiffGenerator(int contextLines) {
        this.contextLines = contextLines;
    }

    /**
     * Diff between the current content of {@code originalFile} and {@code refactoredCode}.
     */
    public String generateUnifiedDiff(Path originalFile, String refactoredCode) throws IOException {
        return generateUnifiedDiff(originalFile, refactoredCode, contextLines);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(Path originalFile, String refactoredCode, int context) throws IOException {
        String original = Files.readString(originalFile, StandardCharsets.UTF_8);
        return generateUnifiedDiff(originalFile.getFileName().toString(), original, refactoredCode, context);
    }

    /**
     * Diff of two versions of a file's text; empty when they are equal.
     */
    public String generateUnifiedDiff(String fileName, String original, String revised, int context) {
        List<String> before = contentLines(original);
        List<String> after = contentLines(revised);

        Patch<String> patch = DiffUtils.diff(before, after);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                before,
                patch,
                context);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> contentLines(String text) {
        List<String> lines = Indentation.lines(text);
        return text.endsWith("\n") ? lines.subList(0, lines.size() - 1) : lines;
    }
}
