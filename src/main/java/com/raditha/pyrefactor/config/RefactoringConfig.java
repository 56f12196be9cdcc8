package com.raditha.pyrefactor.config;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for the refactoring engine.
 *
 * @param indentUnit                  indentation added per nesting level in generated code
 * @param rejectPrivateNames          refuse extracted function names that start with an underscore
 * @param historyFile                 JSON file that keeps the fix history; in memory only when null
 * @param extractionCandidateMinLines functions longer than this are reported as extraction candidates
 * @param extraBuiltins               names treated as builtins in addition to the standard ones
 * @param diffContextLines            context lines around each hunk of a preview diff
 */
public record RefactoringConfig(
        String indentUnit,
        boolean rejectPrivateNames,
        @Nullable Path historyFile,
        int extractionCandidateMinLines,
        List<String> extraBuiltins,
        int diffContextLines) {

    public static final String DEFAULT_INDENT = "    ";

    /**
     * Validate configuration.
     */
    public RefactoringConfig {
        if (indentUnit == null || indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("indentUnit must be a non-empty run of spaces or tabs");
        }
        if (!indentUnit.chars().allMatch(c -> c == ' ') && !indentUnit.chars().allMatch(c -> c == '\t')) {
            throw new IllegalArgumentException("indentUnit must not mix spaces and tabs");
        }
        if (extractionCandidateMinLines < 1) {
            throw new IllegalArgumentException("extractionCandidateMinLines must be >= 1");
        }
        if (diffContextLines < 0) {
            throw new IllegalArgumentException("diffContextLines must be >= 0");
        }
        extraBuiltins = extraBuiltins == null ? List.of() : List.copyOf(extraBuiltins);
    }

    /**
     * Default preset: four space indentation, private names rejected,
     * history kept in memory.
     */
    public static RefactoringConfig defaults() {
        return new RefactoringConfig(
                DEFAULT_INDENT,
                true, // rejectPrivateNames
                null, // historyFile
                50, // extractionCandidateMinLines
                List.of(),
                3); // diffContextLines
    }

    /**
     * Permissive preset: like {@link #defaults()} but allows extracted names
     * with a leading underscore.
     */
    public static RefactoringConfig permissive() {
        return defaults().withRejectPrivateNames(false);
    }

    public RefactoringConfig withRejectPrivateNames(boolean reject) {
        return new RefactoringConfig(indentUnit, reject, historyFile, extractionCandidateMinLines,
                extraBuiltins, diffContextLines);
    }

    public RefactoringConfig withHistoryFile(@Nullable Path file) {
        return new RefactoringConfig(indentUnit, rejectPrivateNames, file, extractionCandidateMinLines,
                extraBuiltins, diffContextLines);
    }
}
