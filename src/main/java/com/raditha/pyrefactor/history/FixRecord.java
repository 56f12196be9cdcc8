package com.raditha.pyrefactor.history;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One applied refactoring, with enough content to undo it.
 *
 * @param id                id in the form {@code fix-yyyyMMddHHmmss-NNNN}
 * @param filePath          the file that was rewritten
 * @param kind              the refactoring that was applied, e.g. {@code extract_function}
 * @param originalContent   file content before the change
 * @param newContent        file content after the change
 * @param timestamp         when the change was written
 * @param description       one line summary for people
 * @param rollbackAvailable whether {@link FixHistory#rollback(String)} may restore it
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FixRecord(
        String id,
        String filePath,
        String kind,
        String originalContent,
        String newContent,
        Instant timestamp,
        String description,
        boolean rollbackAvailable) {
}
