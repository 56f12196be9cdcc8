package com.raditha.pyrefactor.history;

import java.util.List;
import java.util.Optional;

/**
 * Sink for applied refactorings.
 */
public interface FixHistory {

    void record(FixRecord record);

    /**
     * Writes the original content of the fix back to its file.
     *
     * @return false when the id is unknown, the record does not allow rollback,
     *         the file no longer exists or it cannot be written
     */
    boolean rollback(String id);

    /**
     * All records, newest first.
     */
    List<FixRecord> getAllFixes();

    List<FixRecord> getFixesForFile(String filePath);

    Optional<FixRecord> getFixById(String id);

    HistoryStatistics getStatistics();

    void clear();
}
