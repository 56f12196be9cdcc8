package com.raditha.pyrefactor.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.Map;

/**
 * Queries and rollback on top of a store that can load and save the whole
 * list of records.
 */
public abstract class AbstractFixHistory implements FixHistory {

    private static final Logger logger = LoggerFactory.getLogger(AbstractFixHistory.class);

    /**
     * Records in insertion order.
     */
    protected abstract List<FixRecord> load();

    @Override
    public List<FixRecord> getAllFixes() {
        return load().stream()
                .sorted(Comparator.comparing(FixRecord::timestamp).reversed())
                .toList();
    }

    @Override
    public List<FixRecord> getFixesForFile(String filePath) {
        return getAllFixes().stream()
                .filter(r -> r.filePath().equals(filePath))
                .toList();
    }

    @Override
    public Optional<FixRecord> getFixById(String id) {
        return load().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    @Override
    public boolean rollback(String id) {
        Optional<FixRecord> found = getFixById(id);
        if (found.isEmpty()) {
            logger.warn("No fix with id {}", id);
            return false;
        }
        FixRecord record = found.get();
        if (!record.rollbackAvailable()) {
            logger.warn("Fix {} cannot be rolled back", id);
            return false;
        }
        Path file = Path.of(record.filePath());
        if (!Files.exists(file)) {
            logger.warn("Cannot roll back {}: {} no longer exists", id, file);
            return false;
        }
        try {
            Files.writeString(file, record.originalContent(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Cannot roll back {}: {}", id, e.getMessage());
            return false;
        }
        logger.info("Rolled back {} on {}", id, file);
        return true;
    }

    @Override
    public HistoryStatistics getStatistics() {
        List<FixRecord> records = load();
        Set<String> files = new HashSet<>();
        Map<String, Integer> byKind = new TreeMap<>();
        for (FixRecord record : records) {
            files.add(record.filePath());
            byKind.merge(record.kind(), 1, Integer::sum);
        }
        return new HistoryStatistics(records.size(), files.size(), byKind);
    }
}
