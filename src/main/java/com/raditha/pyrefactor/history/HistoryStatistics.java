package com.raditha.pyrefactor.history;

import java.util.Map;

/**
 * Summary counts over a fix history.
 *
 * @param totalFixes   number of records
 * @param filesFixed   number of distinct files
 * @param fixesByKind  number of records per refactoring kind
 */
public record HistoryStatistics(int totalFixes, int filesFixed, Map<String, Integer> fixesByKind) {

    public HistoryStatistics {
        fixesByKind = Map.copyOf(fixesByKind);
    }
}
