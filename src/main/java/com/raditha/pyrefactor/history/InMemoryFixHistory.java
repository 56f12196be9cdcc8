package com.raditha.pyrefactor.history;

import java.util.ArrayList;
import java.util.List;

/**
 * History that lives as long as the process.
 */
public class InMemoryFixHistory extends AbstractFixHistory {

    private final List<FixRecord> records = new ArrayList<>();

    @Override
    protected synchronized List<FixRecord> load() {
        return List.copyOf(records);
    }

    @Override
    public synchronized void record(FixRecord record) {
        records.add(record);
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }
}
