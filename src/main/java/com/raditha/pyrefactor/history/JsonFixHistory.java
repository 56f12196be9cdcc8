package com.raditha.pyrefactor.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * History kept as a JSON array in a file. Every operation reads the file
 * afresh so that separate invocations of the command line tool see each
 * other's records.
 */
public class JsonFixHistory extends AbstractFixHistory {

    private static final Logger logger = LoggerFactory.getLogger(JsonFixHistory.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path historyFile;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonFixHistory(Path historyFile) {
        this.historyFile = historyFile;
    }

    public Path getHistoryFile() {
        return historyFile;
    }

    @Override
    protected List<FixRecord> load() {
        lock.readLock().lock();
        try {
            return read();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void record(FixRecord record) {
        lock.writeLock().lock();
        try {
            List<FixRecord> records = new ArrayList<>(read());
            records.add(record);
            write(records);
            logger.debug("Recorded {} in {}", record.id(), historyFile);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean rollback(String id) {
        lock.writeLock().lock();
        try {
            return super.rollback(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            write(List.of());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<FixRecord> read() {
        if (!Files.exists(historyFile)) {
            return List.of();
        }
        try {
            List<FixRecord> records = mapper.readValue(historyFile.toFile(), new TypeReference<List<FixRecord>>() {
            });
            return records == null ? List.of() : records;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fix history " + historyFile, e);
        }
    }

    private void write(List<FixRecord> records) {
        try {
            Path parent = historyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(historyFile.toFile(), records);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write fix history " + historyFile, e);
        }
    }
}
