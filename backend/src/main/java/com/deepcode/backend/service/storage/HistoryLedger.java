package com.deepcode.backend.service.storage;

import com.deepcode.backend.config.DeepCodeProperties;
import com.deepcode.backend.domain.HistoryEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, append-only log of processing outcomes kept in a single JSON array file.
 * Every mutation re-reads the file, applies the change and swaps a fully written temp file in place,
 * so a reader never sees a half-written ledger.
 */
@Component
public class HistoryLedger {

    public static final int MAX_ENTRIES = 50;

    private static final Logger log = LoggerFactory.getLogger(HistoryLedger.class);
    private static final TypeReference<List<HistoryEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final ObjectMapper om;
    private final Path filePath;
    private final int maxEntries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    @Autowired
    public HistoryLedger(ObjectMapper om, DeepCodeProperties props) {
        this(om, props.storage().historyFile(), MAX_ENTRIES);
    }

    public HistoryLedger(ObjectMapper om, Path filePath, int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be positive");
        this.om = om;
        this.filePath = filePath.toAbsolutePath();
        this.maxEntries = maxEntries;
    }

    public Path filePath() {
        return filePath;
    }

    /** Entries in insertion order, oldest first. */
    public List<HistoryEntry> list() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(read());
        } finally {
            lock.readLock().unlock();
        }
    }

    public HistoryEntry append(HistoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            List<HistoryEntry> items = read();
            items.add(entry);
            if (items.size() > maxEntries) {
                items = new ArrayList<>(items.subList(items.size() - maxEntries, items.size()));
            }
            write(items);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            write(List.of());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<HistoryEntry> read() {
        if (!Files.exists(filePath)) {
            return new ArrayList<>();
        }
        try {
            byte[] raw = Files.readAllBytes(filePath);
            if (raw.length == 0) {
                return new ArrayList<>();
            }
            List<HistoryEntry> items = om.readValue(raw, ENTRY_LIST);
            return items == null ? new ArrayList<>() : new ArrayList<>(items);
        } catch (IOException e) {
            log.warn("History file {} is unreadable, starting from an empty ledger: {}", filePath, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void write(List<HistoryEntry> items) {
        Path tmp = null;
        try {
            Path dir = filePath.getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, filePath.getFileName().toString(), ".tmp");
            Files.write(tmp, om.writerWithDefaultPrettyPrinter().writeValueAsBytes(items));
            try {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new HistoryPersistenceException("failed to write history file " + filePath, e);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not remove temp history file {}", p, e);
        }
    }
}
