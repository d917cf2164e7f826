// file: src/main/java/io/kvledger/storage/JsonFileStore.java
package io.kvledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvledger.core.CorruptedStoreException;
import io.kvledger.core.InvalidKeyException;
import io.kvledger.core.JsonValues;
import io.kvledger.core.KeyNotFoundException;
import io.kvledger.core.Operation;
import io.kvledger.core.StorePersistenceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.kvledger.core.TransactionRecord.*;

/**
 * Write-through key-value store persisted as one JSON object.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: key -> JSON value.
 *  - On write:
 *      1) Validate key and value before touching any state.
 *      2) Take the write lock.
 *      3) Build the next mapping and write it to disk (temp file, fsync, atomic rename).
 *      4) Only then apply it in memory.
 *      5) Release the lock and hand a record to the transaction log.
 * <p>
 *  - On startup:
 *      1) Drop a temp file left by an interrupted write.
 *      2) Load the data file; a missing or blank file is an empty store,
 *         anything that is not a JSON object is rejected.
 * <p>
 * Note:
 * The read-write lock is fair: once a writer waits, newly arriving readers queue
 * behind it, so a continuous stream of reads cannot starve writes.
 * The store never holds its lock while calling the log, and the log never
 * calls back into the store.
 */
public final class JsonFileStore implements KeyValueStore {
    private static final Logger log = Logger.getLogger(JsonFileStore.class.getName());
    private static final ObjectMapper MAPPER = JsonValues.mapper();

    // Values are never mutated after insertion; copies go out, copies come in.
    private final Map<String, JsonNode> mem = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final AtomicFileWriter writer;
    private final TransactionLog txLog;
    private final boolean logReads;

    public JsonFileStore(Path dataFile, TransactionLog txLog) {
        this(dataFile, txLog, false);
    }

    /**
     * @param dataFile JSON file holding the whole mapping
     * @param txLog    log receiving one record per mutation (and per read if enabled)
     * @param logReads whether successful gets are logged too
     */
    public JsonFileStore(Path dataFile, TransactionLog txLog, boolean logReads) {
        Objects.requireNonNull(dataFile, "dataFile");
        this.txLog = Objects.requireNonNull(txLog, "txLog");
        this.logReads = logReads;
        try {
            this.writer = new AtomicFileWriter(dataFile);
            writer.discardStaleTemp();
        } catch (IOException e) {
            throw new StorePersistenceException("cannot prepare data file " + dataFile, e);
        }
        load();
        log.log(Level.INFO, "Opened store " + writer.target() + " (" + mem.size() + " keys)");
    }

    @Override
    public JsonNode put(String key, Object value) {
        long start = System.nanoTime();
        requireKey(key);
        JsonNode node = JsonValues.toNode(value);

        JsonNode old;
        lock.writeLock().lock();
        try {
            old = mem.get(key);
            Map<String, JsonNode> next = new LinkedHashMap<>(mem);
            next.put(key, node);
            persist(next);
            mem.put(key, node);
        } finally {
            lock.writeLock().unlock();
        }

        audit(Operation.PUT, key, node, old, start, null);
        return JsonValues.copy(old);
    }

    @Override
    public JsonNode get(String key) {
        long start = System.nanoTime();
        requireKey(key);

        JsonNode found;
        lock.readLock().lock();
        try {
            found = mem.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (found == null) {
            throw new KeyNotFoundException(key);
        }

        if (logReads) {
            audit(Operation.GET, key, null, null, start, null);
        }
        return found.deepCopy();
    }

    @Override
    public JsonNode delete(String key) {
        long start = System.nanoTime();
        requireKey(key);

        JsonNode old;
        lock.writeLock().lock();
        try {
            old = mem.get(key);
            if (old == null) {
                throw new KeyNotFoundException(key);
            }
            Map<String, JsonNode> next = new LinkedHashMap<>(mem);
            next.remove(key);
            persist(next);
            mem.remove(key);
        } finally {
            lock.writeLock().unlock();
        }

        audit(Operation.DELETE, key, null, old, start, null);
        return old.deepCopy();
    }

    @Override
    public int clear() {
        long start = System.nanoTime();

        int removed;
        lock.writeLock().lock();
        try {
            removed = mem.size();
            persist(Map.of());
            mem.clear();
        } finally {
            lock.writeLock().unlock();
        }

        audit(Operation.CLEAR, null, null, null, start, removed);
        return removed;
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);
        lock.readLock().lock();
        try {
            return mem.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> keys() {
        lock.readLock().lock();
        try {
            return List.copyOf(mem.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<JsonNode> values() {
        List<JsonNode> shallow;
        lock.readLock().lock();
        try {
            shallow = new ArrayList<>(mem.values());
        } finally {
            lock.readLock().unlock();
        }
        List<JsonNode> out = new ArrayList<>(shallow.size());
        for (JsonNode v : shallow) {
            out.add(v.deepCopy());
        }
        return out;
    }

    @Override
    public Map<String, JsonNode> items() {
        Map<String, JsonNode> shallow;
        lock.readLock().lock();
        try {
            shallow = new LinkedHashMap<>(mem);
        } finally {
            lock.readLock().unlock();
        }
        shallow.replaceAll((k, v) -> v.deepCopy());
        return shallow;
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return mem.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Serialize the given mapping and atomically replace the data file.
     * Caller holds the write lock and has not yet touched {@code mem}.
     */
    private void persist(Map<String, JsonNode> next) {
        ObjectNode root = MAPPER.createObjectNode();
        root.setAll(next);
        try {
            writer.write(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to persist store to " + writer.target(), e);
            throw new StorePersistenceException("cannot write data file " + writer.target(), e);
        }
    }

    private void load() {
        Path file = writer.target();
        if (!Files.exists(file)) {
            return;
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorruptedStoreException("cannot read data file " + file, e);
        }
        if (content.isBlank()) {
            return;
        }

        JsonNode root;
        try {
            root = JsonValues.parseStrict(content);
        } catch (JsonProcessingException e) {
            throw new CorruptedStoreException("data file " + file + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptedStoreException("data file " + file + " must hold a JSON object");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            mem.put(e.getKey(), e.getValue());
        }
    }

    /**
     * Append the audit record for a finished operation. Runs outside the store lock.
     * A failure here surfaces to the caller; the store change itself stays.
     */
    private void audit(Operation op, String key, JsonNode value, JsonNode old, long startNanos, Integer removed) {
        Thread t = Thread.currentThread();
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(META_THREAD, t.getName());
        meta.put(META_THREAD_ID, t.getId());
        meta.put(META_DURATION_MS, (System.nanoTime() - startNanos) / 1_000_000.0);
        if (removed != null) {
            meta.put(META_REMOVED_COUNT, removed);
        }
        txLog.log(op, key, value, old, meta);
        log.log(Level.FINE, () -> op + " " + (key == null ? "*" : key));
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new InvalidKeyException(null, "key must not be null");
        }
        if (key.isBlank()) {
            throw new InvalidKeyException(key, "key must not be empty");
        }
    }
}
