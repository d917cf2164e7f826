// file: src/main/java/io/kvledger/storage/FileTransactionLogger.java
package io.kvledger.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvledger.core.CorruptedLogException;
import io.kvledger.core.LogPersistenceException;
import io.kvledger.core.LogQuery;
import io.kvledger.core.Operation;
import io.kvledger.core.StatsSummary;
import io.kvledger.core.TransactionRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed transaction log: one JSON record per line, appended and fsynced.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the parent directory if needed,
 *      - reads every existing line (fail-fast on the first malformed one),
 *      - continues ids from the highest id found (0 for an empty file),
 *      - opens the file for append and terminates an unterminated last line.
 * <p>
 *  - log():
 *      - under the write lock: build and encode the record, take the next id,
 *        append, force, add in memory.
 *      - a record that cannot be built or encoded takes no id.
 *      - a failed write consumes the id (ids are never reused) and the file is
 *        cut back to its length before the write.
 * <p>
 *  - show()/stats():
 *      - under the read lock, over the in-memory copy; the file is not re-read.
 * <p>
 *  - clearLog():
 *      - truncates the file and resets the id counter to 0.
 * <p>
 * The lock is fair, so a steady stream of queries cannot hold back appends.
 */
public final class FileTransactionLogger implements TransactionLog {
    private static final Logger log = Logger.getLogger(FileTransactionLogger.class.getName());

    private final Path file;
    private final Clock clock;
    private final List<TransactionRecord> records = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final FileChannel ch;
    private long lastId = 0;

    /** Opens the append channel; tests substitute one that fails. */
    @FunctionalInterface
    interface ChannelOpener {
        FileChannel open(Path file) throws IOException;
    }

    public FileTransactionLogger(Path file) {
        this(file, Clock.systemUTC());
    }

    public FileTransactionLogger(Path file, Clock clock) {
        this(file, clock, f -> FileChannel.open(f, CREATE, WRITE, APPEND));
    }

    FileTransactionLogger(Path file, Clock clock, ChannelOpener opener) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Path parent = this.file.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new LogPersistenceException("cannot create directory for " + this.file, e);
        }
        boolean unterminated = load();
        try {
            ch = opener.open(this.file);
        } catch (IOException e) {
            throw new LogPersistenceException("cannot open transaction log " + this.file, e);
        }
        if (unterminated) {
            terminateLastLine();
        }
        log.log(Level.INFO, "Opened transaction log " + this.file
                + " (" + records.size() + " records, last id " + lastId + ")");
    }

    @Override
    public TransactionRecord log(Operation operation,
                                 String key,
                                 JsonNode value,
                                 JsonNode oldValue,
                                 Map<String, Object> metadata) {
        Objects.requireNonNull(operation, "operation");
        lock.writeLock().lock();
        try {
            long id = lastId + 1;
            var rec = new TransactionRecord(id, operation, clock.instant(), key, value, oldValue, metadata);
            byte[] line = RecordCodec.encode(rec);
            lastId = id;
            long before = -1;
            try {
                before = ch.size();
                ByteBuffer buf = ByteBuffer.wrap(line);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(false);
            } catch (IOException e) {
                if (before >= 0) cutBack(before, e);
                log.log(Level.WARNING, "Failed to append transaction " + id + " to " + file, e);
                throw new LogPersistenceException("cannot append transaction " + id + " to " + file, e);
            }
            records.add(rec);
            log.log(Level.FINE, () -> "Logged #" + id + " " + operation + " " + key);
            return rec;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<TransactionRecord> show(LogQuery query) {
        LogQuery q = query == null ? LogQuery.all() : query;
        List<TransactionRecord> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (TransactionRecord r : records) {
                if (q.matches(r)) matched.add(r);
            }
        } finally {
            lock.readLock().unlock();
        }
        if (q.limit() != null && matched.size() > q.limit()) {
            return List.copyOf(matched.subList(matched.size() - q.limit(), matched.size()));
        }
        return List.copyOf(matched);
    }

    @Override
    public StatsSummary stats() {
        lock.readLock().lock();
        try {
            return StatsSummary.of(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int clearLog() {
        lock.writeLock().lock();
        try {
            int removed = records.size();
            try {
                ch.truncate(0);
                ch.force(true);
            } catch (IOException e) {
                log.log(Level.WARNING, "Failed to truncate " + file, e);
                throw new LogPersistenceException("cannot truncate transaction log " + file, e);
            }
            records.clear();
            lastId = 0;
            log.log(Level.INFO, "Cleared transaction log " + file + " (" + removed + " records)");
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Highest id handed out so far; 0 after a clear or for a fresh log. */
    public long lastId() {
        lock.readLock().lock();
        try {
            return lastId;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new LogPersistenceException("cannot close transaction log " + file, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drop a partly written line so the next append starts on a clean line. */
    private void cutBack(long size, IOException cause) {
        try {
            ch.truncate(size);
            ch.force(false);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    /** The last record was complete but its newline never reached the file. */
    private void terminateLastLine() {
        try {
            ch.write(ByteBuffer.wrap(new byte[]{'\n'}));
            ch.force(false);
        } catch (IOException e) {
            try {
                ch.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new LogPersistenceException("cannot terminate last line of " + file, e);
        }
        log.log(Level.INFO, "Added missing final newline to " + file);
    }

    /**
     * Read the existing file into memory.
     * Any malformed line aborts startup; nothing is skipped or repaired.
     *
     * @return true if the file is non-empty and does not end with a newline
     */
    private boolean load() {
        if (!Files.exists(file)) return false;
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNo = 0;
            for (String line; (line = r.readLine()) != null; ) {
                lineNo++;
                if (line.isBlank()) continue;
                TransactionRecord rec = RecordCodec.decode(line, lineNo);
                if (rec.transactionId() <= lastId) {
                    throw new CorruptedLogException("line " + lineNo + ": transaction_id "
                            + rec.transactionId() + " does not follow " + lastId);
                }
                records.add(rec);
                lastId = rec.transactionId();
            }
        } catch (IOException e) {
            throw new CorruptedLogException("cannot read transaction log " + file, e);
        }
        return !endsWithNewline();
    }

    private boolean endsWithNewline() {
        try (FileChannel in = FileChannel.open(file, READ)) {
            long size = in.size();
            if (size == 0) return true;
            ByteBuffer last = ByteBuffer.allocate(1);
            in.read(last, size - 1);
            return last.get(0) == '\n';
        } catch (IOException e) {
            throw new CorruptedLogException("cannot read transaction log " + file, e);
        }
    }
}
