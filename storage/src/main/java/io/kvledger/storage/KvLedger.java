// file: src/main/java/io/kvledger/storage/KvLedger.java
package io.kvledger.storage;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Open/close scope for one store and its transaction log.
 * <p>
 * Wiring:
 *  - the log is opened first, then a store that records into it;
 *  - if the store fails to load, the already opened log is closed again;
 *  - close() releases the log file.
 * <p>
 * There is no process-wide default instance: whoever opens a ledger passes it
 * (or its store and log) to the code that needs it.
 */
public final class KvLedger implements AutoCloseable {
    private static final Logger log = Logger.getLogger(KvLedger.class.getName());

    private final StoreConfig config;
    private final FileTransactionLogger txLog;
    private final JsonFileStore store;

    private KvLedger(StoreConfig config, FileTransactionLogger txLog, JsonFileStore store) {
        this.config = config;
        this.txLog = txLog;
        this.store = store;
    }

    public static KvLedger open(StoreConfig config) {
        Objects.requireNonNull(config, "config");
        var txLog = new FileTransactionLogger(config.logFile());
        try {
            var store = new JsonFileStore(config.dataFile(), txLog, config.logReads());
            return new KvLedger(config, txLog, store);
        } catch (RuntimeException e) {
            try {
                txLog.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    public KeyValueStore store() {
        return store;
    }

    public TransactionLog log() {
        return txLog;
    }

    public StoreConfig config() {
        return config;
    }

    @Override
    public void close() {
        txLog.close();
        log.log(Level.FINE, () -> "Closed ledger " + config.dataFile());
    }
}
