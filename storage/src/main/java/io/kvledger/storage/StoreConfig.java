// file: src/main/java/io/kvledger/storage/StoreConfig.java
package io.kvledger.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the store and its transaction log live, and whether reads are logged.
 *
 * Supports:
 *  - dataFile: JSON object with the whole mapping, replaced atomically on every write
 *  - logFile:  newline-delimited JSON transaction records, append-only
 *  - logReads: also record successful GETs (off by default)
 */
public record StoreConfig(Path dataFile, Path logFile, boolean logReads) {

    public static final Path DEFAULT_DATA_FILE = Path.of("data", "store.json");
    public static final Path DEFAULT_LOG_FILE = Path.of("data", "transactions.log");

    public StoreConfig {
        Objects.requireNonNull(dataFile, "dataFile");
        Objects.requireNonNull(logFile, "logFile");
        if (dataFile.toAbsolutePath().normalize().equals(logFile.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("dataFile and logFile must differ: " + dataFile);
        }
    }

    public static StoreConfig defaults() {
        return new StoreConfig(DEFAULT_DATA_FILE, DEFAULT_LOG_FILE, false);
    }

    /** Both files inside {@code dir}, with the default file names. */
    public static StoreConfig inDirectory(Path dir) {
        return new StoreConfig(dir.resolve(DEFAULT_DATA_FILE.getFileName()),
                dir.resolve(DEFAULT_LOG_FILE.getFileName()), false);
    }

    public StoreConfig withLogReads(boolean enabled) {
        return new StoreConfig(dataFile, logFile, enabled);
    }
}
