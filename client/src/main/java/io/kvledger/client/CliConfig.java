// file: client/src/main/java/io/kvledger/client/CliConfig.java
package io.kvledger.client;

import io.kvledger.storage.StoreConfig;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Global options plus the command words that follow them.
 *
 * Supports:
 *  - dataFile: JSON data file (default: ./data/store.json)
 *  - logFile:  transaction log file (default: ./data/transactions.log)
 *  - logReads: record GET operations in the transaction log
 *  - verbose:  lower log level to FINE for io.kvledger
 *  - help:     print usage and stop
 *  - command:  everything after the options, e.g. ["put", "a", "1"]
 */
public record CliConfig(
        Path dataFile,
        Path logFile,
        boolean logReads,
        boolean verbose,
        boolean help,
        List<String> command
) {

    public CliConfig {
        command = List.copyOf(command);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags (must precede the command):
     *   --data-file, -d  <path>
     *   --log-file,  -l  <path>
     *   --log-reads
     *   --verbose,   -v
     *   --help,      -h
     */
    public static CliConfig fromArgs(String[] args) {
        Path dataFile = StoreConfig.DEFAULT_DATA_FILE;
        Path logFile = StoreConfig.DEFAULT_LOG_FILE;
        boolean logReads = false;
        boolean verbose = false;
        boolean help = false;

        int i = 0;
        for (; i < args.length && args[i].startsWith("-"); i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--data-file", "-d" -> {
                    ensureValue(args, i);
                    dataFile = Path.of(args[++i]);
                }

                case "--log-file", "-l" -> {
                    ensureValue(args, i);
                    logFile = Path.of(args[++i]);
                }

                case "--log-reads" -> logReads = true;

                case "--verbose", "-v" -> verbose = true;

                default -> throw new CliException("unknown option: " + args[i]);
            }
        }
        List<String> command = Arrays.asList(args).subList(i, args.length);
        return new CliConfig(dataFile, logFile, logReads, verbose, help, command);
    }

    public StoreConfig storeConfig() {
        return new StoreConfig(dataFile, logFile, logReads);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
    }
}
