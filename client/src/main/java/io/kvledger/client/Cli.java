// file: client/src/main/java/io/kvledger/client/Cli.java
package io.kvledger.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.kvledger.core.JsonValues;
import io.kvledger.core.KvStoreException;
import io.kvledger.core.LogQuery;
import io.kvledger.core.Operation;
import io.kvledger.core.StatsSummary;
import io.kvledger.core.TransactionRecord;
import io.kvledger.storage.KeyValueStore;
import io.kvledger.storage.KvLedger;
import io.kvledger.storage.RecordCodec;
import io.kvledger.storage.TransactionLog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line front end running against a local store and transaction log.
 *
 * Usage:
 *   kvledger [options] put <key> <value>
 *   kvledger [options] get <key>
 *   kvledger [options] delete <key>
 *   kvledger [options] list | size | clear
 *   kvledger [options] log show [operation|*] [key|*] [limit]
 *   kvledger [options] log stats | log clear
 *   kvledger [options]                 (interactive session)
 *
 * Examples:
 *   kvledger put user:1 '{"name":"ann"}'
 *   kvledger get user:1
 *   kvledger log show PUT user:1 10
 */
public final class Cli {
    private static final String ANY = "*";
    private static final String PROMPT = "kvledger> ";

    // Held so the level set in configureLogging is not lost to GC.
    private static final Logger ROOT = Logger.getLogger("io.kvledger");

    private final ObjectMapper json = JsonValues.mapper();
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public Cli(PrintStream out, PrintStream err) {
        this(System.in, out, err);
    }

    public Cli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Cli(System.in, System.out, System.err).run(args));
    }

    /**
     * Parse options, open the ledger, run one command (or an interactive
     * session when no command is given), close the ledger.
     *
     * @return process exit code: 0 on success, 1 on usage or store errors
     */
    public int run(String[] args) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.help()) {
                usage(out, null);
                return 0;
            }
            configureLogging(cfg.verbose());
            try (KvLedger ledger = KvLedger.open(cfg.storeConfig())) {
                if (cfg.command().isEmpty()) {
                    interactive(ledger);
                } else {
                    dispatch(ledger.store(), ledger.log(), cfg.command());
                }
            }
            return 0;
        } catch (CliException e) {
            usage(err, e.getMessage());
            return 1;
        } catch (KvStoreException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Read commands line by line until exit, quit, q or end of input.
     * A failing command prints its error and the session goes on.
     * Every completed write is already on disk, so Ctrl-C loses nothing.
     */
    private void interactive(KvLedger ledger) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, Charset.defaultCharset()));
        out.println("kvledger interactive session");
        out.println("Type 'help' for commands, 'exit' to leave");
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("cannot read standard input", e);
            }
            if (line == null) {
                out.println();
                out.println("Bye");
                return;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            String word = line.toLowerCase(Locale.ROOT);
            if (word.equals("exit") || word.equals("quit") || word.equals("q")) {
                out.println("Bye");
                return;
            }
            if (word.equals("help") || word.equals("?")) {
                usage(out, null);
                continue;
            }
            try {
                dispatch(ledger.store(), ledger.log(), words(line));
            } catch (CliException e) {
                err.println("error: " + e.getMessage() + " (type 'help' for usage)");
            } catch (KvStoreException | IllegalArgumentException e) {
                err.println("error: " + e.getMessage());
            }
        }
    }

    /**
     * Split an interactive line on whitespace. For put, everything after the
     * key is the value, so {@code put user {"name": "ann"}} keeps its spaces.
     */
    static List<String> words(String line) {
        String trimmed = line.trim();
        int limit = trimmed.split("\\s+", 2)[0].equals("put") ? 3 : 0;
        return Arrays.asList(trimmed.split("\\s+", limit));
    }

    private void dispatch(KeyValueStore store, TransactionLog txLog, List<String> cmd) {
        String name = cmd.get(0);
        switch (name) {
            case "put" -> {
                requireArgs(cmd, 3, "put requires <key> <value>");
                JsonNode value = parseValue(cmd.get(2));
                JsonNode old = store.put(cmd.get(1), value);
                out.println(old == null
                        ? "OK"
                        : "OK (replaced " + compact(old) + ")");
            }
            case "get" -> {
                requireArgs(cmd, 2, "get requires <key>");
                out.println(pretty(store.get(cmd.get(1))));
            }
            case "delete", "del" -> {
                requireArgs(cmd, 2, "delete requires <key>");
                JsonNode old = store.delete(cmd.get(1));
                out.println("Deleted " + cmd.get(1) + " (was " + compact(old) + ")");
            }
            case "list" -> {
                requireArgs(cmd, 1, "list takes no arguments");
                Map<String, JsonNode> items = store.items();
                if (items.isEmpty()) {
                    out.println("(empty)");
                    return;
                }
                items.forEach((k, v) -> out.println(k + ": " + compact(v)));
            }
            case "size" -> {
                requireArgs(cmd, 1, "size takes no arguments");
                out.println(store.size());
            }
            case "clear" -> {
                requireArgs(cmd, 1, "clear takes no arguments");
                out.println("Cleared " + store.clear() + " entries");
            }
            case "log" -> runLog(store, txLog, cmd.subList(1, cmd.size()));
            default -> throw new CliException("unknown command: " + name);
        }
    }

    private void runLog(KeyValueStore store, TransactionLog txLog, List<String> cmd) {
        if (cmd.isEmpty()) {
            throw new CliException("log requires show, stats or clear");
        }
        switch (cmd.get(0)) {
            case "show" -> {
                if (cmd.size() > 4) {
                    throw new CliException("log show takes at most [operation] [key] [limit]");
                }
                LogQuery q = LogQuery.all();
                if (cmd.size() > 1 && !ANY.equals(cmd.get(1))) q = q.withOperation(Operation.parse(cmd.get(1)));
                if (cmd.size() > 2 && !ANY.equals(cmd.get(2))) q = q.withKey(cmd.get(2));
                if (cmd.size() > 3) q = q.withLimit(parseLimit(cmd.get(3)));

                List<TransactionRecord> records = txLog.show(q);
                if (records.isEmpty()) {
                    out.println("(no transactions)");
                    return;
                }
                ArrayNode arr = json.createArrayNode();
                records.forEach(r -> arr.add(RecordCodec.toJson(r)));
                out.println(pretty(arr));
            }
            case "stats" -> out.println(pretty(statsJson(txLog.stats(), store.size())));
            case "clear" -> out.println("Cleared " + txLog.clearLog() + " log records");
            default -> throw new CliException("unknown log command: " + cmd.get(0));
        }
    }

    private ObjectNode statsJson(StatsSummary s, int storeSize) {
        ObjectNode node = json.createObjectNode();
        node.put("total", s.total());
        ObjectNode ops = node.putObject("operations");
        s.countsByOperation().forEach((op, n) -> ops.put(op.name(), n));
        node.put("distinct_keys", s.distinctKeys());
        ObjectNode durations = node.putObject("duration_ms");
        putOptional(durations, "min", s.minDurationMillis());
        putOptional(durations, "max", s.maxDurationMillis());
        putOptional(durations, "avg", s.averageDurationMillis());
        node.put("store_size", storeSize);
        return node;
    }

    private static void putOptional(ObjectNode node, String field, OptionalDouble v) {
        if (v.isPresent()) {
            node.put(field, v.getAsDouble());
        } else {
            node.putNull(field);
        }
    }

    /** JSON text becomes the matching JSON value; anything else is kept as a string. */
    JsonNode parseValue(String raw) {
        JsonNode parsed;
        try {
            parsed = JsonValues.parseStrict(raw);
        } catch (JsonProcessingException notJson) {
            return TextNode.valueOf(raw);
        }
        return parsed == null || parsed.isMissingNode() ? TextNode.valueOf(raw) : parsed;
    }

    private static int parseLimit(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new CliException("limit must be an integer: " + raw);
        }
    }

    private static void requireArgs(List<String> cmd, int expected, String message) {
        if (cmd.size() != expected) {
            throw new CliException(message);
        }
    }

    private String pretty(JsonNode node) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String compact(JsonNode node) {
        return node.toString();
    }

    private static void configureLogging(boolean verbose) {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: cannot load logging.properties: " + e.getMessage());
        }
        if (verbose) {
            ROOT.setLevel(Level.FINE);
        }
    }

    private static void usage(PrintStream to, String msg) {
        if (msg != null && !msg.isBlank()) {
            to.println("error: " + msg);
        }
        to.println("""
                Usage:
                  kvledger [options] put <key> <value>
                  kvledger [options] get <key>
                  kvledger [options] delete <key>
                  kvledger [options] list | size | clear
                  kvledger [options] log show [operation|*] [key|*] [limit]
                  kvledger [options] log stats | log clear
                  kvledger [options]              start an interactive session

                Interactive session:
                  the commands above without "kvledger [options]",
                  plus help (or ?) and exit (or quit, q)

                Options:
                  --data-file, -d   JSON data file (default: data/store.json)
                  --log-file,  -l   Transaction log file (default: data/transactions.log)
                  --log-reads       Record GET operations in the transaction log
                  --verbose,   -v   Log store activity to stderr
                  --help,      -h   Show this help message
                """);
    }
}
