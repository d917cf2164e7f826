package io.kvledger.storage;

import com.fasterxml.jackson.databind.node.TextNode;
import io.kvledger.core.CorruptedLogException;
import io.kvledger.core.LogPersistenceException;
import io.kvledger.core.LogQuery;
import io.kvledger.core.Operation;
import io.kvledger.core.TransactionRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;
import static org.junit.jupiter.api.Assertions.*;

class FileTransactionLoggerTest {

    @TempDir Path dir;

    private static final Clock FIXED =
            Clock.fixed(Instant.parse("2026-03-04T05:06:07.123456789Z"), ZoneOffset.UTC);

    private Path logFile() {
        return dir.resolve("logs").resolve("tx.log");
    }

    private static TransactionRecord put(FileTransactionLogger log, String key, String value) {
        return log.log(Operation.PUT, key, TextNode.valueOf(value), null, Map.of());
    }

    @Test
    void ids_start_at_one_and_strictly_increase() {
        try (var log = new FileTransactionLogger(logFile())) {
            var r1 = put(log, "a", "1");
            var r2 = log.log(Operation.DELETE, "a", null, TextNode.valueOf("1"), Map.of());
            var r3 = log.log(Operation.CLEAR, null, null, null, Map.of("removed_count", 0));

            assertEquals(1, r1.transactionId());
            assertEquals(2, r2.transactionId());
            assertEquals(3, r3.transactionId());
            assertEquals(3, log.lastId());
        }
    }

    @Test
    void ids_continue_after_reopen() {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
            put(log, "b", "2");
        }
        try (var log = new FileTransactionLogger(logFile())) {
            assertEquals(2, log.size());
            assertEquals(3, put(log, "c", "3").transactionId());
        }
    }

    @Test
    void reopened_log_reproduces_records() {
        TransactionRecord written;
        try (var log = new FileTransactionLogger(logFile(), FIXED)) {
            written = log.log(Operation.PUT, "k", TextNode.valueOf("new"), TextNode.valueOf("old"),
                    Map.of("thread", "worker-1", "duration_ms", 1.25));
        }
        try (var log = new FileTransactionLogger(logFile())) {
            TransactionRecord read = log.show(LogQuery.all()).get(0);
            assertEquals(written, read);
            assertEquals(Instant.parse("2026-03-04T05:06:07.123456Z"), read.timestamp());
        }
    }

    @Test
    void file_has_one_json_line_per_record_with_microsecond_timestamps() throws Exception {
        try (var log = new FileTransactionLogger(logFile(), FIXED)) {
            put(log, "a", "1");
            put(log, "b", "2");
        }
        List<String> lines = Files.readAllLines(logFile());

        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{\"transaction_id\":1,\"operation\":\"PUT\""), lines.get(0));
        assertTrue(lines.get(0).contains("\"timestamp\":\"2026-03-04T05:06:07.123456Z\""), lines.get(0));
        assertTrue(lines.get(1).contains("\"old_value\":null"), lines.get(1));
    }

    @Test
    void appends_never_rewrite_earlier_lines() throws Exception {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
            String first = Files.readString(logFile());
            put(log, "b", "2");
            assertTrue(Files.readString(logFile()).startsWith(first));
        }
    }

    @Test
    void clear_log_truncates_file_and_resets_ids() throws Exception {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
            put(log, "b", "2");

            assertEquals(2, log.clearLog());
            assertEquals(0, log.size());
            assertEquals(0, Files.size(logFile()));
            assertEquals(1, put(log, "c", "3").transactionId());
        }
        try (var log = new FileTransactionLogger(logFile())) {
            assertEquals(1, log.size());
            assertEquals("c", log.show(LogQuery.all()).get(0).key());
        }
    }

    @Test
    void show_filters_by_operation_and_key() {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
            put(log, "b", "1");
            log.log(Operation.DELETE, "a", null, TextNode.valueOf("1"), Map.of());
            put(log, "a", "2");

            assertEquals(4, log.show(null).size());
            assertEquals(List.of(1L, 4L), ids(log.show(new LogQuery(Operation.PUT, "a", null))));
            assertEquals(List.of(1L, 3L, 4L), ids(log.show(LogQuery.all().withKey("a"))));
            assertEquals(List.of(3L), ids(log.show(LogQuery.all().withOperation(Operation.DELETE))));
            assertTrue(log.show(LogQuery.all().withOperation(Operation.CLEAR)).isEmpty());
        }
    }

    @Test
    void limit_keeps_most_recent_matches_in_ascending_order() {
        try (var log = new FileTransactionLogger(logFile())) {
            for (int i = 0; i < 5; i++) {
                put(log, "k", "v" + i);
                put(log, "other", "x" + i);
            }

            assertEquals(List.of(7L, 9L), ids(log.show(LogQuery.all().withKey("k").withLimit(2))));
            assertEquals(5, log.show(LogQuery.all().withKey("k").withLimit(50)).size());
        }
    }

    @Test
    void malformed_line_fails_startup() throws Exception {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
        }
        Files.writeString(logFile(), "{not json}\n", java.nio.file.StandardOpenOption.APPEND);

        var e = assertThrows(CorruptedLogException.class, () -> new FileTransactionLogger(logFile()));
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());
    }

    @Test
    void trailing_content_after_a_record_fails_startup() throws Exception {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
        }
        String line = Files.readString(logFile()).stripTrailing();

        Files.writeString(logFile(), line + " garbage\n");
        assertThrows(CorruptedLogException.class, () -> new FileTransactionLogger(logFile()));

        Files.writeString(logFile(), line + " " + line.replace("\"transaction_id\":1", "\"transaction_id\":2") + "\n");
        assertThrows(CorruptedLogException.class, () -> new FileTransactionLogger(logFile()));
    }

    @Test
    void unterminated_last_line_is_closed_before_the_next_append() throws Exception {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");
        }
        Files.writeString(logFile(), Files.readString(logFile()).stripTrailing());

        try (var log = new FileTransactionLogger(logFile())) {
            assertEquals(2, put(log, "b", "2").transactionId());
        }
        try (var log = new FileTransactionLogger(logFile())) {
            assertEquals(List.of(1L, 2L), ids(log.show(LogQuery.all())));
            assertEquals(3, put(log, "c", "3").transactionId());
        }
        assertEquals(3, Files.readAllLines(logFile()).size());
    }

    @Test
    void torn_append_is_cut_back_and_its_id_stays_unused() throws Exception {
        TornWriteChannel[] channel = new TornWriteChannel[1];
        FileTransactionLogger.ChannelOpener opener =
                f -> channel[0] = new TornWriteChannel(FileChannel.open(f, CREATE, WRITE, APPEND));

        try (var log = new FileTransactionLogger(logFile(), FIXED, opener)) {
            put(log, "a", "1");
            long intact = Files.size(logFile());

            channel[0].failNextWrite();
            assertThrows(LogPersistenceException.class, () -> put(log, "b", "2"));
            assertEquals(intact, Files.size(logFile()), "partial line must be removed");
            assertEquals(1, log.size());

            assertEquals(3, put(log, "c", "3").transactionId());
        }
        try (var log = new FileTransactionLogger(logFile())) {
            assertEquals(List.of(1L, 3L), ids(log.show(LogQuery.all())));
            assertEquals(4, put(log, "d", "4").transactionId());
        }
    }

    @Test
    void record_that_cannot_be_built_takes_no_id() {
        try (var log = new FileTransactionLogger(logFile())) {
            put(log, "a", "1");

            assertThrows(IllegalArgumentException.class, () -> log.log(Operation.PUT, "b",
                    TextNode.valueOf("2"), null, Map.of("duration_ms", Double.NaN)));

            assertEquals(1, log.lastId());
            assertEquals(2, put(log, "c", "3").transactionId());
        }
    }

    @Test
    void record_without_required_fields_fails_startup() throws Exception {
        Files.createDirectories(logFile().getParent());
        Files.writeString(logFile(), "{\"transaction_id\":1,\"operation\":\"PUT\"}\n");

        assertThrows(CorruptedLogException.class, () -> new FileTransactionLogger(logFile()));
    }

    @Test
    void unknown_operation_fails_startup() throws Exception {
        Files.createDirectories(logFile().getParent());
        Files.writeString(logFile(),
                "{\"transaction_id\":1,\"operation\":\"UPSERT\",\"timestamp\":\"2026-01-01T00:00:00.000000Z\"}\n");

        assertThrows(CorruptedLogException.class, () -> new FileTransactionLogger(logFile()));
    }

    @Test
    void out_of_order_ids_fail_startup() throws Exception {
        Files.createDirectories(logFile().getParent());
        String ts = "\"timestamp\":\"2026-01-01T00:00:00.000000Z\"";
        Files.writeString(logFile(),
                "{\"transaction_id\":5,\"operation\":\"PUT\"," + ts + "}\n"
                        + "{\"transaction_id\":4,\"operation\":\"PUT\"," + ts + "}\n");

        assertThrows(CorruptedLogException.class, () -> new FileTransactionLogger(logFile()));
    }

    @Test
    void blank_lines_are_ignored_and_highest_id_wins() throws Exception {
        Files.createDirectories(logFile().getParent());
        String ts = "\"timestamp\":\"2026-01-01T00:00:00.000000Z\"";
        Files.writeString(logFile(),
                "{\"transaction_id\":3,\"operation\":\"PUT\",\"key\":\"a\"," + ts + "}\n\n"
                        + "{\"transaction_id\":9,\"operation\":\"CLEAR\"," + ts + "}\n");

        try (var log = new FileTransactionLogger(logFile())) {
            assertEquals(2, log.size());
            assertEquals(10, put(log, "b", "1").transactionId());
        }
    }

    @Test
    void stats_aggregate_counts_keys_and_durations() {
        try (var log = new FileTransactionLogger(logFile())) {
            log.log(Operation.PUT, "a", TextNode.valueOf("1"), null, Map.of("duration_ms", 2.0));
            log.log(Operation.PUT, "b", TextNode.valueOf("1"), null, Map.of("duration_ms", 4.0));
            log.log(Operation.PUT, "a", TextNode.valueOf("2"), TextNode.valueOf("1"), Map.of("duration_ms", 6.0));
            log.log(Operation.DELETE, "a", null, TextNode.valueOf("2"), Map.of());

            var stats = log.stats();
            assertEquals(4, stats.total());
            assertEquals(3, stats.count(Operation.PUT));
            assertEquals(1, stats.count(Operation.DELETE));
            assertEquals(0, stats.count(Operation.GET));
            assertEquals(2, stats.distinctKeys());
            assertEquals(2.0, stats.minDurationMillis().getAsDouble());
            assertEquals(6.0, stats.maxDurationMillis().getAsDouble());
            assertEquals(4.0, stats.averageDurationMillis().getAsDouble(), 1e-9);
        }
    }

    @Test
    void stats_of_empty_log_have_no_durations() {
        try (var log = new FileTransactionLogger(logFile())) {
            var stats = log.stats();
            assertEquals(0, stats.total());
            assertEquals(0, stats.distinctKeys());
            assertTrue(stats.minDurationMillis().isEmpty());
        }
    }

    private static List<Long> ids(List<TransactionRecord> records) {
        return records.stream().map(TransactionRecord::transactionId).toList();
    }
}
