package io.kvledger.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogQueryTest {

    private static TransactionRecord rec(long id, Operation op, String key) {
        return new TransactionRecord(id, op, Instant.EPOCH, key, null, null, Map.of());
    }

    @Test
    void empty_query_matches_everything() {
        var q = LogQuery.all();

        assertTrue(q.matches(rec(1, Operation.PUT, "a")));
        assertTrue(q.matches(rec(2, Operation.CLEAR, null)));
    }

    @Test
    void operation_and_key_must_both_match() {
        var q = LogQuery.all().withOperation(Operation.PUT).withKey("a");

        assertTrue(q.matches(rec(1, Operation.PUT, "a")));
        assertFalse(q.matches(rec(2, Operation.DELETE, "a")));
        assertFalse(q.matches(rec(3, Operation.PUT, "b")));
        assertFalse(q.matches(rec(4, Operation.CLEAR, null)));
    }

    @Test
    void limit_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> LogQuery.all().withLimit(0));
        assertThrows(IllegalArgumentException.class, () -> new LogQuery(null, null, -3));
        assertEquals(4, LogQuery.all().withLimit(4).limit());
    }

    @Test
    void operation_names_parse_case_insensitively() {
        assertEquals(Operation.DELETE, Operation.parse(" delete "));
        assertThrows(IllegalArgumentException.class, () -> Operation.parse("upsert"));
        assertThrows(IllegalArgumentException.class, () -> Operation.parse(""));
    }
}
