// file: src/main/java/io/kvledger/core/TransactionRecord.java
package io.kvledger.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable entry of the transaction log.
 * <p>
 * Fields:
 *  - transactionId: assigned by the logger, strictly increasing with append order.
 *  - operation:     PUT, GET, DELETE or CLEAR.
 *  - timestamp:     creation time, truncated to microseconds.
 *  - key:           affected key, null for CLEAR.
 *  - value:         new value for PUT, null otherwise.
 *  - oldValue:      value displaced by PUT or removed by DELETE, null if none existed.
 *  - metadata:      free-form scalars (thread, duration_ms, removed_count, ...).
 * <p>
 * JSON trees are copied on the way in and on the way out.
 */
public record TransactionRecord(
        long transactionId,
        Operation operation,
        Instant timestamp,
        String key,
        JsonNode value,
        JsonNode oldValue,
        Map<String, Object> metadata
) {
    public static final String META_THREAD = "thread";
    public static final String META_THREAD_ID = "thread_id";
    public static final String META_DURATION_MS = "duration_ms";
    public static final String META_REMOVED_COUNT = "removed_count";

    public TransactionRecord {
        if (transactionId <= 0) throw new IllegalArgumentException("transactionId must be > 0");
        Objects.requireNonNull(operation, "operation");
        timestamp = Objects.requireNonNull(timestamp, "timestamp").truncatedTo(ChronoUnit.MICROS);
        value = JsonValues.copy(value);
        oldValue = JsonValues.copy(oldValue);
        metadata = freezeMetadata(metadata);
    }

    @Override
    public JsonNode value() {
        return JsonValues.copy(value);
    }

    @Override
    public JsonNode oldValue() {
        return JsonValues.copy(oldValue);
    }

    /** Recorded duration of the operation, or NaN if the record has none. */
    public double durationMillis() {
        Object d = metadata.get(META_DURATION_MS);
        return d instanceof Number n ? n.doubleValue() : Double.NaN;
    }

    private static Map<String, Object> freezeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>(metadata.size() * 2);
        for (Map.Entry<String, Object> e : metadata.entrySet()) {
            Object v = e.getValue();
            if (v != null && !(v instanceof String) && !(v instanceof Number) && !(v instanceof Boolean)) {
                throw new IllegalArgumentException(
                        "metadata '" + e.getKey() + "' must be a scalar, got " + v.getClass().getName());
            }
            if ((v instanceof Double || v instanceof Float) && !Double.isFinite(((Number) v).doubleValue())) {
                throw new IllegalArgumentException("metadata '" + e.getKey() + "' is not a finite number: " + v);
            }
            copy.put(Objects.requireNonNull(e.getKey(), "metadata key"), v);
        }
        return Collections.unmodifiableMap(copy);
    }
}
