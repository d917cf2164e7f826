// file: src/main/java/io/kvledger/core/LogQuery.java
package io.kvledger.core;

/**
 * Filter for reading back the transaction log.
 * <p>
 * Semantics:
 *  - operation: exact match when non-null.
 *  - key:       exact match when non-null.
 *  - limit:     when non-null, keep only the last {@code limit} matches
 *               (filter first, then truncate). Must be positive.
 * Results are always in ascending transaction id order.
 */
public record LogQuery(Operation operation, String key, Integer limit) {

    public LogQuery {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
    }

    public static LogQuery all() {
        return new LogQuery(null, null, null);
    }

    public LogQuery withOperation(Operation op) {
        return new LogQuery(op, key, limit);
    }

    public LogQuery withKey(String k) {
        return new LogQuery(operation, k, limit);
    }

    public LogQuery withLimit(int n) {
        return new LogQuery(operation, key, n);
    }

    public boolean matches(TransactionRecord r) {
        if (operation != null && r.operation() != operation) return false;
        return key == null || key.equals(r.key());
    }
}
