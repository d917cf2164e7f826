// file: src/main/java/io/kvledger/storage/TransactionLog.java
package io.kvledger.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvledger.core.LogQuery;
import io.kvledger.core.Operation;
import io.kvledger.core.StatsSummary;
import io.kvledger.core.TransactionRecord;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of store operations.
 * <p>
 * Contract:
 *  - log() assigns the next id, and the record is durable in the log file
 *    before it returns. Ids strictly increase with append order.
 *  - Existing entries are never rewritten; only clearLog() removes them, all at once.
 *  - Queries see records in ascending id order.
 */
public interface TransactionLog extends AutoCloseable {

    /**
     * Append a record.
     *
     * @throws io.kvledger.core.LogPersistenceException on disk failure
     */
    TransactionRecord log(Operation operation,
                          String key,
                          JsonNode value,
                          JsonNode oldValue,
                          Map<String, Object> metadata);

    /** Records matching the query, oldest first. */
    List<TransactionRecord> show(LogQuery query);

    StatsSummary stats();

    /**
     * Drop every record, truncate the file and restart ids from 1.
     *
     * @return number of records removed
     */
    int clearLog();

    int size();

    @Override
    void close();
}
