package io.kvledger.core;

/**
 * Appending to or truncating the transaction log failed.
 * <p>
 * When raised from a store mutation, the mutation itself is already committed
 * and persisted; only its audit record is missing.
 */
public class LogPersistenceException extends KvStoreException {

    public LogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
