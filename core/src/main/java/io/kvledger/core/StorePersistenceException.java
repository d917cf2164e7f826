package io.kvledger.core;

/**
 * Writing the data file failed. The in-memory mapping has been restored to its
 * pre-call state when this is thrown from a mutation.
 */
public class StorePersistenceException extends KvStoreException {

    public StorePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
