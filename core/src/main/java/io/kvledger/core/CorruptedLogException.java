package io.kvledger.core;

/** Existing transaction log holds a line that is not a valid record. */
public class CorruptedLogException extends KvStoreException {

    public CorruptedLogException(String message) {
        super(message);
    }

    public CorruptedLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
