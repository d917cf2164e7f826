package io.kvledger.core;

/** Data file exists but cannot be read back as a JSON object. Not auto-repaired. */
public class CorruptedStoreException extends KvStoreException {

    public CorruptedStoreException(String message) {
        super(message);
    }

    public CorruptedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
