package io.kvledger.core;

/** Requested key is absent. Read-only failure, nothing is changed or logged. */
public class KeyNotFoundException extends KvStoreException {
    private final String key;

    public KeyNotFoundException(String key) {
        super("key '" + key + "' not found");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
