package io.kvledger.core;

/** Key is null, empty or blank. Raised before any state change. */
public class InvalidKeyException extends KvStoreException {
    private final String key;

    public InvalidKeyException(String key, String reason) {
        super("invalid key '" + key + "': " + reason);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
