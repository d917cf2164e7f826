package io.kvledger.core;

/** Value cannot be represented as JSON. Raised before any state change. */
public class SerializationException extends KvStoreException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
