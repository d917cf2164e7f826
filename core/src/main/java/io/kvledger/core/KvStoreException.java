// file: src/main/java/io/kvledger/core/KvStoreException.java
package io.kvledger.core;

/**
 * Root of all errors raised by the store and the transaction log.
 */
public class KvStoreException extends RuntimeException {

    public KvStoreException(String message) {
        super(message);
    }

    public KvStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
