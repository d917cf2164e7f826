// file: src/main/java/io/kvledger/core/Operation.java
package io.kvledger.core;

/**
 * Kinds of operation recorded in the transaction log.
 * <p>
 * PUT, DELETE and CLEAR change the store and are always logged.
 * GET is logged only when read logging is switched on.
 */
public enum Operation {
    PUT,
    GET,
    DELETE,
    CLEAR;

    /** Case-insensitive lookup used by the CLI and the log codec. */
    public static Operation parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("operation must not be blank");
        }
        try {
            return Operation.valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown operation: " + name, e);
        }
    }
}
