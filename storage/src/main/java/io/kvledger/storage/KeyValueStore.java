// file: src/main/java/io/kvledger/storage/KeyValueStore.java
package io.kvledger.storage;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Synchronous, thread-safe key-value interface consumed by the CLI.
 * <p>
 * Semantics:
 *  - Mutations (put, delete, clear) are durable before returning: the whole
 *    mapping has been written to the data file.
 *  - Each mutation is recorded in the transaction log after its effect is durable.
 *  - Returned values and collections are detached copies.
 *  - A failed call leaves the mapping exactly as it was.
 */
public interface KeyValueStore {

    /**
     * Insert or overwrite a key.
     *
     * @param value any JSON value, or an object Jackson can convert to one
     * @return the displaced value, or null if the key was absent
     * @throws io.kvledger.core.InvalidKeyException    if key is null or blank
     * @throws io.kvledger.core.SerializationException if value has no JSON form
     */
    JsonNode put(String key, Object value);

    /**
     * @throws io.kvledger.core.KeyNotFoundException if the key is absent
     */
    JsonNode get(String key);

    /**
     * Remove a key.
     *
     * @return the removed value
     * @throws io.kvledger.core.KeyNotFoundException if the key is absent; nothing changes
     */
    JsonNode delete(String key);

    /**
     * Remove every entry.
     *
     * @return number of entries removed
     */
    int clear();

    boolean exists(String key);

    List<String> keys();

    List<JsonNode> values();

    /** Insertion-ordered copy of the whole mapping. */
    Map<String, JsonNode> items();

    int size();
}
