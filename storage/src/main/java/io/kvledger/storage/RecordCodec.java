// file: src/main/java/io/kvledger/storage/RecordCodec.java
package io.kvledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvledger.core.CorruptedLogException;
import io.kvledger.core.JsonValues;
import io.kvledger.core.Operation;
import io.kvledger.core.TransactionRecord;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Line framing for the transaction log file.
 * <p>
 * One record per line, as a compact JSON object:
 * <pre>
 *   {"transaction_id":7,"operation":"PUT","timestamp":"2026-01-02T03:04:05.123456Z",
 *    "key":"a","value":"2","old_value":"1","metadata":{"thread":"main","duration_ms":0.41}}
 * </pre>
 * Absent key/value/old_value are written as explicit nulls. Timestamps are UTC
 * with exactly six fractional digits.
 */
public final class RecordCodec {
    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper MAPPER = JsonValues.mapper();

    private RecordCodec() {
    }

    /** Encode a record as one UTF-8 line, trailing newline included. */
    static byte[] encode(TransactionRecord r) {
        ObjectNode node = toJson(r);
        try {
            return (MAPPER.writeValueAsString(node) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            // a tree built from validated nodes always serializes
            throw new IllegalStateException("cannot encode record " + r.transactionId(), e);
        }
    }

    public static ObjectNode toJson(TransactionRecord r) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("transaction_id", r.transactionId());
        node.put("operation", r.operation().name());
        node.put("timestamp", TIMESTAMP.format(r.timestamp()));
        node.put("key", r.key());
        node.set("value", r.value());
        node.set("old_value", r.oldValue());
        ObjectNode meta = node.putObject("metadata");
        for (Map.Entry<String, Object> e : r.metadata().entrySet()) {
            meta.set(e.getKey(), JsonValues.toNode(e.getValue()));
        }
        // set(name, null) stores a NullNode, so every field is always present
        return node;
    }

    /**
     * Decode one line read back from the log file.
     *
     * @param lineNo 1-based line number, for error messages only
     * @throws CorruptedLogException if the line is not a well-formed record
     */
    static TransactionRecord decode(String line, int lineNo) {
        JsonNode node;
        try {
            node = JsonValues.parseStrict(line);
        } catch (JsonProcessingException e) {
            throw new CorruptedLogException("line " + lineNo + ": not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new CorruptedLogException("line " + lineNo + ": expected a JSON object");
        }

        JsonNode id = node.get("transaction_id");
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) {
            throw new CorruptedLogException("line " + lineNo + ": missing or non-integer transaction_id");
        }
        JsonNode ts = node.get("timestamp");
        if (ts == null || !ts.isTextual()) {
            throw new CorruptedLogException("line " + lineNo + ": missing timestamp");
        }
        JsonNode op = node.get("operation");
        if (op == null || !op.isTextual()) {
            throw new CorruptedLogException("line " + lineNo + ": missing operation");
        }

        try {
            return new TransactionRecord(
                    id.longValue(),
                    Operation.parse(op.textValue()),
                    Instant.parse(ts.textValue()),
                    textOrNull(node.get("key")),
                    nullable(node.get("value")),
                    nullable(node.get("old_value")),
                    metadata(node.get("metadata"))
            );
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new CorruptedLogException("line " + lineNo + ": " + e.getMessage(), e);
        }
    }

    private static String textOrNull(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (!n.isTextual()) throw new IllegalArgumentException("key must be a string");
        return n.textValue();
    }

    private static JsonNode nullable(JsonNode n) {
        return (n == null || n.isNull()) ? null : n;
    }

    private static Map<String, Object> metadata(JsonNode n) {
        if (n == null || n.isNull()) return Map.of();
        if (!n.isObject()) throw new IllegalArgumentException("metadata must be an object");
        Map<String, Object> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = n.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), JsonValues.toScalar(e.getValue()));
        }
        return out;
    }
}
