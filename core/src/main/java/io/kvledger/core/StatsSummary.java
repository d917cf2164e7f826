// file: src/main/java/io/kvledger/core/StatsSummary.java
package io.kvledger.core;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Aggregate view over a set of transaction records.
 *
 * @param total                 number of records
 * @param countsByOperation     count per operation; every operation is present
 * @param distinctKeys          number of distinct non-null keys touched
 * @param minDurationMillis     smallest recorded duration, empty if none recorded
 * @param maxDurationMillis     largest recorded duration, empty if none recorded
 * @param averageDurationMillis mean recorded duration, empty if none recorded
 */
public record StatsSummary(
        long total,
        Map<Operation, Long> countsByOperation,
        int distinctKeys,
        OptionalDouble minDurationMillis,
        OptionalDouble maxDurationMillis,
        OptionalDouble averageDurationMillis
) {
    public StatsSummary {
        EnumMap<Operation, Long> counts = new EnumMap<>(Operation.class);
        for (Operation op : Operation.values()) {
            counts.put(op, countsByOperation == null ? 0L : countsByOperation.getOrDefault(op, 0L));
        }
        countsByOperation = Collections.unmodifiableMap(counts);
    }

    public long count(Operation op) {
        return countsByOperation.get(op);
    }

    /** Single pass over the given records. */
    public static StatsSummary of(Collection<TransactionRecord> records) {
        Map<Operation, Long> counts = new EnumMap<>(Operation.class);
        Set<String> keys = new HashSet<>();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        int timed = 0;

        for (TransactionRecord r : records) {
            counts.merge(r.operation(), 1L, Long::sum);
            if (r.key() != null) keys.add(r.key());
            double d = r.durationMillis();
            if (!Double.isNaN(d)) {
                min = Math.min(min, d);
                max = Math.max(max, d);
                sum += d;
                timed++;
            }
        }

        if (timed == 0) {
            return new StatsSummary(records.size(), counts, keys.size(),
                    OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }
        return new StatsSummary(records.size(), counts, keys.size(),
                OptionalDouble.of(min), OptionalDouble.of(max), OptionalDouble.of(sum / timed));
    }
}
