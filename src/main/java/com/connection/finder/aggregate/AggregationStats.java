package com.connection.finder.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statistics of one aggregation.
 *
 * @param totalUnique        number of canonical identities
 * @param bySource           number of identities each source contributed to
 * @param multiSourceMatches identities confirmed by at least two distinct sources
 * @param droppedRecords     malformed records rejected before ingestion
 * @param mergedRecords      records merged into an already existing identity
 */
public record AggregationStats(
        int totalUnique,
        Map<String, Integer> bySource,
        int multiSourceMatches,
        int droppedRecords,
        int mergedRecords
) {
    public AggregationStats {
        bySource = bySource != null ? Collections.unmodifiableMap(new LinkedHashMap<>(bySource)) : Map.of();
    }

    public static AggregationStats empty() {
        return new AggregationStats(0, Map.of(), 0, 0, 0);
    }
}
