package com.connection.finder.api;

import com.connection.finder.core.model.PersonCategory;
import com.connection.finder.health.SourceHealth;
import com.connection.finder.source.ProviderOutcome;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statistics describing how a search result was produced.
 *
 * @param totalUnique        canonical identities found, before truncation to the budget
 * @param multiSourceMatches identities confirmed by at least two distinct sources
 * @param bySource           identities each source contributed to
 * @param droppedRecords     malformed records rejected
 * @param mergedRecords      records merged into an existing identity
 * @param categoryCounts     identities per category, over all identities found
 * @param providerReports    one report per registered source, in dispatch order
 * @param health             provider health after the search
 * @param partial            true when the search deadline cut the fan-out short
 * @param fromCache          true when the result was served from the search cache
 * @param elapsed            wall-clock time of the search
 */
public record SearchStats(
        int totalUnique,
        int multiSourceMatches,
        Map<String, Integer> bySource,
        int droppedRecords,
        int mergedRecords,
        Map<PersonCategory, Integer> categoryCounts,
        List<ProviderReport> providerReports,
        Map<String, SourceHealth> health,
        boolean partial,
        boolean fromCache,
        Duration elapsed
) {
    public SearchStats {
        bySource = bySource != null ? Collections.unmodifiableMap(new LinkedHashMap<>(bySource)) : Map.of();
        categoryCounts = categoryCounts != null && !categoryCounts.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(categoryCounts)) : Map.of();
        providerReports = providerReports != null ? List.copyOf(providerReports) : List.of();
        health = health != null ? Collections.unmodifiableMap(new LinkedHashMap<>(health)) : Map.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public Optional<ProviderReport> reportFor(String sourceId) {
        return providerReports.stream()
                .filter(report -> report.sourceId().equals(sourceId))
                .findFirst();
    }

    public long countOutcome(ProviderOutcome outcome) {
        return providerReports.stream()
                .filter(report -> report.outcome() == outcome)
                .count();
    }

    public SearchStats withFromCache(boolean cached) {
        return new SearchStats(totalUnique, multiSourceMatches, bySource, droppedRecords, mergedRecords,
                categoryCounts, providerReports, health, partial, cached, elapsed);
    }
}
