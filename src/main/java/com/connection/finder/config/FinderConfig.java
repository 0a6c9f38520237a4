package com.connection.finder.config;

import com.connection.finder.api.FinderOptions;
import com.connection.finder.cache.CacheConfig;
import com.connection.finder.health.HealthPolicy;
import com.connection.finder.rules.ParentCompanyMapping;
import com.connection.finder.source.SourceConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Externalized finder configuration, as read by {@link FinderConfigLoader}.
 *
 * @param options         fan-out options
 * @param healthPolicy    source health thresholds
 * @param cache           search cache settings
 * @param sources         per-source configuration keyed by source id
 * @param parentCompanies parent-company aliases added to the built-in table
 */
public record FinderConfig(
        FinderOptions options,
        HealthPolicy healthPolicy,
        CacheConfig cache,
        Map<String, SourceConfig> sources,
        ParentCompanyMapping parentCompanies
) {
    public FinderConfig {
        options = options != null ? options : FinderOptions.defaults();
        healthPolicy = healthPolicy != null ? healthPolicy : HealthPolicy.defaults();
        cache = cache != null ? cache : CacheConfig.disabled();
        sources = sources != null ? Collections.unmodifiableMap(new LinkedHashMap<>(sources)) : Map.of();
        parentCompanies = parentCompanies != null ? parentCompanies : ParentCompanyMapping.empty();
    }

    public static FinderConfig defaults() {
        return new FinderConfig(null, null, null, null, null);
    }

    public Optional<SourceConfig> source(String id) {
        return Optional.ofNullable(sources.get(id));
    }
}
