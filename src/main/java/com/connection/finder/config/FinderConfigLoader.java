package com.connection.finder.config;

import com.connection.finder.api.FinderOptions;
import com.connection.finder.cache.CacheConfig;
import com.connection.finder.health.HealthPolicy;
import com.connection.finder.rules.ParentCompanyMapping;
import com.connection.finder.source.SourceConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link FinderConfig} from JSON.
 *
 * <pre>
 * {
 *   "options": {"maxConcurrency": 4, "providerTimeoutMs": 10000, "searchDeadlineMs": 30000},
 *   "health":  {"degradedAfter": 1, "failingAfter": 3, "disabledAfter": 5, "recoveryWindowSeconds": 300},
 *   "cache":   {"enabled": true, "maxSize": 1000, "ttlSeconds": 600},
 *   "sources": [{"id": "github", "priority": 1, "timeoutMs": 8000, "requiresAuth": true}],
 *   "parentCompanies": {"meta": ["threads"]}
 * }
 * </pre>
 *
 * <p>Every section is optional; missing values keep their defaults.</p>
 */
public class FinderConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(FinderConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "connection-finder.json";

    private final ObjectMapper objectMapper;

    public FinderConfigLoader() {
        this(new ObjectMapper());
    }

    public FinderConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns defaults if absent.
     */
    public FinderConfig loadDefault() {
        try (InputStream in = FinderConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return FinderConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new FinderConfigException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public FinderConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new FinderConfigException("Failed to read " + path, e);
        }
    }

    public FinderConfig load(InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new FinderConfigException("Malformed configuration: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return FinderConfig.defaults();
        }
        if (!root.isObject()) {
            throw new FinderConfigException("Configuration root must be an object");
        }

        try {
            FinderConfig config = new FinderConfig(
                    readOptions(root.path("options")),
                    readHealth(root.path("health")),
                    readCache(root.path("cache")),
                    readSources(root.path("sources")),
                    readParentCompanies(root.path("parentCompanies")));
            log.info("Loaded finder configuration: {} sources, {} extra company aliases, options={}",
                    config.sources().size(), config.parentCompanies().size(), config.options());
            return config;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new FinderConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private FinderOptions readOptions(JsonNode node) {
        FinderOptions.Builder builder = FinderOptions.builder();
        if (node.isMissingNode()) {
            return builder.build();
        }
        if (node.has("maxConcurrency")) {
            builder.maxConcurrency(node.get("maxConcurrency").asInt());
        }
        if (node.has("providerTimeoutMs")) {
            builder.providerTimeout(Duration.ofMillis(node.get("providerTimeoutMs").asLong()));
        }
        if (node.has("searchDeadlineMs")) {
            builder.searchDeadline(Duration.ofMillis(node.get("searchDeadlineMs").asLong()));
        }
        if (node.has("providerLimit")) {
            builder.providerLimit(node.get("providerLimit").asInt());
        }
        return builder.build();
    }

    private HealthPolicy readHealth(JsonNode node) {
        HealthPolicy.Builder builder = HealthPolicy.builder();
        if (node.isMissingNode()) {
            return builder.build();
        }
        if (node.has("degradedAfter")) {
            builder.degradedAfter(node.get("degradedAfter").asInt());
        }
        if (node.has("failingAfter")) {
            builder.failingAfter(node.get("failingAfter").asInt());
        }
        if (node.has("disabledAfter")) {
            builder.disabledAfter(node.get("disabledAfter").asInt());
        }
        JsonNode window = node.path("recoveryWindowSeconds");
        if (!window.isMissingNode() && !window.isNull()) {
            builder.recoveryWindow(Duration.ofSeconds(window.asLong()));
        }
        return builder.build();
    }

    private CacheConfig readCache(JsonNode node) {
        if (node.isMissingNode()) {
            return CacheConfig.disabled();
        }
        CacheConfig defaults = CacheConfig.defaults();
        return new CacheConfig(
                node.path("maxSize").asInt(defaults.maxSize()),
                node.path("ttlSeconds").asInt(defaults.ttlSeconds()),
                node.path("enabled").asBoolean(true));
    }

    private Map<String, SourceConfig> readSources(JsonNode node) {
        Map<String, SourceConfig> sources = new LinkedHashMap<>();
        if (node.isMissingNode()) {
            return sources;
        }
        if (!node.isArray()) {
            throw new FinderConfigException("'sources' must be an array");
        }
        for (JsonNode entry : node) {
            String id = entry.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new FinderConfigException("Every source needs an 'id'");
            }
            SourceConfig.Builder builder = SourceConfig.builder(id)
                    .enabled(entry.path("enabled").asBoolean(true))
                    .priority(entry.path("priority").asInt(SourceConfig.DEFAULT_PRIORITY))
                    .requiresAuth(entry.path("requiresAuth").asBoolean(false))
                    .description(entry.path("description").asText(""));
            if (entry.has("timeoutMs")) {
                builder.timeout(Duration.ofMillis(entry.get("timeoutMs").asLong()));
            }
            if (sources.put(id, builder.build()) != null) {
                throw new FinderConfigException("Duplicate source id '" + id + "'");
            }
        }
        return sources;
    }

    private ParentCompanyMapping readParentCompanies(JsonNode node) {
        if (node.isMissingNode()) {
            return ParentCompanyMapping.empty();
        }
        if (!node.isObject()) {
            throw new FinderConfigException("'parentCompanies' must be an object");
        }
        ParentCompanyMapping.Builder builder = ParentCompanyMapping.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> aliases = new ArrayList<>();
            for (JsonNode alias : field.getValue()) {
                aliases.add(alias.asText());
            }
            builder.parent(field.getKey(), aliases);
        }
        return builder.build();
    }
}
