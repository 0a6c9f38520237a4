package com.connection.finder.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and combines them into one status.
 *
 * <p>The worst individual status wins: any DOWN makes the whole DOWN, otherwise any
 * DEGRADED makes it DEGRADED. A check that throws counts as DOWN.</p>
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.status().ordinal() > worstStatus.ordinal()) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("Health check '{}' failed: {}", check.getName(), e.getMessage());
            return HealthStatus.down("Check failed: " + e.getMessage());
        }
    }
}
