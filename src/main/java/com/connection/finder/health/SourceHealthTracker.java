package com.connection.finder.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-scoped record of provider successes and failures.
 *
 * <p>State machine per provider:</p>
 * <ul>
 *   <li>failures push the status HEALTHY → DEGRADED → FAILING → DISABLED as the consecutive
 *       failure count crosses the {@link HealthPolicy} thresholds</li>
 *   <li>a success resets the consecutive count and moves the status one step back toward
 *       HEALTHY (FAILING → DEGRADED → HEALTHY)</li>
 *   <li>DISABLED is terminal until {@link #reset(String)}, unless the policy defines a
 *       recovery window, after which the provider is tried again in FAILING state</li>
 * </ul>
 *
 * <p>All updates are atomic per provider.</p>
 */
public class SourceHealthTracker {
    private static final Logger log = LoggerFactory.getLogger(SourceHealthTracker.class);

    private final ConcurrentHashMap<String, SourceHealth> health = new ConcurrentHashMap<>();
    private final HealthPolicy policy;
    private final Clock clock;

    public SourceHealthTracker() {
        this(HealthPolicy.defaults());
    }

    public SourceHealthTracker(HealthPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public SourceHealthTracker(HealthPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Starts tracking a provider in HEALTHY state. Has no effect if it is already tracked.
     */
    public void register(String sourceId) {
        health.putIfAbsent(sourceId, SourceHealth.initial(sourceId));
    }

    public void recordSuccess(String sourceId) {
        recordSuccess(sourceId, null);
    }

    public void recordSuccess(String sourceId, Duration latency) {
        Instant now = clock.instant();
        SourceHealth updated = health.compute(sourceId, (id, current) -> {
            SourceHealth base = current != null ? current : SourceHealth.initial(id);
            SourceStatus next = switch (base.status()) {
                case DISABLED -> SourceStatus.DISABLED;
                case FAILING -> SourceStatus.DEGRADED;
                case DEGRADED, HEALTHY -> SourceStatus.HEALTHY;
            };
            if (next != base.status()) {
                log.info("Source '{}' recovering: {} -> {}", id, base.status(), next);
            }
            return new SourceHealth(id, next, 0, now, base.lastFailureAt(),
                    base.totalSuccesses() + 1, base.totalFailures(), latency);
        });
        if (updated.isDisabled()) {
            log.debug("Success recorded for disabled source '{}'; status unchanged until reset", sourceId);
        }
    }

    public void recordFailure(String sourceId) {
        recordFailure(sourceId, null);
    }

    public void recordFailure(String sourceId, Duration latency) {
        Instant now = clock.instant();
        health.compute(sourceId, (id, current) -> {
            SourceHealth base = current != null ? current : SourceHealth.initial(id);
            int failures = base.consecutiveFailures() + 1;
            SourceStatus implied = policy.statusFor(failures);
            SourceStatus next = implied.isWorseThan(base.status()) ? implied : base.status();
            if (next != base.status()) {
                if (next == SourceStatus.DISABLED) {
                    log.warn("Source '{}' disabled after {} consecutive failures", id, failures);
                } else {
                    log.info("Source '{}' health: {} -> {} ({} consecutive failures)",
                            id, base.status(), next, failures);
                }
            }
            return new SourceHealth(id, next, failures, base.lastSuccessAt(), now,
                    base.totalSuccesses(), base.totalFailures() + 1, latency);
        });
    }

    /**
     * Returns the current health of a provider. Unknown providers are HEALTHY.
     */
    public SourceHealth status(String sourceId) {
        SourceHealth current = health.get(sourceId);
        return current != null ? current : SourceHealth.initial(sourceId);
    }

    /**
     * Returns true if the provider may be invoked. A disabled provider whose recovery
     * window has elapsed is moved to FAILING and becomes available again.
     */
    public boolean isAvailable(String sourceId) {
        SourceHealth current = status(sourceId);
        if (!current.isDisabled()) {
            return true;
        }
        Duration window = policy.getRecoveryWindow().orElse(null);
        if (window == null || current.lastFailureAt() == null) {
            return false;
        }
        Instant retryAt = current.lastFailureAt().plus(window);
        if (clock.instant().isBefore(retryAt)) {
            return false;
        }
        SourceHealth reopened = health.computeIfPresent(sourceId, (id, h) -> {
            if (!h.isDisabled()) {
                return h;
            }
            log.info("Source '{}' recovery window elapsed, retrying in {} state", id, SourceStatus.FAILING);
            // One more failure disables the source again
            return new SourceHealth(id, SourceStatus.FAILING, Math.max(0, policy.getDisabledAfter() - 1),
                    h.lastSuccessAt(), h.lastFailureAt(), h.totalSuccesses(), h.totalFailures(), h.lastLatency());
        });
        return reopened == null || !reopened.isDisabled();
    }

    /**
     * Manually re-enables a provider, clearing its history.
     */
    public void reset(String sourceId) {
        SourceHealth previous = health.put(sourceId, SourceHealth.initial(sourceId));
        log.info("Source '{}' reset to {} (was {})", sourceId, SourceStatus.HEALTHY,
                previous != null ? previous.status() : SourceStatus.HEALTHY);
    }

    /**
     * Returns the health of every tracked provider, sorted by identifier.
     */
    public Map<String, SourceHealth> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(health));
    }

    public HealthPolicy getPolicy() {
        return policy;
    }
}
