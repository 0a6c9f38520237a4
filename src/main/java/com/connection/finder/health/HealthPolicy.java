package com.connection.finder.health;

import java.time.Duration;
import java.util.Optional;

/**
 * Consecutive-failure thresholds driving the source health state machine.
 * A threshold is the number of consecutive failures at which the status is reached.
 */
public final class HealthPolicy {

    private static final int DEFAULT_DEGRADED_AFTER = 1;
    private static final int DEFAULT_FAILING_AFTER = 3;
    private static final int DEFAULT_DISABLED_AFTER = 5;

    private final int degradedAfter;
    private final int failingAfter;
    private final int disabledAfter;
    private final Duration recoveryWindow;

    private HealthPolicy(Builder builder) {
        this.degradedAfter = builder.degradedAfter;
        this.failingAfter = builder.failingAfter;
        this.disabledAfter = builder.disabledAfter;
        this.recoveryWindow = builder.recoveryWindow;
    }

    public static HealthPolicy defaults() {
        return builder().build();
    }

    public int getDegradedAfter() {
        return degradedAfter;
    }

    public int getFailingAfter() {
        return failingAfter;
    }

    public int getDisabledAfter() {
        return disabledAfter;
    }

    /**
     * Time after the last failure at which a disabled provider is tried again.
     * Empty means disabled providers stay disabled until reset manually.
     */
    public Optional<Duration> getRecoveryWindow() {
        return Optional.ofNullable(recoveryWindow);
    }

    /**
     * Status implied by a number of consecutive failures.
     */
    public SourceStatus statusFor(int consecutiveFailures) {
        if (consecutiveFailures >= disabledAfter) {
            return SourceStatus.DISABLED;
        }
        if (consecutiveFailures >= failingAfter) {
            return SourceStatus.FAILING;
        }
        if (consecutiveFailures >= degradedAfter) {
            return SourceStatus.DEGRADED;
        }
        return SourceStatus.HEALTHY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int degradedAfter = DEFAULT_DEGRADED_AFTER;
        private int failingAfter = DEFAULT_FAILING_AFTER;
        private int disabledAfter = DEFAULT_DISABLED_AFTER;
        private Duration recoveryWindow;

        public Builder degradedAfter(int degradedAfter) {
            this.degradedAfter = degradedAfter;
            return this;
        }

        public Builder failingAfter(int failingAfter) {
            this.failingAfter = failingAfter;
            return this;
        }

        public Builder disabledAfter(int disabledAfter) {
            this.disabledAfter = disabledAfter;
            return this;
        }

        public Builder recoveryWindow(Duration recoveryWindow) {
            if (recoveryWindow != null && (recoveryWindow.isNegative() || recoveryWindow.isZero())) {
                throw new IllegalArgumentException("recoveryWindow must be positive");
            }
            this.recoveryWindow = recoveryWindow;
            return this;
        }

        public HealthPolicy build() {
            if (degradedAfter < 1) {
                throw new IllegalArgumentException("degradedAfter must be >= 1");
            }
            if (failingAfter < degradedAfter) {
                throw new IllegalArgumentException("failingAfter must be >= degradedAfter");
            }
            if (disabledAfter < failingAfter) {
                throw new IllegalArgumentException("disabledAfter must be >= failingAfter");
            }
            return new HealthPolicy(this);
        }
    }

    @Override
    public String toString() {
        return "HealthPolicy{" +
                "degradedAfter=" + degradedAfter +
                ", failingAfter=" + failingAfter +
                ", disabledAfter=" + disabledAfter +
                ", recoveryWindow=" + recoveryWindow +
                '}';
    }
}
