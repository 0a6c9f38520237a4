package com.connection.finder.source;

import java.time.Duration;
import java.util.Objects;

/**
 * Static configuration of a provider: whether it may run, in which order, and how long
 * a single call may take.
 */
public final class SourceConfig {

    public static final int DEFAULT_PRIORITY = 100;

    private final String id;
    private final boolean enabled;
    private final int priority;
    private final Duration timeout;
    private final boolean requiresAuth;
    private final String description;

    private SourceConfig(Builder builder) {
        this.id = builder.id;
        this.enabled = builder.enabled;
        this.priority = builder.priority;
        this.timeout = builder.timeout;
        this.requiresAuth = builder.requiresAuth;
        this.description = builder.description;
    }

    /**
     * Enabled, default priority, finder-wide timeout.
     */
    public static SourceConfig defaults(String id) {
        return builder(id).build();
    }

    public String getId() {
        return id;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Lower values run first.
     */
    public int getPriority() {
        return priority;
    }

    /**
     * Per-call timeout, or null to use the finder's default.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean isRequiresAuth() {
        return requiresAuth;
    }

    public String getDescription() {
        return description;
    }

    public Builder toBuilder() {
        return builder(id)
                .enabled(enabled)
                .priority(priority)
                .timeout(timeout)
                .requiresAuth(requiresAuth)
                .description(description);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private boolean enabled = true;
        private int priority = DEFAULT_PRIORITY;
        private Duration timeout;
        private boolean requiresAuth = false;
        private String description = "";

        private Builder(String id) {
            this.id = id;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder requiresAuth(boolean requiresAuth) {
            this.requiresAuth = requiresAuth;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public SourceConfig build() {
            Objects.requireNonNull(id, "id is required");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            return new SourceConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SourceConfig{" +
                "id='" + id + '\'' +
                ", enabled=" + enabled +
                ", priority=" + priority +
                ", timeout=" + timeout +
                ", requiresAuth=" + requiresAuth +
                '}';
    }
}
