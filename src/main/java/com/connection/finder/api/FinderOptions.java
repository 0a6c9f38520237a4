package com.connection.finder.api;

import java.time.Duration;

/**
 * Fan-out options for {@link ConnectionFinder}.
 */
public class FinderOptions {

    private static final int DEFAULT_MAX_CONCURRENCY = 4;
    private static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_SEARCH_DEADLINE = Duration.ofSeconds(30);

    private final int maxConcurrency;
    private final Duration providerTimeout;
    private final Duration searchDeadline;
    private final int providerLimit;

    private FinderOptions(Builder builder) {
        this.maxConcurrency = builder.maxConcurrency;
        this.providerTimeout = builder.providerTimeout;
        this.searchDeadline = builder.searchDeadline;
        this.providerLimit = builder.providerLimit;
    }

    /**
     * Maximum number of provider calls in flight for one search.
     */
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Per-call timeout for sources that do not configure their own.
     */
    public Duration getProviderTimeout() {
        return providerTimeout;
    }

    /**
     * Overall time limit of a search. Results gathered when it expires are returned as partial.
     */
    public Duration getSearchDeadline() {
        return searchDeadline;
    }

    /**
     * Record limit passed to each provider; 0 means the search's result budget.
     */
    public int getProviderLimit() {
        return providerLimit;
    }

    public int providerLimitFor(int resultBudget) {
        return providerLimit > 0 ? providerLimit : resultBudget;
    }

    public static FinderOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Duration providerTimeout = DEFAULT_PROVIDER_TIMEOUT;
        private Duration searchDeadline = DEFAULT_SEARCH_DEADLINE;
        private int providerLimit = 0;

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder providerTimeout(Duration providerTimeout) {
            this.providerTimeout = requirePositive(providerTimeout, "providerTimeout");
            return this;
        }

        public Builder searchDeadline(Duration searchDeadline) {
            this.searchDeadline = requirePositive(searchDeadline, "searchDeadline");
            return this;
        }

        public Builder providerLimit(int providerLimit) {
            if (providerLimit < 0) {
                throw new IllegalArgumentException("providerLimit must be >= 0");
            }
            this.providerLimit = providerLimit;
            return this;
        }

        public FinderOptions build() {
            return new FinderOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "FinderOptions{" +
                "maxConcurrency=" + maxConcurrency +
                ", providerTimeout=" + providerTimeout +
                ", searchDeadline=" + searchDeadline +
                ", providerLimit=" + providerLimit +
                '}';
    }
}
