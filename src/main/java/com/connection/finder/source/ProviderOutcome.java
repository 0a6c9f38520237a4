package com.connection.finder.source;

/**
 * What happened to one provider during a search.
 */
public enum ProviderOutcome {
    SUCCESS,
    EMPTY,
    FAILED,
    TIMED_OUT,
    UNAVAILABLE,
    SKIPPED_DISABLED_BY_CONFIG,
    SKIPPED_NOT_CONFIGURED,
    SKIPPED_DISABLED_BY_HEALTH,
    SKIPPED_BUDGET,
    SKIPPED_DEADLINE,
    ABANDONED;

    /**
     * True if the provider was actually called.
     */
    public boolean wasInvoked() {
        return switch (this) {
            case SUCCESS, EMPTY, FAILED, TIMED_OUT, UNAVAILABLE, ABANDONED -> true;
            default -> false;
        };
    }

    public boolean isSkipped() {
        return name().startsWith("SKIPPED_");
    }
}
