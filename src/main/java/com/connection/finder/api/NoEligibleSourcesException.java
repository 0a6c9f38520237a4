package com.connection.finder.api;

import java.util.List;

/**
 * Thrown when a search cannot reach any provider: every source is disabled by
 * configuration, unconfigured, disabled by health, or reported itself unavailable.
 */
public class NoEligibleSourcesException extends RuntimeException {

    private final List<ProviderReport> reports;

    public NoEligibleSourcesException(String message, List<ProviderReport> reports) {
        super(message);
        this.reports = reports != null ? List.copyOf(reports) : List.of();
    }

    /**
     * Why each registered source was not usable.
     */
    public List<ProviderReport> getReports() {
        return reports;
    }
}
