package com.connection.finder.source;

import com.connection.finder.core.model.PersonRecord;

import java.util.List;

/**
 * A data provider that returns people matching a company and optional title.
 *
 * <p>Implementations may block and may fail. They signal transient failures (rate limits,
 * blocks, network errors) with {@link ProviderException} and missing configuration with
 * {@link ProviderUnavailableException}; any other runtime exception is treated as transient.</p>
 */
public interface SourceProvider {

    /**
     * Stable identifier used for provenance and health tracking.
     */
    String id();

    /**
     * Searches the provider. Returns an empty list when nothing matches.
     */
    List<PersonRecord> search(SourceQuery query);

    /**
     * Returns false when the provider lacks what it needs to run, e.g. credentials.
     * Unconfigured providers are skipped without being invoked.
     */
    default boolean isConfigured() {
        return true;
    }
}
