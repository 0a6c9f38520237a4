package com.connection.finder.source;

/**
 * Transient provider failure such as a rate limit, a block or a network error.
 * Counts against the provider's health.
 */
public class ProviderException extends SourceProviderException {

    public ProviderException(String sourceId, String message) {
        super(sourceId, message);
    }

    public ProviderException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }
}
