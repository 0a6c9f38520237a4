package com.connection.finder.source;

/**
 * Base class for failures reported by a {@link SourceProvider}.
 */
public abstract class SourceProviderException extends RuntimeException {

    private final String sourceId;

    protected SourceProviderException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    protected SourceProviderException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
