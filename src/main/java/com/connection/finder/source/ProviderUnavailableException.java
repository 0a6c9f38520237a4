package com.connection.finder.source;

/**
 * The provider cannot run at all, typically because credentials or an endpoint are missing.
 * Carries no health penalty.
 */
public class ProviderUnavailableException extends SourceProviderException {

    public ProviderUnavailableException(String sourceId, String message) {
        super(sourceId, message);
    }
}
