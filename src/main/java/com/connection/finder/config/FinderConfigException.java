package com.connection.finder.config;

/**
 * Thrown when a configuration document cannot be read or holds invalid values.
 */
public class FinderConfigException extends RuntimeException {

    public FinderConfigException(String message) {
        super(message);
    }

    public FinderConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
