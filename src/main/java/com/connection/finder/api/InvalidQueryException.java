package com.connection.finder.api;

/**
 * Thrown when a search request is rejected before any provider is contacted.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
