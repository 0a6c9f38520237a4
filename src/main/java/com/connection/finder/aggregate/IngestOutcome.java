package com.connection.finder.aggregate;

/**
 * What happened to a record handed to the aggregator.
 */
public enum IngestOutcome {
    /** A new canonical identity was created. */
    CREATED,
    /** The record was merged into an existing identity. */
    MERGED,
    /** The record was malformed and dropped. */
    DROPPED
}
