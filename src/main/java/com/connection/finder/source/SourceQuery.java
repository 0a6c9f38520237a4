package com.connection.finder.source;

import java.util.Objects;

/**
 * Query handed to each provider.
 *
 * @param company raw company name as entered by the caller
 * @param title   target title, may be null
 * @param limit   maximum number of records the provider should return
 */
public record SourceQuery(String company, String title, int limit) {

    public SourceQuery {
        Objects.requireNonNull(company, "company is required");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
