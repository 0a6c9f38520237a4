package com.connection.finder.cache;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies a cached search: normalized company, lowercase target title ("" when absent)
 * and result budget.
 */
public record SearchCacheKey(String normalizedCompany, String title, int resultBudget) {

    public SearchCacheKey {
        Objects.requireNonNull(normalizedCompany, "normalizedCompany is required");
        title = title == null ? "" : title.toLowerCase(Locale.ROOT).trim();
    }

    public static SearchCacheKey of(String normalizedCompany, String title, int resultBudget) {
        return new SearchCacheKey(normalizedCompany, title, resultBudget);
    }
}
