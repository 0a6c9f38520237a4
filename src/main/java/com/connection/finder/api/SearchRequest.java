package com.connection.finder.api;

/**
 * A people search at one company.
 *
 * @param company      free-text company name, required
 * @param title        target title used for categorization, may be null
 * @param resultBudget maximum number of people to return, must be positive
 */
public record SearchRequest(String company, String title, int resultBudget) {

    public SearchRequest {
        if (company == null || company.isBlank()) {
            throw new InvalidQueryException("company must not be blank");
        }
        if (resultBudget <= 0) {
            throw new InvalidQueryException("resultBudget must be > 0, got " + resultBudget);
        }
        company = company.trim();
        title = title == null || title.isBlank() ? null : title.trim();
    }

    public static SearchRequest of(String company, String title, int resultBudget) {
        return new SearchRequest(company, title, resultBudget);
    }
}
