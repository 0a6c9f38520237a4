package com.connection.finder.core.model;

/**
 * Optional single-valued fields of a person record.
 * A record holds at most one value per field, so a person has at most one contact
 * handle of each kind.
 */
public enum PersonField {
    TITLE("title"),
    LINKEDIN_URL("linkedinUrl"),
    EMAIL("email"),
    TWITTER_URL("twitterUrl"),
    GITHUB_URL("githubUrl"),
    DEPARTMENT("department"),
    LOCATION("location"),
    EVIDENCE_URL("evidenceUrl");

    private final String label;

    PersonField(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
