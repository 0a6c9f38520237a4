package com.connection.finder.core.model;

/**
 * Functional category of a person relative to the role being targeted.
 */
public enum PersonCategory {
    MANAGER("manager"),
    RECRUITER("recruiter"),
    PEER("peer"),
    SENIOR("senior"),
    UNKNOWN("unknown");

    private final String label;

    PersonCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
