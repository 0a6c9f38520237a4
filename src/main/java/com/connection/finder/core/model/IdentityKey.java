package com.connection.finder.core.model;

import java.util.Objects;

/**
 * Deduplication key of a person: lowercase trimmed name plus normalized company.
 * Two records with equal keys are treated as the same real-world identity.
 */
public record IdentityKey(String name, String company) {

    public IdentityKey {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(company, "company is required");
    }

    @Override
    public String toString() {
        return name + "@" + company;
    }
}
