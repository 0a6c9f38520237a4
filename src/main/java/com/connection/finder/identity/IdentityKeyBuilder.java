package com.connection.finder.identity;

import com.connection.finder.core.model.IdentityKey;
import com.connection.finder.core.model.PersonRecord;
import com.connection.finder.rules.CompanyNameNormalizer;
import com.connection.finder.rules.CompanySuffixRules;

import java.util.Locale;
import java.util.Objects;

/**
 * Derives the deduplication key of a raw person record.
 * Different people sharing a name at the same normalized company collapse onto one key;
 * that is a known limitation of name-based keys.
 */
public class IdentityKeyBuilder {

    private final CompanyNameNormalizer normalizer;

    public IdentityKeyBuilder() {
        this(CompanySuffixRules.createDefaultNormalizer());
    }

    public IdentityKeyBuilder(CompanyNameNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    public IdentityKey keyOf(PersonRecord record) {
        Objects.requireNonNull(record, "record is required");
        return keyOf(record.getName(), record.getCompany());
    }

    public IdentityKey keyOf(String name, String company) {
        String normalizedName = name == null ? "" : name.toLowerCase(Locale.ROOT).trim();
        return new IdentityKey(normalizedName, normalizer.normalize(company));
    }

    public CompanyNameNormalizer getNormalizer() {
        return normalizer;
    }
}
