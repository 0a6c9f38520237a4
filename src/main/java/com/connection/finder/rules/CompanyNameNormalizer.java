package com.connection.finder.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonicalizes free-text company names for comparison.
 *
 * <p>Steps: lowercase, trim and collapse whitespace; strip trailing legal-entity suffixes
 * until none applies; re-trim; resolve the result through the parent-company table.</p>
 *
 * <p>The function is pure and idempotent. The constructor rejects parent tables that would
 * break idempotence: every alias must already be suffix-free, and every parent must be a
 * fixed point of suffix stripping.</p>
 */
public class CompanyNameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(CompanyNameNormalizer.class);

    private final List<NormalizationRule> suffixRules;
    private final ParentCompanyMapping parentMapping;

    public CompanyNameNormalizer(List<NormalizationRule> suffixRules, ParentCompanyMapping parentMapping) {
        List<NormalizationRule> sorted = new ArrayList<>(suffixRules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.suffixRules = List.copyOf(sorted);
        this.parentMapping = parentMapping != null ? parentMapping : ParentCompanyMapping.empty();
        validateMapping();
    }

    /**
     * Normalizes the given company name. Returns "" for null or blank input.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String cleaned = clean(raw);
        String stripped = stripSuffixes(cleaned);
        String resolved = parentMapping.resolve(stripped);
        if (!resolved.equals(stripped)) {
            log.debug("Company '{}' resolved to parent '{}'", stripped, resolved);
        }
        return resolved;
    }

    /**
     * Checks if two company names are the same company after normalization.
     */
    public boolean areEquivalent(String company1, String company2) {
        return normalize(company1).equals(normalize(company2));
    }

    public List<NormalizationRule> getSuffixRules() {
        return suffixRules;
    }

    public ParentCompanyMapping getParentMapping() {
        return parentMapping;
    }

    /**
     * Returns a normalizer with the same suffix rules and the given parent table.
     */
    public CompanyNameNormalizer withParentMapping(ParentCompanyMapping mapping) {
        return new CompanyNameNormalizer(suffixRules, mapping);
    }

    String stripSuffixes(String value) {
        String current = value;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (NormalizationRule rule : suffixRules) {
                Optional<String> next = rule.rewrite(current);
                if (next.isPresent()) {
                    log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), current, next.get());
                    current = next.get();
                    changed = true;
                }
            }
        }
        return current;
    }

    private static String clean(String value) {
        return value.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    private void validateMapping() {
        for (Map.Entry<String, String> entry : parentMapping.getAliases().entrySet()) {
            String alias = entry.getKey();
            if (!stripSuffixes(alias).equals(alias)) {
                throw new IllegalArgumentException(
                        "Alias '" + alias + "' carries a legal suffix and can never match");
            }
            String parent = entry.getValue();
            if (!stripSuffixes(parent).equals(parent)) {
                throw new IllegalArgumentException(
                        "Parent '" + parent + "' carries a legal suffix and would not normalize to itself");
            }
        }
    }
}
