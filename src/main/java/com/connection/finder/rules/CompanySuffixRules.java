package com.connection.finder.rules;

import java.util.List;

/**
 * Built-in rules stripping trailing legal-entity suffixes from company names.
 * Every rule is anchored at the end of the string and requires a separator before the
 * suffix, so a name that consists only of a suffix word is left alone.
 */
public final class CompanySuffixRules {

    private CompanySuffixRules() {
        // Utility class
    }

    /**
     * Creates a normalizer with the default suffix rules and parent-company table.
     */
    public static CompanyNameNormalizer createDefaultNormalizer() {
        return new CompanyNameNormalizer(getSuffixRules(), ParentCompanyMapping.defaults());
    }

    /**
     * Gets the legal-entity suffix rules.
     */
    public static List<NormalizationRule> getSuffixRules() {
        return List.of(
                NormalizationRule.suffix("company-corporation", "corporation", 10),
                NormalizationRule.suffix("company-company", "company", 10),
                NormalizationRule.suffix("company-llc", "llc", 20),
                NormalizationRule.suffix("company-inc", "inc", 20),
                NormalizationRule.suffix("company-ltd", "ltd", 20),
                NormalizationRule.suffix("company-corp", "corp", 20),
                NormalizationRule.suffix("company-co", "co", 30)
        );
    }
}
