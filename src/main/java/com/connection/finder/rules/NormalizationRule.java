package com.connection.finder.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A case-insensitive rewrite of a company name. Lower priority values run first.
 *
 * @param name        rule identifier, used in logs
 * @param pattern     compiled pattern, matched case-insensitively
 * @param replacement replacement text for every match
 * @param priority    ordering among the rules of one normalizer
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    private static final String SUFFIX_SEPARATOR = "[\\s,]+";
    private static final String SUFFIX_END = "\\.?$";

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        if ((pattern.flags() & Pattern.CASE_INSENSITIVE) == 0) {
            pattern = Pattern.compile(pattern.pattern(), pattern.flags() | Pattern.CASE_INSENSITIVE);
        }
    }

    /**
     * Rule removing a trailing legal-entity word, such as ", Inc." or " LLC".
     * A separator is required before the word, so a name made only of that word never matches.
     */
    public static NormalizationRule suffix(String name, String word, int priority) {
        return new NormalizationRule(name,
                Pattern.compile(SUFFIX_SEPARATOR + Pattern.quote(word) + SUFFIX_END), "", priority);
    }

    /**
     * Returns the rewritten name, or empty when the rule does not apply or would leave
     * nothing behind.
     */
    public Optional<String> rewrite(String input) {
        if (input == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(input);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String rewritten = matcher.replaceAll(replacement).trim();
        if (rewritten.isEmpty() || rewritten.equals(input)) {
            return Optional.empty();
        }
        return Optional.of(rewritten);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizationRule other)) return false;
        return priority == other.priority
                && name.equals(other.name)
                && pattern.pattern().equals(other.pattern.pattern())
                && replacement.equals(other.replacement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pattern.pattern(), replacement, priority);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(pattern, "pattern is required");
            return new NormalizationRule(name, Pattern.compile(pattern, Pattern.CASE_INSENSITIVE),
                    replacement, priority);
        }
    }
}
