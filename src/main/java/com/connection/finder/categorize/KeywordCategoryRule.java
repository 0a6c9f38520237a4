package com.connection.finder.categorize;

import com.connection.finder.core.model.PersonCategory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches when the title contains any of the keywords and none of the excluded phrases.
 * Keywords are plain substrings, so "manager" also fires on "managers" and "lead" on
 * "leadership".
 */
public class KeywordCategoryRule implements CategoryRule {
    private final String name;
    private final PersonCategory category;
    private final List<String> keywords;
    private final List<String> excludedKeywords;
    private final Pattern keywordPattern;
    private final Pattern excludedPattern;

    private KeywordCategoryRule(Builder builder) {
        this.name = builder.name;
        this.category = builder.category;
        this.keywords = List.copyOf(builder.keywords);
        this.excludedKeywords = List.copyOf(builder.excludedKeywords);
        this.keywordPattern = compile(keywords);
        this.excludedPattern = excludedKeywords.isEmpty() ? null : compile(excludedKeywords);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PersonCategory getCategory() {
        return category;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public List<String> getExcludedKeywords() {
        return excludedKeywords;
    }

    @Override
    public boolean matches(String title, String targetTitle) {
        if (title == null || title.isEmpty()) {
            return false;
        }
        if (!keywordPattern.matcher(title).find()) {
            return false;
        }
        return excludedPattern == null || !excludedPattern.matcher(title).find();
    }

    private static Pattern compile(List<String> words) {
        String alternatives = words.stream()
                .map(word -> Pattern.quote(word.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
        return Pattern.compile(alternatives, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    @Override
    public String toString() {
        return "KeywordCategoryRule{" +
                "name='" + name + '\'' +
                ", category=" + category +
                ", keywords=" + keywords +
                ", excluded=" + excludedKeywords +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private PersonCategory category;
        private List<String> keywords = List.of();
        private List<String> excludedKeywords = List.of();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(PersonCategory category) {
            this.category = category;
            return this;
        }

        public Builder keywords(String... keywords) {
            this.keywords = List.of(keywords);
            return this;
        }

        public Builder excluding(String... excludedKeywords) {
            this.excludedKeywords = List.of(excludedKeywords);
            return this;
        }

        public KeywordCategoryRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(category, "category is required");
            if (keywords.isEmpty()) {
                throw new IllegalArgumentException("at least one keyword is required");
            }
            return new KeywordCategoryRule(this);
        }
    }
}
