package com.connection.finder.categorize;

import com.connection.finder.core.model.CanonicalPerson;
import com.connection.finder.core.model.PersonCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies canonical people into functional categories by evaluating an ordered rule
 * list against their title. The first matching rule wins; no match yields UNKNOWN.
 */
public class PersonCategorizer {
    private static final Logger log = LoggerFactory.getLogger(PersonCategorizer.class);

    private final List<CategoryRule> rules;

    public PersonCategorizer(List<CategoryRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<CategoryRule> getRules() {
        return rules;
    }

    /**
     * Determines the category of a person. The title is used when present,
     * otherwise the department stands in for it.
     */
    public PersonCategory categorize(CanonicalPerson person, String targetTitle) {
        String text = person.getTitle();
        if (text == null || text.isBlank()) {
            text = person.getDepartment();
        }
        return categorizeTitle(text, targetTitle);
    }

    /**
     * Determines the category for free title text.
     */
    public PersonCategory categorizeTitle(String title, String targetTitle) {
        if (title == null || title.isBlank()) {
            return PersonCategory.UNKNOWN;
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        String lowerTarget = targetTitle == null ? "" : targetTitle.toLowerCase(Locale.ROOT).trim();
        for (CategoryRule rule : rules) {
            if (rule.matches(lowerTitle, lowerTarget)) {
                log.trace("Rule '{}' matched title '{}'", rule.getName(), title);
                return rule.getCategory();
            }
        }
        return PersonCategory.UNKNOWN;
    }

    /**
     * Sets the category on each person.
     */
    public void categorizeAll(Collection<CanonicalPerson> people, String targetTitle) {
        for (CanonicalPerson person : people) {
            person.setCategory(categorize(person, targetTitle));
        }
    }

    /**
     * Counts people per category; every category is present in the result.
     */
    public static Map<PersonCategory, Integer> countByCategory(Collection<CanonicalPerson> people) {
        Map<PersonCategory, Integer> counts = new EnumMap<>(PersonCategory.class);
        for (PersonCategory category : PersonCategory.values()) {
            counts.put(category, 0);
        }
        for (CanonicalPerson person : people) {
            counts.merge(person.getCategory(), 1, Integer::sum);
        }
        return counts;
    }
}
