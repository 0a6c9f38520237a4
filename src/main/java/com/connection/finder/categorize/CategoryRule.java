package com.connection.finder.categorize;

import com.connection.finder.core.model.PersonCategory;

/**
 * One entry of the categorizer's ordered rule list.
 * The first rule that matches a person's title decides the category.
 */
public interface CategoryRule {

    /**
     * Returns the name of this rule.
     */
    String getName();

    /**
     * Returns the category assigned when this rule matches.
     */
    PersonCategory getCategory();

    /**
     * Tests the rule against a lowercase title.
     *
     * @param title       the person's lowercase title text, never null
     * @param targetTitle the lowercase title being targeted, possibly empty
     */
    boolean matches(String title, String targetTitle);
}
