package com.connection.finder.categorize;

import com.connection.finder.core.model.PersonCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default ordered rule list. Order is significant: recruiter keywords are checked before
 * manager keywords so that "campus recruiting manager" is a recruiter.
 */
public final class DefaultCategoryRules {

    private DefaultCategoryRules() {
        // Utility class
    }

    public static PersonCategorizer createDefaultCategorizer() {
        return new PersonCategorizer(getRules());
    }

    /**
     * Default rules plus the title-similarity peer rule, evaluated after the keyword rules.
     */
    public static PersonCategorizer createTitleAwareCategorizer() {
        List<CategoryRule> rules = new ArrayList<>(getRules());
        rules.add(new TitleSimilarityRule());
        return new PersonCategorizer(rules);
    }

    public static List<CategoryRule> getRules() {
        return List.of(recruiterRule(), managerRule(), seniorRule(), peerRule());
    }

    public static KeywordCategoryRule recruiterRule() {
        return KeywordCategoryRule.builder()
                .name("recruiter")
                .category(PersonCategory.RECRUITER)
                .keywords("recruiter", "recruiting", "talent", "staffing", "hiring", "campus", "university")
                .build();
    }

    /**
     * "manager" alone is not enough when a more senior qualifier is present.
     */
    public static KeywordCategoryRule managerRule() {
        return KeywordCategoryRule.builder()
                .name("manager")
                .category(PersonCategory.MANAGER)
                .keywords("manager")
                .excluding("senior manager", "director", "vp")
                .build();
    }

    public static KeywordCategoryRule seniorRule() {
        return KeywordCategoryRule.builder()
                .name("senior")
                .category(PersonCategory.SENIOR)
                .keywords("senior", "staff", "principal", "lead", "architect", "director", "vp")
                .build();
    }

    public static KeywordCategoryRule peerRule() {
        return KeywordCategoryRule.builder()
                .name("peer")
                .category(PersonCategory.PEER)
                .keywords("junior", "associate", "analyst", "intern", "entry")
                .build();
    }
}
