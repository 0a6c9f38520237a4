package com.connection.finder.categorize;

import com.connection.finder.core.model.PersonCategory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies a person as a peer when their title, with seniority words removed, is the
 * same role as the target title. Not part of the default rule list.
 */
public class TitleSimilarityRule implements CategoryRule {

    static final List<String> SENIORITY_WORDS = List.of(
            "senior", "staff", "principal", "architect", "distinguished", "fellow",
            "junior", "jr", "sr", "i", "ii", "iii", "iv");

    private static final Pattern SENIORITY = Pattern.compile(
            "\\b(?:" + String.join("|", SENIORITY_WORDS) + ")\\b\\.?");

    @Override
    public String getName() {
        return "peer-title-similarity";
    }

    @Override
    public PersonCategory getCategory() {
        return PersonCategory.PEER;
    }

    @Override
    public boolean matches(String title, String targetTitle) {
        String core = coreRole(title);
        String targetCore = coreRole(targetTitle);
        if (core.isEmpty() || targetCore.isEmpty()) {
            return false;
        }
        return core.equals(targetCore) || core.contains(targetCore) || targetCore.contains(core);
    }

    static String coreRole(String title) {
        if (title == null) {
            return "";
        }
        return SENIORITY.matcher(title).replaceAll(" ").trim().replaceAll("\\s+", " ");
    }
}
