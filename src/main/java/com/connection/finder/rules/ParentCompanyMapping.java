package com.connection.finder.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static table collapsing subsidiary and brand names onto their parent's canonical name.
 * Lookups are exact matches on the suffix-stripped, lowercase company name.
 */
public final class ParentCompanyMapping {

    private final Map<String, String> aliasToParent;

    private ParentCompanyMapping(Map<String, String> aliasToParent) {
        this.aliasToParent = Collections.unmodifiableMap(new LinkedHashMap<>(aliasToParent));
    }

    /**
     * Returns the parent name for the given stripped name, or the name itself when unmapped.
     */
    public String resolve(String strippedName) {
        if (strippedName == null) {
            return "";
        }
        return aliasToParent.getOrDefault(strippedName, strippedName);
    }

    public boolean isAlias(String name) {
        return aliasToParent.containsKey(name);
    }

    public Map<String, String> getAliases() {
        return aliasToParent;
    }

    /**
     * Returns the distinct parent names of this table.
     */
    public Set<String> getParents() {
        return new TreeSet<>(aliasToParent.values());
    }

    public int size() {
        return aliasToParent.size();
    }

    /**
     * Returns a new mapping containing this table's entries plus the other's.
     */
    public ParentCompanyMapping with(ParentCompanyMapping other) {
        Builder builder = builder();
        aliasToParent.forEach(builder::alias);
        other.aliasToParent.forEach(builder::alias);
        return builder.build();
    }

    public static ParentCompanyMapping empty() {
        return new ParentCompanyMapping(Map.of());
    }

    /**
     * Built-in table of well-known rebrands and acquisitions.
     */
    public static ParentCompanyMapping defaults() {
        return builder()
                .parent("meta", "facebook", "fb", "meta platforms", "instagram", "whatsapp", "oculus")
                .parent("alphabet", "google", "youtube", "deepmind", "waymo")
                .parent("amazon", "aws", "amazon web services", "twitch", "whole foods", "zappos")
                .parent("microsoft", "msft", "linkedin", "github", "activision blizzard")
                .parent("apple", "aapl")
                .parent("x", "twitter")
                .parent("block", "square", "cash app")
                .parent("salesforce", "slack", "tableau", "mulesoft")
                .parent("twilio", "sendgrid", "segment")
                .parent("adobe", "magento")
                .parent("jp morgan", "jpmorgan", "j.p. morgan", "jpmorgan chase", "jpm")
                .parent("goldman sachs", "goldman")
                .parent("doordash", "door dash")
                .parent("airbnb", "air bnb")
                .parent("databricks", "data bricks")
                .parent("palantir", "palantir technologies")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> aliasToParent = new LinkedHashMap<>();

        /**
         * Maps each alias onto the given parent name.
         */
        public Builder parent(String parent, String... aliases) {
            return parent(parent, List.of(aliases));
        }

        public Builder parent(String parent, Collection<String> aliases) {
            for (String alias : aliases) {
                alias(alias, parent);
            }
            return this;
        }

        public Builder alias(String alias, String parent) {
            String key = clean(Objects.requireNonNull(alias, "alias is required"));
            String value = clean(Objects.requireNonNull(parent, "parent is required"));
            if (key.isEmpty() || value.isEmpty()) {
                throw new IllegalArgumentException("alias and parent must not be blank");
            }
            if (key.equals(value)) {
                return this;
            }
            String existing = aliasToParent.get(key);
            if (existing != null && !existing.equals(value)) {
                throw new IllegalArgumentException(
                        "Alias '" + key + "' already maps to '" + existing + "', cannot remap to '" + value + "'");
            }
            aliasToParent.put(key, value);
            return this;
        }

        public ParentCompanyMapping build() {
            for (Map.Entry<String, String> entry : aliasToParent.entrySet()) {
                if (aliasToParent.containsKey(entry.getValue())) {
                    throw new IllegalArgumentException("Parent '" + entry.getValue() +
                            "' of alias '" + entry.getKey() + "' is itself an alias");
                }
            }
            return new ParentCompanyMapping(aliasToParent);
        }

        private static String clean(String value) {
            return value.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        }
    }
}
