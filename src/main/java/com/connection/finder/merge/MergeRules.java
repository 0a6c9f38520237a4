package com.connection.finder.merge;

import com.connection.finder.core.model.CanonicalPerson;
import com.connection.finder.core.model.PersonField;
import com.connection.finder.core.model.PersonRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;

/**
 * Per-field merge table applied when a record joins an existing canonical identity.
 * Every entry is a pure {@code (existing, incoming) -> merged} function.
 *
 * <p>Defaults:</p>
 * <ul>
 *   <li>optional scalar fields: first non-empty value wins</li>
 *   <li>skills: set union</li>
 *   <li>confidence: existing + fixed boost, capped at 1.0, never below the incoming value</li>
 *   <li>sources: set union of literal identifiers</li>
 * </ul>
 */
public final class MergeRules {

    public static final double DEFAULT_CONFIDENCE_BOOST = 0.2;

    private final Map<PersonField, BinaryOperator<String>> fieldMergers;
    private final BinaryOperator<Set<String>> skillsMerger;
    private final DoubleBinaryOperator confidenceMerger;
    private final boolean boostOnlyNewSources;

    private MergeRules(Builder builder) {
        Map<PersonField, BinaryOperator<String>> mergers = new EnumMap<>(PersonField.class);
        for (PersonField field : PersonField.values()) {
            mergers.put(field, builder.fieldMergers.getOrDefault(field, firstNonEmpty()));
        }
        this.fieldMergers = Collections.unmodifiableMap(mergers);
        this.skillsMerger = builder.skillsMerger;
        this.confidenceMerger = builder.confidenceMerger != null
                ? builder.confidenceMerger : boostedConfidence(builder.confidenceBoost);
        this.boostOnlyNewSources = builder.boostOnlyNewSources;
    }

    public static MergeRules defaults() {
        return builder().build();
    }

    /**
     * Keeps the existing value when it is non-empty, otherwise adopts the incoming one.
     */
    public static BinaryOperator<String> firstNonEmpty() {
        return (existing, incoming) -> isEmpty(existing) ? emptyToNull(incoming) : existing;
    }

    public static BinaryOperator<Set<String>> union() {
        return (existing, incoming) -> {
            Set<String> merged = new LinkedHashSet<>();
            if (existing != null) {
                merged.addAll(existing);
            }
            if (incoming != null) {
                merged.addAll(incoming);
            }
            return merged;
        };
    }

    /**
     * Fixed-increment corroboration boost. The incoming record's own confidence only acts
     * as a floor, so a merged identity is never less trusted than any record it absorbed.
     */
    public static DoubleBinaryOperator boostedConfidence(double boost) {
        if (boost < 0.0 || boost > 1.0) {
            throw new IllegalArgumentException("boost must be between 0.0 and 1.0");
        }
        return (existing, incoming) -> Math.max(Math.min(1.0, existing + boost), Math.min(1.0, incoming));
    }

    public BinaryOperator<String> mergerFor(PersonField field) {
        return fieldMergers.get(field);
    }

    public BinaryOperator<Set<String>> skillsMerger() {
        return skillsMerger;
    }

    public DoubleBinaryOperator confidenceMerger() {
        return confidenceMerger;
    }

    public boolean isBoostOnlyNewSources() {
        return boostOnlyNewSources;
    }

    /**
     * Merges the incoming record into the existing identity in place.
     *
     * @return true if the incoming source was not yet part of the identity
     */
    public boolean apply(CanonicalPerson existing, PersonRecord incoming) {
        Objects.requireNonNull(existing, "existing is required");
        Objects.requireNonNull(incoming, "incoming is required");

        for (Map.Entry<PersonField, BinaryOperator<String>> entry : fieldMergers.entrySet()) {
            PersonField field = entry.getKey();
            String merged = entry.getValue().apply(existing.get(field), incoming.get(field));
            existing.set(field, merged);
        }

        existing.setSkills(skillsMerger.apply(existing.getSkills(), incoming.getSkills()));

        boolean newSource = existing.addSource(incoming.getSource());
        if (newSource || !boostOnlyNewSources) {
            existing.setConfidence(confidenceMerger.applyAsDouble(
                    existing.getConfidence(), incoming.getConfidence()));
        }
        existing.observedAt(incoming.getObservedAt());
        return newSource;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }

    private static String emptyToNull(String value) {
        return isEmpty(value) ? null : value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<PersonField, BinaryOperator<String>> fieldMergers = new EnumMap<>(PersonField.class);
        private BinaryOperator<Set<String>> skillsMerger = union();
        private DoubleBinaryOperator confidenceMerger;
        private double confidenceBoost = DEFAULT_CONFIDENCE_BOOST;
        private boolean boostOnlyNewSources = false;

        public Builder field(PersonField field, BinaryOperator<String> merger) {
            fieldMergers.put(Objects.requireNonNull(field, "field is required"),
                    Objects.requireNonNull(merger, "merger is required"));
            return this;
        }

        public Builder skills(BinaryOperator<Set<String>> merger) {
            this.skillsMerger = Objects.requireNonNull(merger, "merger is required");
            return this;
        }

        public Builder confidenceBoost(double confidenceBoost) {
            if (confidenceBoost < 0.0 || confidenceBoost > 1.0) {
                throw new IllegalArgumentException("confidenceBoost must be between 0.0 and 1.0");
            }
            this.confidenceBoost = confidenceBoost;
            return this;
        }

        public Builder confidence(DoubleBinaryOperator merger) {
            this.confidenceMerger = Objects.requireNonNull(merger, "merger is required");
            return this;
        }

        /**
         * When set, a repeat record from a source already on the identity does not boost confidence.
         */
        public Builder boostOnlyNewSources(boolean boostOnlyNewSources) {
            this.boostOnlyNewSources = boostOnlyNewSources;
            return this;
        }

        public MergeRules build() {
            return new MergeRules(this);
        }
    }
}
