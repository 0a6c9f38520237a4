package com.connection.finder.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The merged record representing one real-world person across all contributing sources.
 * Mutated only by the aggregator that owns it; callers receive copies.
 */
public class CanonicalPerson {
    private final IdentityKey identityKey;
    private final String name;
    private final String company;
    private final Map<PersonField, String> fields;
    private final Set<String> skills;
    private final Set<String> sources;
    private double confidence;
    private PersonCategory category;
    private final Instant firstObservedAt;
    private Instant lastObservedAt;

    private CanonicalPerson(IdentityKey identityKey, String name, String company,
                            Map<PersonField, String> fields, Set<String> skills, Set<String> sources,
                            double confidence, PersonCategory category,
                            Instant firstObservedAt, Instant lastObservedAt) {
        this.identityKey = identityKey;
        this.name = name;
        this.company = company;
        this.fields = new EnumMap<>(PersonField.class);
        this.fields.putAll(fields);
        this.skills = new LinkedHashSet<>(skills);
        this.sources = new LinkedHashSet<>(sources);
        this.confidence = confidence;
        this.category = category;
        this.firstObservedAt = firstObservedAt;
        this.lastObservedAt = lastObservedAt;
    }

    /**
     * Creates a new canonical identity from the first record observed for a key.
     */
    public static CanonicalPerson from(IdentityKey key, PersonRecord record) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(record, "record is required");
        return new CanonicalPerson(key, record.getName().trim(), record.getCompany().trim(),
                record.getFields(), record.getSkills(), Set.of(record.getSource()),
                record.getConfidence(), PersonCategory.UNKNOWN,
                record.getObservedAt(), record.getObservedAt());
    }

    /**
     * Returns an independent copy of this identity.
     */
    public CanonicalPerson copy() {
        return new CanonicalPerson(identityKey, name, company, fields, skills, sources,
                confidence, category, firstObservedAt, lastObservedAt);
    }

    public IdentityKey getIdentityKey() {
        return identityKey;
    }

    public String getName() {
        return name;
    }

    public String getCompany() {
        return company;
    }

    public String getNormalizedCompany() {
        return identityKey.company();
    }

    public String get(PersonField field) {
        return fields.get(field);
    }

    public void set(PersonField field, String value) {
        if (value == null || value.isBlank()) {
            fields.remove(field);
        } else {
            fields.put(field, value);
        }
    }

    public Map<PersonField, String> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public String getTitle() {
        return fields.get(PersonField.TITLE);
    }

    public String getLinkedinUrl() {
        return fields.get(PersonField.LINKEDIN_URL);
    }

    public String getEmail() {
        return fields.get(PersonField.EMAIL);
    }

    public String getTwitterUrl() {
        return fields.get(PersonField.TWITTER_URL);
    }

    public String getGithubUrl() {
        return fields.get(PersonField.GITHUB_URL);
    }

    public String getDepartment() {
        return fields.get(PersonField.DEPARTMENT);
    }

    public String getLocation() {
        return fields.get(PersonField.LOCATION);
    }

    public String getEvidenceUrl() {
        return fields.get(PersonField.EVIDENCE_URL);
    }

    public Set<String> getSkills() {
        return Collections.unmodifiableSet(skills);
    }

    public void setSkills(Set<String> merged) {
        skills.clear();
        skills.addAll(merged);
    }

    /**
     * Provider identifiers that contributed to this identity, in first-seen order.
     */
    public Set<String> getSources() {
        return Collections.unmodifiableSet(sources);
    }

    /**
     * Records a contributing source. Returns true if the source was not present yet.
     */
    public boolean addSource(String source) {
        return sources.add(source);
    }

    public boolean isMultiSource() {
        return sources.size() > 1;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public PersonCategory getCategory() {
        return category;
    }

    public void setCategory(PersonCategory category) {
        this.category = category != null ? category : PersonCategory.UNKNOWN;
    }

    public Instant getFirstObservedAt() {
        return firstObservedAt;
    }

    public Instant getLastObservedAt() {
        return lastObservedAt;
    }

    public void observedAt(Instant observedAt) {
        if (observedAt != null && observedAt.isAfter(lastObservedAt)) {
            this.lastObservedAt = observedAt;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalPerson that = (CanonicalPerson) o;
        return Objects.equals(identityKey, that.identityKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityKey);
    }

    @Override
    public String toString() {
        return "CanonicalPerson{" +
                "name='" + name + '\'' +
                ", company='" + company + '\'' +
                ", title='" + getTitle() + '\'' +
                ", category=" + category +
                ", confidence=" + confidence +
                ", sources=" + sources +
                '}';
    }
}
