package com.connection.finder.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A raw person record as emitted by a single source provider.
 * Immutable; blank optional values are stored as absent.
 */
public final class PersonRecord {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    private final String name;
    private final String company;
    private final String source;
    private final double confidence;
    private final Instant observedAt;
    private final Map<PersonField, String> fields;
    private final Set<String> skills;

    private PersonRecord(Builder builder) {
        this.name = builder.name;
        this.company = builder.company;
        this.source = builder.source;
        this.confidence = clampConfidence(builder.confidence);
        this.observedAt = builder.observedAt != null ? builder.observedAt : Instant.now();
        this.fields = Collections.unmodifiableMap(new EnumMap<>(builder.fields));
        this.skills = Collections.unmodifiableSet(new LinkedHashSet<>(builder.skills));
    }

    public String getName() {
        return name;
    }

    public String getCompany() {
        return company;
    }

    public String getSource() {
        return source;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    /**
     * Returns the value of an optional field, or null when absent.
     */
    public String get(PersonField field) {
        return fields.get(field);
    }

    public Map<PersonField, String> getFields() {
        return fields;
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
        return skills;
    }

    /**
     * A record is well formed when both name and company are non-empty after trimming.
     */
    public boolean isWellFormed() {
        return name != null && !name.isBlank() && company != null && !company.isBlank();
    }

    static double clampConfidence(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PersonRecord that = (PersonRecord) o;
        return Double.compare(that.confidence, confidence) == 0
                && Objects.equals(name, that.name)
                && Objects.equals(company, that.company)
                && Objects.equals(source, that.source)
                && Objects.equals(observedAt, that.observedAt)
                && fields.equals(that.fields)
                && skills.equals(that.skills);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, company, source, confidence, observedAt, fields, skills);
    }

    @Override
    public String toString() {
        return "PersonRecord{" +
                "name='" + name + '\'' +
                ", company='" + company + '\'' +
                ", title='" + getTitle() + '\'' +
                ", source='" + source + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String company;
        private String source;
        private double confidence = DEFAULT_CONFIDENCE;
        private Instant observedAt;
        private final Map<PersonField, String> fields = new EnumMap<>(PersonField.class);
        private final Set<String> skills = new LinkedHashSet<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder field(PersonField field, String value) {
            Objects.requireNonNull(field, "field is required");
            if (value == null || value.isBlank()) {
                fields.remove(field);
            } else {
                fields.put(field, value.trim());
            }
            return this;
        }

        public Builder title(String title) {
            return field(PersonField.TITLE, title);
        }

        public Builder linkedinUrl(String linkedinUrl) {
            return field(PersonField.LINKEDIN_URL, linkedinUrl);
        }

        public Builder email(String email) {
            return field(PersonField.EMAIL, email);
        }

        public Builder twitterUrl(String twitterUrl) {
            return field(PersonField.TWITTER_URL, twitterUrl);
        }

        public Builder githubUrl(String githubUrl) {
            return field(PersonField.GITHUB_URL, githubUrl);
        }

        public Builder department(String department) {
            return field(PersonField.DEPARTMENT, department);
        }

        public Builder location(String location) {
            return field(PersonField.LOCATION, location);
        }

        public Builder evidenceUrl(String evidenceUrl) {
            return field(PersonField.EVIDENCE_URL, evidenceUrl);
        }

        public Builder skill(String skill) {
            if (skill != null && !skill.isBlank()) {
                skills.add(skill.trim());
            }
            return this;
        }

        public Builder skills(Collection<String> skills) {
            if (skills != null) {
                skills.forEach(this::skill);
            }
            return this;
        }

        public PersonRecord build() {
            Objects.requireNonNull(source, "source is required");
            return new PersonRecord(this);
        }
    }
}
