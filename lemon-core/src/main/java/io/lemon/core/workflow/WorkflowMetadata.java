package io.lemon.core.workflow;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Descriptive and validation-tracking information attached to a workflow.
///
/// The validation pair (`validationScore`, `validationCount`) is the persisted
/// running result of every completed validation session: a percentage of
/// matched answers and the number of answers it was computed over.
///
/// @param name display name, not null
/// @param description free text, never null (may be empty)
/// @param domain optional grouping such as "healthcare", may be null
/// @param tags unmodifiable tag list, never null
/// @param creatorId optional author id, may be null
/// @param validationScore percentage in `[0, 100]`
/// @param validationCount number of answers behind the score, non-negative
/// @param createdAt creation time, never null
/// @param updatedAt last modification time, never null
public record WorkflowMetadata(
        String name,
        String description,
        String domain,
        List<String> tags,
        String creatorId,
        double validationScore,
        int validationCount,
        Instant createdAt,
        Instant updatedAt) {

    public WorkflowMetadata {
        Objects.requireNonNull(name, "name must not be null");
        description = description != null ? description : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
        if (validationScore < 0 || validationScore > 100) {
            throw new IllegalArgumentException(
                    "validationScore must be within [0, 100], got " + validationScore);
        }
        if (validationCount < 0) {
            throw new IllegalArgumentException(
                    "validationCount must not be negative, got " + validationCount);
        }
        Instant now = Instant.now();
        createdAt = createdAt != null ? createdAt : now;
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    /// Creates metadata with only a name; every other field takes its default.
    public static WorkflowMetadata named(String name) {
        return builder().name(name).build();
    }

    public ValidationConfidence confidence() {
        return ValidationConfidence.fromCount(validationCount);
    }

    public boolean isValidated() {
        return confidence().validates(validationScore);
    }

    /// Returns a copy carrying a new validation result and a refreshed update time.
    public WorkflowMetadata withValidation(double score, int count) {
        return new WorkflowMetadata(
                name, description, domain, tags, creatorId, score, count, createdAt, Instant.now());
    }

    /// Returns a copy with the given update time.
    public WorkflowMetadata withUpdatedAt(Instant updatedAt) {
        return new WorkflowMetadata(
                name,
                description,
                domain,
                tags,
                creatorId,
                validationScore,
                validationCount,
                createdAt,
                updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private String domain;
        private List<String> tags;
        private String creatorId;
        private double validationScore;
        private int validationCount;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder creatorId(String creatorId) {
            this.creatorId = creatorId;
            return this;
        }

        public Builder validationScore(double validationScore) {
            this.validationScore = validationScore;
            return this;
        }

        public Builder validationCount(int validationCount) {
            this.validationCount = validationCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkflowMetadata build() {
            return new WorkflowMetadata(
                    name,
                    description,
                    domain,
                    tags,
                    creatorId,
                    validationScore,
                    validationCount,
                    createdAt,
                    updatedAt);
        }
    }
}
