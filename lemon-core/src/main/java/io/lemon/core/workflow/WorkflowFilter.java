package io.lemon.core.workflow;

import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.InputType;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/// Query criteria for {@link WorkflowRepository#list}.
///
/// Every non-null criterion must hold for a workflow to match. `tags` matches
/// when the workflow carries any of the listed tags; `nameContains` is
/// case-insensitive. `offset` and `limit` apply after ordering by
/// `updatedAt` descending.
public record WorkflowFilter(
        String domain,
        List<String> tags,
        String hasInput,
        InputType hasInputType,
        String hasOutput,
        Double minValidation,
        Double maxValidation,
        String creatorId,
        String nameContains,
        Boolean isValidated,
        Integer limit,
        Integer offset) {

    public static final WorkflowFilter NONE = builder().build();

    public WorkflowFilter {
        tags = tags != null ? List.copyOf(tags) : List.of();
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    /// Returns whether no criterion and no pagination is set.
    public boolean isEmpty() {
        return this.equals(NONE);
    }

    public WorkflowFilter withoutPagination() {
        return new WorkflowFilter(
                domain,
                tags,
                hasInput,
                hasInputType,
                hasOutput,
                minValidation,
                maxValidation,
                creatorId,
                nameContains,
                isValidated,
                null,
                null);
    }

    /// Tests a single workflow against the criteria (pagination ignored).
    ///
    /// @param workflow the workflow to test, not null
    /// @return true if every set criterion holds
    public boolean matches(Workflow workflow) {
        WorkflowMetadata metadata = workflow.getMetadata();
        if (domain != null && !domain.equals(metadata.domain())) {
            return false;
        }
        if (!tags.isEmpty() && tags.stream().noneMatch(metadata.tags()::contains)) {
            return false;
        }
        if (hasInput != null && !workflow.getInputNames().contains(hasInput)) {
            return false;
        }
        if (hasInputType != null
                && workflow.getInputBlocks().stream()
                        .map(InputBlock::getInputType)
                        .noneMatch(hasInputType::equals)) {
            return false;
        }
        if (hasOutput != null && !workflow.getOutputValues().contains(hasOutput)) {
            return false;
        }
        if (minValidation != null && metadata.validationScore() < minValidation) {
            return false;
        }
        if (maxValidation != null && metadata.validationScore() > maxValidation) {
            return false;
        }
        if (creatorId != null && !creatorId.equals(metadata.creatorId())) {
            return false;
        }
        if (nameContains != null
                && !metadata.name()
                        .toLowerCase(Locale.ROOT)
                        .contains(nameContains.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return isValidated == null || isValidated == metadata.isValidated();
    }

    /// Filters, orders and paginates a workflow collection into summaries.
    ///
    /// @param workflows candidate workflows, not null
    /// @return matching summaries, most recently updated first, never null
    public List<WorkflowSummary> apply(Collection<Workflow> workflows) {
        return workflows.stream()
                .filter(this::matches)
                .map(WorkflowSummary::from)
                .sorted(Comparator.comparing(WorkflowSummary::updatedAt).reversed())
                .skip(offset != null ? offset : 0)
                .limit(limit != null ? limit : Long.MAX_VALUE)
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String domain;
        private List<String> tags;
        private String hasInput;
        private InputType hasInputType;
        private String hasOutput;
        private Double minValidation;
        private Double maxValidation;
        private String creatorId;
        private String nameContains;
        private Boolean isValidated;
        private Integer limit;
        private Integer offset;

        private Builder() {}

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder hasInput(String hasInput) {
            this.hasInput = hasInput;
            return this;
        }

        public Builder hasInputType(InputType hasInputType) {
            this.hasInputType = hasInputType;
            return this;
        }

        public Builder hasOutput(String hasOutput) {
            this.hasOutput = hasOutput;
            return this;
        }

        public Builder minValidation(Double minValidation) {
            this.minValidation = minValidation;
            return this;
        }

        public Builder maxValidation(Double maxValidation) {
            this.maxValidation = maxValidation;
            return this;
        }

        public Builder creatorId(String creatorId) {
            this.creatorId = creatorId;
            return this;
        }

        public Builder nameContains(String nameContains) {
            this.nameContains = nameContains;
            return this;
        }

        public Builder isValidated(Boolean isValidated) {
            this.isValidated = isValidated;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public WorkflowFilter build() {
            return new WorkflowFilter(
                    domain,
                    tags,
                    hasInput,
                    hasInputType,
                    hasOutput,
                    minValidation,
                    maxValidation,
                    creatorId,
                    nameContains,
                    isValidated,
                    limit,
                    offset);
        }
    }
}
