package io.lemon.core.workflow;

import java.time.Instant;
import java.util.List;

/// Lightweight listing view of a workflow without its graph.
public record WorkflowSummary(
        String id,
        String name,
        String description,
        String domain,
        List<String> tags,
        double validationScore,
        int validationCount,
        ValidationConfidence confidence,
        boolean validated,
        List<String> inputNames,
        List<String> outputValues,
        Instant createdAt,
        Instant updatedAt) {

    public WorkflowSummary {
        tags = List.copyOf(tags);
        inputNames = List.copyOf(inputNames);
        outputValues = List.copyOf(outputValues);
    }

    public static WorkflowSummary from(Workflow workflow) {
        WorkflowMetadata metadata = workflow.getMetadata();
        return new WorkflowSummary(
                workflow.getId(),
                metadata.name(),
                metadata.description(),
                metadata.domain(),
                metadata.tags(),
                metadata.validationScore(),
                metadata.validationCount(),
                metadata.confidence(),
                metadata.isValidated(),
                workflow.getInputNames(),
                workflow.getOutputValues(),
                metadata.createdAt(),
                metadata.updatedAt());
    }
}
