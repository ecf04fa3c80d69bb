package io.lemon.core.search;

import io.lemon.core.workflow.ValidationConfidence;
import io.lemon.core.workflow.WorkflowFilter;
import io.lemon.core.workflow.WorkflowRepository;
import io.lemon.core.workflow.WorkflowSummary;
import io.lemon.core.workflow.block.InputType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Query facade over the workflow library.
///
/// Wraps {@link WorkflowRepository#list} with the lookups authors need when
/// browsing for a workflow to reuse or compose.
public class WorkflowSearchService {

    private final WorkflowRepository repository;

    public WorkflowSearchService(WorkflowRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    public List<WorkflowSummary> search(WorkflowFilter filter) {
        return repository.list(filter);
    }

    /// Finds workflows whose name, description, domain or tags contain the text,
    /// case-insensitively.
    ///
    /// @param text search text, not null; blank matches everything
    /// @param limit maximum number of results, or null for no limit
    /// @return matches, most recently updated first, never null
    public List<WorkflowSummary> searchByText(String text, Integer limit) {
        String needle = text.trim().toLowerCase(Locale.ROOT);
        List<WorkflowSummary> matches =
                repository.list(WorkflowFilter.NONE).stream()
                        .filter(summary -> needle.isEmpty() || matchesText(summary, needle))
                        .toList();
        return limit != null && matches.size() > limit ? matches.subList(0, limit) : matches;
    }

    public List<String> listDomains() {
        return repository.listDomains();
    }

    public List<String> listTags() {
        return repository.listTags();
    }

    /// Counts workflows per domain.
    ///
    /// @return domain to workflow count, in domain order, never null
    public Map<String, Integer> domainCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String domain : repository.listDomains()) {
            counts.put(domain, repository.count(WorkflowFilter.builder().domain(domain).build()));
        }
        return counts;
    }

    public List<WorkflowSummary> listByDomain(String domain) {
        return search(WorkflowFilter.builder().domain(domain).build());
    }

    public List<WorkflowSummary> listByTag(String tag) {
        return search(WorkflowFilter.builder().tags(List.of(tag)).build());
    }

    public List<WorkflowSummary> findByInput(String inputName) {
        return search(WorkflowFilter.builder().hasInput(inputName).build());
    }

    public List<WorkflowSummary> findByInputType(InputType inputType) {
        return search(WorkflowFilter.builder().hasInputType(inputType).build());
    }

    public List<WorkflowSummary> findByOutput(String outputValue) {
        return search(WorkflowFilter.builder().hasOutput(outputValue).build());
    }

    /// Finds workflows whose outputs could feed the given input names.
    ///
    /// Matches output values against input names literally: a workflow that can
    /// output `ckd_stage` is offered for an input named `ckd_stage`.
    ///
    /// @param requiredInputs input names a composed workflow needs, not null
    /// @return distinct matches in the order found, never null
    public List<WorkflowSummary> findComposableForInputs(List<String> requiredInputs) {
        Map<String, WorkflowSummary> results = new LinkedHashMap<>();
        for (String inputName : requiredInputs) {
            for (WorkflowSummary summary : findByOutput(inputName)) {
                results.putIfAbsent(summary.id(), summary);
            }
        }
        return List.copyOf(results.values());
    }

    /// Finds workflows that declare inputs named like the given outputs.
    ///
    /// @param availableOutputs output values available from some workflow, not null
    /// @return distinct matches in the order found, never null
    public List<WorkflowSummary> findConsumersOfOutputs(List<String> availableOutputs) {
        Map<String, WorkflowSummary> results = new LinkedHashMap<>();
        for (String output : availableOutputs) {
            for (WorkflowSummary summary : findByInput(output)) {
                results.putIfAbsent(summary.id(), summary);
            }
        }
        return List.copyOf(results.values());
    }

    /// Finds workflows scoring at least the given percentage.
    ///
    /// @param minScore minimum validation score in `[0, 100]`
    /// @return matches, never null
    public List<WorkflowSummary> findValidated(double minScore) {
        return search(WorkflowFilter.builder().minValidation(minScore).build());
    }

    public List<WorkflowSummary> findValidated() {
        return findValidated(ValidationConfidence.VALIDATED_SCORE_THRESHOLD);
    }

    public List<WorkflowSummary> findUnvalidated() {
        return search(WorkflowFilter.builder().isValidated(false).build());
    }

    /// Finds workflows with some validation that have not yet reached the
    /// validated threshold.
    public List<WorkflowSummary> findNeedsValidation() {
        return search(WorkflowFilter.builder().minValidation(1.0).isValidated(false).build());
    }

    public List<WorkflowSummary> findValidatedByDomain(String domain) {
        return search(WorkflowFilter.builder().domain(domain).isValidated(true).build());
    }

    public int countAll() {
        return repository.count(WorkflowFilter.NONE);
    }

    public int countValidated() {
        return repository.count(WorkflowFilter.builder().isValidated(true).build());
    }

    private static boolean matchesText(WorkflowSummary summary, String needle) {
        if (contains(summary.name(), needle)
                || contains(summary.description(), needle)
                || contains(summary.domain(), needle)) {
            return true;
        }
        return summary.tags().stream().anyMatch(tag -> contains(tag, needle));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
