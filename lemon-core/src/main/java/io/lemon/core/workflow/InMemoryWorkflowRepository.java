package io.lemon.core.workflow;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// In-memory workflow repository (default implementation).
///
/// Thread-safe, no external dependencies. Stores workflows indexed by id.
///
/// ### Idempotent Save
/// Saving a workflow with an existing id overwrites the previous definition.
///
/// @implNote Uses ConcurrentHashMap for thread-safety. Validation updates are
/// applied with {@link Map#computeIfPresent} so a concurrent save and update
/// never interleave on one entry.
/// @see WorkflowRepository for contract
public final class InMemoryWorkflowRepository implements WorkflowRepository {

    private static final Logger logger = Logger.getLogger(InMemoryWorkflowRepository.class.getName());

    private final Map<String, Workflow> storage = new ConcurrentHashMap<>();

    @Override
    public String save(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");

        Workflow stored = workflow.withMetadata(workflow.getMetadata().withUpdatedAt(Instant.now()));
        storage.put(stored.getId(), stored);
        logger.fine("Saved workflow: " + stored.getId());
        return stored.getId();
    }

    @Override
    public Optional<Workflow> get(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return Optional.ofNullable(storage.get(workflowId));
    }

    @Override
    public boolean delete(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return storage.remove(workflowId) != null;
    }

    @Override
    public boolean exists(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return storage.containsKey(workflowId);
    }

    @Override
    public List<WorkflowSummary> list(WorkflowFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return filter.apply(List.copyOf(storage.values()));
    }

    @Override
    public boolean updateValidation(String workflowId, double score, int count) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        Workflow updated =
                storage.computeIfPresent(
                        workflowId,
                        (id, wf) -> wf.withMetadata(wf.getMetadata().withValidation(score, count)));
        return updated != null;
    }

    @Override
    public List<String> listDomains() {
        TreeSet<String> domains = new TreeSet<>();
        for (Workflow workflow : storage.values()) {
            if (workflow.getMetadata().domain() != null) {
                domains.add(workflow.getMetadata().domain());
            }
        }
        return List.copyOf(domains);
    }

    @Override
    public List<String> listTags() {
        TreeSet<String> tags = new TreeSet<>();
        for (Workflow workflow : storage.values()) {
            tags.addAll(workflow.getMetadata().tags());
        }
        return List.copyOf(tags);
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
