package io.lemon.core.workflow;

import java.util.List;
import java.util.Optional;

/// Repository for workflow definition persistence.
///
/// The executor consumes {@link #get} to resolve workflow references; the
/// validation session manager consumes {@link #get} and {@link #updateValidation}.
/// The remaining operations serve the workflow library.
///
/// ### Idempotent Operations
/// {@link #save} overwrites any workflow with the same id and refreshes its
/// `updatedAt` timestamp.
///
/// ### Usage
/// {@snippet :
/// repository.save(workflow);
/// Optional<Workflow> wf = repository.get(workflowId);
/// List<WorkflowSummary> validated =
///         repository.list(WorkflowFilter.builder().isValidated(true).build());
/// repository.updateValidation(workflowId, 75.0, 4);
/// }
///
/// @see InMemoryWorkflowRepository for the default implementation
public interface WorkflowRepository {

    /// Saves a workflow definition (idempotent).
    ///
    /// @param workflow the workflow to persist, not null
    /// @return the workflow id, never null
    /// @throws NullPointerException if workflow is null
    String save(Workflow workflow);

    /// Finds a workflow by id.
    ///
    /// @param workflowId the workflow identifier, not null
    /// @return the workflow if found, empty otherwise
    Optional<Workflow> get(String workflowId);

    /// Deletes a workflow by id.
    ///
    /// @param workflowId the workflow to delete, not null
    /// @return true if the workflow was deleted, false if not found
    boolean delete(String workflowId);

    /// Checks if a workflow exists.
    ///
    /// @param workflowId the workflow identifier, not null
    /// @return true if the workflow exists
    boolean exists(String workflowId);

    /// Lists summaries of workflows matching the filter, most recently updated first.
    ///
    /// @param filter criteria and pagination, not null (use {@link WorkflowFilter#NONE})
    /// @return matching summaries, never null (may be empty)
    List<WorkflowSummary> list(WorkflowFilter filter);

    /// Replaces the persisted validation result of a workflow.
    ///
    /// @param workflowId the workflow to update, not null
    /// @param score percentage of matched answers in `[0, 100]`
    /// @param count number of answers behind the score
    /// @return true if the workflow existed and was updated
    boolean updateValidation(String workflowId, double score, int count);

    /// Returns all distinct non-null domains, sorted.
    ///
    /// @return sorted list, never null
    List<String> listDomains();

    /// Returns all distinct tags, sorted.
    ///
    /// @return sorted list, never null
    List<String> listTags();

    /// Counts workflows matching the filter, ignoring pagination.
    ///
    /// @param filter criteria, not null
    /// @return number of matches
    default int count(WorkflowFilter filter) {
        return list(filter.withoutPagination()).size();
    }
}
