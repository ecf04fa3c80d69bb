package io.lemon.core;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.execution.WorkflowExecutor;
import io.lemon.core.generation.CaseGenerator;
import io.lemon.core.search.WorkflowSearchService;
import io.lemon.core.validation.ValidationSessionManager;
import io.lemon.core.validation.ValidationSessionStore;
import io.lemon.core.workflow.WorkflowRepository;
import io.lemon.core.workflow.WorkflowValidator;

/// Container holding the wired Lemon components.
///
/// ### Contracts
/// - **Postcondition**: All getters return the same instances passed to constructor
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link LemonFactory#createEnvironment()} or
/// {@link LemonFactory.Builder} rather than direct construction.
///
/// @see LemonFactory
public final class LemonEnvironment implements AutoCloseable {

    private final LemonConfig config;
    private final ConditionEvaluator conditionEvaluator;
    private final WorkflowRepository workflowRepository;
    private final WorkflowExecutor workflowExecutor;
    private final CaseGenerator caseGenerator;
    private final ValidationSessionStore sessionStore;
    private final ValidationSessionManager sessionManager;
    private final WorkflowSearchService searchService;
    private final WorkflowValidator workflowValidator;

    public LemonEnvironment(
            LemonConfig config,
            ConditionEvaluator conditionEvaluator,
            WorkflowRepository workflowRepository,
            WorkflowExecutor workflowExecutor,
            CaseGenerator caseGenerator,
            ValidationSessionStore sessionStore,
            ValidationSessionManager sessionManager,
            WorkflowSearchService searchService,
            WorkflowValidator workflowValidator) {
        this.config = config;
        this.conditionEvaluator = conditionEvaluator;
        this.workflowRepository = workflowRepository;
        this.workflowExecutor = workflowExecutor;
        this.caseGenerator = caseGenerator;
        this.sessionStore = sessionStore;
        this.sessionManager = sessionManager;
        this.searchService = searchService;
        this.workflowValidator = workflowValidator;
    }

    public LemonConfig getConfig() {
        return config;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    /// Returns the repository for workflow definitions.
    ///
    /// Defaults to {@link io.lemon.core.workflow.InMemoryWorkflowRepository} when
    /// no repository is passed to {@link LemonFactory}.
    ///
    /// @return the workflow repository, never null
    public WorkflowRepository getWorkflowRepository() {
        return workflowRepository;
    }

    public WorkflowExecutor getWorkflowExecutor() {
        return workflowExecutor;
    }

    public CaseGenerator getCaseGenerator() {
        return caseGenerator;
    }

    public ValidationSessionStore getSessionStore() {
        return sessionStore;
    }

    public ValidationSessionManager getSessionManager() {
        return sessionManager;
    }

    public WorkflowSearchService getSearchService() {
        return searchService;
    }

    public WorkflowValidator getWorkflowValidator() {
        return workflowValidator;
    }

    /// Releases closeable components. The in-memory defaults hold no resources;
    /// a repository or session store implementing {@link AutoCloseable} is closed.
    @Override
    public void close() throws Exception {
        if (sessionStore instanceof AutoCloseable closeable) {
            closeable.close();
        }
        if (workflowRepository instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
