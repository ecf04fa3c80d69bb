package io.lemon.core;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.execution.WorkflowExecutor;
import io.lemon.core.generation.CaseGenerator;
import io.lemon.core.search.WorkflowSearchService;
import io.lemon.core.validation.InMemoryValidationSessionStore;
import io.lemon.core.validation.ValidationSessionManager;
import io.lemon.core.validation.ValidationSessionStore;
import io.lemon.core.workflow.InMemoryWorkflowRepository;
import io.lemon.core.workflow.WorkflowRepository;
import io.lemon.core.workflow.WorkflowValidator;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/// Factory for creating a wired {@link LemonEnvironment}.
///
/// ### Example
/// {@snippet :
/// try (var env = LemonFactory.builder()
///         .config(LemonConfig.builder().generationSeed(42L).build())
///         .workflowRepository(repository)
///         .build()) {
///     ExecutionResult result = env.getWorkflowExecutor().execute(workflow, inputs);
/// }
/// }
///
/// @see LemonConfig for configuration keys
public final class LemonFactory {

    private static final Logger logger = Logger.getLogger(LemonFactory.class.getName());

    private LemonFactory() {}

    /// Creates an environment with default configuration and in-memory storage.
    ///
    /// @return new environment, never null
    public static LemonEnvironment createEnvironment() {
        return createEnvironment(new LemonConfig());
    }

    /// Creates an environment with in-memory storage.
    ///
    /// @param config configuration, not null
    /// @return new environment, never null
    public static LemonEnvironment createEnvironment(LemonConfig config) {
        return builder().config(config).build();
    }

    /// Creates an environment configured from environment variables overridden by properties.
    ///
    /// @param properties overriding configuration properties, not null
    /// @return new environment, never null
    /// @see LemonConfig#load(Properties)
    public static LemonEnvironment createEnvironment(Properties properties) {
        return createEnvironment(LemonConfig.load(properties));
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link LemonEnvironment}.
    ///
    /// Components not supplied are created with defaults: in-memory workflow
    /// repository and session store, and a case generator seeded from the config.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private LemonConfig config = new LemonConfig();
        private WorkflowRepository workflowRepository;
        private ValidationSessionStore sessionStore;
        private ConditionEvaluator conditionEvaluator;

        private Builder() {}

        public Builder config(LemonConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder workflowRepository(WorkflowRepository workflowRepository) {
            this.workflowRepository = workflowRepository;
            return this;
        }

        public Builder sessionStore(ValidationSessionStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        /// Wires and returns the environment.
        ///
        /// @return new environment, never null
        public LemonEnvironment build() {
            ConditionEvaluator evaluator =
                    conditionEvaluator != null ? conditionEvaluator : new ConditionEvaluator();
            WorkflowRepository repository =
                    workflowRepository != null ? workflowRepository : new InMemoryWorkflowRepository();
            ValidationSessionStore store =
                    sessionStore != null ? sessionStore : new InMemoryValidationSessionStore();

            WorkflowExecutor executor =
                    new WorkflowExecutor(evaluator, repository, config.getMaxSteps());
            CaseGenerator generator = new CaseGenerator(evaluator, config.getGenerationSeed());
            ValidationSessionManager sessionManager =
                    new ValidationSessionManager(repository, executor, generator, store, config);

            logger.fine(
                    () ->
                            "Created Lemon environment: repository="
                                    + repository.getClass().getSimpleName()
                                    + ", maxSteps="
                                    + config.getMaxSteps());
            return new LemonEnvironment(
                    config,
                    evaluator,
                    repository,
                    executor,
                    generator,
                    store,
                    sessionManager,
                    new WorkflowSearchService(repository),
                    new WorkflowValidator(evaluator));
        }
    }
}
