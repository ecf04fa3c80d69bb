package io.lemon.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.withSettings;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.execution.ExecutionResult;
import io.lemon.core.generation.GenerationStrategy;
import io.lemon.core.validation.ValidationSessionStore;
import io.lemon.core.workflow.InMemoryWorkflowRepository;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LemonFactory")
class LemonFactoryTest {

    private LemonEnvironment environment;

    @AfterEach
    void tearDown() throws Exception {
        if (environment != null) {
            environment.close();
        }
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("executes a workflow with default components")
        void shouldExecuteWithDefaults() {
            environment = LemonFactory.builder().build();
            environment.getWorkflowRepository().save(TestWorkflows.ageCheck());

            ExecutionResult result =
                    environment.getWorkflowExecutor().execute(TestWorkflows.ageCheck(), Map.of("age", 30));

            assertThat(result.success()).isTrue();
            assertThat(result.output()).isEqualTo("adult");
            assertThat(environment.getWorkflowRepository()).isInstanceOf(InMemoryWorkflowRepository.class);
            assertThat(environment.getSearchService().countAll()).isEqualTo(1);
            assertThat(environment.getWorkflowValidator().validate(TestWorkflows.ageCheck())).isEmpty();
        }

        @Test
        @DisplayName("wires supplied components")
        void shouldWireSuppliedComponents() {
            InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository();
            ConditionEvaluator evaluator = new ConditionEvaluator();

            environment =
                    LemonFactory.builder()
                            .workflowRepository(repository)
                            .conditionEvaluator(evaluator)
                            .build();

            assertThat(environment.getWorkflowRepository()).isSameAs(repository);
            assertThat(environment.getConditionEvaluator()).isSameAs(evaluator);
        }

        @Test
        @DisplayName("applies config to executor and sessions")
        void shouldApplyConfig() throws Exception {
            LemonConfig config =
                    LemonConfig.builder()
                            .maxSteps(25)
                            .generationSeed(42L)
                            .defaultCaseCount(4)
                            .defaultStrategy(GenerationStrategy.RANDOM)
                            .build();
            environment = LemonFactory.createEnvironment(config);
            environment.getWorkflowRepository().save(TestWorkflows.ageCheck());

            String sessionId = environment.getSessionManager().startSession("age-check");

            assertThat(environment.getConfig()).isSameAs(config);
            assertThat(environment.getWorkflowExecutor().getMaxSteps()).isEqualTo(25);
            assertThat(environment.getSessionManager().getSession(sessionId).getCases()).hasSize(4);
        }

        @Test
        @DisplayName("produces identical cases for the same seed")
        void shouldGenerateReproducibleCases() throws Exception {
            LemonConfig config = LemonConfig.builder().generationSeed(42L).build();

            try (LemonEnvironment first = LemonFactory.createEnvironment(config);
                    LemonEnvironment second = LemonFactory.createEnvironment(config)) {
                assertThat(first.getCaseGenerator().generate(TestWorkflows.ageCheck(), 5))
                        .isEqualTo(second.getCaseGenerator().generate(TestWorkflows.ageCheck(), 5));
            }
        }
    }

    @Test
    @DisplayName("loads config from properties")
    void shouldCreateFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(LemonConfig.MAX_STEPS_KEY, "12");

        environment = LemonFactory.createEnvironment(properties);

        assertThat(environment.getConfig().getMaxSteps()).isEqualTo(12);
    }

    @Test
    @DisplayName("closes closeable components")
    void shouldCloseCloseableStore() throws Exception {
        ValidationSessionStore store =
                mock(ValidationSessionStore.class, withSettings().extraInterfaces(AutoCloseable.class));

        LemonFactory.builder().sessionStore(store).build().close();

        verify((AutoCloseable) store).close();
    }
}
