package io.lemon.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.lemon.core.LemonConfig;
import io.lemon.core.TestWorkflows;
import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.exception.SessionCompletedException;
import io.lemon.core.exception.SessionNotFoundException;
import io.lemon.core.exception.WorkflowNotFoundException;
import io.lemon.core.execution.WorkflowExecutor;
import io.lemon.core.generation.CaseGenerator;
import io.lemon.core.generation.GenerationStrategy;
import io.lemon.core.generation.ValidationCase;
import io.lemon.core.workflow.InMemoryWorkflowRepository;
import io.lemon.core.workflow.PortType;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.WorkflowMetadata;
import io.lemon.core.workflow.WorkflowRepository;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.InputType;
import io.lemon.core.workflow.block.OutputBlock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class ValidationSessionManagerTest {

    private static final String WORKFLOW_ID = "age-check";

    private InMemoryWorkflowRepository repository;
    private WorkflowExecutor executor;
    private ValidationSessionManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRepository();
        repository.save(TestWorkflows.ageCheck(WORKFLOW_ID));
        manager = newManager(repository, LemonConfig.builder().build());
    }

    private ValidationSessionManager newManager(WorkflowRepository repo, LemonConfig config) {
        ConditionEvaluator evaluator = new ConditionEvaluator();
        executor = new WorkflowExecutor(evaluator, repo);
        return new ValidationSessionManager(
                repo,
                executor,
                new CaseGenerator(evaluator, 42L),
                new InMemoryValidationSessionStore(),
                config);
    }

    /// The output the workflow actually produces for the session's current case.
    private String actualOutput(String sessionId) throws Exception {
        ValidationCase current = manager.getCurrentCase(sessionId).orElseThrow();
        Workflow workflow = repository.get(WORKFLOW_ID).orElseThrow();
        return executor.execute(workflow, current.inputs()).output();
    }

    private static String opposite(String output) {
        return "adult".equals(output) ? "minor" : "adult";
    }

    // -------------------------------------------------------------------------
    // Starting
    // -------------------------------------------------------------------------

    @Test
    void shouldStartSessionWithGeneratedCases() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);

        ValidationSession session = manager.getSession(sessionId);
        assertThat(sessionId).hasSize(12).matches("[0-9a-f]+");
        assertThat(session.getWorkflowId()).isEqualTo(WORKFLOW_ID);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.IN_PROGRESS);
        assertThat(session.getCases()).hasSize(2);
        assertThat(session.getProgress()).isEqualTo(new SessionProgress(0, 2, 2));
    }

    @Test
    void shouldUseConfiguredDefaults() throws Exception {
        manager =
                newManager(
                        repository,
                        LemonConfig.builder()
                                .defaultCaseCount(3)
                                .defaultStrategy(GenerationStrategy.RANDOM)
                                .build());

        String sessionId = manager.startSession(WORKFLOW_ID);

        assertThat(manager.getSession(sessionId).getCases()).hasSize(3);
    }

    @Test
    void shouldRejectUnknownWorkflow() {
        assertThatThrownBy(() -> manager.startSession("missing", 2, GenerationStrategy.RANDOM))
                .isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void shouldRejectUnknownSession() {
        assertThatThrownBy(() -> manager.getSession("nope"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void shouldListSessionsPerWorkflow() throws Exception {
        repository.save(TestWorkflows.ageCheck("other"));
        String first = manager.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
        String second = manager.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
        manager.startSession("other", 1, GenerationStrategy.RANDOM);

        assertThat(manager.listSessions(WORKFLOW_ID))
                .extracting(ValidationSession::getId)
                .containsExactlyInAnyOrder(first, second);
        assertThat(manager.listSessions(null)).hasSize(3);
    }

    // -------------------------------------------------------------------------
    // Answering
    // -------------------------------------------------------------------------

    @Test
    void shouldRecordMatchingAnswer() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        String expected = actualOutput(sessionId);

        ValidationAnswer answer = manager.submitAnswer(sessionId, "  " + expected.toUpperCase() + " ");

        assertThat(answer.matched()).isTrue();
        assertThat(answer.workflowOutput()).isEqualTo(expected);
        assertThat(manager.getSession(sessionId).getProgress()).isEqualTo(new SessionProgress(1, 2, 1));
        assertThat(manager.getScore(sessionId)).isEqualTo(new ValidationScore(1, 1));
    }

    @Test
    void shouldRecordExecutionErrorAsOutput() throws Exception {
        Workflow broken =
                Workflow.builder()
                        .id("broken")
                        .metadata(WorkflowMetadata.named("Broken"))
                        .block(InputBlock.builder().id("input_x").name("x").inputType(InputType.INT).build())
                        .block(DecisionBlock.builder().id("d1").condition("y > 1").build())
                        .block(OutputBlock.builder().id("yes").value("yes").build())
                        .connect("input_x", "d1")
                        .connect("d1", PortType.TRUE, "yes")
                        .build();
        repository.save(broken);
        String sessionId = manager.startSession("broken", 1, GenerationStrategy.RANDOM);

        ValidationAnswer answer = manager.submitAnswer(sessionId, "yes");

        assertThat(answer.workflowOutput()).startsWith("ERROR: ");
        assertThat(answer.matched()).isFalse();
    }

    @Test
    void shouldRejectAnswerWhenAllCasesDone() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
        manager.submitAnswer(sessionId, "adult");

        assertThat(manager.getCurrentCase(sessionId)).isEmpty();
        assertThatThrownBy(() -> manager.submitAnswer(sessionId, "adult"))
                .isInstanceOf(SessionCompletedException.class)
                .hasMessageContaining("All cases already answered");
    }

    @Test
    void shouldSkipWithoutAnswer() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);

        assertThat(manager.skipCase(sessionId)).isTrue();
        assertThat(manager.skipCase(sessionId)).isTrue();
        assertThat(manager.skipCase(sessionId)).isFalse();

        ValidationSession session = manager.getSession(sessionId);
        assertThat(session.getAnswers()).isEmpty();
        assertThat(session.getProgress().remaining()).isZero();
        assertThat(manager.getScore(sessionId)).isEqualTo(ValidationScore.EMPTY);
    }

    // -------------------------------------------------------------------------
    // Completion
    // -------------------------------------------------------------------------

    @Test
    void shouldAccumulateScoreAcrossSessions() throws Exception {
        String first = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        manager.submitAnswer(first, actualOutput(first));
        manager.submitAnswer(first, actualOutput(first));

        assertThat(manager.completeSession(first)).isEqualTo(new ValidationScore(2, 2));
        assertThat(manager.getScore(first)).isEqualTo(new ValidationScore(2, 2));
        WorkflowMetadata afterFirst = repository.get(WORKFLOW_ID).orElseThrow().getMetadata();
        assertThat(afterFirst.validationScore()).isEqualTo(100.0);
        assertThat(afterFirst.validationCount()).isEqualTo(2);

        String second = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        manager.submitAnswer(second, actualOutput(second));
        manager.submitAnswer(second, opposite(actualOutput(second)));

        assertThat(manager.completeSession(second)).isEqualTo(new ValidationScore(3, 4));
        assertThat(manager.completeSession(second)).isEqualTo(new ValidationScore(3, 4));
        assertThat(manager.getScore(second)).isEqualTo(new ValidationScore(1, 2));
        assertThat(manager.getSession(second).getCompletedScore())
                .contains(new ValidationScore(3, 4));
        WorkflowMetadata afterSecond = repository.get(WORKFLOW_ID).orElseThrow().getMetadata();
        assertThat(afterSecond.validationScore()).isEqualTo(75.0);
        assertThat(afterSecond.validationCount()).isEqualTo(4);
    }

    @Test
    void shouldCompleteIdempotently() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
        manager.submitAnswer(sessionId, actualOutput(sessionId));

        ValidationScore first = manager.completeSession(sessionId);
        ValidationScore second = manager.completeSession(sessionId);

        assertThat(second).isEqualTo(first);
        assertThat(repository.get(WORKFLOW_ID).orElseThrow().getMetadata().validationCount())
                .isEqualTo(1);
        assertThat(manager.getSession(sessionId).getStatus()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void shouldRejectAnswerAfterCompletion() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        manager.completeSession(sessionId);

        assertThat(manager.getCurrentCase(sessionId)).isEmpty();
        assertThatThrownBy(() -> manager.submitAnswer(sessionId, "adult"))
                .isInstanceOf(SessionCompletedException.class)
                .hasMessageContaining("Session already completed");
        assertThatThrownBy(() -> manager.skipCase(sessionId))
                .isInstanceOf(SessionCompletedException.class);
        assertThatThrownBy(() -> manager.abandonSession(sessionId))
                .isInstanceOf(SessionCompletedException.class);
    }

    @Test
    void shouldKeepScoreWhenWorkflowDeletedBeforeCompletion() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
        manager.submitAnswer(sessionId, actualOutput(sessionId));
        repository.delete(WORKFLOW_ID);

        assertThat(manager.completeSession(sessionId)).isEqualTo(new ValidationScore(1, 1));
    }

    @Test
    void shouldNotLoseScoresWhenSessionsCompleteConcurrently() throws Exception {
        WorkflowRepository slowReads = spy(repository);
        ValidationSessionManager concurrent = newManager(slowReads, LemonConfig.builder().build());
        String first = concurrent.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        String second = concurrent.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        for (String sessionId : List.of(first, second)) {
            concurrent.submitAnswer(sessionId, "adult");
            concurrent.submitAnswer(sessionId, "adult");
        }

        // Holds each read until both completions have read or the wait expires.
        CyclicBarrier bothRead = new CyclicBarrier(2);
        doAnswer(
                        invocation -> {
                            try {
                                bothRead.await(200, TimeUnit.MILLISECONDS);
                            } catch (TimeoutException | BrokenBarrierException e) {
                                // the other completion is holding the workflow lock
                            }
                            return invocation.callRealMethod();
                        })
                .when(slowReads)
                .get(WORKFLOW_ID);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ValidationScore> a = pool.submit(() -> concurrent.completeSession(first));
            Future<ValidationScore> b = pool.submit(() -> concurrent.completeSession(second));
            a.get(5, TimeUnit.SECONDS);
            b.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(repository.get(WORKFLOW_ID).orElseThrow().getMetadata().validationCount())
                .isEqualTo(4);
    }

    // -------------------------------------------------------------------------
    // Abandonment
    // -------------------------------------------------------------------------

    @Test
    void shouldAbandonWithoutPersisting() throws Exception {
        String sessionId = manager.startSession(WORKFLOW_ID, 2, GenerationStrategy.RANDOM);
        manager.submitAnswer(sessionId, actualOutput(sessionId));

        manager.abandonSession(sessionId);
        manager.abandonSession(sessionId);

        assertThat(manager.getSession(sessionId).getStatus()).isEqualTo(SessionStatus.ABANDONED);
        assertThat(repository.get(WORKFLOW_ID).orElseThrow().getMetadata().validationCount()).isZero();
        assertThatThrownBy(() -> manager.submitAnswer(sessionId, "adult"))
                .isInstanceOf(SessionCompletedException.class)
                .hasMessageContaining("Session was abandoned");
        assertThatThrownBy(() -> manager.completeSession(sessionId))
                .isInstanceOf(SessionCompletedException.class)
                .hasMessageContaining("Session was abandoned");
    }

    // -------------------------------------------------------------------------
    // Composite score
    // -------------------------------------------------------------------------

    @Test
    void shouldBlendParentAndChildScores() throws Exception {
        repository.save(TestWorkflows.parentOf("parent", WORKFLOW_ID));
        repository.updateValidation("parent", 100.0, 10);
        repository.updateValidation(WORKFLOW_ID, 50.0, 10);

        ValidationScore composite = manager.getCompositeScore("parent");

        assertThat(composite).isEqualTo(new ValidationScore(15, 20));
    }

    @Test
    void shouldIgnoreMissingChildren() throws Exception {
        repository.save(TestWorkflows.parentOf("parent", "missing"));
        repository.updateValidation("parent", 80.0, 5);

        assertThat(manager.getCompositeScore("parent")).isEqualTo(new ValidationScore(4, 5));
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class RepositoryWrites {

        @Mock private WorkflowRepository mockRepository;

        private ValidationSessionManager mocked;

        @BeforeEach
        void setUp() {
            when(mockRepository.get(WORKFLOW_ID))
                    .thenReturn(Optional.of(TestWorkflows.ageCheck(WORKFLOW_ID)));
            mocked = newManager(mockRepository, LemonConfig.builder().build());
        }

        @Test
        void shouldWriteOnceOnCompletion() throws Exception {
            String sessionId = mocked.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
            ValidationAnswer answer = mocked.submitAnswer(sessionId, "adult");

            mocked.completeSession(sessionId);
            mocked.completeSession(sessionId);

            double expected = answer.matched() ? 100.0 : 0.0;
            verify(mockRepository, times(1)).updateValidation(eq(WORKFLOW_ID), eq(expected), eq(1));
        }

        @Test
        void shouldNeverWriteOnAbandon() throws Exception {
            String sessionId = mocked.startSession(WORKFLOW_ID, 1, GenerationStrategy.RANDOM);
            mocked.submitAnswer(sessionId, "adult");

            mocked.abandonSession(sessionId);

            verify(mockRepository, never()).updateValidation(anyString(), anyDouble(), anyInt());
        }
    }
}
