package io.lemon.core.validation;

import io.lemon.core.LemonConfig;
import io.lemon.core.exception.SessionCompletedException;
import io.lemon.core.exception.SessionNotFoundException;
import io.lemon.core.exception.WorkflowNotFoundException;
import io.lemon.core.execution.ExecutionResult;
import io.lemon.core.execution.WorkflowExecutor;
import io.lemon.core.generation.CaseGenerator;
import io.lemon.core.generation.GenerationStrategy;
import io.lemon.core.generation.ValidationCase;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.WorkflowMetadata;
import io.lemon.core.workflow.WorkflowRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/// Drives human validation of workflows.
///
/// A session pairs generated cases with the validator's answers. Each answer
/// executes the workflow on the case inputs and compares the result with the
/// answer; completing the session folds its score into the workflow's
/// persisted running score.
///
/// ### Session flow
/// {@snippet :
/// String sessionId = manager.startSession("triage", 20, GenerationStrategy.COMPREHENSIVE);
/// Optional<ValidationCase> current;
/// while ((current = manager.getCurrentCase(sessionId)).isPresent()) {
///     ValidationAnswer answer = manager.submitAnswer(sessionId, askHuman(current.get()));
/// }
/// ValidationScore cumulative = manager.completeSession(sessionId);
/// }
///
/// ### Contracts
/// - Sessions move `IN_PROGRESS -> COMPLETED` or `IN_PROGRESS -> ABANDONED`, never back
/// - {@link #completeSession} is idempotent and writes to the repository once
/// - {@link #abandonSession} never writes to the repository
///
/// @implNote Thread-safe. Every mutation of a session runs while holding that
/// session's monitor, so concurrent calls on one session are serialized and
/// calls on different sessions proceed in parallel. Completing sessions also
/// takes a per-workflow lock around the read-merge-write of the running score.
public class ValidationSessionManager {

    private static final Logger logger = Logger.getLogger(ValidationSessionManager.class.getName());

    private final WorkflowRepository repository;
    private final WorkflowExecutor executor;
    private final CaseGenerator caseGenerator;
    private final ValidationSessionStore store;
    private final LemonConfig config;
    private final ConcurrentMap<String, Object> workflowLocks = new ConcurrentHashMap<>();

    public ValidationSessionManager(
            WorkflowRepository repository,
            WorkflowExecutor executor,
            CaseGenerator caseGenerator,
            ValidationSessionStore store,
            LemonConfig config) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.caseGenerator = Objects.requireNonNull(caseGenerator, "caseGenerator must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Starts a session with the configured case count and strategy.
    ///
    /// @see #startSession(String, int, GenerationStrategy)
    public String startSession(String workflowId) throws WorkflowNotFoundException {
        return startSession(workflowId, config.getDefaultCaseCount(), config.getDefaultStrategy());
    }

    /// Starts a session, generating its cases up front.
    ///
    /// @param workflowId workflow to validate, not null
    /// @param caseCount number of random cases; ignored by the boundary strategy
    /// @param strategy case generation strategy, not null
    /// @return the new session id (12 hex characters), never null
    /// @throws WorkflowNotFoundException if the workflow does not exist
    public String startSession(String workflowId, int caseCount, GenerationStrategy strategy)
            throws WorkflowNotFoundException {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Workflow workflow = loadWorkflow(workflowId);

        List<ValidationCase> cases;
        synchronized (caseGenerator) {
            cases = caseGenerator.generate(workflow, strategy, caseCount);
        }

        ValidationSession session =
                new ValidationSession(
                        UUID.randomUUID().toString().replace("-", "").substring(0, 12),
                        workflowId,
                        cases);
        store.put(session);
        logger.info(
                "Started validation session "
                        + session.getId()
                        + " for workflow "
                        + workflowId
                        + " with "
                        + cases.size()
                        + " "
                        + strategy.name().toLowerCase(Locale.ROOT)
                        + " cases");
        return session.getId();
    }

    /// Returns a session.
    ///
    /// @param sessionId the session id, not null
    /// @return the session, never null
    /// @throws SessionNotFoundException if the session does not exist
    public ValidationSession getSession(String sessionId) throws SessionNotFoundException {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return store.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /// Lists sessions for a workflow, oldest first.
    ///
    /// @param workflowId workflow id, or null for every session
    /// @return sessions, never null
    public List<ValidationSession> listSessions(String workflowId) {
        List<ValidationSession> sessions = new ArrayList<>();
        for (ValidationSession session : store.all()) {
            if (workflowId == null || workflowId.equals(session.getWorkflowId())) {
                sessions.add(session);
            }
        }
        sessions.sort(Comparator.comparing(ValidationSession::getCreatedAt));
        return sessions;
    }

    /// Returns the case awaiting an answer.
    ///
    /// @param sessionId the session id, not null
    /// @return the case, or empty when the session is terminal or every case is done
    /// @throws SessionNotFoundException if the session does not exist
    public Optional<ValidationCase> getCurrentCase(String sessionId) throws SessionNotFoundException {
        return getSession(sessionId).getCurrentCase();
    }

    /// Answers the current case and advances.
    ///
    /// The workflow is reloaded and executed on the case inputs. A failed
    /// execution is compared as `ERROR: <message>`.
    ///
    /// @param sessionId the session id, not null
    /// @param userAnswer the validator's expected output, not null
    /// @return the recorded answer, never null
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionCompletedException if the session is terminal or every case is done
    /// @throws WorkflowNotFoundException if the workflow was deleted mid-session
    public ValidationAnswer submitAnswer(String sessionId, String userAnswer)
            throws SessionNotFoundException, SessionCompletedException, WorkflowNotFoundException {
        Objects.requireNonNull(userAnswer, "userAnswer must not be null");
        ValidationSession session = getSession(sessionId);
        synchronized (session) {
            requireOpen(session);
            if (session.isComplete()) {
                throw new SessionCompletedException(sessionId, "All cases already answered");
            }

            ValidationCase current = session.getCases().get(session.getCurrentIndex());
            Workflow workflow = loadWorkflow(session.getWorkflowId());
            ExecutionResult result = executor.execute(workflow, current.inputs());

            String workflowOutput;
            if (result.success()) {
                workflowOutput = result.output();
            } else {
                logger.warning(
                        "Workflow "
                                + workflow.getId()
                                + " failed on case "
                                + current.id()
                                + ": "
                                + result.error());
                workflowOutput = "ERROR: " + result.error();
            }

            ValidationAnswer answer = ValidationAnswer.of(current.id(), userAnswer, workflowOutput);
            session.recordAnswer(answer);
            return answer;
        }
    }

    /// Skips the current case without recording an answer.
    ///
    /// @param sessionId the session id, not null
    /// @return true if a case was skipped, false if none remained
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionCompletedException if the session is terminal
    public boolean skipCase(String sessionId)
            throws SessionNotFoundException, SessionCompletedException {
        ValidationSession session = getSession(sessionId);
        synchronized (session) {
            requireOpen(session);
            if (session.isComplete()) {
                return false;
            }
            session.skip();
            return true;
        }
    }

    /// Scores the answers recorded so far.
    ///
    /// @param sessionId the session id, not null
    /// @return the score, never null
    /// @throws SessionNotFoundException if the session does not exist
    public ValidationScore getScore(String sessionId) throws SessionNotFoundException {
        return getSession(sessionId).getScore();
    }

    /// Completes a session and merges its score into the workflow's running score.
    ///
    /// The persisted pair `(score, count)` is converted back to matches with
    /// {@link ScoreCalculator#impliedMatches}, the session's matches and totals
    /// are added, and the new percentage and count are written back. The
    /// merged score is kept on the session, so calling this again returns it
    /// without writing. When the workflow no longer exists, nothing is written
    /// and the session's own score is returned.
    ///
    /// @param sessionId the session id, not null
    /// @return the workflow's cumulative score after the merge, never null
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionCompletedException if the session was abandoned
    public ValidationScore completeSession(String sessionId)
            throws SessionNotFoundException, SessionCompletedException {
        ValidationSession session = getSession(sessionId);
        synchronized (session) {
            if (session.getStatus() == SessionStatus.COMPLETED) {
                return session.getCompletedScore().orElseGet(session::getScore);
            }
            if (session.getStatus() == SessionStatus.ABANDONED) {
                throw new SessionCompletedException(sessionId, "Session was abandoned");
            }
            ValidationScore score = session.getScore();
            ValidationScore cumulative = mergeIntoWorkflow(session, score);
            session.complete(cumulative);
            return cumulative;
        }
    }

    /// Reads, merges and writes back a workflow's running score while holding
    /// that workflow's lock, so sessions completing concurrently on the same
    /// workflow never overwrite each other's contribution.
    private ValidationScore mergeIntoWorkflow(ValidationSession session, ValidationScore score) {
        String workflowId = session.getWorkflowId();
        synchronized (workflowLocks.computeIfAbsent(workflowId, id -> new Object())) {
            Optional<Workflow> workflow = repository.get(workflowId);
            if (workflow.isEmpty()) {
                logger.warning(
                        "Workflow "
                                + workflowId
                                + " no longer exists, session "
                                + session.getId()
                                + " score not persisted");
                return score;
            }

            WorkflowMetadata metadata = workflow.get().getMetadata();
            ValidationScore cumulative =
                    ScoreCalculator.merge(
                            metadata.validationScore(), metadata.validationCount(), score);
            repository.updateValidation(workflowId, cumulative.score(), cumulative.total());
            logger.info(
                    "Completed validation session "
                            + session.getId()
                            + ": "
                            + score.matches()
                            + "/"
                            + score.total()
                            + ", workflow "
                            + workflowId
                            + " now at "
                            + String.format("%.1f", cumulative.score())
                            + "% over "
                            + cumulative.total());
            return cumulative;
        }
    }

    /// Abandons a session. Nothing is written to the repository.
    ///
    /// @param sessionId the session id, not null
    /// @throws SessionNotFoundException if the session does not exist
    /// @throws SessionCompletedException if the session was already completed
    public void abandonSession(String sessionId)
            throws SessionNotFoundException, SessionCompletedException {
        ValidationSession session = getSession(sessionId);
        synchronized (session) {
            if (session.getStatus() == SessionStatus.COMPLETED) {
                throw new SessionCompletedException(sessionId, "Session already completed");
            }
            if (session.getStatus() == SessionStatus.IN_PROGRESS) {
                session.setStatus(SessionStatus.ABANDONED);
                logger.info("Abandoned validation session " + sessionId);
            }
        }
    }

    /// Computes a composed workflow's score from its own persisted score and
    /// those of the workflows it references directly.
    ///
    /// Referenced workflows that no longer exist are ignored.
    ///
    /// @param workflowId the workflow, not null
    /// @return combined score weighted by the configured parent weight, never null
    /// @throws WorkflowNotFoundException if the workflow does not exist
    public ValidationScore getCompositeScore(String workflowId) throws WorkflowNotFoundException {
        Workflow workflow = loadWorkflow(workflowId);
        List<ValidationScore> children = new ArrayList<>();
        for (String refId : workflow.getReferencedWorkflowIds()) {
            repository.get(refId).ifPresent(child -> children.add(persistedScore(child)));
        }
        return ScoreCalculator.combineScores(
                persistedScore(workflow), children, config.getCompositionParentWeight());
    }

    private static ValidationScore persistedScore(Workflow workflow) {
        WorkflowMetadata metadata = workflow.getMetadata();
        return new ValidationScore(
                ScoreCalculator.impliedMatches(metadata.validationScore(), metadata.validationCount()),
                metadata.validationCount());
    }

    private Workflow loadWorkflow(String workflowId) throws WorkflowNotFoundException {
        return repository.get(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private static void requireOpen(ValidationSession session) throws SessionCompletedException {
        switch (session.getStatus()) {
            case COMPLETED -> throw new SessionCompletedException(session.getId(), "Session already completed");
            case ABANDONED -> throw new SessionCompletedException(session.getId(), "Session was abandoned");
            case IN_PROGRESS -> {
                // open
            }
        }
    }
}
