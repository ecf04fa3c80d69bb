package io.lemon.core.validation;

import io.lemon.core.generation.ValidationCase;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A run of generated cases shown to a human validator, one at a time.
///
/// The case list is fixed at creation. Answers accumulate as the validator
/// works through the cases; skipped cases advance the index without an answer.
///
/// @implNote Mutations happen only through {@link ValidationSessionManager},
/// which holds this object's monitor while changing it. Getters synchronize on
/// the same monitor and return snapshots.
public final class ValidationSession {

    private final String id;
    private final String workflowId;
    private final List<ValidationCase> cases;
    private final List<ValidationAnswer> answers = new ArrayList<>();
    private final Instant createdAt;
    private int currentIndex;
    private SessionStatus status = SessionStatus.IN_PROGRESS;
    private ValidationScore completedScore;

    public ValidationSession(String id, String workflowId, List<ValidationCase> cases) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId must not be null");
        this.cases = List.copyOf(cases);
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<ValidationCase> getCases() {
        return cases;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized List<ValidationAnswer> getAnswers() {
        return List.copyOf(answers);
    }

    public synchronized int getCurrentIndex() {
        return currentIndex;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    /// Returns whether every case has been answered or skipped.
    public synchronized boolean isComplete() {
        return currentIndex >= cases.size();
    }

    public synchronized SessionProgress getProgress() {
        return new SessionProgress(currentIndex, cases.size(), cases.size() - currentIndex);
    }

    /// Returns the case awaiting an answer.
    ///
    /// @return the current case, or empty when the session is terminal or exhausted
    public synchronized Optional<ValidationCase> getCurrentCase() {
        if (status.isTerminal() || isComplete()) {
            return Optional.empty();
        }
        return Optional.of(cases.get(currentIndex));
    }

    public synchronized ValidationScore getScore() {
        return ScoreCalculator.calculate(answers);
    }

    /// Returns the workflow's cumulative score as merged when this session completed.
    ///
    /// @return the merged score, or empty unless the session is completed
    public synchronized Optional<ValidationScore> getCompletedScore() {
        return Optional.ofNullable(completedScore);
    }

    void recordAnswer(ValidationAnswer answer) {
        answers.add(answer);
        currentIndex++;
    }

    void skip() {
        currentIndex++;
    }

    void setStatus(SessionStatus status) {
        this.status = status;
    }

    void complete(ValidationScore mergedScore) {
        this.completedScore = Objects.requireNonNull(mergedScore, "mergedScore must not be null");
        this.status = SessionStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "ValidationSession{id=" + id + ", workflowId=" + workflowId + ", status=" + getStatus() + "}";
    }
}
