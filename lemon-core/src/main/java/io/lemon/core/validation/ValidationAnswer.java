package io.lemon.core.validation;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/// A validator's answer for one case, paired with what the workflow produced.
///
/// @param caseId id of the answered case
/// @param userAnswer the validator's expected output, trimmed
/// @param workflowOutput the workflow's output, or `ERROR: <message>` when execution failed
/// @param matched whether both agree, ignoring case and surrounding whitespace
/// @param timestamp when the answer was recorded
public record ValidationAnswer(
        String caseId, String userAnswer, String workflowOutput, boolean matched, Instant timestamp) {

    public ValidationAnswer {
        Objects.requireNonNull(caseId, "caseId must not be null");
        Objects.requireNonNull(userAnswer, "userAnswer must not be null");
        Objects.requireNonNull(workflowOutput, "workflowOutput must not be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /// Records an answer, trimming it and computing the match.
    public static ValidationAnswer of(String caseId, String userAnswer, String workflowOutput) {
        return new ValidationAnswer(
                caseId,
                userAnswer.trim(),
                workflowOutput,
                outputsMatch(userAnswer, workflowOutput),
                Instant.now());
    }

    /// Compares two outputs case-insensitively, ignoring surrounding whitespace.
    public static boolean outputsMatch(String expected, String actual) {
        return expected.trim().toLowerCase(Locale.ROOT).equals(actual.trim().toLowerCase(Locale.ROOT));
    }
}
