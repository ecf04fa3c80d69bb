package io.lemon.core.validation;

import io.lemon.core.workflow.ValidationConfidence;

/// Matched answers out of total answers.
///
/// @param matches number of matching answers, `0 <= matches <= total`
/// @param total number of answers
public record ValidationScore(int matches, int total) {

    public static final ValidationScore EMPTY = new ValidationScore(0, 0);

    public ValidationScore {
        if (total < 0 || matches < 0 || matches > total) {
            throw new IllegalArgumentException(
                    "Invalid score: " + matches + " matches out of " + total);
        }
    }

    /// Returns the match percentage.
    ///
    /// @return `matches / total * 100`, or 0 when there are no answers
    public double score() {
        return total == 0 ? 0.0 : (double) matches / total * 100.0;
    }

    public ValidationConfidence confidence() {
        return ValidationConfidence.fromCount(total);
    }

    public boolean isValidated() {
        return confidence().validates(score());
    }
}
