package io.lemon.core.validation;

import java.util.Collection;
import java.util.List;

/// Score arithmetic for validation sessions and composed workflows.
public final class ScoreCalculator {

    private ScoreCalculator() {}

    /// Scores a list of answers.
    ///
    /// @param answers recorded answers, not null
    /// @return matches over total, {@link ValidationScore#EMPTY} for no answers
    public static ValidationScore calculate(List<ValidationAnswer> answers) {
        int matches = 0;
        for (ValidationAnswer answer : answers) {
            if (answer.matched()) {
                matches++;
            }
        }
        return new ValidationScore(matches, answers.size());
    }

    /// Rebuilds the match count behind a persisted percentage.
    ///
    /// @param score persisted percentage in `[0, 100]`
    /// @param count number of answers behind the percentage
    /// @return `round(score / 100 * count)`, 0 when count is 0
    public static int impliedMatches(double score, int count) {
        if (count <= 0) {
            return 0;
        }
        long implied = Math.round(score / 100.0 * count);
        return (int) Math.max(0, Math.min(count, implied));
    }

    /// Folds a session score into a workflow's persisted running score.
    ///
    /// @param previousScore persisted percentage
    /// @param previousCount persisted answer count
    /// @param session the new session's score, not null
    /// @return the cumulative score over all answers, never null
    public static ValidationScore merge(double previousScore, int previousCount, ValidationScore session) {
        int matches = impliedMatches(previousScore, previousCount) + session.matches();
        int total = Math.max(previousCount, 0) + session.total();
        return new ValidationScore(matches, total);
    }

    /// Blends a composed workflow's own score with its children's.
    ///
    /// The child rate is the pooled match rate over all children. The combined
    /// rate is `w * parentRate + (1 - w) * childRate` over
    /// `parent.total + sum(child.total)` answers; matches are rounded down.
    ///
    /// @param parent the workflow's own score, not null
    /// @param children scores of referenced workflows, not null
    /// @param parentWeight weight `w` of the parent's rate, in `[0, 1]`
    /// @return the combined score; `parent` itself when no child has answers
    /// @throws IllegalArgumentException if the weight is outside `[0, 1]`
    public static ValidationScore combineScores(
            ValidationScore parent, Collection<ValidationScore> children, double parentWeight) {
        if (parentWeight < 0.0 || parentWeight > 1.0 || Double.isNaN(parentWeight)) {
            throw new IllegalArgumentException(
                    "parentWeight must be within [0, 1], got " + parentWeight);
        }
        if (children.isEmpty()) {
            return parent;
        }
        int childMatches = 0;
        int childTotal = 0;
        for (ValidationScore child : children) {
            childMatches += child.matches();
            childTotal += child.total();
        }
        if (childTotal == 0) {
            return parent;
        }

        double childRate = (double) childMatches / childTotal;
        double parentRate = parent.total() == 0 ? 0.0 : (double) parent.matches() / parent.total();
        double combinedRate = parentWeight * parentRate + (1 - parentWeight) * childRate;
        int combinedTotal = parent.total() + childTotal;
        int combinedMatches = (int) (combinedRate * combinedTotal);
        return new ValidationScore(Math.min(combinedMatches, combinedTotal), combinedTotal);
    }
}
