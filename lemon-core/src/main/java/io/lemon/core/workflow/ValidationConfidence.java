package io.lemon.core.workflow;

/// Coarse trust bucket derived from how many validation answers a workflow has accumulated.
///
/// | Count   | Confidence |
/// |---------|------------|
/// | 0       | NONE       |
/// | 1-9     | LOW        |
/// | 10-49   | MEDIUM     |
/// | 50+     | HIGH       |
public enum ValidationConfidence {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    /// Score a workflow needs, together with at least {@link #MEDIUM} confidence, to count as validated.
    public static final double VALIDATED_SCORE_THRESHOLD = 80.0;

    public static ValidationConfidence fromCount(int count) {
        if (count <= 0) {
            return NONE;
        }
        if (count < 10) {
            return LOW;
        }
        if (count < 50) {
            return MEDIUM;
        }
        return HIGH;
    }

    /// Returns whether a score with this confidence counts as validated.
    ///
    /// @param score percentage in `[0, 100]`
    /// @return true when the score reaches the threshold and confidence is medium or high
    public boolean validates(double score) {
        return score >= VALIDATED_SCORE_THRESHOLD && (this == MEDIUM || this == HIGH);
    }
}
