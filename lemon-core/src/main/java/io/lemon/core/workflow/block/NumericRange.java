package io.lemon.core.workflow.block;

/// Optional inclusive bounds for a numeric input.
///
/// Either bound may be null, meaning unbounded on that side.
///
/// @param min lower bound, inclusive, may be null
/// @param max upper bound, inclusive, may be null
public record NumericRange(Double min, Double max) {

    public NumericRange {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException(
                    "Range min must be less than or equal to max, got " + min + " > " + max);
        }
    }

    public static NumericRange of(double min, double max) {
        return new NumericRange(min, max);
    }

    public boolean contains(double value) {
        return (min == null || min <= value) && (max == null || value <= max);
    }
}
