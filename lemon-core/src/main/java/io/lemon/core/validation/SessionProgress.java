package io.lemon.core.validation;

/// Position within a session's case list.
///
/// @param current index of the next case to answer
/// @param total number of cases
/// @param remaining cases not yet answered or skipped
public record SessionProgress(int current, int total, int remaining) {}
