package io.lemon.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `NumericRange`: an unbounded side is omitted rather than
/// written as `null`.
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class NumericRangeMixin {}
