package io.lemon.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `Position`. Editors may attach extra canvas attributes
/// (size, color); those are dropped on read.
@JsonPropertyOrder({"x", "y"})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class PositionMixin {}
