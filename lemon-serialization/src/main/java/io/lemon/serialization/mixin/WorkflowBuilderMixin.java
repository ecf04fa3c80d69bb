package io.lemon.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `Workflow.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder methods
/// (`id`, `metadata`, `blocks`, `connections`).
///
/// @see WorkflowMixin
/// @see io.lemon.serialization.LemonJacksonModule
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowBuilderMixin {}
