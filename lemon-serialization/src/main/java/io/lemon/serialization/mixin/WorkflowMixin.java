package io.lemon.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.lemon.core.workflow.Workflow;

/// Jackson mixin that binds `Workflow` deserialization to its builder.
///
/// Applied to `Workflow.class` via `LemonJacksonModule.setupModule()`.
/// Only `id`, `metadata`, `blocks` and `connections` are written; the typed
/// block lists and name/value projections are derived from them and are
/// ignored in both directions.
///
/// @apiNote The companion mixin {@link WorkflowBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see WorkflowBuilderMixin
/// @see io.lemon.serialization.LemonJacksonModule
@JsonDeserialize(builder = Workflow.Builder.class)
@JsonPropertyOrder({"id", "metadata", "blocks", "connections"})
@JsonIgnoreProperties({
    "inputBlocks",
    "decisionBlocks",
    "outputBlocks",
    "workflowRefBlocks",
    "inputNames",
    "outputValues",
    "referencedWorkflowIds"
})
public abstract class WorkflowMixin {}
