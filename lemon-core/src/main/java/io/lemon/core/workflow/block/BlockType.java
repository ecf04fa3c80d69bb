package io.lemon.core.workflow.block;

/// Discriminator for the closed set of workflow block variants.
///
/// @see Block#getBlockType()
public enum BlockType {
    /// Declares a named, typed workflow input.
    INPUT,
    /// Branches on a boolean condition.
    DECISION,
    /// Terminal block producing the workflow result.
    OUTPUT,
    /// Executes another stored workflow and binds its output.
    WORKFLOW_REF
}
