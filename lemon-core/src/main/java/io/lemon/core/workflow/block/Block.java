package io.lemon.core.workflow.block;

import java.util.Objects;

/// Base class for the four workflow block variants.
///
/// Blocks are the vertices of a workflow graph. Every block has an identifier
/// unique within its workflow, an editor {@link Position} and an optional
/// free-text description. The hierarchy is closed: executors dispatch on
/// {@link #getBlockType()} with an exhaustive switch.
///
/// ### Variants
/// - {@link InputBlock} - typed workflow input declaration
/// - {@link DecisionBlock} - boolean branch on a condition
/// - {@link OutputBlock} - terminal result
/// - {@link WorkflowRefBlock} - composition of another workflow
///
/// @implNote Subclasses are immutable after construction.
public abstract sealed class Block permits InputBlock, DecisionBlock, OutputBlock, WorkflowRefBlock {

    protected final String id;
    protected final Position position;
    protected final String description;

    protected Block(String id, Position position, String description) {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Block id is required");
        }
        this.id = id;
        this.position = position != null ? position : Position.ORIGIN;
        this.description = description;
    }

    /// Returns the block identifier.
    ///
    /// @return id unique within the owning workflow, never null
    public String getId() {
        return id;
    }

    /// Returns the editor position.
    ///
    /// @return position, never null
    public Position getPosition() {
        return position;
    }

    /// Returns the free-text description.
    ///
    /// @return description, or null if not set
    public String getDescription() {
        return description;
    }

    /// Returns the variant discriminator used for dispatch and serialization.
    ///
    /// @return block type, never null
    public abstract BlockType getBlockType();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Block other = (Block) o;
        return id.equals(other.id)
                && position.equals(other.position)
                && Objects.equals(description, other.description)
                && sameContent(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getBlockType(), id);
    }

    /// Compares variant-specific fields. Called only with an instance of the same class.
    protected abstract boolean sameContent(Block other);
}
