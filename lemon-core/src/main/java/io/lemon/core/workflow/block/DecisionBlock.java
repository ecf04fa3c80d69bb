package io.lemon.core.workflow.block;

/// Branches execution on a boolean condition.
///
/// The condition is evaluated against the current variable state; execution
/// follows the `TRUE` or `FALSE` port connection, falling back to a
/// `DEFAULT` connection when the chosen port is not wired.
///
/// @see io.lemon.core.condition.ConditionEvaluator
public final class DecisionBlock extends Block {

    private final String condition;

    private DecisionBlock(Builder builder) {
        super(builder.id, builder.position, builder.description);
        this.condition = builder.condition.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the condition text, trimmed.
    ///
    /// @return condition, never null or blank
    public String getCondition() {
        return condition;
    }

    @Override
    public BlockType getBlockType() {
        return BlockType.DECISION;
    }

    @Override
    protected boolean sameContent(Block other) {
        return condition.equals(((DecisionBlock) other).condition);
    }

    @Override
    public String toString() {
        return "DecisionBlock{id=" + id + ", condition=" + condition + "}";
    }

    public static final class Builder {
        private String id;
        private Position position;
        private String description;
        private String condition;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        /// @throws IllegalStateException if the condition is null or blank
        public DecisionBlock build() {
            if (condition == null || condition.isBlank()) {
                throw new IllegalStateException("DecisionBlock condition cannot be empty");
            }
            return new DecisionBlock(this);
        }
    }
}
