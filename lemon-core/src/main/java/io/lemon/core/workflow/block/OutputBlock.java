package io.lemon.core.workflow.block;

/// Terminal block whose value becomes the workflow result.
public final class OutputBlock extends Block {

    private final String value;

    private OutputBlock(Builder builder) {
        super(builder.id, builder.position, builder.description);
        this.value = builder.value.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the output value, trimmed.
    ///
    /// @return value, never null or blank
    public String getValue() {
        return value;
    }

    @Override
    public BlockType getBlockType() {
        return BlockType.OUTPUT;
    }

    @Override
    protected boolean sameContent(Block other) {
        return value.equals(((OutputBlock) other).value);
    }

    @Override
    public String toString() {
        return "OutputBlock{id=" + id + ", value=" + value + "}";
    }

    public static final class Builder {
        private String id;
        private Position position;
        private String description;
        private String value;

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

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        /// @throws IllegalStateException if the value is null or blank
        public OutputBlock build() {
            if (value == null || value.isBlank()) {
                throw new IllegalStateException("OutputBlock value cannot be empty");
            }
            return new OutputBlock(this);
        }
    }
}
