package io.lemon.core.workflow.block;

import java.util.List;
import java.util.Objects;

/// Declares a named, typed input the caller supplies when executing a workflow.
///
/// ### Contracts
/// - `name` is non-blank
/// - {@link InputType#ENUM} requires at least one enum value
/// - numeric types never carry enum values
/// - a range is only meaningful for numeric types and is ignored by other kinds
///
/// @implNote Immutable and thread-safe after construction.
public final class InputBlock extends Block {

    private final String name;
    private final InputType inputType;
    private final NumericRange range;
    private final List<String> enumValues;
    private final boolean required;

    private InputBlock(Builder builder) {
        super(builder.id, builder.position, builder.description);
        this.name = builder.name;
        this.inputType = builder.inputType;
        this.range = builder.range;
        this.enumValues = builder.enumValues != null ? List.copyOf(builder.enumValues) : List.of();
        this.required = builder.required;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the variable name the input is bound to during execution.
    ///
    /// @return input name, never null
    public String getName() {
        return name;
    }

    public InputType getInputType() {
        return inputType;
    }

    /// Returns the inclusive numeric bounds.
    ///
    /// @return range, or null when unbounded
    public NumericRange getRange() {
        return range;
    }

    /// Returns the allowed values for {@link InputType#ENUM} inputs.
    ///
    /// @return unmodifiable list, never null (empty for non-enum inputs)
    public List<String> getEnumValues() {
        return enumValues;
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public BlockType getBlockType() {
        return BlockType.INPUT;
    }

    @Override
    protected boolean sameContent(Block other) {
        InputBlock that = (InputBlock) other;
        return required == that.required
                && name.equals(that.name)
                && inputType == that.inputType
                && Objects.equals(range, that.range)
                && enumValues.equals(that.enumValues);
    }

    @Override
    public String toString() {
        return "InputBlock{id=" + id + ", name=" + name + ", type=" + inputType + "}";
    }

    /// Builder for constructing immutable InputBlock instances.
    ///
    /// Required fields: `id`, `name`, `inputType`
    public static final class Builder {
        private String id;
        private Position position;
        private String description;
        private String name;
        private InputType inputType;
        private NumericRange range;
        private List<String> enumValues;
        private boolean required = true;

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

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder inputType(InputType inputType) {
            this.inputType = inputType;
            return this;
        }

        public Builder range(NumericRange range) {
            this.range = range;
            return this;
        }

        public Builder range(double min, double max) {
            this.range = NumericRange.of(min, max);
            return this;
        }

        public Builder enumValues(List<String> enumValues) {
            this.enumValues = enumValues;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        /// Builds the immutable input block.
        ///
        /// @return new InputBlock instance, never null
        /// @throws IllegalStateException if a required field is missing or the
        ///         enum values contradict the input type
        public InputBlock build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("InputBlock name is required");
            }
            Objects.requireNonNull(inputType, "InputBlock inputType is required");
            boolean hasEnumValues = enumValues != null && !enumValues.isEmpty();
            if (inputType == InputType.ENUM && !hasEnumValues) {
                throw new IllegalStateException(
                        "Input '" + name + "' of type ENUM requires enum values");
            }
            if (inputType.isNumeric() && hasEnumValues) {
                throw new IllegalStateException(
                        "Input '" + name + "' of type " + inputType + " cannot have enum values");
            }
            return new InputBlock(this);
        }
    }
}
