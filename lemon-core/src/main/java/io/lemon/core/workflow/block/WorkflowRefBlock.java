package io.lemon.core.workflow.block;

import java.util.Map;

/// Embeds another stored workflow as a single block.
///
/// Before the referenced workflow runs, each entry of the input mapping copies
/// a parent variable into a child input (`childInput -> parentVariable`). On
/// success the child's output is bound in the parent state under
/// {@link #getOutputName()} and execution continues along the default port.
///
/// @implNote Immutable and thread-safe after construction.
/// @see io.lemon.core.execution.WorkflowExecutor
public final class WorkflowRefBlock extends Block {

    public static final String DEFAULT_OUTPUT_NAME = "result";

    private final String refId;
    private final String refName;
    private final Map<String, String> inputMapping;
    private final String outputName;

    private WorkflowRefBlock(Builder builder) {
        super(builder.id, builder.position, builder.description);
        this.refId = builder.refId.trim();
        this.refName = builder.refName != null ? builder.refName : "";
        this.inputMapping =
                builder.inputMapping != null ? Map.copyOf(builder.inputMapping) : Map.of();
        this.outputName =
                builder.outputName != null && !builder.outputName.isBlank()
                        ? builder.outputName
                        : DEFAULT_OUTPUT_NAME;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the identifier of the referenced workflow.
    ///
    /// @return workflow id, never null or blank
    public String getRefId() {
        return refId;
    }

    /// Returns the display name of the referenced workflow.
    ///
    /// @return name, never null (may be empty)
    public String getRefName() {
        return refName;
    }

    /// Returns the mapping from child input name to parent variable name.
    ///
    /// @return unmodifiable mapping, never null (may be empty)
    public Map<String, String> getInputMapping() {
        return inputMapping;
    }

    /// Returns the parent variable the child output is bound to.
    ///
    /// @return variable name, defaults to {@value #DEFAULT_OUTPUT_NAME}
    public String getOutputName() {
        return outputName;
    }

    @Override
    public BlockType getBlockType() {
        return BlockType.WORKFLOW_REF;
    }

    @Override
    protected boolean sameContent(Block other) {
        WorkflowRefBlock that = (WorkflowRefBlock) other;
        return refId.equals(that.refId)
                && refName.equals(that.refName)
                && inputMapping.equals(that.inputMapping)
                && outputName.equals(that.outputName);
    }

    @Override
    public String toString() {
        return "WorkflowRefBlock{id=" + id + ", refId=" + refId + ", outputName=" + outputName + "}";
    }

    /// Builder for constructing immutable WorkflowRefBlock instances.
    ///
    /// Required fields: `id`, `refId`
    public static final class Builder {
        private String id;
        private Position position;
        private String description;
        private String refId;
        private String refName;
        private Map<String, String> inputMapping;
        private String outputName;

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

        public Builder refId(String refId) {
            this.refId = refId;
            return this;
        }

        public Builder refName(String refName) {
            this.refName = refName;
            return this;
        }

        /// Sets the child-input to parent-variable mapping.
        ///
        /// @param inputMapping mapping, may be null (treated as empty)
        /// @return this builder for chaining
        public Builder inputMapping(Map<String, String> inputMapping) {
            this.inputMapping = inputMapping;
            return this;
        }

        public Builder outputName(String outputName) {
            this.outputName = outputName;
            return this;
        }

        /// @throws IllegalStateException if `refId` is null or blank
        public WorkflowRefBlock build() {
            if (refId == null || refId.isBlank()) {
                throw new IllegalStateException("WorkflowRefBlock refId cannot be empty");
            }
            return new WorkflowRefBlock(this);
        }
    }
}
