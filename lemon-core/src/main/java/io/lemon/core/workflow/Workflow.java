package io.lemon.core.workflow;

import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.BlockType;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.OutputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable workflow definition: typed inputs, decision points and outputs wired
/// by port connections.
///
/// A workflow is a pure data structure. It is constructed via the builder and
/// validated on build; execution lives in
/// {@link io.lemon.core.execution.WorkflowExecutor}.
///
/// ### Validation
/// - Block ids are unique
/// - Every connection's `fromBlock` and `toBlock` reference a declared block
///
/// Reachability, dangling branches and condition syntax are not checked here;
/// {@link WorkflowValidator} reports those without rejecting the workflow.
///
/// @implNote Immutable and thread-safe after construction. Blocks keep their
/// declaration order, which the executor relies on to pick the start block.
///
/// @see Block for the block hierarchy
/// @see Connection for edges
public final class Workflow {

    private final String id;
    private final WorkflowMetadata metadata;
    private final List<Block> blocks;
    private final List<Connection> connections;
    private final Map<String, Block> blocksById;

    private Workflow(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID required");
        this.metadata =
                builder.metadata != null ? builder.metadata : WorkflowMetadata.named(builder.id);
        this.blocks = List.copyOf(builder.blocks);
        this.connections = List.copyOf(builder.connections);

        Map<String, Block> index = new LinkedHashMap<>();
        for (Block block : blocks) {
            if (index.put(block.getId(), block) != null) {
                throw new IllegalStateException(
                        "Duplicate block id '" + block.getId() + "' in workflow '" + id + "'");
            }
        }
        this.blocksById = Collections.unmodifiableMap(index);

        validate();
    }

    private void validate() {
        for (Connection connection : connections) {
            if (!blocksById.containsKey(connection.fromBlock())) {
                throw new IllegalStateException(
                        "Connection '"
                                + connection.id()
                                + "' references unknown source block '"
                                + connection.fromBlock()
                                + "'");
            }
            if (!blocksById.containsKey(connection.toBlock())) {
                throw new IllegalStateException(
                        "Connection '"
                                + connection.id()
                                + "' references unknown target block '"
                                + connection.toBlock()
                                + "'");
            }
        }
    }

    /// Returns the unique workflow identifier.
    ///
    /// @return workflow ID, never null
    public String getId() {
        return id;
    }

    /// Returns the workflow metadata.
    ///
    /// @return metadata, never null
    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    /// Returns all blocks in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<Block> getBlocks() {
        return blocks;
    }

    /// Returns all connections in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<Connection> getConnections() {
        return connections;
    }

    /// Looks up a block by id.
    ///
    /// @param blockId the block identifier, not null
    /// @return the block, or empty if not declared
    public Optional<Block> getBlock(String blockId) {
        return Optional.ofNullable(blocksById.get(blockId));
    }

    /// Returns connections leaving the given block, in declaration order.
    ///
    /// @param blockId source block id, not null
    /// @return unmodifiable list, never null (may be empty)
    public List<Connection> getConnectionsFrom(String blockId) {
        return connections.stream().filter(c -> c.fromBlock().equals(blockId)).toList();
    }

    /// Returns connections entering the given block, in declaration order.
    ///
    /// @param blockId target block id, not null
    /// @return unmodifiable list, never null (may be empty)
    public List<Connection> getConnectionsTo(String blockId) {
        return connections.stream().filter(c -> c.toBlock().equals(blockId)).toList();
    }

    public List<InputBlock> getInputBlocks() {
        return blocksOf(InputBlock.class);
    }

    public List<DecisionBlock> getDecisionBlocks() {
        return blocksOf(DecisionBlock.class);
    }

    public List<OutputBlock> getOutputBlocks() {
        return blocksOf(OutputBlock.class);
    }

    public List<WorkflowRefBlock> getWorkflowRefBlocks() {
        return blocksOf(WorkflowRefBlock.class);
    }

    /// Returns the declared input names in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<String> getInputNames() {
        return getInputBlocks().stream().map(InputBlock::getName).toList();
    }

    /// Returns the distinct output values in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<String> getOutputValues() {
        return List.copyOf(
                new LinkedHashSet<>(getOutputBlocks().stream().map(OutputBlock::getValue).toList()));
    }

    /// Returns the ids of workflows this workflow composes.
    ///
    /// @return unmodifiable set in declaration order, never null
    public Set<String> getReferencedWorkflowIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (WorkflowRefBlock ref : getWorkflowRefBlocks()) {
            ids.add(ref.getRefId());
        }
        return Collections.unmodifiableSet(ids);
    }

    /// Resolves the block execution starts from.
    ///
    /// The start block is the first non-input block, in declaration order,
    /// that has no incoming connections or whose incoming connections all come
    /// from input blocks.
    ///
    /// @return the start block, or empty when the workflow has only input and
    ///         output blocks wired to one another, or none at all
    public Optional<Block> findStartBlock() {
        for (Block block : blocks) {
            if (block.getBlockType() == BlockType.INPUT) {
                continue;
            }
            boolean onlyFromInputs =
                    getConnectionsTo(block.getId()).stream()
                            .allMatch(c -> blocksById.get(c.fromBlock()).getBlockType() == BlockType.INPUT);
            if (onlyFromInputs) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    /// Returns a copy of this workflow with different metadata.
    ///
    /// @param metadata replacement metadata, not null
    /// @return new workflow, never null
    public Workflow withMetadata(WorkflowMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        return toBuilder().metadata(metadata).build();
    }

    private <T extends Block> List<T> blocksOf(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Block block : blocks) {
            if (type.isInstance(block)) {
                result.add(type.cast(block));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "Workflow{id=" + id + ", name=" + metadata.name() + ", blocks=" + blocks.size() + "}";
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .metadata(metadata)
                .blocks(blocks)
                .connections(connections);
    }

    /// Creates a new workflow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Workflow instances.
    ///
    /// Required fields: `id`. Metadata defaults to a name equal to the id.
    ///
    /// @see #build() for validation rules
    public static final class Builder {
        private String id;
        private WorkflowMetadata metadata;
        private final List<Block> blocks = new ArrayList<>();
        private final List<Connection> connections = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder metadata(WorkflowMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        /// Replaces all blocks.
        ///
        /// @param blocks blocks in declaration order, not null
        /// @return this builder for chaining
        public Builder blocks(List<? extends Block> blocks) {
            this.blocks.clear();
            this.blocks.addAll(blocks);
            return this;
        }

        public Builder block(Block block) {
            this.blocks.add(Objects.requireNonNull(block, "block must not be null"));
            return this;
        }

        /// Replaces all connections.
        ///
        /// @param connections connections in declaration order, not null
        /// @return this builder for chaining
        public Builder connections(List<Connection> connections) {
            this.connections.clear();
            this.connections.addAll(connections);
            return this;
        }

        public Builder connection(Connection connection) {
            this.connections.add(Objects.requireNonNull(connection, "connection must not be null"));
            return this;
        }

        /// Convenience for adding a connection with a generated id.
        public Builder connect(String fromBlock, PortType fromPort, String toBlock) {
            return connection(
                    Connection.of(
                            "c" + (connections.size() + 1) + "_" + fromBlock + "_" + toBlock,
                            fromBlock,
                            fromPort,
                            toBlock));
        }

        public Builder connect(String fromBlock, String toBlock) {
            return connect(fromBlock, PortType.DEFAULT, toBlock);
        }

        /// Builds the immutable workflow.
        ///
        /// @return new Workflow instance, never null
        /// @throws NullPointerException if id is null
        /// @throws IllegalStateException if block ids repeat or a connection
        ///         references an unknown block
        public Workflow build() {
            return new Workflow(this);
        }
    }
}
