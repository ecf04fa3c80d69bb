package io.lemon.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.lemon.core.validation.ValidationSession;
import io.lemon.core.workflow.Connection;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.WorkflowMetadata;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.NumericRange;
import io.lemon.core.workflow.block.Position;
import io.lemon.serialization.mixin.ConnectionMixin;
import io.lemon.serialization.mixin.NumericRangeMixin;
import io.lemon.serialization.mixin.PositionMixin;
import io.lemon.serialization.mixin.WorkflowBuilderMixin;
import io.lemon.serialization.mixin.WorkflowMetadataMixin;
import io.lemon.serialization.mixin.WorkflowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Lemon serialization configuration in one place.
///
/// Covers two registration strategies:
///
/// **Custom serializer/deserializer pairs**:
/// - `Block`: `BlockSerializer` / `BlockDeserializer`, discriminator: `"type"`
/// - `ValidationSession`: `ValidationRecordSerializer` (write-only)
///
/// **Mixins**:
/// - `Workflow` + `Workflow.Builder` (builder-based deserialization)
/// - `WorkflowMetadata`, `Connection`, `NumericRange`, `Position` (records, read
///   through their canonical constructors)
///
/// @see WorkflowSerializer for the convenience factory API
public class LemonJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5127764403918872215L;

    public LemonJacksonModule() {
        super("LemonJacksonModule");

        addSerializer(Block.class, new BlockSerializer());
        addDeserializer(Block.class, new BlockDeserializer());

        addSerializer(ValidationSession.class, new ValidationRecordSerializer());
    }

    /// Applies mixin annotations to the workflow model types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Workflow.class, WorkflowMixin.class);
        context.setMixInAnnotations(Workflow.Builder.class, WorkflowBuilderMixin.class);

        context.setMixInAnnotations(WorkflowMetadata.class, WorkflowMetadataMixin.class);
        context.setMixInAnnotations(Connection.class, ConnectionMixin.class);
        context.setMixInAnnotations(NumericRange.class, NumericRangeMixin.class);
        context.setMixInAnnotations(Position.class, PositionMixin.class);
    }
}
