package io.lemon.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.OutputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.io.IOException;
import java.io.Serial;

/// Serializes all `Block` subtypes to JSON with a `"type"` discriminator field.
///
/// Every serialized object begins with `"id"`, `"type"` and `"position"`,
/// followed by `"description"` when present and then subtype-specific fields.
///
/// ```
/// type           Additional fields
/// ———————————————+————————————————————————————————————————————————
/// input          │ name, inputType, range, enumValues, required
/// decision       │ condition
/// output         │ value
/// workflow_ref   │ refId, refName, inputMapping, outputName
/// ```
///
/// @implNote Package-private. Registered by {@link LemonJacksonModule}.
/// @see BlockDeserializer for the inverse operation
class BlockSerializer extends StdSerializer<Block> {

    @Serial private static final long serialVersionUID = 3190227561853067409L;

    BlockSerializer() {
        super(Block.class);
    }

    @Override
    public void serialize(Block block, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", block.getId());
        gen.writeStringField("type", BlockDeserializer.typeName(block.getBlockType()));
        provider.defaultSerializeField("position", block.getPosition(), gen);
        if (block.getDescription() != null && !block.getDescription().isEmpty()) {
            gen.writeStringField("description", block.getDescription());
        }

        switch (block.getBlockType()) {
            case INPUT -> writeInput((InputBlock) block, gen, provider);
            case DECISION -> gen.writeStringField("condition", ((DecisionBlock) block).getCondition());
            case OUTPUT -> gen.writeStringField("value", ((OutputBlock) block).getValue());
            case WORKFLOW_REF -> writeWorkflowRef((WorkflowRefBlock) block, gen, provider);
        }

        gen.writeEndObject();
    }

    private void writeInput(InputBlock block, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("name", block.getName());
        gen.writeStringField("inputType", block.getInputType().name());
        if (block.getRange() != null) {
            provider.defaultSerializeField("range", block.getRange(), gen);
        }
        if (!block.getEnumValues().isEmpty()) {
            provider.defaultSerializeField("enumValues", block.getEnumValues(), gen);
        }
        gen.writeBooleanField("required", block.isRequired());
    }

    private void writeWorkflowRef(
            WorkflowRefBlock block, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("refId", block.getRefId());
        if (!block.getRefName().isEmpty()) {
            gen.writeStringField("refName", block.getRefName());
        }
        if (!block.getInputMapping().isEmpty()) {
            provider.defaultSerializeField("inputMapping", block.getInputMapping(), gen);
        }
        gen.writeStringField("outputName", block.getOutputName());
    }
}
