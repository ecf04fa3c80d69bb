package io.lemon.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.BlockType;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.InputType;
import io.lemon.core.workflow.block.NumericRange;
import io.lemon.core.workflow.block.OutputBlock;
import io.lemon.core.workflow.block.Position;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Deserializes JSON to the appropriate `Block` subtype using the `"type"`
/// discriminator field.
///
/// Blocks are built through their builders, so every construction invariant
/// (non-blank condition, enum values for `ENUM` inputs, non-blank `refId`)
/// applies to documents exactly as it does to code. A violated invariant is
/// reported as a `JsonMappingException` pointing at the offending block.
///
/// @implNote Package-private. Registered by {@link LemonJacksonModule}.
/// @see BlockSerializer for the inverse operation
class BlockDeserializer extends StdDeserializer<Block> {

    @Serial private static final long serialVersionUID = -6504917828813342056L;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    BlockDeserializer() {
        super(Block.class);
    }

    /// Maps a block type to its discriminator value (`input`, `decision`,
    /// `output`, `workflow_ref`).
    static String typeName(BlockType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Block deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = required(p, root, "id");
        String type = required(p, root, "type");
        BlockType blockType;
        try {
            blockType = BlockType.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Unknown block type '" + type + "' for block " + id);
        }

        Position position =
                root.hasNonNull("position")
                        ? mapper.treeToValue(root.get("position"), Position.class)
                        : null;
        String description = textOrNull(root, "description");

        try {
            return switch (blockType) {
                case INPUT -> deserializeInput(mapper, p, root, id, position, description);
                case DECISION ->
                        DecisionBlock.builder()
                                .id(id)
                                .position(position)
                                .description(description)
                                .condition(required(p, root, "condition"))
                                .build();
                case OUTPUT ->
                        OutputBlock.builder()
                                .id(id)
                                .position(position)
                                .description(description)
                                .value(required(p, root, "value"))
                                .build();
                case WORKFLOW_REF -> deserializeWorkflowRef(mapper, p, root, id, position, description);
            };
        } catch (IllegalStateException | IllegalArgumentException | NullPointerException e) {
            throw JsonMappingException.from(p, "Invalid block " + id + ": " + e.getMessage(), e);
        }
    }

    private InputBlock deserializeInput(
            ObjectMapper mapper,
            JsonParser p,
            JsonNode root,
            String id,
            Position position,
            String description)
            throws IOException {
        InputBlock.Builder b =
                InputBlock.builder()
                        .id(id)
                        .position(position)
                        .description(description)
                        .name(required(p, root, "name"))
                        .inputType(
                                InputType.valueOf(
                                        required(p, root, "inputType").toUpperCase(Locale.ROOT)));

        if (root.hasNonNull("range")) {
            b.range(mapper.treeToValue(root.get("range"), NumericRange.class));
        }
        if (root.hasNonNull("enumValues")) {
            b.enumValues(mapper.readerFor(STRING_LIST).readValue(root.get("enumValues")));
        }
        if (root.hasNonNull("required")) {
            b.required(root.get("required").asBoolean());
        }
        return b.build();
    }

    private WorkflowRefBlock deserializeWorkflowRef(
            ObjectMapper mapper,
            JsonParser p,
            JsonNode root,
            String id,
            Position position,
            String description)
            throws IOException {
        WorkflowRefBlock.Builder b =
                WorkflowRefBlock.builder()
                        .id(id)
                        .position(position)
                        .description(description)
                        .refId(required(p, root, "refId"))
                        .refName(textOrNull(root, "refName"))
                        .outputName(textOrNull(root, "outputName"));

        if (root.hasNonNull("inputMapping")) {
            b.inputMapping(mapper.readerFor(STRING_MAP).readValue(root.get("inputMapping")));
        }
        return b.build();
    }

    private static String required(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        String value = textOrNull(root, field);
        if (value == null) {
            throw JsonMappingException.from(p, "Block is missing required field '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
