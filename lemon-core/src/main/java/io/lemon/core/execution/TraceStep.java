package io.lemon.core.execution;

import io.lemon.core.workflow.PortType;
import io.lemon.core.workflow.block.BlockType;
import java.util.Map;

/// One visited block in an {@link ExecutionTrace}.
///
/// Only the fields relevant to the block type are set: decisions carry the
/// condition, its result and the chosen port; inputs carry the input name and
/// value; workflow references carry the referenced id and the child output.
/// A decision whose condition could not be evaluated carries the condition
/// and the evaluation error instead of a result.
///
/// @param step one-based step number
/// @param blockId id of the visited block
/// @param blockType type of the visited block
/// @param state snapshot of the variable state before the block ran
/// @param error condition evaluation error, null unless the decision failed
public record TraceStep(
        int step,
        String blockId,
        BlockType blockType,
        Map<String, Object> state,
        String condition,
        Boolean conditionResult,
        PortType port,
        String inputName,
        Object inputValue,
        String refId,
        String childOutput,
        String error) {

    static TraceStep started(int step, String blockId, BlockType blockType, Map<String, Object> state) {
        return new TraceStep(step, blockId, blockType, state, null, null, null, null, null, null, null, null);
    }

    TraceStep withDecision(String condition, boolean result, PortType port) {
        return new TraceStep(
                step, blockId, blockType, state, condition, result, port, null, null, null, null, null);
    }

    TraceStep withInput(String inputName, Object inputValue) {
        return new TraceStep(
                step, blockId, blockType, state, null, null, null, inputName, inputValue, null, null, null);
    }

    TraceStep withWorkflowRef(String refId, String childOutput) {
        return new TraceStep(
                step, blockId, blockType, state, null, null, null, null, null, refId, childOutput, null);
    }

    TraceStep withDecisionError(String condition, String error) {
        return new TraceStep(
                step, blockId, blockType, state, condition, null, null, null, null, null, null, error);
    }
}
