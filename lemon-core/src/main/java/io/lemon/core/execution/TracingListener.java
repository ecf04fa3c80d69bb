package io.lemon.core.execution;

import io.lemon.core.workflow.PortType;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Collects {@link TraceStep}s from traversal callbacks.
///
/// @implNote Not thread-safe. Use one instance per execution.
final class TracingListener implements ExecutionListener {

    private final List<TraceStep> steps = new ArrayList<>();

    @Override
    public void onBlockStart(int step, Block block, Map<String, Object> state) {
        steps.add(
                TraceStep.started(
                        step,
                        block.getId(),
                        block.getBlockType(),
                        Collections.unmodifiableMap(new LinkedHashMap<>(state))));
    }

    @Override
    public void onInput(InputBlock block, Object value) {
        replaceLast(last().withInput(block.getName(), value));
    }

    @Override
    public void onDecision(DecisionBlock block, boolean result, PortType port) {
        replaceLast(last().withDecision(block.getCondition(), result, port));
    }

    @Override
    public void onDecisionFailed(DecisionBlock block, String error) {
        replaceLast(last().withDecisionError(block.getCondition(), error));
    }

    @Override
    public void onWorkflowRef(WorkflowRefBlock block, ExecutionResult childResult) {
        replaceLast(last().withWorkflowRef(block.getRefId(), childResult.output()));
    }

    List<TraceStep> getSteps() {
        return List.copyOf(steps);
    }

    private TraceStep last() {
        return steps.get(steps.size() - 1);
    }

    private void replaceLast(TraceStep step) {
        steps.set(steps.size() - 1, step);
    }
}
