package io.lemon.core.execution;

import java.util.List;

/// Step-by-step record of one execution, alongside its result.
///
/// @param result the execution result, identical to what
///        {@link WorkflowExecutor#execute} returns for the same input
/// @param steps visited blocks in order, never null
public record ExecutionTrace(ExecutionResult result, List<TraceStep> steps) {

    public ExecutionTrace {
        steps = List.copyOf(steps);
    }
}
