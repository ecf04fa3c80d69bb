package io.lemon.core.execution;

import io.lemon.core.workflow.PortType;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.util.Map;

/// Listener for workflow traversal events.
///
/// All methods have default no-op implementations, allowing listeners to
/// override only the events they care about. Callbacks fire only for the
/// top-level workflow; referenced workflows run without a listener.
///
/// ### Callback Lifecycle
/// ```
/// onBlockStart(step, block, state)     before every visited block
/// onInput(block, value)                input pass-through
/// onDecision(block, result, port)      condition evaluated, port chosen
/// onDecisionFailed(block, error)       condition could not be evaluated
/// onWorkflowRef(block, childResult)    referenced workflow returned
/// ```
///
/// @see WorkflowExecutor#execute(io.lemon.core.workflow.Workflow, Map, ExecutionListener)
/// @see TracingListener
public interface ExecutionListener {

    /// Called before a block is processed.
    ///
    /// @param step one-based step number
    /// @param block the block about to be processed, not null
    /// @param state read-only view of the variable state, not null
    default void onBlockStart(int step, Block block, Map<String, Object> state) {}

    /// Called when execution passes through an input block.
    ///
    /// @param block the input block, not null
    /// @param value the bound input value, may be null when the input is absent
    default void onInput(InputBlock block, Object value) {}

    /// Called after a decision condition is evaluated.
    ///
    /// @param block the decision block, not null
    /// @param result the condition result
    /// @param port the port execution will follow, not null
    default void onDecision(DecisionBlock block, boolean result, PortType port) {}

    /// Called when a decision condition fails to evaluate. Execution stops
    /// after this callback.
    ///
    /// @param block the decision block, not null
    /// @param error the evaluation error message, not null
    default void onDecisionFailed(DecisionBlock block, String error) {}

    /// Called after a referenced workflow finishes, successfully or not.
    ///
    /// @param block the reference block, not null
    /// @param childResult the referenced workflow's result, not null
    default void onWorkflowRef(WorkflowRefBlock block, ExecutionResult childResult) {}

    /// No-op listener for when no callbacks are needed.
    ExecutionListener NOOP = new ExecutionListener() {};
}
