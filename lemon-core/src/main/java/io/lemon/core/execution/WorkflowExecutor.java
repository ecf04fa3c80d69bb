package io.lemon.core.execution;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.condition.ConditionException;
import io.lemon.core.workflow.Connection;
import io.lemon.core.workflow.PortType;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.WorkflowRepository;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.OutputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Deterministic graph walker for workflows.
///
/// Starting at the workflow's start block, follows connections until an
/// {@link OutputBlock} is reached. Decisions pick the `TRUE` or `FALSE` port
/// via the {@link ConditionEvaluator}; workflow references execute another
/// stored workflow through the {@link WorkflowRepository} and bind its output.
///
/// ### Start block
/// The first non-input block, in declaration order, that has no incoming
/// connections or only incoming connections from input blocks. A workflow with
/// no such block returns its first output block directly.
///
/// ### Failure handling
/// Nothing on the execution path throws. Invalid inputs, condition errors,
/// dead ends, missing references, composition cycles and step-cap exhaustion
/// all come back as an {@link ExecutionResult} carrying an error.
///
/// ### Composition
/// Each recursive call receives a copy of the visited workflow ids plus the
/// current id, so sibling references to the same workflow are allowed while
/// any cycle is reported as `Circular reference detected: <id>`.
///
/// @implNote Thread-safe. The executor holds no per-execution state; each call
/// works on its own variable map.
///
/// @see ExecutionListener for traversal callbacks
/// @see #trace for a step-by-step record
public class WorkflowExecutor {

    private static final Logger logger = Logger.getLogger(WorkflowExecutor.class.getName());

    public static final int DEFAULT_MAX_STEPS = 1000;

    private final ConditionEvaluator evaluator;
    private final WorkflowRepository repository;
    private final int maxSteps;

    /// Creates an executor.
    ///
    /// @param evaluator condition evaluator, not null
    /// @param repository repository used to resolve workflow references, may be
    ///        null in which case reference blocks fail
    /// @param maxSteps traversal cap, must be positive
    public WorkflowExecutor(ConditionEvaluator evaluator, WorkflowRepository repository, int maxSteps) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.repository = repository;
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public WorkflowExecutor(ConditionEvaluator evaluator, WorkflowRepository repository) {
        this(evaluator, repository, DEFAULT_MAX_STEPS);
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /// Executes a workflow.
    ///
    /// @param workflow the workflow to run, not null
    /// @param inputs input values by input name, not null
    /// @return the result, never null
    public ExecutionResult execute(Workflow workflow, Map<String, ?> inputs) {
        return execute(workflow, inputs, ExecutionListener.NOOP);
    }

    /// Executes a workflow, reporting traversal events to a listener.
    ///
    /// @param workflow the workflow to run, not null
    /// @param inputs input values by input name, not null
    /// @param listener receives callbacks for top-level blocks, not null
    /// @return the result, never null
    public ExecutionResult execute(
            Workflow workflow, Map<String, ?> inputs, ExecutionListener listener) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        return run(workflow, inputs, Set.of(), listener);
    }

    /// Validates inputs without executing.
    ///
    /// @param workflow the workflow whose input declarations apply, not null
    /// @param inputs candidate inputs, not null
    /// @return every violation found, empty if the inputs are acceptable; never null
    public List<String> validateInputs(Workflow workflow, Map<String, ?> inputs) {
        return InputValidator.validate(workflow, inputs);
    }

    /// Executes a workflow and records every visited block.
    ///
    /// Runs the same code path as {@link #execute(Workflow, Map)}, so the
    /// returned result is identical.
    ///
    /// @param workflow the workflow to run, not null
    /// @param inputs input values by input name, not null
    /// @return the trace, never null
    public ExecutionTrace trace(Workflow workflow, Map<String, ?> inputs) {
        TracingListener tracer = new TracingListener();
        ExecutionResult result = execute(workflow, inputs, tracer);
        return new ExecutionTrace(result, tracer.getSteps());
    }

    private ExecutionResult run(
            Workflow workflow,
            Map<String, ?> inputs,
            Set<String> visited,
            ExecutionListener listener) {
        List<String> validationErrors = validateInputs(workflow, inputs);
        if (!validationErrors.isEmpty()) {
            return ExecutionResult.failure(
                    "Input validation failed: " + String.join("; ", validationErrors));
        }

        Map<String, Object> state = new HashMap<>(inputs);
        List<String> path = new ArrayList<>();

        Optional<Block> start = workflow.findStartBlock();
        if (start.isEmpty()) {
            List<OutputBlock> outputs = workflow.getOutputBlocks();
            if (!outputs.isEmpty()) {
                return ExecutionResult.success(outputs.get(0).getValue(), path, state);
            }
            return ExecutionResult.failure("Workflow has no executable blocks");
        }

        Block current = start.get();
        for (int step = 1; step <= maxSteps; step++) {
            path.add(current.getId());
            listener.onBlockStart(step, current, Collections.unmodifiableMap(state));
            logger.fine(() -> "Workflow " + workflow.getId() + " visiting " + path.get(path.size() - 1));

            Step outcome =
                    switch (current.getBlockType()) {
                        case OUTPUT -> Step.finish(
                                ExecutionResult.success(
                                        ((OutputBlock) current).getValue(), path, state));
                        case DECISION -> decide(workflow, (DecisionBlock) current, state, path, listener);
                        case INPUT -> passThrough(workflow, (InputBlock) current, state, listener);
                        case WORKFLOW_REF -> compose(
                                workflow, (WorkflowRefBlock) current, state, path, visited, listener);
                    };
            if (outcome.result() != null) {
                return outcome.result();
            }

            Block next = outcome.next();
            if (next == null) {
                return ExecutionResult.failure("Execution reached dead end", path);
            }
            current = next;
        }

        logger.warning("Workflow " + workflow.getId() + " exceeded " + maxSteps + " steps");
        return ExecutionResult.failure("Execution exceeded maximum steps", path);
    }

    private Step decide(
            Workflow workflow,
            DecisionBlock decision,
            Map<String, Object> state,
            List<String> path,
            ExecutionListener listener) {
        boolean result;
        try {
            result = evaluator.evaluate(decision.getCondition(), state);
        } catch (ConditionException e) {
            listener.onDecisionFailed(decision, e.getMessage());
            return Step.finish(
                    ExecutionResult.failure("Condition evaluation failed: " + e.getMessage(), path));
        }
        PortType port = PortType.forDecision(result);
        listener.onDecision(decision, result, port);
        return Step.next(followPort(workflow, decision, port));
    }

    private Step passThrough(
            Workflow workflow, InputBlock input, Map<String, Object> state, ExecutionListener listener) {
        listener.onInput(input, state.get(input.getName()));
        return Step.next(followDefault(workflow, input));
    }

    private Step compose(
            Workflow workflow,
            WorkflowRefBlock ref,
            Map<String, Object> state,
            List<String> path,
            Set<String> visited,
            ExecutionListener listener) {
        ExecutionResult childResult = executeRef(workflow, ref, state, visited);
        listener.onWorkflowRef(ref, childResult);
        if (!childResult.success()) {
            return Step.finish(ExecutionResult.failure(childResult.error(), path));
        }
        state.put(ref.getOutputName(), childResult.output());
        return Step.next(followDefault(workflow, ref));
    }

    /// Runs a referenced workflow. Returns a failed result whose error is
    /// already phrased for the parent.
    private ExecutionResult executeRef(
            Workflow parent, WorkflowRefBlock ref, Map<String, Object> state, Set<String> visited) {
        if (repository == null) {
            return ExecutionResult.failure("Cannot execute workflow ref: no repository");
        }
        Optional<Workflow> child = repository.get(ref.getRefId());
        if (child.isEmpty()) {
            return ExecutionResult.failure("Referenced workflow not found: " + ref.getRefId());
        }

        Set<String> childVisited = new HashSet<>(visited);
        childVisited.add(parent.getId());
        if (childVisited.contains(ref.getRefId())) {
            return ExecutionResult.failure("Circular reference detected: " + ref.getRefId());
        }

        Map<String, Object> childInputs = new LinkedHashMap<>();
        for (Map.Entry<String, String> mapping : ref.getInputMapping().entrySet()) {
            if (!state.containsKey(mapping.getValue())) {
                return ExecutionResult.failure("Missing mapping source: " + mapping.getValue());
            }
            childInputs.put(mapping.getKey(), state.get(mapping.getValue()));
        }

        ExecutionResult result =
                run(child.get(), childInputs, Set.copyOf(childVisited), ExecutionListener.NOOP);
        if (!result.success()) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Referenced workflow " + ref.getRefId() + " failed: " + result.error());
            }
            return ExecutionResult.failure("Referenced workflow failed: " + result.error());
        }
        return result;
    }

    private static Optional<Block> followPort(Workflow workflow, Block from, PortType port) {
        List<Connection> outgoing = workflow.getConnectionsFrom(from.getId());
        Optional<Block> next = target(workflow, outgoing, port);
        return next.isPresent() ? next : target(workflow, outgoing, PortType.DEFAULT);
    }

    private static Optional<Block> followDefault(Workflow workflow, Block from) {
        return target(workflow, workflow.getConnectionsFrom(from.getId()), PortType.DEFAULT);
    }

    private static Optional<Block> target(
            Workflow workflow, List<Connection> outgoing, PortType port) {
        for (Connection connection : outgoing) {
            if (connection.fromPort() == port) {
                return workflow.getBlock(connection.toBlock());
            }
        }
        return Optional.empty();
    }

    /// Outcome of processing one block: either the block to visit next
    /// (null at a dead end) or a terminal result.
    private record Step(Block next, ExecutionResult result) {

        static Step next(Optional<Block> block) {
            return new Step(block.orElse(null), null);
        }

        static Step finish(ExecutionResult result) {
            return new Step(null, result);
        }
    }
}
