package io.lemon.core.workflow;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.BlockType;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Reports structural problems in a workflow without executing it.
///
/// A workflow that builds is already free of dangling connections and
/// duplicate block ids. This lint covers what construction allows but an
/// author most likely did not intend:
///
/// - no output block
/// - two inputs with the same name
/// - decision conditions that do not parse or use unknown variables
/// - decisions with neither a `TRUE` (or `FALSE`) nor a `DEFAULT` connection
/// - non-terminal blocks without any outgoing connection
/// - blocks unreachable from the start block
///
/// Variables available to conditions are the input names plus the output
/// names of workflow reference blocks.
public class WorkflowValidator {

    private final ConditionEvaluator evaluator;

    public WorkflowValidator(ConditionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /// Lints a workflow.
    ///
    /// @param workflow the workflow to check, not null
    /// @return human-readable issues in block declaration order, empty if none; never null
    public List<String> validate(Workflow workflow) {
        List<String> issues = new ArrayList<>();

        if (workflow.getOutputBlocks().isEmpty()) {
            issues.add("Workflow has no output blocks");
        }

        Set<String> variables = new LinkedHashSet<>();
        for (InputBlock input : workflow.getInputBlocks()) {
            if (!variables.add(input.getName())) {
                issues.add("Duplicate input name: " + input.getName());
            }
        }
        for (WorkflowRefBlock ref : workflow.getWorkflowRefBlocks()) {
            variables.add(ref.getOutputName());
        }

        for (Block block : workflow.getBlocks()) {
            if (block instanceof DecisionBlock decision) {
                for (String error : evaluator.validate(decision.getCondition(), variables)) {
                    issues.add("Decision '" + decision.getId() + "': " + error);
                }
                checkBranch(workflow, decision, PortType.TRUE, issues);
                checkBranch(workflow, decision, PortType.FALSE, issues);
            } else if (block.getBlockType() != BlockType.OUTPUT
                    && block.getBlockType() != BlockType.INPUT
                    && workflow.getConnectionsFrom(block.getId()).isEmpty()) {
                issues.add("Block '" + block.getId() + "' has no outgoing connection");
            }
        }

        Set<String> reachable = reachableFromStart(workflow);
        for (Block block : workflow.getBlocks()) {
            if (block.getBlockType() != BlockType.INPUT && !reachable.contains(block.getId())) {
                issues.add("Block '" + block.getId() + "' is unreachable");
            }
        }
        return issues;
    }

    private static void checkBranch(
            Workflow workflow, DecisionBlock decision, PortType port, List<String> issues) {
        boolean wired =
                workflow.getConnectionsFrom(decision.getId()).stream()
                        .anyMatch(c -> c.fromPort() == port || c.fromPort() == PortType.DEFAULT);
        if (!wired) {
            issues.add("Decision '" + decision.getId() + "' has no " + port + " branch");
        }
    }

    private static Set<String> reachableFromStart(Workflow workflow) {
        Set<String> reachable = new HashSet<>();
        Optional<Block> start = workflow.findStartBlock();
        if (start.isEmpty()) {
            // Executes straight to the first output
            workflow.getOutputBlocks().stream().findFirst().ifPresent(o -> reachable.add(o.getId()));
            return reachable;
        }
        Deque<String> pending = new ArrayDeque<>();
        pending.add(start.get().getId());
        while (!pending.isEmpty()) {
            String id = pending.poll();
            if (reachable.add(id)) {
                for (Connection connection : workflow.getConnectionsFrom(id)) {
                    pending.add(connection.toBlock());
                }
            }
        }
        return reachable;
    }
}
