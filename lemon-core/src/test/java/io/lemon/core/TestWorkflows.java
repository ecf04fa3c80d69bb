package io.lemon.core;

import io.lemon.core.workflow.PortType;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.WorkflowMetadata;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.InputType;
import io.lemon.core.workflow.block.OutputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.util.List;
import java.util.Map;

/// Workflow fixtures shared by the core tests.
public final class TestWorkflows {

    private TestWorkflows() {}

    /// `age` (INT, 0..120) -> `age >= 18` -> adult / minor.
    public static Workflow ageCheck() {
        return ageCheck("age-check");
    }

    public static Workflow ageCheck(String id) {
        return Workflow.builder()
                .id(id)
                .metadata(
                        WorkflowMetadata.builder()
                                .name("Age check")
                                .description("Adult or minor")
                                .domain("demo")
                                .tags(List.of("age", "basic"))
                                .build())
                .block(
                        InputBlock.builder()
                                .id("input_age")
                                .name("age")
                                .inputType(InputType.INT)
                                .range(0, 120)
                                .build())
                .block(DecisionBlock.builder().id("d1").condition("age >= 18").build())
                .block(OutputBlock.builder().id("adult").value("adult").build())
                .block(OutputBlock.builder().id("minor").value("minor").build())
                .connect("input_age", "d1")
                .connect("d1", PortType.TRUE, "adult")
                .connect("d1", PortType.FALSE, "minor")
                .build();
    }

    /// Calls `child` with `age -> parentAge`, then branches on its `result`.
    public static Workflow parentOf(String id, String childId) {
        return Workflow.builder()
                .id(id)
                .metadata(WorkflowMetadata.named("Parent of " + childId))
                .block(
                        InputBlock.builder()
                                .id("input_parent_age")
                                .name("parentAge")
                                .inputType(InputType.INT)
                                .build())
                .block(
                        WorkflowRefBlock.builder()
                                .id("ref")
                                .refId(childId)
                                .inputMapping(Map.of("age", "parentAge"))
                                .build())
                .block(DecisionBlock.builder().id("d1").condition("result == 'adult'").build())
                .block(OutputBlock.builder().id("allow").value("allow").build())
                .block(OutputBlock.builder().id("deny").value("deny").build())
                .connect("input_parent_age", "ref")
                .connect("ref", "d1")
                .connect("d1", PortType.TRUE, "allow")
                .connect("d1", PortType.FALSE, "deny")
                .build();
    }
}
