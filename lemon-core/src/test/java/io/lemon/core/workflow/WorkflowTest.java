package io.lemon.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lemon.core.TestWorkflows;
import io.lemon.core.workflow.block.Block;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.InputType;
import io.lemon.core.workflow.block.OutputBlock;
import io.lemon.core.workflow.block.WorkflowRefBlock;
import java.time.Instant;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowTest {

    @Nested
    class Construction {

        @Test
        void shouldRejectConnectionToUnknownBlock() {
            assertThatThrownBy(
                            () ->
                                    Workflow.builder()
                                            .id("wf")
                                            .block(output("yes"))
                                            .block(
                                                    DecisionBlock.builder()
                                                            .id("d1")
                                                            .condition("x > 1")
                                                            .build())
                                            .connect("d1", PortType.TRUE, "missing")
                                            .build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("unknown target block 'missing'");
        }

        @Test
        void shouldRejectConnectionFromUnknownBlock() {
            assertThatThrownBy(
                            () ->
                                    Workflow.builder()
                                            .id("wf")
                                            .block(output("yes"))
                                            .connect("ghost", "yes")
                                            .build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("unknown source block 'ghost'");
        }

        @Test
        void shouldRejectDuplicateBlockIds() {
            assertThatThrownBy(
                            () ->
                                    Workflow.builder()
                                            .id("wf")
                                            .block(output("o"))
                                            .block(output("o"))
                                            .build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Duplicate block id 'o'");
        }

        @Test
        void shouldRejectSelfLoop() {
            assertThatThrownBy(() -> Connection.of("c1", "d1", "d1"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("to itself");
        }

        @Test
        void shouldRequireId() {
            assertThatThrownBy(() -> Workflow.builder().block(output("o")).build())
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        void shouldDefaultMetadataNameToId() {
            Workflow workflow = Workflow.builder().id("wf").block(output("o")).build();

            assertThat(workflow.getMetadata().name()).isEqualTo("wf");
            assertThat(workflow.getMetadata().validationCount()).isZero();
        }

        @Test
        void shouldDefaultConnectionPorts() {
            Connection connection = new Connection("c1", "a", null, "b", null);

            assertThat(connection.fromPort()).isEqualTo(PortType.DEFAULT);
            assertThat(connection.toPort()).isEqualTo(PortType.DEFAULT);
        }
    }

    @Nested
    class Accessors {

        private final Workflow workflow = TestWorkflows.ageCheck();

        @Test
        void shouldReturnConnectionsFromAndTo() {
            assertThat(workflow.getConnectionsFrom("d1"))
                    .extracting(Connection::toBlock)
                    .containsExactly("adult", "minor");
            assertThat(workflow.getConnectionsTo("d1"))
                    .extracting(Connection::fromBlock)
                    .containsExactly("input_age");
            assertThat(workflow.getConnectionsFrom("adult")).isEmpty();
        }

        @Test
        void shouldLookUpBlocksById() {
            assertThat(workflow.getBlock("d1")).containsInstanceOf(DecisionBlock.class);
            assertThat(workflow.getBlock("nope")).isEmpty();
        }

        @Test
        void shouldExposeTypedBlockLists() {
            assertThat(workflow.getInputBlocks()).hasSize(1);
            assertThat(workflow.getDecisionBlocks()).hasSize(1);
            assertThat(workflow.getOutputBlocks()).hasSize(2);
            assertThat(workflow.getWorkflowRefBlocks()).isEmpty();
            assertThat(workflow.getInputNames()).containsExactly("age");
            assertThat(workflow.getOutputValues()).containsExactly("adult", "minor");
        }

        @Test
        void shouldListDistinctOutputValues() {
            Workflow twoYes =
                    Workflow.builder()
                            .id("wf")
                            .block(OutputBlock.builder().id("o1").value("yes").build())
                            .block(OutputBlock.builder().id("o2").value("yes").build())
                            .build();

            assertThat(twoYes.getOutputValues()).containsExactly("yes");
        }

        @Test
        void shouldCollectReferencedWorkflowIds() {
            Workflow parent = TestWorkflows.parentOf("parent", "age-check");

            assertThat(parent.getReferencedWorkflowIds()).containsExactly("age-check");
        }

        @Test
        void shouldFindStartBlockAfterInputs() {
            assertThat(workflow.findStartBlock()).map(Block::getId).contains("d1");
        }

        @Test
        void shouldStartAtOutputFedOnlyByInputs() {
            Workflow trivial =
                    Workflow.builder()
                            .id("wf")
                            .block(
                                    InputBlock.builder()
                                            .id("i")
                                            .name("x")
                                            .inputType(InputType.STRING)
                                            .build())
                            .block(output("o"))
                            .connect("i", "o")
                            .build();

            assertThat(trivial.findStartBlock()).map(Block::getId).contains("o");
        }

        @Test
        void shouldReplaceMetadataWithoutTouchingGraph() {
            WorkflowMetadata updated = workflow.getMetadata().withValidation(90.0, 12);

            Workflow copy = workflow.withMetadata(updated);

            assertThat(copy.getMetadata().validationScore()).isEqualTo(90.0);
            assertThat(copy.getBlocks()).isEqualTo(workflow.getBlocks());
            assertThat(copy.getConnections()).isEqualTo(workflow.getConnections());
            assertThat(workflow.getMetadata().validationCount()).isZero();
        }
    }

    @Nested
    class Metadata {

        @Test
        void shouldDeriveConfidenceFromCount() {
            assertThat(meta(100, 0).confidence()).isEqualTo(ValidationConfidence.NONE);
            assertThat(meta(100, 9).confidence()).isEqualTo(ValidationConfidence.LOW);
            assertThat(meta(100, 10).confidence()).isEqualTo(ValidationConfidence.MEDIUM);
            assertThat(meta(100, 50).confidence()).isEqualTo(ValidationConfidence.HIGH);
        }

        @Test
        void shouldRequireScoreAndMediumConfidenceToBeValidated() {
            assertThat(meta(80, 10).isValidated()).isTrue();
            assertThat(meta(79.9, 100).isValidated()).isFalse();
            assertThat(meta(100, 9).isValidated()).isFalse();
        }

        @Test
        void shouldRejectOutOfRangeScore() {
            assertThatThrownBy(() -> meta(100.5, 1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> meta(50, -1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldDefaultTimestamps() {
            WorkflowMetadata metadata = WorkflowMetadata.named("x");

            assertThat(metadata.createdAt()).isNotNull();
            assertThat(metadata.updatedAt()).isEqualTo(metadata.createdAt());
            assertThat(metadata.tags()).isEmpty();
            assertThat(metadata.description()).isEmpty();
        }

        @Test
        void shouldRefreshUpdatedAtOnValidation() {
            Instant created = Instant.parse("2020-01-01T00:00:00Z");
            WorkflowMetadata metadata =
                    WorkflowMetadata.builder().name("x").createdAt(created).build();

            WorkflowMetadata validated = metadata.withValidation(75.0, 4);

            assertThat(validated.createdAt()).isEqualTo(created);
            assertThat(validated.updatedAt()).isAfter(created);
            assertThat(validated.validationScore()).isEqualTo(75.0);
            assertThat(validated.validationCount()).isEqualTo(4);
        }

        private WorkflowMetadata meta(double score, int count) {
            return WorkflowMetadata.builder()
                    .name("m")
                    .validationScore(score)
                    .validationCount(count)
                    .build();
        }
    }

    @Test
    void shouldBuildWorkflowRefWithDefaults() {
        WorkflowRefBlock ref = WorkflowRefBlock.builder().id("r").refId("  child ").build();

        assertThat(ref.getRefId()).isEqualTo("child");
        assertThat(ref.getOutputName()).isEqualTo(WorkflowRefBlock.DEFAULT_OUTPUT_NAME);
        assertThat(ref.getInputMapping()).isEmpty();
        assertThat(ref.getRefName()).isEmpty();
    }

    private static OutputBlock output(String id) {
        return OutputBlock.builder().id(id).value(id).build();
    }
}
