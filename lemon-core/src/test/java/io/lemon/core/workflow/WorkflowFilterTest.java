package io.lemon.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lemon.core.TestWorkflows;
import io.lemon.core.workflow.block.InputType;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkflowFilterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldMatchEverythingWhenEmpty() {
        assertThat(WorkflowFilter.NONE.isEmpty()).isTrue();
        assertThat(WorkflowFilter.NONE.matches(TestWorkflows.ageCheck())).isTrue();
        assertThat(WorkflowFilter.builder().domain("x").build().isEmpty()).isFalse();
    }

    @Test
    void shouldMatchAnyOfTags() {
        Workflow workflow = TestWorkflows.ageCheck();

        assertThat(filter().tags(List.of("nope", "basic")).build().matches(workflow)).isTrue();
        assertThat(filter().tags(List.of("nope")).build().matches(workflow)).isFalse();
    }

    @Test
    void shouldMatchInputsAndOutputs() {
        Workflow workflow = TestWorkflows.ageCheck();

        assertThat(filter().hasInput("age").build().matches(workflow)).isTrue();
        assertThat(filter().hasInputType(InputType.INT).build().matches(workflow)).isTrue();
        assertThat(filter().hasInputType(InputType.DATE).build().matches(workflow)).isFalse();
        assertThat(filter().hasOutput("minor").build().matches(workflow)).isTrue();
        assertThat(filter().hasOutput("maybe").build().matches(workflow)).isFalse();
    }

    @Test
    void shouldMatchNameCaseInsensitively() {
        assertThat(filter().nameContains("AGE").build().matches(TestWorkflows.ageCheck())).isTrue();
    }

    @Test
    void shouldMatchValidationRangeAndFlag() {
        Workflow validated = withValidation("v", 90.0, 20, T0);
        Workflow weak = withValidation("w", 90.0, 3, T0);

        assertThat(filter().minValidation(85.0).build().matches(validated)).isTrue();
        assertThat(filter().maxValidation(85.0).build().matches(validated)).isFalse();
        assertThat(filter().isValidated(true).build().matches(validated)).isTrue();
        assertThat(filter().isValidated(true).build().matches(weak)).isFalse();
        assertThat(filter().isValidated(false).build().matches(weak)).isTrue();
    }

    @Test
    void shouldOrderByUpdatedAtDescendingThenPaginate() {
        List<Workflow> workflows =
                List.of(
                        withValidation("old", 0, 0, T0),
                        withValidation("new", 0, 0, T0.plusSeconds(20)),
                        withValidation("mid", 0, 0, T0.plusSeconds(10)));

        assertThat(WorkflowFilter.NONE.apply(workflows))
                .extracting(WorkflowSummary::id)
                .containsExactly("new", "mid", "old");
        assertThat(filter().offset(1).limit(1).build().apply(workflows))
                .extracting(WorkflowSummary::id)
                .containsExactly("mid");
    }

    @Test
    void shouldRejectNegativePagination() {
        assertThatThrownBy(() -> filter().limit(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter().offset(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSummarizeWorkflow() {
        WorkflowSummary summary = WorkflowSummary.from(withValidation("s", 85.0, 12, T0));

        assertThat(summary.name()).isEqualTo("s");
        assertThat(summary.confidence()).isEqualTo(ValidationConfidence.MEDIUM);
        assertThat(summary.validated()).isTrue();
        assertThat(summary.inputNames()).containsExactly("age");
        assertThat(summary.outputValues()).containsExactly("adult", "minor");
    }

    private static WorkflowFilter.Builder filter() {
        return WorkflowFilter.builder();
    }

    private static Workflow withValidation(String id, double score, int count, Instant updatedAt) {
        return TestWorkflows.ageCheck(id)
                .withMetadata(
                        WorkflowMetadata.builder()
                                .name(id)
                                .validationScore(score)
                                .validationCount(count)
                                .createdAt(T0)
                                .updatedAt(updatedAt)
                                .build());
    }
}
