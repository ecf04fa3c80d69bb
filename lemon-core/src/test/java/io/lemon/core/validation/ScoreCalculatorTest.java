package io.lemon.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lemon.core.workflow.ValidationConfidence;
import java.util.List;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ScoreCalculatorTest {

    @Nested
    class Calculate {

        @Test
        void shouldCountMatches() {
            List<ValidationAnswer> answers =
                    List.of(
                            ValidationAnswer.of("c1", "Adult", "adult"),
                            ValidationAnswer.of("c2", " minor ", "minor"),
                            ValidationAnswer.of("c3", "adult", "minor"));

            ValidationScore score = ScoreCalculator.calculate(answers);

            assertThat(score.matches()).isEqualTo(2);
            assertThat(score.total()).isEqualTo(3);
            assertThat(score.score()).isCloseTo(66.67, Offset.offset(0.01));
        }

        @Test
        void shouldScoreZeroWithoutAnswers() {
            ValidationScore score = ScoreCalculator.calculate(List.of());

            assertThat(score).isEqualTo(ValidationScore.EMPTY);
            assertThat(score.score()).isZero();
            assertThat(score.confidence()).isEqualTo(ValidationConfidence.NONE);
            assertThat(score.isValidated()).isFalse();
        }

        @Test
        void shouldTrimStoredAnswer() {
            ValidationAnswer answer = ValidationAnswer.of("c1", "  adult  ", "adult");

            assertThat(answer.userAnswer()).isEqualTo("adult");
            assertThat(answer.matched()).isTrue();
            assertThat(answer.timestamp()).isNotNull();
        }

        @Test
        void shouldRejectInconsistentScore() {
            assertThatThrownBy(() -> new ValidationScore(3, 2))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Merge {

        @Test
        void shouldAccumulateSessions() {
            ValidationScore first = ScoreCalculator.merge(0.0, 0, new ValidationScore(2, 2));
            ValidationScore second =
                    ScoreCalculator.merge(first.score(), first.total(), new ValidationScore(1, 2));

            assertThat(first.score()).isEqualTo(100.0);
            assertThat(first.total()).isEqualTo(2);
            assertThat(second.score()).isEqualTo(75.0);
            assertThat(second.total()).isEqualTo(4);
        }

        @ParameterizedTest
        @CsvSource({"100.0, 2, 2", "75.0, 4, 3", "66.67, 3, 2", "50.0, 3, 2", "0.0, 0, 0", "0.0, 10, 0"})
        void shouldRoundImpliedMatches(double score, int count, int expected) {
            assertThat(ScoreCalculator.impliedMatches(score, count)).isEqualTo(expected);
        }
    }

    @Nested
    class Combine {

        @Test
        void shouldWeightParentAndPooledChildren() {
            ValidationScore combined =
                    ScoreCalculator.combineScores(
                            new ValidationScore(10, 10),
                            List.of(new ValidationScore(5, 10), new ValidationScore(5, 10)),
                            0.5);

            // 0.5 * 1.0 + 0.5 * 0.5 = 0.75 over 30 answers
            assertThat(combined.total()).isEqualTo(30);
            assertThat(combined.matches()).isEqualTo(22);
        }

        @Test
        void shouldReturnParentWithoutChildAnswers() {
            ValidationScore parent = new ValidationScore(3, 4);

            assertThat(ScoreCalculator.combineScores(parent, List.of(), 0.5)).isEqualTo(parent);
            assertThat(ScoreCalculator.combineScores(parent, List.of(ValidationScore.EMPTY), 0.5))
                    .isEqualTo(parent);
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.1})
        void shouldRejectWeightOutsideUnitInterval(double weight) {
            assertThatThrownBy(
                            () ->
                                    ScoreCalculator.combineScores(
                                            ValidationScore.EMPTY, List.of(), weight))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("parentWeight");
        }
    }
}
