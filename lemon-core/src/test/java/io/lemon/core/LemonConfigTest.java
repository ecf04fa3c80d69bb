package io.lemon.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lemon.core.generation.GenerationStrategy;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("LemonConfig")
class LemonConfigTest {

    @Test
    void shouldHaveDefaults() {
        LemonConfig config = new LemonConfig();

        assertThat(config.getMaxSteps()).isEqualTo(1000);
        assertThat(config.getGenerationSeed()).isNull();
        assertThat(config.getDefaultCaseCount()).isEqualTo(20);
        assertThat(config.getDefaultStrategy()).isEqualTo(GenerationStrategy.COMPREHENSIVE);
        assertThat(config.getCompositionParentWeight()).isEqualTo(0.5);
    }

    @Nested
    @DisplayName("builder")
    class BuilderTest {

        @Test
        void shouldApplyValues() {
            LemonConfig config =
                    LemonConfig.builder()
                            .maxSteps(50)
                            .generationSeed(7L)
                            .defaultCaseCount(5)
                            .defaultStrategy(GenerationStrategy.BOUNDARY)
                            .compositionParentWeight(0.25)
                            .build();

            assertThat(config.getMaxSteps()).isEqualTo(50);
            assertThat(config.getGenerationSeed()).isEqualTo(7L);
            assertThat(config.getDefaultCaseCount()).isEqualTo(5);
            assertThat(config.getDefaultStrategy()).isEqualTo(GenerationStrategy.BOUNDARY);
            assertThat(config.getCompositionParentWeight()).isEqualTo(0.25);
        }

        @Test
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> LemonConfig.builder().maxSteps(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(LemonConfig.MAX_STEPS_KEY);
            assertThatThrownBy(() -> LemonConfig.builder().defaultCaseCount(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(LemonConfig.CASE_COUNT_KEY);
            assertThatThrownBy(() -> LemonConfig.builder().compositionParentWeight(1.5))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(LemonConfig.PARENT_WEIGHT_KEY);
            assertThatThrownBy(() -> LemonConfig.builder().compositionParentWeight(Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        void shouldLoadFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(LemonConfig.MAX_STEPS_KEY, " 200 ");
            properties.setProperty(LemonConfig.SEED_KEY, "42");
            properties.setProperty(LemonConfig.STRATEGY_KEY, "random");

            LemonConfig config = LemonConfig.fromProperties(properties);

            assertThat(config.getMaxSteps()).isEqualTo(200);
            assertThat(config.getGenerationSeed()).isEqualTo(42L);
            assertThat(config.getDefaultStrategy()).isEqualTo(GenerationStrategy.RANDOM);
            assertThat(config.getDefaultCaseCount()).isEqualTo(20);
        }

        @Test
        void shouldLoadFromEnvironmentMap() {
            LemonConfig config =
                    LemonConfig.fromEnvironment(
                            Map.of(
                                    "LEMON_VALIDATION_CASE_COUNT", "8",
                                    "LEMON_COMPOSITION_PARENT_WEIGHT", "0.75",
                                    "UNRELATED", "x"));

            assertThat(config.getDefaultCaseCount()).isEqualTo(8);
            assertThat(config.getCompositionParentWeight()).isEqualTo(0.75);
        }

        @Test
        void shouldPreferPropertiesOverEnvironment() {
            Properties properties = new Properties();
            properties.setProperty(LemonConfig.MAX_STEPS_KEY, "10");

            LemonConfig config =
                    LemonConfig.load(
                            Map.of(
                                    "LEMON_EXECUTION_MAX_STEPS", "99",
                                    "LEMON_GENERATION_SEED", "3"),
                            properties);

            assertThat(config.getMaxSteps()).isEqualTo(10);
            assertThat(config.getGenerationSeed()).isEqualTo(3L);
        }

        @ParameterizedTest
        @CsvSource({
            "lemon.execution.max-steps, LEMON_EXECUTION_MAX_STEPS",
            "lemon.composition.parent-weight, LEMON_COMPOSITION_PARENT_WEIGHT"
        })
        void shouldDeriveEnvironmentNames(String key, String expected) {
            assertThat(LemonConfig.environmentName(key)).isEqualTo(expected);
        }

        @ParameterizedTest
        @CsvSource({
            "lemon.execution.max-steps, many",
            "lemon.generation.seed, 1.5",
            "lemon.validation.strategy, exhaustive",
            "lemon.composition.parent-weight, half"
        })
        void shouldNameKeyOfUnparseableValue(String key, String value) {
            Properties properties = new Properties();
            properties.setProperty(key, value);

            assertThatThrownBy(() -> LemonConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid value for " + key + ": '" + value + "'");
        }
    }
}
