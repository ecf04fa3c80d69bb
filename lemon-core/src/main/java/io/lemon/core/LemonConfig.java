package io.lemon.core;

import io.lemon.core.execution.WorkflowExecutor;
import io.lemon.core.generation.GenerationStrategy;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/// Configuration options for the Lemon engine.
///
/// Controls the execution step cap, case generation and validation defaults.
/// Use the {@link Builder} for fluent configuration, construct directly with
/// setters, or load from properties and environment variables.
///
/// ### Keys
/// | Property                           | Environment variable               | Default         |
/// |------------------------------------|------------------------------------|-----------------|
/// | `lemon.execution.max-steps`        | `LEMON_EXECUTION_MAX_STEPS`        | `1000`          |
/// | `lemon.generation.seed`            | `LEMON_GENERATION_SEED`            | unset (random)  |
/// | `lemon.validation.case-count`      | `LEMON_VALIDATION_CASE_COUNT`      | `20`            |
/// | `lemon.validation.strategy`        | `LEMON_VALIDATION_STRATEGY`        | `comprehensive` |
/// | `lemon.composition.parent-weight`  | `LEMON_COMPOSITION_PARENT_WEIGHT`  | `0.5`           |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link LemonFactory}.
/// Do not modify after environment creation.
///
/// @see LemonFactory#createEnvironment(LemonConfig)
/// @see Builder
public class LemonConfig {

    public static final String MAX_STEPS_KEY = "lemon.execution.max-steps";
    public static final String SEED_KEY = "lemon.generation.seed";
    public static final String CASE_COUNT_KEY = "lemon.validation.case-count";
    public static final String STRATEGY_KEY = "lemon.validation.strategy";
    public static final String PARENT_WEIGHT_KEY = "lemon.composition.parent-weight";

    private static final String[] KEYS = {
        MAX_STEPS_KEY, SEED_KEY, CASE_COUNT_KEY, STRATEGY_KEY, PARENT_WEIGHT_KEY
    };

    private int maxSteps = WorkflowExecutor.DEFAULT_MAX_STEPS;
    private Long generationSeed;
    private int defaultCaseCount = 20;
    private GenerationStrategy defaultStrategy = GenerationStrategy.COMPREHENSIVE;
    private double compositionParentWeight = 0.5;

    /// Creates a configuration with default values.
    public LemonConfig() {}

    /// Returns the maximum number of blocks one execution may visit.
    ///
    /// @return positive step cap
    public int getMaxSteps() {
        return maxSteps;
    }

    /// Sets the execution step cap.
    ///
    /// @param maxSteps the cap, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setMaxSteps(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException(MAX_STEPS_KEY + " must be positive, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    /// Returns the case generator seed.
    ///
    /// @return the seed, or null for non-reproducible generation
    public Long getGenerationSeed() {
        return generationSeed;
    }

    public void setGenerationSeed(Long generationSeed) {
        this.generationSeed = generationSeed;
    }

    public int getDefaultCaseCount() {
        return defaultCaseCount;
    }

    /// Sets the number of random cases a session generates when none is given.
    ///
    /// @param defaultCaseCount case count, must not be negative
    /// @throws IllegalArgumentException if negative
    public void setDefaultCaseCount(int defaultCaseCount) {
        if (defaultCaseCount < 0) {
            throw new IllegalArgumentException(
                    CASE_COUNT_KEY + " must not be negative, got " + defaultCaseCount);
        }
        this.defaultCaseCount = defaultCaseCount;
    }

    public GenerationStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(GenerationStrategy defaultStrategy) {
        if (defaultStrategy == null) {
            throw new IllegalArgumentException(STRATEGY_KEY + " must not be null");
        }
        this.defaultStrategy = defaultStrategy;
    }

    /// Returns the weight of a composed workflow's own score against its children's.
    ///
    /// @return weight in `[0, 1]`
    public double getCompositionParentWeight() {
        return compositionParentWeight;
    }

    /// Sets the parent weight used when combining composed workflow scores.
    ///
    /// @param compositionParentWeight weight in `[0, 1]`
    /// @throws IllegalArgumentException if outside `[0, 1]`
    public void setCompositionParentWeight(double compositionParentWeight) {
        if (!(compositionParentWeight >= 0.0 && compositionParentWeight <= 1.0)) {
            throw new IllegalArgumentException(
                    PARENT_WEIGHT_KEY + " must be within [0, 1], got " + compositionParentWeight);
        }
        this.compositionParentWeight = compositionParentWeight;
    }

    /// Loads configuration from properties. Missing keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed, naming the key
    public static LemonConfig fromProperties(Properties properties) {
        LemonConfig config = new LemonConfig();
        for (String key : KEYS) {
            String value = properties.getProperty(key);
            if (value != null && !value.isBlank()) {
                config.apply(key, value.trim());
            }
        }
        return config;
    }

    /// Loads configuration from process environment variables.
    ///
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed, naming the key
    public static LemonConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /// Loads configuration from an environment map such as {@link System#getenv()}.
    ///
    /// Each property key maps to an upper-case variable with `.` and `-`
    /// replaced by `_`, e.g. `lemon.execution.max-steps` becomes
    /// `LEMON_EXECUTION_MAX_STEPS`.
    ///
    /// @param environment variables by name, not null
    /// @return new configuration, never null
    public static LemonConfig fromEnvironment(Map<String, String> environment) {
        Properties properties = new Properties();
        for (String key : KEYS) {
            String value = environment.get(environmentName(key));
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    /// Loads configuration from the environment and properties combined.
    ///
    /// Properties take precedence over environment variables when the same
    /// key exists in both sources.
    ///
    /// @param properties overriding properties, not null
    /// @return new configuration, never null
    public static LemonConfig load(Properties properties) {
        return load(System.getenv(), properties);
    }

    static LemonConfig load(Map<String, String> environment, Properties properties) {
        Properties merged = new Properties();
        for (String key : KEYS) {
            String value = environment.get(environmentName(key));
            if (value != null) {
                merged.setProperty(key, value);
            }
            if (properties.getProperty(key) != null) {
                merged.setProperty(key, properties.getProperty(key));
            }
        }
        return fromProperties(merged);
    }

    /// Returns the environment variable name for a property key.
    ///
    /// @param key property key, not null
    /// @return upper-case variable name, never null
    public static String environmentName(String key) {
        return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private void apply(String key, String value) {
        try {
            switch (key) {
                case MAX_STEPS_KEY -> setMaxSteps(Integer.parseInt(value));
                case SEED_KEY -> setGenerationSeed(Long.parseLong(value));
                case CASE_COUNT_KEY -> setDefaultCaseCount(Integer.parseInt(value));
                case STRATEGY_KEY -> setDefaultStrategy(parseStrategy(value));
                case PARENT_WEIGHT_KEY -> setCompositionParentWeight(Double.parseDouble(value));
                default -> throw new IllegalArgumentException("Unknown configuration key: " + key);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static GenerationStrategy parseStrategy(String value) {
        try {
            return GenerationStrategy.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid value for " + STRATEGY_KEY + ": '" + value + "'", e);
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link LemonConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}. Values are validated as they are set.
    public static class Builder {
        private final LemonConfig config = new LemonConfig();

        public Builder maxSteps(int maxSteps) {
            config.setMaxSteps(maxSteps);
            return this;
        }

        /// Sets the case generator seed.
        ///
        /// @param seed the seed, or null for non-reproducible generation
        /// @return this builder for chaining, never null
        public Builder generationSeed(Long seed) {
            config.setGenerationSeed(seed);
            return this;
        }

        public Builder defaultCaseCount(int defaultCaseCount) {
            config.setDefaultCaseCount(defaultCaseCount);
            return this;
        }

        public Builder defaultStrategy(GenerationStrategy defaultStrategy) {
            config.setDefaultStrategy(defaultStrategy);
            return this;
        }

        public Builder compositionParentWeight(double compositionParentWeight) {
            config.setCompositionParentWeight(compositionParentWeight);
            return this;
        }

        /// Builds and returns the configured {@link LemonConfig} instance.
        ///
        /// @return the configured instance, never null
        public LemonConfig build() {
            return config;
        }
    }
}
