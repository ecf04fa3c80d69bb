package io.lemon.core.generation;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.block.DecisionBlock;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.NumericRange;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Derives validation inputs from a workflow's own structure.
///
/// ### Strategies
/// - {@link #generate(Workflow, int)}: random values within each input's constraints
/// - {@link #generateBoundary(Workflow)}: range ends plus `t-1, t, t+1` (`t±0.1`
///   for floats) around every numeric literal of every decision that mentions the
///   input, all booleans and all enum values
/// - {@link #generateComprehensive(Workflow, int)}: boundary cases then random
///   cases, deduplicated by input values
///
/// ### Random values
/// | Type   | Value                                                   |
/// |--------|---------------------------------------------------------|
/// | INT    | uniform in `[min, max]`, default `[0, 100]`             |
/// | FLOAT  | uniform in `[min, max]` rounded to 2 places             |
/// | BOOL   | uniform                                                 |
/// | STRING | `test_string_<1..1000>`                                 |
/// | ENUM   | uniform over the declared values                        |
/// | DATE   | `yyyy-MM-dd`, year 1950-2030, month 1-12, day 1-28      |
///
/// @implNote Thresholds are associated with every variable a condition
/// mentions, not with the operand the number is compared to. `a > 5 and b < 10`
/// tries 4..6 and 9..11 for both `a` and `b`.
///
/// @implNote Not thread-safe: the generator owns a single {@link Random}. With a
/// seed, the same workflow always produces the same cases, ids included.
public class CaseGenerator {

    private static final Logger logger = Logger.getLogger(CaseGenerator.class.getName());

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+\\.?\\d*");
    private static final BigDecimal FLOAT_STEP = new BigDecimal("0.1");

    private final ConditionEvaluator evaluator;
    private final Random rng;

    /// Creates a generator.
    ///
    /// @param evaluator used to find the variables a condition references, not null
    /// @param seed random seed for reproducible cases, or null for an unseeded generator
    public CaseGenerator(ConditionEvaluator evaluator, Long seed) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.rng = seed != null ? new Random(seed) : new Random();
    }

    /// Generates cases with the given strategy.
    ///
    /// @param workflow source of the input declarations, not null
    /// @param strategy generation strategy, not null
    /// @param count number of random cases; ignored by {@link GenerationStrategy#BOUNDARY}
    /// @return generated cases, never null
    public List<ValidationCase> generate(Workflow workflow, GenerationStrategy strategy, int count) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        return switch (strategy) {
            case RANDOM -> generate(workflow, count);
            case BOUNDARY -> generateBoundary(workflow);
            case COMPREHENSIVE -> generateComprehensive(workflow, count);
        };
    }

    /// Generates random cases.
    ///
    /// @param workflow source of the input declarations, not null
    /// @param count number of cases, non-negative
    /// @return exactly `count` cases, never null
    public List<ValidationCase> generate(Workflow workflow, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got " + count);
        }
        List<InputBlock> inputs = workflow.getInputBlocks();
        List<ValidationCase> cases = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (InputBlock input : inputs) {
                values.put(input.getName(), randomValue(input));
            }
            cases.add(new ValidationCase(nextCaseId(), values));
        }
        return cases;
    }

    /// Generates boundary cases: one case per boundary value per input, with the
    /// other inputs held at a single random base assignment.
    ///
    /// @param workflow source of the input declarations and decisions, not null
    /// @return boundary cases, never null (empty when no input has boundaries)
    public List<ValidationCase> generateBoundary(Workflow workflow) {
        List<InputBlock> inputs = workflow.getInputBlocks();
        Map<String, List<Double>> thresholds = extractThresholds(workflow);

        Map<String, Object> base = new LinkedHashMap<>();
        for (InputBlock input : inputs) {
            base.put(input.getName(), randomValue(input));
        }

        List<ValidationCase> cases = new ArrayList<>();
        for (InputBlock input : inputs) {
            for (Object value : boundaryValues(input, thresholds.getOrDefault(input.getName(), List.of()))) {
                Map<String, Object> values = new LinkedHashMap<>(base);
                values.put(input.getName(), value);
                cases.add(new ValidationCase(nextCaseId(), values));
            }
        }
        return cases;
    }

    /// Generates boundary cases followed by random cases, dropping any case
    /// whose inputs repeat an earlier one.
    ///
    /// @param workflow source of the input declarations and decisions, not null
    /// @param randomCount number of random cases to add before deduplication
    /// @return unique cases, never null
    public List<ValidationCase> generateComprehensive(Workflow workflow, int randomCount) {
        List<ValidationCase> all = new ArrayList<>(generateBoundary(workflow));
        all.addAll(generate(workflow, randomCount));

        Set<String> seen = new HashSet<>();
        List<ValidationCase> unique = new ArrayList<>();
        for (ValidationCase candidate : all) {
            if (seen.add(new TreeMap<>(candidate.inputs()).toString())) {
                unique.add(candidate);
            }
        }
        logger.fine(
                () -> "Generated " + unique.size() + " comprehensive cases for " + workflow.getId());
        return unique;
    }

    /// Maps each variable referenced by a decision to every numeric literal in
    /// that decision's text.
    Map<String, List<Double>> extractThresholds(Workflow workflow) {
        Map<String, List<Double>> thresholds = new HashMap<>();
        for (DecisionBlock decision : workflow.getDecisionBlocks()) {
            List<Double> numbers = extractNumbers(decision.getCondition());
            for (String variable : evaluator.getReferencedVariables(decision.getCondition())) {
                thresholds.computeIfAbsent(variable, k -> new ArrayList<>()).addAll(numbers);
            }
        }
        return thresholds;
    }

    static List<Double> extractNumbers(String condition) {
        List<Double> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(condition);
        while (matcher.find()) {
            numbers.add(Double.parseDouble(matcher.group()));
        }
        return numbers;
    }

    private List<Object> boundaryValues(InputBlock input, List<Double> thresholds) {
        NumericRange range = input.getRange();
        List<Object> values = new ArrayList<>();
        switch (input.getInputType()) {
            case INT -> {
                if (range != null && range.min() != null) {
                    values.add((long) range.min().doubleValue());
                }
                if (range != null && range.max() != null) {
                    values.add((long) range.max().doubleValue());
                }
                for (double threshold : thresholds) {
                    long t = (long) threshold;
                    values.add(t - 1);
                    values.add(t);
                    values.add(t + 1);
                }
            }
            case FLOAT -> {
                if (range != null && range.min() != null) {
                    values.add(range.min());
                }
                if (range != null && range.max() != null) {
                    values.add(range.max());
                }
                for (double threshold : thresholds) {
                    BigDecimal t = BigDecimal.valueOf(threshold);
                    values.add(t.subtract(FLOAT_STEP).doubleValue());
                    values.add(threshold);
                    values.add(t.add(FLOAT_STEP).doubleValue());
                }
            }
            case BOOL -> {
                values.add(Boolean.TRUE);
                values.add(Boolean.FALSE);
            }
            case ENUM -> values.addAll(input.getEnumValues());
            case STRING, DATE -> {
                // no meaningful boundaries
            }
        }

        Set<Object> unique = new LinkedHashSet<>();
        for (Object value : values) {
            if (value instanceof Number number && range != null && !range.contains(number.doubleValue())) {
                continue;
            }
            unique.add(value);
        }
        return new ArrayList<>(unique);
    }

    private Object randomValue(InputBlock input) {
        NumericRange range = input.getRange();
        return switch (input.getInputType()) {
            case INT -> {
                long min = range != null && range.min() != null ? (long) range.min().doubleValue() : 0L;
                long max =
                        range != null && range.max() != null
                                ? (long) range.max().doubleValue()
                                : Math.max(100L, min);
                if (range == null || range.min() == null) {
                    min = Math.min(min, max);
                }
                yield min == max ? min : rng.nextLong(min, max + 1);
            }
            case FLOAT -> {
                double min = range != null && range.min() != null ? range.min() : 0.0;
                double max =
                        range != null && range.max() != null ? range.max() : Math.max(100.0, min);
                if (range == null || range.min() == null) {
                    min = Math.min(min, max);
                }
                double value = min == max ? min : rng.nextDouble(min, max);
                double rounded = Math.round(value * 100.0) / 100.0;
                yield Math.min(max, Math.max(min, rounded));
            }
            case BOOL -> rng.nextBoolean();
            case STRING -> "test_string_" + (1 + rng.nextInt(1000));
            case ENUM -> input.getEnumValues().get(rng.nextInt(input.getEnumValues().size()));
            case DATE -> String.format(
                    "%04d-%02d-%02d",
                    1950 + rng.nextInt(81),
                    1 + rng.nextInt(12),
                    1 + rng.nextInt(28));
        };
    }

    private String nextCaseId() {
        return String.format("%08x", rng.nextInt());
    }
}
