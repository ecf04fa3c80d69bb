package io.lemon.core.execution;

import io.lemon.core.condition.ConditionEvaluator;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.block.InputBlock;
import io.lemon.core.workflow.block.NumericRange;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Checks caller-supplied inputs against a workflow's input declarations.
///
/// Collects every violation instead of stopping at the first, and never throws
/// for bad values. Booleans are never accepted as numbers.
final class InputValidator {

    private InputValidator() {}

    static List<String> validate(Workflow workflow, Map<String, ?> inputs) {
        List<String> errors = new ArrayList<>();
        for (InputBlock block : workflow.getInputBlocks()) {
            String name = block.getName();
            if (!inputs.containsKey(name)) {
                if (block.isRequired()) {
                    errors.add("Missing required input: " + name);
                }
                continue;
            }
            checkValue(block, inputs.get(name), errors);
        }
        return errors;
    }

    private static void checkValue(InputBlock block, Object value, List<String> errors) {
        String name = block.getName();
        switch (block.getInputType()) {
            case INT -> {
                if (!isIntegral(value)) {
                    errors.add(typeError(name, "an integer", value));
                    return;
                }
                checkRange(block, (Number) value, errors);
            }
            case FLOAT -> {
                if (!(value instanceof Number)) {
                    errors.add(typeError(name, "a number", value));
                    return;
                }
                if (isNaN(value)) {
                    errors.add("Input '" + name + "' must be a number, got NaN");
                    return;
                }
                checkRange(block, (Number) value, errors);
            }
            case BOOL -> {
                if (!(value instanceof Boolean)) {
                    errors.add(typeError(name, "a boolean", value));
                }
            }
            case STRING -> {
                if (!(value instanceof String)) {
                    errors.add(typeError(name, "a string", value));
                }
            }
            case ENUM -> {
                if (!block.getEnumValues().isEmpty() && !block.getEnumValues().contains(value)) {
                    errors.add(
                            "Input '"
                                    + name
                                    + "' value '"
                                    + value
                                    + "' not in allowed values: "
                                    + block.getEnumValues());
                }
            }
            case DATE -> {
                if (!isDate(value)) {
                    errors.add(typeError(name, "a date (YYYY-MM-DD)", value));
                }
            }
        }
    }

    private static void checkRange(InputBlock block, Number value, List<String> errors) {
        NumericRange range = block.getRange();
        if (range == null) {
            return;
        }
        double v = value.doubleValue();
        if (range.min() != null && v < range.min()) {
            errors.add(
                    "Input '"
                            + block.getName()
                            + "' value "
                            + value
                            + " below minimum "
                            + formatBound(range.min()));
        }
        if (range.max() != null && v > range.max()) {
            errors.add(
                    "Input '"
                            + block.getName()
                            + "' value "
                            + value
                            + " above maximum "
                            + formatBound(range.max()));
        }
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    private static boolean isNaN(Object value) {
        return (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }

    private static boolean isDate(Object value) {
        if (value instanceof LocalDate) {
            return true;
        }
        if (value instanceof String text) {
            try {
                LocalDate.parse(text);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
        return false;
    }

    private static String typeError(String name, String expected, Object value) {
        return "Input '"
                + name
                + "' must be "
                + expected
                + ", got "
                + ConditionEvaluator.typeName(value);
    }

    private static String formatBound(double bound) {
        if (bound == Math.rint(bound) && !Double.isInfinite(bound)) {
            return Long.toString((long) bound);
        }
        return Double.toString(bound);
    }
}
