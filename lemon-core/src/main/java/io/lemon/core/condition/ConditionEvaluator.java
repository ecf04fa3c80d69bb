package io.lemon.core.condition;

import io.lemon.core.condition.ConditionNode.BoolOp;
import io.lemon.core.condition.ConditionNode.Compare;
import io.lemon.core.condition.ConditionNode.ListLiteral;
import io.lemon.core.condition.ConditionNode.Literal;
import io.lemon.core.condition.ConditionNode.Name;
import io.lemon.core.condition.ConditionNode.UnaryOp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/// Parses and evaluates decision conditions against a variable context.
///
/// Conditions are small boolean expressions written by workflow authors:
/// comparisons (including chains such as `10 < age < 30`), `and`/`or`/`not`,
/// membership (`in`, `not in`), number/string/boolean/none literals, lists and
/// tuples, and bare variable names. Calls, attribute access, subscripts,
/// arithmetic and statement keywords are rejected before anything is evaluated.
///
/// ### Value semantics
/// - Numbers compare by value regardless of integral or decimal representation
/// - Strings compare lexicographically; `in` on a string tests for a substring
/// - Ordering values of incompatible types is an error, equality is simply false
/// - No comparison involving NaN holds
/// - `none`, `false`, zero, the empty string and the empty list are falsy
/// - `and`/`or` stop at the first operand that decides the result
///
/// ### Usage
/// {@snippet :
/// ConditionEvaluator evaluator = new ConditionEvaluator();
/// boolean adult = evaluator.evaluate("age >= 18", Map.of("age", 20)); // true
/// List<String> problems = evaluator.validate("len(name) > 3", Set.of("name"));
/// // ["Function calls are not allowed in conditions"]
/// }
///
/// @implNote Thread-safe and side-effect free. Parsed trees are cached by
/// condition text since the case generator and validation sessions evaluate
/// the same conditions many times.
public final class ConditionEvaluator {

    private static final int CACHE_LIMIT = 1024;

    private final Map<String, ConditionNode> cache = new ConcurrentHashMap<>();

    /// Evaluates a condition to a boolean.
    ///
    /// @param expression condition text, not null
    /// @param context variable values by name, not null; values may be
    ///        numbers, strings, booleans, null, collections or `LocalDate`
    /// @return truthiness of the expression result
    /// @throws InvalidConditionException if the text is malformed, uses a
    ///         disallowed construct, or compares incompatible types
    /// @throws UnknownVariableException if a referenced variable is absent
    public boolean evaluate(String expression, Map<String, ?> context)
            throws ConditionException {
        Objects.requireNonNull(context, "context must not be null");
        ConditionNode root = parse(expression);
        return truthy(new Evaluation(expression, context).eval(root));
    }

    /// Checks a condition without evaluating it.
    ///
    /// @param expression condition text
    /// @param knownVariables names that will be available at evaluation time
    /// @return problems found, empty if the condition is valid; never null
    public List<String> validate(String expression, Set<String> knownVariables) {
        List<String> errors = new ArrayList<>();
        ConditionNode root;
        try {
            root = parse(expression);
        } catch (InvalidConditionException e) {
            errors.add(e.getMessage());
            return errors;
        }
        Set<String> unknown = new TreeSet<>(collectNames(root));
        unknown.removeAll(knownVariables);
        if (!unknown.isEmpty()) {
            errors.add("Unknown variables: " + String.join(", ", unknown));
        }
        return errors;
    }

    /// Returns every variable name a condition references.
    ///
    /// @param expression condition text
    /// @return sorted names, empty if the text cannot be parsed; never null
    public Set<String> getReferencedVariables(String expression) {
        try {
            return Collections.unmodifiableSet(new TreeSet<>(collectNames(parse(expression))));
        } catch (InvalidConditionException e) {
            return Set.of();
        }
    }

    /// Parses a condition into its tree, using the cache.
    ///
    /// @param expression condition text
    /// @return root node, never null
    /// @throws InvalidConditionException if the text is not a valid condition
    public ConditionNode parse(String expression) throws InvalidConditionException {
        String key = expression != null ? expression.trim() : "";
        ConditionNode cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        ConditionNode parsed = ConditionParser.parse(key);
        if (cache.size() >= CACHE_LIMIT) {
            cache.clear();
        }
        cache.put(key, parsed);
        return parsed;
    }

    private static Set<String> collectNames(ConditionNode node) {
        Set<String> names = new TreeSet<>();
        collectNames(node, names);
        return names;
    }

    private static void collectNames(ConditionNode node, Set<String> names) {
        if (node instanceof Name name) {
            names.add(name.id());
        } else if (node instanceof Compare compare) {
            collectNames(compare.left(), names);
            compare.comparators().forEach(c -> collectNames(c, names));
        } else if (node instanceof BoolOp boolOp) {
            boolOp.values().forEach(v -> collectNames(v, names));
        } else if (node instanceof UnaryOp unaryOp) {
            collectNames(unaryOp.operand(), names);
        } else if (node instanceof ListLiteral list) {
            list.elements().forEach(e -> collectNames(e, names));
        }
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    /// One evaluation pass over a tree with a fixed context.
    private static final class Evaluation {
        private final String expression;
        private final Map<String, ?> context;

        Evaluation(String expression, Map<String, ?> context) {
            this.expression = expression;
            this.context = context;
        }

        Object eval(ConditionNode node) throws ConditionException {
            if (node instanceof Literal literal) {
                return literal.value();
            }
            if (node instanceof Name name) {
                return resolve(name.id());
            }
            if (node instanceof Compare compare) {
                return compare(compare);
            }
            if (node instanceof BoolOp boolOp) {
                return boolOp(boolOp);
            }
            if (node instanceof UnaryOp unaryOp) {
                return unary(unaryOp);
            }
            if (node instanceof ListLiteral list) {
                List<Object> values = new ArrayList<>(list.elements().size());
                for (ConditionNode element : list.elements()) {
                    values.add(eval(element));
                }
                return values;
            }
            throw new InvalidConditionException(
                    "Unsupported expression type: " + node.getClass().getSimpleName(), expression);
        }

        private Object resolve(String name) throws UnknownVariableException {
            if (!context.containsKey(name)) {
                throw new UnknownVariableException(
                        name, new ArrayList<>(new TreeSet<>(context.keySet())), expression);
            }
            return context.get(name);
        }

        private Boolean compare(Compare compare) throws ConditionException {
            Object left = eval(compare.left());
            for (int i = 0; i < compare.ops().size(); i++) {
                Object right = eval(compare.comparators().get(i));
                if (!apply(compare.ops().get(i), left, right)) {
                    return Boolean.FALSE;
                }
                left = right;
            }
            return Boolean.TRUE;
        }

        private Object boolOp(BoolOp boolOp) throws ConditionException {
            Object last = null;
            for (ConditionNode operand : boolOp.values()) {
                last = eval(operand);
                boolean value = truthy(last);
                if (boolOp.and() != value) {
                    return last;
                }
            }
            return last;
        }

        private Object unary(UnaryOp unaryOp) throws ConditionException {
            Object operand = eval(unaryOp.operand());
            switch (unaryOp.op()) {
                case NOT:
                    return !truthy(operand);
                case NEGATE:
                    if (operand instanceof Double || operand instanceof Float) {
                        return -((Number) operand).doubleValue();
                    }
                    if (operand instanceof Number number) {
                        return -number.longValue();
                    }
                    throw new InvalidConditionException(
                            "Unary '-' requires a number, got " + typeName(operand), expression);
                case PLUS:
                    if (operand instanceof Number) {
                        return operand;
                    }
                    throw new InvalidConditionException(
                            "Unary '+' requires a number, got " + typeName(operand), expression);
                default:
                    throw new InvalidConditionException(
                            "Unsupported unary operator: " + unaryOp.op(), expression);
            }
        }

        private boolean apply(ComparisonOperator op, Object left, Object right)
                throws InvalidConditionException {
            return switch (op) {
                case EQ -> Values.equal(left, right);
                case NEQ -> !Values.equal(left, right);
                case IN -> contains(right, left);
                case NOT_IN -> !contains(right, left);
                case LT, LTE, GT, GTE -> ordered(op, left, right);
            };
        }

        private boolean ordered(ComparisonOperator op, Object left, Object right)
                throws InvalidConditionException {
            if ((Values.isNaN(left) && Values.isNumber(right))
                    || (Values.isNaN(right) && Values.isNumber(left))) {
                return false;
            }
            int result = order(op, left, right);
            return switch (op) {
                case LT -> result < 0;
                case LTE -> result <= 0;
                case GT -> result > 0;
                default -> result >= 0;
            };
        }

        private int order(ComparisonOperator op, Object left, Object right)
                throws InvalidConditionException {
            Integer result = Values.compare(left, right);
            if (result == null) {
                throw new InvalidConditionException(
                        "Cannot compare "
                                + typeName(left)
                                + " and "
                                + typeName(right)
                                + " with '"
                                + op.symbol()
                                + "'",
                        expression);
            }
            return result;
        }

        private boolean contains(Object container, Object element)
                throws InvalidConditionException {
            if (container instanceof Collection<?> collection) {
                for (Object candidate : collection) {
                    if (Values.equal(element, candidate)) {
                        return true;
                    }
                }
                return false;
            }
            if (container instanceof CharSequence text) {
                if (element instanceof CharSequence part) {
                    return text.toString().contains(part);
                }
                throw new InvalidConditionException(
                        "'in <string>' requires a string on the left, got " + typeName(element),
                        expression);
            }
            throw new InvalidConditionException(
                    "Membership test requires a list or string, got " + typeName(container),
                    expression);
        }
    }

    /// Returns the condition-language name of a value's type: `int`, `float`, `bool`, `str`, `list` or `none`.
    public static String typeName(Object value) {
        if (value == null) {
            return "none";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Double || value instanceof Float) {
            return "float";
        }
        if (value instanceof Number) {
            return "int";
        }
        if (value instanceof CharSequence) {
            return "str";
        }
        if (value instanceof Collection<?>) {
            return "list";
        }
        return value.getClass().getSimpleName();
    }
}
