package io.lemon.core.condition;

import java.util.List;

/// Parsed condition tree. The variant set is closed: the evaluator handles
/// every permitted construct and nothing else can be represented.
public sealed interface ConditionNode {

    /// Constant value: `Long`, `Double`, `String`, `Boolean` or null for `none`.
    record Literal(Object value) implements ConditionNode {}

    /// Variable reference resolved from the evaluation context.
    record Name(String id) implements ConditionNode {}

    /// Possibly chained comparison: `left op0 c0 op1 c1 ...`.
    record Compare(ConditionNode left, List<ComparisonOperator> ops, List<ConditionNode> comparators)
            implements ConditionNode {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
            if (ops.isEmpty() || ops.size() != comparators.size()) {
                throw new IllegalArgumentException("Compare requires one comparator per operator");
            }
        }
    }

    /// `and` / `or` over two or more operands.
    record BoolOp(boolean and, List<ConditionNode> values) implements ConditionNode {
        public BoolOp {
            values = List.copyOf(values);
        }
    }

    /// `not`, unary minus or unary plus.
    record UnaryOp(UnaryOperator op, ConditionNode operand) implements ConditionNode {}

    /// List `[a, b]` or tuple `(a, b)` literal.
    record ListLiteral(List<ConditionNode> elements) implements ConditionNode {
        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }

    enum UnaryOperator {
        NOT,
        NEGATE,
        PLUS
    }
}
