package io.lemon.core.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/// Equality and ordering over condition values.
final class Values {

    private Values() {}

    static boolean equal(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (isNumber(left) && isNumber(right)) {
            return !isNaN(left)
                    && !isNaN(right)
                    && compareNumbers((Number) left, (Number) right) == 0;
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().equals(right.toString());
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext()) {
                if (!equal(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    /// Orders two values of the types conditions carry: numbers, strings,
    /// booleans and dates.
    ///
    /// @return negative, zero or positive; null when the types are not mutually ordered
    static Integer compare(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (isNumber(left) && isNumber(right)) {
            return compareNumbers((Number) left, (Number) right);
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().compareTo(right.toString());
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        if (left instanceof LocalDate a && right instanceof LocalDate b) {
            return a.compareTo(b);
        }
        return null;
    }

    /// NaN is unordered: no comparison involving it holds.
    static boolean isNaN(Object value) {
        return (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }

    /// Booleans are not numbers here: `true < 2` is a type error, not a comparison.
    static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if (left instanceof BigDecimal || right instanceof BigDecimal
                || left instanceof BigInteger || right instanceof BigInteger) {
            return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString()));
        }
        double a = left.doubleValue();
        double b = right.doubleValue();
        return a == b ? 0 : Double.compare(a, b);
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte;
    }
}
