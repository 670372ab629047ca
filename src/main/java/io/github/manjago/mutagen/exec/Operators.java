package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.snippet.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * Operator semantics for snippet values.
 *
 * Integers are {@code Long}, floats {@code Double}. Mixed arithmetic
 * promotes to Double, {@code /} always yields Double, {@code //} and
 * {@code %} floor toward negative infinity. Any operation involving a
 * {@link Frame} is applied element-wise.
 */
final class Operators {

    private Operators() {}

    // ========== Binary ==========

    static Object binary(Expr.BinaryOperator op, Object left, Object right) {
        if (left instanceof Frame || right instanceof Frame) {
            return frameBinary(op, left, right);
        }
        if (op == Expr.BinaryOperator.BIT_AND || op == Expr.BinaryOperator.BIT_OR) {
            return bitwise(op, left, right);
        }
        if (op == Expr.BinaryOperator.ADD && left instanceof String l && right instanceof String r) {
            return l + r;
        }
        if (op == Expr.BinaryOperator.ADD && left instanceof List<?> l && right instanceof List<?> r) {
            List<Object> joined = new ArrayList<>(l);
            joined.addAll(r);
            return joined;
        }
        if (!isNumber(left) || !isNumber(right)) {
            throw new EvaluationException(String.format("Unsupported operand types for %s: %s and %s",
                op.symbol(), typeName(left), typeName(right)));
        }
        if (isInteger(left) && isInteger(right)) {
            return integerArithmetic(op, toLong(left), toLong(right));
        }
        return floatArithmetic(op, toDouble(left), toDouble(right));
    }

    private static Object integerArithmetic(Expr.BinaryOperator op, long a, long b) {
        return switch (op) {
            case ADD -> Math.addExact(a, b);
            case SUB -> Math.subtractExact(a, b);
            case MUL -> Math.multiplyExact(a, b);
            case DIV -> {
                if (b == 0) {
                    throw new EvaluationException("Division by zero");
                }
                yield (double) a / b;
            }
            case FLOOR_DIV -> {
                if (b == 0) {
                    throw new EvaluationException("Integer division by zero");
                }
                yield Math.floorDiv(a, b);
            }
            case MOD -> {
                if (b == 0) {
                    throw new EvaluationException("Integer modulo by zero");
                }
                yield Math.floorMod(a, b);
            }
            case POW -> b >= 0 ? (Object) (long) Math.pow(a, b) : (Object) Math.pow(a, b);
            default -> throw new IllegalStateException("Unexpected operator " + op);
        };
    }

    private static double floatArithmetic(Expr.BinaryOperator op, double a, double b) {
        return switch (op) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> {
                if (b == 0) {
                    throw new EvaluationException("Division by zero");
                }
                yield a / b;
            }
            case FLOOR_DIV -> {
                if (b == 0) {
                    throw new EvaluationException("Division by zero");
                }
                yield Math.floor(a / b);
            }
            case MOD -> {
                if (b == 0) {
                    throw new EvaluationException("Modulo by zero");
                }
                yield a - b * Math.floor(a / b);
            }
            case POW -> Math.pow(a, b);
            default -> throw new IllegalStateException("Unexpected operator " + op);
        };
    }

    private static Object bitwise(Expr.BinaryOperator op, Object left, Object right) {
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return op == Expr.BinaryOperator.BIT_AND ? l && r : l || r;
        }
        if (isInteger(left) && isInteger(right)) {
            long a = toLong(left);
            long b = toLong(right);
            return op == Expr.BinaryOperator.BIT_AND ? a & b : a | b;
        }
        throw new EvaluationException(String.format("Unsupported operand types for %s: %s and %s",
            op.symbol(), typeName(left), typeName(right)));
    }

    private static Frame frameBinary(Expr.BinaryOperator op, Object left, Object right) {
        DoubleBinaryOperator fn = switch (op) {
            case ADD -> Double::sum;
            case SUB -> (a, b) -> a - b;
            case MUL -> (a, b) -> a * b;
            case DIV -> (a, b) -> b == 0 ? Double.NaN : a / b;
            case FLOOR_DIV -> (a, b) -> b == 0 ? Double.NaN : Math.floor(a / b);
            case MOD -> (a, b) -> b == 0 ? Double.NaN : a - b * Math.floor(a / b);
            case POW -> Math::pow;
            case BIT_AND -> (a, b) -> Frame.bool(Frame.truthy(a) && Frame.truthy(b));
            case BIT_OR -> (a, b) -> Frame.bool(Frame.truthy(a) || Frame.truthy(b));
        };
        if (left instanceof Frame l && right instanceof Frame r) {
            return l.combine(r, fn);
        }
        if (left instanceof Frame l) {
            return l.combine(frameScalar(right, op.symbol()), fn);
        }
        double scalar = frameScalar(left, op.symbol());
        return ((Frame) right).map(v -> fn.applyAsDouble(scalar, v));
    }

    private static double frameScalar(Object value, String symbol) {
        if (value instanceof Boolean b) {
            return Frame.bool(b);
        }
        if (!isNumber(value)) {
            throw new EvaluationException("Unsupported operand type for Frame " + symbol + ": " + typeName(value));
        }
        return toDouble(value);
    }

    // ========== Comparison ==========

    static Object compare(Expr.CompareOperator op, Object left, Object right) {
        if (left instanceof Frame || right instanceof Frame) {
            DoubleBinaryOperator fn = (a, b) -> {
                if (Double.isNaN(a) || Double.isNaN(b)) {
                    return op == Expr.CompareOperator.NE ? 1.0 : 0.0;
                }
                return Frame.bool(compareNumbers(op, Double.compare(a, b)));
            };
            if (left instanceof Frame l && right instanceof Frame r) {
                return l.combine(r, fn);
            }
            if (left instanceof Frame l) {
                return l.combine(frameScalar(right, op.symbol()), fn);
            }
            double scalar = frameScalar(left, op.symbol());
            return ((Frame) right).map(v -> fn.applyAsDouble(scalar, v));
        }
        if (op == Expr.CompareOperator.EQ) {
            return valueEquals(left, right);
        }
        if (op == Expr.CompareOperator.NE) {
            return !valueEquals(left, right);
        }
        if (isNumber(left) && isNumber(right)) {
            return compareNumbers(op, Double.compare(toDouble(left), toDouble(right)));
        }
        if (left instanceof String l && right instanceof String r) {
            return compareNumbers(op, l.compareTo(r));
        }
        throw new EvaluationException(String.format("Cannot compare %s and %s with %s",
            typeName(left), typeName(right), op.symbol()));
    }

    private static boolean compareNumbers(Expr.CompareOperator op, int cmp) {
        return switch (op) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
        };
    }

    private static boolean valueEquals(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            return toDouble(left) == toDouble(right);
        }
        return Objects.equals(left, right);
    }

    // ========== Unary ==========

    static Object unary(Expr.UnaryOperator op, Object operand) {
        switch (op) {
            case NOT:
                return !truthy(operand);
            case NEG:
                if (operand instanceof Frame f) {
                    return f.map(v -> -v);
                }
                if (isInteger(operand)) {
                    return Math.negateExact(toLong(operand));
                }
                if (isNumber(operand)) {
                    return -toDouble(operand);
                }
                break;
            case POS:
                if (operand instanceof Frame || isNumber(operand)) {
                    return operand instanceof Boolean b ? (Object) (b ? 1L : 0L) : operand;
                }
                break;
            case INVERT:
                if (operand instanceof Frame f) {
                    return f.map(v -> Frame.bool(!Frame.truthy(v)));
                }
                if (isInteger(operand)) {
                    return ~toLong(operand);
                }
                break;
            default:
                break;
        }
        throw new EvaluationException("Bad operand type for unary " + op.symbol() + ": " + typeName(operand));
    }

    // ========== Value helpers ==========

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Long l) {
            return l != 0;
        }
        if (value instanceof Double d) {
            return d != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof List<?> l) {
            return !l.isEmpty();
        }
        if (value instanceof Frame) {
            throw new EvaluationException("The truth value of a Frame is ambiguous");
        }
        return true;
    }

    static boolean isNumber(Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    static boolean isInteger(Object value) {
        return value instanceof Long || value instanceof Boolean;
    }

    static long toLong(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return ((Number) value).longValue();
    }

    static double toDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new EvaluationException("Expected a number but got " + typeName(value));
    }

    static String typeName(Object value) {
        if (value == null) {
            return "NoneType";
        }
        if (value instanceof Long) {
            return "int";
        }
        if (value instanceof Double) {
            return "float";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof String) {
            return "str";
        }
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof Frame) {
            return "Frame";
        }
        if (value instanceof ScriptCallable) {
            return "function";
        }
        return value.getClass().getSimpleName();
    }
}
