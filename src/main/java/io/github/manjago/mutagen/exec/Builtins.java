package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.snippet.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builtin functions visible to every snippet, plus argument helpers.
 *
 * The set is deliberately small: pure numeric and list helpers only.
 * Nothing here reaches the file system, the network or the host runtime.
 */
public final class Builtins {

    private static final Logger log = LoggerFactory.getLogger(Builtins.class);

    private static final long MAX_RANGE = 1_000_000;

    private Builtins() {}

    /**
     * Fresh map of all builtins, keyed by name.
     */
    public static Map<String, Object> all() {
        Map<String, Object> b = new LinkedHashMap<>();
        add(b, "abs", (i, a, k) -> abs(single(a, "abs")));
        add(b, "min", (i, a, k) -> extreme(a, true));
        add(b, "max", (i, a, k) -> extreme(a, false));
        add(b, "len", (i, a, k) -> len(single(a, "len")));
        add(b, "range", (i, a, k) -> range(a));
        add(b, "round", (i, a, k) -> round(a));
        add(b, "float", (i, a, k) -> a.isEmpty() ? 0.0 : toFloat(a.get(0)));
        add(b, "int", (i, a, k) -> a.isEmpty() ? 0L : toInt(a.get(0)));
        add(b, "bool", (i, a, k) -> !a.isEmpty() && Operators.truthy(a.get(0)));
        add(b, "str", (i, a, k) -> a.isEmpty() ? "" : str(a.get(0)));
        add(b, "sum", (i, a, k) -> sum(single(a, "sum")));
        add(b, "print", (i, a, k) -> {
            log.debug("snippet: {}", a.stream().map(Builtins::str).collect(Collectors.joining(" ")));
            return null;
        });
        return b;
    }

    private static void add(Map<String, Object> map, String name, BuiltinFunction.Body body) {
        map.put(name, new BuiltinFunction(name, body));
    }

    // ========== Implementations ==========

    private static Object abs(Object v) {
        if (v instanceof Frame f) {
            return f.map(Math::abs);
        }
        if (Operators.isInteger(v)) {
            return Math.abs(Operators.toLong(v));
        }
        return Math.abs(Operators.toDouble(v));
    }

    private static Object extreme(List<Object> args, boolean min) {
        List<?> items = args.size() == 1 && args.get(0) instanceof List<?> l ? l : args;
        if (items.isEmpty()) {
            throw new EvaluationException((min ? "min" : "max") + "() arg is an empty sequence");
        }
        Object best = items.get(0);
        for (Object item : items) {
            double cmp = Operators.toDouble(item) - Operators.toDouble(best);
            if (min ? cmp < 0 : cmp > 0) {
                best = item;
            }
        }
        return best;
    }

    private static Object len(Object v) {
        if (v instanceof List<?> l) {
            return (long) l.size();
        }
        if (v instanceof String s) {
            return (long) s.length();
        }
        if (v instanceof Frame f) {
            return (long) f.rows();
        }
        throw new EvaluationException("Object of type " + Operators.typeName(v) + " has no len()");
    }

    private static Object range(List<Object> args) {
        long start = 0;
        long stop;
        long step = 1;
        switch (args.size()) {
            case 1 -> stop = toInt(args.get(0));
            case 2 -> {
                start = toInt(args.get(0));
                stop = toInt(args.get(1));
            }
            case 3 -> {
                start = toInt(args.get(0));
                stop = toInt(args.get(1));
                step = toInt(args.get(2));
            }
            default -> throw new EvaluationException("range expected 1 to 3 arguments, got " + args.size());
        }
        if (step == 0) {
            throw new EvaluationException("range() step must not be zero");
        }
        long count = Math.max(0, (stop - start + step + (step > 0 ? -1 : 1)) / step);
        if (count > MAX_RANGE) {
            throw new EvaluationException("range() too large: " + count + " elements");
        }
        List<Object> out = new ArrayList<>((int) count);
        for (long v = start; step > 0 ? v < stop : v > stop; v += step) {
            out.add(v);
        }
        return out;
    }

    private static Object round(List<Object> args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new EvaluationException("round expected 1 or 2 arguments, got " + args.size());
        }
        double v = Operators.toDouble(args.get(0));
        if (args.size() == 1) {
            return (long) Math.rint(v);
        }
        double scale = Math.pow(10, toInt(args.get(1)));
        return Math.rint(v * scale) / scale;
    }

    private static Object sum(Object v) {
        if (!(v instanceof List<?> items)) {
            throw new EvaluationException("sum() expects a list, got " + Operators.typeName(v));
        }
        Object total = 0L;
        for (Object item : items) {
            total = Operators.binary(Expr.BinaryOperator.ADD, total, item);
        }
        return total;
    }

    private static double toFloat(Object v) {
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new EvaluationException("could not convert string to float: '" + s + "'");
            }
        }
        return Operators.toDouble(v);
    }

    private static long toInt(Object v) {
        if (v instanceof Double d) {
            return d.longValue();
        }
        if (Operators.isInteger(v)) {
            return Operators.toLong(v);
        }
        throw new EvaluationException("Expected an integer but got " + Operators.typeName(v));
    }

    static String str(Object v) {
        if (v == null) {
            return "None";
        }
        if (v instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return String.valueOf(v);
    }

    private static Object single(List<Object> args, String fn) {
        if (args.size() != 1) {
            throw new EvaluationException(fn + "() takes exactly one argument (" + args.size() + " given)");
        }
        return args.get(0);
    }

    // ========== Argument helpers ==========

    /**
     * Integer argument by position or keyword.
     *
     * @param defaultValue used when absent; null makes the argument required
     */
    public static int intArg(List<Object> args, Map<String, Object> kwargs, int index, String name, Integer defaultValue) {
        Object v = arg(args, kwargs, index, name);
        if (v == null) {
            if (defaultValue == null) {
                throw new EvaluationException("Missing required argument '" + name + "'");
            }
            return defaultValue;
        }
        long l = toInt(v);
        if (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) {
            throw new EvaluationException("Argument '" + name + "' out of range: " + l);
        }
        return (int) l;
    }

    public static double doubleArg(List<Object> args, Map<String, Object> kwargs, int index, String name, Double defaultValue) {
        Object v = arg(args, kwargs, index, name);
        if (v == null) {
            if (defaultValue == null) {
                throw new EvaluationException("Missing required argument '" + name + "'");
            }
            return defaultValue;
        }
        return Operators.toDouble(v);
    }

    /**
     * Raw argument by position or keyword, null when absent.
     */
    public static Object arg(List<Object> args, Map<String, Object> kwargs, int index, String name) {
        if (index >= 0 && index < args.size()) {
            return args.get(index);
        }
        return kwargs.get(name);
    }
}
