package io.github.manjago.mutagen.exec;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.ToDoubleFunction;

/**
 * Date x symbol matrix of doubles, the value type strategies compute with.
 *
 * Rows are trading days (oldest first), columns are symbols. Missing values
 * are NaN. Boolean results (comparisons, masks) are stored as 1.0 / 0.0.
 * Frames are immutable; every operation returns a new frame.
 */
public final class Frame implements ScriptObject {

    private final List<String> symbols;
    private final double[][] values;

    public Frame(List<String> symbols, double[][] values) {
        this.symbols = List.copyOf(symbols);
        this.values = values;
        for (double[] row : values) {
            if (row.length != symbols.size()) {
                throw new IllegalArgumentException(
                    "Row width " + row.length + " does not match " + symbols.size() + " symbols");
            }
        }
    }

    public static Frame filled(List<String> symbols, int rows, double value) {
        double[][] v = new double[rows][symbols.size()];
        for (double[] row : v) {
            Arrays.fill(row, value);
        }
        return new Frame(symbols, v);
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return symbols.size();
    }

    public List<String> symbols() {
        return symbols;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    // ========== Element-wise ==========

    public Frame map(DoubleUnaryOperator op) {
        double[][] out = new double[rows()][columns()];
        for (int r = 0; r < rows(); r++) {
            for (int c = 0; c < columns(); c++) {
                out[r][c] = op.applyAsDouble(values[r][c]);
            }
        }
        return new Frame(symbols, out);
    }

    public Frame combine(Frame other, DoubleBinaryOperator op) {
        if (other.rows() != rows() || other.columns() != columns()) {
            throw new EvaluationException(String.format(
                "Frame shapes differ: %dx%d vs %dx%d", rows(), columns(), other.rows(), other.columns()));
        }
        double[][] out = new double[rows()][columns()];
        for (int r = 0; r < rows(); r++) {
            for (int c = 0; c < columns(); c++) {
                out[r][c] = op.applyAsDouble(values[r][c], other.values[r][c]);
            }
        }
        return new Frame(symbols, out);
    }

    public Frame combine(double scalar, DoubleBinaryOperator op) {
        return map(v -> op.applyAsDouble(v, scalar));
    }

    static boolean truthy(double v) {
        return !Double.isNaN(v) && v != 0.0;
    }

    static double bool(boolean b) {
        return b ? 1.0 : 0.0;
    }

    // ========== Time-series operations ==========

    /**
     * Values from {@code periods} rows earlier (later, when negative).
     */
    public Frame shift(int periods) {
        double[][] out = new double[rows()][columns()];
        for (int r = 0; r < rows(); r++) {
            int src = r - periods;
            for (int c = 0; c < columns(); c++) {
                out[r][c] = src >= 0 && src < rows() ? values[src][c] : Double.NaN;
            }
        }
        return new Frame(symbols, out);
    }

    public Frame pctChange(int periods) {
        return combine(shift(periods), (now, before) -> before == 0 ? Double.NaN : now / before - 1);
    }

    public Frame diff(int periods) {
        return combine(shift(periods), (now, before) -> now - before);
    }

    public Rolling rolling(int window) {
        if (window <= 0) {
            throw new EvaluationException("Rolling window must be positive: " + window);
        }
        return new Rolling(this, window);
    }

    public Frame fillna(double value) {
        return map(v -> Double.isNaN(v) ? value : v);
    }

    /**
     * Mask of the {@code n} largest values per row (NaN never selected).
     */
    public Frame isLargest(int n) {
        return rankMask(n, true);
    }

    public Frame isSmallest(int n) {
        return rankMask(n, false);
    }

    private Frame rankMask(int n, boolean largest) {
        double[][] out = new double[rows()][columns()];
        Integer[] order = new Integer[columns()];
        for (int r = 0; r < rows(); r++) {
            double[] row = values[r];
            for (int c = 0; c < order.length; c++) {
                order[c] = c;
            }
            Arrays.sort(order, (a, b) -> {
                boolean na = Double.isNaN(row[a]);
                boolean nb = Double.isNaN(row[b]);
                if (na || nb) {
                    return Boolean.compare(na, nb);
                }
                return largest ? Double.compare(row[b], row[a]) : Double.compare(row[a], row[b]);
            });
            int taken = 0;
            for (int i = 0; i < order.length && taken < n; i++) {
                if (Double.isNaN(row[order[i]])) {
                    break;
                }
                out[r][order[i]] = 1.0;
                taken++;
            }
        }
        return new Frame(symbols, out);
    }

    /**
     * Mean over all non-NaN cells, NaN for an all-NaN frame.
     */
    public double overallMean() {
        double sum = 0;
        int count = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v)) {
                    sum += v;
                    count++;
                }
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    // ========== Script access ==========

    @Override
    public Object getAttribute(String name) {
        return switch (name) {
            case "shift" -> method(name, (args, kw) -> shift(Builtins.intArg(args, kw, 0, "periods", 1)));
            case "pct_change" -> method(name, (args, kw) -> pctChange(Builtins.intArg(args, kw, 0, "periods", 1)));
            case "diff" -> method(name, (args, kw) -> diff(Builtins.intArg(args, kw, 0, "periods", 1)));
            case "rolling" -> method(name, (args, kw) -> rolling(Builtins.intArg(args, kw, 0, "window", null)));
            case "average" -> method(name, (args, kw) -> rolling(Builtins.intArg(args, kw, 0, "window", null)).mean());
            case "is_largest" -> method(name, (args, kw) -> isLargest(Builtins.intArg(args, kw, 0, "n", null)));
            case "is_smallest" -> method(name, (args, kw) -> isSmallest(Builtins.intArg(args, kw, 0, "n", null)));
            case "fillna" -> method(name, (args, kw) -> fillna(Builtins.doubleArg(args, kw, 0, "value", 0.0)));
            case "abs" -> method(name, (args, kw) -> map(Math::abs));
            case "mean" -> method(name, (args, kw) -> overallMean());
            default -> throw new EvaluationException("Frame has no attribute '" + name + "'");
        };
    }

    private BuiltinFunction method(String name, FrameMethod body) {
        return new BuiltinFunction(name, (interp, args, kwargs) -> body.apply(args, kwargs));
    }

    @FunctionalInterface
    private interface FrameMethod {
        Object apply(List<Object> args, Map<String, Object> kwargs);
    }

    @Override
    public String toString() {
        return "Frame[" + rows() + "x" + columns() + "]";
    }

    // ========== Rolling windows ==========

    /**
     * Trailing window over each column; a window with any NaN yields NaN.
     */
    public static final class Rolling implements ScriptObject {
        private final Frame frame;
        private final int window;

        Rolling(Frame frame, int window) {
            this.frame = frame;
            this.window = window;
        }

        public Frame mean() {
            return reduce(w -> total(w) / w.length);
        }

        public Frame sum() {
            return reduce(Rolling::total);
        }

        public Frame max() {
            return reduce(w -> Arrays.stream(w).max().orElse(Double.NaN));
        }

        public Frame min() {
            return reduce(w -> Arrays.stream(w).min().orElse(Double.NaN));
        }

        public Frame std() {
            return reduce(w -> {
                if (w.length < 2) {
                    return Double.NaN;
                }
                double mean = total(w) / w.length;
                double ss = 0;
                for (double v : w) {
                    ss += (v - mean) * (v - mean);
                }
                return Math.sqrt(ss / (w.length - 1));
            });
        }

        private static double total(double[] w) {
            double s = 0;
            for (double v : w) {
                s += v;
            }
            return s;
        }

        private Frame reduce(ToDoubleFunction<double[]> fn) {
            double[][] out = new double[frame.rows()][frame.columns()];
            double[] buf = new double[window];
            for (int c = 0; c < frame.columns(); c++) {
                for (int r = 0; r < frame.rows(); r++) {
                    if (r < window - 1) {
                        out[r][c] = Double.NaN;
                        continue;
                    }
                    boolean missing = false;
                    for (int k = 0; k < window; k++) {
                        double v = frame.values[r - window + 1 + k][c];
                        if (Double.isNaN(v)) {
                            missing = true;
                            break;
                        }
                        buf[k] = v;
                    }
                    out[r][c] = missing ? Double.NaN : fn.applyAsDouble(buf);
                }
            }
            return new Frame(frame.symbols, out);
        }

        @Override
        public Object getAttribute(String name) {
            return switch (name) {
                case "mean" -> new BuiltinFunction(name, (i, a, k) -> mean());
                case "sum" -> new BuiltinFunction(name, (i, a, k) -> sum());
                case "max" -> new BuiltinFunction(name, (i, a, k) -> max());
                case "min" -> new BuiltinFunction(name, (i, a, k) -> min());
                case "std" -> new BuiltinFunction(name, (i, a, k) -> std());
                default -> throw new EvaluationException("Rolling has no attribute '" + name + "'");
            };
        }

        @Override
        public String toString() {
            return "Rolling[" + window + "]";
        }
    }
}
