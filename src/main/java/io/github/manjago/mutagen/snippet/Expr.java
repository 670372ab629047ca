package io.github.manjago.mutagen.snippet;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Expression nodes of the snippet syntax tree.
 *
 * Nodes are immutable values; rewriting a tree always builds new nodes
 * (see {@link AstRewriter}).
 */
public sealed interface Expr {

    /**
     * 1-based source line, 0 for synthesized nodes.
     */
    int line();

    // ========== Operators ==========

    enum BinaryOperator {
        BIT_OR("|", 5),
        BIT_AND("&", 6),
        ADD("+", 7),
        SUB("-", 7),
        MUL("*", 8),
        DIV("/", 8),
        FLOOR_DIV("//", 8),
        MOD("%", 8),
        POW("**", 10);

        private final String symbol;
        private final int precedence;

        BinaryOperator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        @Nullable
        public static BinaryOperator fromSymbol(String symbol) {
            for (BinaryOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }
    }

    enum CompareOperator {
        LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!=");

        private final String symbol;

        CompareOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        @Nullable
        public static CompareOperator fromSymbol(String symbol) {
            for (CompareOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }
    }

    enum UnaryOperator {
        NEG("-"), POS("+"), INVERT("~"), NOT("not");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum LogicalOperator {
        OR("or", 1), AND("and", 2);

        private final String symbol;
        private final int precedence;

        LogicalOperator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }
    }

    // ========== Nodes ==========

    /**
     * Numeric literal. {@code start}/{@code end} locate the literal in the
     * parsed source and are -1 for synthesized literals.
     */
    record Num(double value, boolean integer, String text, int line, int start, int end) implements Expr {

        public static Num of(double value, boolean integer) {
            return new Num(value, integer, Literals.formatNumber(value, integer), 0, -1, -1);
        }

        public Num withValue(double newValue) {
            return new Num(newValue, integer, Literals.formatNumber(newValue, integer), line, start, end);
        }

        public boolean hasSpan() {
            return start >= 0 && end >= start;
        }
    }

    record Str(String value, int line) implements Expr {
    }

    /**
     * {@code True}, {@code False} or {@code None} (value null).
     */
    record Constant(@Nullable Boolean value, int line) implements Expr {

        public String keyword() {
            if (value == null) {
                return "None";
            }
            return value ? "True" : "False";
        }
    }

    record Name(String id, int line) implements Expr {
    }

    record Attribute(Expr target, String name, int line) implements Expr {
    }

    record Subscript(Expr target, Expr index, int line) implements Expr {
    }

    record Keyword(String name, Expr value) {
    }

    record Call(Expr function, List<Expr> args, List<Keyword> keywords, int line) implements Expr {

        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        /**
         * Simple name of the callee: {@code f} for {@code f(x)} and
         * {@code shift} for {@code close.shift(1)}; null for anything else.
         */
        @Nullable
        public String calleeName() {
            if (function instanceof Name n) {
                return n.id();
            }
            if (function instanceof Attribute a) {
                return a.name();
            }
            return null;
        }
    }

    record Binary(Expr left, BinaryOperator op, Expr right, int line) implements Expr {
    }

    record Unary(UnaryOperator op, Expr operand, int line) implements Expr {
    }

    record Comparison(Expr left, CompareOperator op, Expr right, int line) implements Expr {
    }

    record Logical(LogicalOperator op, Expr left, Expr right, int line) implements Expr {
    }

    record ListLiteral(List<Expr> elements, int line) implements Expr {

        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }
}
