package io.github.manjago.mutagen.tier3;

import io.github.manjago.mutagen.snippet.Expr;
import org.jetbrains.annotations.Nullable;

/**
 * Node-level syntax tree transforms.
 */
public enum AstTransform {
    /** {@code <} and {@code <=} swap, as do {@code >} and {@code >=}. */
    COMPARATOR_SWAP("ast_comparator_swap"),
    /** Numeric literal compared against is scaled. */
    THRESHOLD_SCALE("ast_threshold_scale"),
    /** {@code +} and {@code -} swap, as do {@code *} and {@code /}. */
    ARITHMETIC_SWAP("ast_arithmetic_swap");

    private final String type;

    AstTransform(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }

    @Nullable
    public static AstTransform fromType(String type) {
        for (AstTransform t : values()) {
            if (t.type.equals(type)) {
                return t;
            }
        }
        return null;
    }

    /**
     * Whether the transform applies to this node.
     */
    public boolean isEligible(Expr expr) {
        return switch (this) {
            case COMPARATOR_SWAP -> expr instanceof Expr.Comparison c && swapped(c.op()) != null;
            case THRESHOLD_SCALE -> expr instanceof Expr.Comparison c
                && (c.left() instanceof Expr.Num || c.right() instanceof Expr.Num);
            case ARITHMETIC_SWAP -> expr instanceof Expr.Binary b && swapped(b.op()) != null;
        };
    }

    @Nullable
    static Expr.CompareOperator swapped(Expr.CompareOperator op) {
        return switch (op) {
            case LT -> Expr.CompareOperator.LE;
            case LE -> Expr.CompareOperator.LT;
            case GT -> Expr.CompareOperator.GE;
            case GE -> Expr.CompareOperator.GT;
            default -> null;
        };
    }

    @Nullable
    static Expr.BinaryOperator swapped(Expr.BinaryOperator op) {
        return switch (op) {
            case ADD -> Expr.BinaryOperator.SUB;
            case SUB -> Expr.BinaryOperator.ADD;
            case MUL -> Expr.BinaryOperator.DIV;
            case DIV -> Expr.BinaryOperator.MUL;
            default -> null;
        };
    }
}
