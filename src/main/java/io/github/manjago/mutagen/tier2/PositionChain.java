package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The {@code position = a & b & ...} statement, flattened into its operands.
 *
 * @param statement the top-level position assignment
 * @param operands  {@code &} operands, left to right
 */
public record PositionChain(Stmt.Assign statement, List<Expr> operands) {

    public static final String POSITION = "position";
    public static final String DATA = "data";

    public PositionChain {
        operands = List.copyOf(operands);
    }

    /**
     * Chain of the script, null when it has no position assignment.
     */
    @Nullable
    public static PositionChain of(Script script) {
        Stmt.Assign assign = script.findAssignment(POSITION);
        if (assign == null) {
            return null;
        }
        List<Expr> operands = new ArrayList<>();
        flatten(assign.value(), operands);
        return new PositionChain(assign, operands);
    }

    private static void flatten(Expr expr, List<Expr> out) {
        if (expr instanceof Expr.Binary b && b.op() == Expr.BinaryOperator.BIT_AND) {
            flatten(b.left(), out);
            flatten(b.right(), out);
        } else {
            out.add(expr);
        }
    }

    /**
     * Names of script-defined factors called directly in the chain, in order.
     */
    public List<String> factorNames(Script script) {
        List<String> names = new ArrayList<>();
        for (Expr operand : operands) {
            String name = factorName(operand);
            if (name != null && script.findFunction(name) != null && !names.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }

    @Nullable
    static String factorName(Expr operand) {
        if (operand instanceof Expr.Call call && call.function() instanceof Expr.Name n) {
            return n.id();
        }
        return null;
    }

    /**
     * Assignment with the given operands joined by {@code &}.
     */
    public Stmt.Assign withOperands(List<Expr> newOperands) {
        if (newOperands.isEmpty()) {
            throw new IllegalArgumentException("Position chain needs at least one operand");
        }
        Expr value = newOperands.get(0);
        for (int i = 1; i < newOperands.size(); i++) {
            value = new Expr.Binary(value, Expr.BinaryOperator.BIT_AND, newOperands.get(i), statement.line());
        }
        return new Stmt.Assign(statement.target(), value, statement.line());
    }

    /**
     * {@code name(data)}.
     */
    public static Expr.Call factorCall(String name) {
        return new Expr.Call(new Expr.Name(name, 0), List.of(new Expr.Name(DATA, 0)), List.of(), 0);
    }
}
