package io.github.manjago.mutagen.tier3;

import io.github.manjago.mutagen.exec.DataHandle;
import io.github.manjago.mutagen.exec.EvaluationException;
import io.github.manjago.mutagen.exec.ExecutionBudget;
import io.github.manjago.mutagen.exec.Frame;
import io.github.manjago.mutagen.exec.Interpreter;
import io.github.manjago.mutagen.exec.MarketData;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A factor function bound to the evaluator, ready to run against market data.
 *
 * The factor is compiled together with the other top-level functions and
 * literal assignments of its script, so it can call helpers and read
 * configuration values. Nothing else from the script is executed.
 */
public final class CompiledFactor {

    private final String name;
    private final Script context;

    private CompiledFactor(String name, Script context) {
        this.name = name;
        this.context = context;
    }

    /**
     * @throws IllegalArgumentException when the script has no such function,
     *         or it cannot be called with {@code data} alone
     */
    public static CompiledFactor compile(Script script, String factorName) {
        Stmt.FunctionDef def = script.findFunction(factorName);
        if (def == null) {
            throw new IllegalArgumentException("No factor function '" + factorName + "'");
        }
        if (def.params().isEmpty()) {
            throw new IllegalArgumentException("Factor '" + factorName + "' must accept a data argument");
        }
        for (Stmt.Param extra : def.params().subList(1, def.params().size())) {
            if (extra.defaultValue() == null) {
                throw new IllegalArgumentException("Factor '" + factorName + "' parameter '"
                    + extra.name() + "' needs a default value");
            }
        }
        List<Stmt> kept = new ArrayList<>();
        for (Stmt stmt : script.body()) {
            if (stmt instanceof Stmt.FunctionDef || isLiteralAssignment(stmt)) {
                kept.add(stmt);
            }
        }
        return new CompiledFactor(factorName, new Script(kept));
    }

    private static boolean isLiteralAssignment(Stmt stmt) {
        return stmt instanceof Stmt.Assign a && a.targetName() != null
            && (a.value() instanceof Expr.Num || a.value() instanceof Expr.Str || a.value() instanceof Expr.Constant);
    }

    public String name() {
        return name;
    }

    public Frame evaluate(MarketData market) {
        return evaluate(market, ExecutionBudget.unlimited());
    }

    /**
     * @throws EvaluationException when evaluation fails or does not yield a Frame
     */
    public Frame evaluate(MarketData market, ExecutionBudget budget) {
        DataHandle data = new DataHandle(market);
        Interpreter interpreter = new Interpreter(budget, Map.of("data", data));
        interpreter.run(context);
        Object result = interpreter.call(interpreter.global(name), List.of(data), Map.of(), 0);
        if (result instanceof Frame frame) {
            return frame;
        }
        throw new EvaluationException("Factor '" + name + "' returned a value that is not a Frame");
    }
}
