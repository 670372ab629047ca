package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.Stmt;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tree-walking evaluator for parsed snippets.
 *
 * <p>Only builtins and globals supplied by the host are reachable. Imports
 * fail at runtime, attribute access goes through {@link ScriptObject} and
 * dunder names are rejected, so a snippet cannot reach Java classes even
 * when static validation was skipped.
 *
 * <p>Every statement, loop iteration and call consumes a step of the
 * {@link ExecutionBudget}. Recursion is limited to {@link #MAX_CALL_DEPTH}.
 *
 * <p>Not thread-safe; one interpreter per evaluation.
 */
public final class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    /**
     * Marks a parameter without a default value.
     */
    public static final Object NO_DEFAULT = new Object() {
        @Override
        public String toString() {
            return "<required>";
        }
    };

    public static final int MAX_CALL_DEPTH = 100;

    private final Environment globals;
    private final ExecutionBudget budget;
    private int depth;

    public Interpreter(ExecutionBudget budget) {
        this(budget, Map.of());
    }

    public Interpreter(ExecutionBudget budget, Map<String, Object> hostGlobals) {
        this.budget = budget;
        this.globals = new Environment(null);
        Builtins.all().forEach(globals::define);
        hostGlobals.forEach(globals::define);
    }

    public Environment globals() {
        return globals;
    }

    public ExecutionBudget budget() {
        return budget;
    }

    /**
     * Execute the script's top-level statements in the global scope.
     */
    public void run(Script script) {
        Signal signal = execBlock(script.body(), globals);
        if (signal.kind != Kind.NORMAL) {
            throw new EvaluationException("'" + signal.kind.keyword + "' outside " + signal.kind.scope);
        }
        log.debug("Script finished after {} steps", budget.getSteps());
    }

    /**
     * Global value after {@link #run}, null when unbound.
     */
    @Nullable
    public Object global(String name) {
        return globals.local(name);
    }

    /**
     * Call any callable value.
     */
    public Object call(Object callee, List<Object> args, Map<String, Object> kwargs, int line) {
        if (!(callee instanceof ScriptCallable callable)) {
            throw new EvaluationException("'" + Operators.typeName(callee) + "' object is not callable", line);
        }
        budget.tick(line);
        return callable.call(this, args, kwargs);
    }

    /**
     * Bind arguments and run a snippet-defined function body.
     */
    public Object invoke(ScriptFunction function, List<Object> args, Map<String, Object> kwargs) {
        Stmt.FunctionDef def = function.definition();
        List<Stmt.Param> params = def.params();
        if (args.size() > params.size()) {
            throw new EvaluationException(String.format("%s() takes %d positional arguments but %d were given",
                def.name(), params.size(), args.size()), def.line());
        }
        if (depth >= MAX_CALL_DEPTH) {
            throw new EvaluationException("Maximum call depth exceeded (" + MAX_CALL_DEPTH + ")", def.line());
        }

        Environment local = new Environment(globals);
        Set<String> bound = new HashSet<>();
        for (int i = 0; i < args.size(); i++) {
            local.define(params.get(i).name(), args.get(i));
            bound.add(params.get(i).name());
        }
        for (Map.Entry<String, Object> kw : kwargs.entrySet()) {
            if (params.stream().noneMatch(p -> p.name().equals(kw.getKey()))) {
                throw new EvaluationException(def.name() + "() got an unexpected keyword argument '"
                    + kw.getKey() + "'", def.line());
            }
            if (!bound.add(kw.getKey())) {
                throw new EvaluationException(def.name() + "() got multiple values for argument '"
                    + kw.getKey() + "'", def.line());
            }
            local.define(kw.getKey(), kw.getValue());
        }
        for (int i = 0; i < params.size(); i++) {
            String name = params.get(i).name();
            if (bound.contains(name)) {
                continue;
            }
            Object fallback = function.defaults().get(i);
            if (fallback == NO_DEFAULT) {
                throw new EvaluationException(def.name() + "() missing required argument '" + name + "'", def.line());
            }
            local.define(name, fallback);
        }

        depth++;
        try {
            Signal signal = execBlock(def.body(), local);
            if (signal.kind == Kind.RETURN) {
                return signal.value;
            }
            if (signal.kind != Kind.NORMAL) {
                throw new EvaluationException("'" + signal.kind.keyword + "' outside loop", def.line());
            }
            return null;
        } finally {
            depth--;
        }
    }

    // ========== Statements ==========

    private enum Kind {
        NORMAL("", ""),
        BREAK("break", "loop"),
        CONTINUE("continue", "loop"),
        RETURN("return", "function");

        private final String keyword;
        private final String scope;

        Kind(String keyword, String scope) {
            this.keyword = keyword;
            this.scope = scope;
        }
    }

    private record Signal(Kind kind, @Nullable Object value) {
        static final Signal NORMAL = new Signal(Kind.NORMAL, null);
        static final Signal BREAK = new Signal(Kind.BREAK, null);
        static final Signal CONTINUE = new Signal(Kind.CONTINUE, null);
    }

    private Signal execBlock(List<Stmt> body, Environment env) {
        for (Stmt stmt : body) {
            Signal signal = exec(stmt, env);
            if (signal.kind != Kind.NORMAL) {
                return signal;
            }
        }
        return Signal.NORMAL;
    }

    private Signal exec(Stmt stmt, Environment env) {
        budget.tick(stmt.line());
        if (stmt instanceof Stmt.Import || stmt instanceof Stmt.ImportFrom) {
            throw new EvaluationException("Imports are not available", stmt.line());
        }
        if (stmt instanceof Stmt.Assign s) {
            assign(s.target(), evaluate(s.value(), env), env);
        } else if (stmt instanceof Stmt.AugAssign s) {
            Object current = evaluate(s.target(), env);
            Object value = evaluate(s.value(), env);
            assign(s.target(), binary(s.op(), current, value, s.line()), env);
        } else if (stmt instanceof Stmt.ExprStmt s) {
            evaluate(s.value(), env);
        } else if (stmt instanceof Stmt.FunctionDef def) {
            env.define(def.name(), define(def, env));
        } else if (stmt instanceof Stmt.Return r) {
            return new Signal(Kind.RETURN, r.value() == null ? null : evaluate(r.value(), env));
        } else if (stmt instanceof Stmt.If s) {
            boolean test = truthy(evaluate(s.test(), env), s.line());
            return execBlock(test ? s.body() : s.orElse(), env);
        } else if (stmt instanceof Stmt.For s) {
            return execFor(s, env);
        } else if (stmt instanceof Stmt.While s) {
            return execWhile(s, env);
        } else if (stmt instanceof Stmt.Break) {
            return Signal.BREAK;
        } else if (stmt instanceof Stmt.Continue) {
            return Signal.CONTINUE;
        }
        // Pass
        return Signal.NORMAL;
    }

    private ScriptFunction define(Stmt.FunctionDef def, Environment env) {
        List<Object> defaults = new ArrayList<>();
        for (Stmt.Param param : def.params()) {
            defaults.add(param.defaultValue() == null ? NO_DEFAULT : evaluate(param.defaultValue(), env));
        }
        return new ScriptFunction(def, Collections.unmodifiableList(defaults));
    }

    private Signal execFor(Stmt.For loop, Environment env) {
        Object iterable = evaluate(loop.iterable(), env);
        if (!(iterable instanceof List<?> items)) {
            throw new EvaluationException("'" + Operators.typeName(iterable) + "' object is not iterable", loop.line());
        }
        for (Object item : new ArrayList<>(items)) {
            budget.tick(loop.line());
            env.define(loop.variable(), item);
            Signal signal = execBlock(loop.body(), env);
            if (signal.kind == Kind.BREAK) {
                break;
            }
            if (signal.kind == Kind.RETURN) {
                return signal;
            }
        }
        return Signal.NORMAL;
    }

    private Signal execWhile(Stmt.While loop, Environment env) {
        while (truthy(evaluate(loop.test(), env), loop.line())) {
            budget.tick(loop.line());
            Signal signal = execBlock(loop.body(), env);
            if (signal.kind == Kind.BREAK) {
                break;
            }
            if (signal.kind == Kind.RETURN) {
                return signal;
            }
        }
        return Signal.NORMAL;
    }

    private void assign(Expr target, Object value, Environment env) {
        if (target instanceof Expr.Name n) {
            env.define(n.id(), value);
            return;
        }
        if (target instanceof Expr.Subscript s) {
            Object container = evaluate(s.target(), env);
            if (container instanceof List<?> list) {
                @SuppressWarnings("unchecked")
                List<Object> items = (List<Object>) list;
                int index = listIndex(items.size(), evaluate(s.index(), env), s.line());
                try {
                    items.set(index, value);
                } catch (UnsupportedOperationException e) {
                    throw new EvaluationException("List is read-only", s.line());
                }
                return;
            }
            throw new EvaluationException("'" + Operators.typeName(container)
                + "' object does not support item assignment", s.line());
        }
        throw new EvaluationException("Cannot assign to expression", target.line());
    }

    // ========== Expressions ==========

    /**
     * Evaluate an expression in the given scope.
     */
    public Object evaluate(Expr expr, Environment env) {
        if (expr instanceof Expr.Num n) {
            return n.integer() ? (Object) (long) n.value() : (Object) n.value();
        }
        if (expr instanceof Expr.Str s) {
            return s.value();
        }
        if (expr instanceof Expr.Constant c) {
            return c.value();
        }
        if (expr instanceof Expr.Name n) {
            return env.lookup(n.id(), n.line());
        }
        if (expr instanceof Expr.Attribute a) {
            return attribute(evaluate(a.target(), env), a.name(), a.line());
        }
        if (expr instanceof Expr.Subscript s) {
            return subscript(evaluate(s.target(), env), evaluate(s.index(), env), s.line());
        }
        if (expr instanceof Expr.Call c) {
            Object callee = evaluate(c.function(), env);
            List<Object> args = new ArrayList<>(c.args().size());
            for (Expr arg : c.args()) {
                args.add(evaluate(arg, env));
            }
            Map<String, Object> kwargs = new LinkedHashMap<>();
            for (Expr.Keyword kw : c.keywords()) {
                if (kwargs.containsKey(kw.name())) {
                    throw new EvaluationException("Keyword argument repeated: " + kw.name(), c.line());
                }
                kwargs.put(kw.name(), evaluate(kw.value(), env));
            }
            try {
                return call(callee, args, kwargs, c.line());
            } catch (EvaluationException e) {
                throw e.getLineNum() > 0 ? e : new EvaluationException(e.getMessage(), c.line());
            }
        }
        if (expr instanceof Expr.Binary b) {
            return binary(b.op(), evaluate(b.left(), env), evaluate(b.right(), env), b.line());
        }
        if (expr instanceof Expr.Unary u) {
            Object operand = evaluate(u.operand(), env);
            try {
                return Operators.unary(u.op(), operand);
            } catch (ArithmeticException e) {
                throw new EvaluationException("Integer overflow", u.line());
            }
        }
        if (expr instanceof Expr.Comparison c) {
            return Operators.compare(c.op(), evaluate(c.left(), env), evaluate(c.right(), env));
        }
        if (expr instanceof Expr.Logical l) {
            Object left = evaluate(l.left(), env);
            boolean leftTrue = truthy(left, l.line());
            if (l.op() == Expr.LogicalOperator.AND ? !leftTrue : leftTrue) {
                return left;
            }
            return evaluate(l.right(), env);
        }
        if (expr instanceof Expr.ListLiteral list) {
            List<Object> values = new ArrayList<>(list.elements().size());
            for (Expr element : list.elements()) {
                values.add(evaluate(element, env));
            }
            return values;
        }
        throw new IllegalStateException("Unknown expression " + expr);
    }

    private Object binary(Expr.BinaryOperator op, Object left, Object right, int line) {
        try {
            return Operators.binary(op, left, right);
        } catch (ArithmeticException e) {
            throw new EvaluationException("Integer overflow", line);
        } catch (EvaluationException e) {
            throw e.getLineNum() > 0 ? e : new EvaluationException(e.getMessage(), line);
        }
    }

    private Object attribute(Object target, String name, int line) {
        if (name.startsWith("__")) {
            throw new EvaluationException("Access to '" + name + "' is not allowed", line);
        }
        if (target instanceof ScriptObject obj) {
            return obj.getAttribute(name);
        }
        throw new EvaluationException("'" + Operators.typeName(target) + "' object has no attribute '" + name + "'", line);
    }

    private Object subscript(Object target, Object key, int line) {
        if (target instanceof List<?> list) {
            return list.get(listIndex(list.size(), key, line));
        }
        if (target instanceof String s) {
            int index = listIndex(s.length(), key, line);
            return String.valueOf(s.charAt(index));
        }
        if (target instanceof ScriptObject obj) {
            return obj.getItem(key);
        }
        throw new EvaluationException("'" + Operators.typeName(target) + "' object is not subscriptable", line);
    }

    private static int listIndex(int size, Object key, int line) {
        if (!(key instanceof Long l)) {
            throw new EvaluationException("Indices must be integers, not " + Operators.typeName(key), line);
        }
        long index = l < 0 ? l + size : l;
        if (index < 0 || index >= size) {
            throw new EvaluationException("Index out of range: " + l, line);
        }
        return (int) index;
    }

    private static boolean truthy(Object value, int line) {
        try {
            return Operators.truthy(value);
        } catch (EvaluationException e) {
            throw new EvaluationException(e.getMessage(), line);
        }
    }
}
