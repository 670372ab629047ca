package io.github.manjago.mutagen.snippet;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed snippet: the ordered top-level statements.
 *
 * Helper lookups follow the strategy layout: factors are top-level
 * functions, configuration and exit values are top-level assignments.
 */
public record Script(List<Stmt> body) {

    public Script {
        body = List.copyOf(body);
    }

    /**
     * Top-level function definitions in source order.
     */
    public List<Stmt.FunctionDef> functions() {
        List<Stmt.FunctionDef> result = new ArrayList<>();
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.FunctionDef def) {
                result.add(def);
            }
        }
        return result;
    }

    @Nullable
    public Stmt.FunctionDef findFunction(String name) {
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.FunctionDef def && def.name().equals(name)) {
                return def;
            }
        }
        return null;
    }

    /**
     * First top-level assignment to the given variable.
     */
    @Nullable
    public Stmt.Assign findAssignment(String name) {
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.Assign assign && name.equals(assign.targetName())) {
                return assign;
            }
        }
        return null;
    }

    /**
     * Copy with {@code original} (matched by identity) replaced.
     */
    public Script replace(Stmt original, Stmt replacement) {
        List<Stmt> copy = new ArrayList<>(body);
        copy.set(indexOf(original), replacement);
        return new Script(copy);
    }

    /**
     * Copy with {@code stmt} inserted just before {@code anchor}.
     */
    public Script insertBefore(Stmt anchor, Stmt stmt) {
        List<Stmt> copy = new ArrayList<>(body);
        copy.add(indexOf(anchor), stmt);
        return new Script(copy);
    }

    public Script remove(Stmt stmt) {
        List<Stmt> copy = new ArrayList<>(body);
        copy.remove(indexOf(stmt));
        return new Script(copy);
    }

    private int indexOf(Stmt stmt) {
        for (int i = 0; i < body.size(); i++) {
            if (body.get(i) == stmt) {
                return i;
            }
        }
        throw new IllegalArgumentException("Statement is not part of this script: " + stmt);
    }
}
