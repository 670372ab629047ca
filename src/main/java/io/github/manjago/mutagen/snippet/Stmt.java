package io.github.manjago.mutagen.snippet;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Statement nodes of the snippet syntax tree.
 */
public sealed interface Stmt {

    int line();

    record Alias(String name, @Nullable String asName) {

        @Override
        public String toString() {
            return asName == null ? name : name + " as " + asName;
        }
    }

    record Import(List<Alias> names, int line) implements Stmt {

        public Import {
            names = List.copyOf(names);
        }
    }

    record ImportFrom(String module, List<Alias> names, int line) implements Stmt {

        public ImportFrom {
            names = List.copyOf(names);
        }
    }

    record Assign(Expr target, Expr value, int line) implements Stmt {

        /**
         * Target name when assigning to a plain variable, otherwise null.
         */
        @Nullable
        public String targetName() {
            return target instanceof Expr.Name n ? n.id() : null;
        }
    }

    record AugAssign(Expr target, Expr.BinaryOperator op, Expr value, int line) implements Stmt {
    }

    record ExprStmt(Expr value, int line) implements Stmt {
    }

    record Param(String name, @Nullable Expr defaultValue) {
    }

    record FunctionDef(String name, List<Param> params, List<Stmt> body, int line) implements Stmt {

        public FunctionDef {
            params = List.copyOf(params);
            body = List.copyOf(body);
        }

        public FunctionDef withName(String newName) {
            return new FunctionDef(newName, params, body, line);
        }

        public FunctionDef withBody(List<Stmt> newBody) {
            return new FunctionDef(name, params, newBody, line);
        }
    }

    record Return(@Nullable Expr value, int line) implements Stmt {
    }

    /**
     * {@code if}; an {@code elif} chain is an else-branch holding a single If.
     */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt {

        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record For(String variable, Expr iterable, List<Stmt> body, int line) implements Stmt {

        public For {
            body = List.copyOf(body);
        }
    }

    record While(Expr test, List<Stmt> body, int line) implements Stmt {

        public While {
            body = List.copyOf(body);
        }
    }

    record Pass(int line) implements Stmt {
    }

    record Break(int line) implements Stmt {
    }

    record Continue(int line) implements Stmt {
    }
}
