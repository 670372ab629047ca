package io.github.manjago.mutagen.snippet;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Read-only traversal of syntax trees.
 */
public final class AstWalker {

    private AstWalker() {}

    /**
     * Visit every statement, nested blocks included, in source order.
     */
    public static void forEachStmt(List<Stmt> body, Consumer<Stmt> visitor) {
        for (Stmt stmt : body) {
            visitor.accept(stmt);
            for (List<Stmt> block : blocks(stmt)) {
                forEachStmt(block, visitor);
            }
        }
    }

    /**
     * Visit every expression reachable from the statements, pre-order.
     */
    public static void forEachExpr(List<Stmt> body, Consumer<Expr> visitor) {
        forEachStmt(body, stmt -> {
            for (Expr root : expressions(stmt)) {
                forEachExpr(root, visitor);
            }
        });
    }

    public static void forEachExpr(Expr root, Consumer<Expr> visitor) {
        visitor.accept(root);
        for (Expr child : children(root)) {
            forEachExpr(child, visitor);
        }
    }

    /**
     * Nested statement blocks of a compound statement.
     */
    public static List<List<Stmt>> blocks(Stmt stmt) {
        if (stmt instanceof Stmt.FunctionDef s) {
            return List.of(s.body());
        }
        if (stmt instanceof Stmt.If s) {
            return List.of(s.body(), s.orElse());
        }
        if (stmt instanceof Stmt.For s) {
            return List.of(s.body());
        }
        if (stmt instanceof Stmt.While s) {
            return List.of(s.body());
        }
        return List.of();
    }

    /**
     * Expressions owned directly by a statement (not those of nested blocks).
     */
    public static List<Expr> expressions(Stmt stmt) {
        List<Expr> result = new ArrayList<>();
        if (stmt instanceof Stmt.Assign s) {
            result.add(s.target());
            result.add(s.value());
        } else if (stmt instanceof Stmt.AugAssign s) {
            result.add(s.target());
            result.add(s.value());
        } else if (stmt instanceof Stmt.ExprStmt s) {
            result.add(s.value());
        } else if (stmt instanceof Stmt.FunctionDef s) {
            for (Stmt.Param p : s.params()) {
                if (p.defaultValue() != null) {
                    result.add(p.defaultValue());
                }
            }
        } else if (stmt instanceof Stmt.Return s) {
            if (s.value() != null) {
                result.add(s.value());
            }
        } else if (stmt instanceof Stmt.If s) {
            result.add(s.test());
        } else if (stmt instanceof Stmt.For s) {
            result.add(s.iterable());
        } else if (stmt instanceof Stmt.While s) {
            result.add(s.test());
        }
        return result;
    }

    public static List<Expr> children(Expr expr) {
        if (expr instanceof Expr.Attribute a) {
            return List.of(a.target());
        }
        if (expr instanceof Expr.Subscript s) {
            return List.of(s.target(), s.index());
        }
        if (expr instanceof Expr.Call c) {
            List<Expr> result = new ArrayList<>();
            result.add(c.function());
            result.addAll(c.args());
            for (Expr.Keyword kw : c.keywords()) {
                result.add(kw.value());
            }
            return result;
        }
        if (expr instanceof Expr.Binary b) {
            return List.of(b.left(), b.right());
        }
        if (expr instanceof Expr.Unary u) {
            return List.of(u.operand());
        }
        if (expr instanceof Expr.Comparison c) {
            return List.of(c.left(), c.right());
        }
        if (expr instanceof Expr.Logical l) {
            return List.of(l.left(), l.right());
        }
        if (expr instanceof Expr.ListLiteral l) {
            return l.elements();
        }
        return List.of();
    }

    // ========== Metrics ==========

    /**
     * Number of statement and expression nodes.
     */
    public static int countNodes(List<Stmt> body) {
        int[] count = {0};
        forEachStmt(body, s -> count[0]++);
        forEachExpr(body, e -> count[0]++);
        return count[0];
    }

    /**
     * Deepest block nesting (a flat list of simple statements is depth 1).
     */
    public static int blockDepth(List<Stmt> body) {
        int max = 0;
        for (Stmt stmt : body) {
            for (List<Stmt> block : blocks(stmt)) {
                max = Math.max(max, blockDepth(block));
            }
        }
        return body.isEmpty() ? 0 : max + 1;
    }

    /**
     * Names assigned anywhere in the statements (plain variable targets,
     * augmented assignments and loop variables).
     */
    public static List<String> assignedNames(List<Stmt> body) {
        List<String> names = new ArrayList<>();
        forEachStmt(body, stmt -> {
            if (stmt instanceof Stmt.Assign s && s.target() instanceof Expr.Name n) {
                names.add(n.id());
            } else if (stmt instanceof Stmt.AugAssign s && s.target() instanceof Expr.Name n) {
                names.add(n.id());
            } else if (stmt instanceof Stmt.For s) {
                names.add(s.variable());
            }
        });
        return names;
    }
}
