package io.github.manjago.mutagen.snippet;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up tree rewriter.
 *
 * Children are rebuilt first, then {@link #visit(Expr)} is called on the
 * rebuilt node. The visiting order is deterministic, so two passes over the
 * same tree see the nodes in the same sequence (mutators rely on this to
 * address nodes by position).
 */
public abstract class AstRewriter {

    /**
     * Hook for subclasses; return the node unchanged to keep it.
     */
    protected abstract Expr visit(Expr expr);

    public Script rewrite(Script script) {
        return new Script(rewriteBlock(script.body()));
    }

    public List<Stmt> rewriteBlock(List<Stmt> body) {
        List<Stmt> result = new ArrayList<>(body.size());
        for (Stmt stmt : body) {
            result.add(rewriteStmt(stmt));
        }
        return result;
    }

    public Stmt rewriteStmt(Stmt stmt) {
        if (stmt instanceof Stmt.Assign s) {
            return new Stmt.Assign(rewrite(s.target()), rewrite(s.value()), s.line());
        }
        if (stmt instanceof Stmt.AugAssign s) {
            return new Stmt.AugAssign(rewrite(s.target()), s.op(), rewrite(s.value()), s.line());
        }
        if (stmt instanceof Stmt.ExprStmt s) {
            return new Stmt.ExprStmt(rewrite(s.value()), s.line());
        }
        if (stmt instanceof Stmt.FunctionDef s) {
            List<Stmt.Param> params = new ArrayList<>();
            for (Stmt.Param p : s.params()) {
                params.add(new Stmt.Param(p.name(), p.defaultValue() == null ? null : rewrite(p.defaultValue())));
            }
            return new Stmt.FunctionDef(s.name(), params, rewriteBlock(s.body()), s.line());
        }
        if (stmt instanceof Stmt.Return s) {
            return new Stmt.Return(s.value() == null ? null : rewrite(s.value()), s.line());
        }
        if (stmt instanceof Stmt.If s) {
            return new Stmt.If(rewrite(s.test()), rewriteBlock(s.body()), rewriteBlock(s.orElse()), s.line());
        }
        if (stmt instanceof Stmt.For s) {
            return new Stmt.For(s.variable(), rewrite(s.iterable()), rewriteBlock(s.body()), s.line());
        }
        if (stmt instanceof Stmt.While s) {
            return new Stmt.While(rewrite(s.test()), rewriteBlock(s.body()), s.line());
        }
        return stmt;
    }

    public Expr rewrite(Expr expr) {
        return visit(rebuildChildren(expr));
    }

    private Expr rebuildChildren(Expr expr) {
        if (expr instanceof Expr.Attribute a) {
            return new Expr.Attribute(rewrite(a.target()), a.name(), a.line());
        }
        if (expr instanceof Expr.Subscript s) {
            Expr target = rewrite(s.target());
            return new Expr.Subscript(target, rewrite(s.index()), s.line());
        }
        if (expr instanceof Expr.Call c) {
            Expr function = rewrite(c.function());
            List<Expr> args = new ArrayList<>();
            for (Expr arg : c.args()) {
                args.add(rewrite(arg));
            }
            List<Expr.Keyword> keywords = new ArrayList<>();
            for (Expr.Keyword kw : c.keywords()) {
                keywords.add(new Expr.Keyword(kw.name(), rewrite(kw.value())));
            }
            return new Expr.Call(function, args, keywords, c.line());
        }
        if (expr instanceof Expr.Binary b) {
            Expr left = rewrite(b.left());
            return new Expr.Binary(left, b.op(), rewrite(b.right()), b.line());
        }
        if (expr instanceof Expr.Unary u) {
            return new Expr.Unary(u.op(), rewrite(u.operand()), u.line());
        }
        if (expr instanceof Expr.Comparison c) {
            Expr left = rewrite(c.left());
            return new Expr.Comparison(left, c.op(), rewrite(c.right()), c.line());
        }
        if (expr instanceof Expr.Logical l) {
            Expr left = rewrite(l.left());
            return new Expr.Logical(l.op(), left, rewrite(l.right()), l.line());
        }
        if (expr instanceof Expr.ListLiteral l) {
            List<Expr> elements = new ArrayList<>();
            for (Expr e : l.elements()) {
                elements.add(rewrite(e));
            }
            return new Expr.ListLiteral(elements, l.line());
        }
        return expr;
    }
}
