package io.github.manjago.mutagen.snippet;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders syntax trees back to snippet source.
 *
 * Output is canonical: four-space indentation, single-quoted strings,
 * parentheses only where precedence requires them. Comments are not part
 * of the tree and are therefore not reproduced.
 */
public final class SourceWriter {

    private static final String INDENT = "    ";

    private static final int PREC_NOT = 3;
    private static final int PREC_COMPARE = 4;
    private static final int PREC_UNARY = 9;
    private static final int PREC_POSTFIX = 12;

    private SourceWriter() {}

    /**
     * Render a whole script. Top-level functions are separated from their
     * neighbours by a blank line.
     */
    @NotNull
    public static String write(Script script) {
        StringBuilder sb = new StringBuilder();
        Stmt previous = null;
        for (Stmt stmt : script.body()) {
            if (previous != null
                    && (stmt instanceof Stmt.FunctionDef || previous instanceof Stmt.FunctionDef)) {
                sb.append('\n');
            }
            writeStmt(sb, stmt, 0);
            previous = stmt;
        }
        return sb.toString();
    }

    /**
     * Render a single statement at top-level indentation.
     */
    @NotNull
    public static String write(Stmt stmt) {
        StringBuilder sb = new StringBuilder();
        writeStmt(sb, stmt, 0);
        return sb.toString();
    }

    @NotNull
    public static String write(Expr expr) {
        return expression(expr);
    }

    // ========== Statements ==========

    private static void writeStmt(StringBuilder sb, Stmt stmt, int depth) {
        String pad = INDENT.repeat(depth);
        if (stmt instanceof Stmt.Import s) {
            sb.append(pad).append("import ").append(aliases(s.names())).append('\n');
        } else if (stmt instanceof Stmt.ImportFrom s) {
            sb.append(pad).append("from ").append(s.module()).append(" import ")
                .append(aliases(s.names())).append('\n');
        } else if (stmt instanceof Stmt.Assign s) {
            sb.append(pad).append(expression(s.target())).append(" = ")
                .append(expression(s.value())).append('\n');
        } else if (stmt instanceof Stmt.AugAssign s) {
            sb.append(pad).append(expression(s.target())).append(' ').append(s.op().symbol())
                .append("= ").append(expression(s.value())).append('\n');
        } else if (stmt instanceof Stmt.ExprStmt s) {
            sb.append(pad).append(expression(s.value())).append('\n');
        } else if (stmt instanceof Stmt.FunctionDef s) {
            sb.append(pad).append("def ").append(s.name()).append('(');
            for (int i = 0; i < s.params().size(); i++) {
                Stmt.Param p = s.params().get(i);
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(p.name());
                if (p.defaultValue() != null) {
                    sb.append('=').append(expression(p.defaultValue()));
                }
            }
            sb.append("):\n");
            writeBlock(sb, s.body(), depth + 1);
        } else if (stmt instanceof Stmt.Return s) {
            sb.append(pad).append("return");
            if (s.value() != null) {
                sb.append(' ').append(expression(s.value()));
            }
            sb.append('\n');
        } else if (stmt instanceof Stmt.If s) {
            writeIf(sb, s, depth, "if");
        } else if (stmt instanceof Stmt.For s) {
            sb.append(pad).append("for ").append(s.variable()).append(" in ")
                .append(expression(s.iterable())).append(":\n");
            writeBlock(sb, s.body(), depth + 1);
        } else if (stmt instanceof Stmt.While s) {
            sb.append(pad).append("while ").append(expression(s.test())).append(":\n");
            writeBlock(sb, s.body(), depth + 1);
        } else if (stmt instanceof Stmt.Pass) {
            sb.append(pad).append("pass\n");
        } else if (stmt instanceof Stmt.Break) {
            sb.append(pad).append("break\n");
        } else if (stmt instanceof Stmt.Continue) {
            sb.append(pad).append("continue\n");
        } else {
            throw new IllegalArgumentException("Unknown statement: " + stmt);
        }
    }

    private static void writeIf(StringBuilder sb, Stmt.If s, int depth, String keyword) {
        String pad = INDENT.repeat(depth);
        sb.append(pad).append(keyword).append(' ').append(expression(s.test())).append(":\n");
        writeBlock(sb, s.body(), depth + 1);
        if (s.orElse().isEmpty()) {
            return;
        }
        if (s.orElse().size() == 1 && s.orElse().get(0) instanceof Stmt.If elif) {
            writeIf(sb, elif, depth, "elif");
        } else {
            sb.append(pad).append("else:\n");
            writeBlock(sb, s.orElse(), depth + 1);
        }
    }

    private static void writeBlock(StringBuilder sb, List<Stmt> body, int depth) {
        if (body.isEmpty()) {
            sb.append(INDENT.repeat(depth)).append("pass\n");
            return;
        }
        for (Stmt stmt : body) {
            writeStmt(sb, stmt, depth);
        }
    }

    private static String aliases(List<Stmt.Alias> names) {
        return names.stream().map(Stmt.Alias::toString).collect(Collectors.joining(", "));
    }

    // ========== Expressions ==========

    private static String expression(Expr expr) {
        if (expr instanceof Expr.Num n) {
            return n.text();
        }
        if (expr instanceof Expr.Str s) {
            return quote(s.value());
        }
        if (expr instanceof Expr.Constant c) {
            return c.keyword();
        }
        if (expr instanceof Expr.Name n) {
            return n.id();
        }
        if (expr instanceof Expr.Attribute a) {
            return operand(a.target(), PREC_POSTFIX, false) + "." + a.name();
        }
        if (expr instanceof Expr.Subscript s) {
            return operand(s.target(), PREC_POSTFIX, false) + "[" + expression(s.index()) + "]";
        }
        if (expr instanceof Expr.Call c) {
            StringBuilder sb = new StringBuilder(operand(c.function(), PREC_POSTFIX, false)).append('(');
            boolean first = true;
            for (Expr arg : c.args()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(expression(arg));
                first = false;
            }
            for (Expr.Keyword kw : c.keywords()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(kw.name()).append('=').append(expression(kw.value()));
                first = false;
            }
            return sb.append(')').toString();
        }
        if (expr instanceof Expr.Binary b) {
            int p = b.op().precedence();
            boolean rightAssoc = b.op() == Expr.BinaryOperator.POW;
            return operand(b.left(), p, rightAssoc) + " " + b.op().symbol() + " "
                + operand(b.right(), p, !rightAssoc);
        }
        if (expr instanceof Expr.Unary u) {
            if (u.op() == Expr.UnaryOperator.NOT) {
                return "not " + operand(u.operand(), PREC_NOT, false);
            }
            return u.op().symbol() + operand(u.operand(), PREC_UNARY, false);
        }
        if (expr instanceof Expr.Comparison c) {
            return operand(c.left(), PREC_COMPARE, true) + " " + c.op().symbol() + " "
                + operand(c.right(), PREC_COMPARE, true);
        }
        if (expr instanceof Expr.Logical l) {
            int p = l.op().precedence();
            return operand(l.left(), p, false) + " " + l.op().symbol() + " " + operand(l.right(), p, true);
        }
        if (expr instanceof Expr.ListLiteral l) {
            return l.elements().stream().map(SourceWriter::expression)
                .collect(Collectors.joining(", ", "[", "]"));
        }
        throw new IllegalArgumentException("Unknown expression: " + expr);
    }

    /**
     * Render a child, parenthesised when its precedence is below the
     * parent's (or equal, when {@code strict}).
     */
    private static String operand(Expr child, int parentPrecedence, boolean strict) {
        int p = precedence(child);
        boolean parens = strict ? p <= parentPrecedence : p < parentPrecedence;
        String text = expression(child);
        return parens ? "(" + text + ")" : text;
    }

    static int precedence(Expr expr) {
        if (expr instanceof Expr.Logical l) {
            return l.op().precedence();
        }
        if (expr instanceof Expr.Unary u) {
            return u.op() == Expr.UnaryOperator.NOT ? PREC_NOT : PREC_UNARY;
        }
        if (expr instanceof Expr.Comparison) {
            return PREC_COMPARE;
        }
        if (expr instanceof Expr.Binary b) {
            return b.op().precedence();
        }
        if (expr instanceof Expr.Num n && (n.value() < 0 || n.text().startsWith("-"))) {
            return PREC_UNARY;
        }
        return PREC_POSTFIX;
    }

    private static String quote(String value) {
        StringBuilder sb = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
