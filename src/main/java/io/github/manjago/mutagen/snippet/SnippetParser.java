package io.github.manjago.mutagen.snippet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for strategy snippets.
 *
 * <h2>Grammar:</h2>
 * <pre>
 * script     := (NEWLINE | statement)* EOF
 * statement  := def | if | for | while | simple (';' simple)* NEWLINE
 * simple     := import | from-import | pass | break | continue | return [expr]
 *             | target '=' expr | target op'=' expr | expr
 * block      := ':' (simple NEWLINE | NEWLINE INDENT statement+ DEDENT)
 *
 * expr       := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := bitor [('&lt;' | '&lt;=' | '&gt;' | '&gt;=' | '==' | '!=') bitor]
 * bitor      := bitand ('|' bitand)*
 * bitand     := arith ('&amp;' arith)*
 * arith      := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '//' | '%') factor)*
 * factor     := ('-' | '+' | '~') factor | power
 * power      := postfix ['**' factor]
 * postfix    := atom ('(' args ')' | '.' NAME | '[' expr ']')*
 * atom       := NUMBER | STRING+ | NAME | True | False | None | '(' expr ')' | '[' exprs ']'
 * </pre>
 *
 * Everything outside this grammar (classes, lambdas, comprehensions,
 * tuples, slicing, try/with) is rejected with a {@link SnippetSyntaxException}.
 */
public final class SnippetParser {

    private static final Logger log = LoggerFactory.getLogger(SnippetParser.class);

    private static final Set<String> KEYWORDS = Set.of(
        "and", "or", "not", "if", "elif", "else", "for", "while", "def", "return",
        "import", "from", "as", "pass", "break", "continue", "in", "is",
        "True", "False", "None", "lambda", "class", "try", "except", "finally",
        "with", "yield", "global", "nonlocal", "del", "raise", "assert", "async", "await"
    );

    private static final Map<String, Expr.BinaryOperator> AUGMENTED = Map.of(
        "+=", Expr.BinaryOperator.ADD,
        "-=", Expr.BinaryOperator.SUB,
        "*=", Expr.BinaryOperator.MUL,
        "/=", Expr.BinaryOperator.DIV,
        "//=", Expr.BinaryOperator.FLOOR_DIV,
        "%=", Expr.BinaryOperator.MOD,
        "**=", Expr.BinaryOperator.POW,
        "&=", Expr.BinaryOperator.BIT_AND,
        "|=", Expr.BinaryOperator.BIT_OR
    );

    /**
     * Deepest allowed nesting of brackets, unary operators and blocks.
     */
    public static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private int pos;
    private int depth;

    private SnippetParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse snippet source into a syntax tree.
     */
    public static Script parse(String source) throws SnippetSyntaxException {
        List<Token> tokens = new Tokenizer(source).tokenize();
        Script script = new SnippetParser(tokens).parseScript();
        log.debug("Parsed {} top-level statements from {} tokens", script.body().size(), tokens.size());
        return script;
    }

    /**
     * Parse a single expression (used by templates and tests).
     */
    public static Expr parseExpression(String source) throws SnippetSyntaxException {
        SnippetParser parser = new SnippetParser(new Tokenizer(source).tokenize());
        Expr expr = parser.expression();
        while (parser.peek().type() == TokenType.NEWLINE) {
            parser.pos++;
        }
        parser.expect(TokenType.EOF, "end of expression");
        return expr;
    }

    /**
     * Quick syntax check.
     */
    public static boolean isValid(String source) {
        try {
            parse(source);
            return true;
        } catch (SnippetSyntaxException e) {
            log.debug("Syntax check failed: {}", e.getMessage());
            return false;
        }
    }

    // ========== Statements ==========

    private Script parseScript() throws SnippetSyntaxException {
        List<Stmt> body = new ArrayList<>();
        while (peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                pos++;
                continue;
            }
            if (peek().type() == TokenType.INDENT) {
                throw error(peek(), "Unexpected indent");
            }
            body.addAll(statement());
        }
        return new Script(body);
    }

    private List<Stmt> statement() throws SnippetSyntaxException {
        Token t = peek();
        if (t.type() == TokenType.NAME) {
            switch (t.text()) {
                case "def":
                    return List.of(functionDef());
                case "if":
                    return List.of(ifStatement());
                case "for":
                    return List.of(forStatement());
                case "while":
                    return List.of(whileStatement());
                case "class", "try", "with", "lambda", "raise", "assert", "del",
                     "global", "nonlocal", "yield", "async", "await":
                    throw error(t, "Unsupported statement '" + t.text() + "'");
                default:
                    break;
            }
        }
        return simpleLine();
    }

    private List<Stmt> simpleLine() throws SnippetSyntaxException {
        List<Stmt> result = new ArrayList<>();
        result.add(simpleStatement());
        while (peek().isOp(";")) {
            pos++;
            if (atLineEnd()) {
                break;
            }
            result.add(simpleStatement());
        }
        endOfLine();
        return result;
    }

    private Stmt simpleStatement() throws SnippetSyntaxException {
        Token t = peek();
        int line = t.line();

        if (t.isKeyword("import")) {
            pos++;
            List<Stmt.Alias> names = new ArrayList<>();
            do {
                names.add(alias(dottedName()));
            } while (match(","));
            return new Stmt.Import(names, line);
        }
        if (t.isKeyword("from")) {
            pos++;
            StringBuilder module = new StringBuilder();
            while (peek().isOp(".")) {
                module.append('.');
                pos++;
            }
            if (peek().type() == TokenType.NAME && !peek().isKeyword("import")) {
                module.append(dottedName());
            }
            expectKeyword("import");
            List<Stmt.Alias> names = new ArrayList<>();
            if (match("*")) {
                names.add(new Stmt.Alias("*", null));
            } else {
                boolean parens = match("(");
                do {
                    if (parens && peek().isOp(")")) {
                        break;
                    }
                    names.add(alias(name()));
                } while (match(","));
                if (parens) {
                    expectOp(")");
                }
            }
            return new Stmt.ImportFrom(module.toString(), names, line);
        }
        if (t.isKeyword("pass")) {
            pos++;
            return new Stmt.Pass(line);
        }
        if (t.isKeyword("break")) {
            pos++;
            return new Stmt.Break(line);
        }
        if (t.isKeyword("continue")) {
            pos++;
            return new Stmt.Continue(line);
        }
        if (t.isKeyword("return")) {
            pos++;
            if (atLineEnd() || peek().isOp(";")) {
                return new Stmt.Return(null, line);
            }
            return new Stmt.Return(expression(), line);
        }

        Expr expr = expression();
        Token next = peek();
        if (next.isOp(",")) {
            throw error(next, "Tuple expressions are not supported");
        }
        if (next.isOp("=")) {
            pos++;
            checkAssignable(expr, next);
            Expr value = expression();
            if (peek().isOp("=")) {
                throw error(peek(), "Chained assignment is not supported");
            }
            return new Stmt.Assign(expr, value, line);
        }
        if (next.type() == TokenType.OP && AUGMENTED.containsKey(next.text())) {
            pos++;
            checkAssignable(expr, next);
            return new Stmt.AugAssign(expr, AUGMENTED.get(next.text()), expression(), line);
        }
        return new Stmt.ExprStmt(expr, line);
    }

    private Stmt.FunctionDef functionDef() throws SnippetSyntaxException {
        int line = expectKeyword("def").line();
        String name = name();
        expectOp("(");
        List<Stmt.Param> params = new ArrayList<>();
        while (!peek().isOp(")")) {
            if (peek().isOp("*") || peek().isOp("**")) {
                throw error(peek(), "Variadic parameters are not supported");
            }
            String param = name();
            Expr defaultValue = match("=") ? expression() : null;
            params.add(new Stmt.Param(param, defaultValue));
            if (!match(",")) {
                break;
            }
        }
        expectOp(")");
        if (match("->")) {
            expression();
        }
        return new Stmt.FunctionDef(name, params, block(), line);
    }

    private Stmt.If ifStatement() throws SnippetSyntaxException {
        Token head = next();
        Expr test = expression();
        List<Stmt> body = block();
        List<Stmt> orElse = List.of();
        if (peek().isKeyword("elif")) {
            orElse = List.of(ifStatement());
        } else if (peek().isKeyword("else")) {
            pos++;
            orElse = block();
        }
        return new Stmt.If(test, body, orElse, head.line());
    }

    private Stmt.For forStatement() throws SnippetSyntaxException {
        int line = expectKeyword("for").line();
        String variable = name();
        if (peek().isOp(",")) {
            throw error(peek(), "Tuple unpacking is not supported");
        }
        expectKeyword("in");
        Expr iterable = expression();
        return new Stmt.For(variable, iterable, block(), line);
    }

    private Stmt.While whileStatement() throws SnippetSyntaxException {
        int line = expectKeyword("while").line();
        Expr test = expression();
        return new Stmt.While(test, block(), line);
    }

    private List<Stmt> block() throws SnippetSyntaxException {
        descend(peek(), "Block nested too deeply");
        try {
            return blockBody();
        } finally {
            depth--;
        }
    }

    private List<Stmt> blockBody() throws SnippetSyntaxException {
        expectOp(":");
        if (peek().type() != TokenType.NEWLINE) {
            return simpleLine();
        }
        pos++;
        expect(TokenType.INDENT, "indented block");
        List<Stmt> body = new ArrayList<>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                pos++;
                continue;
            }
            if (peek().type() == TokenType.INDENT) {
                throw error(peek(), "Unexpected indent");
            }
            body.addAll(statement());
        }
        expect(TokenType.DEDENT, "dedent");
        return body;
    }

    private Stmt.Alias alias(String name) throws SnippetSyntaxException {
        if (match("as")) {
            return new Stmt.Alias(name, name());
        }
        return new Stmt.Alias(name, null);
    }

    private String dottedName() throws SnippetSyntaxException {
        StringBuilder sb = new StringBuilder(name());
        while (peek().isOp(".")) {
            pos++;
            sb.append('.').append(name());
        }
        return sb.toString();
    }

    private void checkAssignable(Expr target, Token at) throws SnippetSyntaxException {
        if (!(target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript)) {
            throw error(at, "Cannot assign to expression");
        }
    }

    // ========== Expressions ==========

    private Expr expression() throws SnippetSyntaxException {
        return or();
    }

    private Expr or() throws SnippetSyntaxException {
        Expr left = and();
        while (peek().isKeyword("or")) {
            int line = next().line();
            left = new Expr.Logical(Expr.LogicalOperator.OR, left, and(), line);
        }
        return left;
    }

    private Expr and() throws SnippetSyntaxException {
        Expr left = not();
        while (peek().isKeyword("and")) {
            int line = next().line();
            left = new Expr.Logical(Expr.LogicalOperator.AND, left, not(), line);
        }
        return left;
    }

    private Expr not() throws SnippetSyntaxException {
        if (peek().isKeyword("not")) {
            descend(peek(), "Expression nested too deeply");
            try {
                int line = next().line();
                return new Expr.Unary(Expr.UnaryOperator.NOT, not(), line);
            } finally {
                depth--;
            }
        }
        return comparison();
    }

    private Expr comparison() throws SnippetSyntaxException {
        Expr left = bitOr();
        Expr.CompareOperator op = compareOperator();
        if (op == null) {
            return left;
        }
        int line = next().line();
        Expr right = bitOr();
        if (compareOperator() != null) {
            throw error(peek(), "Chained comparisons are not supported");
        }
        return new Expr.Comparison(left, op, right, line);
    }

    private Expr.CompareOperator compareOperator() throws SnippetSyntaxException {
        Token t = peek();
        if (t.isKeyword("in") || t.isKeyword("is")) {
            throw error(t, "Operator '" + t.text() + "' is not supported");
        }
        if (t.type() != TokenType.OP) {
            return null;
        }
        return Expr.CompareOperator.fromSymbol(t.text());
    }

    private Expr bitOr() throws SnippetSyntaxException {
        Expr left = bitAnd();
        while (peek().isOp("|")) {
            int line = next().line();
            left = new Expr.Binary(left, Expr.BinaryOperator.BIT_OR, bitAnd(), line);
        }
        return left;
    }

    private Expr bitAnd() throws SnippetSyntaxException {
        Expr left = arith();
        while (peek().isOp("&")) {
            int line = next().line();
            left = new Expr.Binary(left, Expr.BinaryOperator.BIT_AND, arith(), line);
        }
        if (peek().isOp("^") || peek().isOp("<<") || peek().isOp(">>")) {
            throw error(peek(), "Operator '" + peek().text() + "' is not supported");
        }
        return left;
    }

    private Expr arith() throws SnippetSyntaxException {
        Expr left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            Token op = next();
            left = new Expr.Binary(left, Expr.BinaryOperator.fromSymbol(op.text()), term(), op.line());
        }
        return left;
    }

    private Expr term() throws SnippetSyntaxException {
        Expr left = factor();
        while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%")) {
            Token op = next();
            left = new Expr.Binary(left, Expr.BinaryOperator.fromSymbol(op.text()), factor(), op.line());
        }
        return left;
    }

    private Expr factor() throws SnippetSyntaxException {
        descend(peek(), "Expression nested too deeply");
        try {
            return unary();
        } finally {
            depth--;
        }
    }

    private Expr unary() throws SnippetSyntaxException {
        Token t = peek();
        if (t.isOp("-")) {
            pos++;
            return new Expr.Unary(Expr.UnaryOperator.NEG, factor(), t.line());
        }
        if (t.isOp("+")) {
            pos++;
            return new Expr.Unary(Expr.UnaryOperator.POS, factor(), t.line());
        }
        if (t.isOp("~")) {
            pos++;
            return new Expr.Unary(Expr.UnaryOperator.INVERT, factor(), t.line());
        }
        return power();
    }

    private Expr power() throws SnippetSyntaxException {
        Expr base = postfix();
        if (peek().isOp("**")) {
            int line = next().line();
            return new Expr.Binary(base, Expr.BinaryOperator.POW, factor(), line);
        }
        return base;
    }

    private Expr postfix() throws SnippetSyntaxException {
        Expr expr = atom();
        while (true) {
            Token t = peek();
            if (t.isOp("(")) {
                pos++;
                expr = callArguments(expr, t.line());
            } else if (t.isOp(".")) {
                pos++;
                expr = new Expr.Attribute(expr, name(), t.line());
            } else if (t.isOp("[")) {
                pos++;
                Expr index = expression();
                if (peek().isOp(":") || peek().isOp(",")) {
                    throw error(peek(), "Slicing is not supported");
                }
                expectOp("]");
                expr = new Expr.Subscript(expr, index, t.line());
            } else {
                return expr;
            }
        }
    }

    private Expr callArguments(Expr function, int line) throws SnippetSyntaxException {
        List<Expr> args = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        while (!peek().isOp(")")) {
            if (peek().isOp("*") || peek().isOp("**")) {
                throw error(peek(), "Argument unpacking is not supported");
            }
            if (peek().type() == TokenType.NAME && lookahead(1).isOp("=")) {
                String keyword = name();
                pos++;
                keywords.add(new Expr.Keyword(keyword, expression()));
            } else {
                if (!keywords.isEmpty()) {
                    throw error(peek(), "Positional argument follows keyword argument");
                }
                args.add(expression());
            }
            if (!match(",")) {
                break;
            }
        }
        expectOp(")");
        return new Expr.Call(function, args, keywords, line);
    }

    private Expr atom() throws SnippetSyntaxException {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return number(t);
            case STRING: {
                StringBuilder sb = new StringBuilder(t.text());
                while (peek().type() == TokenType.STRING) {
                    sb.append(next().text());
                }
                return new Expr.Str(sb.toString(), t.line());
            }
            case NAME:
                switch (t.text()) {
                    case "True":
                        return new Expr.Constant(Boolean.TRUE, t.line());
                    case "False":
                        return new Expr.Constant(Boolean.FALSE, t.line());
                    case "None":
                        return new Expr.Constant(null, t.line());
                    default:
                        if (KEYWORDS.contains(t.text())) {
                            throw error(t, "Unexpected keyword '" + t.text() + "'");
                        }
                        return new Expr.Name(t.text(), t.line());
                }
            case OP:
                if (t.isOp("(")) {
                    if (peek().isOp(")")) {
                        throw error(peek(), "Tuple expressions are not supported");
                    }
                    Expr inner = expression();
                    if (peek().isOp(",")) {
                        throw error(peek(), "Tuple expressions are not supported");
                    }
                    if (peek().isKeyword("for")) {
                        throw error(peek(), "Generator expressions are not supported");
                    }
                    expectOp(")");
                    return inner;
                }
                if (t.isOp("[")) {
                    List<Expr> elements = new ArrayList<>();
                    while (!peek().isOp("]")) {
                        elements.add(expression());
                        if (peek().isKeyword("for")) {
                            throw error(peek(), "List comprehensions are not supported");
                        }
                        if (!match(",")) {
                            break;
                        }
                    }
                    expectOp("]");
                    return new Expr.ListLiteral(elements, t.line());
                }
                if (t.isOp("{")) {
                    throw error(t, "Dict and set literals are not supported");
                }
                throw error(t, "Unexpected '" + t.text() + "'");
            default:
                throw error(t, "Unexpected " + describe(t));
        }
    }

    private Expr.Num number(Token t) throws SnippetSyntaxException {
        String text = t.text().replace("_", "");
        boolean integer = text.chars().allMatch(Character::isDigit);
        try {
            double value = Double.parseDouble(text);
            return new Expr.Num(value, integer, t.text(), t.line(), t.start(), t.end());
        } catch (NumberFormatException e) {
            throw error(t, "Invalid number literal '" + t.text() + "'");
        }
    }

    // ========== Token helpers ==========

    private void descend(Token at, String message) throws SnippetSyntaxException {
        if (++depth > MAX_NESTING) {
            throw error(at, message);
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token lookahead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF) {
            pos++;
        }
        return t;
    }

    private boolean match(String opOrKeyword) {
        Token t = peek();
        if (t.isOp(opOrKeyword) || t.isKeyword(opOrKeyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean atLineEnd() {
        TokenType type = peek().type();
        return type == TokenType.NEWLINE || type == TokenType.EOF;
    }

    private void endOfLine() throws SnippetSyntaxException {
        Token t = peek();
        if (t.type() == TokenType.NEWLINE) {
            pos++;
        } else if (t.type() != TokenType.EOF && t.type() != TokenType.DEDENT) {
            throw error(t, "Unexpected " + describe(t));
        }
    }

    private String name() throws SnippetSyntaxException {
        Token t = next();
        if (t.type() != TokenType.NAME || KEYWORDS.contains(t.text())) {
            throw error(t, "Expected name but found " + describe(t));
        }
        return t.text();
    }

    private Token expectOp(String op) throws SnippetSyntaxException {
        Token t = next();
        if (!t.isOp(op)) {
            throw error(t, "Expected '" + op + "' but found " + describe(t));
        }
        return t;
    }

    private Token expectKeyword(String keyword) throws SnippetSyntaxException {
        Token t = next();
        if (!t.isKeyword(keyword)) {
            throw error(t, "Expected '" + keyword + "' but found " + describe(t));
        }
        return t;
    }

    private Token expect(TokenType type, String what) throws SnippetSyntaxException {
        Token t = next();
        if (t.type() != type) {
            throw error(t, "Expected " + what + " but found " + describe(t));
        }
        return t;
    }

    private static String describe(Token t) {
        return switch (t.type()) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            case STRING -> "string literal";
            default -> "'" + t.text() + "'";
        };
    }

    private static SnippetSyntaxException error(Token t, String message) {
        return new SnippetSyntaxException(message, t.line());
    }
}
