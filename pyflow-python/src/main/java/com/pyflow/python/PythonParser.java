package com.pyflow.python;

import com.pyflow.python.ast.Alias;
import com.pyflow.python.ast.ComprehensionFor;
import com.pyflow.python.ast.ExceptHandler;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Keyword;
import com.pyflow.python.ast.Module;
import com.pyflow.python.ast.Stmt;
import com.pyflow.python.ast.WithItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Python statement and expression grammar used by data scripts:
 * assignments (chained, augmented, annotated, tuple targets), imports, control flow, function and
 * class definitions, calls with keyword and star arguments, subscripts and slices, comprehensions,
 * lambdas and conditional expressions.
 * <p>
 * Not supported: {@code match} statements, parenthesized multi-item {@code with} headers, type
 * parameter syntax. These raise {@link SourceSyntaxException} like any other invalid input.
 */
public final class PythonParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private static final Set<String> AUG_ASSIGN = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private static final Set<String> COMPARE_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private final List<Token> tokens;
    private final String source;
    private int index;

    private PythonParser(String source) {
        this.source = source != null ? source : "";
        this.tokens = PythonLexer.tokenize(this.source);
    }

    /**
     * Parses a module.
     *
     * @throws SourceSyntaxException with the line and column of the first error
     */
    public static Module parse(String source) {
        PythonParser p = new PythonParser(source);
        List<Stmt> body = new ArrayList<>();
        while (p.peek().type() != TokenType.ENDMARKER) {
            if (p.peek().type() == TokenType.INDENT) throw p.error(p.peek(), "unexpected indent");
            if (p.peek().type() == TokenType.NEWLINE) {
                p.index++;
                continue;
            }
            p.addStatement(body);
        }
        return new Module(body, p.source);
    }

    /** Parses a single expression, e.g. for tests or snippet analysis. */
    public static Expr parseExpression(String source) {
        PythonParser p = new PythonParser(source);
        Expr e = p.starExpressions();
        p.skipNewlines();
        if (p.peek().type() != TokenType.ENDMARKER) throw p.error(p.peek(), "unexpected " + p.peek());
        return e;
    }

    // token helpers

    private Token peek() {
        return tokens.get(index);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.type() != TokenType.ENDMARKER) index++;
        return t;
    }

    private Token previous() {
        return tokens.get(Math.max(0, index - 1));
    }

    private boolean atOp(String op) {
        return peek().isOp(op);
    }

    private boolean atKeyword(String kw) {
        return peek().isName(kw);
    }

    private boolean acceptOp(String op) {
        if (atOp(op)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String kw) {
        if (atKeyword(kw)) {
            index++;
            return true;
        }
        return false;
    }

    private Token expectOp(String op) {
        if (!atOp(op)) throw error(peek(), "expected '" + op + "' but found " + peek());
        return next();
    }

    private void expectKeyword(String kw) {
        if (!atKeyword(kw)) throw error(peek(), "expected '" + kw + "' but found " + peek());
        next();
    }

    private String expectName() {
        Token t = peek();
        if (t.type() != TokenType.NAME || KEYWORDS.contains(t.text())) {
            throw error(t, "expected a name but found " + t);
        }
        return next().text();
    }

    private void skipNewlines() {
        while (peek().type() == TokenType.NEWLINE) index++;
    }

    private SourceSyntaxException error(Token at, String message) {
        return new SourceSyntaxException(message, at.line(), Math.max(1, at.column()));
    }

    private int lastLine() {
        return previous().endLine();
    }

    // statements

    private Stmt statement() {
        Token t = peek();
        if (t.isOp("@")) return decorated();
        if (t.type() == TokenType.NAME) {
            switch (t.text()) {
                case "if":
                    return ifStatement();
                case "while":
                    return whileStatement();
                case "for":
                    return forStatement();
                case "try":
                    return tryStatement();
                case "with":
                    return withStatement();
                case "def":
                    return functionDef(List.of(), t.line());
                case "class":
                    return classDef(List.of(), t.line());
                case "async":
                    if (peek(1).isName("def") || peek(1).isName("for") || peek(1).isName("with")) {
                        next();
                        return statement();
                    }
                    break;
                default:
                    break;
            }
        }
        throw error(t, "invalid syntax");
    }

    private List<Stmt> simpleStatements() {
        List<Stmt> out = new ArrayList<>();
        out.add(smallStatement());
        while (acceptOp(";")) {
            if (peek().type() == TokenType.NEWLINE || peek().type() == TokenType.ENDMARKER) break;
            out.add(smallStatement());
        }
        if (peek().type() == TokenType.NEWLINE) {
            next();
        } else if (peek().type() != TokenType.ENDMARKER) {
            throw error(peek(), "invalid syntax");
        }
        return out;
    }

    private List<Stmt> block() {
        expectOp(":");
        if (peek().type() != TokenType.NEWLINE) return simpleStatements();
        next();
        if (peek().type() != TokenType.INDENT) throw error(peek(), "expected an indented block");
        next();
        List<Stmt> body = new ArrayList<>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.ENDMARKER) {
            if (peek().type() == TokenType.NEWLINE) {
                next();
                continue;
            }
            if (peek().type() == TokenType.INDENT) throw error(peek(), "unexpected indent");
            addStatement(body);
        }
        if (peek().type() == TokenType.DEDENT) next();
        return body;
    }

    /** Adds the next statement, expanding {@code a; b} lines into separate statements. */
    private void addStatement(List<Stmt> body) {
        Token t = peek();
        if (isCompoundStart(t)) {
            body.add(statement());
        } else {
            body.addAll(simpleStatements());
        }
    }

    private boolean isCompoundStart(Token t) {
        if (t.isOp("@")) return true;
        if (t.type() != TokenType.NAME) return false;
        return switch (t.text()) {
            case "if", "while", "for", "try", "with", "def", "class" -> true;
            case "async" -> peek(1).isName("def") || peek(1).isName("for") || peek(1).isName("with");
            default -> false;
        };
    }

    private static int endOf(List<Stmt> body, int fallback) {
        return body.isEmpty() ? fallback : body.get(body.size() - 1).endLine();
    }

    private Stmt ifStatement() {
        Token start = next();
        Expr test = namedExpression();
        List<Stmt> body = block();
        List<Stmt> orElse = List.of();
        if (atKeyword("elif")) {
            orElse = List.of(ifStatement());
        } else if (acceptKeyword("else")) {
            orElse = block();
        }
        int end = orElse.isEmpty() ? endOf(body, start.line()) : endOf(orElse, start.line());
        return new Stmt.If(test, body, orElse, start.line(), end);
    }

    private Stmt whileStatement() {
        Token start = next();
        Expr test = namedExpression();
        List<Stmt> body = block();
        List<Stmt> orElse = acceptKeyword("else") ? block() : List.of();
        return new Stmt.While(test, body, orElse, start.line(), endOf(orElse.isEmpty() ? body : orElse, start.line()));
    }

    private Stmt forStatement() {
        Token start = next();
        Expr target = targetList();
        expectKeyword("in");
        Expr iter = starExpressions();
        List<Stmt> body = block();
        List<Stmt> orElse = acceptKeyword("else") ? block() : List.of();
        return new Stmt.For(target, iter, body, orElse, start.line(), endOf(orElse.isEmpty() ? body : orElse, start.line()));
    }

    private Stmt tryStatement() {
        Token start = next();
        List<Stmt> body = block();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (atKeyword("except")) {
            Token ex = next();
            acceptOp("*");
            Expr type = null;
            String name = null;
            if (!atOp(":")) {
                type = test();
                if (acceptOp(",")) {
                    List<Expr> types = new ArrayList<>();
                    types.add(type);
                    do {
                        types.add(test());
                    } while (acceptOp(","));
                    type = new Expr.Tuple(types, ex.line());
                }
                if (acceptKeyword("as")) name = expectName();
            }
            handlers.add(new ExceptHandler(type, name, block(), ex.line()));
        }
        List<Stmt> orElse = acceptKeyword("else") ? block() : List.of();
        List<Stmt> finalBody = acceptKeyword("finally") ? block() : List.of();
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error(peek(), "expected 'except' or 'finally' block");
        }
        int end = !finalBody.isEmpty() ? endOf(finalBody, start.line())
                : !orElse.isEmpty() ? endOf(orElse, start.line())
                : endOf(handlers.get(handlers.size() - 1).body(), start.line());
        return new Stmt.Try(body, handlers, orElse, finalBody, start.line(), end);
    }

    private Stmt withStatement() {
        Token start = next();
        List<WithItem> items = new ArrayList<>();
        do {
            Expr context = test();
            Expr target = acceptKeyword("as") ? target() : null;
            items.add(new WithItem(context, target));
        } while (acceptOp(","));
        List<Stmt> body = block();
        return new Stmt.With(items, body, start.line(), endOf(body, start.line()));
    }

    private Stmt decorated() {
        int line = peek().line();
        List<Expr> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(namedExpression());
            if (peek().type() != TokenType.NEWLINE) throw error(peek(), "invalid syntax");
            next();
        }
        acceptKeyword("async");
        if (atKeyword("def")) return functionDef(decorators, line);
        if (atKeyword("class")) return classDef(decorators, line);
        throw error(peek(), "expected 'def' or 'class' after decorator");
    }

    private Stmt functionDef(List<Expr> decorators, int line) {
        expectKeyword("def");
        String name = expectName();
        expectOp("(");
        List<String> params = parameters(")", true);
        expectOp(")");
        if (acceptOp("->")) test();
        List<Stmt> body = block();
        return new Stmt.FunctionDef(name, params, body, decorators, line, endOf(body, line));
    }

    private Stmt classDef(List<Expr> decorators, int line) {
        expectKeyword("class");
        String name = expectName();
        List<Expr> bases = new ArrayList<>();
        if (acceptOp("(")) {
            for (Object arg : arguments()) {
                if (arg instanceof Expr e) bases.add(e);
            }
            expectOp(")");
        }
        List<Stmt> body = block();
        return new Stmt.ClassDef(name, bases, body, decorators, line, endOf(body, line));
    }

    /** Parameter list up to the closing token, kept as written. */
    private List<String> parameters(String closing, boolean annotations) {
        List<String> params = new ArrayList<>();
        while (!atOp(closing)) {
            if (acceptOp("/")) {
                params.add("/");
            } else if (acceptOp("**")) {
                String n = expectName();
                if (annotations && acceptOp(":")) test();
                params.add("**" + n);
            } else if (acceptOp("*")) {
                if (peek().type() == TokenType.NAME && !KEYWORDS.contains(peek().text())) {
                    String n = expectName();
                    if (annotations && acceptOp(":")) test();
                    params.add("*" + n);
                } else {
                    params.add("*");
                }
            } else {
                String n = expectName();
                if (annotations && acceptOp(":")) test();
                if (acceptOp("=")) {
                    params.add(n + "=" + ExpressionRenderer.render(test()));
                } else {
                    params.add(n);
                }
            }
            if (!acceptOp(",")) break;
        }
        return params;
    }

    private Stmt smallStatement() {
        Token t = peek();
        int line = t.line();
        if (t.type() == TokenType.NAME) {
            switch (t.text()) {
                case "pass", "break", "continue" -> {
                    next();
                    return new Stmt.Simple(t.text(), line, line);
                }
                case "return" -> {
                    next();
                    Expr value = atStatementEnd() ? null : starExpressions();
                    return new Stmt.Return(value, line, lastLine());
                }
                case "raise" -> {
                    next();
                    Expr exc = null;
                    Expr cause = null;
                    if (!atStatementEnd()) {
                        exc = test();
                        if (acceptKeyword("from")) cause = test();
                    }
                    return new Stmt.Raise(exc, cause, line, lastLine());
                }
                case "global", "nonlocal" -> {
                    next();
                    List<String> names = new ArrayList<>();
                    do {
                        names.add(expectName());
                    } while (acceptOp(","));
                    return new Stmt.Global(names, t.text().equals("nonlocal"), line, lastLine());
                }
                case "del" -> {
                    next();
                    Expr targets = targetList();
                    List<Expr> list = targets instanceof Expr.Tuple tuple ? tuple.elements() : List.of(targets);
                    return new Stmt.Delete(list, line, lastLine());
                }
                case "assert" -> {
                    next();
                    Expr test = test();
                    Expr msg = acceptOp(",") ? test() : null;
                    return new Stmt.Assert(test, msg, line, lastLine());
                }
                case "import" -> {
                    return importStatement();
                }
                case "from" -> {
                    return fromImport();
                }
                default -> {
                }
            }
        }
        return expressionStatement();
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.type() == TokenType.NEWLINE || t.type() == TokenType.ENDMARKER || t.isOp(";");
    }

    private Stmt importStatement() {
        Token start = next();
        List<Alias> names = new ArrayList<>();
        do {
            String name = dottedName();
            String as = acceptKeyword("as") ? expectName() : null;
            names.add(new Alias(name, as));
        } while (acceptOp(","));
        return new Stmt.Import(names, start.line(), lastLine());
    }

    private Stmt fromImport() {
        Token start = next();
        int level = 0;
        while (atOp(".") || atOp("...")) level += next().text().length();
        String module = atKeyword("import") ? null : dottedName();
        expectKeyword("import");
        List<Alias> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add(new Alias("*", null));
        } else {
            boolean paren = acceptOp("(");
            do {
                if (paren && atOp(")")) break;
                String name = expectName();
                String as = acceptKeyword("as") ? expectName() : null;
                names.add(new Alias(name, as));
            } while (acceptOp(","));
            if (paren) expectOp(")");
        }
        return new Stmt.ImportFrom(module, names, level, start.line(), lastLine());
    }

    private String dottedName() {
        StringBuilder sb = new StringBuilder(expectName());
        while (acceptOp(".")) sb.append('.').append(expectName());
        return sb.toString();
    }

    private Stmt expressionStatement() {
        int line = peek().line();
        Expr first = atKeyword("yield") ? yieldExpression() : starExpressions();
        Token t = peek();
        if (t.type() == TokenType.OP && AUG_ASSIGN.contains(t.text())) {
            next();
            checkAssignable(first, t);
            Expr value = atKeyword("yield") ? yieldExpression() : starExpressions();
            String op = t.text().substring(0, t.text().length() - 1);
            return new Stmt.AugAssign(first, op, value, line, lastLine());
        }
        if (t.isOp(":")) {
            next();
            checkAssignable(first, t);
            Expr annotation = test();
            Expr value = null;
            if (acceptOp("=")) value = atKeyword("yield") ? yieldExpression() : starExpressions();
            return new Stmt.AnnAssign(first, annotation, value, line, lastLine());
        }
        if (t.isOp("=")) {
            List<Expr> targets = new ArrayList<>();
            Expr value = first;
            while (atOp("=")) {
                Token eq = next();
                checkAssignable(value, eq);
                targets.add(value);
                value = atKeyword("yield") ? yieldExpression() : starExpressions();
            }
            return new Stmt.Assign(targets, value, line, lastLine());
        }
        return new Stmt.ExprStmt(first, line, lastLine());
    }

    private void checkAssignable(Expr target, Token at) {
        if (target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript) return;
        if (target instanceof Expr.Starred s) {
            checkAssignable(s.value(), at);
            return;
        }
        if (target instanceof Expr.Tuple tuple) {
            for (Expr e : tuple.elements()) checkAssignable(e, at);
            return;
        }
        if (target instanceof Expr.ListExpr list) {
            for (Expr e : list.elements()) checkAssignable(e, at);
            return;
        }
        throw error(at, "cannot assign to " + describe(target));
    }

    private static String describe(Expr e) {
        if (e instanceof Expr.Call) return "function call";
        if (e instanceof Expr.Constant) return "literal";
        return "expression";
    }

    // expressions

    /** Comma-separated expressions with optional starred items; a tuple when a comma is present. */
    private Expr starExpressions() {
        int line = peek().line();
        Expr first = starOrNamed();
        if (!atOp(",")) return first;
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (acceptOp(",")) {
            if (!canStartExpression(peek())) break;
            items.add(starOrNamed());
        }
        return new Expr.Tuple(items, line);
    }

    private Expr starOrNamed() {
        if (atOp("*")) {
            Token star = next();
            return new Expr.Starred(bitOr(), star.line());
        }
        return namedExpression();
    }

    /** Assignment targets of {@code for} and {@code del}: stops before {@code in}. */
    private Expr targetList() {
        int line = peek().line();
        Expr first = target();
        if (!atOp(",")) return first;
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (acceptOp(",")) {
            if (!canStartExpression(peek()) || atKeyword("in")) break;
            items.add(target());
        }
        return new Expr.Tuple(items, line);
    }

    private Expr target() {
        if (atOp("*")) {
            Token star = next();
            return new Expr.Starred(bitOr(), star.line());
        }
        return bitOr();
    }

    private boolean canStartExpression(Token t) {
        return switch (t.type()) {
            case NAME -> !KEYWORDS.contains(t.text()) || Set.of("None", "True", "False", "not", "lambda", "await", "yield")
                    .contains(t.text());
            case NUMBER, STRING -> true;
            case OP -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(t.text());
            default -> false;
        };
    }

    private Expr namedExpression() {
        if (peek().type() == TokenType.NAME && peek(1).isOp(":=") && !KEYWORDS.contains(peek().text())) {
            Token name = next();
            next();
            Expr value = test();
            return new Expr.NamedExpr(new Expr.Name(name.text(), name.line(), name.column()), value, name.line());
        }
        return test();
    }

    private Expr yieldExpression() {
        Token start = next();
        if (acceptKeyword("from")) return new Expr.Yield(test(), true, start.line());
        Expr value = atStatementEnd() || atOp(")") || atOp("=") ? null : starExpressions();
        return new Expr.Yield(value, false, start.line());
    }

    private Expr test() {
        if (atKeyword("lambda")) return lambda();
        Expr body = orTest();
        if (atKeyword("if")) {
            // conditional expression; an `if` inside a comprehension never reaches here
            Token ifTok = next();
            Expr cond = orTest();
            if (!acceptKeyword("else")) throw error(peek(), "expected 'else' after 'if' expression");
            Expr orElse = test();
            return new Expr.IfExp(cond, body, orElse, ifTok.line());
        }
        return body;
    }

    private Expr lambda() {
        Token start = next();
        List<String> params = parameters(":", false);
        expectOp(":");
        return new Expr.Lambda(params, test(), start.line());
    }

    private Expr orTest() {
        Expr first = andTest();
        if (!atKeyword("or")) return first;
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) values.add(andTest());
        return new Expr.BoolOp("or", values, first.line());
    }

    private Expr andTest() {
        Expr first = notTest();
        if (!atKeyword("and")) return first;
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) values.add(notTest());
        return new Expr.BoolOp("and", values, first.line());
    }

    private Expr notTest() {
        if (atKeyword("not")) {
            Token not = next();
            return new Expr.UnaryOp("not", notTest(), not.line());
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = bitOr();
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op = null;
            if (t.type() == TokenType.OP && COMPARE_OPS.contains(t.text())) {
                op = next().text();
            } else if (t.isName("in")) {
                next();
                op = "in";
            } else if (t.isName("not") && peek(1).isName("in")) {
                next();
                next();
                op = "not in";
            } else if (t.isName("is")) {
                next();
                op = acceptKeyword("not") ? "is not" : "is";
            }
            if (op == null) break;
            ops.add(op);
            comparators.add(bitOr());
        }
        return ops.isEmpty() ? left : new Expr.Compare(left, ops, comparators, left.line());
    }

    private Expr bitOr() {
        Expr left = bitXor();
        while (atOp("|")) {
            next();
            left = new Expr.BinOp(left, "|", bitXor(), left.line());
        }
        return left;
    }

    private Expr bitXor() {
        Expr left = bitAnd();
        while (atOp("^")) {
            next();
            left = new Expr.BinOp(left, "^", bitAnd(), left.line());
        }
        return left;
    }

    private Expr bitAnd() {
        Expr left = shift();
        while (atOp("&")) {
            next();
            left = new Expr.BinOp(left, "&", shift(), left.line());
        }
        return left;
    }

    private Expr shift() {
        Expr left = arith();
        while (atOp("<<") || atOp(">>")) {
            String op = next().text();
            left = new Expr.BinOp(left, op, arith(), left.line());
        }
        return left;
    }

    private Expr arith() {
        Expr left = term();
        while (atOp("+") || atOp("-")) {
            String op = next().text();
            left = new Expr.BinOp(left, op, term(), left.line());
        }
        return left;
    }

    private Expr term() {
        Expr left = factor();
        while (atOp("*") || atOp("/") || atOp("//") || atOp("%") || atOp("@")) {
            String op = next().text();
            left = new Expr.BinOp(left, op, factor(), left.line());
        }
        return left;
    }

    private Expr factor() {
        if (atOp("-") || atOp("+") || atOp("~")) {
            Token op = next();
            return new Expr.UnaryOp(op.text(), factor(), op.line());
        }
        return power();
    }

    private Expr power() {
        Expr base;
        if (atKeyword("await")) {
            Token await = next();
            base = new Expr.Await(primary(), await.line());
        } else {
            base = primary();
        }
        if (atOp("**")) {
            next();
            return new Expr.BinOp(base, "**", factor(), base.line());
        }
        return base;
    }

    private Expr primary() {
        Expr e = atom();
        while (true) {
            if (atOp(".")) {
                next();
                Token name = peek();
                if (name.type() != TokenType.NAME) throw error(name, "expected attribute name after '.'");
                next();
                e = new Expr.Attribute(e, name.text(), e.line());
            } else if (atOp("(")) {
                next();
                List<Object> args = arguments();
                expectOp(")");
                List<Expr> positional = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                for (Object a : args) {
                    if (a instanceof Keyword k) keywords.add(k);
                    else positional.add((Expr) a);
                }
                e = new Expr.Call(e, positional, keywords, e.line());
            } else if (atOp("[")) {
                next();
                Expr index = subscriptList();
                expectOp("]");
                e = new Expr.Subscript(e, index, e.line());
            } else {
                return e;
            }
        }
    }

    /** Call arguments: {@link Expr} for positional and starred, {@link Keyword} for keyword and {@code **}. */
    private List<Object> arguments() {
        List<Object> args = new ArrayList<>();
        while (!atOp(")")) {
            if (atOp("**")) {
                next();
                args.add(new Keyword(null, test()));
            } else if (atOp("*")) {
                Token star = next();
                args.add(new Expr.Starred(test(), star.line()));
            } else if (peek().type() == TokenType.NAME && peek(1).isOp("=") && !KEYWORDS.contains(peek().text())) {
                String name = next().text();
                next();
                args.add(new Keyword(name, test()));
            } else {
                Expr arg = namedExpression();
                if (atKeyword("for") || (atKeyword("async") && peek(1).isName("for"))) {
                    arg = new Expr.Comprehension(Expr.ComprehensionKind.GENERATOR, arg, null, generators(), arg.line());
                }
                args.add(arg);
            }
            if (!acceptOp(",")) break;
        }
        return args;
    }

    private Expr subscriptList() {
        int line = peek().line();
        Expr first = subscript();
        if (!atOp(",")) return first;
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (acceptOp(",")) {
            if (atOp("]")) break;
            items.add(subscript());
        }
        return new Expr.Tuple(items, line);
    }

    private Expr subscript() {
        int line = peek().line();
        Expr lower = null;
        if (!atOp(":")) {
            lower = starOrNamed();
            if (!atOp(":")) return lower;
        }
        expectOp(":");
        Expr upper = endsSlicePart() ? null : test();
        Expr step = null;
        if (acceptOp(":")) step = endsSlicePart() ? null : test();
        return new Expr.Slice(lower, upper, step, line);
    }

    private boolean endsSlicePart() {
        return atOp(":") || atOp("]") || atOp(",");
    }

    private List<ComprehensionFor> generators() {
        List<ComprehensionFor> out = new ArrayList<>();
        while (atKeyword("for") || (atKeyword("async") && peek(1).isName("for"))) {
            boolean async = acceptKeyword("async");
            expectKeyword("for");
            Expr target = targetList();
            expectKeyword("in");
            Expr iter = orTest();
            List<Expr> conditions = new ArrayList<>();
            while (acceptKeyword("if")) conditions.add(orTest());
            out.add(new ComprehensionFor(target, iter, conditions, async));
        }
        return out;
    }

    private Expr atom() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER -> {
                next();
                Object v = t.value();
                Expr.ConstantKind kind = v instanceof Double ? Expr.ConstantKind.FLOAT
                        : v instanceof String ? Expr.ConstantKind.COMPLEX : Expr.ConstantKind.INT;
                return new Expr.Constant(v, kind, t.text(), t.line());
            }
            case STRING -> {
                return strings();
            }
            case NAME -> {
                switch (t.text()) {
                    case "None" -> {
                        next();
                        return new Expr.Constant(null, Expr.ConstantKind.NONE, null, t.line());
                    }
                    case "True", "False" -> {
                        next();
                        return new Expr.Constant(Boolean.valueOf(t.text()), Expr.ConstantKind.BOOL, null, t.line());
                    }
                    default -> {
                        if (KEYWORDS.contains(t.text())) throw error(t, "invalid syntax");
                        next();
                        return new Expr.Name(t.text(), t.line(), t.column());
                    }
                }
            }
            case OP -> {
                switch (t.text()) {
                    case "(" -> {
                        return parenthesized();
                    }
                    case "[" -> {
                        return listDisplay();
                    }
                    case "{" -> {
                        return braceDisplay();
                    }
                    case "..." -> {
                        next();
                        return new Expr.Constant(null, Expr.ConstantKind.ELLIPSIS, "...", t.line());
                    }
                    default -> throw error(t, "invalid syntax");
                }
            }
            case NEWLINE, ENDMARKER -> throw error(t, "invalid syntax: unexpected end of statement");
            case INDENT -> throw error(t, "unexpected indent");
            default -> throw error(t, "invalid syntax");
        }
    }

    /** Adjacent string literals concatenate; any f-string part makes the whole a formatted string. */
    private Expr strings() {
        Token first = peek();
        StringBuilder value = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        boolean formatted = false;
        boolean bytes = false;
        while (peek().type() == TokenType.STRING) {
            Token t = next();
            StringLiteral s = (StringLiteral) t.value();
            value.append(s.value());
            if (literal.length() > 0) literal.append(' ');
            literal.append(t.text());
            formatted |= s.formatted();
            bytes |= s.bytes();
        }
        if (formatted) return new Expr.FormattedString(literal.toString(), first.line());
        return new Expr.Constant(value.toString(), bytes ? Expr.ConstantKind.BYTES : Expr.ConstantKind.STRING,
                null, first.line());
    }

    private Expr parenthesized() {
        Token open = next();
        if (acceptOp(")")) return new Expr.Tuple(List.of(), open.line());
        if (atKeyword("yield")) {
            Expr y = yieldExpression();
            expectOp(")");
            return y;
        }
        Expr first = starOrNamed();
        if (atKeyword("for") || (atKeyword("async") && peek(1).isName("for"))) {
            Expr gen = new Expr.Comprehension(Expr.ComprehensionKind.GENERATOR, first, null, generators(), open.line());
            expectOp(")");
            return gen;
        }
        if (!atOp(",")) {
            expectOp(")");
            return first;
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (acceptOp(",")) {
            if (atOp(")")) break;
            items.add(starOrNamed());
        }
        expectOp(")");
        return new Expr.Tuple(items, open.line());
    }

    private Expr listDisplay() {
        Token open = next();
        List<Expr> items = new ArrayList<>();
        if (acceptOp("]")) return new Expr.ListExpr(items, open.line());
        Expr first = starOrNamed();
        if (atKeyword("for") || (atKeyword("async") && peek(1).isName("for"))) {
            Expr comp = new Expr.Comprehension(Expr.ComprehensionKind.LIST, first, null, generators(), open.line());
            expectOp("]");
            return comp;
        }
        items.add(first);
        while (acceptOp(",")) {
            if (atOp("]")) break;
            items.add(starOrNamed());
        }
        expectOp("]");
        return new Expr.ListExpr(items, open.line());
    }

    private Expr braceDisplay() {
        Token open = next();
        if (acceptOp("}")) return new Expr.Dict(List.of(), List.of(), open.line());
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (atOp("**")) {
            next();
            keys.add(null);
            values.add(bitOr());
        } else {
            Expr first = starOrNamed();
            if (acceptOp(":")) {
                Expr value = test();
                if (atKeyword("for") || (atKeyword("async") && peek(1).isName("for"))) {
                    Expr comp = new Expr.Comprehension(Expr.ComprehensionKind.DICT, first, value, generators(), open.line());
                    expectOp("}");
                    return comp;
                }
                keys.add(first);
                values.add(value);
            } else {
                if (atKeyword("for") || (atKeyword("async") && peek(1).isName("for"))) {
                    Expr comp = new Expr.Comprehension(Expr.ComprehensionKind.SET, first, null, generators(), open.line());
                    expectOp("}");
                    return comp;
                }
                List<Expr> items = new ArrayList<>();
                items.add(first);
                while (acceptOp(",")) {
                    if (atOp("}")) break;
                    items.add(starOrNamed());
                }
                expectOp("}");
                return new Expr.SetExpr(items, open.line());
            }
        }
        while (acceptOp(",")) {
            if (atOp("}")) break;
            if (acceptOp("**")) {
                keys.add(null);
                values.add(bitOr());
            } else {
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
        }
        expectOp("}");
        return new Expr.Dict(keys, values, open.line());
    }
}
