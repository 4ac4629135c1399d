package com.warden.core.validation.syntax;

import com.warden.core.validation.syntax.Node.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Python-syntax subset accepted by the gateway.
 *
 * <p>Anything outside the subset is reported as a {@link ContentParseException}, which the
 * validator turns into a VALIDATION_FAILED violation. Nesting is bounded so hostile input cannot
 * exhaust the thread stack.
 */
public final class Parser {

    static final int MAX_NESTING = 200;

    private static final Set<String> RESERVED = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private final List<Token> tokens;
    private int pos;
    private int nesting;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a whole program.
     */
    public static Node.Module parseModule(String source) {
        var parser = new Parser(Lexer.tokenize(source.stripIndent()));
        return parser.module();
    }

    /**
     * Parses a single expression, e.g. a factor expression.
     */
    public static Node parseExpression(String source) {
        var parser = new Parser(Lexer.tokenize(source.strip()));
        parser.skipNewlines();
        if (parser.peek().type() == Token.Type.EOF) {
            throw new ContentParseException("empty expression", 1, 1);
        }
        Node expr = parser.testListStarExpr();
        parser.skipNewlines();
        parser.expect(Token.Type.EOF, "end of expression");
        return expr;
    }

    // ── Statements ─────────────────────────────────────────────────────

    private Node.Module module() {
        var body = new ArrayList<Node>();
        skipNewlines();
        while (peek().type() != Token.Type.EOF) {
            statement(body);
            skipNewlines();
        }
        return new Node.Module(body, 1, 1);
    }

    private void statement(List<Node> out) {
        Token t = peek();
        if (t.type() == Token.Type.INDENT) {
            throw error(t, "unexpected indent");
        }
        if (t.type() == Token.Type.NAME) {
            switch (t.text()) {
                case "if" -> { out.add(ifStatement()); return; }
                case "while" -> { out.add(whileStatement()); return; }
                case "for" -> { out.add(forStatement()); return; }
                case "try" -> { out.add(tryStatement()); return; }
                case "with" -> { out.add(withStatement()); return; }
                case "def" -> { out.add(functionDef(List.of())); return; }
                case "class" -> { out.add(classDef(List.of())); return; }
                case "async" -> {
                    next();
                    statement(out);
                    return;
                }
                default -> { }
            }
        }
        if (t.isOp("@")) {
            out.add(decorated());
            return;
        }
        simpleStatements(out);
    }

    private void simpleStatements(List<Node> out) {
        out.add(smallStatement());
        while (accept(";")) {
            if (peek().type() == Token.Type.NEWLINE || peek().type() == Token.Type.EOF) {
                break;
            }
            out.add(smallStatement());
        }
        endOfLine();
    }

    private Node smallStatement() {
        Token t = peek();
        if (t.type() == Token.Type.NAME) {
            switch (t.text()) {
                case "pass", "break", "continue" -> {
                    next();
                    return new Keyword(t.text(), t.line(), t.column());
                }
                case "return" -> {
                    next();
                    Node value = atStatementEnd() ? null : testListStarExpr();
                    return new Return(value, t.line(), t.column());
                }
                case "raise" -> {
                    next();
                    if (atStatementEnd()) {
                        return new Raise(null, null, t.line(), t.column());
                    }
                    Node exc = test();
                    Node cause = acceptKeyword("from") ? test() : null;
                    return new Raise(exc, cause, t.line(), t.column());
                }
                case "global", "nonlocal" -> {
                    next();
                    var names = new ArrayList<String>();
                    do {
                        names.add(name());
                    } while (accept(","));
                    return new Scope(t.text(), names, t.line(), t.column());
                }
                case "del" -> {
                    next();
                    return new Delete(exprList(), t.line(), t.column());
                }
                case "assert" -> {
                    next();
                    Node test = test();
                    Node msg = accept(",") ? test() : null;
                    return new Assert(test, msg, t.line(), t.column());
                }
                case "import" -> {
                    return importStatement();
                }
                case "from" -> {
                    return importFrom();
                }
                default -> { }
            }
        }
        return expressionStatement();
    }

    private Node expressionStatement() {
        Token start = peek();
        Node first = testListStarExpr();
        Token t = peek();
        if (t.isOp(":")) {
            next();
            Node annotation = test();
            Node value = accept("=") ? (peek().isKeyword("yield") ? yieldExpr() : testListStarExpr()) : null;
            return new AnnAssign(first, annotation, value, start.line(), start.column());
        }
        if (t.type() == Token.Type.OP && AUGMENTED.contains(t.text())) {
            next();
            Node value = peek().isKeyword("yield") ? yieldExpr() : testListStarExpr();
            return new AugAssign(first, t.text(), value, start.line(), start.column());
        }
        if (t.isOp("=")) {
            var targets = new ArrayList<Node>();
            Node value = first;
            while (accept("=")) {
                targets.add(value);
                value = peek().isKeyword("yield") ? yieldExpr() : testListStarExpr();
            }
            return new Assign(targets, value, start.line(), start.column());
        }
        return new ExprStatement(first, start.line(), start.column());
    }

    private Node importStatement() {
        Token t = next();
        var names = new ArrayList<Alias>();
        do {
            String dotted = dottedName();
            String as = acceptKeyword("as") ? name() : null;
            names.add(new Alias(dotted, as));
        } while (accept(","));
        return new Import(names, t.line(), t.column());
    }

    private Node importFrom() {
        Token t = next();
        int level = 0;
        while (peek().isOp(".") || peek().isOp("...")) {
            level += next().text().length();
        }
        String module = peek().isKeyword("import") ? "" : dottedName();
        expectKeyword("import");
        var names = new ArrayList<Alias>();
        if (accept("*")) {
            names.add(new Alias("*", null));
        } else {
            boolean parens = accept("(");
            do {
                if (parens && peek().isOp(")")) {
                    break;
                }
                String n = name();
                String as = acceptKeyword("as") ? name() : null;
                names.add(new Alias(n, as));
            } while (accept(","));
            if (parens) {
                expectOp(")");
            }
        }
        return new ImportFrom(module, names, level, t.line(), t.column());
    }

    private Node ifStatement() {
        Token t = next();
        Node test = namedExprTest();
        List<Node> body = suite();
        List<Node> orElse = List.of();
        if (peek().isKeyword("elif")) {
            orElse = List.of(ifStatement());
        } else if (acceptKeyword("else")) {
            orElse = suite();
        }
        return new If(test, body, orElse, t.line(), t.column());
    }

    private Node whileStatement() {
        Token t = next();
        Node test = namedExprTest();
        List<Node> body = suite();
        List<Node> orElse = acceptKeyword("else") ? suite() : List.of();
        return new While(test, body, orElse, t.line(), t.column());
    }

    private Node forStatement() {
        Token t = next();
        Node target = targetList();
        expectKeyword("in");
        Node iter = testListStarExpr();
        List<Node> body = suite();
        List<Node> orElse = acceptKeyword("else") ? suite() : List.of();
        return new For(target, iter, body, orElse, t.line(), t.column());
    }

    private Node tryStatement() {
        Token t = next();
        List<Node> body = suite();
        var handlers = new ArrayList<Node>();
        while (peek().isKeyword("except")) {
            Token h = next();
            accept("*");
            Node type = null;
            String name = null;
            if (!peek().isOp(":")) {
                type = test();
                if (acceptKeyword("as")) {
                    name = name();
                }
            }
            handlers.add(new ExceptHandler(type, name, suite(), h.line(), h.column()));
        }
        List<Node> orElse = List.of();
        if (!handlers.isEmpty() && acceptKeyword("else")) {
            orElse = suite();
        }
        List<Node> finalBody = acceptKeyword("finally") ? suite() : List.of();
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error(peek(), "expected 'except' or 'finally' block");
        }
        return new Try(body, handlers, orElse, finalBody, t.line(), t.column());
    }

    private Node withStatement() {
        Token t = next();
        var contexts = new ArrayList<Node>();
        var targets = new ArrayList<Node>();
        do {
            contexts.add(test());
            if (acceptKeyword("as")) {
                targets.add(expr());
            }
        } while (accept(","));
        return new With(contexts, targets, suite(), t.line(), t.column());
    }

    private Node decorated() {
        var decorators = new ArrayList<Node>();
        while (accept("@")) {
            decorators.add(namedExprTest());
            expect(Token.Type.NEWLINE, "newline after decorator");
        }
        if (acceptKeyword("async")) {
            return functionDef(decorators);
        }
        if (peek().isKeyword("def")) {
            return functionDef(decorators);
        }
        if (peek().isKeyword("class")) {
            return classDef(decorators);
        }
        throw error(peek(), "expected 'def' or 'class' after decorator");
    }

    private Node functionDef(List<Node> decorators) {
        Token t = next();
        String name = name();
        expectOp("(");
        List<Param> params = parameters(")", true);
        expectOp(")");
        Node returns = accept("->") ? test() : null;
        return new FunctionDef(name, params, returns, decorators, suite(), t.line(), t.column());
    }

    private Node classDef(List<Node> decorators) {
        Token t = next();
        String name = name();
        var bases = new ArrayList<Node>();
        if (accept("(")) {
            if (!peek().isOp(")")) {
                var keywords = new ArrayList<KeywordArg>();
                arguments(bases, keywords);
                for (KeywordArg k : keywords) {
                    bases.add(k.value());
                }
            }
            expectOp(")");
        }
        return new ClassDef(name, bases, decorators, suite(), t.line(), t.column());
    }

    private List<Param> parameters(String closer, boolean annotations) {
        var params = new ArrayList<Param>();
        while (!peek().isOp(closer)) {
            if (accept("/")) {
                if (!accept(",")) {
                    break;
                }
                continue;
            }
            int stars = 0;
            if (accept("**")) {
                stars = 2;
            } else if (accept("*")) {
                stars = 1;
                if (peek().isOp(",") || peek().isOp(closer)) {
                    if (!accept(",")) {
                        break;
                    }
                    continue;
                }
            }
            String pname = name();
            Node annotation = annotations && accept(":") ? test() : null;
            Node defaultValue = accept("=") ? test() : null;
            params.add(new Param(pname, annotation, defaultValue, stars));
            if (!accept(",")) {
                break;
            }
        }
        return params;
    }

    private List<Node> suite() {
        expectOp(":");
        if (peek().type() != Token.Type.NEWLINE) {
            var body = new ArrayList<Node>();
            simpleStatements(body);
            return body;
        }
        next();
        Token indent = peek();
        if (indent.type() != Token.Type.INDENT) {
            throw error(indent, "expected an indented block");
        }
        next();
        enter(indent);
        var body = new ArrayList<Node>();
        while (peek().type() != Token.Type.DEDENT && peek().type() != Token.Type.EOF) {
            statement(body);
            skipNewlines();
        }
        accept(Token.Type.DEDENT);
        nesting--;
        return body;
    }

    // ── Expressions ────────────────────────────────────────────────────

    private Node testListStarExpr() {
        Token start = peek();
        Node first = starOrTest();
        if (!peek().isOp(",")) {
            return first;
        }
        var elements = new ArrayList<Node>();
        elements.add(first);
        while (accept(",")) {
            if (atExpressionEnd()) {
                break;
            }
            elements.add(starOrTest());
        }
        return new Sequence(SequenceKind.TUPLE, elements, start.line(), start.column());
    }

    private Node targetList() {
        Token start = peek();
        Node first = starOrExpr();
        if (!peek().isOp(",")) {
            return first;
        }
        var elements = new ArrayList<Node>();
        elements.add(first);
        while (accept(",")) {
            if (peek().isKeyword("in") || peek().isOp("=")) {
                break;
            }
            elements.add(starOrExpr());
        }
        return new Sequence(SequenceKind.TUPLE, elements, start.line(), start.column());
    }

    private List<Node> exprList() {
        var out = new ArrayList<Node>();
        do {
            if (atStatementEnd()) {
                break;
            }
            out.add(starOrExpr());
        } while (accept(","));
        return out;
    }

    private Node starOrTest() {
        Token t = peek();
        if (accept("*")) {
            return new Starred(expr(), t.line(), t.column());
        }
        return namedExprTest();
    }

    private Node starOrExpr() {
        Token t = peek();
        if (accept("*")) {
            return new Starred(expr(), t.line(), t.column());
        }
        return expr();
    }

    private Node namedExprTest() {
        Token t = peek();
        Node value = test();
        if (accept(":=")) {
            if (!(value instanceof Name)) {
                throw error(t, "cannot use assignment expression with this target");
            }
            return new NamedExpr(value, test(), t.line(), t.column());
        }
        return value;
    }

    private Node test() {
        Token t = peek();
        enter(t);
        try {
            if (t.isKeyword("lambda")) {
                next();
                List<Param> params = parameters(":", false);
                expectOp(":");
                return new Lambda(params, test(), t.line(), t.column());
            }
            Node body = orTest();
            if (acceptKeyword("if")) {
                Node cond = orTest();
                expectKeyword("else");
                Node orElse = test();
                return new IfExp(cond, body, orElse, t.line(), t.column());
            }
            return body;
        } finally {
            nesting--;
        }
    }

    private Node orTest() {
        Token t = peek();
        Node left = andTest();
        if (!peek().isKeyword("or")) {
            return left;
        }
        var values = new ArrayList<Node>();
        values.add(left);
        while (acceptKeyword("or")) {
            values.add(andTest());
        }
        return new BoolOp("or", values, t.line(), t.column());
    }

    private Node andTest() {
        Token t = peek();
        Node left = notTest();
        if (!peek().isKeyword("and")) {
            return left;
        }
        var values = new ArrayList<Node>();
        values.add(left);
        while (acceptKeyword("and")) {
            values.add(notTest());
        }
        return new BoolOp("and", values, t.line(), t.column());
    }

    private Node notTest() {
        Token t = peek();
        if (acceptKeyword("not")) {
            enter(t);
            try {
                return new UnaryOp("not", notTest(), t.line(), t.column());
            } finally {
                nesting--;
            }
        }
        return comparison();
    }

    private Node comparison() {
        Token t = peek();
        Node left = expr();
        var ops = new ArrayList<String>();
        var rights = new ArrayList<Node>();
        while (true) {
            Token op = peek();
            String symbol = null;
            if (op.type() == Token.Type.OP && Set.of("<", ">", "==", ">=", "<=", "!=").contains(op.text())) {
                next();
                symbol = op.text();
            } else if (op.isKeyword("in")) {
                next();
                symbol = "in";
            } else if (op.isKeyword("not") && peekAt(1).isKeyword("in")) {
                next();
                next();
                symbol = "not in";
            } else if (op.isKeyword("is")) {
                next();
                symbol = acceptKeyword("not") ? "is not" : "is";
            }
            if (symbol == null) {
                break;
            }
            ops.add(symbol);
            rights.add(expr());
        }
        return ops.isEmpty() ? left : new Compare(left, ops, rights, t.line(), t.column());
    }

    private Node expr() {
        return binary(0);
    }

    private static final List<Set<String>> BINARY_LEVELS = List.of(
            Set.of("|"),
            Set.of("^"),
            Set.of("&"),
            Set.of("<<", ">>"),
            Set.of("+", "-"),
            Set.of("*", "/", "//", "%", "@"));

    private Node binary(int level) {
        if (level == BINARY_LEVELS.size()) {
            return factor();
        }
        Node left = binary(level + 1);
        while (peek().type() == Token.Type.OP && BINARY_LEVELS.get(level).contains(peek().text())) {
            Token op = next();
            Node right = binary(level + 1);
            left = new BinOp(left, op.text(), right, op.line(), op.column());
        }
        return left;
    }

    private Node factor() {
        Token t = peek();
        if (t.isOp("+") || t.isOp("-") || t.isOp("~")) {
            next();
            enter(t);
            try {
                return new UnaryOp(t.text(), factor(), t.line(), t.column());
            } finally {
                nesting--;
            }
        }
        return power();
    }

    private Node power() {
        Token t = peek();
        Node base;
        if (acceptKeyword("await")) {
            base = new UnaryOp("await", primary(), t.line(), t.column());
        } else {
            base = primary();
        }
        if (peek().isOp("**")) {
            Token op = next();
            return new BinOp(base, "**", factor(), op.line(), op.column());
        }
        return base;
    }

    private Node primary() {
        Node node = atom();
        while (true) {
            Token t = peek();
            if (t.isOp("(")) {
                next();
                var args = new ArrayList<Node>();
                var keywords = new ArrayList<KeywordArg>();
                if (!peek().isOp(")")) {
                    arguments(args, keywords);
                }
                expectOp(")");
                node = new Call(node, args, keywords, node.line(), node.column());
            } else if (t.isOp("[")) {
                next();
                Node index = subscriptList();
                expectOp("]");
                node = new Subscript(node, index, node.line(), node.column());
            } else if (t.isOp(".")) {
                next();
                node = new Attribute(node, name(), node.line(), node.column());
            } else {
                return node;
            }
        }
    }

    private void arguments(List<Node> args, List<KeywordArg> keywords) {
        do {
            if (peek().isOp(")")) {
                break;
            }
            Token t = peek();
            if (accept("**")) {
                keywords.add(new KeywordArg(null, test()));
            } else if (accept("*")) {
                args.add(new Starred(test(), t.line(), t.column()));
            } else if (t.type() == Token.Type.NAME && peekAt(1).isOp("=")) {
                String key = name();
                next();
                keywords.add(new KeywordArg(key, test()));
            } else {
                Node value = namedExprTest();
                if (peek().isKeyword("for") || peek().isKeyword("async")) {
                    value = comprehension(ComprehensionKind.GENERATOR, value, null, t);
                }
                args.add(value);
            }
        } while (accept(","));
    }

    private Node subscriptList() {
        Token start = peek();
        Node first = subscript();
        if (!peek().isOp(",")) {
            return first;
        }
        var elements = new ArrayList<Node>();
        elements.add(first);
        while (accept(",")) {
            if (peek().isOp("]")) {
                break;
            }
            elements.add(subscript());
        }
        return new Sequence(SequenceKind.TUPLE, elements, start.line(), start.column());
    }

    private Node subscript() {
        Token t = peek();
        Node lower = null;
        if (!peek().isOp(":")) {
            lower = starOrTest();
            if (!peek().isOp(":")) {
                return lower;
            }
        }
        expectOp(":");
        Node upper = peek().isOp(":") || peek().isOp("]") || peek().isOp(",") ? null : test();
        Node step = null;
        if (accept(":")) {
            step = peek().isOp("]") || peek().isOp(",") ? null : test();
        }
        return new Slice(lower, upper, step, t.line(), t.column());
    }

    private Node atom() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER -> {
                next();
                return new Literal(LiteralKind.NUMBER, t.text(), t.line(), t.column());
            }
            case STRING, BYTES -> {
                var sb = new StringBuilder();
                LiteralKind kind = t.type() == Token.Type.BYTES ? LiteralKind.BYTES : LiteralKind.STRING;
                while (peek().type() == Token.Type.STRING || peek().type() == Token.Type.BYTES) {
                    sb.append(next().text());
                }
                return new Literal(kind, sb.toString(), t.line(), t.column());
            }
            case NAME -> {
                switch (t.text()) {
                    case "None" -> { next(); return new Literal(LiteralKind.NONE, "None", t.line(), t.column()); }
                    case "True", "False" -> { next(); return new Literal(LiteralKind.BOOLEAN, t.text(), t.line(), t.column()); }
                    case "yield" -> { return yieldExpr(); }
                    default -> { }
                }
                if (RESERVED.contains(t.text())) {
                    throw error(t, "unexpected keyword '" + t.text() + "'");
                }
                next();
                return new Name(t.text(), t.line(), t.column());
            }
            case OP -> {
                switch (t.text()) {
                    case "(" -> { return parenthesized(); }
                    case "[" -> { return listDisplay(); }
                    case "{" -> { return braceDisplay(); }
                    case "..." -> { next(); return new Literal(LiteralKind.ELLIPSIS, "...", t.line(), t.column()); }
                    default -> throw error(t, "unexpected '" + t.text() + "'");
                }
            }
            default -> throw error(t, t.type() == Token.Type.EOF ? "unexpected end of input" : "invalid syntax");
        }
    }

    private Node yieldExpr() {
        Token t = next();
        if (acceptKeyword("from")) {
            return new Yield(test(), true, t.line(), t.column());
        }
        Node value = atExpressionEnd() ? null : testListStarExpr();
        return new Yield(value, false, t.line(), t.column());
    }

    private Node parenthesized() {
        Token open = next();
        enter(open);
        try {
            if (accept(")")) {
                return new Sequence(SequenceKind.TUPLE, List.of(), open.line(), open.column());
            }
            if (peek().isKeyword("yield")) {
                Node y = yieldExpr();
                expectOp(")");
                return y;
            }
            Node first = starOrTest();
            if (peek().isKeyword("for") || peek().isKeyword("async")) {
                Node gen = comprehension(ComprehensionKind.GENERATOR, first, null, open);
                expectOp(")");
                return gen;
            }
            if (accept(")")) {
                return first;
            }
            var elements = new ArrayList<Node>();
            elements.add(first);
            while (accept(",")) {
                if (peek().isOp(")")) {
                    break;
                }
                elements.add(starOrTest());
            }
            expectOp(")");
            return new Sequence(SequenceKind.TUPLE, elements, open.line(), open.column());
        } finally {
            nesting--;
        }
    }

    private Node listDisplay() {
        Token open = next();
        enter(open);
        try {
            var elements = new ArrayList<Node>();
            if (accept("]")) {
                return new Sequence(SequenceKind.LIST, elements, open.line(), open.column());
            }
            Node first = starOrTest();
            if (peek().isKeyword("for") || peek().isKeyword("async")) {
                Node comp = comprehension(ComprehensionKind.LIST, first, null, open);
                expectOp("]");
                return comp;
            }
            elements.add(first);
            while (accept(",")) {
                if (peek().isOp("]")) {
                    break;
                }
                elements.add(starOrTest());
            }
            expectOp("]");
            return new Sequence(SequenceKind.LIST, elements, open.line(), open.column());
        } finally {
            nesting--;
        }
    }

    private Node braceDisplay() {
        Token open = next();
        enter(open);
        try {
            if (accept("}")) {
                return new Dict(List.of(), List.of(), open.line(), open.column());
            }
            var keys = new ArrayList<Node>();
            var values = new ArrayList<Node>();
            if (accept("**")) {
                keys.add(null);
                values.add(expr());
            } else {
                Node first = starOrTest();
                if (accept(":")) {
                    Node value = test();
                    if (peek().isKeyword("for") || peek().isKeyword("async")) {
                        Node comp = comprehension(ComprehensionKind.DICT, first, value, open);
                        expectOp("}");
                        return comp;
                    }
                    keys.add(first);
                    values.add(value);
                } else {
                    if (peek().isKeyword("for") || peek().isKeyword("async")) {
                        Node comp = comprehension(ComprehensionKind.SET, first, null, open);
                        expectOp("}");
                        return comp;
                    }
                    var elements = new ArrayList<Node>();
                    elements.add(first);
                    while (accept(",")) {
                        if (peek().isOp("}")) {
                            break;
                        }
                        elements.add(starOrTest());
                    }
                    expectOp("}");
                    return new Sequence(SequenceKind.SET, elements, open.line(), open.column());
                }
            }
            while (accept(",")) {
                if (peek().isOp("}")) {
                    break;
                }
                if (accept("**")) {
                    keys.add(null);
                    values.add(expr());
                } else {
                    keys.add(test());
                    expectOp(":");
                    values.add(test());
                }
            }
            expectOp("}");
            return new Dict(keys, values, open.line(), open.column());
        } finally {
            nesting--;
        }
    }

    private Node comprehension(ComprehensionKind kind, Node element, Node value, Token at) {
        var clauses = new ArrayList<ComprehensionClause>();
        while (true) {
            acceptKeyword("async");
            if (!acceptKeyword("for")) {
                break;
            }
            Node target = targetList();
            expectKeyword("in");
            Node iter = orTest();
            var conditions = new ArrayList<Node>();
            while (peek().isKeyword("if")) {
                next();
                conditions.add(orTest());
            }
            clauses.add(new ComprehensionClause(target, iter, conditions));
        }
        return new Comprehension(kind, element, value, clauses, at.line(), at.column());
    }

    // ── Token helpers ──────────────────────────────────────────────────

    private String dottedName() {
        var sb = new StringBuilder(name());
        while (peek().isOp(".")) {
            next();
            sb.append('.').append(name());
        }
        return sb.toString();
    }

    private String name() {
        Token t = peek();
        if (t.type() != Token.Type.NAME || RESERVED.contains(t.text())) {
            throw error(t, "expected a name");
        }
        next();
        return t.text();
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.type() == Token.Type.NEWLINE || t.type() == Token.Type.EOF || t.isOp(";");
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        return atStatementEnd() || t.isOp(")") || t.isOp("]") || t.isOp("}")
                || t.isOp("=") || t.isOp(":") || (t.type() == Token.Type.OP && AUGMENTED.contains(t.text()));
    }

    private void endOfLine() {
        Token t = peek();
        if (t.type() == Token.Type.NEWLINE) {
            next();
        } else if (t.type() != Token.Type.EOF && t.type() != Token.Type.DEDENT) {
            throw error(t, "invalid syntax");
        }
    }

    private void skipNewlines() {
        while (peek().type() == Token.Type.NEWLINE) {
            next();
        }
    }

    private void enter(Token at) {
        if (++nesting > MAX_NESTING) {
            throw error(at, "nesting exceeds " + MAX_NESTING + " levels");
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != Token.Type.EOF) {
            pos++;
        }
        return t;
    }

    private boolean accept(String op) {
        if (peek().isOp(op)) {
            next();
            return true;
        }
        return false;
    }

    private boolean accept(Token.Type type) {
        if (peek().type() == type) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            next();
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        if (!accept(op)) {
            throw error(peek(), "expected '" + op + "'");
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error(peek(), "expected '" + keyword + "'");
        }
    }

    private void expect(Token.Type type, String what) {
        if (!accept(type)) {
            throw error(peek(), "expected " + what);
        }
    }

    private static ContentParseException error(Token at, String message) {
        return new ContentParseException(message, at.line(), at.column());
    }
}
